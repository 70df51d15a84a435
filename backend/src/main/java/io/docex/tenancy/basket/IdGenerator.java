package io.docex.tenancy.basket;

public interface IdGenerator {

  String BASKET_PREFIX = "bas_";
  String DOCUMENT_PREFIX = "doc_";

  String newBasketId();

  String newDocumentId();
}
