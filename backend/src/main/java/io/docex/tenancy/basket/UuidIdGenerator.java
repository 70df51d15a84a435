package io.docex.tenancy.basket;

import java.util.UUID;
import org.springframework.stereotype.Component;

/** {@code bas_} or {@code doc_} followed by 32 hex digits of a random UUID. */
@Component
public class UuidIdGenerator implements IdGenerator {

  @Override
  public String newBasketId() {
    return BASKET_PREFIX + randomHex();
  }

  @Override
  public String newDocumentId() {
    return DOCUMENT_PREFIX + randomHex();
  }

  private static String randomHex() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
