package io.docex.tenancy.basket;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import org.junit.jupiter.api.Test;

class UuidIdGeneratorTest {

  private final UuidIdGenerator generator = new UuidIdGenerator();

  @Test
  void idsCarryTypePrefixAndHexBody() {
    assertThat(generator.newBasketId()).matches("bas_[0-9a-f]{32}");
    assertThat(generator.newDocumentId()).matches("doc_[0-9a-f]{32}");
  }

  @Test
  void idsAreUnique() {
    var ids = new HashSet<String>();
    for (int i = 0; i < 1_000; i++) {
      ids.add(generator.newBasketId());
    }
    assertThat(ids).hasSize(1_000);
  }
}
