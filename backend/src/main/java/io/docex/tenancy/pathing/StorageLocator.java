package io.docex.tenancy.pathing;

/**
 * A resolved object-storage location. The full path is computed once when the owning basket or
 * document is created and stored on its row; reads use the stored string.
 *
 * @param prefix namespace, environment and tenant segments, ending in {@code /} (may be empty)
 * @param basketSegment basket directory segment, ending in {@code /}
 * @param documentSegment leaf segment, or {@code null} for a basket-level locator
 */
public record StorageLocator(String prefix, String basketSegment, String documentSegment) {

  public StorageLocator {
    if (prefix == null) {
      prefix = "";
    }
    if (basketSegment == null || basketSegment.isBlank()) {
      throw new IllegalArgumentException("basketSegment must not be blank");
    }
  }

  public String basketPath() {
    return prefix + basketSegment;
  }

  public String fullPath() {
    return documentSegment == null ? basketPath() : basketPath() + documentSegment;
  }
}
