package io.docex.tenancy.basket;

import java.time.Instant;

public record Document(
    String id,
    String basketId,
    String tenantId,
    String name,
    String extension,
    String storagePath,
    String createdBy,
    Instant createdAt) {

  public String fileName() {
    return extension == null || extension.isBlank() ? name : name + "." + extension;
  }
}
