package io.docex.tenancy.basket;

import java.time.Instant;

/** A named document container. {@code storagePath} is resolved once at creation. */
public record Basket(
    String id,
    String tenantId,
    String name,
    String description,
    String storagePath,
    String createdBy,
    Instant createdAt) {}
