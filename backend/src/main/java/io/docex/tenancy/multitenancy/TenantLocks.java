package io.docex.tenancy.multitenancy;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A fixed set of locks striped by tenant id. The same id always maps to the same lock, and memory
 * stays constant however many distinct ids are seen, including ids that are refused.
 */
public final class TenantLocks {

  static final int DEFAULT_STRIPES = 64;

  private final ReentrantLock[] stripes;

  public TenantLocks() {
    this(DEFAULT_STRIPES);
  }

  TenantLocks(int stripeCount) {
    if (stripeCount < 1) {
      throw new IllegalArgumentException("stripeCount must be positive");
    }
    this.stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  public ReentrantLock forTenant(String tenantId) {
    return stripes[Math.floorMod(tenantId.hashCode(), stripes.length)];
  }

  int stripeCount() {
    return stripes.length;
  }
}
