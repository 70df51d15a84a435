package io.docex.tenancy.multitenancy;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.exception.InvalidStateException;
import io.docex.tenancy.exception.ResourceExhaustedException;
import io.docex.tenancy.provisioning.TenantBoundary;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * A tenant's pooled connections. Owned by {@link ConnectionRouter}; sessions borrow it while bound
 * and record that with a logical claim.
 */
public class ConnectionHandle {

  private final String tenantId;
  private final TenantBoundary boundary;
  private final HikariDataSource dataSource;
  private final JdbcClient jdbc;
  private final Duration connectionTimeout;
  private final Instant createdAt;
  private final AtomicInteger claims = new AtomicInteger();
  private volatile Instant lastUsedAt;
  private volatile boolean closed;

  ConnectionHandle(
      String tenantId,
      TenantBoundary boundary,
      HikariDataSource dataSource,
      Duration connectionTimeout) {
    this.tenantId = tenantId;
    this.boundary = boundary;
    this.dataSource = dataSource;
    this.jdbc = JdbcClient.create(dataSource);
    this.connectionTimeout = connectionTimeout;
    this.createdAt = Instant.now();
    this.lastUsedAt = createdAt;
  }

  /**
   * Runs JDBC work on this tenant's pool. A pool that stays exhausted for the configured
   * connection timeout surfaces as {@link ResourceExhaustedException}.
   */
  public <T> T execute(Function<JdbcClient, T> work) {
    if (closed) {
      throw new InvalidStateException(
          "Connection closed", "Connection for tenant '" + tenantId + "' has been closed");
    }
    lastUsedAt = Instant.now();
    try {
      return work.apply(jdbc);
    } catch (CannotGetJdbcConnectionException e) {
      if (isPoolTimeout(e)) {
        throw new ResourceExhaustedException(tenantId, connectionTimeout, e);
      }
      throw e;
    }
  }

  void claim() {
    claims.incrementAndGet();
  }

  void release() {
    claims.updateAndGet(current -> Math.max(0, current - 1));
  }

  void close() {
    closed = true;
    dataSource.close();
  }

  public String tenantId() {
    return tenantId;
  }

  public TenantBoundary boundary() {
    return boundary;
  }

  public HikariDataSource dataSource() {
    return dataSource;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant lastUsedAt() {
    return lastUsedAt;
  }

  public int claims() {
    return claims.get();
  }

  public boolean isClosed() {
    return closed;
  }

  private static boolean isPoolTimeout(Throwable e) {
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLTransientConnectionException) {
        return true;
      }
    }
    return false;
  }
}
