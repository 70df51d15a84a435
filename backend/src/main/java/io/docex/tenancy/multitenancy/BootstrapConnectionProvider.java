package io.docex.tenancy.multitenancy;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.provisioning.IsolationBoundaryManagers;
import io.docex.tenancy.provisioning.TenantBoundary;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/**
 * Lazily opened pool on the bootstrap boundary, where the tenant registry lives. The pool is only
 * opened once the boundary exists, and opening it never creates the boundary.
 */
@Component
public class BootstrapConnectionProvider {

  private static final Logger log = LoggerFactory.getLogger(BootstrapConnectionProvider.class);
  static final String POOL_NAME = "docex-bootstrap";

  private final IsolationBoundaryManagers managers;
  private volatile HikariDataSource dataSource;
  private volatile JdbcClient jdbc;

  public BootstrapConnectionProvider(IsolationBoundaryManagers managers) {
    this.managers = managers;
  }

  public TenantBoundary boundary() {
    return managers.bootstrapBoundary();
  }

  public JdbcClient jdbc() {
    var current = jdbc;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (jdbc == null) {
        var boundary = boundary();
        dataSource = managers.forStrategy(boundary.strategy()).openDataSource(boundary, POOL_NAME);
        jdbc = JdbcClient.create(dataSource);
        log.debug("Opened bootstrap pool on {}", boundary.location());
      }
      return jdbc;
    }
  }

  @PreDestroy
  public synchronized void close() {
    if (dataSource != null) {
      dataSource.close();
      dataSource = null;
      jdbc = null;
    }
  }
}
