package io.docex.tenancy.provisioning;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.multitenancy.IsolationStrategy;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Looks up the boundary manager for a strategy and decides the strategy for new boundaries. */
@Component
public class IsolationBoundaryManagers {

  private static final Logger log = LoggerFactory.getLogger(IsolationBoundaryManagers.class);

  private final Map<IsolationStrategy, IsolationBoundaryManager> managers =
      new EnumMap<>(IsolationStrategy.class);
  private final HikariDataSource adminDataSource;
  private final MultiTenancyProperties properties;
  private volatile Boolean adminSupportsSchemas;

  public IsolationBoundaryManagers(
      List<IsolationBoundaryManager> managers,
      @Qualifier("adminDataSource") HikariDataSource adminDataSource,
      MultiTenancyProperties properties) {
    for (var manager : managers) {
      this.managers.put(manager.strategy(), manager);
    }
    this.adminDataSource = adminDataSource;
    this.properties = properties;
  }

  public IsolationBoundaryManager forStrategy(IsolationStrategy strategy) {
    var manager = managers.get(strategy);
    if (manager == null) {
      throw new IllegalStateException("No boundary manager registered for " + strategy);
    }
    return manager;
  }

  /**
   * Strategy for a tenant provisioned without an explicit choice: the configured one, otherwise
   * {@code SCHEMA} when the admin database has schemas, otherwise {@code DATABASE}.
   */
  public IsolationStrategy defaultStrategy() {
    if (properties.isolationStrategy() != null) {
      return properties.isolationStrategy();
    }
    return adminSupportsSchemas() ? IsolationStrategy.SCHEMA : IsolationStrategy.DATABASE;
  }

  /**
   * The bootstrap tenant lives in its own schema, or in its own database file when tenants are
   * file-based. Row-level deployments keep it in a schema separate from the shared one.
   */
  public TenantBoundary bootstrapBoundary() {
    var bootstrap = properties.bootstrapTenant();
    if (defaultStrategy() == IsolationStrategy.DATABASE) {
      return new TenantBoundary(
          bootstrap.id(), IsolationStrategy.DATABASE, null, Path.of(bootstrap.databasePath()));
    }
    return new TenantBoundary(bootstrap.id(), IsolationStrategy.SCHEMA, bootstrap.schema(), null);
  }

  boolean adminSupportsSchemas() {
    Boolean supported = adminSupportsSchemas;
    if (supported == null) {
      try (var conn = adminDataSource.getConnection()) {
        supported = conn.getMetaData().supportsSchemasInDataManipulation();
      } catch (SQLException e) {
        log.warn("Could not read admin database capabilities, assuming no schema support", e);
        return false;
      }
      adminSupportsSchemas = supported;
      log.debug("Admin database supports schemas: {}", supported);
    }
    return supported;
  }
}
