package io.docex.tenancy.provisioning;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.multitenancy.IsolationStrategy;
import io.docex.tenancy.pathing.PathResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

/**
 * One embedded H2 database file per tenant. Only {@link #createIfAbsent} opens a database without
 * {@code IFEXISTS=TRUE}; every other connection fails on a missing file instead of creating it.
 */
@Component
public class DatabaseFileBoundaryManager implements IsolationBoundaryManager {

  private static final Logger log = LoggerFactory.getLogger(DatabaseFileBoundaryManager.class);

  static final String USERNAME = "sa";
  static final String PASSWORD = "";
  static final String DATA_FILE_SUFFIX = ".mv.db";
  private static final String IF_EXISTS = ";IFEXISTS=TRUE";

  private final MultiTenancyProperties properties;
  private final PathResolver pathResolver;

  public DatabaseFileBoundaryManager(MultiTenancyProperties properties, PathResolver pathResolver) {
    this.properties = properties;
    this.pathResolver = pathResolver;
  }

  @Override
  public IsolationStrategy strategy() {
    return IsolationStrategy.DATABASE;
  }

  @Override
  public TenantBoundary resolve(String tenantId) {
    return new TenantBoundary(
        tenantId, IsolationStrategy.DATABASE, null, pathResolver.resolveDatabasePath(tenantId));
  }

  @Override
  public boolean exists(TenantBoundary boundary) {
    return Files.isRegularFile(dataFile(boundary.databasePath()));
  }

  @Override
  public boolean tableExists(TenantBoundary boundary, String tableName) {
    if (!exists(boundary)) {
      return false;
    }
    Long count =
        JdbcClient.create(existingDatabase(boundary))
            .sql("SELECT COUNT(*) FROM information_schema.tables WHERE LOWER(table_name) = ?")
            .param(tableName.toLowerCase(Locale.ROOT))
            .query(Long.class)
            .single();
    return count > 0;
  }

  @Override
  public void createIfAbsent(TenantBoundary boundary) {
    Path databasePath = boundary.databasePath();
    try {
      Path parent = databasePath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      throw new ProvisioningException("Failed to create directory for " + databasePath, e);
    }
    if (exists(boundary)) {
      log.debug("Database file for tenant {} already exists", boundary.tenantId());
      return;
    }
    var creating = new DriverManagerDataSource(url(boundary), USERNAME, PASSWORD);
    try (Connection conn = creating.getConnection()) {
      log.info("Created database {} for tenant {}", databasePath, boundary.tenantId());
    } catch (SQLException e) {
      throw new ProvisioningException("Failed to create database " + databasePath, e);
    }
  }

  @Override
  public void migrate(TenantBoundary boundary, boolean includeRegistry) {
    var result =
        Flyway.configure()
            .dataSource(url(boundary) + IF_EXISTS, USERNAME, PASSWORD)
            .locations(IsolationBoundaryManager.migrationLocations(includeRegistry))
            .baselineOnMigrate(true)
            .outOfOrder(includeRegistry)
            .load()
            .migrate();
    log.info(
        "Migrated database {}: {} migrations applied",
        boundary.databasePath(),
        result.migrationsExecuted);
  }

  @Override
  public HikariDataSource openDataSource(TenantBoundary boundary, String poolName) {
    return TenantPoolFactory.newPool(
        poolName, url(boundary) + IF_EXISTS, USERNAME, PASSWORD, null, properties.pool());
  }

  static Path dataFile(Path databasePath) {
    return databasePath.resolveSibling(databasePath.getFileName() + DATA_FILE_SUFFIX);
  }

  private DriverManagerDataSource existingDatabase(TenantBoundary boundary) {
    return new DriverManagerDataSource(url(boundary) + IF_EXISTS, USERNAME, PASSWORD);
  }

  private String url(TenantBoundary boundary) {
    return pathResolver.resolveDatabaseUrl(boundary.databasePath());
  }
}
