package io.docex.tenancy.provisioning;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.multitenancy.IsolationStrategy;
import io.docex.tenancy.pathing.PathResolver;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.regex.Pattern;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/** One schema per tenant inside the shared admin database. */
@Component
public class SchemaBoundaryManager implements IsolationBoundaryManager {

  private static final Logger log = LoggerFactory.getLogger(SchemaBoundaryManager.class);
  private static final Pattern SAFE_SCHEMA = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

  protected final HikariDataSource adminDataSource;
  protected final MultiTenancyProperties properties;
  private final PathResolver pathResolver;
  private final JdbcClient adminJdbc;

  public SchemaBoundaryManager(
      @Qualifier("adminDataSource") HikariDataSource adminDataSource,
      MultiTenancyProperties properties,
      PathResolver pathResolver) {
    this.adminDataSource = adminDataSource;
    this.properties = properties;
    this.pathResolver = pathResolver;
    this.adminJdbc = JdbcClient.create(adminDataSource);
  }

  @Override
  public IsolationStrategy strategy() {
    return IsolationStrategy.SCHEMA;
  }

  @Override
  public TenantBoundary resolve(String tenantId) {
    return new TenantBoundary(
        tenantId, IsolationStrategy.SCHEMA, pathResolver.resolveSchemaName(tenantId), null);
  }

  @Override
  public boolean exists(TenantBoundary boundary) {
    Long count =
        adminJdbc
            .sql("SELECT COUNT(*) FROM information_schema.schemata WHERE LOWER(schema_name) = ?")
            .param(boundary.schemaName().toLowerCase(Locale.ROOT))
            .query(Long.class)
            .single();
    return count > 0;
  }

  @Override
  public boolean tableExists(TenantBoundary boundary, String tableName) {
    Long count =
        adminJdbc
            .sql(
                """
                SELECT COUNT(*) FROM information_schema.tables
                WHERE LOWER(table_schema) = ? AND LOWER(table_name) = ?
                """)
            .param(boundary.schemaName().toLowerCase(Locale.ROOT))
            .param(tableName.toLowerCase(Locale.ROOT))
            .query(Long.class)
            .single();
    return count > 0;
  }

  @Override
  public void createIfAbsent(TenantBoundary boundary) {
    String schemaName = validateSchemaName(boundary.schemaName());
    try (Connection conn = adminDataSource.getConnection();
        Statement stmt = conn.createStatement()) {
      // Schema name matches SAFE_SCHEMA, safe to concatenate
      stmt.execute("CREATE SCHEMA IF NOT EXISTS \"" + schemaName + "\"");
      log.info("Ensured schema {} exists for tenant {}", schemaName, boundary.tenantId());
    } catch (SQLException e) {
      throw new ProvisioningException("Failed to create schema " + schemaName, e);
    }
  }

  @Override
  public void migrate(TenantBoundary boundary, boolean includeRegistry) {
    var result =
        Flyway.configure()
            .dataSource(adminDataSource)
            .locations(IsolationBoundaryManager.migrationLocations(includeRegistry))
            .schemas(boundary.schemaName())
            .baselineOnMigrate(true)
            .outOfOrder(includeRegistry)
            .load()
            .migrate();
    log.info(
        "Migrated schema {}: {} migrations applied",
        boundary.schemaName(),
        result.migrationsExecuted);
  }

  @Override
  public HikariDataSource openDataSource(TenantBoundary boundary, String poolName) {
    return TenantPoolFactory.newPool(
        poolName,
        adminDataSource.getJdbcUrl(),
        adminDataSource.getUsername(),
        adminDataSource.getPassword(),
        validateSchemaName(boundary.schemaName()),
        properties.pool());
  }

  static String validateSchemaName(String schemaName) {
    if (schemaName == null || !SAFE_SCHEMA.matcher(schemaName).matches()) {
      throw new IllegalArgumentException("Invalid schema name: " + schemaName);
    }
    return schemaName;
  }
}
