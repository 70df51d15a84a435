package io.docex.tenancy.multitenancy;

import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.exception.TenantExistsException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * The {@code tenant_registry} table in the bootstrap boundary; the only source of truth for
 * whether a tenant exists. Nothing here is cached: a stale "absent" answer right after another
 * process provisioned the tenant would let a duplicate creation through.
 */
@Repository
public class TenantRegistry {

  private static final RowMapper<TenantRecord> ROW_MAPPER = TenantRegistry::mapRow;

  private final BootstrapConnectionProvider bootstrap;
  private final String systemTenantId;

  public TenantRegistry(BootstrapConnectionProvider bootstrap, MultiTenancyProperties properties) {
    this.bootstrap = bootstrap;
    this.systemTenantId = properties.bootstrapTenant().id();
  }

  public boolean exists(String tenantId) {
    Long count =
        bootstrap
            .jdbc()
            .sql("SELECT COUNT(*) FROM tenant_registry WHERE tenant_id = :tenantId")
            .param("tenantId", tenantId)
            .query(Long.class)
            .single();
    return count > 0;
  }

  public Optional<TenantRecord> find(String tenantId) {
    return bootstrap
        .jdbc()
        .sql("SELECT * FROM tenant_registry WHERE tenant_id = :tenantId")
        .param("tenantId", tenantId)
        .query(ROW_MAPPER)
        .optional();
  }

  public List<TenantRecord> findAll() {
    return bootstrap
        .jdbc()
        .sql("SELECT * FROM tenant_registry ORDER BY created_at, tenant_id")
        .query(ROW_MAPPER)
        .list();
  }

  public long countBusinessTenants() {
    return bootstrap
        .jdbc()
        .sql("SELECT COUNT(*) FROM tenant_registry WHERE is_system = FALSE")
        .query(Long.class)
        .single();
  }

  public Optional<TenantRecord> findSystemTenant() {
    return bootstrap
        .jdbc()
        .sql("SELECT * FROM tenant_registry WHERE is_system = TRUE AND tenant_id = :tenantId")
        .param("tenantId", systemTenantId)
        .query(ROW_MAPPER)
        .optional();
  }

  public TenantRecord insert(TenantRecord record) {
    try {
      bootstrap
          .jdbc()
          .sql(
              """
              INSERT INTO tenant_registry (tenant_id, display_name, is_system, isolation_strategy,
                  schema_name, database_path, status, created_by, created_at, last_updated_at,
                  last_updated_by)
              VALUES (:tenantId, :displayName, :system, :isolationStrategy, :schemaName,
                  :databasePath, :status, :createdBy, :createdAt, :lastUpdatedAt, :lastUpdatedBy)
              """)
          .param("tenantId", record.tenantId())
          .param("displayName", record.displayName())
          .param("system", record.system())
          .param("isolationStrategy", record.isolationStrategy().name())
          .param("schemaName", record.schemaName())
          .param("databasePath", record.databasePath())
          .param("status", record.status().name())
          .param("createdBy", record.createdBy())
          .param("createdAt", Timestamp.from(record.createdAt()))
          .param("lastUpdatedAt", Timestamp.from(record.lastUpdatedAt()))
          .param("lastUpdatedBy", record.lastUpdatedBy())
          .update();
    } catch (DuplicateKeyException e) {
      throw new TenantExistsException(record.tenantId(), e);
    }
    return record;
  }

  /** Returns {@code false} when no such tenant is registered. */
  public boolean updateStatus(String tenantId, TenantStatus status, String updatedBy) {
    int updated =
        bootstrap
            .jdbc()
            .sql(
                """
                UPDATE tenant_registry
                SET status = :status, last_updated_at = :now, last_updated_by = :updatedBy
                WHERE tenant_id = :tenantId
                """)
            .param("status", status.name())
            .param("now", Timestamp.from(Instant.now()))
            .param("updatedBy", updatedBy)
            .param("tenantId", tenantId)
            .update();
    return updated > 0;
  }

  private static TenantRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TenantRecord(
        rs.getString("tenant_id"),
        rs.getString("display_name"),
        rs.getBoolean("is_system"),
        IsolationStrategy.valueOf(rs.getString("isolation_strategy")),
        rs.getString("schema_name"),
        rs.getString("database_path"),
        TenantStatus.valueOf(rs.getString("status")),
        rs.getString("created_by"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_updated_at")),
        rs.getString("last_updated_by"));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
