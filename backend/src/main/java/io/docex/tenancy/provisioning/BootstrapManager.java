package io.docex.tenancy.provisioning;

import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.exception.TenantExistsException;
import io.docex.tenancy.multitenancy.TenantRecord;
import io.docex.tenancy.multitenancy.TenantRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates the reserved bootstrap boundary, its tables and the system tenant row. Runs once per
 * deployment; later calls find the system row and return it untouched.
 */
@Service
public class BootstrapManager {

  private static final Logger log = LoggerFactory.getLogger(BootstrapManager.class);
  static final String SYSTEM_DISPLAY_NAME = "DocEx System";
  static final String REGISTRY_TABLE = "tenant_registry";

  private final IsolationBoundaryManagers managers;
  private final TenantRegistry registry;
  private final MultiTenancyProperties properties;

  public BootstrapManager(
      IsolationBoundaryManagers managers,
      TenantRegistry registry,
      MultiTenancyProperties properties) {
    this.managers = managers;
    this.registry = registry;
    this.properties = properties;
  }

  public synchronized TenantRecord initialize(String createdBy) {
    if (isInitialized()) {
      var existing = registry.findSystemTenant();
      if (existing.isPresent()) {
        log.info("Bootstrap tenant {} already initialized", existing.get().tenantId());
        return existing.get();
      }
    }

    var boundary = managers.bootstrapBoundary();
    var manager = managers.forStrategy(boundary.strategy());
    log.info(
        "Initializing bootstrap tenant {} ({} at {})",
        boundary.tenantId(),
        boundary.strategy(),
        boundary.location());

    try {
      // Each step is idempotent, a failed run converges when repeated
      manager.createIfAbsent(boundary);
      manager.migrate(boundary, true);
      var record =
          TenantRecord.create(
              boundary.tenantId(),
              SYSTEM_DISPLAY_NAME,
              true,
              boundary.strategy(),
              boundary.schemaName(),
              boundary.databasePath() == null ? null : boundary.databasePath().toString(),
              createdBy);
      registry.insert(record);
      log.info("Bootstrap tenant {} initialized", record.tenantId());
      return record;
    } catch (TenantExistsException e) {
      // Another process inserted the system row first
      return registry
          .findSystemTenant()
          .orElseThrow(() -> new ProvisioningException("System tenant row vanished", e));
    } catch (ProvisioningException e) {
      log.error("Bootstrap initialization failed", e);
      throw e;
    } catch (RuntimeException e) {
      log.error("Bootstrap initialization failed", e);
      throw new ProvisioningException(
          "Failed to initialize bootstrap tenant " + properties.bootstrapTenant().id(), e);
    }
  }

  /** Existence checks only; never creates a schema, file, table or row. */
  public boolean isInitialized() {
    try {
      var boundary = managers.bootstrapBoundary();
      var manager = managers.forStrategy(boundary.strategy());
      if (!manager.exists(boundary)) {
        return false;
      }
      if (!manager.tableExists(boundary, REGISTRY_TABLE)) {
        return false;
      }
      return registry.findSystemTenant().isPresent();
    } catch (RuntimeException e) {
      log.debug("Bootstrap check failed, reporting not initialized: {}", e.getMessage());
      return false;
    }
  }

  public Optional<TenantRecord> getBootstrapTenant() {
    return isInitialized() ? registry.findSystemTenant() : Optional.empty();
  }

  public String bootstrapTenantId() {
    return properties.bootstrapTenant().id();
  }
}
