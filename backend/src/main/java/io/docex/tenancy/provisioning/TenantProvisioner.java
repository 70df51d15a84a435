package io.docex.tenancy.provisioning;

import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.exception.InvalidStateException;
import io.docex.tenancy.exception.InvalidTenantIdException;
import io.docex.tenancy.exception.TenantExistsException;
import io.docex.tenancy.exception.TenantNotFoundException;
import io.docex.tenancy.multitenancy.IsolationStrategy;
import io.docex.tenancy.multitenancy.TenantLocks;
import io.docex.tenancy.multitenancy.TenantRecord;
import io.docex.tenancy.multitenancy.TenantRegistry;
import io.docex.tenancy.multitenancy.TenantStatus;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates business tenants: validates the id, creates and migrates the isolation boundary, then
 * registers the tenant.
 *
 * <p>There is no transaction spanning the boundary and the registry row. The boundary steps are
 * idempotent and the row is written last, so a call that failed part-way can be repeated verbatim
 * and converges. Nothing is rolled back.
 */
@Service
public class TenantProvisioner {

  private static final Logger log = LoggerFactory.getLogger(TenantProvisioner.class);

  static final Pattern TENANT_ID_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_]*$");
  static final Pattern RESERVED_PATTERN = Pattern.compile("^_docex_.*_$");
  static final int MAX_TENANT_ID_LENGTH = 56;

  private final TenantRegistry registry;
  private final IsolationBoundaryManagers managers;
  private final BootstrapManager bootstrapManager;
  private final MultiTenancyProperties properties;
  private final TenantLocks provisioningLocks = new TenantLocks();

  public TenantProvisioner(
      TenantRegistry registry,
      IsolationBoundaryManagers managers,
      BootstrapManager bootstrapManager,
      MultiTenancyProperties properties) {
    this.registry = registry;
    this.managers = managers;
    this.bootstrapManager = bootstrapManager;
    this.properties = properties;
  }

  public TenantRecord create(String tenantId, String displayName, String createdBy) {
    return create(tenantId, displayName, createdBy, null);
  }

  public TenantRecord create(
      String tenantId,
      String displayName,
      String createdBy,
      IsolationStrategy isolationStrategy) {
    validateTenantId(tenantId);
    if (!bootstrapManager.isInitialized()) {
      throw new InvalidStateException(
          "Bootstrap not initialized",
          "Initialize the bootstrap tenant before provisioning tenant '" + tenantId + "'");
    }

    var lock = provisioningLocks.forTenant(tenantId);
    lock.lock();
    try {
      if (registry.exists(tenantId)) {
        throw new TenantExistsException(tenantId);
      }

      var strategy = isolationStrategy != null ? isolationStrategy : managers.defaultStrategy();
      var manager = managers.forStrategy(strategy);
      var boundary = manager.resolve(tenantId);
      log.info(
          "Provisioning tenant {} with {} isolation at {}",
          tenantId,
          strategy,
          boundary.location());

      try {
        manager.createIfAbsent(boundary);
        manager.migrate(boundary, false);
      } catch (ProvisioningException e) {
        log.error("Failed to create boundary for tenant {}", tenantId, e);
        throw e;
      } catch (RuntimeException e) {
        log.error("Failed to create boundary for tenant {}", tenantId, e);
        throw new ProvisioningException("Provisioning failed for tenant " + tenantId, e);
      }

      var record =
          TenantRecord.create(
              tenantId,
              displayName == null || displayName.isBlank() ? tenantId : displayName,
              false,
              strategy,
              boundary.schemaName(),
              boundary.databasePath() == null ? null : boundary.databasePath().toString(),
              createdBy);
      try {
        registry.insert(record);
      } catch (TenantExistsException e) {
        throw e;
      } catch (RuntimeException e) {
        log.error("Failed to register tenant {}", tenantId, e);
        throw new ProvisioningException("Registering tenant " + tenantId + " failed", e);
      }

      log.info("Successfully provisioned tenant {}", tenantId);
      return record;
    } finally {
      lock.unlock();
    }
  }

  /** Live registry read. */
  public boolean tenantExists(String tenantId) {
    return registry.exists(tenantId);
  }

  public Optional<TenantRecord> findTenant(String tenantId) {
    return registry.find(tenantId);
  }

  public List<TenantRecord> listTenants() {
    return registry.findAll();
  }

  public TenantRecord updateStatus(String tenantId, TenantStatus status, String updatedBy) {
    if (isSystemTenant(tenantId)) {
      throw new InvalidTenantIdException(tenantId, "The system tenant's status cannot change");
    }
    if (!registry.updateStatus(tenantId, status, updatedBy)) {
      throw new TenantNotFoundException(tenantId);
    }
    log.info("Tenant {} is now {}", tenantId, status);
    return registry.find(tenantId).orElseThrow(() -> new TenantNotFoundException(tenantId));
  }

  public void validateTenantId(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new InvalidTenantIdException(tenantId, "Tenant id must not be blank");
    }
    if (isSystemTenant(tenantId) || RESERVED_PATTERN.matcher(tenantId).matches()) {
      throw new InvalidTenantIdException(
          tenantId, "Tenant id '" + tenantId + "' is reserved for the system tenant");
    }
    if (tenantId.length() > MAX_TENANT_ID_LENGTH) {
      throw new InvalidTenantIdException(
          tenantId, "Tenant id must be at most " + MAX_TENANT_ID_LENGTH + " characters");
    }
    if (!TENANT_ID_PATTERN.matcher(tenantId).matches()) {
      throw new InvalidTenantIdException(
          tenantId,
          "Tenant id '"
              + tenantId
              + "' must start with a lower-case letter or digit and contain only lower-case"
              + " letters, digits or '_'");
    }
  }

  public boolean isSystemTenant(String tenantId) {
    return properties.bootstrapTenant().id().equals(tenantId);
  }
}
