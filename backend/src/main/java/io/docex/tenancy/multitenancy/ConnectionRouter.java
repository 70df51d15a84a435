package io.docex.tenancy.multitenancy;

import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.config.MultiTenancyProperties.RoutingMode;
import io.docex.tenancy.exception.InvalidStateException;
import io.docex.tenancy.exception.InvalidTenantIdException;
import io.docex.tenancy.exception.TenantExistsException;
import io.docex.tenancy.exception.TenantNotFoundException;
import io.docex.tenancy.provisioning.BootstrapManager;
import io.docex.tenancy.provisioning.IsolationBoundaryManagers;
import io.docex.tenancy.provisioning.TenantBoundary;
import io.docex.tenancy.provisioning.TenantProvisioner;
import jakarta.annotation.PreDestroy;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds one {@link ConnectionHandle} per tenant.
 *
 * <p>Lookups of an existing handle take no lock. Creating a handle takes the {@link TenantLocks}
 * stripe of that tenant id and covers only "check the map, create if absent, insert", so traffic
 * for a tenant whose handle exists never waits on it.
 *
 * <p>In explicit mode a tenant missing from the registry fails with {@link
 * TenantNotFoundException}. In lazy mode it is provisioned on first access.
 */
@Component
public class ConnectionRouter {

  private static final Logger log = LoggerFactory.getLogger(ConnectionRouter.class);
  static final String LAZY_PROVISIONER = "system";

  private final TenantRegistry registry;
  private final BootstrapManager bootstrapManager;
  private final TenantProvisioner provisioner;
  private final IsolationBoundaryManagers managers;
  private final MultiTenancyProperties properties;
  private final ConcurrentMap<String, ConnectionHandle> handles = new ConcurrentHashMap<>();
  private final TenantLocks creationLocks = new TenantLocks();

  public ConnectionRouter(
      TenantRegistry registry,
      BootstrapManager bootstrapManager,
      TenantProvisioner provisioner,
      IsolationBoundaryManagers managers,
      MultiTenancyProperties properties) {
    this.registry = registry;
    this.bootstrapManager = bootstrapManager;
    this.provisioner = provisioner;
    this.managers = managers;
    this.properties = properties;
  }

  public ConnectionHandle get(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new InvalidTenantIdException(tenantId, "Tenant id must not be blank");
    }
    if (provisioner.isSystemTenant(tenantId)) {
      throw new InvalidTenantIdException(
          tenantId, "The system tenant is only reachable through the default connection");
    }
    var existing = handles.get(tenantId);
    if (existing != null) {
      return existing;
    }
    return createOrFetch(tenantId, () -> open(lookupOrProvision(tenantId)));
  }

  /** Handle on the bootstrap boundary, used when multi-tenancy is disabled. */
  public ConnectionHandle getDefault() {
    String bootstrapId = bootstrapManager.bootstrapTenantId();
    var existing = handles.get(bootstrapId);
    if (existing != null) {
      return existing;
    }
    return createOrFetch(
        bootstrapId,
        () -> {
          var record = bootstrapManager.initialize(LAZY_PROVISIONER);
          return open(record);
        });
  }

  public void close(String tenantId) {
    var handle = handles.remove(tenantId);
    if (handle != null) {
      if (handle.claims() > 0) {
        log.warn("Closing pool for tenant {} with {} active claims", tenantId, handle.claims());
      }
      handle.close();
      log.info("Closed connection pool for tenant {}", tenantId);
    }
  }

  @PreDestroy
  public void closeAll() {
    for (String tenantId : Set.copyOf(handles.keySet())) {
      close(tenantId);
    }
  }

  public Set<String> activeTenants() {
    return new TreeSet<>(handles.keySet());
  }

  private ConnectionHandle createOrFetch(String tenantId, Supplier<ConnectionHandle> factory) {
    var lock = creationLocks.forTenant(tenantId);
    lock.lock();
    try {
      var existing = handles.get(tenantId);
      if (existing != null) {
        return existing;
      }
      var handle = factory.get();
      handles.put(tenantId, handle);
      return handle;
    } finally {
      lock.unlock();
    }
  }

  private TenantRecord lookupOrProvision(String tenantId) {
    var lazy = properties.routingMode() == RoutingMode.LAZY;
    if (!bootstrapManager.isInitialized()) {
      if (!lazy) {
        throw new InvalidStateException(
            "Bootstrap not initialized",
            "Initialize the bootstrap tenant before routing to tenant '" + tenantId + "'");
      }
      bootstrapManager.initialize(LAZY_PROVISIONER);
    }

    var record = registry.find(tenantId);
    if (record.isEmpty()) {
      if (!lazy) {
        log.debug("Tenant {} not registered, explicit routing fails closed", tenantId);
        throw new TenantNotFoundException(tenantId);
      }
      record = Optional.of(provisionOnFirstAccess(tenantId));
    }

    var tenant = record.get();
    if (!tenant.isActive()) {
      throw InvalidStateException.tenantSuspended(tenantId);
    }
    return tenant;
  }

  private TenantRecord provisionOnFirstAccess(String tenantId) {
    log.info("Tenant {} not registered, provisioning on first access", tenantId);
    try {
      return provisioner.create(tenantId, tenantId, LAZY_PROVISIONER);
    } catch (TenantExistsException e) {
      // Provisioned concurrently, possibly by another process
      return registry.find(tenantId).orElseThrow(() -> new TenantNotFoundException(tenantId));
    }
  }

  private ConnectionHandle open(TenantRecord record) {
    var boundary = TenantBoundary.of(record);
    var dataSource =
        managers
            .forStrategy(record.isolationStrategy())
            .openDataSource(boundary, "docex-" + record.tenantId());
    log.debug(
        "Opened pool for tenant {} ({} at {})",
        record.tenantId(),
        record.isolationStrategy(),
        boundary.location());
    return new ConnectionHandle(
        record.tenantId(), boundary, dataSource, properties.pool().connectionTimeout());
  }
}
