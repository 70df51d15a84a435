package io.docex.tenancy.setupstatus;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.multitenancy.TenantRegistry;
import io.docex.tenancy.provisioning.BootstrapManager;
import io.docex.tenancy.provisioning.IsolationBoundaryManagers;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Reports whether the deployment can serve requests. Every check is a read; calling it any number
 * of times changes nothing.
 */
@Service
public class SetupStatusService {

  private static final Logger log = LoggerFactory.getLogger(SetupStatusService.class);
  static final List<String> REQUIRED_BOOTSTRAP_TABLES =
      List.of("tenant_registry", "docbasket", "document");
  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final HikariDataSource adminDataSource;
  private final BootstrapManager bootstrapManager;
  private final IsolationBoundaryManagers managers;
  private final TenantRegistry registry;
  private final MultiTenancyProperties properties;

  public SetupStatusService(
      @Qualifier("adminDataSource") HikariDataSource adminDataSource,
      BootstrapManager bootstrapManager,
      IsolationBoundaryManagers managers,
      TenantRegistry registry,
      MultiTenancyProperties properties) {
    this.adminDataSource = adminDataSource;
    this.bootstrapManager = bootstrapManager;
    this.managers = managers;
    this.registry = registry;
    this.properties = properties;
  }

  public boolean isProperlySetup() {
    return getSetupErrors().isEmpty();
  }

  public List<String> getSetupErrors() {
    return getSetupErrors(null);
  }

  /**
   * @param requiredTenantId tenant the caller is about to use, or {@code null} to only require
   *     that some business tenant exists
   */
  public List<String> getSetupErrors(String requiredTenantId) {
    var errors = new ArrayList<String>();

    String connectivityError = checkConnectivity();
    if (connectivityError != null) {
      errors.add(connectivityError);
      return errors;
    }

    if (!bootstrapManager.isInitialized()) {
      errors.add(
          "Bootstrap tenant '"
              + properties.bootstrapTenant().id()
              + "' is not initialized. Run the bootstrap before provisioning tenants.");
      return errors;
    }

    try {
      var boundary = managers.bootstrapBoundary();
      var manager = managers.forStrategy(boundary.strategy());
      for (String table : REQUIRED_BOOTSTRAP_TABLES) {
        if (!manager.tableExists(boundary, table)) {
          errors.add("Required table '" + table + "' is missing from the bootstrap tenant");
        }
      }

      if (properties.enabled()) {
        errors.addAll(checkTenants(requiredTenantId));
      }
    } catch (RuntimeException e) {
      log.warn("Setup check failed while reading the bootstrap tenant", e);
      errors.add("Could not read the bootstrap tenant: " + e.getMessage());
    }

    if (!errors.isEmpty()) {
      log.debug("Setup check found {} problems: {}", errors.size(), errors);
    }
    return errors;
  }

  private List<String> checkTenants(String requiredTenantId) {
    if (requiredTenantId != null) {
      var tenant = registry.find(requiredTenantId);
      if (tenant.isEmpty()) {
        return List.of(
            "Tenant '"
                + requiredTenantId
                + "' is not provisioned. Provision it before running tenant operations.");
      }
      if (!tenant.get().isActive()) {
        return List.of("Tenant '" + requiredTenantId + "' is suspended");
      }
      return List.of();
    }
    if (registry.countBusinessTenants() == 0) {
      return List.of(
          "Multi-tenancy is enabled but no business tenant is provisioned."
              + " Provision a tenant before running tenant operations.");
    }
    return List.of();
  }

  private String checkConnectivity() {
    try (var conn = adminDataSource.getConnection()) {
      if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        return "Database connection is not valid";
      }
      return null;
    } catch (SQLException e) {
      log.warn("Setup check could not reach the database", e);
      return "Database connection failed: " + e.getMessage();
    }
  }
}
