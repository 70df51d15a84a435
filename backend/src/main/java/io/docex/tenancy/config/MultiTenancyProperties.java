package io.docex.tenancy.config;

import io.docex.tenancy.multitenancy.IsolationStrategy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Multi-tenancy settings bound from {@code docex.multi-tenancy.*}.
 *
 * @param enabled whether every session must be bound to a provisioned business tenant
 * @param isolationStrategy strategy for new tenants; {@code null} derives it from the admin
 *     database's capabilities
 * @param routingMode whether routing to an unknown tenant fails or provisions it on first use
 * @param bootstrapTenant location of the reserved system tenant that holds the registry
 * @param naming templates used by the path resolver
 * @param pool per-tenant connection pool sizing
 */
@ConfigurationProperties("docex.multi-tenancy")
public record MultiTenancyProperties(
    @DefaultValue("false") boolean enabled,
    IsolationStrategy isolationStrategy,
    @DefaultValue("explicit") RoutingMode routingMode,
    @DefaultValue BootstrapTenant bootstrapTenant,
    @DefaultValue Naming naming,
    @DefaultValue Pool pool) {

  public enum RoutingMode {
    /** Unknown tenants fail closed with a not-found error. */
    EXPLICIT,
    /** Unknown tenants are provisioned on first access. */
    LAZY
  }

  public record BootstrapTenant(
      @DefaultValue("_docex_system_") String id,
      @DefaultValue("docex_system") String schema,
      @DefaultValue("storage/_docex_system_/docex.db") String databasePath) {}

  /**
   * @param schemaTemplate schema name template, {@code {tenant_id}} is substituted
   * @param databasePathTemplate database file template for database-per-tenant isolation
   * @param databaseUrlTemplate JDBC URL template for database files, {@code {path}} is substituted
   * @param sharedSchema schema shared by all row-level tenants
   */
  public record Naming(
      @DefaultValue("tenant_{tenant_id}") String schemaTemplate,
      @DefaultValue("storage/tenant_{tenant_id}/docex.db") String databasePathTemplate,
      @DefaultValue("jdbc:h2:file:{path};MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE")
          String databaseUrlTemplate,
      @DefaultValue("tenant_shared") String sharedSchema) {}

  public record Pool(
      @DefaultValue("5") int maximumSize,
      @DefaultValue("30s") Duration connectionTimeout,
      @DefaultValue("10m") Duration idleTimeout) {}

  public static MultiTenancyProperties defaults() {
    return new MultiTenancyProperties(
        false,
        null,
        RoutingMode.EXPLICIT,
        new BootstrapTenant("_docex_system_", "docex_system", "storage/_docex_system_/docex.db"),
        new Naming(
            "tenant_{tenant_id}",
            "storage/tenant_{tenant_id}/docex.db",
            "jdbc:h2:file:{path};MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE",
            "tenant_shared"),
        new Pool(5, Duration.ofSeconds(30), Duration.ofMinutes(10)));
  }

  public MultiTenancyProperties withEnabled(boolean enabled) {
    return new MultiTenancyProperties(
        enabled, isolationStrategy, routingMode, bootstrapTenant, naming, pool);
  }

  public MultiTenancyProperties withIsolationStrategy(IsolationStrategy isolationStrategy) {
    return new MultiTenancyProperties(
        enabled, isolationStrategy, routingMode, bootstrapTenant, naming, pool);
  }

  public MultiTenancyProperties withRoutingMode(RoutingMode routingMode) {
    return new MultiTenancyProperties(
        enabled, isolationStrategy, routingMode, bootstrapTenant, naming, pool);
  }

  public MultiTenancyProperties withBootstrapTenant(BootstrapTenant bootstrapTenant) {
    return new MultiTenancyProperties(
        enabled, isolationStrategy, routingMode, bootstrapTenant, naming, pool);
  }

  public MultiTenancyProperties withNaming(Naming naming) {
    return new MultiTenancyProperties(
        enabled, isolationStrategy, routingMode, bootstrapTenant, naming, pool);
  }

  public MultiTenancyProperties withPool(Pool pool) {
    return new MultiTenancyProperties(
        enabled, isolationStrategy, routingMode, bootstrapTenant, naming, pool);
  }
}
