package io.docex.tenancy.setupstatus;

import static org.assertj.core.api.Assertions.assertThat;

import io.docex.tenancy.TenancyTestFixture;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.multitenancy.IsolationStrategy;
import io.docex.tenancy.multitenancy.TenantStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SetupStatusServiceTest {

  private static final MultiTenancyProperties MULTI_TENANT =
      MultiTenancyProperties.defaults()
          .withEnabled(true)
          .withIsolationStrategy(IsolationStrategy.SCHEMA);

  private TenancyTestFixture fixture;

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  private SetupStatusService service() {
    return new SetupStatusService(
        fixture.adminDataSource,
        fixture.bootstrapManager,
        fixture.managers,
        fixture.registry,
        fixture.properties);
  }

  @Test
  void freshDeployment_reportsMissingBootstrap() {
    fixture = TenancyTestFixture.create(MULTI_TENANT);
    var service = service();

    assertThat(service.isProperlySetup()).isFalse();
    assertThat(service.getSetupErrors())
        .singleElement()
        .asString()
        .contains("Bootstrap tenant '_docex_system_' is not initialized");
  }

  @Test
  void repeatedChecksHaveNoSideEffects() {
    fixture = TenancyTestFixture.create(MULTI_TENANT);
    var service = service();

    var first = service.getSetupErrors();
    var second = service.getSetupErrors();

    assertThat(second).isEqualTo(first);
    assertThat(fixture.schemaExists("docex_system")).isFalse();
    assertThat(fixture.bootstrapManager.isInitialized()).isFalse();
  }

  @Test
  void multiTenant_requiresABusinessTenant() {
    fixture = TenancyTestFixture.create(MULTI_TENANT);
    fixture.bootstrapManager.initialize("installer");
    var service = service();

    assertThat(service.getSetupErrors())
        .singleElement()
        .asString()
        .contains("no business tenant is provisioned");

    fixture.provisioner.create("acme", "Acme", "admin");

    assertThat(service.getSetupErrors()).isEmpty();
    assertThat(service.isProperlySetup()).isTrue();
  }

  @Test
  void multiTenant_reportsRequiredTenantProblems() {
    fixture = TenancyTestFixture.create(MULTI_TENANT);
    fixture.bootstrapManager.initialize("installer");
    fixture.provisioner.create("acme", "Acme", "admin");
    var service = service();

    assertThat(service.getSetupErrors("acme")).isEmpty();
    assertThat(service.getSetupErrors("ghost"))
        .singleElement()
        .asString()
        .contains("Tenant 'ghost' is not provisioned");

    fixture.provisioner.updateStatus("acme", TenantStatus.SUSPENDED, "ops");

    assertThat(service.getSetupErrors("acme")).containsExactly("Tenant 'acme' is suspended");
    assertThat(fixture.registry.exists("ghost")).isFalse();
  }

  @Test
  void singleTenant_onlyNeedsBootstrap() {
    fixture = TenancyTestFixture.create(MultiTenancyProperties.defaults());
    fixture.bootstrapManager.initialize("installer");

    assertThat(service().getSetupErrors()).isEmpty();
    assertThat(service().getSetupErrors("anything")).isEmpty();
  }
}
