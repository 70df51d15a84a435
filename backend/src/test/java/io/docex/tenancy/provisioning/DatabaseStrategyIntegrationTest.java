package io.docex.tenancy.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docex.tenancy.TenancyTestFixture;
import io.docex.tenancy.basket.Basket;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.exception.TenantExistsException;
import io.docex.tenancy.exception.TenantNotFoundException;
import io.docex.tenancy.multitenancy.IsolationStrategy;
import io.docex.tenancy.multitenancy.UserContext;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatabaseStrategyIntegrationTest {

  @TempDir Path storageRoot;

  private TenancyTestFixture fixture;

  @BeforeEach
  void setUp() {
    var defaults = MultiTenancyProperties.defaults();
    var naming = defaults.naming();
    var properties =
        defaults
            .withEnabled(true)
            .withIsolationStrategy(IsolationStrategy.DATABASE)
            .withBootstrapTenant(
                new MultiTenancyProperties.BootstrapTenant(
                    "_docex_system_",
                    "docex_system",
                    storageRoot.resolve("_docex_system_/docex.db").toString()))
            .withNaming(
                new MultiTenancyProperties.Naming(
                    naming.schemaTemplate(),
                    storageRoot.resolve("tenant_{tenant_id}/docex.db").toString(),
                    naming.databaseUrlTemplate(),
                    naming.sharedSchema()));
    fixture = TenancyTestFixture.create(properties);
  }

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  private Path dataFile(String directory) {
    return storageRoot.resolve(directory).resolve("docex.db.mv.db");
  }

  @Test
  void isInitialized_doesNotCreateDatabaseFile() {
    assertThat(fixture.bootstrapManager.isInitialized()).isFalse();

    assertThat(dataFile("_docex_system_")).doesNotExist();
  }

  @Test
  void initialize_createsBootstrapDatabaseFile() {
    var system = fixture.bootstrapManager.initialize("installer");

    assertThat(system.isolationStrategy()).isEqualTo(IsolationStrategy.DATABASE);
    assertThat(system.schemaName()).isNull();
    assertThat(dataFile("_docex_system_")).exists();
    assertThat(fixture.bootstrapManager.isInitialized()).isTrue();
  }

  @Test
  void create_givesEachTenantItsOwnFile() {
    fixture.bootstrapManager.initialize("installer");

    var acme = fixture.provisioner.create("acme", "Acme", "admin");
    fixture.provisioner.create("globex", "Globex", "admin");

    assertThat(acme.databasePath()).endsWith("docex.db");
    assertThat(dataFile("tenant_acme")).exists();
    assertThat(dataFile("tenant_globex")).exists();
    assertThatThrownBy(() -> fixture.provisioner.create("acme", "Acme", "admin"))
        .isInstanceOf(TenantExistsException.class);
  }

  @Test
  void tenantsInSeparateFilesDoNotSeeEachOther() {
    fixture.bootstrapManager.initialize("installer");
    fixture.provisioner.create("acme", "Acme", "admin");
    fixture.provisioner.create("globex", "Globex", "admin");
    var entryPoints = fixture.entryPoints();

    try (var acme = entryPoints.open(UserContext.of("alice", "acme"))) {
      acme.createBasket("invoices", null);
    }
    try (var globex = entryPoints.open(UserContext.of("bob", "globex"))) {
      assertThat(globex.listBaskets()).isEmpty();
      globex.createBasket("invoices", null);
    }
    try (var acme = entryPoints.open(UserContext.of("alice", "acme"))) {
      assertThat(acme.listBaskets()).extracting(Basket::name).containsExactly("invoices");
    }
  }

  @Test
  void routingToUnprovisionedTenantCreatesNoFile() {
    fixture.bootstrapManager.initialize("installer");

    assertThatThrownBy(() -> fixture.router.get("ghost"))
        .isInstanceOf(TenantNotFoundException.class);
    assertThat(Files.exists(storageRoot.resolve("tenant_ghost"))).isFalse();
  }
}
