package io.docex.tenancy.pathing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.exception.InvalidTenantIdException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PathResolverTest {

  private static final String BASKET_ID = "bas_a1b2c3d4e5f6a7b8c9d0e1f2a3b42c03";
  private static final String DOCUMENT_ID = "doc_0f1e2d3c4b5a69788796a5b4c3585d29";

  private final MultiTenancyProperties.Naming naming = MultiTenancyProperties.defaults().naming();
  private final PathResolver resolver = new PathResolver(naming, null, null);

  @Test
  void resolvesSchemaNameFromTemplate() {
    assertThat(resolver.resolveSchemaName("acme")).isEqualTo("tenant_acme");
  }

  @Test
  void schemaNameIsDeterministicAcrossInstances() {
    var other = new PathResolver(MultiTenancyProperties.defaults().naming(), null, null);

    assertThat(resolver.resolveSchemaName("acme_corp_2"))
        .isEqualTo(resolver.resolveSchemaName("acme_corp_2"))
        .isEqualTo(other.resolveSchemaName("acme_corp_2"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"Acme", "a-b", "ACME_corp"})
  void rejectsIdsThatWouldNeedFoldingIntoAnIdentifier(String tenantId) {
    assertThatThrownBy(() -> resolver.resolveSchemaName(tenantId))
        .isInstanceOf(InvalidTenantIdException.class);
  }

  @Test
  void distinctTenantIdsResolveToDistinctBoundaries() {
    var tenantIds = List.of("acme", "acme_", "a_b", "ab", "a_b_c", "a__b", "1", "01", "tenant_1");

    assertThat(tenantIds.stream().map(resolver::resolveSchemaName).distinct().count())
        .isEqualTo(tenantIds.size());
    assertThat(tenantIds.stream().map(resolver::resolveDatabasePath).distinct().count())
        .isEqualTo(tenantIds.size());
    assertThat(tenantIds.stream().map(resolver::resolveStoragePrefix).distinct().count())
        .isEqualTo(tenantIds.size());
  }

  @Test
  void rejectsSchemaNameLongerThanIdentifierLimit() {
    String tenantId = "a".repeat(60);

    assertThatThrownBy(() -> resolver.resolveSchemaName(tenantId))
        .isInstanceOf(InvalidTenantIdException.class);
  }

  @Test
  void rejectsTemplateProducingIllegalIdentifier() {
    var badNaming =
        new MultiTenancyProperties.Naming(
            "1tenant_{tenant_id}", naming.databasePathTemplate(), naming.databaseUrlTemplate(), "x");
    var badResolver = new PathResolver(badNaming, null, null);

    assertThatThrownBy(() -> badResolver.resolveSchemaName("acme"))
        .isInstanceOfSatisfying(
            InvalidTenantIdException.class,
            e -> assertThat(e.getBody().getDetail()).contains("not a valid SQL identifier"));
  }

  @Test
  void rejectsBlankTenantId() {
    assertThatThrownBy(() -> resolver.resolveSchemaName(" "))
        .isInstanceOf(InvalidTenantIdException.class);
  }

  @Test
  void resolvesOneDatabaseDirectoryPerTenant() {
    assertThat(resolver.resolveDatabasePath("acme"))
        .isEqualTo(Path.of("storage/tenant_acme/docex.db"));
    assertThat(resolver.resolveDatabasePath("acme").getParent())
        .isNotEqualTo(resolver.resolveDatabasePath("globex").getParent());
  }

  @Test
  void databaseUrlUsesAbsolutePath() {
    String url = resolver.resolveDatabaseUrl(Path.of("storage/tenant_acme/docex.db"));

    assertThat(url).startsWith("jdbc:h2:file:").contains("storage/tenant_acme/docex.db");
    assertThat(url).endsWith(";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE");
  }

  @Test
  void storagePrefixWithoutNamespaceOrEnvironment() {
    assertThat(resolver.resolveStoragePrefix("t1")).isEqualTo("tenant_t1/");
  }

  @Test
  void storagePrefixIncludesNamespaceAndEnvironment() {
    var configured = new PathResolver(naming, "acme-docs", "prod");

    assertThat(configured.resolveStoragePrefix("t1")).isEqualTo("acme-docs/prod/tenant_t1/");
  }

  @Test
  void storagePrefixSkipsBlankSegments() {
    var onlyEnvironment = new PathResolver(naming, "  ", "/staging/");

    assertThat(onlyEnvironment.resolveStoragePrefix("t1")).isEqualTo("staging/tenant_t1/");
  }

  @Test
  void storagePrefixOmitsTenantInSingleTenantMode() {
    var configured = new PathResolver(naming, "docs", "dev");

    assertThat(configured.resolveStoragePrefix(null)).isEqualTo("docs/dev/");
    assertThat(resolver.resolveStoragePrefix(null)).isEmpty();
  }

  @Test
  void basketSegmentUsesLastFourCharactersOfId() {
    assertThat(resolver.resolveBasketSegment("t1", BASKET_ID, "Invoices"))
        .isEqualTo("invoices_2c03/");
  }

  @Test
  void documentSegmentUsesLastSixCharactersOfId() {
    assertThat(resolver.resolveDocumentSegment(DOCUMENT_ID, "inv_001", "pdf"))
        .isEqualTo("inv_001_585d29.pdf");
  }

  @Test
  void documentSegmentWithoutExtension() {
    assertThat(resolver.resolveDocumentSegment(DOCUMENT_ID, "README", ""))
        .isEqualTo("readme_585d29");
    assertThat(resolver.resolveDocumentSegment(DOCUMENT_ID, "scan", ".PNG"))
        .isEqualTo("scan_585d29.png");
  }

  @Test
  void identicalNamesWithDistinctIdsNeverCollide() {
    String first = resolver.resolveBasketSegment("t1", "bas_00000000000000000000000000001111", "Q1");
    String second =
        resolver.resolveBasketSegment("t1", "bas_00000000000000000000000000002222", "Q1");

    assertThat(first).isNotEqualTo(second);
    assertThat(resolver.resolveDocumentSegment("doc_aaaaaa111111", "scan", "pdf"))
        .isNotEqualTo(resolver.resolveDocumentSegment("doc_aaaaaa222222", "scan", "pdf"));
  }

  @Test
  void shortIdsAreUsedWhole() {
    assertThat(resolver.resolveBasketSegment("t1", "bas_ab", "x")).isEqualTo("x_ab/");
    assertThat(resolver.resolveDocumentSegment("7", "x", "txt")).isEqualTo("x_7.txt");
  }

  @Test
  void locateBuildsFullPath() {
    var locator = resolver.locate("t1", BASKET_ID, "invoices", DOCUMENT_ID, "inv_001", "pdf");

    assertThat(locator.prefix()).isEqualTo("tenant_t1/");
    assertThat(locator.basketPath()).isEqualTo("tenant_t1/invoices_2c03/");
    assertThat(locator.fullPath()).isEqualTo("tenant_t1/invoices_2c03/inv_001_585d29.pdf");
  }

  @Test
  void basketLocatorFullPathIsBasketPath() {
    var locator = resolver.locateBasket("t1", BASKET_ID, "invoices");

    assertThat(locator.fullPath()).isEqualTo(locator.basketPath());
  }

  @Test
  void sanitizeReplacesUnsafeRunsAndTrims() {
    assertThat(PathResolver.sanitize("Q1 Invoices (Final)!")).isEqualTo("q1_invoices_final");
    assertThat(PathResolver.sanitize("../etc/passwd")).isEqualTo("etc_passwd");
    assertThat(PathResolver.sanitize("keep-dash_and_underscore"))
        .isEqualTo("keep-dash_and_underscore");
  }

  @Test
  void sanitizeFallsBackToUnnamed() {
    assertThat(PathResolver.sanitize("!!!")).isEqualTo("unnamed");
    assertThat(PathResolver.sanitize("")).isEqualTo("unnamed");
    assertThat(PathResolver.sanitize(null)).isEqualTo("unnamed");
  }
}
