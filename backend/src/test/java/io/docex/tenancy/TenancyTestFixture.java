package io.docex.tenancy;

import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.basket.BasketRepository;
import io.docex.tenancy.basket.DocumentRepository;
import io.docex.tenancy.basket.IdGenerator;
import io.docex.tenancy.basket.UuidIdGenerator;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.config.RetryConfig;
import io.docex.tenancy.config.S3Config.S3Properties;
import io.docex.tenancy.multitenancy.BootstrapConnectionProvider;
import io.docex.tenancy.multitenancy.ConnectionRouter;
import io.docex.tenancy.multitenancy.EntryPointFactory;
import io.docex.tenancy.multitenancy.TenantRegistry;
import io.docex.tenancy.pathing.PathResolver;
import io.docex.tenancy.provisioning.BootstrapManager;
import io.docex.tenancy.provisioning.DatabaseFileBoundaryManager;
import io.docex.tenancy.provisioning.IsolationBoundaryManagers;
import io.docex.tenancy.provisioning.RowLevelBoundaryManager;
import io.docex.tenancy.provisioning.SchemaBoundaryManager;
import io.docex.tenancy.provisioning.TenantProvisioner;
import io.docex.tenancy.s3.TenantStorageService;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * The tenancy object graph wired by hand on a private in-memory H2 database, so each test starts
 * from an empty deployment.
 */
public final class TenancyTestFixture implements AutoCloseable {

  public static final String BUCKET = "docex-test";

  public final HikariDataSource adminDataSource;
  public final MultiTenancyProperties properties;
  public final PathResolver pathResolver;
  public final IsolationBoundaryManagers managers;
  public final BootstrapConnectionProvider bootstrapConnections;
  public final TenantRegistry registry;
  public final BootstrapManager bootstrapManager;
  public final TenantProvisioner provisioner;
  public final ConnectionRouter router;
  public final TenantStorageService storage;
  private final S3Presigner presigner;

  private TenancyTestFixture(MultiTenancyProperties properties) {
    this.properties = properties;
    this.adminDataSource = new HikariDataSource();
    adminDataSource.setJdbcUrl(h2Url("docex_" + UUID.randomUUID().toString().replace("-", "")));
    adminDataSource.setUsername("sa");
    adminDataSource.setPassword("");
    adminDataSource.setMaximumPoolSize(3);

    var s3Properties = new S3Properties(BUCKET, null, null, "us-east-1", null);
    this.pathResolver = new PathResolver(properties, s3Properties);
    this.managers =
        new IsolationBoundaryManagers(
            List.of(
                new SchemaBoundaryManager(adminDataSource, properties, pathResolver),
                new RowLevelBoundaryManager(adminDataSource, properties, pathResolver),
                new DatabaseFileBoundaryManager(properties, pathResolver)),
            adminDataSource,
            properties);
    this.bootstrapConnections = new BootstrapConnectionProvider(managers);
    this.registry = new TenantRegistry(bootstrapConnections, properties);
    this.bootstrapManager = new BootstrapManager(managers, registry, properties);
    this.provisioner = new TenantProvisioner(registry, managers, bootstrapManager, properties);
    this.router = new ConnectionRouter(registry, bootstrapManager, provisioner, managers, properties);
    this.presigner =
        S3Presigner.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test")))
            .build();
    this.storage = new TenantStorageService(presigner, s3Properties);
  }

  public static TenancyTestFixture create(MultiTenancyProperties properties) {
    return new TenancyTestFixture(properties);
  }

  public static String h2Url(String databaseName) {
    return "jdbc:h2:mem:"
        + databaseName
        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE";
  }

  public EntryPointFactory entryPoints() {
    return entryPoints(new UuidIdGenerator());
  }

  public EntryPointFactory entryPoints(IdGenerator idGenerator) {
    return new EntryPointFactory(
        router,
        properties,
        pathResolver,
        new BasketRepository(),
        new DocumentRepository(),
        idGenerator,
        storage,
        RetryConfig.poolExhaustionRetry());
  }

  public boolean schemaExists(String schemaName) {
    Long count =
        JdbcClient.create(adminDataSource)
            .sql("SELECT COUNT(*) FROM information_schema.schemata WHERE LOWER(schema_name) = ?")
            .param(schemaName)
            .query(Long.class)
            .single();
    return count > 0;
  }

  @Override
  public void close() {
    router.closeAll();
    bootstrapConnections.close();
    presigner.close();
    JdbcClient.create(adminDataSource).sql("SHUTDOWN").update();
    adminDataSource.close();
  }
}
