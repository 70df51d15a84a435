package io.docex.tenancy.multitenancy;

import io.docex.tenancy.basket.BasketRepository;
import io.docex.tenancy.basket.DocumentRepository;
import io.docex.tenancy.basket.IdGenerator;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.pathing.PathResolver;
import io.docex.tenancy.s3.TenantStorageService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

@Component
public class EntryPointFactory {

  private final ConnectionRouter router;
  private final MultiTenancyProperties properties;
  private final PathResolver pathResolver;
  private final BasketRepository baskets;
  private final DocumentRepository documents;
  private final IdGenerator idGenerator;
  private final TenantStorageService storage;
  private final RetryTemplate readRetry;

  public EntryPointFactory(
      ConnectionRouter router,
      MultiTenancyProperties properties,
      PathResolver pathResolver,
      BasketRepository baskets,
      DocumentRepository documents,
      IdGenerator idGenerator,
      TenantStorageService storage,
      @Qualifier("poolExhaustionRetryTemplate") RetryTemplate readRetry) {
    this.router = router;
    this.properties = properties;
    this.pathResolver = pathResolver;
    this.baskets = baskets;
    this.documents = documents;
    this.idGenerator = idGenerator;
    this.storage = storage;
    this.readRetry = readRetry;
  }

  /** A new session bound to the context's tenant. */
  public EntryPoint open(UserContext context) {
    return unbound().bind(context);
  }

  public EntryPoint unbound() {
    return new EntryPoint(
        router, properties, pathResolver, baskets, documents, idGenerator, storage, readRetry);
  }
}
