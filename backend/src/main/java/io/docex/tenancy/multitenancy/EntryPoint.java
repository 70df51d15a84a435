package io.docex.tenancy.multitenancy;

import io.docex.tenancy.basket.Basket;
import io.docex.tenancy.basket.BasketRepository;
import io.docex.tenancy.basket.Document;
import io.docex.tenancy.basket.DocumentRepository;
import io.docex.tenancy.basket.IdGenerator;
import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.exception.InvalidTenantIdException;
import io.docex.tenancy.exception.MissingTenantContextException;
import io.docex.tenancy.exception.ResourceNotFoundException;
import io.docex.tenancy.exception.TenantSwitchException;
import io.docex.tenancy.pathing.PathResolver;
import io.docex.tenancy.s3.TenantStorageService;
import io.docex.tenancy.s3.TenantStorageService.PresignedDownloadResult;
import io.docex.tenancy.s3.TenantStorageService.PresignedUploadResult;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.retry.support.RetryTemplate;

/**
 * Per-session handle through which applications work with exactly one tenant.
 *
 * <p>An entry point starts unbound. {@link #bind} attaches it to a tenant's connection; binding
 * again to the same tenant is a no-op, binding to a different one fails with {@link
 * TenantSwitchException} until {@link #close()} or {@link #reset()} returns it to unbound. Every
 * data operation requires a bound session. There is no fallback tenant.
 *
 * <p>Read-only operations retry on an exhausted pool with the bounded backoff of the injected
 * retry template. Mutating operations are attempted once; retrying them is the caller's call.
 */
public class EntryPoint implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(EntryPoint.class);
  private static final String MDC_TENANT_ID = "tenantId";
  private static final String MDC_USER_ID = "userId";

  private final ConnectionRouter router;
  private final MultiTenancyProperties properties;
  private final PathResolver pathResolver;
  private final BasketRepository baskets;
  private final DocumentRepository documents;
  private final IdGenerator idGenerator;
  private final TenantStorageService storage;
  private final RetryTemplate readRetry;

  private ConnectionHandle handle;
  private String boundTenantId;
  private UserContext userContext;

  EntryPoint(
      ConnectionRouter router,
      MultiTenancyProperties properties,
      PathResolver pathResolver,
      BasketRepository baskets,
      DocumentRepository documents,
      IdGenerator idGenerator,
      TenantStorageService storage,
      RetryTemplate readRetry) {
    this.router = router;
    this.properties = properties;
    this.pathResolver = pathResolver;
    this.baskets = baskets;
    this.documents = documents;
    this.idGenerator = idGenerator;
    this.storage = storage;
    this.readRetry = readRetry;
  }

  public synchronized EntryPoint bind(UserContext context) {
    if (context == null) {
      throw new IllegalArgumentException("UserContext is required");
    }
    if (!properties.enabled()) {
      if (handle == null || handle.isClosed()) {
        swapHandle(router.getDefault());
      }
      userContext = context;
      return this;
    }

    String tenantId = context.tenantId();
    if (tenantId == null || tenantId.isBlank()) {
      throw new MissingTenantContextException(
          "Multi-tenancy is enabled; UserContext for user '"
              + context.userId()
              + "' carries no tenant id");
    }
    if (properties.bootstrapTenant().id().equals(tenantId)) {
      throw new InvalidTenantIdException(
          tenantId, "The system tenant cannot be bound to a user session");
    }
    if (handle != null) {
      if (!tenantId.equals(boundTenantId)) {
        throw new TenantSwitchException(boundTenantId, tenantId);
      }
      if (handle.isClosed()) {
        // The router dropped this tenant's pool; move the claim to the current handle
        swapHandle(router.get(tenantId));
        log.debug(
            "Re-bound session of user {} to a fresh handle for {}", context.userId(), tenantId);
      }
      userContext = context;
      return this;
    }

    var tenantHandle = router.get(tenantId);
    tenantHandle.claim();
    handle = tenantHandle;
    boundTenantId = tenantId;
    userContext = context;
    log.debug("Bound session of user {} to tenant {}", context.userId(), tenantId);
    return this;
  }

  private void swapHandle(ConnectionHandle replacement) {
    replacement.claim();
    if (handle != null) {
      handle.release();
    }
    handle = replacement;
  }

  /** Releases this session's claim on the tenant connection and returns to unbound. */
  @Override
  public synchronized void close() {
    if (handle != null) {
      handle.release();
      log.debug("Released session on tenant {}", handle.tenantId());
    }
    handle = null;
    boundTenantId = null;
    userContext = null;
  }

  public void reset() {
    close();
  }

  public synchronized boolean isBound() {
    return handle != null;
  }

  /** The bound tenant, empty when unbound or in single-tenant mode. */
  public synchronized Optional<String> tenantId() {
    return Optional.ofNullable(boundTenantId);
  }

  public synchronized Basket createBasket(String name, String description) {
    requireName(name, "Basket name");
    return inTenant(
        "createBasket",
        () -> {
          String basketId = idGenerator.newBasketId();
          var locator = pathResolver.locateBasket(boundTenantId, basketId, name);
          var basket =
              new Basket(
                  basketId,
                  handle.tenantId(),
                  name,
                  description,
                  locator.basketPath(),
                  userContext.userId(),
                  Instant.now());
          baskets.insert(handle, basket);
          log.info("Created basket {} at {}", basketId, basket.storagePath());
          return basket;
        });
  }

  public synchronized Basket getBasket(String basketId) {
    return inTenant(
        "getBasket",
        () ->
            read(() -> baskets.findById(handle, basketId))
                .orElseThrow(() -> new ResourceNotFoundException("Basket", basketId)));
  }

  public synchronized Optional<Basket> findBasketByName(String name) {
    return inTenant("findBasketByName", () -> read(() -> baskets.findByName(handle, name)));
  }

  public synchronized List<Basket> listBaskets() {
    return inTenant("listBaskets", () -> read(() -> baskets.findAll(handle)));
  }

  /** Registers a document in a basket; {@code fileName} is split into name and extension. */
  public synchronized Document addDocument(String basketId, String fileName) {
    requireName(fileName, "File name");
    return inTenant(
        "addDocument",
        () -> {
          var basket =
              baskets
                  .findById(handle, basketId)
                  .orElseThrow(() -> new ResourceNotFoundException("Basket", basketId));
          int dot = fileName.lastIndexOf('.');
          String name = dot > 0 ? fileName.substring(0, dot) : fileName;
          String extension =
              dot > 0 && dot < fileName.length() - 1
                  ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT)
                  : "";
          String documentId = idGenerator.newDocumentId();
          // Built on the basket's stored path, never re-resolved
          String storagePath =
              basket.storagePath()
                  + pathResolver.resolveDocumentSegment(documentId, name, extension);
          var document =
              new Document(
                  documentId,
                  basket.id(),
                  handle.tenantId(),
                  name,
                  extension,
                  storagePath,
                  userContext.userId(),
                  Instant.now());
          documents.insert(handle, document);
          log.info("Added document {} at {}", documentId, storagePath);
          return document;
        });
  }

  public synchronized Document getDocument(String documentId) {
    return inTenant(
        "getDocument",
        () ->
            read(() -> documents.findById(handle, documentId))
                .orElseThrow(() -> new ResourceNotFoundException("Document", documentId)));
  }

  public synchronized List<Document> listDocuments(String basketId) {
    return inTenant("listDocuments", () -> read(() -> documents.findByBasket(handle, basketId)));
  }

  public synchronized String storagePrefix() {
    requireBound();
    return pathResolver.resolveStoragePrefix(boundTenantId);
  }

  public synchronized PresignedUploadResult uploadUrl(String documentId, String contentType) {
    var document = getDocument(documentId);
    return storage.generateUploadUrl(storagePrefix(), document.storagePath(), contentType);
  }

  public synchronized PresignedDownloadResult downloadUrl(String documentId) {
    var document = getDocument(documentId);
    return storage.generateDownloadUrl(storagePrefix(), document.storagePath());
  }

  private <T> T inTenant(String operation, Supplier<T> work) {
    requireBound();
    MDC.put(MDC_TENANT_ID, handle.tenantId());
    MDC.put(MDC_USER_ID, userContext.userId());
    try {
      log.debug("{} on tenant {}", operation, handle.tenantId());
      return work.get();
    } finally {
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_USER_ID);
    }
  }

  private <T> T read(Supplier<T> query) {
    return readRetry.execute(context -> query.get());
  }

  private void requireBound() {
    if (handle == null) {
      throw new TenantContextNotBoundException();
    }
  }

  private static void requireName(String value, String label) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
  }
}
