package io.docex.tenancy.pathing;

import io.docex.tenancy.config.MultiTenancyProperties;
import io.docex.tenancy.config.S3Config.S3Properties;
import io.docex.tenancy.exception.InvalidTenantIdException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps tenant ids and resource names to schema names, database files and object-storage keys.
 *
 * <p>Every method is a pure function of its arguments and the naming templates this resolver was
 * built with, so the same input resolves to the same location on every call and after restarts.
 * Basket and document segments carry an id-derived suffix, which keeps two resources with the
 * same display name apart.
 */
@Component
public class PathResolver {

  static final String TENANT_PLACEHOLDER = "{tenant_id}";
  static final String UNNAMED = "unnamed";
  static final int MAX_IDENTIFIER_LENGTH = 63;

  private static final Pattern SQL_IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]*$");
  private static final Pattern UNSAFE_RUN = Pattern.compile("[^a-z0-9_-]+");
  private static final String BASKET_ID_PREFIX = "bas_";
  private static final String DOCUMENT_ID_PREFIX = "doc_";

  private final MultiTenancyProperties.Naming naming;
  private final String namespace;
  private final String environment;

  @Autowired
  public PathResolver(MultiTenancyProperties properties, S3Properties s3Properties) {
    this(properties.naming(), s3Properties.namespace(), s3Properties.environment());
  }

  public PathResolver(MultiTenancyProperties.Naming naming, String namespace, String environment) {
    this.naming = naming;
    this.namespace = namespace;
    this.environment = environment;
  }

  public String resolveSchemaName(String tenantId) {
    requireTenantId(tenantId);
    // No case or character folding: distinct tenant ids must never share a schema
    String schemaName = naming.schemaTemplate().replace(TENANT_PLACEHOLDER, tenantId);
    if (schemaName.length() > MAX_IDENTIFIER_LENGTH) {
      throw new InvalidTenantIdException(
          tenantId,
          "Schema name '"
              + schemaName
              + "' exceeds "
              + MAX_IDENTIFIER_LENGTH
              + " characters");
    }
    if (!SQL_IDENTIFIER.matcher(schemaName).matches()) {
      throw new InvalidTenantIdException(
          tenantId, "Schema name '" + schemaName + "' is not a valid SQL identifier");
    }
    return schemaName;
  }

  public Path resolveDatabasePath(String tenantId) {
    requireTenantId(tenantId);
    return Path.of(naming.databasePathTemplate().replace(TENANT_PLACEHOLDER, tenantId));
  }

  /** JDBC URL for a database file; {@code {path}} in the template becomes the absolute path. */
  public String resolveDatabaseUrl(Path databasePath) {
    String path = databasePath.toAbsolutePath().normalize().toString().replace('\\', '/');
    return naming.databaseUrlTemplate().replace("{path}", path);
  }

  /**
   * {@code {namespace}/{environment}/tenant_{tenantId}/}. Blank namespace or environment add no
   * segment; a {@code null} tenant (single-tenant mode) adds none either.
   */
  public String resolveStoragePrefix(String tenantId) {
    var prefix = new StringBuilder();
    appendSegment(prefix, namespace);
    appendSegment(prefix, environment);
    if (tenantId != null) {
      requireTenantId(tenantId);
      appendSegment(prefix, "tenant_" + tenantId);
    }
    return prefix.toString();
  }

  public String resolveBasketSegment(String tenantId, String basketId, String basketName) {
    return sanitize(basketName) + "_" + idSuffix(basketId, BASKET_ID_PREFIX, 4) + "/";
  }

  public String resolveDocumentSegment(String documentId, String documentName, String ext) {
    String segment = sanitize(documentName) + "_" + idSuffix(documentId, DOCUMENT_ID_PREFIX, 6);
    if (ext == null || ext.isBlank()) {
      return segment;
    }
    String cleanExt = ext.startsWith(".") ? ext.substring(1) : ext;
    return segment + "." + cleanExt.toLowerCase(Locale.ROOT);
  }

  public StorageLocator locateBasket(String tenantId, String basketId, String basketName) {
    return new StorageLocator(
        resolveStoragePrefix(tenantId),
        resolveBasketSegment(tenantId, basketId, basketName),
        null);
  }

  public StorageLocator locate(
      String tenantId,
      String basketId,
      String basketName,
      String documentId,
      String documentName,
      String ext) {
    return new StorageLocator(
        resolveStoragePrefix(tenantId),
        resolveBasketSegment(tenantId, basketId, basketName),
        resolveDocumentSegment(documentId, documentName, ext));
  }

  public static String sanitize(String name) {
    if (name == null) {
      return UNNAMED;
    }
    String replaced = UNSAFE_RUN.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    int start = 0;
    int end = replaced.length();
    while (start < end && replaced.charAt(start) == '_') {
      start++;
    }
    while (end > start && replaced.charAt(end - 1) == '_') {
      end--;
    }
    String trimmed = replaced.substring(start, end);
    return trimmed.isEmpty() ? UNNAMED : trimmed;
  }

  static String idSuffix(String id, String idPrefix, int length) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Resource id must not be blank");
    }
    String bare = id.startsWith(idPrefix) ? id.substring(idPrefix.length()) : id;
    return bare.length() <= length ? bare : bare.substring(bare.length() - length);
  }

  private static void appendSegment(StringBuilder prefix, String segment) {
    if (segment == null || segment.isBlank()) {
      return;
    }
    prefix.append(stripSlashes(segment.trim())).append('/');
  }

  private static String stripSlashes(String segment) {
    int start = 0;
    int end = segment.length();
    while (start < end && segment.charAt(start) == '/') {
      start++;
    }
    while (end > start && segment.charAt(end - 1) == '/') {
      end--;
    }
    return segment.substring(start, end);
  }

  private static void requireTenantId(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new InvalidTenantIdException(tenantId, "Tenant id must not be blank");
    }
  }
}
