package io.docex.tenancy.multitenancy;

import java.util.Map;
import java.util.Set;

/**
 * Caller identity for one logical session. The tenant id is required once multi-tenancy is
 * enabled; the entry point enforces that at bind time.
 */
public record UserContext(
    String userId,
    String userEmail,
    String tenantId,
    Set<String> roles,
    Map<String, Object> attributes) {

  public UserContext {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    roles = roles == null ? Set.of() : Set.copyOf(roles);
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static UserContext of(String userId, String tenantId) {
    return new UserContext(userId, null, tenantId, Set.of(), Map.of());
  }

  public boolean hasRole(String role) {
    return roles.contains(role);
  }

  @SuppressWarnings("unchecked")
  public <T> T attribute(String key, T defaultValue) {
    Object value = attributes.get(key);
    return value == null ? defaultValue : (T) value;
  }
}
