package io.docex.tenancy.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class UserContextTest {

  @Test
  void requiresUserId() {
    assertThatThrownBy(() -> UserContext.of(null, "acme"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> UserContext.of(" ", "acme"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void copiesRolesAndAttributes() {
    var roles = new HashSet<>(Set.of("admin"));
    var attributes = new HashMap<String, Object>(Map.of("locale", "en"));
    var context = new UserContext("u1", "u1@example.com", "acme", roles, attributes);

    roles.add("owner");
    attributes.put("locale", "de");

    assertThat(context.hasRole("admin")).isTrue();
    assertThat(context.hasRole("owner")).isFalse();
    assertThat(context.attribute("locale", "fr")).isEqualTo("en");
    assertThatThrownBy(() -> context.roles().add("x"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void nullCollectionsBecomeEmpty() {
    var context = new UserContext("u1", null, null, null, null);

    assertThat(context.roles()).isEmpty();
    assertThat(context.attributes()).isEmpty();
    assertThat(context.attribute("missing", 42)).isEqualTo(42);
  }
}
