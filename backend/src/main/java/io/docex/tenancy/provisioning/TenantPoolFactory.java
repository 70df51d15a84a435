package io.docex.tenancy.provisioning;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.docex.tenancy.config.MultiTenancyProperties;

/**
 * Per-tenant pools hold no idle connections, so a session abandoned without {@code close()} ties
 * up nothing once the idle timeout has passed.
 */
final class TenantPoolFactory {

  private TenantPoolFactory() {}

  static HikariDataSource newPool(
      String poolName,
      String jdbcUrl,
      String username,
      String password,
      String schema,
      MultiTenancyProperties.Pool pool) {
    var config = new HikariConfig();
    config.setPoolName(poolName);
    config.setJdbcUrl(jdbcUrl);
    config.setUsername(username);
    config.setPassword(password);
    if (schema != null) {
      config.setSchema(schema);
    }
    config.setMaximumPoolSize(pool.maximumSize());
    config.setMinimumIdle(0);
    config.setConnectionTimeout(pool.connectionTimeout().toMillis());
    config.setIdleTimeout(pool.idleTimeout().toMillis());
    return new HikariDataSource(config);
  }
}
