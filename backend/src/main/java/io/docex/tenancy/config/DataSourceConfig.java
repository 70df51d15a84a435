package io.docex.tenancy.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Admin pool on the shared database. Used for DDL (schema creation), Flyway runs and metadata
 * lookups; tenant traffic never goes through it, each tenant gets its own pool from the router.
 */
@Configuration
@EnableConfigurationProperties(MultiTenancyProperties.class)
public class DataSourceConfig {

  @Bean(name = "adminDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.admin")
  public HikariDataSource adminDataSource() {
    return new HikariDataSource();
  }
}
