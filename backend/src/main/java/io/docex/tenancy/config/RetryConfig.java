package io.docex.tenancy.config;

import io.docex.tenancy.exception.ResourceExhaustedException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Bounded exponential backoff for read-only work that hit an exhausted tenant pool: up to four
 * attempts, waiting 100 ms, 200 ms and 400 ms (capped at 1 s) between them. Mutating operations
 * never use it.
 */
@Configuration
public class RetryConfig {

  static final int MAX_ATTEMPTS = 4;
  static final long INITIAL_INTERVAL_MS = 100;
  static final double MULTIPLIER = 2.0;
  static final long MAX_INTERVAL_MS = 1000;

  @Bean(name = "poolExhaustionRetryTemplate")
  public RetryTemplate poolExhaustionRetryTemplate() {
    return poolExhaustionRetry();
  }

  public static RetryTemplate poolExhaustionRetry() {
    return RetryTemplate.builder()
        .maxAttempts(MAX_ATTEMPTS)
        .exponentialBackoff(INITIAL_INTERVAL_MS, MULTIPLIER, MAX_INTERVAL_MS)
        .retryOn(ResourceExhaustedException.class)
        .build();
  }
}
