package io.docex.tenancy.config;

import java.net.URI;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
@EnableConfigurationProperties({
  S3Config.S3Properties.class,
  S3Config.AwsCredentialsProperties.class
})
public class S3Config {

  /**
   * Object-storage location. {@code namespace} and {@code environment} each add one key segment
   * in front of the tenant segment when present.
   */
  @ConfigurationProperties("docex.storage.s3")
  public record S3Properties(
      String bucket,
      String namespace,
      String environment,
      @DefaultValue("us-east-1") String region,
      String endpoint) {}

  @ConfigurationProperties("docex.storage.credentials")
  public record AwsCredentialsProperties(String accessKeyId, String secretAccessKey) {}

  @Bean(destroyMethod = "close")
  S3Presigner s3Presigner(S3Properties s3Props, AwsCredentialsProperties credProps) {
    var builder =
        S3Presigner.builder()
            .region(Region.of(s3Props.region()))
            .credentialsProvider(credentialsProvider(credProps));

    if (s3Props.endpoint() != null && !s3Props.endpoint().isBlank()) {
      builder
          .endpointOverride(URI.create(s3Props.endpoint()))
          .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
    }

    return builder.build();
  }

  static AwsCredentialsProvider credentialsProvider(AwsCredentialsProperties credProps) {
    if (credProps.accessKeyId() != null && !credProps.accessKeyId().isBlank()) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(credProps.accessKeyId(), credProps.secretAccessKey()));
    }
    return DefaultCredentialsProvider.create();
  }
}
