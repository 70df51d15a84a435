package io.docex.tenancy.s3;

import io.docex.tenancy.config.S3Config.S3Properties;
import java.time.Duration;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/**
 * Presigned URLs for stored document keys. A key is only signed when it sits under the caller's
 * tenant prefix, so a session can never hand out a URL into another tenant's objects.
 */
@Service
public class TenantStorageService {

  static final Duration URL_EXPIRY = Duration.ofHours(1);

  private final S3Presigner presigner;
  private final String bucketName;

  public TenantStorageService(S3Presigner presigner, S3Properties s3Properties) {
    this.presigner = presigner;
    this.bucketName = s3Properties.bucket();
  }

  public PresignedUploadResult generateUploadUrl(
      String tenantPrefix, String key, String contentType) {
    requireTenantKey(tenantPrefix, key);
    var putRequest =
        PutObjectRequest.builder().bucket(bucket()).key(key).contentType(contentType).build();

    var presignRequest =
        PutObjectPresignRequest.builder()
            .signatureDuration(URL_EXPIRY)
            .putObjectRequest(putRequest)
            .build();

    var presigned = presigner.presignPutObject(presignRequest);
    return new PresignedUploadResult(
        presigned.url().toExternalForm(), key, URL_EXPIRY.toSeconds());
  }

  public PresignedDownloadResult generateDownloadUrl(String tenantPrefix, String key) {
    requireTenantKey(tenantPrefix, key);
    var getRequest = GetObjectRequest.builder().bucket(bucket()).key(key).build();

    var presignRequest =
        GetObjectPresignRequest.builder()
            .signatureDuration(URL_EXPIRY)
            .getObjectRequest(getRequest)
            .build();

    var presigned = presigner.presignGetObject(presignRequest);
    return new PresignedDownloadResult(presigned.url().toExternalForm(), URL_EXPIRY.toSeconds());
  }

  static void requireTenantKey(String tenantPrefix, String key) {
    if (key == null || key.isBlank() || key.endsWith("/")) {
      throw new IllegalArgumentException("Invalid storage key: " + key);
    }
    if (key.startsWith("/") || key.contains("//") || key.contains("..")) {
      throw new IllegalArgumentException("Invalid storage key: " + key);
    }
    if (tenantPrefix != null && !key.startsWith(tenantPrefix)) {
      throw new IllegalArgumentException(
          "Storage key " + key + " is outside the tenant prefix " + tenantPrefix);
    }
  }

  private String bucket() {
    if (bucketName == null || bucketName.isBlank()) {
      throw new IllegalStateException("docex.storage.s3.bucket is not configured");
    }
    return bucketName;
  }

  public record PresignedUploadResult(String url, String key, long expiresInSeconds) {}

  public record PresignedDownloadResult(String url, long expiresInSeconds) {}
}
