package io.docex.tenancy.provisioning;

import io.docex.tenancy.exception.TenantNotFoundException;
import io.docex.tenancy.multitenancy.ConnectionRouter;
import io.docex.tenancy.multitenancy.IsolationStrategy;
import io.docex.tenancy.multitenancy.TenantRecord;
import io.docex.tenancy.multitenancy.TenantStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants")
public class ProvisioningController {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningController.class);

  private final BootstrapManager bootstrapManager;
  private final TenantProvisioner provisioner;
  private final ConnectionRouter router;

  public ProvisioningController(
      BootstrapManager bootstrapManager, TenantProvisioner provisioner, ConnectionRouter router) {
    this.bootstrapManager = bootstrapManager;
    this.provisioner = provisioner;
    this.router = router;
  }

  @PostMapping("/bootstrap")
  public ResponseEntity<TenantResponse> bootstrap(@Valid @RequestBody BootstrapRequest request) {
    log.info("Received bootstrap request from {}", request.createdBy());
    var record = bootstrapManager.initialize(request.createdBy());
    return ResponseEntity.ok(TenantResponse.from(record));
  }

  @PostMapping
  public ResponseEntity<TenantResponse> createTenant(
      @Valid @RequestBody CreateTenantRequest request) {
    log.info("Received provisioning request for tenant {}", request.tenantId());
    var strategy =
        request.isolationStrategy() == null || request.isolationStrategy().isBlank()
            ? null
            : IsolationStrategy.fromValue(request.isolationStrategy());
    var record =
        provisioner.create(
            request.tenantId(), request.displayName(), request.createdBy(), strategy);
    return ResponseEntity.created(URI.create("/internal/tenants/" + record.tenantId()))
        .body(TenantResponse.from(record));
  }

  @GetMapping
  public ResponseEntity<List<TenantResponse>> listTenants() {
    return ResponseEntity.ok(
        provisioner.listTenants().stream().map(TenantResponse::from).toList());
  }

  @GetMapping("/{tenantId}")
  public ResponseEntity<TenantResponse> getTenant(@PathVariable String tenantId) {
    return provisioner
        .findTenant(tenantId)
        .map(TenantResponse::from)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new TenantNotFoundException(tenantId));
  }

  @GetMapping("/{tenantId}/exists")
  public ResponseEntity<ExistsResponse> tenantExists(@PathVariable String tenantId) {
    return ResponseEntity.ok(new ExistsResponse(tenantId, provisioner.tenantExists(tenantId)));
  }

  @PutMapping("/{tenantId}/status")
  public ResponseEntity<TenantResponse> updateStatus(
      @PathVariable String tenantId, @Valid @RequestBody StatusUpdateRequest request) {
    var record = provisioner.updateStatus(tenantId, request.status(), request.updatedBy());
    if (record.status() == TenantStatus.SUSPENDED) {
      // Drop the pool so the next access re-reads the registry and is refused
      router.close(tenantId);
    }
    return ResponseEntity.ok(TenantResponse.from(record));
  }

  public record BootstrapRequest(@NotBlank(message = "createdBy is required") String createdBy) {}

  public record CreateTenantRequest(
      @NotBlank(message = "tenantId is required") String tenantId,
      String displayName,
      @NotBlank(message = "createdBy is required") String createdBy,
      String isolationStrategy) {}

  public record StatusUpdateRequest(
      @NotNull(message = "status is required") TenantStatus status,
      @NotBlank(message = "updatedBy is required") String updatedBy) {}

  public record ExistsResponse(String tenantId, boolean exists) {}

  public record TenantResponse(
      String tenantId,
      String displayName,
      boolean system,
      IsolationStrategy isolationStrategy,
      String schemaName,
      String databasePath,
      TenantStatus status,
      String createdBy,
      Instant createdAt) {

    static TenantResponse from(TenantRecord record) {
      return new TenantResponse(
          record.tenantId(),
          record.displayName(),
          record.system(),
          record.isolationStrategy(),
          record.schemaName(),
          record.databasePath(),
          record.status(),
          record.createdBy(),
          record.createdAt());
    }
  }
}
