package io.docex.tenancy.setupstatus;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/setup")
public class SetupStatusController {

  private final SetupStatusService setupStatusService;

  public SetupStatusController(SetupStatusService setupStatusService) {
    this.setupStatusService = setupStatusService;
  }

  @GetMapping
  public ResponseEntity<SetupStatus> getSetupStatus(
      @RequestParam(name = "tenantId", required = false) String tenantId) {
    return ResponseEntity.ok(SetupStatus.of(setupStatusService.getSetupErrors(tenantId)));
  }
}
