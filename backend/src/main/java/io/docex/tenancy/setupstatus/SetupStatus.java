package io.docex.tenancy.setupstatus;

import java.util.List;

public record SetupStatus(boolean ready, List<String> errors) {

  public static SetupStatus of(List<String> errors) {
    return new SetupStatus(errors.isEmpty(), List.copyOf(errors));
  }
}
