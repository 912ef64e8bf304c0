package com.acme.homelander.fulfillment.request;

import java.util.List;

public record ExecuteRequest(List<CommandGroup> commands) {
  public ExecuteRequest {
    commands = commands == null ? List.of() : List.copyOf(commands);
  }
}
