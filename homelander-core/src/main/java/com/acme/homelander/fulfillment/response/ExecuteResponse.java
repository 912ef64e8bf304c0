package com.acme.homelander.fulfillment.response;

import java.util.List;

public record ExecuteResponse(String errorCode, String debugString, List<CommandResult> commands)
    implements ResponsePayload {

  public static ExecuteResponse of(List<CommandResult> commands) {
    return new ExecuteResponse(null, null, List.copyOf(commands));
  }
}
