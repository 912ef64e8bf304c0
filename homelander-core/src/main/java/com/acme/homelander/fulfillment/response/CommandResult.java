package com.acme.homelander.fulfillment.response;

import com.acme.homelander.command.CommandOutput;
import com.acme.homelander.command.ExecuteStatus;
import java.util.List;
import java.util.Map;

/** One EXECUTE result entry. Always carries a single id. */
public record CommandResult(
    List<String> ids,
    ExecuteStatus status,
    Map<String, Object> states,
    String errorCode,
    String debugString) {

  public static CommandResult from(CommandOutput output) {
    return new CommandResult(
        List.of(output.id()),
        output.status(),
        output.states(),
        output.error() == null ? null : output.error().errorCode(),
        output.debugString());
  }
}
