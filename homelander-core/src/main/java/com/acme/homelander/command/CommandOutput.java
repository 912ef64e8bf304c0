package com.acme.homelander.command;

import com.acme.homelander.error.ExecuteError;
import com.acme.homelander.error.SerializableError;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one command against one device. Successful outputs carry a state fragment, errors
 * carry the serializable error, offline outputs carry at most a debug string.
 */
public record CommandOutput(
    String id,
    ExecuteStatus status,
    Map<String, Object> states,
    SerializableError error,
    String debugString) {

  public CommandOutput {
    states = states == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(states));
  }

  public static CommandOutput success(String id, Map<String, Object> states) {
    return new CommandOutput(id, ExecuteStatus.SUCCESS, states, null, null);
  }

  public static CommandOutput error(String id, SerializableError error) {
    return new CommandOutput(id, ExecuteStatus.ERROR, null, error, null);
  }

  public static CommandOutput offline(String id, String debugString) {
    return new CommandOutput(id, ExecuteStatus.OFFLINE, null, null, debugString);
  }

  public static CommandOutput from(String id, ExecuteError failure) {
    if (failure instanceof ExecuteError.Serializable serializable) {
      return error(id, serializable.error());
    }
    return offline(id, ((ExecuteError.Server) failure).debugString());
  }

  public boolean isSuccess() {
    return status == ExecuteStatus.SUCCESS;
  }
}
