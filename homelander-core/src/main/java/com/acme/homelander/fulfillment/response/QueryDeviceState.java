package com.acme.homelander.fulfillment.response;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * QUERY result of one device. Serializes as a flat object: status, online, on, the optional error
 * code, then the capability state. An {@code on} value in the capability state replaces the
 * default.
 */
public final class QueryDeviceState {
  private static final String ON = "on";

  private final QueryStatus status;
  private final boolean online;
  private final boolean on;
  private final String errorCode;
  private final Map<String, Object> states;

  private QueryDeviceState(
      QueryStatus status, boolean online, boolean on, String errorCode, Map<String, Object> states) {
    this.status = status;
    this.online = online;
    this.on = on;
    this.errorCode = errorCode;
    this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
  }

  public static QueryDeviceState success(Map<String, Object> states) {
    Map<String, Object> rest = new LinkedHashMap<>(states);
    Object on = rest.remove(ON);
    return new QueryDeviceState(
        QueryStatus.SUCCESS, true, on == null || Boolean.TRUE.equals(on), null, rest);
  }

  /** The protocol requires {@code on}; offline devices report the default. */
  public static QueryDeviceState offline() {
    return new QueryDeviceState(QueryStatus.OFFLINE, false, true, null, Map.of());
  }

  public static QueryDeviceState error(boolean online, String errorCode) {
    return new QueryDeviceState(QueryStatus.ERROR, online, false, errorCode, Map.of());
  }

  public QueryStatus status() {
    return status;
  }

  public boolean online() {
    return online;
  }

  public boolean on() {
    return on;
  }

  public String errorCode() {
    return errorCode;
  }

  /** Capability state without {@code on}. */
  public Map<String, Object> states() {
    return states;
  }

  @JsonValue
  public Map<String, Object> toWire() {
    Map<String, Object> wire = new LinkedHashMap<>();
    wire.put("status", status);
    wire.put("online", online);
    wire.put(ON, on);
    if (errorCode != null) {
      wire.put("errorCode", errorCode);
    }
    wire.putAll(states);
    return wire;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryDeviceState other)) {
      return false;
    }
    return status == other.status
        && online == other.online
        && on == other.on
        && Objects.equals(errorCode, other.errorCode)
        && states.equals(other.states);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, online, on, errorCode, states);
  }

  @Override
  public String toString() {
    return "QueryDeviceState" + toWire();
  }
}
