package com.acme.homelander.fulfillment.request;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** One intent of a request, discriminated by its {@code intent} field. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "intent")
@JsonSubTypes({
  @JsonSubTypes.Type(value = Input.Sync.class, name = Input.SYNC),
  @JsonSubTypes.Type(value = Input.Query.class, name = Input.QUERY),
  @JsonSubTypes.Type(value = Input.Execute.class, name = Input.EXECUTE),
  @JsonSubTypes.Type(value = Input.Disconnect.class, name = Input.DISCONNECT)
})
public sealed interface Input {
  String SYNC = "action.devices.SYNC";
  String QUERY = "action.devices.QUERY";
  String EXECUTE = "action.devices.EXECUTE";
  String DISCONNECT = "action.devices.DISCONNECT";

  record Sync() implements Input {}

  record Query(QueryRequest payload) implements Input {}

  record Execute(ExecuteRequest payload) implements Input {}

  record Disconnect() implements Input {}
}
