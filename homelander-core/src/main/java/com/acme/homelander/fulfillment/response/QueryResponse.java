package com.acme.homelander.fulfillment.response;

import java.util.Map;

public record QueryResponse(
    String errorCode, String debugString, Map<String, QueryDeviceState> devices)
    implements ResponsePayload {

  public static QueryResponse of(Map<String, QueryDeviceState> devices) {
    return new QueryResponse(null, null, devices);
  }
}
