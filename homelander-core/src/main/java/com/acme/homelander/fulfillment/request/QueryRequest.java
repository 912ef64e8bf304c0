package com.acme.homelander.fulfillment.request;

import java.util.List;

public record QueryRequest(List<DeviceRef> devices) {
  public QueryRequest {
    devices = devices == null ? List.of() : List.copyOf(devices);
  }
}
