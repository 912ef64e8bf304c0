package com.acme.homelander.fulfillment.request;

import java.util.Map;

/** A device addressed by a request. Custom data is carried through untouched. */
public record DeviceRef(String id, Map<String, Object> customData) {
  public static DeviceRef of(String id) {
    return new DeviceRef(id, null);
  }
}
