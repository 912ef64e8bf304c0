package com.acme.homelander.fulfillment.response;

import java.util.List;

public record SyncResponse(
    String agentUserId, String errorCode, String debugString, List<SyncDevice> devices)
    implements ResponsePayload {

  public static SyncResponse of(String agentUserId, List<SyncDevice> devices) {
    return new SyncResponse(agentUserId, null, null, List.copyOf(devices));
  }

  /** Whole-response failure: no devices, one error code for the lot. */
  public static SyncResponse failed(String agentUserId, String errorCode, String debugString) {
    return new SyncResponse(agentUserId, errorCode, debugString, List.of());
  }
}
