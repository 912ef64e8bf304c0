package com.acme.homelander.fulfillment.request;

import java.util.List;

/** Top-level fulfillment request: one request id and one or more intent inputs. */
public record Request(String requestId, List<Input> inputs) {
  public Request {
    inputs = inputs == null ? List.of() : List.copyOf(inputs);
  }
}
