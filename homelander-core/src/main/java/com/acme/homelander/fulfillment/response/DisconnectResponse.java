package com.acme.homelander.fulfillment.response;

/** DISCONNECT has nothing to report. Serializes as an empty object. */
public record DisconnectResponse() implements ResponsePayload {}
