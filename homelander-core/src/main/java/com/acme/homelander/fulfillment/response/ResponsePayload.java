package com.acme.homelander.fulfillment.response;

/** Intent-specific payload. Serialized as-is, without a discriminator. */
public sealed interface ResponsePayload
    permits SyncResponse, QueryResponse, ExecuteResponse, DisconnectResponse {}
