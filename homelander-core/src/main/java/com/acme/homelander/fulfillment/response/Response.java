package com.acme.homelander.fulfillment.response;

public record Response(String requestId, ResponsePayload payload) {}
