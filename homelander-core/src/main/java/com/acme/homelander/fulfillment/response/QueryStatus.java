package com.acme.homelander.fulfillment.response;

public enum QueryStatus {
  SUCCESS,
  OFFLINE,
  EXCEPTIONS,
  ERROR
}
