package com.acme.homelander.command;

public enum ExecuteStatus {
  SUCCESS,
  PENDING,
  OFFLINE,
  EXCEPTIONS,
  ERROR
}
