package com.acme.homelander.error;

/** Unexpected fault talking to the device: I/O, unreachable hardware, driver bugs. */
public class InfrastructureException extends CapabilityException {
  public InfrastructureException(String message) {
    super(message);
  }

  public InfrastructureException(String message, Throwable e) {
    super(message, e);
  }
}
