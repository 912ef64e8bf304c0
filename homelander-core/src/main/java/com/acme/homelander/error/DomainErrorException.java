package com.acme.homelander.error;

public class DomainErrorException extends CapabilityException {
  private final SerializableError error;

  public DomainErrorException(SerializableError error) {
    super(error.errorCode());
    this.error = error;
  }

  public SerializableError error() {
    return error;
  }
}
