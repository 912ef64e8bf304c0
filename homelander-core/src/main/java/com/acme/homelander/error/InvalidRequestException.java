package com.acme.homelander.error;

/** The request could not be read or carries nothing to act on. */
public class InvalidRequestException extends RuntimeException {
  public InvalidRequestException(String message) {
    super(message);
  }

  public InvalidRequestException(String message, Throwable e) {
    super(message, e);
  }
}
