package com.acme.homelander.error;

/**
 * A failure that is reported verbatim to the caller as a protocol error code. Capability error
 * vocabularies and the generic device vocabularies implement this.
 */
public interface SerializableError {

  /** The protocol error code, e.g. {@code alreadyLocked}. */
  String errorCode();

  /** Wrap this error so a capability operation can throw it. */
  default DomainErrorException toException() {
    return new DomainErrorException(this);
  }
}
