package com.acme.homelander.error;

/**
 * Checked failure of a capability operation. Either a {@link DomainErrorException}, reported to
 * the caller by its error code, or an {@link InfrastructureException}, which never leaves the
 * process except as a debug string.
 */
public abstract class CapabilityException extends Exception {
  protected CapabilityException(String message) {
    super(message);
  }

  protected CapabilityException(String message, Throwable cause) {
    super(message, cause);
  }
}
