package com.acme.homelander.error;

/**
 * Outcome of a failed capability call folded into the two reporting levels: a serializable error
 * the caller sees, or a server fault the caller only sees as offline.
 */
public sealed interface ExecuteError {

  record Serializable(SerializableError error) implements ExecuteError {}

  record Server(String debugString) implements ExecuteError {}

  /**
   * Classify a failure raised by a capability implementation. Anything other than a domain error
   * counts as a server fault.
   */
  static ExecuteError from(Exception e) {
    if (e instanceof DomainErrorException domain) {
      return new Serializable(domain.error());
    }
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return new Server(message);
  }
}
