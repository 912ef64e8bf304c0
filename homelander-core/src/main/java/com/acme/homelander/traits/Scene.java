package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

public interface Scene {

  default Optional<Boolean> sceneReversible() throws CapabilityException {
    return Optional.empty();
  }

  void activate() throws CapabilityException;

  /** Only reached when {@link #sceneReversible()} is true. */
  void deactivate() throws CapabilityException;
}
