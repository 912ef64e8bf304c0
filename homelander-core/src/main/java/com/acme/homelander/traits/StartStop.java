package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.List;
import java.util.Optional;

/** Devices that start and stop, optionally in zones, and optionally pause. */
public interface StartStop {

  default Optional<Boolean> pausable() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<List<String>> availableZones() throws CapabilityException {
    return Optional.empty();
  }

  boolean isRunning() throws CapabilityException;

  default Optional<Boolean> isPaused() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<List<String>> activeZones() throws CapabilityException {
    return Optional.empty();
  }

  /** Zones is null when the whole device is targeted. */
  void startStop(boolean start, List<String> zones) throws CapabilityException;

  void pause(boolean pause) throws CapabilityException;
}
