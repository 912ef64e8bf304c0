package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

public interface Brightness {

  default Optional<Boolean> commandOnlyBrightness() throws CapabilityException {
    return Optional.empty();
  }

  /** Current brightness, 0 to 100. */
  int brightness() throws CapabilityException;

  void setBrightness(int brightness) throws CapabilityException;

  void adjustBrightnessPercent(int relativePercent) throws CapabilityException;

  /** Adjust by a number of steps, negative to dim. */
  void adjustBrightnessWeight(int relativeWeight) throws CapabilityException;
}
