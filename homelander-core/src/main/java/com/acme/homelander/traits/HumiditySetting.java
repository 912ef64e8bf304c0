package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

public interface HumiditySetting {

  record SetpointRange(int minPercent, int maxPercent) {}

  default Optional<SetpointRange> humiditySetpointRange() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> commandOnlyHumiditySetting() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> queryOnlyHumiditySetting() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Integer> humiditySetpointPercent() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Integer> humidityAmbientPercent() throws CapabilityException {
    return Optional.empty();
  }

  void setHumidity(int percent) throws CapabilityException;

  void adjustHumidityPercent(int relativePercent) throws CapabilityException;

  void adjustHumidityWeight(int relativeWeight) throws CapabilityException;
}
