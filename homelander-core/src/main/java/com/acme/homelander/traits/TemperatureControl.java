package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

/** Devices that hold a temperature other than air temperature, such as ovens and kettles. */
public interface TemperatureControl {

  record TemperatureRange(double minThresholdCelsius, double maxThresholdCelsius) {}

  TemperatureRange temperatureRange() throws CapabilityException;

  default Optional<Double> temperatureStepCelsius() throws CapabilityException {
    return Optional.empty();
  }

  TemperatureUnit temperatureUnitForUX() throws CapabilityException;

  default Optional<Boolean> commandOnlyTemperatureControl() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> queryOnlyTemperatureControl() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> temperatureSetpointCelsius() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> temperatureAmbientCelsius() throws CapabilityException {
    return Optional.empty();
  }

  void setTemperature(double celsius) throws CapabilityException;
}
