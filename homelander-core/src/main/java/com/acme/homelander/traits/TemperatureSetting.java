package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Optional;

/**
 * Thermostats. A thermostat reports either a single setpoint or a high/low range, depending on
 * its current mode.
 */
public interface TemperatureSetting {

  enum ThermostatMode {
    OFF("off"),
    HEAT("heat"),
    COOL("cool"),
    ON("on"),
    HEATCOOL("heatcool"),
    AUTO("auto"),
    FAN_ONLY("fan-only"),
    PURIFIER("purifier"),
    ECO("eco"),
    DRY("dry");

    private final String wireName;

    ThermostatMode(String wireName) {
      this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
      return wireName;
    }
  }

  record ThermostatRange(double minThresholdCelsius, double maxThresholdCelsius) {}

  sealed interface ThermostatState permits FixedSetpoint, RangeSetpoint {}

  record FixedSetpoint(
      ThermostatMode thermostatMode,
      Double thermostatTemperatureAmbient,
      double thermostatTemperatureSetpoint)
      implements ThermostatState {}

  record RangeSetpoint(
      ThermostatMode thermostatMode,
      Double thermostatTemperatureAmbient,
      double thermostatTemperatureSetpointHigh,
      double thermostatTemperatureSetpointLow)
      implements ThermostatState {}

  List<ThermostatMode> availableThermostatModes() throws CapabilityException;

  default Optional<ThermostatRange> thermostatTemperatureRange() throws CapabilityException {
    return Optional.empty();
  }

  TemperatureUnit thermostatTemperatureUnit() throws CapabilityException;

  /** Minimum distance between high and low setpoints in heatcool mode. */
  default Optional<Double> bufferRangeCelsius() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> commandOnlyTemperatureSetting() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> queryOnlyTemperatureSetting() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<ThermostatMode> activeThermostatMode() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Long> targetTempReachedEstimateUnixTimestampSec()
      throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> thermostatHumidityAmbient() throws CapabilityException {
    return Optional.empty();
  }

  ThermostatState thermostatState() throws CapabilityException;

  void setThermostatSetpoint(double celsius) throws CapabilityException;

  void setThermostatRange(double highCelsius, double lowCelsius) throws CapabilityException;

  void setThermostatMode(ThermostatMode mode) throws CapabilityException;

  void adjustSetpointDegrees(double degrees) throws CapabilityException;

  void adjustSetpointWeight(int weight) throws CapabilityException;
}
