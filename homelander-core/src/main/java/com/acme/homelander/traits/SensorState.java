package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.List;

public interface SensorState {

  record DescriptiveCapabilities(List<String> availableStates) {}

  record NumericCapabilities(String rawValueUnit) {}

  record SupportedSensor(
      String name,
      DescriptiveCapabilities descriptiveCapabilities,
      NumericCapabilities numericCapabilities) {}

  record SensorReading(String name, String currentSensorState, Double rawValue) {}

  List<SupportedSensor> sensorStatesSupported() throws CapabilityException;

  List<SensorReading> currentSensorStateData() throws CapabilityException;
}
