package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import java.util.List;
import java.util.Optional;

/** Batteries and other energy stores, rechargeable or not. */
public interface EnergyStorage {

  enum DistanceUnit {
    KILOMETERS,
    MILES
  }

  enum CapacityUnit {
    SECONDS,
    MILES,
    KILOMETERS,
    PERCENTAGE,
    KILOWATT_HOURS
  }

  enum CapacityState {
    CRITICALLY_LOW,
    LOW,
    MEDIUM,
    HIGH,
    FULL
  }

  record Capacity(int rawValue, CapacityUnit unit) {}

  enum ErrorCode implements SerializableError {
    DEVICE_UNPLUGGED("deviceUnplugged");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  default Optional<Boolean> queryOnlyEnergyStorage() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<DistanceUnit> energyStorageDistanceUnitForUX() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> isRechargeable() throws CapabilityException {
    return Optional.empty();
  }

  CapacityState descriptiveCapacityRemaining() throws CapabilityException;

  default Optional<List<Capacity>> capacityRemaining() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<List<Capacity>> capacityUntilFull() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> isCharging() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> isPluggedIn() throws CapabilityException {
    return Optional.empty();
  }

  void charge(boolean charge) throws CapabilityException;
}
