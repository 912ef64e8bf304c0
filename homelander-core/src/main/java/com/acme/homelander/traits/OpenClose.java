package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import java.util.List;
import java.util.Optional;

/**
 * Doors, blinds and other devices that open fully, partially, or in several directions. Devices
 * that open in one direction report {@link #openPercent()}; multi-direction devices report
 * {@link #openState()}.
 */
public interface OpenClose {

  enum Direction {
    UP,
    DOWN,
    LEFT,
    RIGHT,
    IN,
    OUT
  }

  record OpenState(double openPercent, Direction openDirection) {}

  enum ErrorCode implements SerializableError {
    LOCKED_STATE("lockedState"),
    DEVICE_JAMMING_DETECTED("deviceJammingDetected");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  default Optional<Boolean> discreteOnlyOpenClose() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<List<Direction>> openDirection() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> commandOnlyOpenClose() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> queryOnlyOpenClose() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> openPercent() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<List<OpenState>> openState() throws CapabilityException {
    return Optional.empty();
  }

  /** Direction is null for single-direction devices. */
  void setOpen(double percent, Direction direction) throws CapabilityException;

  void adjustOpen(double relativePercent, Direction direction) throws CapabilityException;
}
