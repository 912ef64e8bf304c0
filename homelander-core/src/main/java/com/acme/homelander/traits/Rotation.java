package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

public interface Rotation {

  record DegreesRange(double rotationDegreesMin, double rotationDegreesMax) {}

  default Optional<Boolean> supportsDegrees() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsPercent() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<DegreesRange> rotationDegreesRange() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsContinuousRotation() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> commandOnlyRotation() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> rotationDegrees() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> rotationPercent() throws CapabilityException {
    return Optional.empty();
  }

  void rotateToDegrees(double degrees) throws CapabilityException;

  void rotateToPercent(double percent) throws CapabilityException;
}
