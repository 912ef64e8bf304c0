package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Fans with named speed settings, a percentage speed, or both. Reversible fans also accept the
 * Reverse command.
 */
public interface FanSpeed {

  record SpeedName(@JsonProperty("speed_synonym") List<String> speedSynonym, Language lang) {}

  record Speed(
      @JsonProperty("speed_name") String speedName,
      @JsonProperty("speed_values") List<SpeedName> speedValues) {}

  record Speeds(List<Speed> speeds, boolean ordered) {}

  enum ErrorCode implements SerializableError {
    MAX_SPEED_REACHED("maxSpeedReached"),
    MIN_SPEED_REACHED("minSpeedReached");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  default Optional<Boolean> reversible() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> commandOnlyFanSpeed() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Speeds> availableFanSpeeds() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsFanSpeedPercent() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<String> currentFanSpeedSetting() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Integer> currentFanSpeedPercent() throws CapabilityException {
    return Optional.empty();
  }

  void setFanSpeedSetting(String speedName) throws CapabilityException;

  void setFanSpeedPercent(int percent) throws CapabilityException;

  void adjustFanSpeedWeight(int relativeWeight) throws CapabilityException;

  void adjustFanSpeedPercent(int relativePercent) throws CapabilityException;

  void reverse() throws CapabilityException;
}
