package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Optional;

public interface LightEffects {

  enum EffectType {
    COLOR_LOOP("colorLoop"),
    SLEEP("sleep"),
    WAKE("wake");

    private final String wireName;

    EffectType(String wireName) {
      this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
      return wireName;
    }
  }

  default Optional<Integer> defaultColorLoopDuration() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Integer> defaultSleepDuration() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Integer> defaultWakeDuration() throws CapabilityException {
    return Optional.empty();
  }

  List<EffectType> supportedEffects() throws CapabilityException;

  Optional<EffectType> activeLightEffect() throws CapabilityException;

  default Optional<Long> lightEffectEndUnixTimestampSec() throws CapabilityException {
    return Optional.empty();
  }

  /** Durations are in seconds; null means the device default. */
  void colorLoop(Integer duration) throws CapabilityException;

  void sleep(Integer duration) throws CapabilityException;

  void wake(Integer duration) throws CapabilityException;

  void stopEffect() throws CapabilityException;
}
