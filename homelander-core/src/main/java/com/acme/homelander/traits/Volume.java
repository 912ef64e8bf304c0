package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

public interface Volume {

  int volumeMaxLevel() throws CapabilityException;

  boolean volumeCanMuteAndUnmute() throws CapabilityException;

  default Optional<Integer> volumeDefaultPercentage() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Integer> levelStepSize() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> commandOnlyVolume() throws CapabilityException {
    return Optional.empty();
  }

  int currentVolume() throws CapabilityException;

  default Optional<Boolean> isMuted() throws CapabilityException {
    return Optional.empty();
  }

  void mute(boolean mute) throws CapabilityException;

  void setVolume(int level) throws CapabilityException;

  void adjustVolume(int relativeSteps) throws CapabilityException;
}
