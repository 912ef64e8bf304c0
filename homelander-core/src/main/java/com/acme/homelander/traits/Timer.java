package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

public interface Timer {

  int maxTimerLimitSec() throws CapabilityException;

  default Optional<Boolean> commandOnlyTimer() throws CapabilityException {
    return Optional.empty();
  }

  /** Seconds left on the running timer, empty when no timer is set. */
  Optional<Integer> timerRemainingSec() throws CapabilityException;

  default Optional<Boolean> timerPaused() throws CapabilityException {
    return Optional.empty();
  }

  void startTimer(int seconds) throws CapabilityException;

  void adjustTimer(int seconds) throws CapabilityException;

  void pauseTimer() throws CapabilityException;

  void resumeTimer() throws CapabilityException;

  void cancelTimer() throws CapabilityException;
}
