package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

public interface OnOff {

  default Optional<Boolean> commandOnlyOnOff() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> queryOnlyOnOff() throws CapabilityException {
    return Optional.empty();
  }

  boolean isOn() throws CapabilityException;

  void setOn(boolean on) throws CapabilityException;
}
