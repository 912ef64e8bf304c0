package com.acme.homelander.error;

import com.acme.homelander.device.Trait;

/**
 * A command was routed to a device that never registered the capability it needs. This is an
 * integration bug and is never turned into a per-command result.
 */
public class UnsupportedCapabilityException extends IllegalStateException {
  private final String deviceId;
  private final Trait trait;

  public UnsupportedCapabilityException(String deviceId, Trait trait) {
    super("Device " + deviceId + " does not register capability " + trait.wireName());
    this.deviceId = deviceId;
    this.trait = trait;
  }

  public String deviceId() {
    return deviceId;
  }

  public Trait trait() {
    return trait;
  }
}
