package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;

public interface SoftwareUpdate {

  long lastSoftwareUpdateUnixTimestampSec() throws CapabilityException;

  void softwareUpdate() throws CapabilityException;
}
