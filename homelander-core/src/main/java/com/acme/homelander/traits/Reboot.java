package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;

public interface Reboot {

  void reboot() throws CapabilityException;
}
