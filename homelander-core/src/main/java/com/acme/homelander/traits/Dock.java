package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;

public interface Dock {

  boolean isDocked() throws CapabilityException;

  void dock() throws CapabilityException;
}
