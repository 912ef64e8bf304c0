package com.acme.homelander.device;

import com.acme.homelander.error.CapabilityException;

@FunctionalInterface
public interface CapabilityAction<C> {
  void run(C capability) throws CapabilityException;
}
