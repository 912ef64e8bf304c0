package com.acme.homelander.device;

import com.acme.homelander.error.CapabilityException;

@FunctionalInterface
public interface CapabilityCall<C, R> {
  R call(C capability) throws CapabilityException;
}
