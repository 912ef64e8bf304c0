package com.acme.homelander.state;

import com.acme.homelander.device.CapabilityHandle;
import com.acme.homelander.error.CapabilityException;
import java.util.Map;

/** Writes the fields one capability adds to a state or attribute fragment. */
@FunctionalInterface
public interface FragmentContributor<C> {
  void contribute(CapabilityHandle<C> capability, Map<String, Object> fragment)
      throws CapabilityException;
}
