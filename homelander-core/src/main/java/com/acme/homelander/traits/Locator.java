package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;

/** Devices that can make themselves found, usually by ringing. */
public interface Locator {

  void locate(boolean silence, Language lang) throws CapabilityException;
}
