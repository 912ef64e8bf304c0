package com.acme.homelander.device;

import java.util.Optional;

/**
 * Identity contract every exposed device implements, whatever capabilities it registers. Calls
 * are made one at a time with exclusive access to the device.
 */
public interface GoogleHomeDevice {

  DeviceName deviceName();

  DeviceInfo deviceInfo();

  /** Whether the device pushes its state through Report State. */
  boolean willReportState();

  boolean isOnline();

  default Optional<String> roomHint() {
    return Optional.empty();
  }

  /** Called when the device is removed from the home or the user unlinks the account. */
  default void disconnect() {}
}
