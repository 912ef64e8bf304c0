package com.acme.homelander.device;

import java.util.Optional;

/** Snapshot of a device's identity metadata. Each field was read with its own acquisition. */
public record DeviceIdentity(
    DeviceName name,
    DeviceInfo info,
    boolean willReportState,
    Optional<String> roomHint,
    boolean online) {}
