package com.acme.homelander.fulfillment.response;

import com.acme.homelander.device.DeviceInfo;
import com.acme.homelander.device.DeviceName;
import com.acme.homelander.device.DeviceType;
import com.acme.homelander.device.Trait;
import java.util.List;
import java.util.Map;

public record SyncDevice(
    String id,
    DeviceType type,
    List<Trait> traits,
    DeviceName name,
    boolean willReportState,
    String roomHint,
    DeviceInfo deviceInfo,
    Map<String, Object> attributes) {}
