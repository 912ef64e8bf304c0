package com.acme.homelander.device;

public record DeviceInfo(String manufacturer, String model, String hwVersion, String swVersion) {}
