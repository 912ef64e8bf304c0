package com.acme.homelander.cli.demo;

import com.acme.homelander.device.DeviceInfo;
import com.acme.homelander.device.DeviceName;
import com.acme.homelander.device.GoogleHomeDevice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Identity shared by the in-memory demo devices.
 */
abstract class DemoDevice implements GoogleHomeDevice {
    private static final Logger logger = LoggerFactory.getLogger(DemoDevice.class);

    private final DeviceName name;
    private final String model;
    private final String room;

    DemoDevice(DeviceName name, String model, String room) {
        this.name = name;
        this.model = model;
        this.room = room;
    }

    @Override
    public DeviceName deviceName() {
        return name;
    }

    @Override
    public DeviceInfo deviceInfo() {
        return new DeviceInfo("Homelander Demo", model, "1", "1.0.0");
    }

    @Override
    public boolean willReportState() {
        return false;
    }

    @Override
    public boolean isOnline() {
        return true;
    }

    @Override
    public Optional<String> roomHint() {
        return Optional.of(room);
    }

    @Override
    public void disconnect() {
        logger.info("Demo device {} disconnected", name.name());
    }
}
