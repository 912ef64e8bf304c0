package com.acme.homelander.cli.demo;

import com.acme.homelander.device.DeviceName;
import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.traits.LockUnlock;

import java.util.List;
import java.util.Optional;

public class DemoLock extends DemoDevice implements LockUnlock {

    private boolean locked = true;
    private boolean jammed;

    public DemoLock() {
        super(new DeviceName(List.of("Smart Lock"), "Front door", List.of("front lock")), "lock-d3", "Hallway");
    }

    public void setJammed(boolean jammed) {
        this.jammed = jammed;
    }

    @Override
    public boolean isLocked() {
        return locked;
    }

    @Override
    public Optional<Boolean> isJammed() {
        return Optional.of(jammed);
    }

    @Override
    public void setLocked(boolean lock) throws CapabilityException {
        if (jammed) {
            throw ErrorCode.DEVICE_JAMMING_DETECTED.toException();
        }
        if (lock == locked) {
            throw (lock ? ErrorCode.ALREADY_LOCKED : ErrorCode.ALREADY_UNLOCKED).toException();
        }
        locked = lock;
    }
}
