package com.acme.homelander.cli.demo;

import com.acme.homelander.config.HomelanderConfig;
import com.acme.homelander.device.Device;
import com.acme.homelander.device.DeviceType;
import com.acme.homelander.device.Trait;
import com.acme.homelander.fulfillment.Homelander;

/**
 * In-memory home served by the CLI: a kitchen switch, a living room light and the front door lock.
 */
public final class DemoHome {
    public static final String SWITCH_ID = "switch-1";
    public static final String LIGHT_ID = "light-1";
    public static final String LOCK_ID = "door-1";

    private DemoHome() {
    }

    public static Homelander create(HomelanderConfig config, boolean lockJammed) {
        Homelander homelander = new Homelander(config);

        homelander.addDevice(new Device<>(SWITCH_ID, DeviceType.SWITCH, new DemoSwitch())
                .register(Trait.ON_OFF));
        homelander.addDevice(new Device<>(LIGHT_ID, DeviceType.LIGHT, new DemoLight())
                .register(Trait.ON_OFF, Trait.BRIGHTNESS, Trait.COLOR_SETTING));

        DemoLock lock = new DemoLock();
        lock.setJammed(lockJammed);
        homelander.addDevice(new Device<>(LOCK_ID, DeviceType.LOCK, lock)
                .register(Trait.LOCK_UNLOCK));
        return homelander;
    }
}
