package com.acme.homelander.cli.demo;

import com.acme.homelander.device.DeviceName;
import com.acme.homelander.traits.OnOff;

import java.util.List;

public class DemoSwitch extends DemoDevice implements OnOff {

    private boolean on;

    public DemoSwitch() {
        super(new DeviceName(List.of("Smart Plug"), "Kitchen switch", List.of("kettle")), "plug-s1", "Kitchen");
    }

    @Override
    public boolean isOn() {
        return on;
    }

    @Override
    public void setOn(boolean on) {
        this.on = on;
    }
}
