package com.acme.homelander.cli.demo;

import com.acme.homelander.device.DeviceName;
import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.DeviceErrorCode;
import com.acme.homelander.traits.Brightness;
import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.OnOff;

import java.util.List;
import java.util.Optional;

/**
 * Dimmable color bulb. Brightness outside 0..100 and color temperatures outside the supported
 * range are rejected with {@code valueOutOfRange}.
 */
public class DemoLight extends DemoDevice implements OnOff, Brightness, ColorSetting {
    private static final TemperatureRange RANGE = new TemperatureRange(2000, 6500);

    private boolean on;
    private int brightness = 80;
    private Color color = Color.temperature(2700);

    public DemoLight() {
        super(new DeviceName(List.of("Color Bulb"), "Living room light", List.of()), "bulb-c2", "Living Room");
    }

    @Override
    public boolean isOn() {
        return on;
    }

    @Override
    public void setOn(boolean on) {
        this.on = on;
    }

    @Override
    public int brightness() {
        return brightness;
    }

    @Override
    public void setBrightness(int brightness) throws CapabilityException {
        if (brightness < 0 || brightness > 100) {
            throw DeviceErrorCode.VALUE_OUT_OF_RANGE.toException();
        }
        this.brightness = brightness;
    }

    @Override
    public void adjustBrightnessPercent(int relativePercent) throws CapabilityException {
        setBrightness(Math.max(0, Math.min(100, brightness + relativePercent)));
    }

    @Override
    public void adjustBrightnessWeight(int relativeWeight) throws CapabilityException {
        adjustBrightnessPercent(relativeWeight * 10);
    }

    @Override
    public Optional<ColorModel> colorModel() {
        return Optional.of(ColorModel.RGB);
    }

    @Override
    public Optional<TemperatureRange> colorTemperatureRange() {
        return Optional.of(RANGE);
    }

    @Override
    public Color color() {
        return color;
    }

    @Override
    public void setColor(ColorCommand command) throws CapabilityException {
        if (command.temperature() != null) {
            int kelvin = command.temperature();
            if (kelvin < RANGE.temperatureMinK() || kelvin > RANGE.temperatureMaxK()) {
                throw DeviceErrorCode.VALUE_OUT_OF_RANGE.toException();
            }
            color = Color.temperature(kelvin);
        } else if (command.spectrumRgb() != null) {
            color = Color.rgb(command.spectrumRgb());
        } else if (command.spectrumHsv() != null) {
            color = Color.hsv(command.spectrumHsv());
        } else {
            throw DeviceErrorCode.NOT_SUPPORTED.toException();
        }
    }
}
