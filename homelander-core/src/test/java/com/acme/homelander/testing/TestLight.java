package com.acme.homelander.testing;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.traits.Brightness;
import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.OnOff;

import java.util.Optional;

/**
 * Dimmable color light. A failure set through {@link #failWith} is thrown by every color getter.
 */
public class TestLight extends TestDevice implements OnOff, Brightness, ColorSetting {

    private boolean on;
    private int brightness = 50;
    private Color color = Color.temperature(2700);
    private CapabilityException failure;

    public TestLight(String name) {
        super(name);
    }

    public void failWith(CapabilityException failure) {
        this.failure = failure;
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
    public void setBrightness(int brightness) {
        this.brightness = brightness;
    }

    @Override
    public void adjustBrightnessPercent(int relativePercent) {
        brightness = Math.max(0, Math.min(100, brightness + relativePercent));
    }

    @Override
    public void adjustBrightnessWeight(int relativeWeight) {
        adjustBrightnessPercent(relativeWeight * 10);
    }

    @Override
    public Optional<ColorModel> colorModel() throws CapabilityException {
        fail();
        return Optional.of(ColorModel.RGB);
    }

    @Override
    public Optional<TemperatureRange> colorTemperatureRange() throws CapabilityException {
        fail();
        return Optional.of(new TemperatureRange(2000, 6500));
    }

    @Override
    public Color color() throws CapabilityException {
        fail();
        return color;
    }

    @Override
    public void setColor(ColorCommand command) {
        if (command.spectrumRgb() != null) {
            color = Color.rgb(command.spectrumRgb());
        } else if (command.spectrumHsv() != null) {
            color = Color.hsv(command.spectrumHsv());
        } else if (command.temperature() != null) {
            color = Color.temperature(command.temperature());
        }
    }

    private void fail() throws CapabilityException {
        if (failure != null) {
            throw failure;
        }
    }
}
