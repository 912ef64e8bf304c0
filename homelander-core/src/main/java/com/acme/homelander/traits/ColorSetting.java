package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/** Lights that take a full spectrum color, a color temperature, or both. */
public interface ColorSetting {

  enum ColorModel {
    RGB("rgb"),
    HSV("hsv");

    private final String wireName;

    ColorModel(String wireName) {
      this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
      return wireName;
    }
  }

  record TemperatureRange(int temperatureMinK, int temperatureMaxK) {}

  record SpectrumHsv(double hue, double saturation, double value) {}

  /** Reported color. Exactly one of the fields is expected to be set. */
  record Color(Integer temperatureK, Integer spectrumRgb, SpectrumHsv spectrumHsv) {
    public static Color temperature(int kelvin) {
      return new Color(kelvin, null, null);
    }

    public static Color rgb(int rgb) {
      return new Color(null, rgb, null);
    }

    public static Color hsv(SpectrumHsv hsv) {
      return new Color(null, null, hsv);
    }
  }

  /** Requested color, as sent in ColorAbsolute. */
  record ColorCommand(
      String name,
      Integer temperature,
      @JsonProperty("spectrumRGB") Integer spectrumRgb,
      @JsonProperty("spectrumHSV") SpectrumHsv spectrumHsv) {}

  default Optional<Boolean> commandOnlyColorSetting() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<ColorModel> colorModel() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<TemperatureRange> colorTemperatureRange() throws CapabilityException {
    return Optional.empty();
  }

  Color color() throws CapabilityException;

  void setColor(ColorCommand color) throws CapabilityException;
}
