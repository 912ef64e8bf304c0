package com.acme.homelander.core;

import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.TemperatureSetting;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JsonsTest {

    @Test
    @DisplayName("toJson - should leave out null fields")
    void testNullsOmitted() {
        String json = Jsons.toJson(ColorSetting.Color.rgb(0xFF0000));

        assertThat(json).isEqualTo("{\"spectrumRgb\":16711680}");
    }

    @Test
    @DisplayName("toMap - should flatten a record using wire names")
    void testToMap() {
        Map<String, Object> map = Jsons.toMap(new TemperatureSetting.FixedSetpoint(
                TemperatureSetting.ThermostatMode.FAN_ONLY, null, 21.0));

        assertThat(map)
                .containsEntry("thermostatMode", "fan-only")
                .containsEntry("thermostatTemperatureSetpoint", 21.0)
                .doesNotContainKey("thermostatTemperatureAmbient");
    }

    @Test
    @DisplayName("fromJson - should ignore unknown fields")
    void testUnknownFieldsIgnored() {
        ColorSetting.TemperatureRange range = Jsons.fromJson(
                "{\"temperatureMinK\":2000,\"temperatureMaxK\":6500,\"extra\":true}",
                ColorSetting.TemperatureRange.class);

        assertThat(range).isEqualTo(new ColorSetting.TemperatureRange(2000, 6500));
    }

    @Test
    @DisplayName("fromJson - should wrap parse failures")
    void testMalformed() {
        assertThatThrownBy(() -> Jsons.fromJson("{", Map.class))
                .isInstanceOf(RuntimeException.class);
    }
}
