package com.acme.homelander.command;

import com.acme.homelander.core.Jsons;
import com.acme.homelander.fulfillment.request.CommandGroup;
import com.acme.homelander.fulfillment.request.DeviceRef;
import com.acme.homelander.traits.CameraStream;
import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.Language;
import com.acme.homelander.traits.OpenClose;
import com.acme.homelander.traits.TemperatureSetting;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CommandCodec, exercised through the execution list of a command group
 */
class CommandCodecTest {

    private static Command readOne(String entry) throws Exception {
        String json = "{\"devices\":[{\"id\":\"d1\"}],\"execution\":[" + entry + "]}";
        CommandGroup group = Jsons.mapper().readValue(json, CommandGroup.class);
        assertThat(group.execution()).hasSize(1);
        return group.execution().get(0);
    }

    @Nested
    @DisplayName("Deserialization Tests")
    class DeserializationTests {

        @Test
        @DisplayName("deserialize - should read OnOff params")
        void testOnOff() throws Exception {
            Command command = readOne(
                    "{\"command\":\"action.devices.commands.OnOff\",\"params\":{\"on\":true}}");

            assertThat(command).isEqualTo(new Command.OnOff(true));
        }

        @Test
        @DisplayName("deserialize - should treat missing params as empty")
        void testMissingParams() throws Exception {
            assertThat(readOne("{\"command\":\"action.devices.commands.Dock\"}"))
                    .isEqualTo(new Command.Dock());
            assertThat(readOne("{\"command\":\"action.devices.commands.BrightnessRelative\",\"params\":null}"))
                    .isEqualTo(new Command.BrightnessRelative(null, null));
        }

        @Test
        @DisplayName("deserialize - should reject an unknown command name")
        void testUnknownCommand() {
            assertThatThrownBy(() -> readOne("{\"command\":\"action.devices.commands.Teleport\",\"params\":{}}"))
                    .isInstanceOf(InvalidTypeIdException.class)
                    .hasMessageContaining("Teleport");
        }

        @Test
        @DisplayName("deserialize - should reject an entry without a command name")
        void testMissingCommandName() {
            assertThatThrownBy(() -> readOne("{\"params\":{\"on\":true}}"))
                    .isInstanceOf(MismatchedInputException.class);
        }

        @Test
        @DisplayName("deserialize - should read the capitalized camera stream fields")
        void testCameraStream() throws Exception {
            Command command = readOne("{\"command\":\"action.devices.commands.GetCameraStream\","
                    + "\"params\":{\"StreamToChromecast\":true,"
                    + "\"SupportedStreamProtocols\":[\"hls\",\"webrtc\"]}}");

            assertThat(command).isEqualTo(new Command.GetCameraStream(
                    true, List.of(CameraStream.Protocol.HLS, CameraStream.Protocol.WEB_RTC)));
        }

        @Test
        @DisplayName("deserialize - should read wire names of nested enums")
        void testEnumWireNames() throws Exception {
            assertThat(readOne("{\"command\":\"action.devices.commands.ThermostatSetMode\","
                    + "\"params\":{\"thermostatMode\":\"fan-only\"}}"))
                    .isEqualTo(new Command.ThermostatSetMode(TemperatureSetting.ThermostatMode.FAN_ONLY));
            assertThat(readOne("{\"command\":\"action.devices.commands.Locate\","
                    + "\"params\":{\"silence\":false,\"lang\":\"pt-BR\"}}"))
                    .isEqualTo(new Command.Locate(false, Language.PORTUGUESE_BRAZILIAN));
            assertThat(readOne("{\"command\":\"action.devices.commands.OpenClose\","
                    + "\"params\":{\"openPercent\":40,\"openDirection\":\"UP\"}}"))
                    .isEqualTo(new Command.OpenClose(40.0, OpenClose.Direction.UP));
        }

        @Test
        @DisplayName("deserialize - should read color spectrum keys")
        void testColorAbsolute() throws Exception {
            Command command = readOne("{\"command\":\"action.devices.commands.ColorAbsolute\","
                    + "\"params\":{\"color\":{\"name\":\"red\",\"spectrumRGB\":16711680}}}");

            assertThat(command).isEqualTo(new Command.ColorAbsolute(
                    new ColorSetting.ColorCommand("red", null, 16711680, null)));
        }

        @Test
        @DisplayName("deserialize - should read several commands in order")
        void testSeveralCommands() throws Exception {
            String json = "{\"devices\":[{\"id\":\"d1\"},{\"id\":\"d2\"}],\"execution\":["
                    + "{\"command\":\"action.devices.commands.OnOff\",\"params\":{\"on\":false}},"
                    + "{\"command\":\"action.devices.commands.BrightnessAbsolute\",\"params\":{\"brightness\":30}}]}";

            CommandGroup group = Jsons.mapper().readValue(json, CommandGroup.class);

            assertThat(group.devices()).extracting(DeviceRef::id).containsExactly("d1", "d2");
            assertThat(group.execution())
                    .containsExactly(new Command.OnOff(false), new Command.BrightnessAbsolute(30));
        }
    }

    @Nested
    @DisplayName("Serialization Tests")
    class SerializationTests {

        @Test
        @DisplayName("serialize - should write command name and params")
        void testSerialize() {
            CommandGroup group = new CommandGroup(
                    List.of(DeviceRef.of("d1")), List.of(new Command.SetVolume(7), new Command.Reboot()));

            JsonNode execution = Jsons.toTree(group).get("execution");

            assertThat(execution.get(0).get("command").asText())
                    .isEqualTo("action.devices.commands.setVolume");
            assertThat(execution.get(0).get("params").get("volumeLevel").asInt()).isEqualTo(7);
            assertThat(execution.get(1).get("command").asText())
                    .isEqualTo("action.devices.commands.Reboot");
            assertThat(execution.get(1).get("params").isObject()).isTrue();
            assertThat(execution.get(1).get("params").size()).isZero();
        }
    }
}
