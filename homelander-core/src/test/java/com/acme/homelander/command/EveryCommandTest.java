package com.acme.homelander.command;

import com.acme.homelander.core.Jsons;
import com.acme.homelander.device.Device;
import com.acme.homelander.device.DeviceType;
import com.acme.homelander.device.Trait;
import com.acme.homelander.fulfillment.request.CommandGroup;
import com.acme.homelander.fulfillment.response.CommandResult;
import com.acme.homelander.testing.FullDevice;
import com.acme.homelander.traits.CameraStream;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Sends every catalogued command, with only its required params, to a device that registers every
 * capability.
 */
class EveryCommandTest {

    private static final Map<String, String> REQUIRED_PARAMS = Map.ofEntries(
            Map.entry("ArmDisarm", "{\"arm\":true}"),
            Map.entry("BrightnessAbsolute", "{\"brightness\":40}"),
            Map.entry("GetCameraStream",
                    "{\"StreamToChromecast\":false,\"SupportedStreamProtocols\":[\"hls\"]}"),
            Map.entry("relativeChannel", "{\"relativeChannelChange\":1}"),
            Map.entry("ColorAbsolute", "{\"color\":{\"temperature\":3000}}"),
            Map.entry("Cook", "{\"start\":true}"),
            Map.entry("Charge", "{\"charge\":true}"),
            Map.entry("Fill", "{\"fill\":true}"),
            Map.entry("SetHumidity", "{\"humidity\":45}"),
            Map.entry("SetInput", "{\"newInput\":\"hdmi_1\"}"),
            Map.entry("LockUnlock", "{\"lock\":true}"),
            Map.entry("SetModes", "{\"updateModeSettings\":{\"load\":\"small\"}}"),
            Map.entry("EnableDisableGuestNetwork", "{\"enable\":true}"),
            Map.entry("EnableDisableNetworkProfile", "{\"profile\":\"kids\",\"enable\":true}"),
            Map.entry("TestNetworkSpeed", "{\"testDownloadSpeed\":true,\"testUploadSpeed\":false}"),
            Map.entry("OnOff", "{\"on\":true}"),
            Map.entry("OpenClose", "{\"openPercent\":50}"),
            Map.entry("OpenCloseRelative", "{\"openRelativePercent\":10}"),
            Map.entry("StartStop", "{\"start\":true}"),
            Map.entry("PauseUnpause", "{\"pause\":true}"),
            Map.entry("SetTemperature", "{\"temperature\":180}"),
            Map.entry("ThermostatTemperatureSetpoint", "{\"thermostatTemperatureSetpoint\":21}"),
            Map.entry("ThermostatTemperatureSetRange",
                    "{\"thermostatTemperatureSetpointHigh\":24,\"thermostatTemperatureSetpointLow\":18}"),
            Map.entry("ThermostatSetMode", "{\"thermostatMode\":\"heat\"}"),
            Map.entry("TimerStart", "{\"timerTimeSec\":60}"),
            Map.entry("TimerAdjust", "{\"timerTimeSec\":30}"),
            Map.entry("SetToggles", "{\"updateToggleSettings\":{\"sterilization\":true}}"),
            Map.entry("mediaSeekRelative", "{\"relativePositionMs\":10000}"),
            Map.entry("mediaSeekToPosition", "{\"absPositionMs\":0}"),
            Map.entry("mediaRepeatMode", "{\"isOn\":true}"),
            Map.entry("mute", "{\"mute\":true}"),
            Map.entry("setVolume", "{\"volumeLevel\":20}"),
            Map.entry("volumeRelative", "{\"relativeSteps\":-1}"));

    private Device<FullDevice> device;
    private CommandDispatcher dispatcher;

    static Stream<String> commandNames() {
        return CommandCatalog.all().keySet().stream();
    }

    static Stream<String> commandsWithRequiredParams() {
        return REQUIRED_PARAMS.keySet().stream().map(name -> "action.devices.commands." + name);
    }

    private static String shortName(String name) {
        return name.substring(name.lastIndexOf('.') + 1);
    }

    private static Command read(String name, String params) throws Exception {
        String entry = "{\"command\":\"" + name + "\"" + (params == null ? "" : ",\"params\":" + params) + "}";
        String json = "{\"devices\":[{\"id\":\"all-1\"}],\"execution\":[" + entry + "]}";
        return Jsons.mapper().readValue(json, CommandGroup.class).execution().get(0);
    }

    @BeforeEach
    void setUp() throws Exception {
        FullDevice concrete = mock(FullDevice.class);
        when(concrete.getStream(anyBoolean(), anyList()))
                .thenReturn(new CameraStream.StreamDescriptor("rtsp://cam/1", null, null, null));
        when(concrete.guestNetworkPassword()).thenReturn("guest");
        device = new Device<>("all-1", DeviceType.SWITCH, concrete);
        device.register(Trait.values());
        dispatcher = CommandDispatcher.standard();
    }

    @ParameterizedTest
    @MethodSource("commandNames")
    @DisplayName("execute - should answer SUCCESS with states or ERROR with a code")
    void testCommandOutcome(String name) throws Exception {
        Command command = read(name, REQUIRED_PARAMS.get(shortName(name)));

        CommandOutput output = dispatcher.execute(device, command);
        JsonNode wire = Jsons.toTree(CommandResult.from(output));

        assertThat(output.status()).isIn(ExecuteStatus.SUCCESS, ExecuteStatus.ERROR);
        assertThat(wire.get("ids").get(0).asText()).isEqualTo("all-1");
        if (output.isSuccess()) {
            assertThat(output.states()).containsEntry("online", true);
            assertThat(wire.has("errorCode")).isFalse();
        } else {
            assertThat(wire.get("errorCode").asText()).isEqualTo("notSupported");
            assertThat(wire.has("states")).isFalse();
        }
    }

    @ParameterizedTest
    @MethodSource("commandsWithRequiredParams")
    @DisplayName("read - should reject a command missing its required params")
    void testRequiredParamsEnforced(String name) {
        assertThatThrownBy(() -> read(name, "{}"))
                .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    @DisplayName("read - should name every command with required params in the catalogue")
    void testRequiredParamsAreCatalogued() {
        assertThat(commandsWithRequiredParams())
                .allSatisfy(name -> assertThat(CommandCatalog.all()).containsKey(name));
    }
}
