package com.acme.homelander.state;

import com.acme.homelander.device.Device;
import com.acme.homelander.device.DeviceType;
import com.acme.homelander.device.Trait;
import com.acme.homelander.error.InfrastructureException;
import com.acme.homelander.fulfillment.response.QueryDeviceState;
import com.acme.homelander.fulfillment.response.QueryStatus;
import com.acme.homelander.testing.FullDevice;
import com.acme.homelander.testing.TestLight;
import com.acme.homelander.testing.TestLock;
import com.acme.homelander.testing.TestSwitch;
import com.acme.homelander.testing.TestThermostat;
import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.Dock;
import com.acme.homelander.traits.LockUnlock;
import com.acme.homelander.traits.TemperatureSetting;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for QueryStateCollector
 */
class QueryStateCollectorTest {

    private QueryStateCollector collector;

    @BeforeEach
    void setUp() {
        collector = QueryStateCollector.standard();
    }

    @Nested
    @DisplayName("Status Precedence Tests")
    class PrecedenceTests {

        @Test
        @DisplayName("query - should report an online device as SUCCESS")
        void testOnline() {
            TestSwitch plug = new TestSwitch("Plug");
            plug.setOn(true);
            Device<TestSwitch> device = new Device<>("plug-1", DeviceType.SWITCH, plug).register(Trait.ON_OFF);

            QueryDeviceState state = collector.query(device);

            assertThat(state.status()).isEqualTo(QueryStatus.SUCCESS);
            assertThat(state.online()).isTrue();
            assertThat(state.on()).isTrue();
            assertThat(state.states()).isEmpty();
        }

        @Test
        @DisplayName("query - should report an offline device without reading any capability")
        void testOfflineShortCircuits() {
            FullDevice concrete = mock(FullDevice.class);
            when(concrete.isOnline()).thenReturn(false);
            Device<FullDevice> device = new Device<>("x", DeviceType.LIGHT, concrete)
                    .register(Trait.ON_OFF, Trait.BRIGHTNESS, Trait.COLOR_SETTING);

            QueryDeviceState state = collector.query(device);

            assertThat(state).isEqualTo(QueryDeviceState.offline());
            assertThat(state.online()).isFalse();
            assertThat(state.on()).isTrue();
            verify(concrete).isOnline();
            verifyNoMoreInteractions(concrete);
        }

        @Test
        @DisplayName("query - should prefer OFFLINE over a failing getter")
        void testOfflineBeatsError() {
            TestLight light = new TestLight("Lamp");
            light.setOnline(false);
            light.failWith(new InfrastructureException("bulb unreachable"));
            Device<TestLight> device = new Device<>("lamp-1", DeviceType.LIGHT, light).register(Trait.COLOR_SETTING);

            assertThat(collector.query(device).status()).isEqualTo(QueryStatus.OFFLINE);
        }

        @Test
        @DisplayName("query - should report ERROR without partial state when a getter fails")
        void testGetterFailure() {
            TestLight light = new TestLight("Lamp");
            light.setOn(true);
            light.failWith(new InfrastructureException("bulb unreachable"));
            Device<TestLight> device = new Device<>("lamp-1", DeviceType.LIGHT, light)
                    .register(Trait.ON_OFF, Trait.BRIGHTNESS, Trait.COLOR_SETTING);

            QueryDeviceState state = collector.query(device);

            assertThat(state.status()).isEqualTo(QueryStatus.ERROR);
            assertThat(state.online()).isTrue();
            assertThat(state.errorCode()).isEqualTo("bulb unreachable");
            assertThat(state.states()).isEmpty();
            assertThat(state.toWire()).doesNotContainKeys("brightness", "color");
        }

        @Test
        @DisplayName("query - should surface a domain error code")
        void testDomainErrorCode() {
            TestLight light = new TestLight("Lamp");
            light.failWith(LockUnlock.ErrorCode.REMOTE_SET_DISABLED.toException());
            Device<TestLight> device = new Device<>("lamp-1", DeviceType.LIGHT, light).register(Trait.COLOR_SETTING);

            assertThat(collector.query(device).errorCode()).isEqualTo("remoteSetDisabled");
        }

        @Test
        @DisplayName("query - should report ERROR when the online check itself fails")
        void testOnlineCheckFailure() {
            FullDevice concrete = mock(FullDevice.class);
            when(concrete.isOnline()).thenThrow(new IllegalStateException("no link"));
            Device<FullDevice> device = new Device<>("x", DeviceType.LIGHT, concrete).register(Trait.ON_OFF);

            QueryDeviceState state = collector.query(device);

            assertThat(state.status()).isEqualTo(QueryStatus.ERROR);
            assertThat(state.online()).isFalse();
            assertThat(state.errorCode()).isEqualTo("no link");
        }
    }

    @Nested
    @DisplayName("State Fragment Tests")
    class FragmentTests {

        @Test
        @DisplayName("query - should collect state in registration order")
        void testLightState() {
            TestLight light = new TestLight("Lamp");
            Device<TestLight> device = new Device<>("lamp-1", DeviceType.LIGHT, light)
                    .register(Trait.COLOR_SETTING, Trait.BRIGHTNESS, Trait.ON_OFF);

            QueryDeviceState state = collector.query(device);

            assertThat(state.on()).isFalse();
            assertThat(state.states().keySet()).containsExactly("color", "brightness");
            assertThat(state.states()).containsEntry("color", ColorSetting.Color.temperature(2700));
        }

        @Test
        @DisplayName("query - should report lock and jam state")
        void testLockState() {
            TestLock lock = new TestLock("Front door", true);
            Device<TestLock> device = new Device<>("door-1", DeviceType.LOCK, lock).register(Trait.LOCK_UNLOCK);

            assertThat(collector.query(device).states())
                    .containsEntry("isLocked", true)
                    .containsEntry("isJammed", false);
        }

        @Test
        @DisplayName("query - should report -1 when no timer runs")
        void testNoTimer() throws Exception {
            TestThermostat thermostat = new TestThermostat("Hall");
            Device<TestThermostat> device = new Device<>("t-1", DeviceType.THERMOSTAT, thermostat).register(Trait.TIMER);

            assertThat(collector.query(device).states()).containsEntry("timerRemainingSec", -1);

            thermostat.startTimer(90);
            assertThat(collector.query(device).states()).containsEntry("timerRemainingSec", 90);
        }

        @Test
        @DisplayName("query - should flatten fixed and range setpoints")
        void testThermostatFlattened() {
            TestThermostat thermostat = new TestThermostat("Hall");
            Device<TestThermostat> device = new Device<>("t-1", DeviceType.THERMOSTAT, thermostat)
                    .register(Trait.TEMPERATURE_SETTING);

            assertThat(collector.query(device).states())
                    .containsEntry("thermostatMode", "heat")
                    .containsEntry("thermostatTemperatureAmbient", 21.5)
                    .containsEntry("thermostatTemperatureSetpoint", 20.0)
                    .doesNotContainKey("thermostatTemperatureSetpointHigh");

            thermostat.setThermostatMode(TemperatureSetting.ThermostatMode.HEATCOOL);
            assertThat(collector.query(device).states())
                    .containsEntry("thermostatMode", "heatcool")
                    .containsEntry("thermostatTemperatureSetpointHigh", 24.0)
                    .containsEntry("thermostatTemperatureSetpointLow", 18.0)
                    .doesNotContainKey("thermostatTemperatureSetpoint");
        }

        @Test
        @DisplayName("query - should return identical state when nothing changed")
        void testIdempotent() {
            TestLight light = new TestLight("Lamp");
            Device<TestLight> device = new Device<>("lamp-1", DeviceType.LIGHT, light)
                    .register(Trait.ON_OFF, Trait.BRIGHTNESS, Trait.COLOR_SETTING);

            assertThat(collector.query(device)).isEqualTo(collector.query(device));
        }

        @Test
        @DisplayName("registerContributor - should reject a duplicate capability")
        void testDuplicateContributor() {
            assertThatThrownBy(() -> collector.registerContributor(
                    Trait.DOCK, Dock.class, (dock, state) -> state.put("isDocked", true)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Dock");
        }
    }
}
