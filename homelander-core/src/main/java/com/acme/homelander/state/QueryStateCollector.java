package com.acme.homelander.state;

import static com.acme.homelander.state.Fragments.putIfPresent;

import com.acme.homelander.core.Jsons;
import com.acme.homelander.device.Device;
import com.acme.homelander.device.Trait;
import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.ExecuteError;
import com.acme.homelander.fulfillment.response.QueryDeviceState;
import com.acme.homelander.traits.AppSelector;
import com.acme.homelander.traits.ArmDisarm;
import com.acme.homelander.traits.Brightness;
import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.Cook;
import com.acme.homelander.traits.Dispense;
import com.acme.homelander.traits.Dock;
import com.acme.homelander.traits.EnergyStorage;
import com.acme.homelander.traits.FanSpeed;
import com.acme.homelander.traits.Fill;
import com.acme.homelander.traits.HumiditySetting;
import com.acme.homelander.traits.InputSelector;
import com.acme.homelander.traits.LightEffects;
import com.acme.homelander.traits.LockUnlock;
import com.acme.homelander.traits.MediaState;
import com.acme.homelander.traits.Modes;
import com.acme.homelander.traits.NetworkControl;
import com.acme.homelander.traits.OnOff;
import com.acme.homelander.traits.OpenClose;
import com.acme.homelander.traits.Rotation;
import com.acme.homelander.traits.RunCycle;
import com.acme.homelander.traits.SensorState;
import com.acme.homelander.traits.SoftwareUpdate;
import com.acme.homelander.traits.StartStop;
import com.acme.homelander.traits.StatusReport;
import com.acme.homelander.traits.TemperatureControl;
import com.acme.homelander.traits.TemperatureSetting;
import com.acme.homelander.traits.Timer;
import com.acme.homelander.traits.Toggles;
import com.acme.homelander.traits.Volume;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * QUERY state. Offline devices report {@code OFFLINE} without touching any capability; a failing
 * getter turns the whole device into {@code ERROR} with no partial state.
 *
 * <p>Offline is checked first, so it outranks an infrastructure failure that a getter would have
 * raised. This reverses the "infrastructure error, then offline" ranking of the overall status
 * order; the offline short-circuit keeps getters of unreachable devices from being called at all.
 */
public class QueryStateCollector extends FragmentCollector {
  private static final Logger log = LoggerFactory.getLogger(QueryStateCollector.class);

  /** Reported when a device has a Timer but no timer is running. */
  static final int NO_TIMER = -1;

  public static QueryStateCollector standard() {
    QueryStateCollector c = new QueryStateCollector();

    c.registerContributor(
        Trait.APP_SELECTOR,
        AppSelector.class,
        (app, state) -> state.put("currentApplication", app.read(AppSelector::currentApplication)));
    c.registerContributor(
        Trait.ARM_DISARM,
        ArmDisarm.class,
        (alarm, state) -> {
          state.put("isArmed", alarm.read(ArmDisarm::isArmed));
          putIfPresent(state, "currentArmLevel", alarm.read(ArmDisarm::currentArmLevel));
          putIfPresent(state, "exitAllowance", alarm.read(ArmDisarm::exitAllowance));
        });
    c.registerContributor(
        Trait.BRIGHTNESS,
        Brightness.class,
        (brightness, state) -> state.put("brightness", brightness.read(Brightness::brightness)));
    c.registerContributor(
        Trait.COLOR_SETTING,
        ColorSetting.class,
        (color, state) -> state.put("color", color.read(ColorSetting::color)));
    c.registerContributor(
        Trait.COOK,
        Cook.class,
        (cook, state) -> {
          putIfPresent(state, "currentCookingMode", cook.read(Cook::currentCookingMode));
          putIfPresent(state, "currentFoodPreset", cook.read(Cook::currentFoodPreset));
          putIfPresent(state, "currentFoodQuantity", cook.read(Cook::currentFoodQuantity));
          putIfPresent(state, "currentFoodUnit", cook.read(Cook::currentFoodUnit));
        });
    c.registerContributor(
        Trait.DISPENSE,
        Dispense.class,
        (dispense, state) -> state.put("dispenseItems", dispense.read(Dispense::dispenseItems)));
    c.registerContributor(
        Trait.DOCK, Dock.class, (dock, state) -> state.put("isDocked", dock.read(Dock::isDocked)));
    c.registerContributor(
        Trait.ENERGY_STORAGE,
        EnergyStorage.class,
        (battery, state) -> {
          state.put(
              "descriptiveCapacityRemaining",
              battery.read(EnergyStorage::descriptiveCapacityRemaining));
          putIfPresent(state, "capacityRemaining", battery.read(EnergyStorage::capacityRemaining));
          putIfPresent(state, "capacityUntilFull", battery.read(EnergyStorage::capacityUntilFull));
          putIfPresent(state, "isCharging", battery.read(EnergyStorage::isCharging));
          putIfPresent(state, "isPluggedIn", battery.read(EnergyStorage::isPluggedIn));
        });
    c.registerContributor(
        Trait.FAN_SPEED,
        FanSpeed.class,
        (fan, state) -> {
          putIfPresent(state, "currentFanSpeedSetting", fan.read(FanSpeed::currentFanSpeedSetting));
          putIfPresent(state, "currentFanSpeedPercent", fan.read(FanSpeed::currentFanSpeedPercent));
        });
    c.registerContributor(
        Trait.FILL,
        Fill.class,
        (fill, state) -> {
          state.put("isFilled", fill.read(Fill::isFilled));
          putIfPresent(state, "currentFillLevel", fill.read(Fill::currentFillLevel));
          putIfPresent(state, "currentFillPercent", fill.read(Fill::currentFillPercent));
        });
    c.registerContributor(
        Trait.HUMIDITY_SETTING,
        HumiditySetting.class,
        (humidity, state) -> {
          putIfPresent(
              state,
              "humiditySetpointPercent",
              humidity.read(HumiditySetting::humiditySetpointPercent));
          putIfPresent(
              state,
              "humidityAmbientPercent",
              humidity.read(HumiditySetting::humidityAmbientPercent));
        });
    c.registerContributor(
        Trait.INPUT_SELECTOR,
        InputSelector.class,
        (input, state) -> state.put("currentInput", input.read(InputSelector::currentInput)));
    c.registerContributor(
        Trait.LIGHT_EFFECTS,
        LightEffects.class,
        (effects, state) -> {
          putIfPresent(state, "activeLightEffect", effects.read(LightEffects::activeLightEffect));
          putIfPresent(
              state,
              "lightEffectEndUnixTimestampSec",
              effects.read(LightEffects::lightEffectEndUnixTimestampSec));
        });
    c.registerContributor(
        Trait.LOCK_UNLOCK,
        LockUnlock.class,
        (lock, state) -> {
          state.put("isLocked", lock.read(LockUnlock::isLocked));
          putIfPresent(state, "isJammed", lock.read(LockUnlock::isJammed));
        });
    c.registerContributor(
        Trait.MEDIA_STATE,
        MediaState.class,
        (media, state) -> {
          putIfPresent(state, "activityState", media.read(MediaState::activityState));
          putIfPresent(state, "playbackState", media.read(MediaState::playbackState));
        });
    c.registerContributor(
        Trait.MODES,
        Modes.class,
        (modes, state) -> state.put("currentModeSettings", modes.read(Modes::currentModeSettings)));
    c.registerContributor(
        Trait.NETWORK_CONTROL,
        NetworkControl.class,
        (network, state) -> {
          state.put("networkEnabled", network.read(NetworkControl::networkEnabled));
          state.put("networkSettings", network.read(NetworkControl::networkSettings));
          putIfPresent(
              state, "guestNetworkEnabled", network.read(NetworkControl::guestNetworkEnabled));
          putIfPresent(
              state, "guestNetworkSettings", network.read(NetworkControl::guestNetworkSettings));
          putIfPresent(
              state, "numConnectedDevices", network.read(NetworkControl::numConnectedDevices));
          putIfPresent(state, "networkUsageMB", network.read(NetworkControl::networkUsageMb));
          putIfPresent(
              state, "networkUsageLimitMB", network.read(NetworkControl::networkUsageLimitMb));
          putIfPresent(
              state, "networkUsageUnlimited", network.read(NetworkControl::networkUsageUnlimited));
          putIfPresent(
              state,
              "lastNetworkDownloadSpeedTest",
              network.read(NetworkControl::lastNetworkDownloadSpeedTest));
          putIfPresent(
              state,
              "lastNetworkUploadSpeedTest",
              network.read(NetworkControl::lastNetworkUploadSpeedTest));
          putIfPresent(
              state,
              "networkSpeedTestInProgress",
              network.read(NetworkControl::networkSpeedTestInProgress));
          putIfPresent(
              state, "networkProfilesState", network.read(NetworkControl::networkProfilesState));
        });
    c.registerContributor(
        Trait.ON_OFF, OnOff.class, (onOff, state) -> state.put("on", onOff.read(OnOff::isOn)));
    c.registerContributor(
        Trait.OPEN_CLOSE,
        OpenClose.class,
        (door, state) -> {
          putIfPresent(state, "openPercent", door.read(OpenClose::openPercent));
          putIfPresent(state, "openState", door.read(OpenClose::openState));
        });
    c.registerContributor(
        Trait.ROTATION,
        Rotation.class,
        (rotation, state) -> {
          putIfPresent(state, "rotationDegrees", rotation.read(Rotation::rotationDegrees));
          putIfPresent(state, "rotationPercent", rotation.read(Rotation::rotationPercent));
        });
    c.registerContributor(
        Trait.RUN_CYCLE,
        RunCycle.class,
        (cycle, state) -> {
          state.put("currentRunCycle", cycle.read(RunCycle::currentRunCycle));
          state.put("currentTotalRemainingTime", cycle.read(RunCycle::currentTotalRemainingTime));
          state.put("currentCycleRemainingTime", cycle.read(RunCycle::currentCycleRemainingTime));
        });
    c.registerContributor(
        Trait.SENSOR_STATE,
        SensorState.class,
        (sensor, state) ->
            state.put("currentSensorStateData", sensor.read(SensorState::currentSensorStateData)));
    c.registerContributor(
        Trait.SOFTWARE_UPDATE,
        SoftwareUpdate.class,
        (update, state) ->
            state.put(
                "lastSoftwareUpdateUnixTimestampSec",
                update.read(SoftwareUpdate::lastSoftwareUpdateUnixTimestampSec)));
    c.registerContributor(
        Trait.START_STOP,
        StartStop.class,
        (device, state) -> {
          state.put("isRunning", device.read(StartStop::isRunning));
          putIfPresent(state, "isPaused", device.read(StartStop::isPaused));
          putIfPresent(state, "activeZones", device.read(StartStop::activeZones));
        });
    c.registerContributor(
        Trait.STATUS_REPORT,
        StatusReport.class,
        (report, state) ->
            state.put("currentStatusReport", report.read(StatusReport::currentStatusReport)));
    c.registerContributor(
        Trait.TEMPERATURE_CONTROL,
        TemperatureControl.class,
        (control, state) -> {
          putIfPresent(
              state,
              "temperatureSetpointCelsius",
              control.read(TemperatureControl::temperatureSetpointCelsius));
          putIfPresent(
              state,
              "temperatureAmbientCelsius",
              control.read(TemperatureControl::temperatureAmbientCelsius));
        });
    c.registerContributor(
        Trait.TEMPERATURE_SETTING,
        TemperatureSetting.class,
        (thermostat, state) -> {
          putIfPresent(
              state,
              "activeThermostatMode",
              thermostat.read(TemperatureSetting::activeThermostatMode));
          putIfPresent(
              state,
              "targetTempReachedEstimateUnixTimestampSec",
              thermostat.read(TemperatureSetting::targetTempReachedEstimateUnixTimestampSec));
          putIfPresent(
              state,
              "thermostatHumidityAmbient",
              thermostat.read(TemperatureSetting::thermostatHumidityAmbient));
          // fixed or range setpoint, flattened
          state.putAll(Jsons.toMap(thermostat.read(TemperatureSetting::thermostatState)));
        });
    c.registerContributor(
        Trait.TIMER,
        Timer.class,
        (timer, state) -> {
          state.put("timerRemainingSec", timer.read(Timer::timerRemainingSec).orElse(NO_TIMER));
          putIfPresent(state, "timerPaused", timer.read(Timer::timerPaused));
        });
    c.registerContributor(
        Trait.TOGGLES,
        Toggles.class,
        (toggles, state) ->
            state.put("currentToggleSettings", toggles.read(Toggles::currentToggleSettings)));
    c.registerContributor(
        Trait.VOLUME,
        Volume.class,
        (volume, state) -> {
          state.put("currentVolume", volume.read(Volume::currentVolume));
          putIfPresent(state, "isMuted", volume.read(Volume::isMuted));
        });
    return c;
  }

  /** QUERY result of one device. Never throws for device failures. */
  public QueryDeviceState query(Device<?> device) {
    boolean online = false;
    Map<String, Object> states;
    try {
      online = device.isOnline();
      if (!online) {
        log.debug("Device {} is offline", device.id());
        return QueryDeviceState.offline();
      }
      states = collect(device);
    } catch (CapabilityException | RuntimeException e) {
      log.error("Error querying device {}", device.id(), e);
      return QueryDeviceState.error(online, errorCode(ExecuteError.from(e)));
    }
    return QueryDeviceState.success(states);
  }

  private static String errorCode(ExecuteError error) {
    if (error instanceof ExecuteError.Serializable serializable) {
      return serializable.error().errorCode();
    }
    return ((ExecuteError.Server) error).debugString();
  }
}
