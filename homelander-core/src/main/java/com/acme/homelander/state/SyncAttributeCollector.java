package com.acme.homelander.state;

import static com.acme.homelander.state.Fragments.putIfPresent;

import com.acme.homelander.device.Device;
import com.acme.homelander.device.Trait;
import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.fulfillment.response.SyncDevice;
import com.acme.homelander.traits.AppSelector;
import com.acme.homelander.traits.ArmDisarm;
import com.acme.homelander.traits.Brightness;
import com.acme.homelander.traits.CameraStream;
import com.acme.homelander.traits.Channel;
import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.Cook;
import com.acme.homelander.traits.Dispense;
import com.acme.homelander.traits.EnergyStorage;
import com.acme.homelander.traits.FanSpeed;
import com.acme.homelander.traits.Fill;
import com.acme.homelander.traits.HumiditySetting;
import com.acme.homelander.traits.InputSelector;
import com.acme.homelander.traits.LightEffects;
import com.acme.homelander.traits.MediaState;
import com.acme.homelander.traits.Modes;
import com.acme.homelander.traits.NetworkControl;
import com.acme.homelander.traits.OnOff;
import com.acme.homelander.traits.OpenClose;
import com.acme.homelander.traits.Rotation;
import com.acme.homelander.traits.Scene;
import com.acme.homelander.traits.SensorState;
import com.acme.homelander.traits.StartStop;
import com.acme.homelander.traits.TemperatureControl;
import com.acme.homelander.traits.TemperatureSetting;
import com.acme.homelander.traits.Timer;
import com.acme.homelander.traits.Toggles;
import com.acme.homelander.traits.TransportControl;
import com.acme.homelander.traits.Volume;

/**
 * SYNC attributes. Each capability writes its protocol attribute names into one flat map;
 * Dock, Locator, LockUnlock, ObjectDetection, Reboot, RunCycle, SoftwareUpdate and StatusReport
 * have no attributes.
 */
public class SyncAttributeCollector extends FragmentCollector {

  public static SyncAttributeCollector standard() {
    SyncAttributeCollector c = new SyncAttributeCollector();

    c.registerContributor(
        Trait.APP_SELECTOR,
        AppSelector.class,
        (app, attrs) ->
            attrs.put("availableApplications", app.read(AppSelector::availableApplications)));
    c.registerContributor(
        Trait.ARM_DISARM,
        ArmDisarm.class,
        (alarm, attrs) ->
            putIfPresent(attrs, "availableArmLevels", alarm.read(ArmDisarm::availableArmLevels)));
    c.registerContributor(
        Trait.BRIGHTNESS,
        Brightness.class,
        (brightness, attrs) ->
            putIfPresent(
                attrs,
                "commandOnlyBrightness",
                brightness.read(Brightness::commandOnlyBrightness)));
    c.registerContributor(
        Trait.CAMERA_STREAM,
        CameraStream.class,
        (camera, attrs) -> {
          attrs.put(
              "cameraStreamSupportedProtocols", camera.read(CameraStream::supportedProtocols));
          attrs.put("cameraStreamNeedAuthToken", camera.read(CameraStream::needsAuthToken));
        });
    c.registerContributor(
        Trait.CHANNEL,
        Channel.class,
        (channel, attrs) -> {
          putIfPresent(attrs, "availableChannels", channel.read(Channel::availableChannels));
          putIfPresent(attrs, "commandOnlyChannels", channel.read(Channel::commandOnlyChannels));
        });
    c.registerContributor(
        Trait.COLOR_SETTING,
        ColorSetting.class,
        (color, attrs) -> {
          putIfPresent(
              attrs, "commandOnlyColorSetting", color.read(ColorSetting::commandOnlyColorSetting));
          putIfPresent(attrs, "colorModel", color.read(ColorSetting::colorModel));
          putIfPresent(
              attrs, "colorTemperatureRange", color.read(ColorSetting::colorTemperatureRange));
        });
    c.registerContributor(
        Trait.COOK,
        Cook.class,
        (cook, attrs) -> {
          attrs.put("supportedCookingModes", cook.read(Cook::supportedCookingModes));
          putIfPresent(attrs, "foodPresets", cook.read(Cook::foodPresets));
        });
    c.registerContributor(
        Trait.DISPENSE,
        Dispense.class,
        (dispense, attrs) -> {
          attrs.put("supportedDispenseItems", dispense.read(Dispense::supportedDispenseItems));
          putIfPresent(
              attrs, "supportedDispensePresets", dispense.read(Dispense::supportedDispensePresets));
        });
    c.registerContributor(
        Trait.ENERGY_STORAGE,
        EnergyStorage.class,
        (battery, attrs) -> {
          putIfPresent(
              attrs, "queryOnlyEnergyStorage", battery.read(EnergyStorage::queryOnlyEnergyStorage));
          putIfPresent(
              attrs,
              "energyStorageDistanceUnitForUX",
              battery.read(EnergyStorage::energyStorageDistanceUnitForUX));
          putIfPresent(attrs, "isRechargeable", battery.read(EnergyStorage::isRechargeable));
        });
    c.registerContributor(
        Trait.FAN_SPEED,
        FanSpeed.class,
        (fan, attrs) -> {
          putIfPresent(attrs, "reversible", fan.read(FanSpeed::reversible));
          putIfPresent(attrs, "commandOnlyFanSpeed", fan.read(FanSpeed::commandOnlyFanSpeed));
          putIfPresent(attrs, "availableFanSpeeds", fan.read(FanSpeed::availableFanSpeeds));
          putIfPresent(
              attrs, "supportsFanSpeedPercent", fan.read(FanSpeed::supportsFanSpeedPercent));
        });
    c.registerContributor(
        Trait.FILL,
        Fill.class,
        (fill, attrs) ->
            putIfPresent(attrs, "availableFillLevels", fill.read(Fill::availableFillLevels)));
    c.registerContributor(
        Trait.HUMIDITY_SETTING,
        HumiditySetting.class,
        (humidity, attrs) -> {
          putIfPresent(
              attrs, "humiditySetpointRange", humidity.read(HumiditySetting::humiditySetpointRange));
          putIfPresent(
              attrs,
              "commandOnlyHumiditySetting",
              humidity.read(HumiditySetting::commandOnlyHumiditySetting));
          putIfPresent(
              attrs,
              "queryOnlyHumiditySetting",
              humidity.read(HumiditySetting::queryOnlyHumiditySetting));
        });
    c.registerContributor(
        Trait.INPUT_SELECTOR,
        InputSelector.class,
        (input, attrs) -> {
          attrs.put("availableInputs", input.read(InputSelector::availableInputs));
          putIfPresent(
              attrs,
              "commandOnlyInputSelector",
              input.read(InputSelector::commandOnlyInputSelector));
          putIfPresent(attrs, "orderedInputs", input.read(InputSelector::orderedInputs));
        });
    c.registerContributor(
        Trait.LIGHT_EFFECTS,
        LightEffects.class,
        (effects, attrs) -> {
          putIfPresent(
              attrs,
              "defaultColorLoopDuration",
              effects.read(LightEffects::defaultColorLoopDuration));
          putIfPresent(
              attrs, "defaultSleepDuration", effects.read(LightEffects::defaultSleepDuration));
          putIfPresent(
              attrs, "defaultWakeDuration", effects.read(LightEffects::defaultWakeDuration));
          attrs.put("supportedEffects", effects.read(LightEffects::supportedEffects));
        });
    c.registerContributor(
        Trait.MEDIA_STATE,
        MediaState.class,
        (media, attrs) -> {
          putIfPresent(attrs, "supportActivityState", media.read(MediaState::supportActivityState));
          putIfPresent(attrs, "supportPlaybackState", media.read(MediaState::supportPlaybackState));
        });
    c.registerContributor(
        Trait.MODES,
        Modes.class,
        (modes, attrs) -> {
          attrs.put("availableModes", modes.read(Modes::availableModes));
          putIfPresent(attrs, "commandOnlyModes", modes.read(Modes::commandOnlyModes));
          putIfPresent(attrs, "queryOnlyModes", modes.read(Modes::queryOnlyModes));
        });
    c.registerContributor(
        Trait.NETWORK_CONTROL,
        NetworkControl.class,
        (network, attrs) -> {
          putIfPresent(attrs, "networkProfiles", network.read(NetworkControl::networkProfiles));
          putIfPresent(
              attrs,
              "supportsEnablingGuestNetwork",
              network.read(NetworkControl::supportsEnablingGuestNetwork));
          putIfPresent(
              attrs,
              "supportsDisablingGuestNetwork",
              network.read(NetworkControl::supportsDisablingGuestNetwork));
          putIfPresent(
              attrs,
              "supportsGettingGuestNetworkPassword",
              network.read(NetworkControl::supportsGettingGuestNetworkPassword));
          putIfPresent(
              attrs,
              "supportsEnablingNetworkProfile",
              network.read(NetworkControl::supportsEnablingNetworkProfile));
          putIfPresent(
              attrs,
              "supportsDisablingNetworkProfile",
              network.read(NetworkControl::supportsDisablingNetworkProfile));
          putIfPresent(
              attrs,
              "supportsNetworkDownloadSpeedTest",
              network.read(NetworkControl::supportsNetworkDownloadSpeedTest));
          putIfPresent(
              attrs,
              "supportsNetworkUploadSpeedTest",
              network.read(NetworkControl::supportsNetworkUploadSpeedTest));
        });
    c.registerContributor(
        Trait.ON_OFF,
        OnOff.class,
        (onOff, attrs) -> {
          putIfPresent(attrs, "commandOnlyOnOff", onOff.read(OnOff::commandOnlyOnOff));
          putIfPresent(attrs, "queryOnlyOnOff", onOff.read(OnOff::queryOnlyOnOff));
        });
    c.registerContributor(
        Trait.OPEN_CLOSE,
        OpenClose.class,
        (door, attrs) -> {
          putIfPresent(attrs, "discreteOnlyOpenClose", door.read(OpenClose::discreteOnlyOpenClose));
          putIfPresent(attrs, "openDirection", door.read(OpenClose::openDirection));
          putIfPresent(attrs, "commandOnlyOpenClose", door.read(OpenClose::commandOnlyOpenClose));
          putIfPresent(attrs, "queryOnlyOpenClose", door.read(OpenClose::queryOnlyOpenClose));
        });
    c.registerContributor(
        Trait.ROTATION,
        Rotation.class,
        (rotation, attrs) -> {
          putIfPresent(attrs, "supportsDegrees", rotation.read(Rotation::supportsDegrees));
          putIfPresent(attrs, "supportsPercent", rotation.read(Rotation::supportsPercent));
          putIfPresent(attrs, "rotationDegreesRange", rotation.read(Rotation::rotationDegreesRange));
          putIfPresent(
              attrs,
              "supportsContinuousRotation",
              rotation.read(Rotation::supportsContinuousRotation));
          putIfPresent(attrs, "commandOnlyRotation", rotation.read(Rotation::commandOnlyRotation));
        });
    c.registerContributor(
        Trait.SCENE,
        Scene.class,
        (scene, attrs) -> putIfPresent(attrs, "sceneReversible", scene.read(Scene::sceneReversible)));
    c.registerContributor(
        Trait.SENSOR_STATE,
        SensorState.class,
        (sensor, attrs) ->
            attrs.put("sensorStatesSupported", sensor.read(SensorState::sensorStatesSupported)));
    c.registerContributor(
        Trait.START_STOP,
        StartStop.class,
        (device, attrs) -> {
          putIfPresent(attrs, "pausable", device.read(StartStop::pausable));
          putIfPresent(attrs, "availableZones", device.read(StartStop::availableZones));
        });
    c.registerContributor(
        Trait.TEMPERATURE_CONTROL,
        TemperatureControl.class,
        (control, attrs) -> {
          attrs.put("temperatureRange", control.read(TemperatureControl::temperatureRange));
          putIfPresent(
              attrs,
              "temperatureStepCelsius",
              control.read(TemperatureControl::temperatureStepCelsius));
          attrs.put(
              "temperatureUnitForUX", control.read(TemperatureControl::temperatureUnitForUX));
          putIfPresent(
              attrs,
              "commandOnlyTemperatureControl",
              control.read(TemperatureControl::commandOnlyTemperatureControl));
          putIfPresent(
              attrs,
              "queryOnlyTemperatureControl",
              control.read(TemperatureControl::queryOnlyTemperatureControl));
        });
    c.registerContributor(
        Trait.TEMPERATURE_SETTING,
        TemperatureSetting.class,
        (thermostat, attrs) -> {
          attrs.put(
              "availableThermostatModes",
              thermostat.read(TemperatureSetting::availableThermostatModes));
          putIfPresent(
              attrs,
              "thermostatTemperatureRange",
              thermostat.read(TemperatureSetting::thermostatTemperatureRange));
          attrs.put(
              "thermostatTemperatureUnit",
              thermostat.read(TemperatureSetting::thermostatTemperatureUnit));
          putIfPresent(
              attrs, "bufferRangeCelsius", thermostat.read(TemperatureSetting::bufferRangeCelsius));
          putIfPresent(
              attrs,
              "commandOnlyTemperatureSetting",
              thermostat.read(TemperatureSetting::commandOnlyTemperatureSetting));
          putIfPresent(
              attrs,
              "queryOnlyTemperatureSetting",
              thermostat.read(TemperatureSetting::queryOnlyTemperatureSetting));
        });
    c.registerContributor(
        Trait.TIMER,
        Timer.class,
        (timer, attrs) -> {
          attrs.put("maxTimerLimitSec", timer.read(Timer::maxTimerLimitSec));
          putIfPresent(attrs, "commandOnlyTimer", timer.read(Timer::commandOnlyTimer));
        });
    c.registerContributor(
        Trait.TOGGLES,
        Toggles.class,
        (toggles, attrs) -> {
          attrs.put("availableToggles", toggles.read(Toggles::availableToggles));
          putIfPresent(attrs, "commandOnlyToggles", toggles.read(Toggles::commandOnlyToggles));
          putIfPresent(attrs, "queryOnlyToggles", toggles.read(Toggles::queryOnlyToggles));
        });
    c.registerContributor(
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (media, attrs) ->
            attrs.put(
                "transportControlSupportedCommands",
                media.read(TransportControl::transportControlSupportedCommands)));
    c.registerContributor(
        Trait.VOLUME,
        Volume.class,
        (volume, attrs) -> {
          attrs.put("volumeMaxLevel", volume.read(Volume::volumeMaxLevel));
          attrs.put("volumeCanMuteAndUnmute", volume.read(Volume::volumeCanMuteAndUnmute));
          putIfPresent(
              attrs, "volumeDefaultPercentage", volume.read(Volume::volumeDefaultPercentage));
          putIfPresent(attrs, "levelStepSize", volume.read(Volume::levelStepSize));
          putIfPresent(attrs, "commandOnlyVolume", volume.read(Volume::commandOnlyVolume));
        });
    return c;
  }

  /**
   * SYNC entry of one device. Offline devices are synced like any other.
   *
   * @throws CapabilityException if any attribute getter fails
   */
  public SyncDevice sync(Device<?> device) throws CapabilityException {
    return new SyncDevice(
        device.id(),
        device.type(),
        device.traits(),
        device.deviceName(),
        device.willReportState(),
        device.roomHint().orElse(null),
        device.deviceInfo(),
        collect(device));
  }
}
