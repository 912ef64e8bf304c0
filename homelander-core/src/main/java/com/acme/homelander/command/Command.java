package com.acme.homelander.command;

import com.acme.homelander.traits.CameraStream;
import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.Cook.CookingMode;
import com.acme.homelander.traits.Language;
import com.acme.homelander.traits.MeasurementUnit;
import com.acme.homelander.traits.OpenClose.Direction;
import com.acme.homelander.traits.TemperatureSetting;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * One EXECUTE command. Each variant carries the {@code params} object of its protocol command;
 * components marked required must be present and non-null, boxed components are optional and are
 * null when absent. Wire names live in {@link CommandCatalog}.
 */
public sealed interface Command {

  // AppSelector
  record AppInstall(String newApplication, String newApplicationName) implements Command {}

  record AppSearch(String newApplication, String newApplicationName) implements Command {}

  record AppSelect(String newApplication, String newApplicationName) implements Command {}

  // ArmDisarm
  record ArmDisarm(
      @JsonProperty(required = true) boolean arm,
      Boolean cancel,
      String armLevel,
      String followUpToken)
      implements Command {}

  // Brightness
  record BrightnessAbsolute(@JsonProperty(required = true) int brightness) implements Command {}

  record BrightnessRelative(Integer brightnessRelativePercent, Integer brightnessRelativeWeight)
      implements Command {}

  // CameraStream
  record GetCameraStream(
      @JsonProperty(value = "StreamToChromecast", required = true) boolean streamToChromecast,
      @JsonProperty(value = "SupportedStreamProtocols", required = true)
          List<CameraStream.Protocol> supportedStreamProtocols)
      implements Command {}

  // Channel
  record SelectChannel(String channelCode, String channelName, String channelNumber)
      implements Command {}

  record RelativeChannel(@JsonProperty(required = true) int relativeChannelChange)
      implements Command {}

  record ReturnChannel() implements Command {}

  // ColorSetting
  record ColorAbsolute(@JsonProperty(required = true) ColorSetting.ColorCommand color)
      implements Command {}

  // Cook
  record Cook(
      @JsonProperty(required = true) boolean start,
      CookingMode cookingMode,
      String foodPreset,
      Double quantity,
      MeasurementUnit unit)
      implements Command {}

  // Dispense
  record Dispense(String item, Double amount, MeasurementUnit unit, String presetName)
      implements Command {}

  // Dock
  record Dock() implements Command {}

  // EnergyStorage
  record Charge(@JsonProperty(required = true) boolean charge) implements Command {}

  // FanSpeed
  record SetFanSpeed(String fanSpeed, Integer fanSpeedPercent) implements Command {}

  record SetFanSpeedRelative(Integer fanSpeedRelativeWeight, Integer fanSpeedRelativePercent)
      implements Command {}

  record Reverse() implements Command {}

  // Fill
  record Fill(@JsonProperty(required = true) boolean fill, String fillLevel, Double fillPercent)
      implements Command {}

  // HumiditySetting
  record SetHumidity(@JsonProperty(required = true) int humidity) implements Command {}

  record HumidityRelative(Integer humidityRelativePercent, Integer humidityRelativeWeight)
      implements Command {}

  // InputSelector
  record SetInput(@JsonProperty(required = true) String newInput) implements Command {}

  record NextInput() implements Command {}

  record PreviousInput() implements Command {}

  // LightEffects
  record ColorLoop(Integer duration) implements Command {}

  record Sleep(Integer duration) implements Command {}

  record StopEffect() implements Command {}

  record Wake(Integer duration) implements Command {}

  // Locator
  record Locate(Boolean silence, Language lang) implements Command {}

  // LockUnlock
  record LockUnlock(@JsonProperty(required = true) boolean lock, String followUpToken)
      implements Command {}

  // Modes
  record SetModes(
      @JsonProperty(required = true) Map<String, String> updateModeSettings) implements Command {}

  // NetworkControl
  record EnableDisableGuestNetwork(@JsonProperty(required = true) boolean enable)
      implements Command {}

  record EnableDisableNetworkProfile(
      @JsonProperty(required = true) String profile,
      @JsonProperty(required = true) boolean enable)
      implements Command {}

  record GetGuestNetworkPassword() implements Command {}

  record TestNetworkSpeed(
      @JsonProperty(required = true) boolean testDownloadSpeed,
      @JsonProperty(required = true) boolean testUploadSpeed,
      String followUpToken)
      implements Command {}

  // OnOff
  record OnOff(@JsonProperty(required = true) boolean on) implements Command {}

  // OpenClose
  record OpenClose(@JsonProperty(required = true) double openPercent, Direction openDirection)
      implements Command {}

  record OpenCloseRelative(
      @JsonProperty(required = true) double openRelativePercent, Direction openDirection)
      implements Command {}

  // Reboot
  record Reboot() implements Command {}

  // Rotation
  record RotationAbsolute(Double rotationDegrees, Double rotationPercent) implements Command {}

  // Scene
  record ActivateScene(Boolean deactivate) implements Command {}

  // SoftwareUpdate
  record SoftwareUpdate() implements Command {}

  // StartStop
  record StartStop(
      @JsonProperty(required = true) boolean start,
      String zone,
      List<String> multipleZones)
      implements Command {}

  record PauseUnpause(@JsonProperty(required = true) boolean pause) implements Command {}

  // TemperatureControl
  record SetTemperature(@JsonProperty(required = true) double temperature) implements Command {}

  // TemperatureSetting
  record ThermostatTemperatureSetpoint(
      @JsonProperty(required = true) double thermostatTemperatureSetpoint)
      implements Command {}

  record ThermostatTemperatureSetRange(
      @JsonProperty(required = true) double thermostatTemperatureSetpointHigh,
      @JsonProperty(required = true) double thermostatTemperatureSetpointLow)
      implements Command {}

  record ThermostatSetMode(
      @JsonProperty(required = true) TemperatureSetting.ThermostatMode thermostatMode)
      implements Command {}

  record TemperatureRelative(
      Double thermostatTemperatureRelativeDegree, Integer thermostatTemperatureRelativeWeight)
      implements Command {}

  // Timer
  record TimerStart(@JsonProperty(required = true) int timerTimeSec) implements Command {}

  record TimerAdjust(@JsonProperty(required = true) int timerTimeSec) implements Command {}

  record TimerPause() implements Command {}

  record TimerResume() implements Command {}

  record TimerCancel() implements Command {}

  // Toggles
  record SetToggles(
      @JsonProperty(required = true) Map<String,
      Boolean> updateToggleSettings)
      implements Command {}

  // TransportControl
  record MediaStop() implements Command {}

  record MediaNext() implements Command {}

  record MediaPrevious() implements Command {}

  record MediaPause() implements Command {}

  record MediaResume() implements Command {}

  record MediaSeekRelative(@JsonProperty(required = true) long relativePositionMs)
      implements Command {}

  record MediaSeekToPosition(@JsonProperty(required = true) long absPositionMs)
      implements Command {}

  record MediaRepeatMode(@JsonProperty(required = true) boolean isOn, Boolean isSingle)
      implements Command {}

  record MediaShuffle() implements Command {}

  record MediaClosedCaptioningOn(Language closedCaptioningLanguage, Language userQueryLanguage)
      implements Command {}

  record MediaClosedCaptioningOff() implements Command {}

  // Volume
  record Mute(@JsonProperty(required = true) boolean mute) implements Command {}

  record SetVolume(@JsonProperty(required = true) int volumeLevel) implements Command {}

  record VolumeRelative(@JsonProperty(required = true) int relativeSteps) implements Command {}
}
