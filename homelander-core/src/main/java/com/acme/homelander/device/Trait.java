package com.acme.homelander.device;

import com.acme.homelander.traits.AppSelector;
import com.acme.homelander.traits.ArmDisarm;
import com.acme.homelander.traits.Brightness;
import com.acme.homelander.traits.CameraStream;
import com.acme.homelander.traits.Channel;
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
import com.acme.homelander.traits.Locator;
import com.acme.homelander.traits.LockUnlock;
import com.acme.homelander.traits.MediaState;
import com.acme.homelander.traits.Modes;
import com.acme.homelander.traits.NetworkControl;
import com.acme.homelander.traits.ObjectDetection;
import com.acme.homelander.traits.OnOff;
import com.acme.homelander.traits.OpenClose;
import com.acme.homelander.traits.Reboot;
import com.acme.homelander.traits.Rotation;
import com.acme.homelander.traits.RunCycle;
import com.acme.homelander.traits.Scene;
import com.acme.homelander.traits.SensorState;
import com.acme.homelander.traits.SoftwareUpdate;
import com.acme.homelander.traits.StartStop;
import com.acme.homelander.traits.StatusReport;
import com.acme.homelander.traits.TemperatureControl;
import com.acme.homelander.traits.TemperatureSetting;
import com.acme.homelander.traits.Timer;
import com.acme.homelander.traits.Toggles;
import com.acme.homelander.traits.TransportControl;
import com.acme.homelander.traits.Volume;
import com.fasterxml.jackson.annotation.JsonValue;

/** Capability tags, one per slot of a {@link Device}, with the interface a device must implement. */
public enum Trait {
  APP_SELECTOR("AppSelector", AppSelector.class),
  ARM_DISARM("ArmDisarm", ArmDisarm.class),
  BRIGHTNESS("Brightness", Brightness.class),
  CAMERA_STREAM("CameraStream", CameraStream.class),
  CHANNEL("Channel", Channel.class),
  COLOR_SETTING("ColorSetting", ColorSetting.class),
  COOK("Cook", Cook.class),
  DISPENSE("Dispense", Dispense.class),
  DOCK("Dock", Dock.class),
  ENERGY_STORAGE("EnergyStorage", EnergyStorage.class),
  FAN_SPEED("FanSpeed", FanSpeed.class),
  FILL("Fill", Fill.class),
  HUMIDITY_SETTING("HumiditySetting", HumiditySetting.class),
  INPUT_SELECTOR("InputSelector", InputSelector.class),
  LIGHT_EFFECTS("LightEffects", LightEffects.class),
  LOCATOR("Locator", Locator.class),
  LOCK_UNLOCK("LockUnlock", LockUnlock.class),
  MEDIA_STATE("MediaState", MediaState.class),
  MODES("Modes", Modes.class),
  NETWORK_CONTROL("NetworkControl", NetworkControl.class),
  OBJECT_DETECTION("ObjectDetection", ObjectDetection.class),
  ON_OFF("OnOff", OnOff.class),
  OPEN_CLOSE("OpenClose", OpenClose.class),
  REBOOT("Reboot", Reboot.class),
  ROTATION("Rotation", Rotation.class),
  RUN_CYCLE("RunCycle", RunCycle.class),
  SCENE("Scene", Scene.class),
  SENSOR_STATE("SensorState", SensorState.class),
  SOFTWARE_UPDATE("SoftwareUpdate", SoftwareUpdate.class),
  START_STOP("StartStop", StartStop.class),
  STATUS_REPORT("StatusReport", StatusReport.class),
  TEMPERATURE_CONTROL("TemperatureControl", TemperatureControl.class),
  TEMPERATURE_SETTING("TemperatureSetting", TemperatureSetting.class),
  TIMER("Timer", Timer.class),
  TOGGLES("Toggles", Toggles.class),
  TRANSPORT_CONTROL("TransportControl", TransportControl.class),
  VOLUME("Volume", Volume.class);

  private static final String PREFIX = "action.devices.traits.";

  private final String wireName;
  private final Class<?> capabilityType;

  Trait(String name, Class<?> capabilityType) {
    this.wireName = PREFIX + name;
    this.capabilityType = capabilityType;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public Class<?> capabilityType() {
    return capabilityType;
  }
}
