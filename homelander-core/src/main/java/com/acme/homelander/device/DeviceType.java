package com.acme.homelander.device;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeviceType {
  AC_UNIT,
  AIRCOOLER,
  AIRFRESHENER,
  AIRPURIFIER,
  AUDIO_VIDEO_RECEIVER,
  AWNING,
  BATHTUB,
  BED,
  BLENDER,
  BLINDS,
  BOILER,
  CAMERA,
  CARBON_MONOXIDE_DETECTOR,
  CHARGER,
  CLOSET,
  COFFEE_MAKER,
  COOKTOP,
  CURTAIN,
  DEHUMIDIFIER,
  DEHYDRATOR,
  DISHWASHER,
  DOOR,
  DOORBELL,
  DRAWER,
  DRYER,
  FAN,
  FAUCET,
  FIREPLACE,
  FREEZER,
  FRYER,
  GARAGE,
  GATE,
  GRILL,
  HEATER,
  HOOD,
  HUMIDIFIER,
  KETTLE,
  LIGHT,
  LOCK,
  MICROWAVE,
  MOP,
  MOWER,
  MULTICOOKER,
  NETWORK,
  OUTLET,
  OVEN,
  PERGOLA,
  PETFEEDER,
  PRESSURECOOKER,
  RADIATOR,
  REFRIGERATOR,
  REMOTECONTROL,
  ROUTER,
  SCENE,
  SECURITYSYSTEM,
  SENSOR,
  SETTOP,
  SHOWER,
  SHUTTER,
  SMOKE_DETECTOR,
  SOUNDBAR,
  SOUSVIDE,
  SPEAKER,
  SPRINKLER,
  STANDMIXER,
  STREAMING_BOX,
  STREAMING_SOUNDBAR,
  STREAMING_STICK,
  SWITCH,
  THERMOSTAT,
  TV,
  VACUUM,
  VALVE,
  WASHER,
  WATERHEATER,
  WATERPURIFIER,
  WATERSOFTENER,
  WINDOW,
  YOGURTMAKER;

  private static final String PREFIX = "action.devices.types.";

  /** Namespaced type string, e.g. {@code action.devices.types.OUTLET}. */
  @JsonValue
  public String typeString() {
    return PREFIX + name();
  }
}
