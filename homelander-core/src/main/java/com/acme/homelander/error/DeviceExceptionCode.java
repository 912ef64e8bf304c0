package com.acme.homelander.error;

/** Non-blocking exception codes shared by every capability. */
public enum DeviceExceptionCode implements SerializableError {
  BAG_FULL("bagFull"),
  BIN_FULL("binFull"),
  CARPET("carpet"),
  DEVICE_AT_EXTREME_TEMPERATURE("deviceAtExtremeTemperature"),
  DEVICE_JAMMING_DETECTED("deviceJammingDetected"),
  DEVICE_MOVED("deviceMoved"),
  DEVICE_OPEN("deviceOpen"),
  DEVICE_TAMPERED("deviceTampered"),
  DEVICE_UNPLUGGED("deviceUnplugged"),
  FLOOR_UNREACHABLE("floorUnreachable"),
  HARDWARE_FAILURE("hardwareFailure"),
  IS_BYPASSED("isBypassed"),
  LOW_BATTERY("lowBattery"),
  MOTION_DETECTED("motionDetected"),
  NEEDS_SOFTWARE_UPDATE("needsSoftwareUpdate"),
  NEEDS_WATER("needsWater"),
  NETWORK_JAMMING_DETECTED("networkJammingDetected"),
  NO_AVAILABLE_CHANNEL("noAvailableChannel"),
  SECURITY_RESTRICTION("securityRestriction"),
  SOFTWARE_UPDATE_NOT_AVAILABLE("softwareUpdateNotAvailable"),
  STUCK("stuck"),
  TANK_EMPTY("tankEmpty"),
  USING_CELLULAR_BACKUP("usingCellularBackup");

  private final String code;

  DeviceExceptionCode(String code) {
    this.code = code;
  }

  @Override
  public String errorCode() {
    return code;
  }
}
