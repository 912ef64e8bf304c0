package com.acme.homelander.error;

/** Error codes shared by every capability. */
public enum DeviceErrorCode implements SerializableError {
  ACTION_NOT_AVAILABLE("actionNotAvailable"),
  ALREADY_IN_STATE("alreadyInState"),
  AUTH_FAILURE("authFailure"),
  DEVICE_BUSY("deviceBusy"),
  DEVICE_NOT_FOUND("deviceNotFound"),
  DEVICE_NOT_READY("deviceNotReady"),
  DEVICE_OFFLINE("deviceOffline"),
  DEVICE_TURNED_OFF("deviceTurnedOff"),
  FUNCTION_NOT_SUPPORTED("functionNotSupported"),
  HARD_ERROR("hardError"),
  IN_SOFTWARE_UPDATE("inSoftwareUpdate"),
  LOCKED_TO_RANGE("lockedToRange"),
  LOW_BATTERY("lowBattery"),
  NOT_SUPPORTED("notSupported"),
  PROTOCOL_ERROR("protocolError"),
  RELINK_REQUIRED("relinkRequired"),
  SAFETY_SHUT_OFF("safetyShutOff"),
  TRANSIENT_ERROR("transientError"),
  UNABLE_TO_LOCATE_DEVICE("unableToLocateDevice"),
  UNKNOWN_ERROR("unknownError"),
  VALUE_OUT_OF_RANGE("valueOutOfRange");

  private final String code;

  DeviceErrorCode(String code) {
    this.code = code;
  }

  @Override
  public String errorCode() {
    return code;
  }
}
