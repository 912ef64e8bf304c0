package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import java.util.Optional;

public interface LockUnlock {

  enum ErrorCode implements SerializableError {
    ALREADY_LOCKED("alreadyLocked"),
    ALREADY_UNLOCKED("alreadyUnlocked"),
    REMOTE_SET_DISABLED("remoteSetDisabled"),
    DEVICE_JAMMING_DETECTED("deviceJammingDetected"),
    NOT_SUPPORTED("notSupported");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  boolean isLocked() throws CapabilityException;

  default Optional<Boolean> isJammed() throws CapabilityException {
    return Optional.empty();
  }

  void setLocked(boolean locked) throws CapabilityException;
}
