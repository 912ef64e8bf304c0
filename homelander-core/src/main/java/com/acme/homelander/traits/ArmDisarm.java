package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/** Security systems that can be armed, optionally at a named level, and disarmed. */
public interface ArmDisarm {

  record LevelName(@JsonProperty("level_synonym") List<String> levelSynonym, Language lang) {}

  record ArmLevel(
      @JsonProperty("level_name") String levelName,
      @JsonProperty("level_values") List<LevelName> levelValues) {}

  record ArmLevels(List<ArmLevel> levels, boolean ordered) {}

  enum ErrorCode implements SerializableError {
    ALREADY_ARMED("alreadyArmed"),
    ALREADY_DISARMED("alreadyDisarmed"),
    DEVICE_TAMPERED("deviceTampered"),
    PASSPHRASE_INCORRECT("passphraseIncorrect"),
    PIN_INCORRECT("pinIncorrect"),
    SECURITY_RESTRICTION("securityRestriction"),
    TOO_MANY_FAILED_ATTEMPTS("tooManyFailedAttempts"),
    USER_CANCELLED("userCancelled");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  default Optional<ArmLevels> availableArmLevels() throws CapabilityException {
    return Optional.empty();
  }

  boolean isArmed() throws CapabilityException;

  default Optional<String> currentArmLevel() throws CapabilityException {
    return Optional.empty();
  }

  /** Seconds left before the system arms, when an exit delay is running. */
  default Optional<Integer> exitAllowance() throws CapabilityException {
    return Optional.empty();
  }

  void arm(boolean arm) throws CapabilityException;

  void armWithLevel(boolean arm, String level) throws CapabilityException;

  void cancelArm() throws CapabilityException;
}
