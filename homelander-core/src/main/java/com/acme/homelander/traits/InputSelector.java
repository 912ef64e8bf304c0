package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/** Media devices with selectable inputs such as HDMI ports. */
public interface InputSelector {

  record InputName(@JsonProperty("name_synonym") List<String> nameSynonym, Language lang) {}

  record Input(String key, List<InputName> names) {}

  enum ErrorCode implements SerializableError {
    UNSUPPORTED_INPUT("unsupportedInput");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  List<Input> availableInputs() throws CapabilityException;

  default Optional<Boolean> commandOnlyInputSelector() throws CapabilityException {
    return Optional.empty();
  }

  /** Whether next/previous input follow the order of {@link #availableInputs()}. */
  default Optional<Boolean> orderedInputs() throws CapabilityException {
    return Optional.empty();
  }

  String currentInput() throws CapabilityException;

  void setInput(String key) throws CapabilityException;

  void nextInput() throws CapabilityException;

  void previousInput() throws CapabilityException;
}
