package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Named modes, each taking one setting from a fixed list, e.g. a washer's load size. */
public interface Modes {

  record ModeName(@JsonProperty("name_synonym") List<String> nameSynonym, Language lang) {}

  record SettingName(
      @JsonProperty("setting_synonym") List<String> settingSynonym, Language lang) {}

  record Setting(
      @JsonProperty("setting_name") String settingName,
      @JsonProperty("setting_values") List<SettingName> settingValues) {}

  record Mode(
      String name,
      @JsonProperty("name_values") List<ModeName> nameValues,
      List<Setting> settings,
      boolean ordered) {}

  List<Mode> availableModes() throws CapabilityException;

  default Optional<Boolean> commandOnlyModes() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> queryOnlyModes() throws CapabilityException {
    return Optional.empty();
  }

  /** Mode name to the selected setting name. */
  Map<String, String> currentModeSettings() throws CapabilityException;

  void updateMode(String mode, String setting) throws CapabilityException;
}
