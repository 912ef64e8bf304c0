package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface Toggles {

  record ToggleName(@JsonProperty("name_synonym") List<String> nameSynonym, Language lang) {}

  record Toggle(String name, @JsonProperty("name_values") List<ToggleName> nameValues) {}

  List<Toggle> availableToggles() throws CapabilityException;

  default Optional<Boolean> commandOnlyToggles() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> queryOnlyToggles() throws CapabilityException {
    return Optional.empty();
  }

  Map<String, Boolean> currentToggleSettings() throws CapabilityException;

  void setToggle(String toggle, boolean enabled) throws CapabilityException;
}
