package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

public interface Fill {

  record LevelName(@JsonProperty("level_synonym") List<String> levelSynonym, Language lang) {}

  record FillLevel(
      @JsonProperty("level_name") String levelName,
      @JsonProperty("level_values") List<LevelName> levelValues) {}

  record FillLevels(List<FillLevel> levels, boolean ordered, boolean supportsFillPercent) {}

  default Optional<FillLevels> availableFillLevels() throws CapabilityException {
    return Optional.empty();
  }

  boolean isFilled() throws CapabilityException;

  default Optional<String> currentFillLevel() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> currentFillPercent() throws CapabilityException {
    return Optional.empty();
  }

  /** Fill, or drain when {@code fill} is false. */
  void fill(boolean fill) throws CapabilityException;

  void fillToLevel(boolean fill, String level) throws CapabilityException;

  void fillToPercent(boolean fill, double percent) throws CapabilityException;
}
