package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

public interface Cook {

  enum CookingMode {
    UNKNOWN_COOKING_MODE,
    BAKE,
    BEAT,
    BLEND,
    BOIL,
    BREW,
    CARBONATE,
    CHOP,
    CLEAN,
    CONVECTION_BAKE,
    COOK,
    DEFROST,
    DEHYDRATE,
    FERMENT,
    FRY,
    GRILL,
    KNEAD,
    MICROWAVE,
    MIX,
    PRESSURE_COOK,
    PUREE,
    ROAST,
    SAUTE,
    SLOW_COOK,
    SOUS_VIDE,
    STEAM,
    STEW,
    STIR,
    WARM,
    WHIP
  }

  record FoodSynonym(List<String> synonym, Language lang) {}

  record FoodPreset(
      @JsonProperty("food_preset_name") String foodPresetName,
      @JsonProperty("supported_units") List<MeasurementUnit> supportedUnits,
      @JsonProperty("food_synonyms") List<FoodSynonym> foodSynonyms) {}

  /** What to cook. Everything but the mode may be absent. */
  record CookingConfig(
      CookingMode cookingMode, String foodPreset, Double quantity, MeasurementUnit unit) {}

  enum ErrorCode implements SerializableError {
    AMOUNT_ABOVE_LIMIT("amountAboveLimit"),
    DEVICE_DOOR_OPEN("deviceDoorOpen"),
    DEVICE_LID_OPEN("deviceLidOpen"),
    FRACTIONAL_AMOUNT_NOT_SUPPORTED("fractionalAmountNotSupported"),
    UNKNOWN_FOOD_PRESET("unknownFoodPreset");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  List<CookingMode> supportedCookingModes() throws CapabilityException;

  default Optional<List<FoodPreset>> foodPresets() throws CapabilityException {
    return Optional.empty();
  }

  Optional<CookingMode> currentCookingMode() throws CapabilityException;

  default Optional<String> currentFoodPreset() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> currentFoodQuantity() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<MeasurementUnit> currentFoodUnit() throws CapabilityException {
    return Optional.empty();
  }

  void startCooking(CookingConfig config) throws CapabilityException;

  void stopCooking() throws CapabilityException;
}
