package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Devices that dispense a measured amount of an item, a named preset, or a default portion, such
 * as faucets and pet feeders.
 */
public interface Dispense {

  record Synonyms(List<String> synonyms, Language lang) {}

  record Portion(double amount, MeasurementUnit unit) {}

  record DispenseItem(
      @JsonProperty("item_name") String itemName,
      @JsonProperty("item_name_synonyms") List<Synonyms> itemNameSynonyms,
      @JsonProperty("supported_units") List<MeasurementUnit> supportedUnits,
      @JsonProperty("default_portion") Portion defaultPortion) {}

  record DispensePreset(
      @JsonProperty("preset_name") String presetName,
      @JsonProperty("preset_name_synonyms") List<Synonyms> presetNameSynonyms) {}

  record ItemState(
      String itemName,
      Portion amountRemaining,
      Portion amountLastDispensed,
      boolean isCurrentlyDispensing) {}

  enum ErrorCode implements SerializableError {
    DISPENSE_AMOUNT_ABOVE_LIMIT("dispenseAmountAboveLimit"),
    DISPENSE_AMOUNT_BELOW_LIMIT("dispenseAmountBelowLimit"),
    DISPENSE_AMOUNT_REMAINING_EXCEEDED("dispenseAmountRemainingExceeded"),
    DISPENSE_FRACTIONAL_AMOUNT_NOT_SUPPORTED("dispenseFractionalAmountNotSupported"),
    DISPENSE_FRACTIONAL_UNIT_NOT_SUPPORTED("dispenseFractionalUnitNotSupported"),
    DISPENSE_UNIT_NOT_SUPPORTED("dispenseUnitNotSupported"),
    DEVICE_CURRENTLY_DISPENSING("deviceCurrentlyDispensing"),
    DEVICE_CLOGGED("deviceClogged"),
    DEVICE_BUSY("deviceBusy"),
    GENERIC_DISPENSE_NOT_SUPPORTED("genericDispenseNotSupported"),
    DISPENSE_NOT_SUPPORTED("dispenseNotSupported");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  enum ExceptionCode implements SerializableError {
    AMOUNT_REMAINING_LOW("amountRemainingLow"),
    USER_NEEDS_TO_WAIT("userNeedsToWait");

    private final String code;

    ExceptionCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  List<DispenseItem> supportedDispenseItems() throws CapabilityException;

  default Optional<List<DispensePreset>> supportedDispensePresets() throws CapabilityException {
    return Optional.empty();
  }

  List<ItemState> dispenseItems() throws CapabilityException;

  void dispenseAmount(String item, double amount, MeasurementUnit unit)
      throws CapabilityException;

  void dispensePreset(String presetName) throws CapabilityException;

  void dispenseDefault() throws CapabilityException;
}
