package com.acme.homelander.traits;

/** Units used for food quantities and dispensed amounts. */
public enum MeasurementUnit {
  UNKNOWN_UNITS,
  NO_UNITS,
  CENTIMETERS,
  CUPS,
  DECILITERS,
  FEET,
  FLUID_OUNCES,
  GALLONS,
  GRAMS,
  INCHES,
  KILOGRAMS,
  LITERS,
  METERS,
  MILLIGRAMS,
  MILLILITERS,
  MILLIMETERS,
  OUNCES,
  PINCH,
  PINTS,
  PORTION,
  POUNDS,
  QUARTS,
  TABLESPOONS,
  TEASPOONS
}
