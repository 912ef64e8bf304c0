package com.acme.homelander.traits;

public enum TemperatureUnit {
  C,
  F
}
