package com.acme.homelander.device;

import java.util.List;

public record DeviceName(List<String> defaultNames, String name, List<String> nicknames) {
  public DeviceName {
    defaultNames = defaultNames == null ? List.of() : List.copyOf(defaultNames);
    nicknames = nicknames == null ? List.of() : List.copyOf(nicknames);
  }

  public static DeviceName of(String name) {
    return new DeviceName(List.of(), name, List.of());
  }
}
