package com.acme.homelander.state;

import java.util.Map;
import java.util.Optional;

final class Fragments {
  private Fragments() {}

  static void putIfPresent(Map<String, Object> fragment, String key, Optional<?> value) {
    value.ifPresent(v -> fragment.put(key, v));
  }
}
