package com.acme.homelander.traits;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Languages the platform accepts for synonyms and spoken responses. */
public enum Language {
  DANISH("da"),
  DUTCH("nl"),
  ENGLISH("en"),
  FRENCH("fr"),
  GERMAN("de"),
  HINDI("hi"),
  INDONESIAN("id"),
  ITALIAN("it"),
  JAPANESE("ja"),
  KOREAN("ko"),
  NORWEGIAN("no"),
  PORTUGUESE_BRAZILIAN("pt-BR"),
  SPANISH("es"),
  SWEDISH("sv"),
  THAI("th"),
  CHINESE_TRADITIONAL("zh-TW");

  private final String code;

  Language(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static Language fromCode(String code) {
    for (Language language : values()) {
      if (language.code.equals(code)) {
        return language;
      }
    }
    throw new IllegalArgumentException("Unknown language code: " + code);
  }
}
