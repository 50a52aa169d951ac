package com.gentoro.aistack.providers.safety;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Hazard taxonomy of the Llama Guard 3 classifiers. */
public enum SafetyCategory {
  S1("Violent Crimes"),
  S2("Non-Violent Crimes"),
  S3("Sex Crimes"),
  S4("Child Exploitation"),
  S5("Defamation"),
  S6("Specialized Advice"),
  S7("Privacy"),
  S8("Intellectual Property"),
  S9("Indiscriminate Weapons"),
  S10("Hate"),
  S11("Self-Harm"),
  S12("Sexual Content"),
  S13("Elections"),
  S14("Code Interpreter Abuse");

  private final String title;

  SafetyCategory(String title) {
    this.title = title;
  }

  public String code() {
    return name();
  }

  public String title() {
    return title;
  }

  /** Accepts a code ({@code S9}) or a title ({@code Indiscriminate Weapons}). */
  public static Optional<SafetyCategory> parse(String value) {
    if (value == null) return Optional.empty();
    String v = value.trim();
    return Arrays.stream(values())
        .filter(c -> c.name().equalsIgnoreCase(v) || c.title.equalsIgnoreCase(v))
        .findFirst();
  }

  /** S14 is only part of the 8B model's policy. */
  public static List<SafetyCategory> forModel(String model) {
    String m = model == null ? "" : model.toLowerCase(Locale.ROOT);
    boolean large = m.contains("8b");
    return Arrays.stream(values()).filter(c -> large || c != S14).toList();
  }
}
