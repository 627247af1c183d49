package com.ospicorp.priceapi.estimator;

import java.util.Locale;
import java.util.Optional;

public enum LogisticsMode {
  FARMGATE(0.90),
  WHOLESALE(1.00),
  RETAIL(1.20);

  static final double NEUTRAL_MULTIPLIER = 1.00;

  private final double multiplier;

  LogisticsMode(double multiplier) {
    this.multiplier = multiplier;
  }

  public double multiplier() {
    return multiplier;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<LogisticsMode> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (LogisticsMode mode : values()) {
      if (mode.code().equals(code.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }

  // Unrecognised codes are neutral; strict callers validate with fromCode
  public static double multiplierFor(String code) {
    return fromCode(code).map(LogisticsMode::multiplier).orElse(NEUTRAL_MULTIPLIER);
  }
}
