package com.soldexhub.domain.trades;

final class DomainChecks {
  private DomainChecks() {}

  static String requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new TradeDomainException(fieldName + " must not be blank");
    }
    return value;
  }

  static long requireNonNegative(long value, String fieldName) {
    if (value < 0) {
      throw new TradeDomainException(fieldName + " must be >= 0");
    }
    return value;
  }

  static int requireDecimals(int value, String fieldName) {
    if (value < 0 || value > 255) {
      throw new TradeDomainException(fieldName + " must be between 0 and 255");
    }
    return value;
  }
}
