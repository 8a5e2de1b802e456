package com.execrisk.infra.kafka.producer;

final class ProducerKeys {
  private ProducerKeys() {}

  static String require(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
    return value;
  }
}
