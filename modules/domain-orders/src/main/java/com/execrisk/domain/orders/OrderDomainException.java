package com.execrisk.domain.orders;

public class OrderDomainException extends RuntimeException {
  public static final String INVALID_ORDER = "INVALID_ORDER";

  private final String code;

  public OrderDomainException(String message) {
    this(INVALID_ORDER, message);
  }

  public OrderDomainException(String code, String message) {
    super(message);
    this.code = code == null || code.isBlank() ? INVALID_ORDER : code;
  }

  public String code() {
    return code;
  }
}
