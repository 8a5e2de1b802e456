package com.execrisk.engine.intake;

import com.execrisk.domain.orders.OrderDomainException;

public class IntentValidationException extends OrderDomainException {
  public static final String UNKNOWN_INSTRUMENT = "UNKNOWN_INSTRUMENT";

  public IntentValidationException(String code, String message) {
    super(code, message);
  }
}
