package com.execrisk.engine.ledger;

import com.execrisk.domain.ledger.Position;
import java.util.Objects;

public record FillApplication(FillOutcome outcome, Position position) {
  public FillApplication {
    Objects.requireNonNull(outcome, "outcome must not be null");
    Objects.requireNonNull(position, "position must not be null");
  }

  public boolean applied() {
    return outcome == FillOutcome.APPLIED;
  }
}
