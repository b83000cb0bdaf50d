package com.lendkeeper.price;

import com.lendkeeper.config.PriceSpec;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public sealed interface PriceOutcome permits PriceOutcome.Resolved, PriceOutcome.Unavailable {

  default Optional<BigDecimal> price() {
    return this instanceof Resolved r ? Optional.of(r.value()) : Optional.empty();
  }

  record Resolved(BigDecimal value, PriceSpec.Source tier) implements PriceOutcome {
  }

  /**
   * Every configured tier failed. {@code failures} holds one reason per tier, in the order they were tried.
   */
  record Unavailable(List<String> failures) implements PriceOutcome {
    public Unavailable {
      failures = List.copyOf(failures);
    }
  }
}
