package com.lendkeeper.executor.liquidity;

import java.util.Optional;

public sealed interface QuoteOutcome permits QuoteOutcome.Quoted, QuoteOutcome.NoLiquidity {

  default Optional<Quote> quoteIfPresent() {
    return this instanceof Quoted q ? Optional.of(q.quote()) : Optional.empty();
  }

  record Quoted(Quote quote) implements QuoteOutcome {
  }

  record NoLiquidity(String reason) implements QuoteOutcome {
  }
}
