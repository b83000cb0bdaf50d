package com.lendkeeper.domain;

import lombok.NonNull;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * A liquidation auction. Monetary fields are WAD.
 */
public record Auction(
    @NonNull String borrower,
    @NonNull BigInteger collateralRemaining,
    @NonNull BigInteger debtRemaining,
    @NonNull BigInteger neutralPrice,
    @NonNull Instant kickTime,
    boolean settled
) {

  public Duration age(Instant now) {
    return Duration.between(kickTime, now);
  }

  public boolean collateralExhausted() {
    return collateralRemaining.signum() == 0;
  }

  public boolean hasBadDebt() {
    return collateralExhausted() && debtRemaining.signum() > 0;
  }
}
