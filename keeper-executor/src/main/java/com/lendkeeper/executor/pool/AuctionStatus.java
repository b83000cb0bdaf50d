package com.lendkeeper.executor.pool;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Live auction state from PoolInfoUtils. {@code price} is the current auction price in WAD.
 */
public record AuctionStatus(
    Instant kickTime,
    BigInteger collateral,
    BigInteger debtToCover,
    boolean collateralized,
    BigInteger price,
    BigInteger neutralPrice
) {

  public boolean active() {
    return kickTime.getEpochSecond() != 0;
  }
}
