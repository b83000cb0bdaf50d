package com.lendkeeper.executor.pool;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Pool-side auction record. A zero {@code kickTime} means the borrower has no active auction.
 */
public record AuctionInfo(
    String kicker,
    BigInteger bondFactor,
    BigInteger bondSize,
    Instant kickTime,
    BigInteger referencePrice,
    BigInteger neutralPrice
) {

  public boolean active() {
    return kickTime.getEpochSecond() != 0;
  }
}
