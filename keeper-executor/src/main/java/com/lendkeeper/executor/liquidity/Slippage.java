package com.lendkeeper.executor.liquidity;

import java.math.BigInteger;

public final class Slippage {

  public static final int BPS_DENOMINATOR = 10_000;

  private Slippage() {
  }

  /**
   * {@code quoteOut * (10000 - bps) / 10000}, truncated.
   */
  public static BigInteger minOut(BigInteger quoteOut, int slippageBps) {
    if (slippageBps < 0 || slippageBps > BPS_DENOMINATOR) {
      throw new IllegalArgumentException("slippage bps out of range: " + slippageBps);
    }
    return quoteOut.multiply(BigInteger.valueOf(BPS_DENOMINATOR - slippageBps))
        .divide(BigInteger.valueOf(BPS_DENOMINATOR));
  }
}
