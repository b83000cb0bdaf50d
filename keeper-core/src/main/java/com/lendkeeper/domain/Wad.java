package com.lendkeeper.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for the 18-decimal ("WAD") precision every monetary value is kept in.
 * <p>
 * Scaling up from a token's native decimals is exact. Scaling down truncates toward zero; that is
 * the only lossy boundary.
 */
public final class Wad {

  public static final int DECIMALS = 18;
  public static final BigInteger ONE = BigInteger.TEN.pow(DECIMALS);

  private Wad() {
  }

  public static BigInteger fromDecimal(BigDecimal value) {
    if (value == null) {
      return BigInteger.ZERO;
    }
    return value.movePointRight(DECIMALS).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
  }

  public static BigDecimal toDecimal(BigInteger wad) {
    if (wad == null) {
      return BigDecimal.ZERO;
    }
    return new BigDecimal(wad, DECIMALS);
  }

  /**
   * Native token amount to WAD.
   */
  public static BigInteger fromTokenAmount(BigInteger amount, int tokenDecimals) {
    requireDecimals(tokenDecimals);
    if (tokenDecimals == DECIMALS) {
      return amount;
    }
    if (tokenDecimals < DECIMALS) {
      return amount.multiply(BigInteger.TEN.pow(DECIMALS - tokenDecimals));
    }
    return amount.divide(BigInteger.TEN.pow(tokenDecimals - DECIMALS));
  }

  /**
   * WAD to native token amount, truncating any precision the token cannot represent.
   */
  public static BigInteger toTokenAmount(BigInteger wad, int tokenDecimals) {
    requireDecimals(tokenDecimals);
    if (tokenDecimals == DECIMALS) {
      return wad;
    }
    if (tokenDecimals < DECIMALS) {
      return wad.divide(BigInteger.TEN.pow(DECIMALS - tokenDecimals));
    }
    return wad.multiply(BigInteger.TEN.pow(tokenDecimals - DECIMALS));
  }

  public static BigInteger multiply(BigInteger wad, BigDecimal factor) {
    return new BigDecimal(wad).multiply(factor).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
  }

  /**
   * WAD product, rounded down.
   */
  public static BigInteger mul(BigInteger a, BigInteger b) {
    return a.multiply(b).divide(ONE);
  }

  /**
   * WAD quotient, rounded down.
   */
  public static BigInteger div(BigInteger a, BigInteger b) {
    return a.multiply(ONE).divide(b);
  }

  private static void requireDecimals(int tokenDecimals) {
    if (tokenDecimals < 0 || tokenDecimals > 77) {
      throw new IllegalArgumentException("invalid token decimals: " + tokenDecimals);
    }
  }
}
