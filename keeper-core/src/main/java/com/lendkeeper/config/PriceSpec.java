package com.lendkeeper.config;

import java.math.BigDecimal;

/**
 * How to price a pool's collateral in quote token.
 * <p>
 * Market specs name either a single token ({@code tokenId}, priced in USD) or a pair
 * ({@code collateralId} + {@code quoteId}, priced as collateral / quote). A {@code value} next to a
 * market source acts as the last-resort fixed tier.
 */
public record PriceSpec(
    Source source,
    String tokenId,
    String collateralId,
    String quoteId,
    BigDecimal value,
    PoolReference reference,
    Boolean invert
) {

  public PriceSpec {
    if (source == null) {
      source = value != null ? Source.FIXED : Source.COINGECKO;
    }
    if (invert == null) {
      invert = false;
    }
  }

  public static PriceSpec fixed(BigDecimal value) {
    return new PriceSpec(Source.FIXED, null, null, null, value, null, false);
  }

  public static PriceSpec market(String tokenId) {
    return new PriceSpec(Source.COINGECKO, tokenId, null, null, null, null, false);
  }

  public static PriceSpec pair(String collateralId, String quoteId) {
    return new PriceSpec(Source.COINGECKO, null, collateralId, quoteId, null, null, false);
  }

  public static PriceSpec pool(PoolReference reference) {
    return new PriceSpec(Source.POOL, null, null, null, null, reference, false);
  }

  public PriceSpec inverted() {
    return new PriceSpec(source, tokenId, collateralId, quoteId, value, reference, true);
  }

  public boolean isPair() {
    return collateralId != null && !collateralId.isBlank() && quoteId != null && !quoteId.isBlank();
  }

  public enum Source {
    /**
     * Primary external market source.
     */
    COINGECKO,
    /**
     * Fallback external market source.
     */
    ALCHEMY,
    FIXED,
    POOL
  }

  public enum PoolReference {
    LUP,
    HPB
  }
}
