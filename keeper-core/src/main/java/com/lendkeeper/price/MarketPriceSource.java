package com.lendkeeper.price;

import com.lendkeeper.config.PriceSpec;

import java.math.BigDecimal;

/**
 * A remote USD price feed keyed by market token id.
 */
public interface MarketPriceSource {

  PriceSpec.Source source();

  /**
   * False when the source lacks credentials and must not be called.
   */
  boolean configured();

  /**
   * @throws RuntimeException when the remote lookup fails or returns no price
   */
  BigDecimal usdPrice(String tokenId);
}
