package com.lendkeeper.price;

import com.lendkeeper.domain.PoolSnapshot;

/**
 * What a price lookup may draw on besides remote sources. {@code snapshot} is required only by pool-reference specs.
 */
public record PriceContext(String poolName, PoolSnapshot snapshot) {

  public static PriceContext of(String poolName, PoolSnapshot snapshot) {
    return new PriceContext(poolName, snapshot);
  }
}
