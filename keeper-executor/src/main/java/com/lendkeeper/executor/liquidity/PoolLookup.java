package com.lendkeeper.executor.liquidity;

import com.lendkeeper.config.PoolVariant;

/**
 * Result of a pool lookup. {@code feeTier} is set only by routers whose variants are fee tiers.
 */
public record PoolLookup(boolean exists, PoolVariant variant, String address, Integer feeTier, String reason) {

  public static PoolLookup found(PoolVariant variant, String address) {
    return new PoolLookup(true, variant, address, null, null);
  }

  public static PoolLookup found(PoolVariant variant, String address, int feeTier) {
    return new PoolLookup(true, variant, address, feeTier, null);
  }

  public static PoolLookup notFound(String reason) {
    return new PoolLookup(false, null, null, null, reason);
  }
}
