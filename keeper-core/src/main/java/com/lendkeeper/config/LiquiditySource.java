package com.lendkeeper.config;

/**
 * External liquidity a pool may use for takes and reward swaps. Selected by configuration only.
 */
public enum LiquiditySource {
  NONE,
  ONE_INCH,
  UNISWAP_V3,
  AERODROME
}
