package com.lendkeeper.config;

/**
 * Pool flavour behind a quote. {@code AGGREGATED} is used by aggregator APIs that route across pools.
 */
public enum PoolVariant {
  AGGREGATED,
  VOLATILE,
  STABLE,
  CONCENTRATED
}
