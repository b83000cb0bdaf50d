package com.lendkeeper.executor.liquidity;

import com.lendkeeper.config.LiquiditySource;
import com.lendkeeper.config.PoolVariant;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One liquidity source. Amounts are in the tokens' native units. Lookups and quotes report missing pools or
 * liquidity as outcome values instead of throwing.
 */
public interface LiquidityRouter {

  LiquiditySource source();

  /**
   * @param hint preferred pool variant, or null to let the router search in its documented order
   */
  PoolLookup poolExists(String tokenA, String tokenB, PoolVariant hint);

  QuoteOutcome getQuote(BigInteger amountIn, String tokenIn, String tokenOut, PoolVariant hint);

  /**
   * Calldata for swapping exactly {@code quote.amountIn()} with at least {@code minOut} delivered to
   * {@code recipient}. Never cached: callers build a new instruction for every attempt.
   */
  SwapInstruction buildSwapInstruction(Quote quote, BigInteger minOut, Instant deadline, String recipient);
}
