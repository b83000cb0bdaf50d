package com.lendkeeper.executor.liquidity;

import com.lendkeeper.config.LiquiditySource;
import com.lendkeeper.config.PoolVariant;

import java.math.BigInteger;

public record Quote(
    LiquiditySource source,
    String tokenIn,
    String tokenOut,
    BigInteger amountIn,
    BigInteger amountOut,
    PoolVariant poolVariant,
    String poolAddress,
    Integer feeTier
) {
}
