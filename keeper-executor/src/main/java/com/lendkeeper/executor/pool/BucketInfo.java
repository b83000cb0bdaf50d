package com.lendkeeper.executor.pool;

import java.math.BigInteger;

/**
 * One bucket as reported by PoolInfoUtils. Every amount is WAD.
 */
public record BucketInfo(
    int index,
    BigInteger price,
    BigInteger quoteTokens,
    BigInteger collateral,
    BigInteger bucketLp,
    BigInteger exchangeRate
) {
}
