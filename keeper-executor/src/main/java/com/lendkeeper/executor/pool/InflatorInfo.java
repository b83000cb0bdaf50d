package com.lendkeeper.executor.pool;

import java.math.BigInteger;
import java.time.Instant;

public record InflatorInfo(BigInteger inflator, Instant lastUpdate) {
}
