package com.lendkeeper.executor.pool;

import java.math.BigInteger;

public record KickerInfo(BigInteger claimable, BigInteger locked) {
}
