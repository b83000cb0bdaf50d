package com.lendkeeper.domain;

import java.math.BigInteger;

public record Bucket(int index, BigInteger price, BigInteger deposit) {
}
