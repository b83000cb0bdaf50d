package com.lendkeeper.executor.liquidity;

import java.math.BigInteger;

/**
 * Opaque router call: the contract to call, its calldata and the native value to attach.
 */
public record SwapInstruction(String router, String calldata, BigInteger value) {
}
