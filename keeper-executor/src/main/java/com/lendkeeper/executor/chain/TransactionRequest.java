package com.lendkeeper.executor.chain;

import lombok.NonNull;

import java.math.BigInteger;

/**
 * Unsigned contract call. Gas is resolved by the gateway at send time.
 */
public record TransactionRequest(@NonNull String to, @NonNull String data, @NonNull BigInteger value) {

  public static TransactionRequest call(String to, String data) {
    return new TransactionRequest(to, data, BigInteger.ZERO);
  }
}
