package com.lendkeeper.executor.chain;

import java.math.BigInteger;

/**
 * Builds the transaction for the nonce the sequencer assigned. Called again with a fresh nonce on resync.
 */
@FunctionalInterface
public interface TransactionBuilder {

  TransactionRequest build(BigInteger nonce);
}
