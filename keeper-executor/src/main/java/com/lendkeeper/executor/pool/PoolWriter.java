package com.lendkeeper.executor.pool;

import com.lendkeeper.executor.chain.TransactionSubmitter;
import com.lendkeeper.executor.chain.TxOutcome;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Pool write calls, each submitted through the dry-run aware submitter.
 */
@Component
@RequiredArgsConstructor
public class PoolWriter {

  private final @NonNull TransactionSubmitter submitter;

  public TxOutcome kick(@NonNull String pool, @NonNull String borrower, int npLimitIndex) {
    return submitter.submit("kick", pool, AjnaPoolCallEncoder.encodeKick(borrower, npLimitIndex));
  }

  public TxOutcome bucketTake(@NonNull String pool, @NonNull String borrower, int bucketIndex) {
    return submitter.submit("bucketTake", pool, AjnaPoolCallEncoder.encodeBucketTake(borrower, false, bucketIndex));
  }

  public TxOutcome settle(@NonNull String pool, @NonNull String borrower, int maxDepth) {
    return submitter.submit("settle", pool, AjnaPoolCallEncoder.encodeSettle(borrower, maxDepth));
  }

  public TxOutcome removeQuoteToken(@NonNull String pool, @NonNull BigInteger maxAmount, int bucketIndex) {
    return submitter.submit("removeQuoteToken", pool, AjnaPoolCallEncoder.encodeRemoveQuoteToken(maxAmount, bucketIndex));
  }

  public TxOutcome removeCollateral(@NonNull String pool, @NonNull BigInteger maxAmount, int bucketIndex) {
    return submitter.submit("removeCollateral", pool, AjnaPoolCallEncoder.encodeRemoveCollateral(maxAmount, bucketIndex));
  }

  public TxOutcome withdrawBonds(@NonNull String pool, @NonNull String recipient, @NonNull BigInteger amount) {
    return submitter.submit("withdrawBonds", pool, AjnaPoolCallEncoder.encodeWithdrawBonds(recipient, amount));
  }
}
