package com.lendkeeper.executor.chain;

/**
 * Result of one write as seen by the engines. Never thrown.
 */
public record TxOutcome(String label, Status status, String txHash, ChainTransactionException.Kind failureKind, String error) {

  public enum Status {
    CONFIRMED,
    DRY_RUN,
    FAILED
  }

  public static TxOutcome confirmed(String label, String txHash) {
    return new TxOutcome(label, Status.CONFIRMED, txHash, null, null);
  }

  public static TxOutcome dryRun(String label) {
    return new TxOutcome(label, Status.DRY_RUN, null, null, null);
  }

  public static TxOutcome failed(String label, ChainTransactionException.Kind kind, String error, String txHash) {
    return new TxOutcome(label, Status.FAILED, txHash, kind, error);
  }

  public boolean confirmed() {
    return status == Status.CONFIRMED;
  }

  public boolean failed() {
    return status == Status.FAILED;
  }

  public boolean reverted() {
    return failureKind == ChainTransactionException.Kind.REVERTED;
  }
}
