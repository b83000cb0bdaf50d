package com.lendkeeper.executor.chain;

import java.io.IOException;

/**
 * A write that did not end in a successful receipt. {@link Kind} decides whether the nonce sequencer retries.
 */
public class ChainTransactionException extends IOException {

  public enum Kind {
    /**
     * The node rejected the nonce. The sequencer resyncs and retries once.
     */
    NONCE_MISMATCH,
    /**
     * Network or node failure before the transaction was accepted.
     */
    TRANSIENT_RPC,
    REVERTED,
    CONFIRMATION_TIMEOUT,
    /**
     * No keeper credentials are configured, so nothing can be signed.
     */
    NO_SIGNER
  }

  private final Kind kind;
  private final String txHash;

  public ChainTransactionException(Kind kind, String message) {
    this(kind, message, null, null);
  }

  public ChainTransactionException(Kind kind, String message, String txHash, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.txHash = txHash;
  }

  public Kind kind() {
    return kind;
  }

  public String txHash() {
    return txHash;
  }

  public boolean broadcast() {
    return kind == Kind.REVERTED || kind == Kind.CONFIRMATION_TIMEOUT;
  }
}
