package com.lendkeeper.executor.cycle;

import com.lendkeeper.executor.chain.TxOutcome;

/**
 * What an engine did, or declined to do, for one subject (borrower or token).
 */
public record ActionOutcome(Action action, String subject, Status status, String reason, String txHash) {

  public enum Action {
    KICK,
    APPROVE,
    EXTERNAL_TAKE,
    ARB_TAKE,
    SETTLE,
    WITHDRAW_BONDS,
    UPDATE_INTEREST,
    COLLECT_LP,
    REWARD_SWAP,
    REWARD_TRANSFER
  }

  public enum Status {
    EXECUTED,
    DRY_RUN,
    SKIPPED,
    FAILED
  }

  public static ActionOutcome skipped(Action action, String subject, String reason) {
    return new ActionOutcome(action, subject, Status.SKIPPED, reason, null);
  }

  public static ActionOutcome failed(Action action, String subject, String reason) {
    return new ActionOutcome(action, subject, Status.FAILED, reason, null);
  }

  public static ActionOutcome of(Action action, String subject, TxOutcome tx) {
    return switch (tx.status()) {
      case CONFIRMED -> new ActionOutcome(action, subject, Status.EXECUTED, null, tx.txHash());
      case DRY_RUN -> new ActionOutcome(action, subject, Status.DRY_RUN, null, null);
      case FAILED -> new ActionOutcome(action, subject, Status.FAILED,
          tx.failureKind() + ": " + tx.error(), tx.txHash());
    };
  }

  public boolean executed() {
    return status == Status.EXECUTED;
  }
}
