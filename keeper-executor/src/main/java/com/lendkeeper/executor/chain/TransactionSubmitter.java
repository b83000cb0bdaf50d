package com.lendkeeper.executor.chain;

import com.lendkeeper.config.KeeperProperties;
import com.lendkeeper.executor.metrics.KeeperMetrics;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

/**
 * Entry point for every write. In dry-run mode the call is logged and never reaches the nonce queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionSubmitter {

  private final @NonNull KeeperProperties keeperProperties;
  private final @NonNull SignerContext signerContext;
  private final @NonNull NonceSequencer sequencer;
  private final @NonNull KeeperMetrics metrics;

  public boolean dryRun() {
    return keeperProperties.dryRun();
  }

  public TxOutcome submit(@NonNull String label, @NonNull String to, @NonNull String data) {
    if (dryRun()) {
      log.info("dry run - would send {} to {}", label, to);
      metrics.recordTransaction(label, TxOutcome.Status.DRY_RUN);
      return TxOutcome.dryRun(label);
    }
    Credentials signer = signerContext.credentials().orElse(null);
    if (signer == null) {
      log.warn("{} to {} not sent: no keeper credentials configured", label, to);
      metrics.recordTransaction(label, TxOutcome.Status.FAILED);
      return TxOutcome.failed(label, ChainTransactionException.Kind.NO_SIGNER, "no keeper credentials configured", null);
    }
    TxOutcome outcome;
    try {
      TransactionReceipt receipt = sequencer.submit(signer, label, nonce -> TransactionRequest.call(to, data));
      outcome = TxOutcome.confirmed(label, receipt.getTransactionHash());
    } catch (ChainTransactionException e) {
      log.warn("{} to {} failed ({}): {}", label, to, e.kind(), e.getMessage());
      outcome = TxOutcome.failed(label, e.kind(), e.getMessage(), e.txHash());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      outcome = TxOutcome.failed(label, ChainTransactionException.Kind.TRANSIENT_RPC, "interrupted", null);
    }
    metrics.recordTransaction(label, outcome.status());
    return outcome;
  }
}
