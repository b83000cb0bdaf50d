package com.lendkeeper.executor.chain;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes every write of a signer through one fair queue.
 * <p>
 * A caller holds the signer's slot from nonce assignment through broadcast and receipt wait, so broadcast
 * order equals submission order and at most one transaction per signer is unconfirmed. The next nonce is
 * read from the chain once and then advanced locally after each accepted broadcast. Anything that fails
 * before the node accepted the transaction drops the cached nonce; a nonce rejection additionally retries
 * the same operation once with a freshly read nonce.
 */
@Component
@Slf4j
public class NonceSequencer {

  private final ChainGateway gateway;
  private final Map<String, SignerQueue> queues = new ConcurrentHashMap<>();

  public NonceSequencer(@NonNull ChainGateway gateway) {
    this.gateway = gateway;
  }

  public TransactionReceipt submit(
      @NonNull Credentials signer,
      @NonNull String label,
      @NonNull TransactionBuilder builder
  ) throws ChainTransactionException, InterruptedException {
    SignerQueue queue = queue(signer.getAddress());
    queue.lock.lockInterruptibly();
    try {
      return submitLocked(queue, signer, label, builder, true);
    } finally {
      queue.lock.unlock();
    }
  }

  Optional<BigInteger> cachedNonce(String address) {
    SignerQueue queue = queues.get(key(address));
    return queue == null ? Optional.empty() : Optional.ofNullable(queue.nextNonce);
  }

  private TransactionReceipt submitLocked(
      SignerQueue queue,
      Credentials signer,
      String label,
      TransactionBuilder builder,
      boolean mayResync
  ) throws ChainTransactionException, InterruptedException {
    BigInteger nonce = nextNonce(queue, signer.getAddress());
    String txHash;
    try {
      TransactionRequest request = builder.build(nonce);
      txHash = gateway.send(signer, nonce, request);
    } catch (ChainTransactionException e) {
      queue.nextNonce = null;
      if (e.kind() == ChainTransactionException.Kind.NONCE_MISMATCH && mayResync) {
        log.warn("{} rejected for nonce {} ({}); resyncing and retrying once", label, nonce, e.getMessage());
        return submitLocked(queue, signer, label, builder, false);
      }
      throw e;
    } catch (RuntimeException e) {
      queue.nextNonce = null;
      throw e;
    }
    queue.nextNonce = nonce.add(BigInteger.ONE);
    log.debug("{} broadcast with nonce {} (hash={})", label, nonce, txHash);
    return gateway.awaitReceipt(txHash);
  }

  private BigInteger nextNonce(SignerQueue queue, String address) throws ChainTransactionException {
    if (queue.nextNonce != null) {
      return queue.nextNonce;
    }
    try {
      BigInteger pending = gateway.pendingNonce(address);
      log.debug("nonce synced from chain for {}: {}", address, pending);
      return pending;
    } catch (IOException e) {
      throw new ChainTransactionException(ChainTransactionException.Kind.TRANSIENT_RPC,
          "failed reading pending nonce for " + address + ": " + e.getMessage(), null, e);
    }
  }

  private SignerQueue queue(String address) {
    return queues.computeIfAbsent(key(address), k -> new SignerQueue());
  }

  private static String key(String address) {
    return address.toLowerCase(Locale.ROOT);
  }

  private static final class SignerQueue {
    private final ReentrantLock lock = new ReentrantLock(true);
    // guarded by lock
    private BigInteger nextNonce;
  }
}
