package com.lendkeeper.executor.chain;

import org.web3j.crypto.Credentials;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;

/**
 * Raw JSON-RPC operations. Nonce bookkeeping lives in {@link NonceSequencer}, not here.
 */
public interface ChainGateway {

  BigInteger pendingNonce(String address) throws IOException;

  /**
   * Signs and broadcasts. Returns the transaction hash once the node accepted it.
   */
  String send(Credentials signer, BigInteger nonce, TransactionRequest request) throws ChainTransactionException;

  /**
   * Polls for the receipt. A reverted receipt or an exhausted wait is a {@link ChainTransactionException}.
   */
  TransactionReceipt awaitReceipt(String txHash) throws ChainTransactionException, InterruptedException;

  /**
   * eth_call against the latest block. Returns the raw hex result.
   */
  String call(String to, String data) throws IOException;

  BigInteger blockNumber() throws IOException;

  /**
   * eth_getLogs emitted by {@code address} whose first topic is any of {@code topics}, both block bounds inclusive.
   */
  List<Log> logs(String address, List<String> topics, BigInteger fromBlock, BigInteger toBlock) throws IOException;
}
