package com.lendkeeper.executor.chain;

import com.lendkeeper.config.KeeperProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class Web3jChainGateway implements ChainGateway {

  private static final List<String> NONCE_ERRORS = List.of(
      "nonce too low",
      "nonce too high",
      "already known",
      "replacement transaction underpriced",
      "invalid nonce",
      "nonce has already been used"
  );

  private final @NonNull KeeperProperties keeperProperties;
  private final @NonNull ChainProperties chainProperties;

  private volatile Web3j web3j;

  private Web3j web3j() {
    Web3j existing = web3j;
    if (existing != null) {
      return existing;
    }
    synchronized (this) {
      if (web3j == null) {
        web3j = Web3j.build(new HttpService(chainProperties.rpcUrl().toString()));
      }
      return web3j;
    }
  }

  @Override
  public BigInteger pendingNonce(String address) throws IOException {
    return web3j().ethGetTransactionCount(address, DefaultBlockParameterName.PENDING)
        .send()
        .getTransactionCount();
  }

  @Override
  public String send(Credentials signer, BigInteger nonce, TransactionRequest request) throws ChainTransactionException {
    EthSendTransaction send;
    BigInteger gasPrice;
    BigInteger gasLimit;
    try {
      gasPrice = resolveGasPrice();
      gasLimit = resolveGasLimit(signer.getAddress(), request);
      RawTransaction rawTx = RawTransaction.createTransaction(
          nonce,
          gasPrice,
          gasLimit,
          request.to(),
          request.value(),
          request.data()
      );
      byte[] signed = TransactionEncoder.signMessage(rawTx, keeperProperties.chainId(), signer);
      send = web3j().ethSendRawTransaction(Numeric.toHexString(signed)).send();
    } catch (IOException e) {
      throw new ChainTransactionException(ChainTransactionException.Kind.TRANSIENT_RPC,
          "rpc failure before broadcast: " + e.getMessage(), null, e);
    }
    if (send.hasError()) {
      String message = send.getError().getMessage();
      ChainTransactionException.Kind kind = isNonceMismatch(message)
          ? ChainTransactionException.Kind.NONCE_MISMATCH
          : ChainTransactionException.Kind.TRANSIENT_RPC;
      throw new ChainTransactionException(kind, "eth_sendRawTransaction error: " + message);
    }
    String txHash = send.getTransactionHash();
    log.info("tx sent (hash={}, nonce={}, to={}, gasPrice={}, gasLimit={})", txHash, nonce, request.to(), gasPrice, gasLimit);
    return txHash;
  }

  @Override
  public TransactionReceipt awaitReceipt(String txHash) throws ChainTransactionException, InterruptedException {
    long sleepMillis = chainProperties.receiptPollIntervalMillis();
    int attempts = chainProperties.receiptPollAttempts();

    for (int i = 0; i < attempts; i++) {
      Optional<TransactionReceipt> receipt = Optional.empty();
      try {
        EthGetTransactionReceipt resp = web3j().ethGetTransactionReceipt(txHash).send();
        receipt = resp.getTransactionReceipt();
      } catch (IOException e) {
        log.debug("receipt poll failed (hash={}): {}", txHash, e.toString());
      }
      if (receipt.isPresent()) {
        TransactionReceipt r = receipt.get();
        if (!r.isStatusOK()) {
          throw new ChainTransactionException(ChainTransactionException.Kind.REVERTED,
              "tx reverted (hash=" + txHash + ")", txHash, null);
        }
        log.info("tx confirmed (hash={}, block={}, gasUsed={})", txHash, r.getBlockNumber(), r.getGasUsed());
        return r;
      }
      Thread.sleep(sleepMillis);
    }

    throw new ChainTransactionException(ChainTransactionException.Kind.CONFIRMATION_TIMEOUT,
        "timed out waiting for receipt (hash=" + txHash + ", waited="
            + Duration.ofMillis(sleepMillis * (long) attempts) + ")", txHash, null);
  }

  @Override
  public String call(String to, String data) throws IOException {
    Transaction tx = Transaction.createEthCallTransaction(null, to, data);
    EthCall response = web3j().ethCall(tx, DefaultBlockParameterName.LATEST).send();
    if (response.hasError()) {
      throw new IOException("eth_call to " + to + " failed: " + response.getError().getMessage());
    }
    if (response.isReverted()) {
      throw new IOException("eth_call to " + to + " reverted: " + response.getRevertReason());
    }
    return response.getValue();
  }

  @Override
  public BigInteger blockNumber() throws IOException {
    EthBlockNumber response = web3j().ethBlockNumber().send();
    if (response.hasError()) {
      throw new IOException("eth_blockNumber failed: " + response.getError().getMessage());
    }
    return response.getBlockNumber();
  }

  @Override
  public List<Log> logs(String address, List<String> topics, BigInteger fromBlock, BigInteger toBlock)
      throws IOException {
    EthFilter filter = new EthFilter(
        DefaultBlockParameter.valueOf(fromBlock),
        DefaultBlockParameter.valueOf(toBlock),
        address);
    filter.addOptionalTopics(topics.toArray(new String[0]));
    EthLog response = web3j().ethGetLogs(filter).send();
    if (response.hasError()) {
      throw new IOException("eth_getLogs on " + address + " failed: " + response.getError().getMessage());
    }
    List<Log> logs = new ArrayList<>();
    for (EthLog.LogResult<?> result : response.getLogs()) {
      if (result.get() instanceof Log entry) {
        logs.add(entry);
      }
    }
    return logs;
  }

  static boolean isNonceMismatch(String message) {
    if (message == null) {
      return false;
    }
    String m = message.toLowerCase(Locale.ROOT);
    return NONCE_ERRORS.stream().anyMatch(m::contains);
  }

  private BigInteger resolveGasPrice() throws IOException {
    BigInteger base = web3j().ethGasPrice().send().getGasPrice();
    BigDecimal scaled = new BigDecimal(base).multiply(BigDecimal.valueOf(chainProperties.gasPriceMultiplier()));
    return scaled.setScale(0, RoundingMode.CEILING).toBigIntegerExact();
  }

  private BigInteger resolveGasLimit(String from, TransactionRequest request) {
    BigInteger fallback = BigInteger.valueOf(chainProperties.fallbackGasLimit());
    try {
      Transaction tx = Transaction.createFunctionCallTransaction(
          from, null, null, null, request.to(), request.value(), request.data());
      EthEstimateGas estimate = web3j().ethEstimateGas(tx).send();
      if (estimate.hasError() || estimate.getAmountUsed() == null) {
        log.debug("gas estimate failed for {}: {}", request.to(),
            estimate.hasError() ? estimate.getError().getMessage() : "no result");
        return fallback;
      }
      BigDecimal scaled = new BigDecimal(estimate.getAmountUsed())
          .multiply(BigDecimal.valueOf(chainProperties.gasLimitMultiplier()));
      return scaled.setScale(0, RoundingMode.CEILING).toBigIntegerExact().max(BigInteger.valueOf(21_000L));
    } catch (IOException e) {
      log.debug("gas estimate rpc failure for {}: {}", request.to(), e.toString());
      return fallback;
    }
  }
}
