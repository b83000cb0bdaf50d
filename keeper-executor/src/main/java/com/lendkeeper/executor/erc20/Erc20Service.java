package com.lendkeeper.executor.erc20;

import com.lendkeeper.executor.chain.ChainGateway;
import com.lendkeeper.executor.chain.TransactionSubmitter;
import com.lendkeeper.executor.chain.TxOutcome;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ERC-20 reads plus approvals and transfers routed through the transaction submitter. Allowance changes for one
 * token/spender pair are serialized with {@link #allowanceLock}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Erc20Service {

  private final @NonNull ChainGateway gateway;
  private final @NonNull TransactionSubmitter submitter;

  private final Map<String, Integer> decimalsCache = new ConcurrentHashMap<>();
  private final Map<String, ReentrantLock> allowanceLocks = new ConcurrentHashMap<>();

  public BigInteger balanceOf(@NonNull String token, @NonNull String owner) throws IOException {
    return readUint(token, Erc20CallEncoder.balanceOf(owner));
  }

  public BigInteger allowance(@NonNull String token, @NonNull String owner, @NonNull String spender) throws IOException {
    return readUint(token, Erc20CallEncoder.allowance(owner, spender));
  }

  public int decimals(@NonNull String token) throws IOException {
    String key = token.toLowerCase(Locale.ROOT);
    Integer cached = decimalsCache.get(key);
    if (cached != null) {
      return cached;
    }
    int decimals = readUint(token, Erc20CallEncoder.decimals()).intValueExact();
    decimalsCache.put(key, decimals);
    return decimals;
  }

  public TxOutcome approve(@NonNull String token, @NonNull String spender, @NonNull BigInteger amount) {
    log.info("approving {} of token {} for spender {}", amount, token, spender);
    return submitter.submit("approve", token, Erc20CallEncoder.encodeApprove(spender, amount));
  }

  public TxOutcome transfer(@NonNull String token, @NonNull String to, @NonNull BigInteger amount) {
    log.info("transferring {} of token {} to {}", amount, token, to);
    return submitter.submit("transfer", token, Erc20CallEncoder.encodeTransfer(to, amount));
  }

  /**
   * Sets the allowance back to zero when anything is left. Empty when nothing needed resetting.
   */
  public Optional<TxOutcome> resetAllowance(@NonNull String token, @NonNull String owner, @NonNull String spender) {
    try {
      BigInteger remaining = allowance(token, owner, spender);
      if (remaining.signum() == 0) {
        return Optional.empty();
      }
    } catch (IOException e) {
      log.warn("allowance read failed before reset token={} spender={}: {}", token, spender, e.toString());
    }
    TxOutcome outcome = approve(token, spender, BigInteger.ZERO);
    if (outcome.failed()) {
      log.warn("allowance reset failed token={} spender={}: {}", token, spender, outcome.error());
    }
    return Optional.of(outcome);
  }

  public ReentrantLock allowanceLock(@NonNull String token, @NonNull String spender) {
    String key = token.toLowerCase(Locale.ROOT) + ":" + spender.toLowerCase(Locale.ROOT);
    return allowanceLocks.computeIfAbsent(key, k -> new ReentrantLock(true));
  }

  private BigInteger readUint(String token, Function fn) throws IOException {
    String value = gateway.call(token, FunctionEncoder.encode(fn));
    List<Type> decoded = FunctionReturnDecoder.decode(value, fn.getOutputParameters());
    if (decoded == null || decoded.isEmpty()) {
      throw new IOException(fn.getName() + " on " + token + " returned no data");
    }
    Object raw = decoded.get(0).getValue();
    if (raw instanceof BigInteger bi) {
      return bi;
    }
    throw new IOException(fn.getName() + " on " + token + " returned " + raw);
  }
}
