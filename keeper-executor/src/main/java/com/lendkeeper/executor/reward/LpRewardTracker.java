package com.lendkeeper.executor.reward;

import com.lendkeeper.domain.Wad;
import com.lendkeeper.executor.chain.ChainGateway;
import com.lendkeeper.executor.pool.AjnaPoolReader;
import com.lendkeeper.executor.pool.BucketTakeAward;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LP this account earned from bucket takes, per pool and bucket, built from the pool's bucket-take events.
 * Tracking for a pool starts at the chain head seen on its first refresh; earlier awards are not counted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LpRewardTracker {

  static final long MAX_BLOCK_RANGE = 2_000L;

  private final @NonNull ChainGateway gateway;
  private final @NonNull AjnaPoolReader poolReader;

  private final Map<String, PoolLp> pools = new ConcurrentHashMap<>();

  /**
   * Scans blocks since the last refresh and returns the LP still owed per bucket index.
   */
  public SortedMap<Integer, BigInteger> refresh(@NonNull String pool, @NonNull String self) throws IOException {
    PoolLp state = pools.computeIfAbsent(key(pool), k -> new PoolLp());
    synchronized (state) {
      BigInteger head = gateway.blockNumber();
      if (state.scannedTo == null) {
        state.scannedTo = head;
        log.info("pool={} tracking bucket-take LP rewards from block {}", pool, head);
        return new TreeMap<>(state.lp);
      }
      BigInteger from = state.scannedTo.add(BigInteger.ONE);
      while (from.compareTo(head) <= 0) {
        BigInteger to = from.add(BigInteger.valueOf(MAX_BLOCK_RANGE - 1)).min(head);
        for (BucketTakeAward award : poolReader.bucketTakeAwards(pool, from, to)) {
          credit(pool, self, state, award);
        }
        state.scannedTo = to;
        from = to.add(BigInteger.ONE);
      }
      return new TreeMap<>(state.lp);
    }
  }

  /**
   * Records what is left of a bucket's reward after a redemption. Zero or less forgets the bucket.
   */
  public void update(@NonNull String pool, int bucketIndex, @NonNull BigInteger remainingLp) {
    PoolLp state = pools.computeIfAbsent(key(pool), k -> new PoolLp());
    synchronized (state) {
      if (remainingLp.signum() <= 0) {
        state.lp.remove(bucketIndex);
      } else {
        state.lp.put(bucketIndex, remainingLp);
      }
    }
  }

  private static void credit(String pool, String self, PoolLp state, BucketTakeAward award) {
    BigInteger earned = BigInteger.ZERO;
    if (self.equalsIgnoreCase(award.taker())) {
      earned = earned.add(award.lpAwardedTaker());
    }
    if (self.equalsIgnoreCase(award.kicker())) {
      earned = earned.add(award.lpAwardedKicker());
    }
    if (earned.signum() > 0) {
      state.lp.merge(award.bucketIndex(), earned, BigInteger::add);
      log.info("pool={} earned {} LP in bucket {} (tx={})", pool, Wad.toDecimal(earned), award.bucketIndex(),
          award.txHash());
    }
  }

  private static String key(String pool) {
    return pool.toLowerCase(Locale.ROOT);
  }

  private static final class PoolLp {
    private BigInteger scannedTo;
    private final Map<Integer, BigInteger> lp = new TreeMap<>();
  }
}
