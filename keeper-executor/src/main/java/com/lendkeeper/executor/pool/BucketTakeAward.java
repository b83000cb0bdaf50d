package com.lendkeeper.executor.pool;

import org.web3j.abi.EventEncoder;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LP a bucket take awarded to its taker and to the auction's kicker.
 * <p>
 * The pool emits {@code BucketTakeLPAwarded} without the bucket index; the index comes from the
 * {@code BucketTake} event of the same transaction. Events pair up in emission order within a transaction.
 */
public record BucketTakeAward(
    String txHash,
    int bucketIndex,
    String taker,
    String kicker,
    BigInteger lpAwardedTaker,
    BigInteger lpAwardedKicker
) {

  static final String BUCKET_TAKE =
      EventEncoder.buildEventSignature("BucketTake(address,uint256,uint256,uint256,uint256,bool)");
  static final String BUCKET_TAKE_LP_AWARDED =
      EventEncoder.buildEventSignature("BucketTakeLPAwarded(address,address,uint256,uint256)");

  static final List<String> TOPICS = List.of(BUCKET_TAKE, BUCKET_TAKE_LP_AWARDED);

  static List<BucketTakeAward> pair(List<Log> logs) {
    Map<String, List<Log>> byTx = new LinkedHashMap<>();
    for (Log log : logs) {
      if (log.getTopics() == null || log.getTopics().isEmpty() || log.isRemoved()) {
        continue;
      }
      byTx.computeIfAbsent(log.getTransactionHash(), k -> new ArrayList<>()).add(log);
    }

    List<BucketTakeAward> awards = new ArrayList<>();
    for (Map.Entry<String, List<Log>> tx : byTx.entrySet()) {
      Deque<Integer> indexes = new ArrayDeque<>();
      Deque<Log> awarded = new ArrayDeque<>();
      for (Log log : tx.getValue()) {
        String topic = log.getTopics().get(0);
        if (BUCKET_TAKE.equalsIgnoreCase(topic)) {
          indexes.add(word(log.getData(), 0).intValueExact());
        } else if (BUCKET_TAKE_LP_AWARDED.equalsIgnoreCase(topic)) {
          awarded.add(log);
        }
      }
      while (!indexes.isEmpty() && !awarded.isEmpty()) {
        Log award = awarded.poll();
        awards.add(new BucketTakeAward(
            tx.getKey(),
            indexes.poll(),
            topicAddress(award, 1),
            topicAddress(award, 2),
            word(award.getData(), 0),
            word(award.getData(), 1)
        ));
      }
    }
    return awards;
  }

  private static BigInteger word(String data, int index) {
    String hex = Numeric.cleanHexPrefix(data);
    int start = index * 64;
    if (hex.length() < start + 64) {
      throw new IllegalArgumentException("event data too short for word " + index);
    }
    return new BigInteger(hex.substring(start, start + 64), 16);
  }

  private static String topicAddress(Log log, int index) {
    String topic = Numeric.cleanHexPrefix(log.getTopics().get(index));
    return "0x" + topic.substring(topic.length() - 40);
  }
}
