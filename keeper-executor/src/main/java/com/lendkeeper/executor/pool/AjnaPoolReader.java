package com.lendkeeper.executor.pool;

import com.lendkeeper.executor.chain.ChainGateway;
import com.lendkeeper.executor.chain.ChainProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.core.methods.response.Log;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * On-chain reads against a pool. Token addresses never change for a pool and are cached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AjnaPoolReader {

  private final @NonNull ChainGateway gateway;
  private final @NonNull ChainProperties chainProperties;

  private final Map<String, String> quoteTokens = new ConcurrentHashMap<>();
  private final Map<String, String> collateralTokens = new ConcurrentHashMap<>();

  public AuctionInfo auctionInfo(@NonNull String pool, @NonNull String borrower) throws IOException {
    List<Type> out = read(pool, AjnaPoolCallEncoder.auctionInfo(borrower));
    return new AuctionInfo(
        address(out, 0),
        uint(out, 1),
        uint(out, 2),
        Instant.ofEpochSecond(uint(out, 3).longValueExact()),
        uint(out, 4),
        uint(out, 5)
    );
  }

  public AuctionStatus auctionStatus(@NonNull String pool, @NonNull String borrower) throws IOException {
    List<Type> out = read(poolInfoUtils(), AjnaPoolCallEncoder.auctionStatus(pool, borrower));
    return new AuctionStatus(
        Instant.ofEpochSecond(uint(out, 0).longValueExact()),
        uint(out, 1),
        uint(out, 2),
        Boolean.TRUE.equals(out.get(3).getValue()),
        uint(out, 4),
        uint(out, 5)
    );
  }

  public KickerInfo kickerInfo(@NonNull String pool, @NonNull String kicker) throws IOException {
    List<Type> out = read(pool, AjnaPoolCallEncoder.kickerInfo(kicker));
    return new KickerInfo(uint(out, 0), uint(out, 1));
  }

  public BucketInfo bucketInfo(@NonNull String pool, int bucketIndex) throws IOException {
    List<Type> out = read(poolInfoUtils(), AjnaPoolCallEncoder.bucketInfo(pool, bucketIndex));
    return new BucketInfo(bucketIndex, uint(out, 0), uint(out, 1), uint(out, 2), uint(out, 3), uint(out, 5));
  }

  /**
   * LP {@code lender} holds in one bucket.
   */
  public BigInteger lpBalance(@NonNull String pool, int bucketIndex, @NonNull String lender) throws IOException {
    return uint(read(pool, AjnaPoolCallEncoder.lenderInfo(bucketIndex, lender)), 0);
  }

  /**
   * Bucket-take LP awards in the inclusive block range, each paired with the bucket it was taken into.
   */
  public List<BucketTakeAward> bucketTakeAwards(@NonNull String pool, @NonNull BigInteger fromBlock,
      @NonNull BigInteger toBlock) throws IOException {
    List<Log> logs = gateway.logs(pool, BucketTakeAward.TOPICS, fromBlock, toBlock);
    return BucketTakeAward.pair(logs);
  }

  public InflatorInfo inflatorInfo(@NonNull String pool) throws IOException {
    List<Type> out = read(pool, AjnaPoolCallEncoder.inflatorInfo());
    return new InflatorInfo(uint(out, 0), Instant.ofEpochSecond(uint(out, 1).longValueExact()));
  }

  public String quoteToken(@NonNull String pool) throws IOException {
    return cachedAddress(quoteTokens, pool, AjnaPoolCallEncoder.quoteTokenAddress());
  }

  public String collateralToken(@NonNull String pool) throws IOException {
    return cachedAddress(collateralTokens, pool, AjnaPoolCallEncoder.collateralAddress());
  }

  private String poolInfoUtils() throws IOException {
    String utils = chainProperties.poolInfoUtilsAddress();
    if (utils.isBlank()) {
      throw new IOException("keeper.chain.pool-info-utils-address is not configured");
    }
    return utils;
  }

  private String cachedAddress(Map<String, String> cache, String pool, Function fn) throws IOException {
    String key = pool.toLowerCase(Locale.ROOT);
    String cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    String value = address(read(pool, fn), 0);
    cache.put(key, value);
    return value;
  }

  private List<Type> read(String to, Function fn) throws IOException {
    String value = gateway.call(to, FunctionEncoder.encode(fn));
    List<Type> decoded = FunctionReturnDecoder.decode(value, fn.getOutputParameters());
    if (decoded == null || decoded.size() < fn.getOutputParameters().size()) {
      throw new IOException(fn.getName() + " on " + to + " returned malformed data");
    }
    return decoded;
  }

  private static BigInteger uint(List<Type> values, int index) {
    return (BigInteger) values.get(index).getValue();
  }

  private static String address(List<Type> values, int index) {
    return values.get(index).getValue().toString();
  }
}
