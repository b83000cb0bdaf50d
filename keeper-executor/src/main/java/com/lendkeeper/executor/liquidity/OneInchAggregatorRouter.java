package com.lendkeeper.executor.liquidity;

import com.fasterxml.jackson.databind.JsonNode;
import com.lendkeeper.config.KeeperProperties;
import com.lendkeeper.config.LiquiditySource;
import com.lendkeeper.config.PoolVariant;
import com.lendkeeper.http.HttpRequestFactory;
import com.lendkeeper.http.HttpTransportException;
import com.lendkeeper.http.JsonHttpTransport;
import com.lendkeeper.http.RequestRateLimiter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 1inch swap API. The aggregator picks its own route, so every pair reports the {@code AGGREGATED} variant
 * and calls are spaced by a minimum delay to stay under the API rate limit.
 */
@Component
@Slf4j
public class OneInchAggregatorRouter implements LiquidityRouter {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(15);

  private final DexProperties.OneInch properties;
  private final long chainId;
  private final HttpRequestFactory requestFactory;
  private final JsonHttpTransport transport;

  public OneInchAggregatorRouter(
      @NonNull DexProperties dexProperties,
      @NonNull KeeperProperties keeperProperties,
      @NonNull JsonHttpTransport transport,
      @NonNull Clock clock
  ) {
    this.properties = dexProperties.oneInch();
    this.chainId = keeperProperties.chainId();
    this.requestFactory = new HttpRequestFactory(URI.create(properties.baseUrl() + "/" + chainId));
    this.transport = transport.withRateLimiter(
        RequestRateLimiter.minInterval(Duration.ofMillis(properties.minDelayMillis()), clock));
  }

  @Override
  public LiquiditySource source() {
    return LiquiditySource.ONE_INCH;
  }

  @Override
  public PoolLookup poolExists(String tokenA, String tokenB, PoolVariant hint) {
    if (!properties.configured()) {
      return PoolLookup.notFound("1inch api key not configured");
    }
    return PoolLookup.found(PoolVariant.AGGREGATED, null);
  }

  @Override
  public QuoteOutcome getQuote(BigInteger amountIn, String tokenIn, String tokenOut, PoolVariant hint) {
    if (!properties.configured()) {
      return new QuoteOutcome.NoLiquidity("1inch api key not configured");
    }
    Map<String, String> query = new LinkedHashMap<>();
    query.put("src", tokenIn);
    query.put("dst", tokenOut);
    query.put("amount", amountIn.toString());
    JsonNode root;
    try {
      root = transport.sendJson(get("/quote", query), JsonNode.class);
    } catch (HttpTransportException e) {
      log.warn("1inch quote failed {}->{}: {}", tokenIn, tokenOut, e.getMessage());
      return new QuoteOutcome.NoLiquidity("1inch quote failed: " + e.getMessage());
    }
    BigInteger amountOut = parseAmount(root == null ? null : root.path("dstAmount").asText(null));
    if (amountOut.signum() <= 0) {
      return new QuoteOutcome.NoLiquidity("1inch returned no route for " + tokenIn + "->" + tokenOut);
    }
    return new QuoteOutcome.Quoted(new Quote(
        LiquiditySource.ONE_INCH, tokenIn, tokenOut, amountIn, amountOut, PoolVariant.AGGREGATED, null, null));
  }

  /**
   * The swap endpoint takes slippage as a percentage of the fresh quote; it is derived from {@code minOut}.
   * 1inch calldata carries no deadline.
   */
  @Override
  public SwapInstruction buildSwapInstruction(Quote quote, BigInteger minOut, Instant deadline, String recipient) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("src", quote.tokenIn());
    query.put("dst", quote.tokenOut());
    query.put("amount", quote.amountIn().toString());
    query.put("from", recipient);
    query.put("slippage", slippagePercent(quote.amountOut(), minOut).toPlainString());
    query.put("disableEstimate", "true");
    JsonNode root = transport.sendJson(get("/swap", query), JsonNode.class);
    JsonNode tx = root == null ? null : root.path("tx");
    if (tx == null || tx.path("to").asText("").isBlank() || tx.path("data").asText("").isBlank()) {
      throw new HttpTransportException("1inch swap response carries no transaction", 200);
    }
    return new SwapInstruction(tx.path("to").asText(), tx.path("data").asText(), parseAmount(tx.path("value").asText("0")));
  }

  static BigDecimal slippagePercent(BigInteger quoteOut, BigInteger minOut) {
    if (quoteOut.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    return new BigDecimal(quoteOut.subtract(minOut).max(BigInteger.ZERO))
        .multiply(BigDecimal.valueOf(100))
        .divide(new BigDecimal(quoteOut), 2, RoundingMode.DOWN);
  }

  private HttpRequest get(String path, Map<String, String> query) {
    return requestFactory.request(path, query)
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .header("Authorization", "Bearer " + properties.apiKey())
        .build();
  }

  private static BigInteger parseAmount(String raw) {
    if (raw == null || raw.isBlank()) {
      return BigInteger.ZERO;
    }
    try {
      return new BigInteger(raw.trim());
    } catch (NumberFormatException e) {
      return BigInteger.ZERO;
    }
  }
}
