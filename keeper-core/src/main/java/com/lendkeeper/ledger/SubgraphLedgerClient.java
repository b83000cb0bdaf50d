package com.lendkeeper.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lendkeeper.config.KeeperProperties;
import com.lendkeeper.domain.Auction;
import com.lendkeeper.domain.Bucket;
import com.lendkeeper.domain.Loan;
import com.lendkeeper.domain.PoolSnapshot;
import com.lendkeeper.domain.Wad;
import com.lendkeeper.http.HttpTransportException;
import com.lendkeeper.http.JsonHttpTransport;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pool snapshots from the lending protocol subgraph. Decimal subgraph values are converted to WAD here.
 */
@Slf4j
public class SubgraphLedgerClient implements LedgerQueryService {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(15);

  private static final BigDecimal MIN_BOND_FACTOR = new BigDecimal("0.005");
  private static final BigDecimal MAX_BOND_FACTOR = new BigDecimal("0.03");

  private static final String POOL_SNAPSHOT_QUERY = """
      query PoolSnapshot($poolId: String!, $maxLoans: Int!, $maxAuctions: Int!, $minDeposit: BigDecimal!) {
        pool(id: $poolId) {
          id
          lup
          inflator
          loans(first: $maxLoans, where: { inLiquidation: false }) {
            borrower
            thresholdPrice
            t0debt
            t0Np
          }
          liquidationAuctions(first: $maxAuctions, where: { settled: false }) {
            borrower
            collateralRemaining
            debtRemaining
            neutralPrice
            kickTime
            settled
          }
          buckets(first: 1, where: { deposit_gt: $minDeposit }, orderBy: bucketPrice, orderDirection: desc) {
            bucketIndex
            bucketPrice
            deposit
          }
        }
      }
      """;

  private final URI subgraphUri;
  private final KeeperProperties.Ledger ledger;
  private final JsonHttpTransport transport;
  private final Clock clock;

  public SubgraphLedgerClient(
      @NonNull URI subgraphUri,
      @NonNull KeeperProperties.Ledger ledger,
      @NonNull JsonHttpTransport transport,
      @NonNull Clock clock
  ) {
    this.subgraphUri = subgraphUri;
    this.ledger = ledger;
    this.transport = transport;
    this.clock = clock;
  }

  @Override
  public PoolSnapshot snapshot(String poolAddress) {
    String poolId = poolAddress.toLowerCase(Locale.ROOT);
    ObjectNode body = transport.objectMapper().createObjectNode();
    body.put("query", POOL_SNAPSHOT_QUERY);
    ObjectNode variables = body.putObject("variables");
    variables.put("poolId", poolId);
    variables.put("maxLoans", ledger.maxLoans());
    variables.put("maxAuctions", ledger.maxAuctions());
    variables.put("minDeposit", ledger.minBucketDeposit().toPlainString());

    HttpRequest request = HttpRequest.newBuilder(subgraphUri)
        .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
        .timeout(HTTP_TIMEOUT)
        .header("Content-Type", "application/json")
        .build();

    JsonNode root;
    try {
      root = transport.sendJson(request, JsonNode.class);
    } catch (HttpTransportException e) {
      throw new LedgerQueryException("subgraph query failed for pool " + poolId, e);
    }
    if (root == null) {
      throw new LedgerQueryException("empty subgraph response for pool " + poolId);
    }
    if (root.hasNonNull("errors")) {
      throw new LedgerQueryException("subgraph errors for pool " + poolId + ": " + root.get("errors"));
    }
    JsonNode pool = root.path("data").path("pool");
    if (pool.isMissingNode() || pool.isNull()) {
      throw new LedgerQueryException("pool not indexed by subgraph: " + poolId);
    }
    return toSnapshot(poolId, pool);
  }

  PoolSnapshot toSnapshot(String poolId, JsonNode pool) {
    BigDecimal inflator = decimal(pool, "inflator", BigDecimal.ONE);

    List<Loan> loans = new ArrayList<>();
    for (JsonNode l : pool.path("loans")) {
      BigDecimal tp = decimal(l, "thresholdPrice", BigDecimal.ZERO);
      BigDecimal debt = decimal(l, "t0debt", BigDecimal.ZERO).multiply(inflator);
      BigDecimal np = decimal(l, "t0Np", BigDecimal.ZERO).multiply(inflator);
      loans.add(new Loan(
          l.path("borrower").asText(),
          Wad.fromDecimal(tp),
          Wad.fromDecimal(estimateBond(debt, np, tp)),
          Wad.fromDecimal(np),
          Wad.fromDecimal(debt)
      ));
    }

    List<Auction> auctions = new ArrayList<>();
    for (JsonNode a : pool.path("liquidationAuctions")) {
      auctions.add(new Auction(
          a.path("borrower").asText(),
          Wad.fromDecimal(decimal(a, "collateralRemaining", BigDecimal.ZERO)),
          Wad.fromDecimal(decimal(a, "debtRemaining", BigDecimal.ZERO)),
          Wad.fromDecimal(decimal(a, "neutralPrice", BigDecimal.ZERO)),
          Instant.ofEpochSecond(a.path("kickTime").asLong(0)),
          a.path("settled").asBoolean(false)
      ));
    }

    Bucket highest = highestMeaningfulBucket(pool.path("buckets"));

    PoolSnapshot snapshot = new PoolSnapshot(
        poolId,
        Wad.fromDecimal(decimal(pool, "lup", BigDecimal.ZERO)),
        highest == null ? BigInteger.ZERO : highest.price(),
        highest == null ? 0 : highest.index(),
        loans,
        auctions,
        clock.instant()
    );
    log.debug("subgraph snapshot pool={} loans={} auctions={} hpbIndex={}",
        poolId, loans.size(), auctions.size(), snapshot.hpbIndex());
    return snapshot;
  }

  /**
   * First bucket, in descending price order, whose deposit exceeds {@code minBucketDeposit}.
   */
  private Bucket highestMeaningfulBucket(JsonNode buckets) {
    BigDecimal minDeposit = ledger.minBucketDeposit();
    for (JsonNode b : buckets) {
      BigDecimal deposit = decimal(b, "deposit", BigDecimal.ZERO);
      if (deposit.compareTo(minDeposit) > 0) {
        return new Bucket(
            b.path("bucketIndex").asInt(),
            Wad.fromDecimal(decimal(b, "bucketPrice", BigDecimal.ZERO)),
            Wad.fromDecimal(deposit));
      }
    }
    return null;
  }

  /**
   * Kicker bond the protocol will demand: debt * clamp((NP/TP - 1) / 10, 0.5%, 3%).
   */
  static BigDecimal estimateBond(BigDecimal debt, BigDecimal neutralPrice, BigDecimal thresholdPrice) {
    if (debt.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal factor = MIN_BOND_FACTOR;
    if (thresholdPrice.signum() > 0) {
      BigDecimal ratio = neutralPrice.divide(thresholdPrice, MathContext.DECIMAL64);
      factor = ratio.subtract(BigDecimal.ONE).divide(BigDecimal.TEN, MathContext.DECIMAL64)
          .max(MIN_BOND_FACTOR)
          .min(MAX_BOND_FACTOR);
    }
    return debt.multiply(factor);
  }

  private static BigDecimal decimal(JsonNode node, String field, BigDecimal fallback) {
    JsonNode v = node.path(field);
    if (v.isMissingNode() || v.isNull()) {
      return fallback;
    }
    String text = v.asText();
    if (text.isBlank()) {
      return fallback;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      log.debug("unparseable subgraph decimal field={} value={}", field, text);
      return fallback;
    }
  }

}
