package com.lendkeeper.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Validated
@ConfigurationProperties(prefix = "keeper")
public record KeeperProperties(
    /**
     * When true, every write is replaced by a log line and nothing enters the nonce queue.
     */
    @NotNull Boolean dryRun,
    @NotNull @Min(1) Long chainId,
    /**
     * GraphQL endpoint of the pool subgraph.
     */
    String subgraphUrl,
    @Valid CoinGecko coinGecko,
    @Valid Alchemy alchemy,
    /**
     * Market-source token id (e.g. {@code ethereum}) to token contract address, used by the fallback price source.
     */
    Map<String, String> tokenAddresses,
    @Valid Cycle cycle,
    @Valid Ledger ledger,
    List<@Valid PoolConfig> pools
) {

  public KeeperProperties {
    if (dryRun == null) {
      dryRun = true;
    }
    if (chainId == null) {
      chainId = 8453L;
    }
    if (subgraphUrl == null) {
      subgraphUrl = "";
    }
    if (coinGecko == null) {
      coinGecko = new CoinGecko(null, null);
    }
    if (alchemy == null) {
      alchemy = new Alchemy(null, null);
    }
    tokenAddresses = normalizeTokenAddresses(tokenAddresses);
    if (cycle == null) {
      cycle = new Cycle(null, null, null, null);
    }
    if (ledger == null) {
      ledger = new Ledger(null, null, null, null);
    }
    pools = pools == null ? List.of() : pools.stream().filter(Objects::nonNull).toList();
  }

  public Optional<PoolConfig> pool(String name) {
    return pools.stream().filter(p -> p.name().equalsIgnoreCase(name)).findFirst();
  }

  private static Map<String, String> normalizeTokenAddresses(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return Map.of();
    }
    Map<String, String> out = new LinkedHashMap<>();
    values.forEach((k, v) -> {
      if (k != null && v != null && !v.isBlank()) {
        out.put(k.trim().toLowerCase(Locale.ROOT), v.trim());
      }
    });
    return Map.copyOf(out);
  }

  public record CoinGecko(
      /**
       * Demo API key. Without it the primary market source is skipped.
       */
      @JsonIgnore String apiKey,
      String baseUrl
  ) {
    public CoinGecko {
      if (apiKey == null) {
        apiKey = "";
      }
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api.coingecko.com/api/v3";
      }
    }

    public boolean hasApiKey() {
      return !apiKey.isBlank() && !"YOUR_COINGECKO_API_KEY_HERE".equals(apiKey);
    }
  }

  public record Alchemy(
      @JsonIgnore String apiKey,
      String baseUrl
  ) {
    public Alchemy {
      if (apiKey == null) {
        apiKey = "";
      }
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api.g.alchemy.com/prices/v1";
      }
    }
  }

  public record Cycle(
      /**
       * Pause between two full passes over all pools.
       */
      @NotNull @Min(1_000) Long delayBetweenRunsMillis,
      /**
       * Pause between two consecutive write actions within a pool.
       */
      @NotNull @PositiveOrZero Long delayBetweenActionsMillis,
      /**
       * Number of pools evaluated concurrently. Writes stay ordered per signer regardless.
       */
      @NotNull @Min(1) Integer poolConcurrency,
      @NotNull Boolean enabled
  ) {
    public Cycle {
      if (delayBetweenRunsMillis == null) {
        delayBetweenRunsMillis = 30_000L;
      }
      if (delayBetweenActionsMillis == null) {
        delayBetweenActionsMillis = 2_000L;
      }
      if (poolConcurrency == null) {
        poolConcurrency = 1;
      }
      if (enabled == null) {
        enabled = true;
      }
    }
  }

  public record Ledger(
      /**
       * Snapshots younger than this are served from cache.
       */
      @NotNull @PositiveOrZero Long snapshotTtlMillis,
      @NotNull @Min(1) Integer maxLoans,
      @NotNull @Min(1) Integer maxAuctions,
      /**
       * Buckets holding no more than this deposit are ignored when picking the arb-take bucket.
       */
      @NotNull @PositiveOrZero BigDecimal minBucketDeposit
  ) {
    public Ledger {
      if (snapshotTtlMillis == null) {
        snapshotTtlMillis = 5_000L;
      }
      if (maxLoans == null) {
        maxLoans = 1000;
      }
      if (maxAuctions == null) {
        maxAuctions = 1000;
      }
      if (minBucketDeposit == null) {
        minBucketDeposit = BigDecimal.ZERO;
      }
    }
  }
}
