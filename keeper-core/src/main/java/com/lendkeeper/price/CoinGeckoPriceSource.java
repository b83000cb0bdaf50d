package com.lendkeeper.price;

import com.fasterxml.jackson.databind.JsonNode;
import com.lendkeeper.config.KeeperProperties;
import com.lendkeeper.config.PriceSpec;
import com.lendkeeper.http.HttpRequestFactory;
import com.lendkeeper.http.JsonHttpTransport;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Primary market source: CoinGecko simple price endpoint.
 */
@Slf4j
public class CoinGeckoPriceSource implements MarketPriceSource {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final KeeperProperties.CoinGecko properties;
  private final HttpRequestFactory requestFactory;
  private final JsonHttpTransport transport;

  public CoinGeckoPriceSource(@NonNull KeeperProperties.CoinGecko properties, @NonNull JsonHttpTransport transport) {
    this.properties = properties;
    this.requestFactory = new HttpRequestFactory(URI.create(properties.baseUrl()));
    this.transport = transport;
  }

  @Override
  public PriceSpec.Source source() {
    return PriceSpec.Source.COINGECKO;
  }

  @Override
  public boolean configured() {
    return properties.hasApiKey();
  }

  @Override
  public BigDecimal usdPrice(String tokenId) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("ids", tokenId);
    query.put("vs_currencies", "usd");
    HttpRequest request = requestFactory.request("/simple/price", query)
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("accept", "application/json")
        .header("x-cg-demo-api-key", properties.apiKey())
        .build();

    JsonNode root = transport.sendJson(request, JsonNode.class);
    JsonNode usd = root == null ? null : root.path(tokenId).path("usd");
    if (usd == null || !usd.isNumber()) {
      throw new IllegalStateException("coingecko returned no usd price for " + tokenId);
    }
    BigDecimal price = usd.decimalValue();
    log.debug("coingecko price tokenId={} usd={}", tokenId, price);
    return price;
  }
}
