package com.lendkeeper.price;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.Map;

/**
 * Fallback market source: Alchemy token prices by contract address.
 */
@Slf4j
public class AlchemyPriceSource implements MarketPriceSource {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private static final Map<Long, String> NETWORKS = Map.of(
      1L, "eth-mainnet",
      8453L, "base-mainnet",
      42161L, "arb-mainnet",
      10L, "opt-mainnet",
      137L, "polygon-mainnet",
      43114L, "avax-mainnet"
  );

  private final KeeperProperties.Alchemy properties;
  private final TokenAddressBook addressBook;
  private final HttpRequestFactory requestFactory;
  private final JsonHttpTransport transport;

  public AlchemyPriceSource(
      @NonNull KeeperProperties.Alchemy properties,
      @NonNull TokenAddressBook addressBook,
      @NonNull JsonHttpTransport transport
  ) {
    this.properties = properties;
    this.addressBook = addressBook;
    this.requestFactory = new HttpRequestFactory(URI.create(properties.baseUrl()));
    this.transport = transport;
  }

  @Override
  public PriceSpec.Source source() {
    return PriceSpec.Source.ALCHEMY;
  }

  @Override
  public boolean configured() {
    return !properties.apiKey().isBlank();
  }

  @Override
  public BigDecimal usdPrice(String tokenId) {
    String network = NETWORKS.get(addressBook.chainId());
    if (network == null) {
      throw new IllegalStateException("alchemy prices unsupported on chain " + addressBook.chainId());
    }
    String address = addressBook.addressOf(tokenId).orElseThrow(() -> new IllegalStateException(
        "no token address for '%s' on chain %d; add it to keeper.token-addresses".formatted(tokenId, addressBook.chainId())));

    ObjectNode body = transport.objectMapper().createObjectNode();
    ObjectNode entry = body.putArray("addresses").addObject();
    entry.put("network", network);
    entry.put("address", address);

    HttpRequest request = requestFactory.request("/" + properties.apiKey() + "/tokens/by-address", Map.of())
        .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
        .timeout(HTTP_TIMEOUT)
        .header("Content-Type", "application/json")
        .build();

    JsonNode root = transport.sendJson(request, JsonNode.class);
    JsonNode data = root == null ? null : root.path("data").path(0);
    if (data == null || data.isMissingNode()) {
      throw new IllegalStateException("alchemy returned no price data for " + address);
    }
    if (data.hasNonNull("error")) {
      throw new IllegalStateException("alchemy error for " + address + ": " + data.get("error"));
    }
    for (JsonNode p : data.path("prices")) {
      if ("usd".equalsIgnoreCase(p.path("currency").asText())) {
        BigDecimal price = new BigDecimal(p.path("value").asText());
        log.debug("alchemy price tokenId={} address={} usd={}", tokenId, address, price);
        return price;
      }
    }
    throw new IllegalStateException("alchemy returned no usd price for " + address);
  }
}
