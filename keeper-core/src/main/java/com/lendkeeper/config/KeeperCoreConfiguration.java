package com.lendkeeper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendkeeper.http.JsonHttpTransport;
import com.lendkeeper.ledger.LedgerQueryService;
import com.lendkeeper.ledger.PoolSnapshotCache;
import com.lendkeeper.ledger.SubgraphLedgerClient;
import com.lendkeeper.price.AlchemyPriceSource;
import com.lendkeeper.price.CoinGeckoPriceSource;
import com.lendkeeper.price.PriceResolver;
import com.lendkeeper.price.TokenAddressBook;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class KeeperCoreConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public JsonHttpTransport jsonHttpTransport(HttpClient httpClient, ObjectMapper objectMapper) {
    return new JsonHttpTransport(httpClient, objectMapper);
  }

  @Bean
  public TokenAddressBook tokenAddressBook(KeeperProperties properties) {
    return new TokenAddressBook(properties.chainId(), properties.tokenAddresses());
  }

  @Bean
  public PriceResolver priceResolver(
      KeeperProperties properties,
      JsonHttpTransport transport,
      TokenAddressBook addressBook
  ) {
    return new PriceResolver(
        new CoinGeckoPriceSource(properties.coinGecko(), transport),
        new AlchemyPriceSource(properties.alchemy(), addressBook, transport)
    );
  }

  @Bean
  public LedgerQueryService ledgerQueryService(KeeperProperties properties, JsonHttpTransport transport, Clock clock) {
    KeeperProperties.Ledger ledger = properties.ledger();
    SubgraphLedgerClient client = new SubgraphLedgerClient(URI.create(properties.subgraphUrl()), ledger, transport, clock);
    return new PoolSnapshotCache(client, Duration.ofMillis(ledger.snapshotTtlMillis()), clock);
  }
}
