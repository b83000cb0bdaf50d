package com.lendkeeper.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendkeeper.config.KeeperProperties;
import com.lendkeeper.domain.Auction;
import com.lendkeeper.domain.Loan;
import com.lendkeeper.domain.PoolSnapshot;
import com.lendkeeper.domain.Wad;
import com.lendkeeper.http.HttpTransportException;
import com.lendkeeper.http.JsonHttpTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubgraphLedgerClientTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private StubTransport transport;
  private SubgraphLedgerClient client;

  @BeforeEach
  void setUp() {
    transport = new StubTransport(objectMapper);
    client = new SubgraphLedgerClient(
        URI.create("https://subgraph.example/ajna"),
        new KeeperProperties.Ledger(null, null, null, null),
        transport,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void shouldMapPoolLoansAuctionsAndBucketsToWad() throws Exception {
    transport.response = objectMapper.readTree("""
        {"data":{"pool":{
          "id":"0xpool","lup":"100","inflator":"1.1",
          "loans":[{"borrower":"0xb1","thresholdPrice":"105","t0debt":"100","t0Np":"120"}],
          "liquidationAuctions":[{"borrower":"0xb2","collateralRemaining":"0","debtRemaining":"50",
            "neutralPrice":"99","kickTime":"1705305600","settled":false}],
          "buckets":[{"bucketIndex":4140,"bucketPrice":"110.5","deposit":"1000"}]
        }}}
        """);

    PoolSnapshot snapshot = client.snapshot("0xPOOL");

    assertThat(snapshot.poolAddress()).isEqualTo("0xpool");
    assertThat(snapshot.lup()).isEqualTo(Wad.fromDecimal(new BigDecimal("100")));
    assertThat(snapshot.hpbIndex()).isEqualTo(4140);
    assertThat(snapshot.hpb()).isEqualTo(Wad.fromDecimal(new BigDecimal("110.5")));
    assertThat(snapshot.fetchedAt()).isEqualTo(NOW);

    Loan loan = snapshot.loans().get(0);
    assertThat(Wad.toDecimal(loan.debt())).isEqualByComparingTo("110");
    assertThat(Wad.toDecimal(loan.neutralPrice())).isEqualByComparingTo("132");
    assertThat(loan.liquidationBond().signum()).isPositive();

    Auction auction = snapshot.auctions().get(0);
    assertThat(auction.hasBadDebt()).isTrue();
    assertThat(auction.kickTime()).isEqualTo(Instant.ofEpochSecond(1705305600L));

    assertThat(transport.lastBody).contains("\"poolId\":\"0xpool\"").contains("\"minDeposit\":\"0\"");
  }

  @Test
  void shouldTakeHpbFromHighestBucketAboveMinimumDeposit() throws Exception {
    client = new SubgraphLedgerClient(
        URI.create("https://subgraph.example/ajna"),
        new KeeperProperties.Ledger(null, null, null, new BigDecimal("5")),
        transport,
        Clock.fixed(NOW, ZoneOffset.UTC));
    transport.response = objectMapper.readTree("""
        {"data":{"pool":{
          "id":"0xpool","lup":"100","inflator":"1",
          "loans":[],"liquidationAuctions":[],
          "buckets":[{"bucketIndex":4100,"bucketPrice":"130.2","deposit":"0.5"},
                     {"bucketIndex":4140,"bucketPrice":"110.5","deposit":"1000"}]
        }}}
        """);

    PoolSnapshot snapshot = client.snapshot("0xpool");

    assertThat(snapshot.hpbIndex()).isEqualTo(4140);
    assertThat(Wad.toDecimal(snapshot.hpb())).isEqualByComparingTo("110.5");
    assertThat(transport.lastBody).contains("\"minDeposit\":\"5\"");
  }

  @Test
  void shouldReportNoHpbWhenNoBucketHoldsEnoughDeposit() throws Exception {
    transport.response = objectMapper.readTree("""
        {"data":{"pool":{"id":"0xpool","lup":"100","loans":[],"liquidationAuctions":[],"buckets":[]}}}
        """);

    PoolSnapshot snapshot = client.snapshot("0xpool");

    assertThat(snapshot.hpb().signum()).isZero();
    assertThat(snapshot.hpbIndex()).isZero();
  }

  @Test
  void shouldFailWhenPoolIsNotIndexed() throws Exception {
    transport.response = objectMapper.readTree("{\"data\":{\"pool\":null}}");

    assertThatThrownBy(() -> client.snapshot("0xpool"))
        .isInstanceOf(LedgerQueryException.class)
        .hasMessageContaining("not indexed");
  }

  @Test
  void shouldSurfaceGraphqlErrors() throws Exception {
    transport.response = objectMapper.readTree("{\"errors\":[{\"message\":\"bad query\"}]}");

    assertThatThrownBy(() -> client.snapshot("0xpool"))
        .isInstanceOf(LedgerQueryException.class)
        .hasMessageContaining("bad query");
  }

  @Test
  void shouldWrapTransportFailures() {
    transport.failure = new HttpTransportException("POST subgraph returned HTTP 502", 502);

    assertThatThrownBy(() -> client.snapshot("0xpool"))
        .isInstanceOf(LedgerQueryException.class)
        .hasCauseInstanceOf(HttpTransportException.class);
  }

  @Test
  void shouldClampBondFactorBetweenHalfAndThreePercent() {
    BigDecimal debt = new BigDecimal("1000");

    assertThat(SubgraphLedgerClient.estimateBond(debt, new BigDecimal("101"), new BigDecimal("100")))
        .isEqualByComparingTo("5");
    assertThat(SubgraphLedgerClient.estimateBond(debt, new BigDecimal("200"), new BigDecimal("100")))
        .isEqualByComparingTo("30");
    assertThat(SubgraphLedgerClient.estimateBond(debt, new BigDecimal("120"), new BigDecimal("100")))
        .isEqualByComparingTo("20");
    assertThat(SubgraphLedgerClient.estimateBond(BigDecimal.ZERO, new BigDecimal("120"), new BigDecimal("100")))
        .isEqualByComparingTo("0");
  }

  private static final class StubTransport extends JsonHttpTransport {
    JsonNode response;
    HttpTransportException failure;
    String lastBody;

    StubTransport(ObjectMapper objectMapper) {
      super(HttpClient.newHttpClient(), objectMapper);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T sendJson(HttpRequest request, Class<T> type) {
      lastBody = request.bodyPublisher()
          .map(p -> {
            BodyCollector collector = new BodyCollector();
            p.subscribe(collector);
            return collector.body();
          })
          .orElse("");
      if (failure != null) {
        throw failure;
      }
      return (T) response;
    }
  }

  private static final class BodyCollector implements Flow.Subscriber<ByteBuffer> {
    private final StringBuilder body = new StringBuilder();

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(ByteBuffer item) {
      body.append(StandardCharsets.UTF_8.decode(item));
    }

    @Override
    public void onError(Throwable throwable) {
    }

    @Override
    public void onComplete() {
    }

    String body() {
      return body.toString();
    }
  }
}
