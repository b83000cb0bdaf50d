package com.lendkeeper.executor.pool;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.executor.KeeperFixtures;
import com.lendkeeper.executor.chain.TransactionSubmitter;
import com.lendkeeper.executor.chain.TxOutcome;
import com.lendkeeper.executor.cycle.ActionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PoolInterestUpdaterTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  @Mock
  private AjnaPoolReader poolReader;
  @Mock
  private TransactionSubmitter submitter;

  private PoolInterestUpdater updater;
  private PoolConfig pool;

  @BeforeEach
  void setUp() {
    updater = new PoolInterestUpdater(poolReader, submitter, Clock.fixed(NOW, ZoneId.of("UTC")));
    pool = KeeperFixtures.pool(null, null, null);
  }

  @Test
  void shouldSkipWhenInterestUpdatedWithinAWeek() throws Exception {
    when(poolReader.inflatorInfo(KeeperFixtures.POOL))
        .thenReturn(new InflatorInfo(BigInteger.ONE, NOW.minus(Duration.ofDays(6))));

    ActionOutcome outcome = updater.updateIfStale(pool);

    assertThat(outcome.status()).isEqualTo(ActionOutcome.Status.SKIPPED);
    verifyNoInteractions(submitter);
  }

  @Test
  void shouldUpdateInterestWhenStale() throws Exception {
    when(poolReader.inflatorInfo(KeeperFixtures.POOL))
        .thenReturn(new InflatorInfo(BigInteger.ONE, NOW.minus(Duration.ofDays(8))));
    when(submitter.submit(eq("updateInterest"), eq(KeeperFixtures.POOL), anyString()))
        .thenReturn(TxOutcome.confirmed("updateInterest", "0x01"));

    ActionOutcome outcome = updater.updateIfStale(pool);

    assertThat(outcome.executed()).isTrue();
    assertThat(outcome.txHash()).isEqualTo("0x01");
  }

  @Test
  void shouldReportFailedReadWithoutSubmitting() throws Exception {
    when(poolReader.inflatorInfo(KeeperFixtures.POOL)).thenThrow(new IOException("rpc down"));

    ActionOutcome outcome = updater.updateIfStale(pool);

    assertThat(outcome.status()).isEqualTo(ActionOutcome.Status.FAILED);
    verifyNoInteractions(submitter);
  }
}
