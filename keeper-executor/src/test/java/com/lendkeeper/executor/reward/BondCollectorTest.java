package com.lendkeeper.executor.reward;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.config.PriceSpec;
import com.lendkeeper.executor.KeeperFixtures;
import com.lendkeeper.executor.chain.SignerContext;
import com.lendkeeper.executor.chain.TxOutcome;
import com.lendkeeper.executor.cycle.ActionOutcome;
import com.lendkeeper.executor.pool.AjnaPoolReader;
import com.lendkeeper.executor.pool.KickerInfo;
import com.lendkeeper.executor.pool.PoolWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static com.lendkeeper.executor.KeeperFixtures.POOL;
import static com.lendkeeper.executor.KeeperFixtures.wad;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BondCollectorTest {

  private static final String SELF = KeeperFixtures.KEEPER.getAddress();

  @Mock
  private AjnaPoolReader poolReader;
  @Mock
  private PoolWriter poolWriter;

  @Test
  void shouldDoNothingWhenCollectionDisabled() {
    BondCollector collector = new BondCollector(poolReader, poolWriter, SignerContext.of(KeeperFixtures.KEEPER));

    assertThat(collector.collect(pool(false))).isEmpty();
    verifyNoInteractions(poolReader, poolWriter);
  }

  @Test
  void shouldSkipWithoutCredentials() {
    BondCollector collector = new BondCollector(poolReader, poolWriter, SignerContext.of(null));

    assertThat(collector.collect(pool(true))).hasValueSatisfying(o ->
        assertThat(o.status()).isEqualTo(ActionOutcome.Status.SKIPPED));
    verifyNoInteractions(poolReader, poolWriter);
  }

  @Test
  void shouldWithdrawClaimableBond() throws Exception {
    BondCollector collector = new BondCollector(poolReader, poolWriter, SignerContext.of(KeeperFixtures.KEEPER));
    when(poolReader.kickerInfo(POOL, SELF)).thenReturn(new KickerInfo(wad("1.5"), wad("3")));
    when(poolWriter.withdrawBonds(POOL, SELF, wad("1.5"))).thenReturn(TxOutcome.confirmed("withdrawBonds", "0xb0"));

    assertThat(collector.collect(pool(true))).hasValueSatisfying(o -> {
      assertThat(o.action()).isEqualTo(ActionOutcome.Action.WITHDRAW_BONDS);
      assertThat(o.executed()).isTrue();
      assertThat(o.txHash()).isEqualTo("0xb0");
    });
  }

  @Test
  void shouldLeaveLockedBondAlone() throws Exception {
    BondCollector collector = new BondCollector(poolReader, poolWriter, SignerContext.of(KeeperFixtures.KEEPER));
    when(poolReader.kickerInfo(POOL, SELF)).thenReturn(new KickerInfo(BigInteger.ZERO, wad("3")));

    assertThat(collector.collect(pool(true))).isEmpty();
    verifyNoInteractions(poolWriter);
  }

  @Test
  void shouldReportFailedRead() throws Exception {
    BondCollector collector = new BondCollector(poolReader, poolWriter, SignerContext.of(KeeperFixtures.KEEPER));
    when(poolReader.kickerInfo(POOL, SELF)).thenThrow(new IOException("rpc down"));

    assertThat(collector.collect(pool(true))).hasValueSatisfying(o -> {
      assertThat(o.status()).isEqualTo(ActionOutcome.Status.FAILED);
      assertThat(o.reason()).isEqualTo("rpc down");
    });
  }

  private static PoolConfig pool(boolean collectBond) {
    return new PoolConfig("weth-usdc", POOL, PriceSpec.fixed(new BigDecimal("100")), null, null, null,
        collectBond, false, List.of(), null);
  }
}
