package com.lendkeeper.executor.kick;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.config.PriceSpec;
import com.lendkeeper.domain.PoolSnapshot;
import com.lendkeeper.executor.KeeperFixtures;
import com.lendkeeper.executor.chain.ChainTransactionException;
import com.lendkeeper.executor.chain.SignerContext;
import com.lendkeeper.executor.chain.TransactionSubmitter;
import com.lendkeeper.executor.chain.TxOutcome;
import com.lendkeeper.executor.cycle.ActionOutcome;
import com.lendkeeper.executor.cycle.ActionPacer;
import com.lendkeeper.executor.erc20.Erc20Service;
import com.lendkeeper.executor.pool.AjnaPoolReader;
import com.lendkeeper.executor.pool.PoolWriter;
import com.lendkeeper.price.PriceOutcome;
import com.lendkeeper.price.PriceResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static com.lendkeeper.executor.KeeperFixtures.ALICE;
import static com.lendkeeper.executor.KeeperFixtures.BOB;
import static com.lendkeeper.executor.KeeperFixtures.CAROL;
import static com.lendkeeper.executor.KeeperFixtures.POOL;
import static com.lendkeeper.executor.KeeperFixtures.QUOTE_TOKEN;
import static com.lendkeeper.executor.KeeperFixtures.loan;
import static com.lendkeeper.executor.KeeperFixtures.wad;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KickEngineTest {

  private static final String OWNER = KeeperFixtures.KEEPER.getAddress();
  private static final BigInteger USDC_UNIT = BigInteger.TEN.pow(6);

  @Mock
  private PriceResolver priceResolver;
  @Mock
  private AjnaPoolReader poolReader;
  @Mock
  private PoolWriter poolWriter;
  @Mock
  private Erc20Service erc20;
  @Mock
  private TransactionSubmitter submitter;
  @Mock
  private ActionPacer pacer;

  private KickEngine engine;
  private PoolConfig pool;

  @BeforeEach
  void setUp() {
    engine = new KickEngine(priceResolver, poolReader, poolWriter, erc20, SignerContext.of(KeeperFixtures.KEEPER),
        submitter, pacer);
    pool = KeeperFixtures.pool(KeeperFixtures.kick("50", "0.9"), null, null);
  }

  @Test
  void shouldKickLoanAboveLupWithProfitableNeutralPrice() {
    // Given: debt 100 >= 50, TP 110 >= LUP 100, NP 120 * 0.9 = 108 >= price 100
    givenPrice("100");
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(loan(ALICE, "110", "5", "120", "100")), List.of());

    List<KickCandidate> candidates = engine.scan(snapshot, pool).toList();

    assertThat(candidates).singleElement().satisfies(c -> {
      assertThat(c.borrower()).isEqualTo(ALICE);
      assertThat(c.liquidationBond()).isEqualTo(wad("5"));
      assertThat(c.limitPrice()).isEqualByComparingTo("100");
    });
  }

  @Test
  void shouldNotKickLoanWithThresholdPriceBelowLup() {
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(loan(ALICE, "90", "5", "120", "100")), List.of());

    assertThat(engine.scan(snapshot, pool).toList()).isEmpty();
    verifyNoInteractions(priceResolver);
  }

  @Test
  void shouldNotKickLoanBelowMinimumDebt() {
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(loan(ALICE, "110", "5", "120", "49.99")), List.of());

    assertThat(engine.scan(snapshot, pool).toList()).isEmpty();
  }

  @Test
  void shouldNotKickWhenNeutralPriceTimesFactorIsBelowPrice() {
    givenPrice("100");
    // 110 * 0.9 = 99 < 100
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(loan(ALICE, "110", "5", "110", "100")), List.of());

    assertThat(engine.scan(snapshot, pool).toList()).isEmpty();
  }

  @Test
  void shouldRankByBondAndCarryRemainingBondEstimate() {
    givenPrice("100");
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(
        loan(ALICE, "110", "1", "120", "100"),
        loan(BOB, "110", "5", "120", "100"),
        loan(CAROL, "110", "3", "120", "100")
    ), List.of());

    List<KickCandidate> candidates = engine.scan(snapshot, pool).toList();

    assertThat(candidates).extracting(KickCandidate::borrower).containsExactly(BOB, CAROL, ALICE);
    assertThat(candidates).extracting(KickCandidate::estimatedRemainingBond)
        .containsExactly(wad("9"), wad("4"), wad("1"));
    verify(priceResolver, times(1)).resolve(any(), any());
  }

  @Test
  void shouldStopScanWhenPriceIsUnavailable() {
    when(priceResolver.resolve(any(), any())).thenReturn(new PriceOutcome.Unavailable(List.of("FIXED: down")));
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(
        loan(ALICE, "110", "5", "120", "100"),
        loan(BOB, "110", "3", "120", "100")
    ), List.of());

    assertThat(engine.scan(snapshot, pool).toList()).isEmpty();
    verify(priceResolver, times(1)).resolve(any(), any());
  }

  @Test
  void shouldOnlyLogKicksInDryRun() throws Exception {
    givenPrice("100");
    when(submitter.dryRun()).thenReturn(true);
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(loan(ALICE, "110", "5", "120", "100")), List.of());

    List<ActionOutcome> outcomes = engine.handleKicks(pool, snapshot);

    assertThat(outcomes).singleElement().satisfies(o -> {
      assertThat(o.action()).isEqualTo(ActionOutcome.Action.KICK);
      assertThat(o.status()).isEqualTo(ActionOutcome.Status.DRY_RUN);
    });
    verifyNoInteractions(erc20, poolWriter);
  }

  @Test
  void shouldApproveRemainingBondsKickAndClearAllowance() throws Exception {
    givenPrice("100");
    givenQuoteToken(USDC_UNIT.multiply(BigInteger.valueOf(1000)), BigInteger.ZERO);
    ReentrantLock lock = new ReentrantLock();
    when(erc20.allowanceLock(QUOTE_TOKEN, POOL)).thenReturn(lock);
    // min(5, 1000) * 1.01 in 6 decimals
    when(erc20.approve(QUOTE_TOKEN, POOL, BigInteger.valueOf(5_050_000))).thenReturn(TxOutcome.confirmed("approve", "0xa1"));
    when(poolWriter.kick(POOL, ALICE, 3232)).thenReturn(TxOutcome.confirmed("kick", "0xb1"));
    when(erc20.resetAllowance(QUOTE_TOKEN, OWNER, POOL)).thenReturn(Optional.of(TxOutcome.confirmed("approve", "0xc1")));
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(loan(ALICE, "110", "5", "120", "100")), List.of());

    List<ActionOutcome> outcomes = engine.handleKicks(pool, snapshot);

    assertThat(outcomes).extracting(ActionOutcome::action, ActionOutcome::status, ActionOutcome::txHash).containsExactly(
        tuple(ActionOutcome.Action.APPROVE, ActionOutcome.Status.EXECUTED, "0xa1"),
        tuple(ActionOutcome.Action.KICK, ActionOutcome.Status.EXECUTED, "0xb1"),
        tuple(ActionOutcome.Action.APPROVE, ActionOutcome.Status.EXECUTED, "0xc1"));
    assertThat(lock.isLocked()).isFalse();
    verify(pacer).pause();
  }

  @Test
  void shouldSkipKickWithoutApprovalWhenBalanceBelowBond() throws Exception {
    givenQuoteToken(USDC_UNIT.multiply(BigInteger.valueOf(4)), null);
    KickCandidate candidate = candidate("5", "9");

    List<ActionOutcome> outcomes = engine.execute(candidate);

    assertThat(outcomes).singleElement().satisfies(o -> {
      assertThat(o.action()).isEqualTo(ActionOutcome.Action.KICK);
      assertThat(o.status()).isEqualTo(ActionOutcome.Status.SKIPPED);
    });
    verify(erc20, never()).approve(anyString(), anyString(), any());
    verifyNoInteractions(poolWriter);
  }

  @Test
  void shouldSkipKickWhenApprovalFails() throws Exception {
    givenQuoteToken(USDC_UNIT.multiply(BigInteger.valueOf(1000)), BigInteger.ZERO);
    when(erc20.approve(QUOTE_TOKEN, POOL, BigInteger.valueOf(9_090_000))).thenReturn(
        TxOutcome.failed("approve", ChainTransactionException.Kind.REVERTED, "execution reverted", "0xa1"));

    List<ActionOutcome> outcomes = engine.execute(candidate("5", "9"));

    assertThat(outcomes).extracting(ActionOutcome::action, ActionOutcome::status).containsExactly(
        tuple(ActionOutcome.Action.APPROVE, ActionOutcome.Status.FAILED),
        tuple(ActionOutcome.Action.KICK, ActionOutcome.Status.SKIPPED));
    verify(poolWriter, never()).kick(anyString(), anyString(), anyInt());
  }

  @Test
  void shouldReuseExistingAllowanceCoveringBond() throws Exception {
    givenQuoteToken(USDC_UNIT.multiply(BigInteger.valueOf(1000)), USDC_UNIT.multiply(BigInteger.valueOf(6)));
    when(poolWriter.kick(POOL, ALICE, 3232)).thenReturn(TxOutcome.confirmed("kick", "0xb1"));

    List<ActionOutcome> outcomes = engine.execute(candidate("5", "9"));

    assertThat(outcomes).singleElement().satisfies(o -> assertThat(o.executed()).isTrue());
    verify(erc20, never()).approve(anyString(), anyString(), any());
  }

  @Test
  void shouldCapApprovalAtBalancePlusMargin() {
    assertThat(KickEngine.approvalAmount(wad("9"), wad("1000"))).isEqualTo(wad("9.09"));
    assertThat(KickEngine.approvalAmount(wad("9"), wad("6"))).isEqualTo(wad("6.06"));
  }

  @Test
  void shouldIgnorePoolWithoutKickSection() {
    PoolConfig noKick = KeeperFixtures.pool(null, null, null);
    PoolSnapshot snapshot = KeeperFixtures.snapshot("100", "105", List.of(loan(ALICE, "110", "5", "120", "100")), List.of());

    assertThat(engine.scan(snapshot, noKick).toList()).isEmpty();
  }

  private KickCandidate candidate(String bond, String remaining) {
    return new KickCandidate(pool.name(), POOL, ALICE, wad(bond), wad(remaining), new BigDecimal("100"));
  }

  private void givenPrice(String price) {
    when(priceResolver.resolve(any(), any()))
        .thenReturn(new PriceOutcome.Resolved(new BigDecimal(price), PriceSpec.Source.FIXED));
  }

  private void givenQuoteToken(BigInteger balance, BigInteger allowance) throws Exception {
    when(poolReader.quoteToken(POOL)).thenReturn(QUOTE_TOKEN);
    when(erc20.decimals(QUOTE_TOKEN)).thenReturn(6);
    when(erc20.balanceOf(QUOTE_TOKEN, OWNER)).thenReturn(balance);
    if (allowance != null) {
      when(erc20.allowance(QUOTE_TOKEN, OWNER, POOL)).thenReturn(allowance);
    }
  }
}
