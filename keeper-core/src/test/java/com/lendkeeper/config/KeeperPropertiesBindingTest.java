package com.lendkeeper.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class KeeperPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class)
      .withPropertyValues(
          "keeper.dry-run=false",
          "keeper.chain-id=1",
          "keeper.subgraph-url=https://subgraph.example/ajna",
          "keeper.coin-gecko.api-key=cg-key",
          "keeper.token-addresses.weth=0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2",
          "keeper.cycle.pool-concurrency=3",
          "keeper.pools[0].name=WETH/USDC",
          "keeper.pools[0].address=0x0000000000000000000000000000000000000001",
          "keeper.pools[0].price.token-id=ethereum",
          "keeper.pools[0].price.invert=true",
          "keeper.pools[0].kick.min-debt=50",
          "keeper.pools[0].kick.price-factor=0.9",
          "keeper.pools[0].take.liquidity-source=AERODROME",
          "keeper.pools[0].take.market-price-factor=0.99",
          "keeper.pools[0].take.pool-variant=STABLE",
          "keeper.pools[0].settlement.min-auction-age=7200",
          "keeper.pools[0].collect-bond=true",
          "keeper.pools[0].rewards[0].token=0x0000000000000000000000000000000000000002",
          "keeper.pools[0].rewards[0].action=SWAP",
          "keeper.pools[0].rewards[0].target-token=0x0000000000000000000000000000000000000003",
          "keeper.pools[0].rewards[0].liquidity-source=UNISWAP_V3",
          "keeper.pools[0].rewards[1].token=0x0000000000000000000000000000000000000003",
          "keeper.pools[0].rewards[1].action=TRANSFER",
          "keeper.pools[0].rewards[1].transfer-to=0x0000000000000000000000000000000000000004",
          "keeper.pools[0].collect-lp-reward.redeem-first=COLLATERAL",
          "keeper.pools[0].collect-lp-reward.min-amount-quote=0.5"
      );

  @Test
  void bindsNestedPoolConfigurationFromRelaxedProperties() {
    runner.run(context -> {
      KeeperProperties properties = context.getBean(KeeperProperties.class);

      assertThat(properties.dryRun()).isFalse();
      assertThat(properties.chainId()).isEqualTo(1L);
      assertThat(properties.coinGecko().hasApiKey()).isTrue();
      assertThat(properties.alchemy().apiKey()).isEmpty();
      assertThat(properties.tokenAddresses()).containsKey("weth");
      assertThat(properties.cycle().poolConcurrency()).isEqualTo(3);
      assertThat(properties.cycle().delayBetweenRunsMillis()).isEqualTo(30_000L);

      PoolConfig pool = properties.pool("weth/usdc").orElseThrow();
      assertThat(pool.price().source()).isEqualTo(PriceSpec.Source.COINGECKO);
      assertThat(pool.price().invert()).isTrue();
      assertThat(pool.kickEnabled()).isTrue();
      assertThat(pool.kick().priceFactor()).isEqualByComparingTo("0.9");
      assertThat(pool.take().externalTakeEnabled()).isTrue();
      assertThat(pool.take().arbTakeEnabled()).isFalse();
      assertThat(pool.take().poolVariant()).isEqualTo(PoolVariant.STABLE);
      assertThat(pool.take().slippageBps()).isEqualTo(50);
      assertThat(pool.settlementEnabled()).isTrue();
      assertThat(pool.settlement().minAuctionAge()).isEqualTo(7200L);
      assertThat(pool.settlement().maxIterations()).isEqualTo(10);
      assertThat(pool.collectBond()).isTrue();
      assertThat(pool.rewards()).hasSize(2);
      assertThat(pool.rewards().get(0).action()).isEqualTo(PoolConfig.Reward.Action.SWAP);
      assertThat(pool.rewards().get(1).action()).isEqualTo(PoolConfig.Reward.Action.TRANSFER);
      assertThat(pool.rewards().get(1).transferTo()).isEqualTo("0x0000000000000000000000000000000000000004");
      assertThat(pool.collectLpEnabled()).isTrue();
      assertThat(pool.collectLpReward().redeemFirst()).isEqualTo(PoolConfig.CollectLpReward.TokenToCollect.COLLATERAL);
      assertThat(pool.collectLpReward().minAmountQuote()).isEqualByComparingTo("0.5");
      assertThat(pool.collectLpReward().minAmountCollateral()).isEqualByComparingTo("0");
    });
  }

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    new ApplicationContextRunner()
        .withUserConfiguration(TestConfig.class)
        .run(context -> {
          KeeperProperties properties = context.getBean(KeeperProperties.class);

          assertThat(properties.dryRun()).isTrue();
          assertThat(properties.chainId()).isEqualTo(8453L);
          assertThat(properties.coinGecko().hasApiKey()).isFalse();
          assertThat(properties.ledger().snapshotTtlMillis()).isEqualTo(5_000L);
          assertThat(properties.ledger().minBucketDeposit()).isEqualByComparingTo("0");
          assertThat(properties.pools()).isEmpty();
        });
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(KeeperProperties.class)
  static class TestConfig {
  }
}
