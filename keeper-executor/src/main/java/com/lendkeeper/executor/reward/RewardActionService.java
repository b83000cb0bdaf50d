package com.lendkeeper.executor.reward;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.executor.chain.SignerContext;
import com.lendkeeper.executor.chain.TransactionSubmitter;
import com.lendkeeper.executor.chain.TxOutcome;
import com.lendkeeper.executor.cycle.ActionOutcome;
import com.lendkeeper.executor.cycle.ActionPacer;
import com.lendkeeper.executor.erc20.Erc20Service;
import com.lendkeeper.executor.liquidity.DexProperties;
import com.lendkeeper.executor.liquidity.LiquidityRouter;
import com.lendkeeper.executor.liquidity.LiquidityRouterRegistry;
import com.lendkeeper.executor.liquidity.Quote;
import com.lendkeeper.executor.liquidity.QuoteOutcome;
import com.lendkeeper.executor.liquidity.Slippage;
import com.lendkeeper.executor.liquidity.SwapInstruction;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Acts on accumulated reward token balances. SWAP sells the whole balance through the configured router,
 * approving exactly the quoted input and clearing the allowance afterwards. TRANSFER sends the whole balance
 * to a fixed recipient. HOLD leaves the balance alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RewardActionService {

  private final @NonNull Erc20Service erc20;
  private final @NonNull LiquidityRouterRegistry routers;
  private final @NonNull TransactionSubmitter submitter;
  private final @NonNull SignerContext signerContext;
  private final @NonNull DexProperties dexProperties;
  private final @NonNull ActionPacer pacer;
  private final @NonNull Clock clock;

  public List<ActionOutcome> handleRewards(@NonNull PoolConfig pool) throws InterruptedException {
    List<ActionOutcome> outcomes = new ArrayList<>();
    for (PoolConfig.Reward reward : pool.rewards()) {
      ActionOutcome outcome = switch (reward.action()) {
        case HOLD -> null;
        case SWAP -> swap(pool, reward);
        case TRANSFER -> transfer(pool, reward);
      };
      if (outcome == null) {
        continue;
      }
      outcomes.add(outcome);
      if (outcome.status() != ActionOutcome.Status.SKIPPED) {
        pacer.pause();
      }
    }
    return outcomes;
  }

  ActionOutcome swap(PoolConfig pool, PoolConfig.Reward reward) throws InterruptedException {
    ActionOutcome.Action action = ActionOutcome.Action.REWARD_SWAP;
    String token = reward.token();
    if (reward.targetToken() == null || reward.targetToken().isBlank()) {
      return skip(action, pool, token, "no target token");
    }
    LiquidityRouter router = routers.router(reward.liquiditySource()).orElse(null);
    if (router == null) {
      return skip(action, pool, token, "no router for " + reward.liquiditySource());
    }
    String owner = signerContext.address().orElse(null);
    if (owner == null) {
      return skip(action, pool, token, "no credentials");
    }
    Balance balance = balance(action, pool, reward, owner);
    if (balance.rejected() != null) {
      return balance.rejected();
    }

    QuoteOutcome quoted = router.getQuote(balance.amount(), token, reward.targetToken(), null);
    if (quoted instanceof QuoteOutcome.NoLiquidity none) {
      return skip(action, pool, token, none.reason());
    }
    Quote quote = quoted.quoteIfPresent().orElseThrow();
    BigInteger minOut = Slippage.minOut(quote.amountOut(), reward.slippageBps());
    Instant deadline = clock.instant().plusSeconds(dexProperties.swapDeadlineSeconds());

    SwapInstruction swap;
    try {
      swap = router.buildSwapInstruction(quote, minOut, deadline, owner);
    } catch (RuntimeException e) {
      log.warn("pool={} reward token={} swap instruction failed: {}", pool.name(), token, e.getMessage());
      return ActionOutcome.failed(action, token, e.getMessage());
    }

    ReentrantLock lock = erc20.allowanceLock(token, swap.router());
    lock.lockInterruptibly();
    try {
      TxOutcome approval = erc20.approve(token, swap.router(), quote.amountIn());
      if (approval.failed()) {
        log.warn("pool={} reward token={} not swapped: approval failed ({})", pool.name(), token, approval.error());
        return ActionOutcome.of(action, token, approval);
      }
      log.info("pool={} swapping reward {} {} -> {} via {} (minOut={})", pool.name(), quote.amountIn(), token,
          reward.targetToken(), router.source(), minOut);
      TxOutcome tx = submitter.submit("rewardSwap", swap.router(), swap.calldata());
      return ActionOutcome.of(action, token, tx);
    } finally {
      try {
        if (!submitter.dryRun()) {
          erc20.resetAllowance(token, owner, swap.router());
        }
      } finally {
        lock.unlock();
      }
    }
  }

  ActionOutcome transfer(PoolConfig pool, PoolConfig.Reward reward) {
    ActionOutcome.Action action = ActionOutcome.Action.REWARD_TRANSFER;
    String token = reward.token();
    if (reward.transferTo() == null || reward.transferTo().isBlank()) {
      return skip(action, pool, token, "no transfer recipient");
    }
    String owner = signerContext.address().orElse(null);
    if (owner == null) {
      return skip(action, pool, token, "no credentials");
    }
    if (owner.equalsIgnoreCase(reward.transferTo())) {
      return skip(action, pool, token, "recipient is the keeper account");
    }
    Balance balance = balance(action, pool, reward, owner);
    if (balance.rejected() != null) {
      return balance.rejected();
    }
    log.info("pool={} transferring reward {} {} to {}", pool.name(), balance.amount(), token, reward.transferTo());
    return ActionOutcome.of(action, token, erc20.transfer(token, reward.transferTo(), balance.amount()));
  }

  private Balance balance(ActionOutcome.Action action, PoolConfig pool, PoolConfig.Reward reward, String owner) {
    String token = reward.token();
    try {
      BigInteger amount = erc20.balanceOf(token, owner);
      BigDecimal readable = new BigDecimal(amount, erc20.decimals(token));
      if (amount.signum() == 0 || readable.compareTo(reward.minAmount()) < 0) {
        log.debug("pool={} reward token={} balance {} below minimum {}", pool.name(), token, readable,
            reward.minAmount());
        return new Balance(amount, ActionOutcome.skipped(action, token, "balance below minimum"));
      }
      return new Balance(amount, null);
    } catch (IOException e) {
      log.warn("pool={} reward token={} balance read failed: {}", pool.name(), token, e.toString());
      return new Balance(BigInteger.ZERO, ActionOutcome.failed(action, token, e.getMessage()));
    }
  }

  private static ActionOutcome skip(ActionOutcome.Action action, PoolConfig pool, String token, String reason) {
    log.info("pool={} reward token={} {} skipped: {}", pool.name(), token, action, reason);
    return ActionOutcome.skipped(action, token, reason);
  }

  private record Balance(BigInteger amount, ActionOutcome rejected) {
  }
}
