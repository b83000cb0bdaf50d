package com.lendkeeper.executor.liquidity;

import com.lendkeeper.config.LiquiditySource;
import lombok.NonNull;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class LiquidityRouterRegistry {

  private final Map<LiquiditySource, LiquidityRouter> routers = new EnumMap<>(LiquiditySource.class);

  public LiquidityRouterRegistry(@NonNull List<LiquidityRouter> routers) {
    for (LiquidityRouter router : routers) {
      LiquidityRouter previous = this.routers.put(router.source(), router);
      if (previous != null) {
        throw new IllegalStateException("two routers registered for " + router.source());
      }
    }
  }

  public Optional<LiquidityRouter> router(LiquiditySource source) {
    if (source == null || source == LiquiditySource.NONE) {
      return Optional.empty();
    }
    return Optional.ofNullable(routers.get(source));
  }
}
