package com.lendkeeper.executor.cycle;

import com.lendkeeper.config.KeeperProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Spaces consecutive writes within a pool by {@code keeper.cycle.delay-between-actions-millis}.
 */
@Component
@RequiredArgsConstructor
public class ActionPacer {

  private final @NonNull KeeperProperties keeperProperties;

  public void pause() throws InterruptedException {
    long millis = keeperProperties.cycle().delayBetweenActionsMillis();
    if (millis > 0) {
      Thread.sleep(millis);
    }
  }
}
