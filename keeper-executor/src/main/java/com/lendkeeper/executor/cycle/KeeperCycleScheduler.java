package com.lendkeeper.executor.cycle;

import com.lendkeeper.config.KeeperProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class KeeperCycleScheduler {

  private final @NonNull KeeperProperties properties;
  private final @NonNull KeeperCycleService cycleService;

  @Scheduled(fixedDelayString = "${keeper.cycle.delay-between-runs-millis:30000}")
  public void tick() {
    if (!properties.cycle().enabled()) {
      return;
    }
    try {
      CycleRunResult res = cycleService.runOnce();
      if (!res.ok() && !"no-pools".equals(res.status())) {
        log.warn("keeper cycle status={} dryRun={} pools={}", res.status(), res.dryRun(), res.pools().size());
      }
    } catch (Exception e) {
      log.warn("keeper cycle tick failed: {}", e.toString());
    }
  }
}
