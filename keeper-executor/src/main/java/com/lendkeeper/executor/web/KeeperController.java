package com.lendkeeper.executor.web;

import com.lendkeeper.config.KeeperProperties;
import com.lendkeeper.executor.chain.ChainProperties;
import com.lendkeeper.executor.chain.SignerContext;
import com.lendkeeper.executor.cycle.CycleRunResult;
import com.lendkeeper.executor.cycle.KeeperCycleService;
import com.lendkeeper.executor.cycle.PoolCycleReport;
import com.lendkeeper.executor.liquidity.DexProperties;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/keeper")
@Validated
@RequiredArgsConstructor
public class KeeperController {

  private final @NonNull KeeperCycleService cycleService;
  private final @NonNull KeeperProperties keeperProperties;
  private final @NonNull ChainProperties chainProperties;
  private final @NonNull DexProperties dexProperties;
  private final @NonNull SignerContext signerContext;

  @GetMapping("/config")
  public ResponseEntity<Object> getConfig() {
    return ResponseEntity.ok(new ConfigResponse(keeperProperties, chainProperties, dexProperties));
  }

  @GetMapping("/status")
  public ResponseEntity<Object> status() {
    return ResponseEntity.ok(new StatusResponse(
        signerContext.address().orElse(null),
        keeperProperties.dryRun(),
        cycleService.running(),
        cycleService.lastRun(),
        cycleService.lastReports()
    ));
  }

  /**
   * Runs one pass immediately, in the configured dry-run mode.
   */
  @PostMapping("/run")
  public ResponseEntity<Object> runOnce() {
    return ResponseEntity.ok(cycleService.runOnce());
  }

  private record ConfigResponse(
      @NotNull KeeperProperties keeper,
      @NotNull ChainProperties chain,
      @NotNull DexProperties dex
  ) {
  }

  private record StatusResponse(
      String keeperAddress,
      boolean dryRun,
      boolean running,
      CycleRunResult lastRun,
      Map<String, PoolCycleReport> pools
  ) {
  }
}
