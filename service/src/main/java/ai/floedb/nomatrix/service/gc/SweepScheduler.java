/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.floedb.nomatrix.service.gc;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

/**
 * Tick bookkeeping shared by the lock and presence sweeps: enable toggle, shutdown flag, and the
 * {@code nomatrix_gc_<name>_*} meters.
 */
abstract class SweepScheduler {
  private static final Logger LOG = Logger.getLogger(SweepScheduler.class);

  @Inject MeterRegistry registry;

  private final String name;

  private Counter tickCounter;
  private Counter removedCounter;
  private Counter failureCounter;
  private Timer tickTimer;
  private final AtomicInteger running = new AtomicInteger(0);
  private final AtomicInteger enabledGauge = new AtomicInteger(0);
  private final AtomicLong lastTickStartMs = new AtomicLong(0);
  private final AtomicLong lastTickEndMs = new AtomicLong(0);
  private final AtomicLong lastRemoved = new AtomicLong(0);

  protected volatile boolean stopping;

  protected SweepScheduler(String name) {
    this.name = name;
  }

  @PostConstruct
  void initMeters() {
    String prefix = "nomatrix_gc_" + name;
    tickCounter =
        Counter.builder(prefix + "_ticks").description("Scheduler ticks").register(registry);
    removedCounter =
        Counter.builder(prefix + "_removed")
            .description("Records removed by the sweep")
            .register(registry);
    failureCounter =
        Counter.builder(prefix + "_failures")
            .description("Ticks that ended with an error")
            .register(registry);
    tickTimer =
        Timer.builder(prefix + "_tick_duration")
            .description("Duration of sweep ticks")
            .register(registry);
    registry.gauge(prefix + "_running", running);
    registry.gauge(prefix + "_enabled", enabledGauge);
    registry.gauge(prefix + "_last_tick_start_ms", lastTickStartMs);
    registry.gauge(prefix + "_last_tick_end_ms", lastTickEndMs);
    registry.gauge(prefix + "_last_removed", lastRemoved);
  }

  /**
   * Runs one sweep unless disabled or shutting down.
   *
   * @return records removed, or -1 when the tick was skipped or failed
   */
  protected int runTick(IntSupplier sweep) {
    if (stopping) {
      return -1;
    }
    boolean enabled = isEnabled(name);
    enabledGauge.set(enabled ? 1 : 0);
    if (!enabled) {
      return -1;
    }

    lastTickStartMs.set(System.currentTimeMillis());
    running.set(1);
    tickCounter.increment();

    Timer.Sample sample = Timer.start(registry);
    try {
      int removed = sweep.getAsInt();
      removedCounter.increment(removed);
      lastRemoved.set(removed);
      return removed;
    } catch (RuntimeException e) {
      failureCounter.increment();
      LOG.warnf(e, "gc %s tick failed", name);
      return -1;
    } finally {
      sample.stop(tickTimer);
      lastTickEndMs.set(System.currentTimeMillis());
      running.set(0);
    }
  }

  static boolean isEnabled(String name) {
    return ConfigProvider.getConfig()
        .getOptionalValue("nomatrix.gc." + name + ".enabled", Boolean.class)
        .orElse(true);
  }
}
