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

import ai.floedb.nomatrix.service.presence.PresenceTracker;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.ScheduledExecution;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import java.time.Clock;

/** Deletes presence records nobody has refreshed within the stale window. */
@ApplicationScoped
public class PresenceSweepScheduler extends SweepScheduler {
  static final String NAME = "presence";

  @Inject Provider<PresenceTracker> presence;
  @Inject Clock clock;

  public PresenceSweepScheduler() {
    super(NAME);
  }

  public PresenceSweepScheduler(
      Provider<PresenceTracker> presence, Clock clock, MeterRegistry registry) {
    super(NAME);
    this.presence = presence;
    this.clock = clock;
    this.registry = registry;
    initMeters();
  }

  void onStop(@Observes ShutdownEvent ev) {
    stopping = true;
    DisabledOrStopping.signalStopping();
  }

  @Scheduled(
      every = "{nomatrix.gc.presence.tick-every}",
      concurrentExecution = Scheduled.ConcurrentExecution.SKIP,
      skipExecutionIf = DisabledOrStopping.class)
  void tick() {
    sweepNow();
  }

  /** One sweep outside the schedule; -1 when disabled, stopping or failed. */
  int sweepNow() {
    return runTick(() -> presence.get().sweepStale(clock.instant()));
  }

  public static final class DisabledOrStopping implements Scheduled.SkipPredicate {
    private static volatile boolean stopping;

    static void signalStopping() {
      stopping = true;
    }

    @Override
    public boolean test(ScheduledExecution execution) {
      return !isEnabled(NAME) || stopping;
    }
  }
}
