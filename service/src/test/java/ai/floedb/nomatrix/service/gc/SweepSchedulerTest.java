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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ai.floedb.nomatrix.service.lock.LockManager;
import ai.floedb.nomatrix.service.presence.PresenceUpdate;
import ai.floedb.nomatrix.service.repo.model.LockKind;
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.testsupport.CollabFixture;
import ai.floedb.nomatrix.storage.errors.StorageException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SweepSchedulerTest {
  private static final String P = "proj-1";

  private CollabFixture fx;
  private LockSweepScheduler lockSweep;
  private PresenceSweepScheduler presenceSweep;

  @BeforeEach
  void setUp() {
    fx = new CollabFixture();
    lockSweep = new LockSweepScheduler(() -> fx.locks, fx.clock, fx.registry);
    presenceSweep = new PresenceSweepScheduler(() -> fx.presence, fx.clock, fx.registry);
  }

  @AfterEach
  void tearDown() {
    System.clearProperty("nomatrix.gc.locks.enabled");
    System.clearProperty("nomatrix.gc.presence.enabled");
  }

  @Test
  void lockTickRemovesExpiredLocksAndCounts() {
    fx.locks.acquire(P, new ObjectPair("a", "b"), "alice", "s1", LockKind.EDIT, fx.now());
    fx.locks.acquire(P, new ObjectPair("b", "c"), "bob", "s2", LockKind.EDIT, fx.now());

    assertEquals(0, lockSweep.sweepNow());
    fx.clock.advance(Duration.ofMinutes(5));
    assertEquals(2, lockSweep.sweepNow());

    assertEquals(2.0, fx.registry.counter("nomatrix_gc_locks_ticks").count());
    assertEquals(2.0, fx.registry.counter("nomatrix_gc_locks_removed").count());
    assertEquals(1.0, fx.registry.get("nomatrix_gc_locks_enabled").gauge().value());
    assertEquals(0.0, fx.registry.get("nomatrix_gc_locks_running").gauge().value());
    assertTrue(fx.locks.activeLocks(P, fx.now()).isEmpty());
  }

  @Test
  void presenceTickRemovesStaleRecords() {
    fx.presence.heartbeat(P, "alice", "s1", PresenceUpdate.viewing(), fx.now());
    fx.clock.advance(Duration.ofHours(1));

    assertEquals(1, presenceSweep.sweepNow());
    assertEquals(1.0, fx.registry.counter("nomatrix_gc_presence_removed").count());
  }

  @Test
  void disabledTickDoesNothing() {
    System.setProperty("nomatrix.gc.locks.enabled", "false");
    fx.locks.acquire(P, new ObjectPair("a", "b"), "alice", "s1", LockKind.EDIT, fx.now());
    fx.clock.advance(Duration.ofMinutes(10));

    assertEquals(-1, lockSweep.sweepNow());
    assertEquals(0.0, fx.registry.counter("nomatrix_gc_locks_ticks").count());
    assertEquals(0.0, fx.registry.get("nomatrix_gc_locks_enabled").gauge().value());
    assertFalse(SweepScheduler.isEnabled(LockSweepScheduler.NAME));
    assertTrue(SweepScheduler.isEnabled(PresenceSweepScheduler.NAME));
  }

  @Test
  void stoppingSkipsTicks() {
    lockSweep.stopping = true;

    assertEquals(-1, lockSweep.sweepNow());
  }

  @Test
  void failedTickIsCountedAndDoesNotThrow() {
    var failing = mock(LockManager.class);
    when(failing.sweepExpired(any())).thenThrow(new StorageException("store unavailable"));
    var sweep = new LockSweepScheduler(() -> failing, fx.clock, fx.registry);

    assertEquals(-1, sweep.sweepNow());
    assertEquals(1.0, fx.registry.counter("nomatrix_gc_locks_failures").count());
  }
}
