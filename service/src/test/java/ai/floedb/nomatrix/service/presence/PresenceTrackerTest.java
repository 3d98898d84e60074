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
package ai.floedb.nomatrix.service.presence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.floedb.nomatrix.service.repo.model.Activity;
import ai.floedb.nomatrix.service.repo.model.Keys;
import ai.floedb.nomatrix.service.repo.model.Presence;
import ai.floedb.nomatrix.service.testsupport.CollabFixture;
import ai.floedb.nomatrix.service.testsupport.InterleavingKvStore;
import ai.floedb.nomatrix.service.testsupport.TestConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PresenceTrackerTest {
  private static final String P = "proj-1";

  private PresenceTracker tracker;
  private Instant t0;

  @BeforeEach
  void setUp() {
    var fx = new CollabFixture();
    tracker = fx.presence;
    t0 = fx.now();
  }

  @Test
  void activeWindowIncludesRecentAndExcludesOld() {
    tracker.heartbeat(P, "fresh", "s1", PresenceUpdate.viewing(), t0.minus(Duration.ofMinutes(4)));
    tracker.heartbeat(P, "old", "s2", PresenceUpdate.viewing(), t0.minus(Duration.ofMinutes(6)));

    var active = tracker.listActive(P, t0, Duration.ofMinutes(5));

    assertThat(active).extracting(Presence::userId).containsExactly("fresh");
  }

  @Test
  void heartbeatOverwritesAndKeepsId() {
    var first = tracker.heartbeat(P, "alice", "s1", PresenceUpdate.viewing(), t0);
    var second =
        tracker.heartbeat(
            P, "alice", "s2", PresenceUpdate.at(Activity.EDITING, 2, 3), t0.plusSeconds(30));

    assertEquals(first.id(), second.id());
    var active = tracker.listActive(P, t0.plusSeconds(30));
    assertEquals(1, active.size());
    var p = active.get(0);
    assertEquals("s2", p.sessionId());
    assertEquals(Activity.EDITING, p.activity());
    assertEquals(t0.plusSeconds(30), p.lastSeen());
    assertEquals(Integer.valueOf(2), p.matrixRow());
    assertEquals(Integer.valueOf(3), p.matrixCol());
  }

  @Test
  void missingActivityDefaultsToViewing() {
    var p = tracker.heartbeat(P, "alice", "s1", new PresenceUpdate("obj-1", null, null, null), t0);

    assertEquals(Activity.VIEWING, p.activity());
    assertEquals("obj-1", p.currentObjectId());
  }

  @Test
  void presenceIsScopedToProject() {
    tracker.heartbeat(P, "alice", "s1", PresenceUpdate.viewing(), t0);
    tracker.heartbeat("proj-2", "bob", "s2", PresenceUpdate.viewing(), t0);

    assertThat(tracker.listActive(P, t0)).extracting(Presence::userId).containsExactly("alice");
  }

  @Test
  void sweepStaleDeletesOnlyRecordsPastTheWindow() {
    tracker.heartbeat(P, "gone", "s1", PresenceUpdate.viewing(), t0.minus(Duration.ofHours(2)));
    tracker.heartbeat(P, "edge", "s2", PresenceUpdate.viewing(), t0.minus(Duration.ofHours(1)));
    tracker.heartbeat("proj-2", "here", "s3", PresenceUpdate.viewing(), t0);

    assertEquals(2, tracker.sweepStale(t0));
    assertEquals(0, tracker.sweepStale(t0));
    assertThat(tracker.listActive("proj-2", t0)).hasSize(1);
    assertTrue(tracker.listActive(P, t0, Duration.ofDays(1)).isEmpty());
  }

  @Test
  void sweepLeavesPresenceRecreatedDuringTheSweep() {
    var store = new InterleavingKvStore();
    var local = new CollabFixture(store, TestConfig.defaults()).presence;
    var stale = local.heartbeat(P, "alice", "s1", PresenceUpdate.viewing(), t0);
    var later = t0.plus(Duration.ofHours(2));
    var back = new AtomicReference<Presence>();

    store.beforeNextGet(
        Keys.presenceById(stale.id()),
        () -> {
          assertEquals(1, local.sweepStale(later));
          back.set(local.heartbeat(P, "alice", "s2", PresenceUpdate.viewing(), later));
        });

    assertEquals(0, local.sweepStale(later));
    assertNotEquals(stale.id(), back.get().id());
    assertThat(local.listActive(P, later)).containsExactly(back.get());
  }

  @Test
  void heartbeatRetriesWhenItsRecordIsSweptUnderIt() {
    var store = new InterleavingKvStore();
    var local = new CollabFixture(store, TestConfig.defaults()).presence;
    var stale = local.heartbeat(P, "alice", "s1", PresenceUpdate.viewing(), t0);
    var later = t0.plus(Duration.ofHours(2));
    var other = new AtomicReference<Presence>();

    store.beforeNextGet(
        Keys.presenceById(stale.id()),
        () -> {
          assertEquals(1, local.sweepStale(later));
          other.set(local.heartbeat(P, "alice", "s2", PresenceUpdate.viewing(), later));
        });
    var mine = local.heartbeat(P, "alice", "s3", PresenceUpdate.viewing(), later.plusSeconds(1));

    assertEquals(other.get().id(), mine.id());
    assertThat(local.listActive(P, later.plusSeconds(1))).containsExactly(mine);
    assertEquals(1, local.sweepStale(later.plus(Duration.ofHours(2))));
    assertTrue(local.listActive(P, later, Duration.ofDays(1)).isEmpty());
  }
}
