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

import ai.floedb.nomatrix.service.config.CollaborationConfig;
import ai.floedb.nomatrix.service.repo.impl.PresenceRepository;
import ai.floedb.nomatrix.service.repo.model.Activity;
import ai.floedb.nomatrix.service.repo.model.Presence;
import ai.floedb.nomatrix.service.repo.util.BaseRecordRepository;
import ai.floedb.nomatrix.service.repo.util.Stored;
import ai.floedb.nomatrix.storage.errors.StorageAbortRetryableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Advisory awareness of who is looking at a project. One record per (project, user), last writer
 * wins. Never interacts with cell locks.
 */
@ApplicationScoped
public class PresenceTracker {
  private static final Logger LOG = Logger.getLogger(PresenceTracker.class);

  @Inject PresenceRepository presence;
  @Inject CollaborationConfig config;

  public PresenceTracker() {}

  public PresenceTracker(PresenceRepository presence, CollaborationConfig config) {
    this.presence = presence;
    this.config = config;
  }

  /** Creates or overwrites the caller's record and moves last-seen to {@code now}. */
  public Presence heartbeat(
      String projectId, String userId, String sessionId, PresenceUpdate update, Instant now) {
    var activity = update.activity() == null ? Activity.VIEWING : update.activity();

    for (int i = 0; i < BaseRecordRepository.CAS_MAX; i++) {
      var current = presence.get(projectId, userId);
      var next =
          new Presence(
              current.map(s -> s.value().id()).orElseGet(() -> UUID.randomUUID().toString()),
              projectId,
              userId,
              sessionId,
              now,
              update.currentObjectId(),
              activity,
              update.matrixRow(),
              update.matrixCol());

      boolean written =
          current.isPresent() ? presence.update(next, current.get()) : presence.create(next);
      if (written) {
        return next;
      }
    }

    throw new StorageAbortRetryableException(
        "presence pointer not yet visible: project=" + projectId + " user=" + userId);
  }

  public List<Presence> listActive(String projectId, Instant now, Duration activeWindow) {
    return presence.listByProject(projectId).stream()
        .map(Stored::value)
        .filter(p -> p.isActive(now, activeWindow))
        .toList();
  }

  public List<Presence> listActive(String projectId, Instant now) {
    return listActive(projectId, now, config.presenceActiveWindow());
  }

  /** Deletes records with {@code lastSeen <= now - staleWindow}. */
  public int sweepStale(Instant now, Duration staleWindow) {
    var threshold = now.minus(staleWindow);
    int removed = 0;
    for (var stored : presence.listAll()) {
      if (!stored.value().lastSeen().isAfter(threshold) && presence.delete(stored)) {
        removed++;
      }
    }
    if (removed > 0) {
      LOG.infof("swept stale presence count=%d", removed);
    }
    return removed;
  }

  public int sweepStale(Instant now) {
    return sweepStale(now, config.presenceStaleWindow());
  }
}
