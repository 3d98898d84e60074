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
package ai.floedb.nomatrix.service.lock;

import ai.floedb.nomatrix.service.config.CollaborationConfig;
import ai.floedb.nomatrix.service.error.Outcome;
import ai.floedb.nomatrix.service.repo.impl.LockRepository;
import ai.floedb.nomatrix.service.repo.model.CellLock;
import ai.floedb.nomatrix.service.repo.model.LockKind;
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.repo.util.BaseRecordRepository;
import ai.floedb.nomatrix.service.repo.util.Stored;
import ai.floedb.nomatrix.storage.errors.StorageAbortRetryableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Grants short-lived exclusive locks on matrix cells.
 *
 * <p>At most one unexpired lock exists per (project, pair). Acquisition never waits: it either
 * wins the conditional write or reports a conflict. Expiry is evaluated against the caller's
 * {@code now} at every read, so correctness does not depend on {@link #sweepExpired} having run.
 *
 * <p>Re-acquiring a pair the caller already holds is a conflict, not a renewal. A holder that
 * needs more time must release and acquire again, leaving a short window in which someone else
 * may take the cell.
 */
@ApplicationScoped
public class LockManager {
  private static final Logger LOG = Logger.getLogger(LockManager.class);

  @Inject LockRepository locks;
  @Inject CollaborationConfig config;
  @Inject MeterRegistry registry;

  private Counter grantedCounter;
  private Counter conflictCounter;

  public LockManager() {}

  public LockManager(LockRepository locks, CollaborationConfig config, MeterRegistry registry) {
    this.locks = locks;
    this.config = config;
    this.registry = registry;
    initMeters();
  }

  @PostConstruct
  void initMeters() {
    grantedCounter =
        Counter.builder("nomatrix_locks_granted")
            .description("Cell locks granted")
            .register(registry);
    conflictCounter =
        Counter.builder("nomatrix_locks_conflicts")
            .description("Cell lock requests refused because the cell was held")
            .register(registry);
  }

  public Outcome<CellLock> acquire(
      String projectId,
      ObjectPair pair,
      String holder,
      String sessionId,
      LockKind kind,
      Instant now) {
    for (int i = 0; i < BaseRecordRepository.CAS_MAX; i++) {
      Optional<Stored<CellLock>> current = locks.getByPair(projectId, pair);
      if (current.isPresent() && !current.get().value().isExpired(now)) {
        var held = current.get().value();
        conflictCounter.increment();
        LOG.debugf(
            "lock conflict project=%s pair=%s requestedBy=%s heldBy=%s",
            projectId, pair, holder, held.holder());
        return Outcome.conflict("lock.held", conflictParams(held));
      }

      var lock =
          new CellLock(
              UUID.randomUUID().toString(),
              projectId,
              pair,
              holder,
              sessionId,
              kind,
              now,
              now.plus(config.lockGrantDuration()));

      if (locks.insert(lock, current)) {
        grantedCounter.increment();
        if (current.isPresent()) {
          LOG.debugf(
              "lock replaced expired project=%s pair=%s stale=%s",
              projectId, pair, current.get().value().id());
        }
        return Outcome.ok(lock);
      }
      // lost to a concurrent acquire, release or sweep; re-read decides
    }

    throw new StorageAbortRetryableException(
        "lock pointer not yet visible: project=" + projectId + " pair=" + pair);
  }

  /**
   * @return true if the lock existed, belonged to {@code holder} and is now gone
   */
  public boolean release(String lockId, String holder) {
    var stored = locks.getById(lockId);
    if (stored.isEmpty()) {
      return false;
    }
    if (!stored.get().value().holder().equals(holder)) {
      LOG.debugf("lock release refused lock=%s requestedBy=%s", lockId, holder);
      return false;
    }
    return locks.delete(stored.get());
  }

  /** Removes every lock with {@code expiresAt <= now}. Zero is a normal result. */
  public int sweepExpired(Instant now) {
    int removed = 0;
    for (var stored : locks.listAll()) {
      if (stored.value().isExpired(now) && locks.delete(stored)) {
        removed++;
      }
    }
    if (removed > 0) {
      LOG.infof("swept expired locks count=%d", removed);
    }
    return removed;
  }

  /** Holder of the live lock on the cell, if any. */
  public Optional<String> isLocked(String projectId, ObjectPair pair, Instant now) {
    return locks
        .getByPair(projectId, pair)
        .map(Stored::value)
        .filter(l -> !l.isExpired(now))
        .map(CellLock::holder);
  }

  public Optional<CellLock> get(String lockId, Instant now) {
    return locks.getById(lockId).map(Stored::value).filter(l -> !l.isExpired(now));
  }

  public List<CellLock> activeLocks(String projectId, Instant now) {
    return locks.listByProject(projectId).stream()
        .map(Stored::value)
        .filter(l -> !l.isExpired(now))
        .toList();
  }

  private static Map<String, String> conflictParams(CellLock held) {
    Map<String, String> params = new HashMap<>();
    params.put("source_object_id", held.pair().sourceObjectId());
    params.put("target_object_id", held.pair().targetObjectId());
    params.put("locked_by", held.holder());
    params.put("expires_at", held.expiresAt().toString());
    return params;
  }
}
