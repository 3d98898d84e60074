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
package ai.floedb.nomatrix.service.repo.impl;

import ai.floedb.nomatrix.service.repo.model.CellLock;
import ai.floedb.nomatrix.service.repo.model.Keys;
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.repo.util.BaseRecordRepository;
import ai.floedb.nomatrix.service.repo.util.Stored;
import ai.floedb.nomatrix.storage.kv.KvStore;
import ai.floedb.nomatrix.storage.kv.KvStore.TxnDelete;
import ai.floedb.nomatrix.storage.kv.KvStore.TxnOp;
import ai.floedb.nomatrix.storage.kv.KvStore.TxnPut;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lock records. The by-pair record is the lock; the by-id record lets a holder release by lock id.
 * Both are always written and removed together.
 *
 * <p>Store versions restart at 1 when a key is deleted and created again, so the by-pair version
 * alone does not identify a lock. Every replace or delete therefore also deletes the by-id record
 * of the lock it observed, and fails if that record is already gone.
 */
@ApplicationScoped
public class LockRepository extends BaseRecordRepository<CellLock> {

  public LockRepository() {}

  public LockRepository(KvStore kv, ObjectMapper mapper) {
    super(kv, mapper);
  }

  @Override
  protected Class<CellLock> type() {
    return CellLock.class;
  }

  @Override
  protected String kind() {
    return "cell-lock";
  }

  public Optional<Stored<CellLock>> getByPair(String projectId, ObjectPair pair) {
    return read(Keys.lockByPair(projectId, pair));
  }

  public Optional<Stored<CellLock>> getById(String lockId) {
    var idx = kv.get(Keys.lockById(lockId));
    if (idx.isEmpty()) {
      return Optional.empty();
    }
    var attrs = idx.get().attrs();
    var pair = new ObjectPair(attrs.get("source"), attrs.get("target"));
    return getByPair(attrs.get("project"), pair).filter(s -> lockId.equals(s.value().id()));
  }

  /**
   * Writes {@code lock} over the pair in one transaction. {@code replacing} is the record the
   * caller observed (empty when the pair was free); if it was released, swept or replaced since,
   * nothing is written.
   */
  public boolean insert(CellLock lock, Optional<Stored<CellLock>> replacing) {
    var byPair = Keys.lockByPair(lock.projectId(), lock.pair());
    var index =
        new KvStore.Record(
            Keys.lockById(lock.id()),
            "cell-lock-id",
            null,
            Map.of(
                "project", lock.projectId(),
                "source", lock.pair().sourceObjectId(),
                "target", lock.pair().targetObjectId()),
            0L);

    List<TxnOp> ops = new ArrayList<>();
    if (replacing.isPresent()) {
      var old = indexDelete(replacing.get().value().id());
      if (old.isEmpty()) {
        return false;
      }
      ops.add(new TxnPut(toRecord(byPair, lock, Map.of()), replacing.get().version()));
      ops.add(old.get());
    } else {
      ops.add(new TxnPut(toRecord(byPair, lock, Map.of()), 0L));
    }
    ops.add(new TxnPut(index, 0L));
    return kv.txnWriteCas(ops);
  }

  /** False when the observed lock is no longer the one on the pair. */
  public boolean delete(Stored<CellLock> stored) {
    var lock = stored.value();
    var old = indexDelete(lock.id());
    if (old.isEmpty()) {
      return false;
    }
    return kv.txnWriteCas(
        List.of(
            new TxnDelete(Keys.lockByPair(lock.projectId(), lock.pair()), stored.version()),
            old.get()));
  }

  public List<Stored<CellLock>> listByProject(String projectId) {
    return scan(Keys.LOCKS_PARTITION, Keys.lockByPairPrefix(projectId));
  }

  public List<Stored<CellLock>> listAll() {
    return scan(Keys.LOCKS_PARTITION, Keys.lockByPairPrefix());
  }

  private Optional<TxnOp> indexDelete(String lockId) {
    var key = Keys.lockById(lockId);
    return kv.get(key).map(idx -> new TxnDelete(key, idx.version()));
  }
}
