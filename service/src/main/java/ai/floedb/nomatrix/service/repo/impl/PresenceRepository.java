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

import ai.floedb.nomatrix.service.repo.model.Keys;
import ai.floedb.nomatrix.service.repo.model.Presence;
import ai.floedb.nomatrix.service.repo.util.BaseRecordRepository;
import ai.floedb.nomatrix.service.repo.util.Stored;
import ai.floedb.nomatrix.storage.kv.KvStore;
import ai.floedb.nomatrix.storage.kv.KvStore.TxnDelete;
import ai.floedb.nomatrix.storage.kv.KvStore.TxnPut;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Presence records, one per (project, user). A record keeps its id across heartbeats; the by-id
 * record exists exactly as long as that generation of the presence does.
 *
 * <p>A record deleted by a sweep and recreated by a heartbeat starts again at store version 1, so
 * updates and deletes also check the by-id record of the generation they observed.
 */
@ApplicationScoped
public class PresenceRepository extends BaseRecordRepository<Presence> {

  public PresenceRepository() {}

  public PresenceRepository(KvStore kv, ObjectMapper mapper) {
    super(kv, mapper);
  }

  @Override
  protected Class<Presence> type() {
    return Presence.class;
  }

  @Override
  protected String kind() {
    return "presence";
  }

  public Optional<Stored<Presence>> get(String projectId, String userId) {
    return read(Keys.presence(projectId, userId));
  }

  /** False when the user already has a record. */
  public boolean create(Presence presence) {
    return kv.txnWriteCas(
        List.of(new TxnPut(record(presence), 0L), new TxnPut(index(presence), 0L)));
  }

  /**
   * Overwrites {@code current} with {@code next}, which must carry the same id. False if the
   * observed record changed or was swept since.
   */
  public boolean update(Presence next, Stored<Presence> current) {
    var idx = kv.get(Keys.presenceById(current.value().id()));
    if (idx.isEmpty()) {
      return false;
    }
    return kv.txnWriteCas(
        List.of(
            new TxnPut(record(next), current.version()),
            new TxnPut(index(next), idx.get().version())));
  }

  public boolean delete(Stored<Presence> stored) {
    var p = stored.value();
    var idxKey = Keys.presenceById(p.id());
    var idx = kv.get(idxKey);
    if (idx.isEmpty()) {
      return false;
    }
    return kv.txnWriteCas(
        List.of(
            new TxnDelete(Keys.presence(p.projectId(), p.userId()), stored.version()),
            new TxnDelete(idxKey, idx.get().version())));
  }

  public List<Stored<Presence>> listByProject(String projectId) {
    return scan(Keys.PRESENCE_PARTITION, Keys.presencePrefix(projectId));
  }

  public List<Stored<Presence>> listAll() {
    return scan(Keys.PRESENCE_PARTITION, Keys.presencePrefix());
  }

  private KvStore.Record record(Presence presence) {
    return toRecord(Keys.presence(presence.projectId(), presence.userId()), presence, Map.of());
  }

  private static KvStore.Record index(Presence presence) {
    return new KvStore.Record(
        Keys.presenceById(presence.id()),
        "presence-id",
        null,
        Map.of("project", presence.projectId(), "user", presence.userId()),
        0L);
  }
}
