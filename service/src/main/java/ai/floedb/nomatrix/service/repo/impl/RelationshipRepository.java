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
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.repo.model.Relationship;
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
 * Relationships of a project. The (source, target) uniqueness constraint is the by-pair index
 * record, which is only ever created in the same transaction as the relationship itself.
 */
@ApplicationScoped
public class RelationshipRepository extends BaseRecordRepository<Relationship> {

  public RelationshipRepository() {}

  public RelationshipRepository(KvStore kv, ObjectMapper mapper) {
    super(kv, mapper);
  }

  @Override
  protected Class<Relationship> type() {
    return Relationship.class;
  }

  @Override
  protected String kind() {
    return "relationship";
  }

  /**
   * @return false when the pair (or, improbably, the id) is already taken; nothing is written
   */
  public boolean create(Relationship rel) {
    var byId = Keys.relationshipById(rel.projectId(), rel.id());
    var byPair = Keys.relationshipByPair(rel.projectId(), rel.pair());
    var index = new KvStore.Record(byPair, "relationship-pair", null, Map.of("id", rel.id()), 0L);

    return kv.txnWriteCas(
        List.of(new TxnPut(toRecord(byId, rel, Map.of()), 0L), new TxnPut(index, 0L)));
  }

  public Optional<Stored<Relationship>> getStored(String projectId, String relationshipId) {
    return read(Keys.relationshipById(projectId, relationshipId));
  }

  public Optional<Relationship> getById(String projectId, String relationshipId) {
    return getStored(projectId, relationshipId).map(Stored::value);
  }

  public boolean pairExists(String projectId, ObjectPair pair) {
    return kv.get(Keys.relationshipByPair(projectId, pair)).isPresent();
  }

  public List<Relationship> list(String projectId) {
    return scan(Keys.projectPartition(projectId), Keys.relationshipByIdPrefix()).stream()
        .map(Stored::value)
        .toList();
  }

  /** Rewrites the record in place. The pair is immutable, so the index is untouched. */
  public boolean update(Relationship next, long expectedVersion) {
    var key = Keys.relationshipById(next.projectId(), next.id());
    return kv.putCas(toRecord(key, next, Map.of()), expectedVersion);
  }

  /** Removes the record and frees its pair in one transaction. */
  public boolean delete(Stored<Relationship> stored) {
    var rel = stored.value();
    var byPair = Keys.relationshipByPair(rel.projectId(), rel.pair());

    List<TxnOp> ops = new ArrayList<>();
    ops.add(new TxnDelete(Keys.relationshipById(rel.projectId(), rel.id()), stored.version()));
    kv.get(byPair)
        .filter(idx -> rel.id().equals(idx.attrs().get("id")))
        .ifPresent(idx -> ops.add(new TxnDelete(byPair, idx.version())));
    return kv.txnWriteCas(ops);
  }
}
