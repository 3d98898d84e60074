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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.floedb.nomatrix.service.repo.model.Keys;
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.repo.model.Relationship;
import ai.floedb.nomatrix.service.testsupport.CollabFixture;
import ai.floedb.nomatrix.storage.errors.StorageCorruptionException;
import ai.floedb.nomatrix.storage.kv.KvStore;
import ai.floedb.nomatrix.storage.memory.InMemoryKvStore;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelationshipRepositoryTest {
  private static final String P = "proj-1";
  private static final ObjectPair AB = new ObjectPair("a", "b");
  private static final Instant T = Instant.parse("2026-03-02T10:00:00Z");

  private KvStore kv;
  private RelationshipRepository repo;

  @BeforeEach
  void setUp() {
    kv = new InMemoryKvStore();
    repo = new RelationshipRepository(kv, CollabFixture.mapper());
  }

  @Test
  void createWritesRecordAndPairIndex() {
    var rel = rel("r1", AB);

    assertTrue(repo.create(rel));

    assertEquals(Optional.of(rel), repo.getById(P, "r1"));
    assertTrue(repo.pairExists(P, AB));
    assertFalse(repo.pairExists(P, AB.reversed()));
    assertFalse(repo.pairExists("proj-2", AB));
    assertEquals(
        "r1", kv.get(Keys.relationshipByPair(P, AB)).orElseThrow().attrs().get("id"));
  }

  @Test
  void createOnTakenPairWritesNothing() {
    assertTrue(repo.create(rel("r1", AB)));

    assertFalse(repo.create(rel("r2", AB)));

    assertTrue(repo.getById(P, "r2").isEmpty());
    assertEquals(1, repo.list(P).size());
  }

  @Test
  void updateIsConditionalOnVersion() {
    repo.create(rel("r1", AB));
    var stored = repo.getStored(P, "r1").orElseThrow();
    var next = stored.value().toBuilder().setForwardLabel("owns").build();

    assertTrue(repo.update(next, stored.version()));
    assertFalse(repo.update(next, stored.version()));
    assertEquals("owns", repo.getById(P, "r1").orElseThrow().forwardLabel());
  }

  @Test
  void deleteRemovesRecordAndFreesPair() {
    repo.create(rel("r1", AB));

    assertTrue(repo.delete(repo.getStored(P, "r1").orElseThrow()));

    assertTrue(repo.getById(P, "r1").isEmpty());
    assertFalse(repo.pairExists(P, AB));
    assertTrue(repo.create(rel("r2", AB)));
  }

  @Test
  void deleteWithStaleVersionFails() {
    repo.create(rel("r1", AB));
    var stale = repo.getStored(P, "r1").orElseThrow();
    repo.update(stale.value().toBuilder().setDescription("changed").build(), stale.version());

    assertFalse(repo.delete(stale));
    assertTrue(repo.pairExists(P, AB));
  }

  @Test
  void listIsScopedToProject() {
    repo.create(rel("r1", AB));
    repo.create(rel("r2", AB.reversed()));
    repo.create(rel("proj-2", "r3", AB));

    assertEquals(2, repo.list(P).size());
    assertEquals(1, repo.list("proj-2").size());
  }

  @Test
  void undecodableRecordIsCorruption() {
    var key = Keys.relationshipById(P, "bad");
    kv.putCas(
        new KvStore.Record(
            key, "relationship", "{not json".getBytes(StandardCharsets.UTF_8), Map.of(), 0L),
        0L);

    assertThrows(StorageCorruptionException.class, () -> repo.getById(P, "bad"));
  }

  @Test
  void enumsArePersistedByWireValue() {
    repo.create(rel("r1", AB));

    var json = new String(
        kv.get(Keys.relationshipById(P, "r1")).orElseThrow().value(), StandardCharsets.UTF_8);

    assertTrue(json.contains("\"cardinality\":\"1:N\""), json);
    assertTrue(json.contains("\"strength\":\"normal\""), json);
  }

  @Test
  void unknownWireValueIsCorruption() {
    repo.create(rel("r1", AB));
    var key = Keys.relationshipById(P, "r1");
    var rec = kv.get(key).orElseThrow();
    var json = new String(rec.value(), StandardCharsets.UTF_8).replace("\"1:N\"", "\"2:2\"");
    kv.putCas(
        new KvStore.Record(
            key, rec.kind(), json.getBytes(StandardCharsets.UTF_8), rec.attrs(), 0L),
        rec.version());

    assertThrows(StorageCorruptionException.class, () -> repo.getById(P, "r1"));
  }

  private static Relationship rel(String id, ObjectPair pair) {
    return rel(P, id, pair);
  }

  private static Relationship rel(String projectId, String id, ObjectPair pair) {
    return Relationship.newBuilder()
        .setId(id)
        .setProjectId(projectId)
        .setPair(pair)
        .setCreated(T, "alice")
        .setUpdated(T, "alice")
        .build();
  }
}
