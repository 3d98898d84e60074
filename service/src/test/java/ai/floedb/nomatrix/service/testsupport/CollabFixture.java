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
package ai.floedb.nomatrix.service.testsupport;

import ai.floedb.nomatrix.service.collab.CollaborationFacade;
import ai.floedb.nomatrix.service.config.CollaborationConfig;
import ai.floedb.nomatrix.service.lock.LockManager;
import ai.floedb.nomatrix.service.matrix.MatrixAssembler;
import ai.floedb.nomatrix.service.presence.PresenceTracker;
import ai.floedb.nomatrix.service.repo.impl.LockRepository;
import ai.floedb.nomatrix.service.repo.impl.ObjectRepository;
import ai.floedb.nomatrix.service.repo.impl.PresenceRepository;
import ai.floedb.nomatrix.service.repo.impl.RelationshipRepository;
import ai.floedb.nomatrix.service.repo.model.NomObject;
import ai.floedb.nomatrix.storage.kv.KvStore;
import ai.floedb.nomatrix.storage.memory.InMemoryKvStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;

/** Wires the collaboration beans by hand over one store, the way the container would. */
public final class CollabFixture {
  public static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

  public final KvStore kv;
  public final ObjectMapper mapper = mapper();
  public final MutableClock clock = new MutableClock(T0);
  public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  public final CollaborationConfig config;

  public final ObjectRepository objects;
  public final RelationshipRepository relationships;
  public final LockRepository lockRepo;
  public final PresenceRepository presenceRepo;
  public final LockManager locks;
  public final PresenceTracker presence;
  public final MatrixAssembler assembler;
  public final CollaborationFacade facade;

  public CollabFixture() {
    this(new InMemoryKvStore(), TestConfig.defaults());
  }

  public CollabFixture(KvStore kv, CollaborationConfig config) {
    this.kv = kv;
    this.config = config;
    objects = new ObjectRepository(kv, mapper);
    relationships = new RelationshipRepository(kv, mapper);
    lockRepo = new LockRepository(kv, mapper);
    presenceRepo = new PresenceRepository(kv, mapper);
    locks = new LockManager(lockRepo, config, registry);
    presence = new PresenceTracker(presenceRepo, config);
    assembler = new MatrixAssembler(objects, relationships, locks, presence);
    facade =
        new CollaborationFacade(
            objects, relationships, locks, presence, assembler, config, clock);
  }

  public static ObjectMapper mapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public NomObject seedObject(String projectId, String id, String name) {
    var o = new NomObject(id, projectId, name, name + " definition", List.of());
    if (!objects.create(o)) {
      throw new IllegalStateException("object already seeded: " + id);
    }
    return o;
  }

  public Instant now() {
    return clock.instant();
  }
}
