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
package ai.floedb.nomatrix.service.matrix;

import ai.floedb.nomatrix.service.lock.LockManager;
import ai.floedb.nomatrix.service.presence.PresenceTracker;
import ai.floedb.nomatrix.service.repo.ObjectDirectory;
import ai.floedb.nomatrix.service.repo.impl.RelationshipRepository;
import ai.floedb.nomatrix.service.repo.model.CellLock;
import ai.floedb.nomatrix.service.repo.model.NomObject;
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.repo.model.Relationship;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Builds the n x n grid of a project from its objects, relationships, live locks and presence.
 *
 * <p>Relationships and locks are each indexed by pair once, so assembly is O(n^2 + m) for n
 * objects and m relationships.
 */
@ApplicationScoped
public class MatrixAssembler {
  private static final Logger LOG = Logger.getLogger(MatrixAssembler.class);

  static final Comparator<NomObject> MATRIX_ORDER =
      Comparator.comparing(NomObject::name, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(NomObject::id);

  @Inject ObjectDirectory objects;
  @Inject RelationshipRepository relationships;
  @Inject LockManager locks;
  @Inject PresenceTracker presence;

  public MatrixAssembler() {}

  public MatrixAssembler(
      ObjectDirectory objects,
      RelationshipRepository relationships,
      LockManager locks,
      PresenceTracker presence) {
    this.objects = objects;
    this.relationships = relationships;
    this.locks = locks;
    this.presence = presence;
  }

  public NomMatrix assemble(String projectId, Instant now) {
    List<NomObject> ordered = new ArrayList<>(objects.list(projectId));
    ordered.sort(MATRIX_ORDER);

    List<Relationship> rels = relationships.list(projectId);
    Map<ObjectPair, Relationship> byPair = new HashMap<>(rels.size() * 2);
    Map<String, Integer> outgoing = new HashMap<>();
    Map<String, Integer> incoming = new HashMap<>();
    for (Relationship r : rels) {
      byPair.put(r.pair(), r);
      outgoing.merge(r.sourceObjectId(), 1, Integer::sum);
      incoming.merge(r.targetObjectId(), 1, Integer::sum);
    }

    Map<ObjectPair, CellLock> lockByPair = new HashMap<>();
    for (CellLock l : locks.activeLocks(projectId, now)) {
      lockByPair.put(l.pair(), l);
    }

    List<MatrixObject> headers = new ArrayList<>(ordered.size());
    for (NomObject o : ordered) {
      headers.add(
          new MatrixObject(
              o.id(),
              o.name(),
              o.definition(),
              o.synonyms().size(),
              outgoing.getOrDefault(o.id(), 0),
              incoming.getOrDefault(o.id(), 0)));
    }

    List<List<MatrixCell>> rows = new ArrayList<>(ordered.size());
    for (NomObject source : ordered) {
      List<MatrixCell> row = new ArrayList<>(ordered.size());
      for (NomObject target : ordered) {
        var pair = new ObjectPair(source.id(), target.id());
        boolean self = pair.isSelfReference();
        CellLock lock = lockByPair.get(pair);
        row.add(
            new MatrixCell(
                source.id(),
                target.id(),
                byPair.get(pair),
                self,
                !self,
                lock != null,
                lock == null ? null : lock.holder(),
                lock == null ? null : lock.id()));
      }
      rows.add(List.copyOf(row));
    }

    int n = ordered.size();
    int m = rels.size();
    var matrix =
        new NomMatrix(
            projectId,
            List.copyOf(headers),
            List.copyOf(rows),
            n,
            m,
            completionPercentage(n, m),
            presence.listActive(projectId, now),
            now);

    LOG.debugf(
        "assembled matrix project=%s objects=%d relationships=%d locks=%d",
        projectId, n, m, lockByPair.size());
    return matrix;
  }

  /** {@code m / (n * (n - 1)) * 100} clamped to [0, 100]; 0 when there is no off-diagonal cell. */
  public static double completionPercentage(int objectCount, int relationshipCount) {
    if (objectCount <= 1) {
      return 0.0;
    }
    double totalPossible = (double) objectCount * (objectCount - 1);
    double pct = relationshipCount / totalPossible * 100.0;
    return Math.max(0.0, Math.min(100.0, pct));
  }
}
