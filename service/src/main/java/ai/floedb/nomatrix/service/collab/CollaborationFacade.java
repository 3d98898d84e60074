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
package ai.floedb.nomatrix.service.collab;

import static ai.floedb.nomatrix.service.collab.RelationshipUpdate.CARDINALITY;
import static ai.floedb.nomatrix.service.collab.RelationshipUpdate.DESCRIPTION;
import static ai.floedb.nomatrix.service.collab.RelationshipUpdate.FORWARD_LABEL;
import static ai.floedb.nomatrix.service.collab.RelationshipUpdate.IS_BIDIRECTIONAL;
import static ai.floedb.nomatrix.service.collab.RelationshipUpdate.REVERSE_LABEL;
import static ai.floedb.nomatrix.service.collab.RelationshipUpdate.STRENGTH;

import ai.floedb.nomatrix.service.common.LogHelper;
import ai.floedb.nomatrix.service.config.CollaborationConfig;
import ai.floedb.nomatrix.service.error.Outcome;
import ai.floedb.nomatrix.service.error.RejectedException;
import ai.floedb.nomatrix.service.lock.LockManager;
import ai.floedb.nomatrix.service.matrix.MatrixAssembler;
import ai.floedb.nomatrix.service.matrix.NomMatrix;
import ai.floedb.nomatrix.service.presence.PresenceTracker;
import ai.floedb.nomatrix.service.presence.PresenceUpdate;
import ai.floedb.nomatrix.service.repo.ObjectDirectory;
import ai.floedb.nomatrix.service.repo.impl.RelationshipRepository;
import ai.floedb.nomatrix.service.repo.model.CellLock;
import ai.floedb.nomatrix.service.repo.model.LockKind;
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.repo.model.Presence;
import ai.floedb.nomatrix.service.repo.model.Relationship;
import ai.floedb.nomatrix.service.repo.util.BaseRecordRepository;
import ai.floedb.nomatrix.storage.errors.StorageAbortRetryableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Entry point for the transport layer. Validates requests, sequences the lock manager, presence
 * tracker, relationship store and matrix assembler, and reports caller-correctable problems as
 * {@link Outcome} failures. Storage faults propagate as exceptions.
 *
 * <p>Mutating a relationship does not require holding the cell lock; locks coordinate clients,
 * they do not gate writes.
 */
@ApplicationScoped
public class CollaborationFacade {
  private static final Logger LOG = Logger.getLogger(CollaborationFacade.class);

  static final int MAX_LABEL_LENGTH = 255;
  static final int MAX_DESCRIPTION_LENGTH = 1000;
  static final int MAX_SESSION_LENGTH = 255;

  private static final Comparator<Instant> INSTANTS =
      Comparator.nullsFirst(Comparator.naturalOrder());

  private static final Comparator<Relationship> NEWEST_FIRST =
      Comparator.comparing(Relationship::createdAt, INSTANTS)
          .thenComparing(Relationship::id)
          .reversed();

  private static final Comparator<Relationship> RECENTLY_CHANGED_FIRST =
      Comparator.comparing(Relationship::updatedAt, INSTANTS)
          .thenComparing(Relationship::id)
          .reversed();

  @Inject ObjectDirectory objects;
  @Inject RelationshipRepository relationships;
  @Inject LockManager locks;
  @Inject PresenceTracker presence;
  @Inject MatrixAssembler assembler;
  @Inject CollaborationConfig config;
  @Inject Clock clock;

  public CollaborationFacade() {}

  public CollaborationFacade(
      ObjectDirectory objects,
      RelationshipRepository relationships,
      LockManager locks,
      PresenceTracker presence,
      MatrixAssembler assembler,
      CollaborationConfig config,
      Clock clock) {
    this.objects = objects;
    this.relationships = relationships;
    this.locks = locks;
    this.presence = presence;
    this.assembler = assembler;
    this.config = config;
    this.clock = clock;
  }

  // ---- relationships ----

  public Outcome<Relationship> createRelationship(
      String projectId, String actor, RelationshipSpec spec) {
    return run(
        "CreateRelationship",
        () -> {
          mustNonBlank(projectId, "project_id");
          mustNonBlank(actor, "actor");
          required(spec, "relationship");
          mustNonBlank(spec.sourceObjectId(), "source_object_id");
          mustNonBlank(spec.targetObjectId(), "target_object_id");

          var pair = new ObjectPair(spec.sourceObjectId(), spec.targetObjectId());
          if (pair.isSelfReference()) {
            throw RejectedException.invalid(
                "relationship.self_reference", Map.of("object_id", pair.sourceObjectId()));
          }
          maxLength(spec.forwardLabel(), "forward_label", MAX_LABEL_LENGTH);
          maxLength(spec.reverseLabel(), "reverse_label", MAX_LABEL_LENGTH);
          maxLength(spec.description(), "description", MAX_DESCRIPTION_LENGTH);

          if (relationships.pairExists(projectId, pair)) {
            throw pairTaken(pair);
          }
          if (objects.get(projectId, pair.sourceObjectId()).isEmpty()
              || objects.get(projectId, pair.targetObjectId()).isEmpty()) {
            throw RejectedException.invalid(
                "relationship.endpoint.missing", Map.of("project_id", projectId));
          }

          var now = clock.instant();
          var b =
              Relationship.newBuilder()
                  .setId(UUID.randomUUID().toString())
                  .setProjectId(projectId)
                  .setPair(pair)
                  .setForwardLabel(spec.forwardLabel())
                  .setReverseLabel(spec.reverseLabel())
                  .setBidirectional(spec.bidirectional())
                  .setDescription(spec.description())
                  .setCreated(now, actor)
                  .setUpdated(now, actor);
          if (spec.cardinality() != null) {
            b.setCardinality(spec.cardinality());
          }
          if (spec.strength() != null) {
            b.setStrength(spec.strength());
          }
          var rel = b.build();

          if (!relationships.create(rel)) {
            throw pairTaken(pair);
          }
          return rel;
        });
  }

  public Outcome<Relationship> getRelationship(String projectId, String relationshipId) {
    return run(
        "GetRelationship",
        () -> {
          mustNonBlank(projectId, "project_id");
          mustNonBlank(relationshipId, "relationship_id");
          return relationships
              .getById(projectId, relationshipId)
              .orElseThrow(() -> relationshipNotFound(projectId, relationshipId));
        });
  }

  public Outcome<Relationship> updateRelationship(
      String projectId, String relationshipId, String actor, RelationshipUpdate update) {
    return run(
        "UpdateRelationship",
        () -> {
          mustNonBlank(projectId, "project_id");
          mustNonBlank(relationshipId, "relationship_id");
          mustNonBlank(actor, "actor");
          required(update, "update");
          var mask = normalizeMask(update.updateMask());
          validateMask(mask);

          for (int i = 0; i < BaseRecordRepository.CAS_MAX; i++) {
            var stored =
                relationships
                    .getStored(projectId, relationshipId)
                    .orElseThrow(() -> relationshipNotFound(projectId, relationshipId));
            var current = stored.value();

            var desired = applyPatch(current, update, mask);
            if (desired.equals(current)) {
              return current;
            }
            desired = desired.toBuilder().setUpdated(clock.instant(), actor).build();
            if (relationships.update(desired, stored.version())) {
              return desired;
            }
          }
          throw new StorageAbortRetryableException(
              "relationship update kept losing: project=" + projectId + " id=" + relationshipId);
        });
  }

  /** Deletes the relationship and frees its pair. Returns what was deleted. */
  public Outcome<Relationship> deleteRelationship(String projectId, String relationshipId) {
    return run(
        "DeleteRelationship",
        () -> {
          mustNonBlank(projectId, "project_id");
          mustNonBlank(relationshipId, "relationship_id");

          for (int i = 0; i < BaseRecordRepository.CAS_MAX; i++) {
            var stored =
                relationships
                    .getStored(projectId, relationshipId)
                    .orElseThrow(() -> relationshipNotFound(projectId, relationshipId));
            if (relationships.delete(stored)) {
              return stored.value();
            }
          }
          throw new StorageAbortRetryableException(
              "relationship delete kept losing: project=" + projectId + " id=" + relationshipId);
        });
  }

  public Outcome<SearchPage<Relationship>> searchRelationships(
      String projectId, RelationshipSearch search) {
    return run(
        "SearchRelationships",
        () -> {
          mustNonBlank(projectId, "project_id");
          required(search, "search");
          int max = config.searchMaxLimit();
          int limit = search.limit() == null ? config.searchDefaultLimit() : search.limit();
          if (limit < 1 || limit > max) {
            throw RejectedException.invalid(
                "search.limit.out_of_range",
                Map.of("max", Integer.toString(max), "limit", Integer.toString(limit)));
          }
          int offset = search.offset() == null ? 0 : search.offset();
          if (offset < 0) {
            throw RejectedException.invalid(
                "search.offset.negative", Map.of("offset", Integer.toString(offset)));
          }
          var order = sortOrder(search);

          List<Relationship> matched = new ArrayList<>();
          for (var r : relationships.list(projectId)) {
            if (matches(r, search)) {
              matched.add(r);
            }
          }
          matched.sort(order);

          int total = matched.size();
          int from = Math.min(offset, total);
          int to = (int) Math.min((long) from + limit, total);
          return new SearchPage<>(List.copyOf(matched.subList(from, to)), total, offset, limit);
        });
  }

  /** Every relationship of the project, newest first. */
  public Outcome<List<Relationship>> listRelationships(String projectId) {
    return run(
        "ListRelationships",
        () -> {
          mustNonBlank(projectId, "project_id");
          List<Relationship> out = new ArrayList<>(relationships.list(projectId));
          out.sort(NEWEST_FIRST);
          return List.copyOf(out);
        });
  }

  // ---- matrix ----

  public Outcome<NomMatrix> assembleMatrix(String projectId) {
    return run(
        "AssembleMatrix",
        () -> {
          mustNonBlank(projectId, "project_id");
          return assembler.assemble(projectId, clock.instant());
        });
  }

  // ---- locks ----

  public Outcome<CellLock> acquireLock(String projectId, String holder, LockRequest request) {
    var L = LogHelper.start(LOG, "AcquireLock");
    Outcome<CellLock> out;
    try {
      mustNonBlank(projectId, "project_id");
      mustNonBlank(holder, "holder");
      required(request, "request");
      required(request.pair(), "pair");
      mustNonBlank(request.pair().sourceObjectId(), "source_object_id");
      mustNonBlank(request.pair().targetObjectId(), "target_object_id");
      mustNonBlank(request.sessionId(), "session_id");
      maxLength(request.sessionId(), "session_id", MAX_SESSION_LENGTH);
      if (request.pair().isSelfReference()) {
        throw RejectedException.invalid(
            "cell.not_editable",
            Map.of(
                "source_object_id", request.pair().sourceObjectId(),
                "target_object_id", request.pair().targetObjectId()));
      }
      var kind = request.kind() == null ? LockKind.EDIT : request.kind();
      out =
          locks.acquire(
              projectId, request.pair(), holder, request.sessionId(), kind, clock.instant());
    } catch (RejectedException r) {
      L.rejected(r.kind(), r.messageKey());
      return r.toOutcome();
    } catch (RuntimeException e) {
      L.fail(e);
      throw e;
    }

    if (out instanceof Outcome.Failure<CellLock> f) {
      L.rejected(f.kind(), f.messageKey());
    } else {
      L.okf("project=%s pair=%s holder=%s", projectId, request.pair(), holder);
    }
    return out;
  }

  /** False for an unknown lock or a holder mismatch. */
  public boolean releaseLock(String lockId, String holder) {
    if (isBlank(lockId) || isBlank(holder)) {
      return false;
    }
    var L = LogHelper.start(LOG, "ReleaseLock");
    try {
      boolean released = locks.release(lockId, holder);
      L.okf("lock=%s released=%s", lockId, released);
      return released;
    } catch (RuntimeException e) {
      L.fail(e);
      throw e;
    }
  }

  public int cleanupExpiredLocks() {
    return locks.sweepExpired(clock.instant());
  }

  // ---- presence ----

  public Outcome<Presence> heartbeat(
      String projectId, String userId, String sessionId, PresenceUpdate update) {
    return run(
        "Heartbeat",
        () -> {
          mustNonBlank(projectId, "project_id");
          mustNonBlank(userId, "user_id");
          mustNonBlank(sessionId, "session_id");
          maxLength(sessionId, "session_id", MAX_SESSION_LENGTH);
          var u = update == null ? PresenceUpdate.viewing() : update;
          nonNegative(u.matrixRow(), "matrix_row");
          nonNegative(u.matrixCol(), "matrix_col");
          return presence.heartbeat(projectId, userId, sessionId, u, clock.instant());
        });
  }

  public Outcome<List<Presence>> activePresence(String projectId) {
    return run(
        "ActivePresence",
        () -> {
          mustNonBlank(projectId, "project_id");
          return presence.listActive(projectId, clock.instant());
        });
  }

  public int cleanupStalePresence() {
    return presence.sweepStale(clock.instant());
  }

  // ---- summary ----

  public Outcome<CollaborationSummary> collaborationSummary(String projectId) {
    return run(
        "CollaborationSummary",
        () -> {
          mustNonBlank(projectId, "project_id");
          var now = clock.instant();
          var users = presence.listActive(projectId, now);
          var active = locks.activeLocks(projectId, now);

          List<Relationship> recent = new ArrayList<>(relationships.list(projectId));
          recent.sort(RECENTLY_CHANGED_FIRST);
          int n = Math.max(0, config.summaryRecentChanges());
          if (recent.size() > n) {
            recent = recent.subList(0, n);
          }

          return new CollaborationSummary(
              projectId, users, active, List.copyOf(recent), users.size(), active.size());
        });
  }

  // ---- helpers ----

  private static <T> Outcome<T> run(String op, Supplier<T> body) {
    var L = LogHelper.start(LOG, op);
    try {
      T value = body.get();
      L.ok();
      return Outcome.ok(value);
    } catch (RejectedException r) {
      L.rejected(r.kind(), r.messageKey());
      return r.toOutcome();
    } catch (RuntimeException e) {
      L.fail(e);
      throw e;
    }
  }

  private static Relationship applyPatch(
      Relationship current, RelationshipUpdate update, Set<String> mask) {
    var b = current.toBuilder();

    if (mask.contains(CARDINALITY)) {
      if (update.cardinality() == null) {
        throw cannotClear(CARDINALITY);
      }
      b.setCardinality(update.cardinality());
    }
    if (mask.contains(STRENGTH)) {
      if (update.strength() == null) {
        throw cannotClear(STRENGTH);
      }
      b.setStrength(update.strength());
    }
    if (mask.contains(IS_BIDIRECTIONAL)) {
      if (update.bidirectional() == null) {
        throw cannotClear(IS_BIDIRECTIONAL);
      }
      b.setBidirectional(update.bidirectional());
    }
    if (mask.contains(FORWARD_LABEL)) {
      maxLength(update.forwardLabel(), FORWARD_LABEL, MAX_LABEL_LENGTH);
      b.setForwardLabel(update.forwardLabel());
    }
    if (mask.contains(REVERSE_LABEL)) {
      maxLength(update.reverseLabel(), REVERSE_LABEL, MAX_LABEL_LENGTH);
      b.setReverseLabel(update.reverseLabel());
    }
    if (mask.contains(DESCRIPTION)) {
      maxLength(update.description(), DESCRIPTION, MAX_DESCRIPTION_LENGTH);
      b.setDescription(update.description());
    }
    return b.build();
  }

  private static Set<String> normalizeMask(Set<String> mask) {
    Set<String> out = new LinkedHashSet<>();
    for (var p : mask) {
      if (p == null) {
        continue;
      }
      var t = p.trim().toLowerCase(Locale.ROOT);
      if (!t.isEmpty()) {
        out.add(t);
      }
    }
    return out;
  }

  private static void validateMask(Set<String> mask) {
    if (mask.isEmpty()) {
      throw RejectedException.invalid("update_mask.required", Map.of());
    }
    for (var p : mask) {
      if (!RelationshipUpdate.MUTABLE_PATHS.contains(p)) {
        throw RejectedException.invalid("update_mask.path.invalid", Map.of("path", p));
      }
    }
  }

  private static Comparator<Relationship> sortOrder(RelationshipSearch search) {
    var sortBy =
        search.sortBy() == null
            ? RelationshipSearch.SORT_CREATED_AT
            : search.sortBy().trim().toLowerCase(Locale.ROOT);
    Comparator<Relationship> cmp =
        switch (sortBy) {
          case RelationshipSearch.SORT_CREATED_AT -> Comparator.comparing(
              Relationship::createdAt, INSTANTS);
          case RelationshipSearch.SORT_UPDATED_AT -> Comparator.comparing(
              Relationship::updatedAt, INSTANTS);
          case RelationshipSearch.SORT_CARDINALITY -> Comparator.comparing(
              r -> r.cardinality().wire());
          case RelationshipSearch.SORT_STRENGTH -> Comparator.comparing(r -> r.strength().wire());
          default -> throw RejectedException.invalid(
              "search.sort_by.invalid",
              Map.of(
                  "allowed", String.join(", ", RelationshipSearch.SORT_FIELDS),
                  "sort_by", search.sortBy()));
        };
    cmp = cmp.thenComparing(Relationship::id);

    var sortOrder =
        search.sortOrder() == null ? "desc" : search.sortOrder().trim().toLowerCase(Locale.ROOT);
    return switch (sortOrder) {
      case "asc" -> cmp;
      case "desc" -> cmp.reversed();
      default -> throw RejectedException.invalid(
          "search.sort_order.invalid", Map.of("sort_order", search.sortOrder()));
    };
  }

  private static boolean matches(Relationship r, RelationshipSearch s) {
    return (s.sourceObjectId() == null || s.sourceObjectId().equals(r.sourceObjectId()))
        && (s.targetObjectId() == null || s.targetObjectId().equals(r.targetObjectId()))
        && (s.cardinality() == null || s.cardinality() == r.cardinality())
        && (s.strength() == null || s.strength() == r.strength())
        && (s.bidirectional() == null || s.bidirectional() == r.bidirectional());
  }

  private static RejectedException pairTaken(ObjectPair pair) {
    return RejectedException.conflict(
        "relationship.pair.exists",
        Map.of(
            "source_object_id", pair.sourceObjectId(),
            "target_object_id", pair.targetObjectId()));
  }

  private static RejectedException relationshipNotFound(String projectId, String id) {
    return RejectedException.notFound("relationship", Map.of("id", id, "project_id", projectId));
  }

  private static RejectedException cannotClear(String field) {
    return RejectedException.invalid("field.cannot_clear", Map.of("field", field));
  }

  private static void required(Object value, String field) {
    if (value == null) {
      throw RejectedException.invalid("field.required", Map.of("field", field));
    }
  }

  private static void mustNonBlank(String value, String field) {
    if (isBlank(value)) {
      throw RejectedException.invalid("field.required", Map.of("field", field));
    }
  }

  private static void maxLength(String value, String field, int max) {
    if (value != null && value.length() > max) {
      throw RejectedException.invalid(
          "field.too_long", Map.of("field", field, "max", Integer.toString(max)));
    }
  }

  private static void nonNegative(Integer value, String field) {
    if (value != null && value < 0) {
      throw RejectedException.invalid("field.negative", Map.of("field", field));
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
