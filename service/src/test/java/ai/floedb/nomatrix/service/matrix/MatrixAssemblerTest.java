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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.floedb.nomatrix.service.collab.RelationshipSpec;
import ai.floedb.nomatrix.service.presence.PresenceUpdate;
import ai.floedb.nomatrix.service.repo.model.LockKind;
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.testsupport.CollabFixture;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MatrixAssemblerTest {
  private static final String P = "proj-1";

  private CollabFixture fx;

  @BeforeEach
  void setUp() {
    fx = new CollabFixture();
  }

  @Test
  void threeObjectsOneRelationship() {
    fx.seedObject(P, "a", "A");
    fx.seedObject(P, "b", "B");
    fx.seedObject(P, "c", "C");
    assertTrue(
        fx.facade
            .createRelationship(P, "alice", RelationshipSpec.of(new ObjectPair("a", "b")))
            .isOk());

    var m = fx.assembler.assemble(P, fx.now());

    assertEquals(3, m.totalObjects());
    assertEquals(1, m.totalRelationships());
    assertEquals(100.0 / 6.0, m.completionPercentage(), 1e-9);
    assertEquals(3, m.cells().size());
    m.cells().forEach(row -> assertEquals(3, row.size()));

    assertTrue(m.cell("a", "b").hasRelationship());
    assertFalse(m.cell("b", "a").hasRelationship());
    assertFalse(m.cell("a", "a").canEdit());
    assertTrue(m.cell("a", "a").selfReference());
    assertTrue(m.cell("a", "c").canEdit());

    var a = m.objects().get(m.indexOf("a"));
    assertEquals(1, a.outgoingRelationshipCount());
    assertEquals(0, a.incomingRelationshipCount());
    assertEquals(1, m.objects().get(m.indexOf("b")).incomingRelationshipCount());
  }

  @Test
  void diagonalIsNeverEditable() {
    for (int i = 0; i < 5; i++) {
      fx.seedObject(P, "o" + i, "Object " + i);
    }

    var m = fx.assembler.assemble(P, fx.now());

    for (int i = 0; i < 5; i++) {
      var cell = m.cells().get(i).get(i);
      assertTrue(cell.selfReference());
      assertFalse(cell.canEdit());
    }
  }

  @Test
  void completionIsZeroForEmptyOrSingleObjectProjects() {
    assertEquals(0.0, fx.assembler.assemble(P, fx.now()).completionPercentage());

    fx.seedObject(P, "only", "Only");
    var m = fx.assembler.assemble(P, fx.now());
    assertEquals(1, m.totalObjects());
    assertEquals(0.0, m.completionPercentage());
    assertEquals(0.0, MatrixAssembler.completionPercentage(0, 3));
  }

  @Test
  void completionIsClampedToHundred() {
    assertEquals(100.0, MatrixAssembler.completionPercentage(2, 2));
    assertEquals(100.0, MatrixAssembler.completionPercentage(2, 7));
    assertEquals(50.0, MatrixAssembler.completionPercentage(2, 1));
  }

  @Test
  void objectsOrderedByNameThenId() {
    fx.seedObject(P, "z2", "Same");
    fx.seedObject(P, "z1", "Same");
    fx.seedObject(P, "y", "Alpha");

    var m = fx.assembler.assemble(P, fx.now());

    assertThat(m.objects()).extracting(MatrixObject::id).containsExactly("y", "z1", "z2");
  }

  @Test
  void liveLockShowsInCellAndExpiredDoesNot() {
    fx.seedObject(P, "a", "A");
    fx.seedObject(P, "b", "B");
    var lock =
        fx.locks.acquire(P, new ObjectPair("a", "b"), "bob", "s1", LockKind.EDIT, fx.now()).value();

    var cell = fx.assembler.assemble(P, fx.now()).cell("a", "b");
    assertTrue(cell.locked());
    assertEquals("bob", cell.lockedBy());
    assertEquals(lock.id(), cell.lockId());
    assertFalse(fx.assembler.assemble(P, fx.now()).cell("b", "a").locked());

    var later = fx.assembler.assemble(P, fx.now().plus(Duration.ofMinutes(5))).cell("a", "b");
    assertFalse(later.locked());
    assertNull(later.lockedBy());
  }

  @Test
  void activeUsersAreIncluded() {
    fx.seedObject(P, "a", "A");
    fx.presence.heartbeat(P, "alice", "s1", PresenceUpdate.viewing(), fx.now());

    var m = fx.assembler.assemble(P, fx.now());

    assertEquals(1, m.activeUsers().size());
    assertEquals(fx.now(), m.assembledAt());
  }
}
