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

import ai.floedb.nomatrix.service.repo.model.Relationship;

/**
 * One (source, target) entry of the matrix. {@code relationship}, {@code lockedBy} and
 * {@code lockId} are null when absent.
 */
public record MatrixCell(
    String sourceObjectId,
    String targetObjectId,
    Relationship relationship,
    boolean selfReference,
    boolean canEdit,
    boolean locked,
    String lockedBy,
    String lockId) {

  public boolean hasRelationship() {
    return relationship != null;
  }
}
