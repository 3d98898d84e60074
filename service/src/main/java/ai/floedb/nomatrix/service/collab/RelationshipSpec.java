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

import ai.floedb.nomatrix.service.repo.model.Cardinality;
import ai.floedb.nomatrix.service.repo.model.ObjectPair;
import ai.floedb.nomatrix.service.repo.model.Strength;

/**
 * Fields supplied when creating a relationship. Null cardinality means 1:N, null strength means
 * normal.
 */
public record RelationshipSpec(
    String sourceObjectId,
    String targetObjectId,
    Cardinality cardinality,
    String forwardLabel,
    String reverseLabel,
    boolean bidirectional,
    Strength strength,
    String description) {

  public static RelationshipSpec of(ObjectPair pair) {
    return new RelationshipSpec(
        pair.sourceObjectId(), pair.targetObjectId(), null, null, null, false, null, null);
  }

  public static RelationshipSpec of(ObjectPair pair, Cardinality cardinality, Strength strength) {
    return new RelationshipSpec(
        pair.sourceObjectId(),
        pair.targetObjectId(),
        cardinality,
        null,
        null,
        false,
        strength,
        null);
  }
}
