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

import ai.floedb.nomatrix.service.repo.model.Presence;
import java.time.Instant;
import java.util.List;

/**
 * Renderable grid of a project. {@code cells.get(i).get(j)} is the cell whose source is
 * {@code objects.get(i)} and whose target is {@code objects.get(j)}.
 */
public record NomMatrix(
    String projectId,
    List<MatrixObject> objects,
    List<List<MatrixCell>> cells,
    int totalObjects,
    int totalRelationships,
    double completionPercentage,
    List<Presence> activeUsers,
    Instant assembledAt) {

  public int indexOf(String objectId) {
    for (int i = 0; i < objects.size(); i++) {
      if (objects.get(i).id().equals(objectId)) {
        return i;
      }
    }
    return -1;
  }

  public MatrixCell cell(String sourceObjectId, String targetObjectId) {
    int i = indexOf(sourceObjectId);
    int j = indexOf(targetObjectId);
    if (i < 0 || j < 0) {
      throw new IllegalArgumentException(
          "object not in matrix: " + (i < 0 ? sourceObjectId : targetObjectId));
    }
    return cells.get(i).get(j);
  }
}
