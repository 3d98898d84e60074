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
package ai.floedb.nomatrix.service.repo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/** Ordered (source, target) tuple. The key shared by relationships and cell locks. */
public record ObjectPair(String sourceObjectId, String targetObjectId) {
  public ObjectPair {
    Objects.requireNonNull(sourceObjectId, "sourceObjectId");
    Objects.requireNonNull(targetObjectId, "targetObjectId");
  }

  @JsonIgnore
  public boolean isSelfReference() {
    return sourceObjectId.equals(targetObjectId);
  }

  public ObjectPair reversed() {
    return new ObjectPair(targetObjectId, sourceObjectId);
  }

  @Override
  public String toString() {
    return sourceObjectId + "->" + targetObjectId;
  }
}
