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
import java.time.Instant;

/** Directed relationship between two objects of the same project. */
public record Relationship(
    String id,
    String projectId,
    String sourceObjectId,
    String targetObjectId,
    Cardinality cardinality,
    String forwardLabel,
    String reverseLabel,
    boolean bidirectional,
    Strength strength,
    String description,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    String updatedBy) {

  @JsonIgnore
  public ObjectPair pair() {
    return new ObjectPair(sourceObjectId, targetObjectId);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private String id;
    private String projectId;
    private String sourceObjectId;
    private String targetObjectId;
    private Cardinality cardinality = Cardinality.ONE_TO_MANY;
    private String forwardLabel;
    private String reverseLabel;
    private boolean bidirectional;
    private Strength strength = Strength.NORMAL;
    private String description;
    private Instant createdAt;
    private Instant updatedAt;
    private String createdBy;
    private String updatedBy;

    private Builder() {}

    private Builder(Relationship r) {
      this.id = r.id;
      this.projectId = r.projectId;
      this.sourceObjectId = r.sourceObjectId;
      this.targetObjectId = r.targetObjectId;
      this.cardinality = r.cardinality;
      this.forwardLabel = r.forwardLabel;
      this.reverseLabel = r.reverseLabel;
      this.bidirectional = r.bidirectional;
      this.strength = r.strength;
      this.description = r.description;
      this.createdAt = r.createdAt;
      this.updatedAt = r.updatedAt;
      this.createdBy = r.createdBy;
      this.updatedBy = r.updatedBy;
    }

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setProjectId(String projectId) {
      this.projectId = projectId;
      return this;
    }

    public Builder setPair(ObjectPair pair) {
      this.sourceObjectId = pair.sourceObjectId();
      this.targetObjectId = pair.targetObjectId();
      return this;
    }

    public Builder setCardinality(Cardinality cardinality) {
      this.cardinality = cardinality;
      return this;
    }

    public Builder setForwardLabel(String forwardLabel) {
      this.forwardLabel = forwardLabel;
      return this;
    }

    public Builder setReverseLabel(String reverseLabel) {
      this.reverseLabel = reverseLabel;
      return this;
    }

    public Builder setBidirectional(boolean bidirectional) {
      this.bidirectional = bidirectional;
      return this;
    }

    public Builder setStrength(Strength strength) {
      this.strength = strength;
      return this;
    }

    public Builder setDescription(String description) {
      this.description = description;
      return this;
    }

    public Builder setCreated(Instant at, String by) {
      this.createdAt = at;
      this.createdBy = by;
      return this;
    }

    public Builder setUpdated(Instant at, String by) {
      this.updatedAt = at;
      this.updatedBy = by;
      return this;
    }

    public Relationship build() {
      return new Relationship(
          id,
          projectId,
          sourceObjectId,
          targetObjectId,
          cardinality,
          forwardLabel,
          reverseLabel,
          bidirectional,
          strength,
          description,
          createdAt,
          updatedAt,
          createdBy,
          updatedBy);
    }
  }
}
