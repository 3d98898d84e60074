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
import ai.floedb.nomatrix.service.repo.model.Strength;
import java.util.List;

/**
 * Relationship filter plus an explicit page window. Null filters match everything; null sort,
 * offset and limit take their defaults.
 */
public record RelationshipSearch(
    String sourceObjectId,
    String targetObjectId,
    Cardinality cardinality,
    Strength strength,
    Boolean bidirectional,
    String sortBy,
    String sortOrder,
    Integer offset,
    Integer limit) {

  public static final String SORT_CREATED_AT = "created_at";
  public static final String SORT_UPDATED_AT = "updated_at";
  public static final String SORT_CARDINALITY = "cardinality";
  public static final String SORT_STRENGTH = "strength";

  public static final List<String> SORT_FIELDS =
      List.of(SORT_CREATED_AT, SORT_UPDATED_AT, SORT_CARDINALITY, SORT_STRENGTH);

  public static RelationshipSearch all() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private String sourceObjectId;
    private String targetObjectId;
    private Cardinality cardinality;
    private Strength strength;
    private Boolean bidirectional;
    private String sortBy;
    private String sortOrder;
    private Integer offset;
    private Integer limit;

    private Builder() {}

    public Builder setSourceObjectId(String sourceObjectId) {
      this.sourceObjectId = sourceObjectId;
      return this;
    }

    public Builder setTargetObjectId(String targetObjectId) {
      this.targetObjectId = targetObjectId;
      return this;
    }

    public Builder setCardinality(Cardinality cardinality) {
      this.cardinality = cardinality;
      return this;
    }

    public Builder setStrength(Strength strength) {
      this.strength = strength;
      return this;
    }

    public Builder setBidirectional(Boolean bidirectional) {
      this.bidirectional = bidirectional;
      return this;
    }

    public Builder setSort(String sortBy, String sortOrder) {
      this.sortBy = sortBy;
      this.sortOrder = sortOrder;
      return this;
    }

    public Builder setPage(int offset, int limit) {
      this.offset = offset;
      this.limit = limit;
      return this;
    }

    public RelationshipSearch build() {
      return new RelationshipSearch(
          sourceObjectId,
          targetObjectId,
          cardinality,
          strength,
          bidirectional,
          sortBy,
          sortOrder,
          offset,
          limit);
    }
  }
}
