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
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Partial update of a relationship. Only the fields named in {@code updateMask} are applied; a
 * masked label or description with a null value clears it.
 */
public record RelationshipUpdate(
    Cardinality cardinality,
    String forwardLabel,
    String reverseLabel,
    Boolean bidirectional,
    Strength strength,
    String description,
    Set<String> updateMask) {

  public static final String CARDINALITY = "cardinality";
  public static final String FORWARD_LABEL = "forward_label";
  public static final String REVERSE_LABEL = "reverse_label";
  public static final String IS_BIDIRECTIONAL = "is_bidirectional";
  public static final String STRENGTH = "strength";
  public static final String DESCRIPTION = "description";

  public static final Set<String> MUTABLE_PATHS =
      Set.of(CARDINALITY, FORWARD_LABEL, REVERSE_LABEL, IS_BIDIRECTIONAL, STRENGTH, DESCRIPTION);

  public RelationshipUpdate {
    updateMask = updateMask == null ? Set.of() : Set.copyOf(updateMask);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Each setter also adds its field to the mask. */
  public static final class Builder {
    private Cardinality cardinality;
    private String forwardLabel;
    private String reverseLabel;
    private Boolean bidirectional;
    private Strength strength;
    private String description;
    private final Set<String> mask = new LinkedHashSet<>();

    private Builder() {}

    public Builder setCardinality(Cardinality cardinality) {
      this.cardinality = cardinality;
      mask.add(CARDINALITY);
      return this;
    }

    public Builder setForwardLabel(String forwardLabel) {
      this.forwardLabel = forwardLabel;
      mask.add(FORWARD_LABEL);
      return this;
    }

    public Builder setReverseLabel(String reverseLabel) {
      this.reverseLabel = reverseLabel;
      mask.add(REVERSE_LABEL);
      return this;
    }

    public Builder setBidirectional(boolean bidirectional) {
      this.bidirectional = bidirectional;
      mask.add(IS_BIDIRECTIONAL);
      return this;
    }

    public Builder setStrength(Strength strength) {
      this.strength = strength;
      mask.add(STRENGTH);
      return this;
    }

    public Builder setDescription(String description) {
      this.description = description;
      mask.add(DESCRIPTION);
      return this;
    }

    public Builder clearDescription() {
      return setDescription(null);
    }

    public RelationshipUpdate build() {
      return new RelationshipUpdate(
          cardinality, forwardLabel, reverseLabel, bidirectional, strength, description, mask);
    }
  }
}
