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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum Cardinality {
  ONE_TO_ONE("1:1"),
  ONE_TO_MANY("1:N"),
  MANY_TO_MANY("N:M");

  private final String wire;

  Cardinality(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  public static Optional<Cardinality> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (Cardinality c : values()) {
      if (c.wire.equalsIgnoreCase(value.trim()) || c.name().equalsIgnoreCase(value.trim())) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }

  @JsonCreator
  public static Cardinality parse(String value) {
    return fromWire(value)
        .orElseThrow(() -> new IllegalArgumentException("unknown cardinality: " + value));
  }
}
