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
import java.util.Locale;
import java.util.Optional;

public enum Activity {
  VIEWING,
  EDITING,
  NAVIGATING;

  @JsonValue
  public String wire() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Activity> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (Activity a : values()) {
      if (a.name().equalsIgnoreCase(value.trim())) {
        return Optional.of(a);
      }
    }
    return Optional.empty();
  }

  @JsonCreator
  public static Activity parse(String value) {
    return fromWire(value)
        .orElseThrow(() -> new IllegalArgumentException("unknown activity: " + value));
  }
}
