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

import java.time.Duration;
import java.time.Instant;

/** Where a user is in a project's matrix, and when they were last heard from. */
public record Presence(
    String id,
    String projectId,
    String userId,
    String sessionId,
    Instant lastSeen,
    String currentObjectId,
    Activity activity,
    Integer matrixRow,
    Integer matrixCol) {

  public boolean isActive(Instant now, Duration activeWindow) {
    return lastSeen.isAfter(now.minus(activeWindow));
  }
}
