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

/**
 * Exclusive, time-bounded claim on one matrix cell.
 *
 * <p>A lock whose {@code expiresAt} is at or before "now" is semantically absent even while the
 * record is still stored. Every read site applies that filter; sweeping only reclaims space.
 */
public record CellLock(
    String id,
    String projectId,
    ObjectPair pair,
    String holder,
    String sessionId,
    LockKind kind,
    Instant lockedAt,
    Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public double minutesRemaining(Instant now) {
    if (isExpired(now)) {
      return 0.0;
    }
    return Duration.between(now, expiresAt).toMillis() / 60_000.0;
  }
}
