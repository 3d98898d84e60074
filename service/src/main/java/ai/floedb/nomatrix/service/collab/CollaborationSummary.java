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

import ai.floedb.nomatrix.service.repo.model.CellLock;
import ai.floedb.nomatrix.service.repo.model.Presence;
import ai.floedb.nomatrix.service.repo.model.Relationship;
import java.util.List;

/** Who is around, what is locked and what changed last in a project. */
public record CollaborationSummary(
    String projectId,
    List<Presence> activeUsers,
    List<CellLock> activeLocks,
    List<Relationship> recentChanges,
    int totalActiveUsers,
    int totalActiveLocks) {}
