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
package ai.floedb.nomatrix.service.presence;

import ai.floedb.nomatrix.service.repo.model.Activity;

/** What a heartbeat reports. Every field is optional; activity defaults to viewing. */
public record PresenceUpdate(
    String currentObjectId, Activity activity, Integer matrixRow, Integer matrixCol) {

  public static PresenceUpdate viewing() {
    return new PresenceUpdate(null, Activity.VIEWING, null, null);
  }

  public static PresenceUpdate at(Activity activity, int row, int col) {
    return new PresenceUpdate(null, activity, row, col);
  }
}
