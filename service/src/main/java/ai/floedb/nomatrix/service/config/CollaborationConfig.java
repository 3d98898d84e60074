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
package ai.floedb.nomatrix.service.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;

@ConfigMapping(prefix = "nomatrix.collab")
public interface CollaborationConfig {

  /** Fixed lifetime of a cell lock. Locks are never extended in place. */
  @WithDefault("PT5M")
  Duration lockGrantDuration();

  /** A presence record counts as active while last seen within this window. */
  @WithDefault("PT5M")
  Duration presenceActiveWindow();

  /** Presence records last seen longer ago than this are reclaimed by the sweep. */
  @WithDefault("PT1H")
  Duration presenceStaleWindow();

  @WithDefault("50")
  int searchDefaultLimit();

  @WithDefault("100")
  int searchMaxLimit();

  @WithDefault("10")
  int summaryRecentChanges();
}
