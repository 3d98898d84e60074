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
package ai.floedb.nomatrix.storage.kv;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Key path helpers shared by every store backend. */
public final class Keys {
  public static final String SEP = "/";

  private Keys() {}

  public static String join(String... segments) {
    StringBuilder sb = new StringBuilder();
    for (String s : segments) {
      if (s == null || s.isEmpty()) {
        continue;
      }
      String trimmed = s;
      while (trimmed.startsWith(SEP)) {
        trimmed = trimmed.substring(1);
      }
      while (trimmed.endsWith(SEP)) {
        trimmed = trimmed.substring(0, trimmed.length() - 1);
      }
      if (trimmed.isEmpty()) {
        continue;
      }
      sb.append(SEP).append(trimmed);
    }
    return sb.length() == 0 ? SEP : sb.toString();
  }

  public static String encode(String s) {
    return URLEncoder.encode(Objects.requireNonNull(s, "encode value"), StandardCharsets.UTF_8);
  }

  public static String req(String name, String v) {
    if (v == null || v.isBlank()) {
      throw new IllegalArgumentException("key arg '" + name + "' is null/blank");
    }
    return v;
  }
}
