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
package ai.floedb.nomatrix.service.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Optional;
import java.util.ResourceBundle;
import org.junit.jupiter.api.Test;

class MessageCatalogTest {

  @Test
  void everyErrorKindRequiresAPropertyEntry() {
    final ResourceBundle bundle;
    try {
      bundle = ResourceBundle.getBundle("errors", Locale.ROOT);
    } catch (MissingResourceException e) {
      fail("errors.properties missing or unreadable", e);
      return;
    }
    for (ErrorKind kind : ErrorKind.values()) {
      assertTrue(
          bundle.containsKey(kind.name()), () -> kind.name() + " missing in errors.properties");
    }
  }

  @Test
  void rendersKeyedTemplateWithParams() {
    var msg =
        MessageCatalog.render(
            ErrorKind.CONFLICT,
            "lock.held",
            Map.of(
                "source_object_id", "a",
                "target_object_id", "b",
                "locked_by", "alice",
                "expires_at", "2026-03-02T10:05:00Z"));

    assertEquals("Cell a -> b is already locked by alice until 2026-03-02T10:05:00Z.", msg);
  }

  @Test
  void unknownKeyFallsBackToKindTemplate() {
    var msg = MessageCatalog.render(ErrorKind.VALIDATION, "no.such.key", Map.of("field", "x"));

    assertEquals("Invalid value for x.", msg);
  }

  @Test
  void failureOutcomeCarriesRenderedMessage() {
    Outcome<String> out =
        Outcome.notFound("relationship", Map.of("id", "r1", "project_id", "p1"));

    assertFalse(out.isOk());
    assertEquals(Optional.of(ErrorKind.NOT_FOUND), out.errorKind());
    assertEquals(
        "Relationship r1 was not found in project p1.", ((Outcome.Failure<String>) out).message());
    assertThrows(IllegalStateException.class, out::value);
    assertEquals("seven!!", Outcome.ok("seven!!").value());
  }

  @Test
  void rejectedExceptionConvertsToFailure() {
    var r =
        RejectedException.conflict(
            "relationship.pair.exists", Map.of("source_object_id", "a", "target_object_id", "b"));

    Outcome<Integer> out = r.toOutcome();

    assertEquals(ErrorKind.CONFLICT, r.kind());
    assertEquals("relationship.pair.exists", r.messageKey());
    assertEquals(r.getMessage(), ((Outcome.Failure<Integer>) out).message());
  }
}
