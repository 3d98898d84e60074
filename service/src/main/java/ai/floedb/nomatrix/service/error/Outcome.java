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

import java.util.Map;
import java.util.Optional;

/**
 * Result of a collaboration operation: a value, or a caller-correctable failure.
 *
 * <p>Expected outcomes such as a held lock or a duplicate pair are values of this type, never
 * exceptions.
 */
public sealed interface Outcome<T> {

  record Ok<T>(T value) implements Outcome<T> {}

  record Failure<T>(ErrorKind kind, String messageKey, Map<String, String> params, String message)
      implements Outcome<T> {
    public Failure {
      params = params == null ? Map.of() : Map.copyOf(params);
    }

    @Override
    public T value() {
      throw new IllegalStateException("outcome is a failure: " + kind + " " + message);
    }
  }

  T value();

  static <T> Outcome<T> ok(T value) {
    return new Ok<>(value);
  }

  static <T> Outcome<T> failure(ErrorKind kind, String messageKey, Map<String, String> params) {
    return new Failure<>(kind, messageKey, params, MessageCatalog.render(kind, messageKey, params));
  }

  static <T> Outcome<T> validation(String messageKey, Map<String, String> params) {
    return failure(ErrorKind.VALIDATION, messageKey, params);
  }

  static <T> Outcome<T> conflict(String messageKey, Map<String, String> params) {
    return failure(ErrorKind.CONFLICT, messageKey, params);
  }

  static <T> Outcome<T> notFound(String messageKey, Map<String, String> params) {
    return failure(ErrorKind.NOT_FOUND, messageKey, params);
  }

  default boolean isOk() {
    return this instanceof Ok;
  }

  default Optional<ErrorKind> errorKind() {
    return this instanceof Failure<T> f ? Optional.of(f.kind()) : Optional.empty();
  }
}
