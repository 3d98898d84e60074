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

/**
 * Raised by validation helpers deep in an operation and converted to an {@link Outcome.Failure} at
 * the operation boundary. Never escapes the service.
 */
public final class RejectedException extends RuntimeException {
  private final Outcome.Failure<?> failure;

  private RejectedException(Outcome<?> failure) {
    super(((Outcome.Failure<?>) failure).message(), null, false, false);
    this.failure = (Outcome.Failure<?>) failure;
  }

  public static RejectedException invalid(String messageKey, Map<String, String> params) {
    return new RejectedException(Outcome.validation(messageKey, params));
  }

  public static RejectedException conflict(String messageKey, Map<String, String> params) {
    return new RejectedException(Outcome.conflict(messageKey, params));
  }

  public static RejectedException notFound(String messageKey, Map<String, String> params) {
    return new RejectedException(Outcome.notFound(messageKey, params));
  }

  public ErrorKind kind() {
    return failure.kind();
  }

  public String messageKey() {
    return failure.messageKey();
  }

  @SuppressWarnings("unchecked")
  public <T> Outcome<T> toOutcome() {
    return (Outcome<T>) failure;
  }
}
