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
package ai.floedb.nomatrix.service.repo.util;

import ai.floedb.nomatrix.storage.errors.StorageCorruptionException;
import ai.floedb.nomatrix.storage.errors.StorageException;
import ai.floedb.nomatrix.storage.kv.KvStore;
import ai.floedb.nomatrix.storage.kv.KvStore.Key;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared plumbing for repositories that keep JSON-encoded records in the {@link KvStore}.
 *
 * <p>Subclasses own the key layout and the multi-record invariants (indexes written in the same
 * transaction as the record they point at). This class only reads, decodes and pages.
 */
public abstract class BaseRecordRepository<T> {
  public static final int CAS_MAX = 10;
  protected static final int PAGE_SIZE = 200;

  @Inject protected KvStore kv;
  @Inject protected ObjectMapper mapper;

  protected BaseRecordRepository() {}

  protected BaseRecordRepository(KvStore kv, ObjectMapper mapper) {
    this.kv = Objects.requireNonNull(kv, "kv");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  protected abstract Class<T> type();

  protected abstract String kind();

  protected KvStore.Record toRecord(Key key, T value, Map<String, String> attrs) {
    try {
      return new KvStore.Record(key, kind(), mapper.writeValueAsBytes(value), attrs, 0L);
    } catch (JsonProcessingException e) {
      throw new StorageException("encode failed: " + kind() + " " + key, e);
    }
  }

  protected T decode(KvStore.Record rec) {
    try {
      return mapper.readValue(rec.value(), type());
    } catch (IOException e) {
      throw new StorageCorruptionException("parse failed: " + rec.key(), e);
    }
  }

  protected Optional<Stored<T>> read(Key key) {
    return kv.get(key).map(r -> new Stored<>(decode(r), r.version()));
  }

  protected List<KvStore.Record> scanRecords(String partitionKey, String sortKeyPrefix) {
    List<KvStore.Record> out = new ArrayList<>();
    Optional<String> token = Optional.empty();
    do {
      var page = kv.queryByPartitionKeyPrefix(partitionKey, sortKeyPrefix, PAGE_SIZE, token);
      out.addAll(page.items());
      token = page.nextToken();
    } while (token.isPresent());
    return out;
  }

  protected List<Stored<T>> scan(String partitionKey, String sortKeyPrefix) {
    List<Stored<T>> out = new ArrayList<>();
    for (var rec : scanRecords(partitionKey, sortKeyPrefix)) {
      out.add(new Stored<>(decode(rec), rec.version()));
    }
    return out;
  }
}
