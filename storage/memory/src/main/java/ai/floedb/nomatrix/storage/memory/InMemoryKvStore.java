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

package ai.floedb.nomatrix.storage.memory;

import ai.floedb.nomatrix.storage.kv.KvStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Single-process {@link KvStore}. Reads are lock-free; every write, single or transactional, is
 * serialized on the store monitor so a transaction never interleaves with a CAS on the same key.
 */
@Singleton
@IfBuildProperty(name = "nomatrix.kv", stringValue = "memory")
public class InMemoryKvStore implements KvStore {
  private final Map<String, ConcurrentSkipListMap<String, Record>> partitions =
      new ConcurrentHashMap<>();

  @Override
  public Optional<Record> get(Key key) {
    var part = partitions.get(key.partitionKey());
    if (part == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(part.get(key.sortKey()));
  }

  @Override
  public synchronized boolean putCas(Record record, long expectedVersion) {
    if (!matches(record.key(), expectedVersion)) {
      return false;
    }
    partition(record.key().partitionKey())
        .put(record.key().sortKey(), record.withVersion(expectedVersion + 1L));
    return true;
  }

  @Override
  public synchronized boolean deleteCas(Key key, long expectedVersion) {
    if (expectedVersion <= 0L || !matches(key, expectedVersion)) {
      return false;
    }
    remove(key);
    return true;
  }

  @Override
  public Page queryByPartitionKeyPrefix(
      String partitionKey, String sortKeyPrefix, int limit, Optional<String> pageToken) {
    final String pfx = sortKeyPrefix == null ? "" : sortKeyPrefix;
    final int lim = Math.max(1, limit);

    var part = partitions.get(partitionKey);
    if (part == null) {
      return new Page(List.of(), Optional.empty());
    }

    String token = pageToken.filter(t -> !t.isBlank()).orElse(null);
    NavigableMap<String, Record> view =
        (token != null && token.compareTo(pfx) >= 0)
            ? part.tailMap(token, false)
            : part.tailMap(pfx, true);

    List<Record> items = new ArrayList<>(Math.min(lim, 64));
    String last = null;
    boolean more = false;
    for (var e : view.entrySet()) {
      if (!e.getKey().startsWith(pfx)) {
        break;
      }
      if (items.size() == lim) {
        more = true;
        break;
      }
      items.add(e.getValue());
      last = e.getKey();
    }

    return new Page(items, more ? Optional.of(last) : Optional.empty());
  }

  @Override
  public synchronized void reset() {
    partitions.clear();
  }

  @Override
  public boolean isEmpty() {
    return partitions.values().stream().allMatch(Map::isEmpty);
  }

  @Override
  public synchronized boolean txnWriteCas(List<TxnOp> ops) {
    if (ops == null || ops.isEmpty()) {
      return true;
    }

    for (TxnOp op : ops) {
      if (op instanceof TxnPut put) {
        if (!matches(put.record().key(), put.expectedVersion())) {
          return false;
        }
      } else if (op instanceof TxnDelete delete) {
        if (!matches(delete.key(), delete.expectedVersion())) {
          return false;
        }
      }
    }

    for (TxnOp op : ops) {
      if (op instanceof TxnPut put) {
        partition(put.record().key().partitionKey())
            .put(
                put.record().key().sortKey(),
                put.record().withVersion(put.expectedVersion() + 1L));
      } else if (op instanceof TxnDelete delete) {
        remove(delete.key());
      }
    }
    return true;
  }

  private boolean matches(Key key, long expectedVersion) {
    var cur = get(key).orElse(null);
    if (cur == null) {
      return expectedVersion == 0L;
    }
    return cur.version() == expectedVersion;
  }

  private ConcurrentSkipListMap<String, Record> partition(String partitionKey) {
    return partitions.computeIfAbsent(partitionKey, k -> new ConcurrentSkipListMap<>());
  }

  private void remove(Key key) {
    var part = partitions.get(key.partitionKey());
    if (part != null) {
      part.remove(key.sortKey());
    }
  }
}
