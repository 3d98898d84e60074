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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal KV surface area for collaboration records.
 *
 * <p>This interface is intentionally CAS-only for writes: all puts and deletes are conditional on
 * an expected version. A put with {@code expectedVersion == 0} is the only way to create a record,
 * which makes it the uniqueness constraint every caller relies on.
 */
public interface KvStore {

  record Key(String partitionKey, String sortKey) {

    @Override
    public String toString() {
      if (partitionKey == null || partitionKey.isEmpty() || partitionKey.equals(Keys.SEP)) {
        return Keys.join(sortKey);
      } else if (sortKey == null || sortKey.isEmpty() || sortKey.equals(Keys.SEP)) {
        return Keys.join(partitionKey);
      }
      return Keys.join(partitionKey, sortKey);
    }
  }

  /**
   * A single record in the KV store.
   *
   * <ul>
   *   <li>{@code key} is the primary key (pk/sk)
   *   <li>{@code kind} is a small discriminator (useful for debugging)
   *   <li>{@code value} is raw bytes (JSON for canonical records; usually empty for index items)
   *   <li>{@code attrs} are small string attributes for indexes/metadata
   *   <li>{@code version} is the monotonically increasing optimistic-concurrency version
   * </ul>
   */
  record Record(Key key, String kind, byte[] value, Map<String, String> attrs, long version) {
    public Record {
      attrs = (attrs == null) ? Map.of() : Map.copyOf(attrs);
      value = (value == null) ? new byte[0] : value;
      if (version < 0) throw new IllegalArgumentException("version must be >= 0");
    }

    public Record withVersion(long next) {
      return new Record(key, kind, value, attrs, next);
    }
  }

  record Page(List<Record> items, Optional<String> nextToken) {}

  Optional<Record> get(Key key);

  /**
   * Conditional put.
   *
   * <ul>
   *   <li>{@code expectedVersion == 0} means "create if absent" (no existing item).
   *   <li>{@code expectedVersion > 0} means "update only if current ver matches".
   * </ul>
   *
   * <p>On success the stored record carries version {@code expectedVersion + 1}, whatever version
   * the caller put on {@code record}.
   *
   * @return true if write succeeded; false if the condition failed
   */
  boolean putCas(Record record, long expectedVersion);

  /**
   * Conditional delete.
   *
   * @return true if deleted; false if the condition failed
   */
  boolean deleteCas(Key key, long expectedVersion);

  /**
   * Query within a partition key, ordered by sk, with a prefix constraint. The page token is the
   * last sort key of the previous page.
   */
  Page queryByPartitionKeyPrefix(
      String partitionKey, String sortKeyPrefix, int limit, Optional<String> pageToken);

  /**
   * Remove all records in store. <br>
   * NB: for testing purposes only.
   */
  void reset();

  boolean isEmpty();

  /**
   * Transactionally perform CAS puts/deletes.
   *
   * @return true if committed; false if any condition failed, in which case nothing was written
   */
  boolean txnWriteCas(List<TxnOp> ops);

  sealed interface TxnOp permits TxnPut, TxnDelete {}

  /**
   * CAS put in a transaction.
   *
   * <p>expectedVersion==0 => create-if-absent; expectedVersion>0 => update-if-version-matches.
   */
  record TxnPut(Record record, long expectedVersion) implements TxnOp {
    public TxnPut {
      if (expectedVersion < 0) throw new IllegalArgumentException("expectedVersion must be >= 0");
    }
  }

  /** CAS delete in a transaction (expectedVersion must be > 0). */
  record TxnDelete(Key key, long expectedVersion) implements TxnOp {
    public TxnDelete {
      if (expectedVersion <= 0) {
        throw new IllegalArgumentException("expectedVersion must be > 0 for delete");
      }
    }
  }
}
