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
package ai.floedb.nomatrix.service.repo.impl;

import ai.floedb.nomatrix.service.repo.ObjectDirectory;
import ai.floedb.nomatrix.service.repo.model.Keys;
import ai.floedb.nomatrix.service.repo.model.NomObject;
import ai.floedb.nomatrix.service.repo.util.BaseRecordRepository;
import ai.floedb.nomatrix.service.repo.util.Stored;
import ai.floedb.nomatrix.storage.kv.KvStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ApplicationScoped
public class ObjectRepository extends BaseRecordRepository<NomObject> implements ObjectDirectory {

  public ObjectRepository() {}

  public ObjectRepository(KvStore kv, ObjectMapper mapper) {
    super(kv, mapper);
  }

  @Override
  protected Class<NomObject> type() {
    return NomObject.class;
  }

  @Override
  protected String kind() {
    return "object";
  }

  public boolean create(NomObject object) {
    var key = Keys.objectById(object.projectId(), object.id());
    return kv.putCas(toRecord(key, object, Map.of()), 0L);
  }

  @Override
  public Optional<NomObject> get(String projectId, String objectId) {
    return read(Keys.objectById(projectId, objectId)).map(Stored::value);
  }

  @Override
  public List<NomObject> list(String projectId) {
    return scan(Keys.projectPartition(projectId), Keys.objectByIdPrefix()).stream()
        .map(Stored::value)
        .toList();
  }
}
