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
package ai.floedb.nomatrix.service.repo.model;

import static ai.floedb.nomatrix.storage.kv.Keys.encode;
import static ai.floedb.nomatrix.storage.kv.Keys.req;

import ai.floedb.nomatrix.storage.kv.KvStore.Key;

/**
 * Record layout.
 *
 * <pre>
 * /projects/{project}  objects/by-id/{object}
 *                      relationships/by-id/{relationship}
 *                      relationships/by-pair/{source}/{target}   attrs: id
 * /locks               by-pair/{project}/{source}/{target}
 *                      by-id/{lock}                              attrs: project, source, target
 * /presence            by-user/{project}/{user}
 *                      by-id/{presence}                          attrs: project, user
 * </pre>
 *
 * Segments are URL encoded, so a prefix ending in "/" never matches a longer id.
 */
public final class Keys {
  public static final String LOCKS_PARTITION = "/locks";
  public static final String PRESENCE_PARTITION = "/presence";

  private Keys() {}

  private static String pairPath(ObjectPair pair) {
    return encode(req("source_object_id", pair.sourceObjectId()))
        + "/"
        + encode(req("target_object_id", pair.targetObjectId()));
  }

  public static String projectPartition(String projectId) {
    return "/projects/" + encode(req("project_id", projectId));
  }

  // ===== Object =====

  public static Key objectById(String projectId, String objectId) {
    return new Key(
        projectPartition(projectId), "objects/by-id/" + encode(req("object_id", objectId)));
  }

  public static String objectByIdPrefix() {
    return "objects/by-id/";
  }

  // ===== Relationship =====

  public static Key relationshipById(String projectId, String relationshipId) {
    return new Key(
        projectPartition(projectId),
        "relationships/by-id/" + encode(req("relationship_id", relationshipId)));
  }

  public static String relationshipByIdPrefix() {
    return "relationships/by-id/";
  }

  public static Key relationshipByPair(String projectId, ObjectPair pair) {
    return new Key(projectPartition(projectId), "relationships/by-pair/" + pairPath(pair));
  }

  // ===== Lock =====

  public static Key lockByPair(String projectId, ObjectPair pair) {
    return new Key(
        LOCKS_PARTITION,
        "by-pair/" + encode(req("project_id", projectId)) + "/" + pairPath(pair));
  }

  public static String lockByPairPrefix() {
    return "by-pair/";
  }

  public static String lockByPairPrefix(String projectId) {
    return "by-pair/" + encode(req("project_id", projectId)) + "/";
  }

  public static Key lockById(String lockId) {
    return new Key(LOCKS_PARTITION, "by-id/" + encode(req("lock_id", lockId)));
  }

  // ===== Presence =====

  public static Key presence(String projectId, String userId) {
    return new Key(
        PRESENCE_PARTITION,
        "by-user/"
            + encode(req("project_id", projectId))
            + "/"
            + encode(req("user_id", userId)));
  }

  public static String presencePrefix() {
    return "by-user/";
  }

  public static String presencePrefix(String projectId) {
    return "by-user/" + encode(req("project_id", projectId)) + "/";
  }

  public static Key presenceById(String presenceId) {
    return new Key(PRESENCE_PARTITION, "by-id/" + encode(req("presence_id", presenceId)));
  }
}
