/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.opa.client.interfaces;

import java.io.IOException;
import java.util.List;

/**
 * A client that answers permission questions against a policy decision point. Implementations are
 * expected to be thread-safe; a single instance is shared by all callers of a service.
 *
 * <p>When a method throws, no permission should be inferred; whether a failed check means "deny"
 * is the caller's decision.
 */
public interface OpaClient {

  /**
   * Asks whether the members in {@code options} may perform {@code action} on {@code resource}.
   *
   * @param resource the resource identifier as understood by the policy.
   * @param action the requested operation.
   * @param options the members and the optional override value; never modified.
   * @return true iff the action is allowed.
   * @throws IOException if the decision could not be obtained.
   */
  boolean queryPermissions(String resource, Action action, PermissionOptions options)
      throws IOException;

  /**
   * Asks the same question as {@link #queryPermissions} for several resources in one round trip.
   *
   * @param resources the resources to check; may be empty or contain duplicates.
   * @param action the requested operation.
   * @param options the members and the optional override value; never modified.
   * @return a list of the same size as {@code resources} where the element at index {@code i}
   *     answers for {@code resources.get(i)}.
   * @throws IOException if the decision could not be obtained; no partial result is returned.
   */
  List<Boolean> queryPermissionsMultiResources(
      List<String> resources, Action action, PermissionOptions options) throws IOException;
}
