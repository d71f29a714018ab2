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
package com.google.opa.client;

import com.google.common.collect.ImmutableList;
import com.google.opa.client.interfaces.Action;
import com.google.opa.client.interfaces.OpaClient;
import com.google.opa.client.interfaces.PermissionOptions;
import java.util.Collections;
import java.util.List;

/** This is the no-op client used when authorization is disabled; it allows every request. */
public class PermissiveOpaClient implements OpaClient {

  @Override
  public boolean queryPermissions(String resource, Action action, PermissionOptions options) {
    return true;
  }

  @Override
  public List<Boolean> queryPermissionsMultiResources(
      List<String> resources, Action action, PermissionOptions options) {
    return ImmutableList.copyOf(Collections.nCopies(resources.size(), true));
  }
}
