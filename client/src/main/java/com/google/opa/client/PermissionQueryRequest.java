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
import java.util.List;

/** The body of a single-resource query; OPA expects the document under an `input` key. */
class PermissionQueryRequest {

  private final Input input;

  PermissionQueryRequest(String resource, Action action, List<String> memberIds) {
    this.input = new Input(resource, action, memberIds);
  }

  static class Input {
    private final String resource;
    private final Action action;
    private final List<String> memberIds;

    Input(String resource, Action action, List<String> memberIds) {
      this.resource = resource;
      this.action = action;
      this.memberIds = ImmutableList.copyOf(memberIds);
    }
  }
}
