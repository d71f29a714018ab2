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

import java.util.List;
import javax.annotation.Nullable;
import lombok.Getter;

/**
 * The answer to a batch filter query: the subset of requested resources the policy allows. Order
 * and duplicates are whatever the policy produces; `result` is absent if the rule is undefined.
 */
@Getter
class PermissionFilterResponse {
  @Nullable private List<String> result;
}
