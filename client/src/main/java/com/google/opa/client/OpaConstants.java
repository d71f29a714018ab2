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

import java.time.Duration;
import org.apache.http.entity.ContentType;

public class OpaConstants {

  public static final String DEFAULT_PERMISSION_QUERY_PATH = "/v1/data/authz/allow";

  public static final String DEFAULT_PERMISSION_FILTER_PATH = "/v1/data/authz/filter_allowed";

  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  // OPA's liveness endpoint; answers 200 once the server is ready to evaluate policies.
  public static final String HEALTH_PATH = "/health";

  static final ContentType JSON_CONTENT = ContentType.APPLICATION_JSON;

  private OpaConstants() {}
}
