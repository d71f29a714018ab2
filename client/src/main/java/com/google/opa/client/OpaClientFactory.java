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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.opa.client.interfaces.OpaClient;
import java.time.Duration;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a helper class to create the appropriate {@link OpaClient} for the configured client
 * kind.
 */
public class OpaClientFactory {

  private static final Logger logger = LoggerFactory.getLogger(OpaClientFactory.class);

  static final String CLIENT_KIND_ENV = "OPA_CLIENT_KIND";
  static final String ADDRESS_ENV = "OPA_ADDRESS";
  static final String PERMISSION_QUERY_PATH_ENV = "OPA_PERMISSION_QUERY_PATH";
  static final String PERMISSION_FILTER_PATH_ENV = "OPA_PERMISSION_FILTER_PATH";
  static final String REQUEST_TIMEOUT_SECONDS_ENV = "OPA_REQUEST_TIMEOUT_SECONDS";
  static final String VERBOSE_LOGGING_ENV = "OPA_VERBOSE_LOGGING";
  static final String OVERRIDE_HEADER_VALUE_ENV = "OPA_OVERRIDE_HEADER_VALUE";

  private OpaClientFactory() {}

  public static OpaClient create(OpaClientConfig config) {
    switch (config.getClientKind()) {
      case HTTP:
        return new HttpOpaClient(config);
      case NOP:
        logger.warn("Authorization is disabled; all permission queries will be allowed");
        return new PermissiveOpaClient();
      case MOCK:
        return new MockOpaClient();
      default:
        throw new IllegalArgumentException("Unsupported client kind " + config.getClientKind());
    }
  }

  public static OpaClient createFromEnvVars() {
    return create(configFromEnv(System::getenv));
  }

  @VisibleForTesting
  static OpaClientConfig configFromEnv(Function<String, String> env) {
    OpaClientConfig.Builder builder = OpaClientConfig.builder();
    String clientKindValue = env.apply(CLIENT_KIND_ENV);
    ClientKind clientKind =
        Strings.isNullOrEmpty(clientKindValue)
            ? ClientKind.NOP
            : ClientKind.fromString(clientKindValue);
    builder.setClientKind(clientKind);

    String address = env.apply(ADDRESS_ENV);
    if (Strings.isNullOrEmpty(address)) {
      if (clientKind == ClientKind.HTTP) {
        throw new IllegalArgumentException(
            String.format("The environment variable %s is not set!", ADDRESS_ENV));
      }
    } else {
      builder.setAddress(address);
    }
    String queryPath = env.apply(PERMISSION_QUERY_PATH_ENV);
    if (!Strings.isNullOrEmpty(queryPath)) {
      builder.setPermissionQueryPath(queryPath);
    }
    String filterPath = env.apply(PERMISSION_FILTER_PATH_ENV);
    if (!Strings.isNullOrEmpty(filterPath)) {
      builder.setPermissionFilterPath(filterPath);
    }
    String timeoutSeconds = env.apply(REQUEST_TIMEOUT_SECONDS_ENV);
    if (!Strings.isNullOrEmpty(timeoutSeconds)) {
      try {
        builder.setRequestTimeout(Duration.ofSeconds(Long.parseLong(timeoutSeconds.trim())));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format(
                "The environment variable %s is not a number of seconds: %s",
                REQUEST_TIMEOUT_SECONDS_ENV, timeoutSeconds),
            e);
      }
    }
    builder.setVerbose(Boolean.parseBoolean(env.apply(VERBOSE_LOGGING_ENV)));
    builder.setOverrideHeaderValue(Strings.emptyToNull(env.apply(OVERRIDE_HEADER_VALUE_ENV)));

    return builder.build();
  }
}
