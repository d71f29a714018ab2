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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;

import com.google.common.collect.ImmutableMap;
import com.google.opa.client.interfaces.OpaClient;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import org.junit.Test;

public class OpaClientFactoryTest {

  private static OpaClientConfig configFrom(Map<String, String> env) {
    return OpaClientFactory.configFromEnv(env::get);
  }

  @Test
  public void configFromEnv_allVariablesSet() {
    OpaClientConfig config =
        configFrom(
            ImmutableMap.<String, String>builder()
                .put(OpaClientFactory.CLIENT_KIND_ENV, "HTTP")
                .put(OpaClientFactory.ADDRESS_ENV, "http://opa:8181")
                .put(OpaClientFactory.PERMISSION_QUERY_PATH_ENV, "/v1/data/iam/allow")
                .put(OpaClientFactory.PERMISSION_FILTER_PATH_ENV, "/v1/data/iam/filter")
                .put(OpaClientFactory.REQUEST_TIMEOUT_SECONDS_ENV, "3")
                .put(OpaClientFactory.VERBOSE_LOGGING_ENV, "true")
                .put(OpaClientFactory.OVERRIDE_HEADER_VALUE_ENV, "secret")
                .build());

    assertThat(config.getClientKind(), equalTo(ClientKind.HTTP));
    assertThat(config.getAddress(), equalTo("http://opa:8181"));
    assertThat(config.getPermissionQueryPath(), equalTo("/v1/data/iam/allow"));
    assertThat(config.getPermissionFilterPath(), equalTo("/v1/data/iam/filter"));
    assertThat(config.getRequestTimeout(), equalTo(Duration.ofSeconds(3)));
    assertThat(config.isVerbose(), equalTo(true));
    assertThat(config.getOverrideHeaderValue(), equalTo("secret"));
  }

  @Test
  public void configFromEnv_defaults() {
    OpaClientConfig config =
        configFrom(
            ImmutableMap.of(
                OpaClientFactory.CLIENT_KIND_ENV, "http",
                OpaClientFactory.ADDRESS_ENV, "http://opa:8181"));

    assertThat(
        config.getPermissionQueryPath(), equalTo(OpaConstants.DEFAULT_PERMISSION_QUERY_PATH));
    assertThat(
        config.getPermissionFilterPath(), equalTo(OpaConstants.DEFAULT_PERMISSION_FILTER_PATH));
    assertThat(config.getRequestTimeout(), equalTo(OpaConstants.DEFAULT_REQUEST_TIMEOUT));
    assertThat(config.isVerbose(), equalTo(false));
    assertThat(config.getOverrideHeaderValue(), nullValue());
  }

  @Test
  public void configFromEnv_noKind_defaultsToNop() {
    OpaClientConfig config = configFrom(ImmutableMap.of());

    assertThat(config.getClientKind(), equalTo(ClientKind.NOP));
  }

  @Test(expected = IllegalArgumentException.class)
  public void configFromEnv_httpWithoutAddress_throws() {
    configFrom(ImmutableMap.of(OpaClientFactory.CLIENT_KIND_ENV, "http"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void configFromEnv_unknownKind_throws() {
    configFrom(ImmutableMap.of(OpaClientFactory.CLIENT_KIND_ENV, "grpc"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void configFromEnv_invalidTimeout_throws() {
    configFrom(
        ImmutableMap.of(
            OpaClientFactory.CLIENT_KIND_ENV, "http",
            OpaClientFactory.ADDRESS_ENV, "http://opa:8181",
            OpaClientFactory.REQUEST_TIMEOUT_SECONDS_ENV, "ten"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void configFromEnv_zeroTimeout_throws() {
    configFrom(
        ImmutableMap.of(
            OpaClientFactory.CLIENT_KIND_ENV, "http",
            OpaClientFactory.ADDRESS_ENV, "http://opa:8181",
            OpaClientFactory.REQUEST_TIMEOUT_SECONDS_ENV, "0"));
  }

  @Test
  public void create_selectsVariantByKind() throws IOException {
    OpaClient nopClient =
        OpaClientFactory.create(OpaClientConfig.builder().setClientKind(ClientKind.NOP).build());
    OpaClient mockClient =
        OpaClientFactory.create(OpaClientConfig.builder().setClientKind(ClientKind.MOCK).build());
    OpaClient httpClient =
        OpaClientFactory.create(
            OpaClientConfig.builder()
                .setClientKind(ClientKind.HTTP)
                .setAddress("http://localhost:8181")
                .build());

    assertThat(nopClient, instanceOf(PermissiveOpaClient.class));
    assertThat(mockClient, instanceOf(MockOpaClient.class));
    assertThat(httpClient, instanceOf(HttpOpaClient.class));
    ((HttpOpaClient) httpClient).close();
  }
}
