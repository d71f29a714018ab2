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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

import com.google.common.collect.ImmutableList;
import com.google.opa.client.MockOpaClient.RecordedQuery;
import com.google.opa.client.interfaces.Action;
import com.google.opa.client.interfaces.PermissionOptions;
import java.io.IOException;
import org.junit.Before;
import org.junit.Test;

public class MockOpaClientTest {

  private MockOpaClient mockClient;

  @Before
  public void setUp() {
    mockClient = new MockOpaClient();
  }

  @Test
  public void queryPermissions_usesStubsThenDefault() throws IOException {
    mockClient.allow("project-a", Action.READ).deny("project-b", Action.READ);

    assertThat(
        mockClient.queryPermissions("project-a", Action.READ, PermissionOptions.empty()),
        equalTo(true));
    assertThat(
        mockClient.queryPermissions("project-a", Action.DELETE, PermissionOptions.empty()),
        equalTo(false));
    assertThat(
        mockClient.queryPermissions("project-b", Action.READ, PermissionOptions.empty()),
        equalTo(false));

    mockClient.setDefaultAnswer(true);
    assertThat(
        mockClient.queryPermissions("project-c", Action.READ, PermissionOptions.empty()),
        equalTo(true));
  }

  @Test
  public void queryPermissionsMultiResources_answersPerResource() throws IOException {
    mockClient.allow("project-a", Action.UPDATE);

    assertThat(
        mockClient.queryPermissionsMultiResources(
            ImmutableList.of("project-a", "project-b", "project-a"),
            Action.UPDATE,
            PermissionOptions.empty()),
        contains(true, false, true));
  }

  @Test
  public void queries_areRecorded() throws IOException {
    PermissionOptions options = PermissionOptions.forMembers("user1");

    mockClient.queryPermissions("project-a", Action.READ, options);
    mockClient.queryPermissionsMultiResources(
        ImmutableList.of("project-a", "project-b"), Action.LIST, options);

    ImmutableList<RecordedQuery> recorded = mockClient.getRecordedQueries();
    assertThat(recorded, hasSize(2));
    assertThat(recorded.get(0).getResources(), contains("project-a"));
    assertThat(recorded.get(0).isMultiResource(), equalTo(false));
    assertThat(recorded.get(1).getResources(), contains("project-a", "project-b"));
    assertThat(recorded.get(1).getAction(), equalTo(Action.LIST));
    assertThat(recorded.get(1).getOptions().getMemberIds(), contains("user1"));
  }

  @Test(expected = PermissionQueryException.class)
  public void failWith_throwsConfiguredFailure() throws IOException {
    mockClient.failWith(new PermissionQueryException("policy service down"));

    mockClient.queryPermissions("project-a", Action.READ, PermissionOptions.empty());
  }

  @Test
  public void reset_clearsStubsRecordsAndFailure() throws IOException {
    mockClient.allow("project-a", Action.READ).failWith(new IOException("down"));

    mockClient.reset();

    assertThat(mockClient.getRecordedQueries(), empty());
    assertThat(
        mockClient.queryPermissions("project-a", Action.READ, PermissionOptions.empty()),
        equalTo(false));
  }
}
