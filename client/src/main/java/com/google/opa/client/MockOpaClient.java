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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.common.collect.Tables;
import com.google.opa.client.interfaces.Action;
import com.google.opa.client.interfaces.OpaClient;
import com.google.opa.client.interfaces.PermissionOptions;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.annotation.Nullable;

/**
 * A stand-in {@link OpaClient} for tests of calling code. Answers come from per resource and action
 * stubs, falling back to a default answer; every call is recorded. Thread-safe.
 */
public class MockOpaClient implements OpaClient {

  private final Table<String, Action, Boolean> answers =
      Tables.synchronizedTable(HashBasedTable.create());
  private final List<RecordedQuery> recordedQueries = new CopyOnWriteArrayList<>();
  private volatile boolean defaultAnswer;
  @Nullable private volatile IOException failure;

  public MockOpaClient() {
    this(false);
  }

  public MockOpaClient(boolean defaultAnswer) {
    this.defaultAnswer = defaultAnswer;
  }

  public MockOpaClient allow(String resource, Action action) {
    answers.put(resource, action, true);
    return this;
  }

  public MockOpaClient deny(String resource, Action action) {
    answers.put(resource, action, false);
    return this;
  }

  public MockOpaClient setDefaultAnswer(boolean defaultAnswer) {
    this.defaultAnswer = defaultAnswer;
    return this;
  }

  /** Makes every following query throw {@code failure}; pass null to answer normally again. */
  public MockOpaClient failWith(@Nullable IOException failure) {
    this.failure = failure;
    return this;
  }

  public ImmutableList<RecordedQuery> getRecordedQueries() {
    return ImmutableList.copyOf(recordedQueries);
  }

  /** Forgets all stubs, recorded calls and the failure; the default answer is kept. */
  public void reset() {
    answers.clear();
    recordedQueries.clear();
    failure = null;
  }

  @Override
  public boolean queryPermissions(String resource, Action action, PermissionOptions options)
      throws IOException {
    recordedQueries.add(new RecordedQuery(ImmutableList.of(resource), action, options, false));
    throwIfFailing();
    return answer(resource, action);
  }

  @Override
  public List<Boolean> queryPermissionsMultiResources(
      List<String> resources, Action action, PermissionOptions options) throws IOException {
    recordedQueries.add(new RecordedQuery(ImmutableList.copyOf(resources), action, options, true));
    throwIfFailing();
    ImmutableList.Builder<Boolean> permissions = ImmutableList.builder();
    for (String resource : resources) {
      permissions.add(answer(resource, action));
    }
    return permissions.build();
  }

  private void throwIfFailing() throws IOException {
    IOException current = failure;
    if (current != null) {
      throw current;
    }
  }

  private boolean answer(String resource, Action action) {
    Boolean stubbed = answers.get(resource, action);
    return stubbed == null ? defaultAnswer : stubbed;
  }

  /** One call made against a {@link MockOpaClient}. */
  public static final class RecordedQuery {
    private final ImmutableList<String> resources;
    private final Action action;
    private final PermissionOptions options;
    private final boolean multiResource;

    RecordedQuery(
        ImmutableList<String> resources,
        Action action,
        PermissionOptions options,
        boolean multiResource) {
      this.resources = resources;
      this.action = action;
      this.options = options;
      this.multiResource = multiResource;
    }

    public ImmutableList<String> getResources() {
      return resources;
    }

    public Action getAction() {
      return action;
    }

    public PermissionOptions getOptions() {
      return options;
    }

    public boolean isMultiResource() {
      return multiResource;
    }

    @Override
    public String toString() {
      return (multiResource ? "multi " : "single ") + action + " " + resources + " " + options;
    }
  }
}
