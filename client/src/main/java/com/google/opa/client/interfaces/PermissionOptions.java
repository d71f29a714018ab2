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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.Collection;
import javax.annotation.Nullable;

/**
 * Per-call options of a permission query. Instances are immutable and can be shared between
 * threads; the member list is copied when the options are built.
 */
public final class PermissionOptions {

  private static final PermissionOptions EMPTY = builder().build();

  private final ImmutableList<String> memberIds;
  @Nullable private final String overrideHeaderValue;
  @Nullable private final Instant deadline;

  private PermissionOptions(Builder builder) {
    this.memberIds = builder.memberIds.build();
    this.overrideHeaderValue = builder.overrideHeaderValue;
    this.deadline = builder.deadline;
  }

  public static PermissionOptions empty() {
    return EMPTY;
  }

  public static PermissionOptions forMembers(String... memberIds) {
    return builder().addMemberIds(ImmutableList.copyOf(memberIds)).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The principals on whose behalf the action is requested; order is not significant. */
  public ImmutableList<String> getMemberIds() {
    return memberIds;
  }

  @Nullable
  public String getOverrideHeaderValue() {
    return overrideHeaderValue;
  }

  public boolean hasOverrideHeaderValue() {
    return !Strings.isNullOrEmpty(overrideHeaderValue);
  }

  /**
   * @return the point in time after which the caller is no longer interested in the answer, or
   *     null if only the client's request timeout applies.
   */
  @Nullable
  public Instant getDeadline() {
    return deadline;
  }

  @Override
  public String toString() {
    // The override value is a shared secret; never print it.
    return "memberIds="
        + memberIds
        + " override="
        + (hasOverrideHeaderValue() ? "<set>" : "<unset>")
        + " deadline="
        + deadline;
  }

  public static class Builder {
    private final ImmutableList.Builder<String> memberIds = ImmutableList.builder();
    private String overrideHeaderValue;
    private Instant deadline;

    private Builder() {}

    public Builder addMemberId(String memberId) {
      Preconditions.checkNotNull(memberId, "memberId");
      memberIds.add(memberId);
      return this;
    }

    public Builder addMemberIds(Collection<String> memberIds) {
      for (String memberId : memberIds) {
        addMemberId(memberId);
      }
      return this;
    }

    public Builder setOverrideHeaderValue(@Nullable String overrideHeaderValue) {
      this.overrideHeaderValue = overrideHeaderValue;
      return this;
    }

    public Builder setDeadline(@Nullable Instant deadline) {
      this.deadline = deadline;
      return this;
    }

    public PermissionOptions build() {
      return new PermissionOptions(this);
    }
  }
}
