/*
 * Copyright © 2025 CorvusPrint
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.corvusprint.slicer.events;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Terminal outcome of one slicing run.
 * <p>
 * A new run produces a new instance; instances are immutable and the list of faulty object
 * identifiers is copied on construction.
 *
 * @param status               how the run ended
 * @param errorMessage         description of the failure, empty unless {@code status} is {@link Status#ERROR}
 * @param errorObjectIds       identifiers of the model objects that caused the failure, possibly empty
 * @param criticalError        whether the failure invalidates the whole result rather than part of it
 * @param invalidateDownstream whether consumers must drop any result derived from previous runs
 */
public record CompletionInfo(Status status,
                             String errorMessage,
                             List<Long> errorObjectIds,
                             boolean criticalError,
                             boolean invalidateDownstream) {

  /**
   * How a slicing run ended.
   */
  public enum Status {
    /** The run completed normally. */
    FINISHED,
    /** The run was stopped at the user's request. */
    CANCELLED,
    /** The run failed. */
    ERROR
  }

  public CompletionInfo {
    requireNonNull(status, "status must not be null");
    errorMessage = errorMessage == null ? "" : errorMessage;
    errorObjectIds = errorObjectIds == null ? List.of() : List.copyOf(errorObjectIds);
  }

  public static CompletionInfo finished() {
    return new CompletionInfo(Status.FINISHED, "", List.of(), false, false);
  }

  public static CompletionInfo cancelled() {
    return new CompletionInfo(Status.CANCELLED, "", List.of(), false, false);
  }

  public static CompletionInfo error(String errorMessage) {
    return new CompletionInfo(Status.ERROR, errorMessage, List.of(), false, false);
  }

  public static Builder builder(Status status) {
    return new Builder(status);
  }

  public boolean isFinished() {
    return status == Status.FINISHED;
  }

  public boolean isSuccess() {
    return status == Status.FINISHED;
  }

  public boolean isCancelled() {
    return status == Status.CANCELLED;
  }

  public boolean isError() {
    return status == Status.ERROR;
  }

  /**
   * Tells whether the run ended without a result, either cancelled or failed. Sinks reset their
   * in-progress state on such a completion.
   *
   * @return {@code true} for {@link Status#CANCELLED} and {@link Status#ERROR}
   */
  public boolean isTerminalFailure() {
    return status != Status.FINISHED;
  }

  /**
   * Builder for the full form of {@link CompletionInfo}.
   */
  public static final class Builder {
    private final Status status;
    private String errorMessage = "";
    private final List<Long> errorObjectIds = new ArrayList<>();
    private boolean criticalError;
    private boolean invalidateDownstream;

    private Builder(Status status) {
      this.status = requireNonNull(status, "status must not be null");
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    public Builder errorObjectId(long id) {
      this.errorObjectIds.add(id);
      return this;
    }

    public Builder errorObjectIds(Collection<Long> ids) {
      requireNonNull(ids, "ids must not be null");
      this.errorObjectIds.addAll(ids);
      return this;
    }

    public Builder criticalError(boolean criticalError) {
      this.criticalError = criticalError;
      return this;
    }

    public Builder invalidateDownstream(boolean invalidateDownstream) {
      this.invalidateDownstream = invalidateDownstream;
      return this;
    }

    public CompletionInfo build() {
      return new CompletionInfo(status, errorMessage, errorObjectIds, criticalError, invalidateDownstream);
    }
  }
}
