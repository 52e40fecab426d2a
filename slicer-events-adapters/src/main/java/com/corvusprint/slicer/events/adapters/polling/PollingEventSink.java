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
package com.corvusprint.slicer.events.adapters.polling;

import com.corvusprint.slicer.events.CompletionInfo;
import com.corvusprint.slicer.events.SlicingEventSink;
import com.corvusprint.slicer.events.SlicingStatus;
import com.corvusprint.slicer.events.adapters.json.EventJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * {@link SlicingEventSink} caching the latest status and completion so that clients can poll them,
 * for instance from an HTTP endpoint.
 * <p>
 * Before any event the status is {@code 0%} with an empty message and no completion. A completion
 * stays cached until {@link #resetCompletion()} is called for the next run; status updates do not
 * clear it. Export events are accepted and ignored.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Events and queries may come from different threads. Both go through one lock, and
 * {@link #snapshot()} reads status and completion together.
 */
public final class PollingEventSink implements SlicingEventSink {

  private static final Logger logger = LoggerFactory.getLogger(PollingEventSink.class);

  private static final SlicingStatus INITIAL_STATUS = SlicingStatus.of(0, "");

  private final Object lock = new Object();
  private SlicingStatus status = INITIAL_STATUS;
  private CompletionInfo completion;

  @Override
  public void onSlicingUpdate(SlicingStatus status) {
    requireNonNull(status, "status must not be null");
    synchronized (lock) {
      this.status = status;
    }
  }

  @Override
  public void onSlicingCompleted(int timestamp) {
    logger.debug("Slicing completed at {}", timestamp);
  }

  @Override
  public void onProcessFinished(CompletionInfo info) {
    requireNonNull(info, "info must not be null");
    synchronized (lock) {
      this.completion = info;
    }
  }

  @Override
  public void onExportBegan() {
  }

  @Override
  public void onExportFinished(String path) {
  }

  /**
   * Forgets the cached completion; called when a new run starts.
   */
  public void resetCompletion() {
    synchronized (lock) {
      completion = null;
    }
  }

  /**
   * Returns to the initial state: {@code 0%}, empty message, no completion.
   */
  public void reset() {
    synchronized (lock) {
      status = INITIAL_STATUS;
      completion = null;
    }
  }

  public StatusSnapshot snapshot() {
    synchronized (lock) {
      return new StatusSnapshot(status, completion != null, completion);
    }
  }

  /**
   * Renders the current snapshot as JSON.
   *
   * @return the polling status document
   * @see EventJson#pollingStatus(SlicingStatus, CompletionInfo)
   */
  public String statusJson() {
    var snapshot = snapshot();
    return EventJson.pollingStatus(snapshot.status(), snapshot.completion());
  }
}
