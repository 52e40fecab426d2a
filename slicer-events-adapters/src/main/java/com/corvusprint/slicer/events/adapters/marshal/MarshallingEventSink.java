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
package com.corvusprint.slicer.events.adapters.marshal;

import com.corvusprint.slicer.events.CompletionInfo;
import com.corvusprint.slicer.events.SlicingEventSink;
import com.corvusprint.slicer.events.SlicingStatus;
import com.google.common.util.concurrent.MoreExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * {@link SlicingEventSink} handing every event over to another thread before delivering it to a
 * target sink.
 * <p>
 * Typical use is a UI whose widgets may only be touched from its event thread:
 * <pre>{@code
 * dispatcher.addSink(new MarshallingEventSink(uiSink, Platform::runLater));
 * }</pre>
 * The producer only enqueues, so a slow target no longer slows the slicing process down.
 *
 * <h2>Ordering</h2>
 * <p>
 * Events reach the target in the order they were received, one at a time, even when the executor
 * runs tasks concurrently: tasks are chained through a sequential executor.
 *
 * <h2>Failure Handling</h2>
 * <p>
 * A failure of the target happens on the executor thread; it is logged and does not prevent the
 * following events from being delivered. An event the executor rejects is logged and dropped.
 */
public final class MarshallingEventSink implements SlicingEventSink {

  private static final Logger logger = LoggerFactory.getLogger(MarshallingEventSink.class);

  private final SlicingEventSink target;
  private final Executor executor;

  /**
   * @param target   the sink receiving the events
   * @param executor the executor running deliveries, typically the target's event thread
   */
  public MarshallingEventSink(SlicingEventSink target, Executor executor) {
    this.target = requireNonNull(target, "target must not be null");
    this.executor = MoreExecutors.newSequentialExecutor(requireNonNull(executor, "executor must not be null"));
  }

  @Override
  public void onSlicingUpdate(SlicingStatus status) {
    marshal("slicing-update", sink -> sink.onSlicingUpdate(status));
  }

  @Override
  public void onSlicingCompleted(int timestamp) {
    marshal("slicing-completed", sink -> sink.onSlicingCompleted(timestamp));
  }

  @Override
  public void onProcessFinished(CompletionInfo info) {
    marshal("process-finished", sink -> sink.onProcessFinished(info));
  }

  @Override
  public void onExportBegan() {
    marshal("export-began", SlicingEventSink::onExportBegan);
  }

  @Override
  public void onExportFinished(String path) {
    marshal("export-finished", sink -> sink.onExportFinished(path));
  }

  private void marshal(String event, Consumer<SlicingEventSink> delivery) {
    try {
      executor.execute(() -> {
        try {
          delivery.accept(target);
        } catch (RuntimeException e) {
          logger.error("Marshalled delivery of '{}' to {} failed", event, target, e);
        }
      });
    } catch (RejectedExecutionException e) {
      logger.error("Executor rejected '{}' for {}, event dropped", event, target, e);
    }
  }

  @Override
  public String toString() {
    return "MarshallingEventSink{" +
      "target=" + target +
      '}';
  }
}
