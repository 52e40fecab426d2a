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

import com.corvusprint.slicer.events.internal.StrongRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Composite {@link SlicingEventSink} that fans every event out to the sinks registered with it.
 * <p>
 * A background slicing process holds exactly one sink. Installing a dispatcher as that sink lets
 * any number of heterogeneous consumers (UI, broker publisher, status poller) receive the same event
 * stream, and come and go during the lifetime of the process:
 * <pre>{@code
 * var dispatcher = new SlicingEventDispatcher();
 * dispatcher.addSink(uiSink);
 * dispatcher.addSink(brokerSink);
 * process.setEventSink(dispatcher);
 * }</pre>
 * Sinks are held strongly and compared by reference. They leave only through
 * {@link #removeSink(SlicingEventSink)} or {@link #clearSinks()}; there is no liveness check.
 *
 * <h2>Delivery</h2>
 * <p>
 * Each event is delivered synchronously on the producer's thread, to every sink, in registration
 * order. The producer is blocked until the last sink returns: a slow sink slows the producer down,
 * and no timeout is applied. Consumers that cannot keep up should be wrapped in a marshalling sink
 * that hands events off to their own thread.
 * <p>
 * When a sink throws, the {@link FaultPolicy} given at construction decides whether the fan-out is
 * aborted with the exception reaching the producer ({@link FaultPolicy#PROPAGATE}, the default) or
 * whether the error is logged and the remaining sinks still served ({@link FaultPolicy#ISOLATE}).
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Registration may happen from any thread while the producer delivers. One lock guards the sink
 * list and is held for the full duration of both registration and fan-out, so a registration never
 * races with an in-flight event, and all deliveries of this dispatcher are totally ordered.
 * <p>
 * Consequently a sink must not call back into the dispatcher ({@code addSink}, {@code removeSink},
 * {@code clearSinks}) from within a delivery. This is not guarded against.
 * <p>
 * The producer-facing contract is that at most one thread delivers at a time; the lock makes
 * concurrent deliveries safe anyway, but their relative order is then unspecified.
 *
 * @see SlicingEventSink
 * @see FaultPolicy
 */
public final class SlicingEventDispatcher implements SlicingEventSink {

  private static final Logger logger = LoggerFactory.getLogger(SlicingEventDispatcher.class);

  private final Object lock = new Object();
  private final StrongRegistry<SlicingEventSink> sinks = new StrongRegistry<>();
  private final FaultPolicy faultPolicy;

  /**
   * Creates a dispatcher that lets sink exceptions propagate to the producer.
   */
  public SlicingEventDispatcher() {
    this(FaultPolicy.PROPAGATE);
  }

  /**
   * Creates a dispatcher with the given fault policy.
   *
   * @param faultPolicy what to do when a sink throws during delivery
   * @throws NullPointerException if {@code faultPolicy} is {@code null}
   */
  public SlicingEventDispatcher(FaultPolicy faultPolicy) {
    this.faultPolicy = requireNonNull(faultPolicy, "faultPolicy must not be null");
  }

  /**
   * Appends a sink. A {@code null} sink is silently ignored. Adding a sink twice makes it receive
   * every event twice.
   *
   * @param sink the sink to register
   */
  public void addSink(SlicingEventSink sink) {
    if (sink == null) {
      logger.debug("Ignoring registration of a null slicing event sink");
      return;
    }
    synchronized (lock) {
      sinks.add(sink);
      logger.debug("Slicing event sink registered: {} ({} sink(s))", sink, sinks.size());
    }
  }

  /**
   * Removes every registration of {@code sink}, compared by reference.
   *
   * @param sink the sink to unregister
   * @return the number of registrations removed
   */
  public int removeSink(SlicingEventSink sink) {
    if (sink == null) {
      return 0;
    }
    synchronized (lock) {
      int removed = sinks.removeAll(sink);
      logger.debug("Slicing event sink unregistered: {} ({} registration(s) removed)", sink, removed);
      return removed;
    }
  }

  /**
   * Removes every sink.
   */
  public void clearSinks() {
    synchronized (lock) {
      sinks.clear();
    }
  }

  /**
   * Returns the number of registrations at the time of the call.
   *
   * @return the sink registration count
   */
  public int sinkCount() {
    synchronized (lock) {
      return sinks.size();
    }
  }

  public FaultPolicy faultPolicy() {
    return faultPolicy;
  }

  @Override
  public void onSlicingUpdate(SlicingStatus status) {
    fanOut("slicing-update", sink -> sink.onSlicingUpdate(status));
  }

  @Override
  public void onSlicingCompleted(int timestamp) {
    fanOut("slicing-completed", sink -> sink.onSlicingCompleted(timestamp));
  }

  @Override
  public void onProcessFinished(CompletionInfo info) {
    fanOut("process-finished", sink -> sink.onProcessFinished(info));
  }

  @Override
  public void onExportBegan() {
    fanOut("export-began", SlicingEventSink::onExportBegan);
  }

  @Override
  public void onExportFinished(String path) {
    fanOut("export-finished", sink -> sink.onExportFinished(path));
  }

  private void fanOut(String event, Consumer<SlicingEventSink> delivery) {
    synchronized (lock) {
      sinks.forEach(sink -> faultPolicy.deliver(sink, event, delivery));
    }
  }

  @Override
  public String toString() {
    return "SlicingEventDispatcher{" +
      "faultPolicy=" + faultPolicy +
      '}';
  }
}
