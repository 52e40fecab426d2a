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

/**
 * Receiver of the lifecycle events produced by a background slicing process.
 * <p>
 * A slicing run, as observed through this contract, follows the sequence
 * <pre>
 *   onSlicingUpdate* → onSlicingCompleted → onExportBegan → onExportFinished → onProcessFinished
 * </pre>
 * {@link #onProcessFinished(CompletionInfo)} is always the terminal event of a run and may arrive
 * early (cancellation or error), skipping the export phase. Implementations must treat a
 * {@linkplain CompletionInfo#isTerminalFailure() cancelled or failed} completion as resetting any
 * in-progress state, regardless of how many progress updates preceded it.
 * <p>
 * The producer calls a sink from its own worker thread, synchronously. Implementations that need to
 * run on another thread (a UI event loop for instance) must hand the event off and return; see the
 * marshalling adapter.
 *
 * @see SlicingEventDispatcher
 */
public interface SlicingEventSink {

  /**
   * Called for every progress update of the running computation. Frequent.
   *
   * @param status the latest status; the latest arrival is authoritative
   */
  void onSlicingUpdate(SlicingStatus status);

  /**
   * Called when the slicing phase is done and the export phase is about to start.
   *
   * @param timestamp producer-defined timestamp of the end of the slicing phase
   */
  void onSlicingCompleted(int timestamp);

  /**
   * Called once per run, as its last event.
   *
   * @param info the outcome of the run
   */
  void onProcessFinished(CompletionInfo info);

  /**
   * Called when the export of the sliced result starts.
   */
  void onExportBegan();

  /**
   * Called when the export of the sliced result is complete.
   *
   * @param path location of the exported file
   */
  void onExportFinished(String path);
}
