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

import com.corvusprint.slicer.events.config.ConfigChangeDispatcher;

import static java.util.Objects.requireNonNull;

/**
 * The two notification channels of a slicer process, built once at start-up and handed to the
 * components that publish or observe events.
 * <p>
 * The configuration-change channel and the slicing-event channel are unrelated: each has its own
 * lock and there is no ordering guarantee between them.
 * <p>
 * Build one context per process (or per test) and pass it explicitly. Nothing in this library keeps
 * a global instance.
 */
public final class NotificationContext {

  private final ConfigChangeDispatcher configChanges;
  private final SlicingEventDispatcher slicingEvents;

  public NotificationContext(ConfigChangeDispatcher configChanges, SlicingEventDispatcher slicingEvents) {
    this.configChanges = requireNonNull(configChanges, "configChanges must not be null");
    this.slicingEvents = requireNonNull(slicingEvents, "slicingEvents must not be null");
  }

  /**
   * Creates a context whose dispatchers let consumer exceptions propagate.
   *
   * @return a new context
   */
  public static NotificationContext create() {
    return create(FaultPolicy.PROPAGATE);
  }

  /**
   * Creates a context whose two dispatchers share the given fault policy.
   *
   * @param faultPolicy what both dispatchers do when a consumer throws
   * @return a new context
   */
  public static NotificationContext create(FaultPolicy faultPolicy) {
    return new NotificationContext(new ConfigChangeDispatcher(faultPolicy), new SlicingEventDispatcher(faultPolicy));
  }

  public ConfigChangeDispatcher configChanges() {
    return configChanges;
  }

  /**
   * Returns the composite sink to install into the slicing process and to register consumers with.
   *
   * @return the slicing event dispatcher
   */
  public SlicingEventDispatcher slicingEvents() {
    return slicingEvents;
  }
}
