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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * What a dispatcher does when a sink or listener throws while an event is being fanned out.
 * <p>
 * Dispatchers run on the producer's thread. Letting the exception through surfaces programmer errors
 * in consumer code immediately but lets one faulty consumer starve the ones registered after it;
 * isolating keeps every consumer fed at the price of turning those errors into log lines. Neither is
 * imposed: the policy is chosen when the dispatcher is built and defaults to {@link #PROPAGATE}.
 * <p>
 * Only {@link RuntimeException}s are subject to the policy. {@link Error}s always propagate.
 */
public enum FaultPolicy {

  /**
   * The exception aborts the fan-out: the targets registered after the faulty one do not receive the
   * event, and the exception reaches the producer's call site unchanged.
   */
  PROPAGATE {
    @Override
    public <T> void deliver(T target, String event, Consumer<? super T> delivery) {
      delivery.accept(target);
    }
  },

  /**
   * The exception is logged with the faulty target and the event, and the fan-out continues with the
   * next target. The producer never sees it.
   */
  ISOLATE {
    @Override
    public <T> void deliver(T target, String event, Consumer<? super T> delivery) {
      try {
        delivery.accept(target);
      } catch (RuntimeException e) {
        logger.error("Delivery of '{}' to {} failed; continuing with the remaining targets", event, target, e);
      }
    }
  };

  private static final Logger logger = LoggerFactory.getLogger(FaultPolicy.class);

  /**
   * Delivers one event to one target according to this policy.
   *
   * @param target   the sink or listener receiving the event
   * @param event    name of the event, used for diagnostics
   * @param delivery the invocation of the target's handler
   * @param <T>      type of the target
   */
  public abstract <T> void deliver(T target, String event, Consumer<? super T> delivery);
}
