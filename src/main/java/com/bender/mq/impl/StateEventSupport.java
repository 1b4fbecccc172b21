// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.bender.mq.impl;

import com.bender.mq.ConnectionManager;
import com.bender.mq.ConnectionState;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifies state listeners of the transitions of a connection manager.
 *
 * <p>Listeners run on the thread making the transition, with the lock of the connection manager
 * held. A failing listener does not prevent the next ones from being notified.
 */
final class StateEventSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(StateEventSupport.class);

  private final List<ConnectionManager.StateListener> listeners;

  StateEventSupport(List<ConnectionManager.StateListener> listeners) {
    this.listeners = new ArrayList<>(listeners);
  }

  void dispatch(
      ConnectionManager connectionManager,
      long generation,
      Throwable failureCause,
      ConnectionState previousState,
      ConnectionState currentState) {
    if (this.listeners.isEmpty()) {
      return;
    }
    Transition transition =
        new Transition(connectionManager, generation, failureCause, previousState, currentState);
    for (ConnectionManager.StateListener listener : this.listeners) {
      try {
        listener.handle(transition);
      } catch (Exception e) {
        LOGGER.warn(
            "Error in state listener of connection '{}' on {}",
            connectionManager.name(),
            transition,
            e);
      }
    }
  }

  private static final class Transition implements ConnectionManager.Context {

    private final ConnectionManager connectionManager;
    private final long generation;
    private final Throwable failureCause;
    private final ConnectionState previousState;
    private final ConnectionState currentState;

    private Transition(
        ConnectionManager connectionManager,
        long generation,
        Throwable failureCause,
        ConnectionState previousState,
        ConnectionState currentState) {
      this.connectionManager = connectionManager;
      this.generation = generation;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public ConnectionManager connectionManager() {
      return this.connectionManager;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public ConnectionState previousState() {
      return this.previousState;
    }

    @Override
    public ConnectionState currentState() {
      return this.currentState;
    }

    @Override
    public long generation() {
      return this.generation;
    }

    @Override
    public String toString() {
      return previousState + " -> " + currentState + " (generation " + generation + ")";
    }
  }
}
