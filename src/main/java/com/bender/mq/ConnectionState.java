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
package com.bender.mq;

import java.util.EnumSet;
import java.util.Set;

/** States of a {@link ConnectionManager}. */
public enum ConnectionState {
  /** No connection attempt yet. */
  DISCONNECTED,
  /** First connection in progress. */
  CONNECTING,
  /** Connected and usable. */
  READY,
  /** The link got lost, recovery is in progress. */
  DEGRADED,
  /** Terminal state. */
  CLOSED;

  private Set<ConnectionState> next;

  static {
    DISCONNECTED.next = EnumSet.of(CONNECTING, CLOSED);
    CONNECTING.next = EnumSet.of(READY, CLOSED);
    READY.next = EnumSet.of(DEGRADED, CLOSED);
    DEGRADED.next = EnumSet.of(READY, CLOSED);
    CLOSED.next = EnumSet.noneOf(ConnectionState.class);
  }

  /**
   * Whether the state machine allows to move from this state to the given state.
   *
   * @param state the target state
   * @return true if the transition is legal
   */
  public boolean canTransitionTo(ConnectionState state) {
    return this.next.contains(state);
  }
}
