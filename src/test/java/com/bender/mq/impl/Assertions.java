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

import static org.assertj.core.api.Assertions.fail;

import com.bender.mq.ConnectionManager;
import com.bender.mq.ConnectionState;
import java.time.Duration;
import org.assertj.core.api.AbstractObjectAssert;

final class Assertions {

  private Assertions() {}

  static SyncAssert assertThat(TestUtils.Sync sync) {
    return new SyncAssert(sync);
  }

  static ConnectionManagerAssert assertThat(ConnectionManager connectionManager) {
    return new ConnectionManagerAssert(connectionManager);
  }

  static class SyncAssert extends AbstractObjectAssert<SyncAssert, TestUtils.Sync> {

    private SyncAssert(TestUtils.Sync sync) {
      super(sync, SyncAssert.class);
    }

    SyncAssert completes() {
      return this.completes(TestUtils.DEFAULT_CONDITION_TIMEOUT);
    }

    SyncAssert completes(Duration timeout) {
      boolean completed = actual.await(timeout);
      if (!completed) {
        fail("Sync '%s' timed out after %d ms", this.actual.toString(), timeout.toMillis());
      }
      return this;
    }

    SyncAssert hasNotCompleted() {
      if (actual.hasCompleted()) {
        fail("Sync '%s' should not have completed", this.actual.toString());
      }
      return this;
    }
  }

  static class ConnectionManagerAssert
      extends AbstractObjectAssert<ConnectionManagerAssert, ConnectionManager> {

    private ConnectionManagerAssert(ConnectionManager connectionManager) {
      super(connectionManager, ConnectionManagerAssert.class);
    }

    ConnectionManagerAssert isReady() {
      return this.hasState(ConnectionState.READY);
    }

    ConnectionManagerAssert isClosed() {
      return this.hasState(ConnectionState.CLOSED);
    }

    ConnectionManagerAssert hasState(ConnectionState state) {
      isNotNull();
      if (actual.state() != state) {
        fail("Connection manager should be %s but is %s", state, actual.state());
      }
      return this;
    }
  }
}
