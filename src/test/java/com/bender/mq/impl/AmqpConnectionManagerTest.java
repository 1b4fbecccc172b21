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

import static com.bender.mq.impl.Assertions.assertThat;
import static com.bender.mq.impl.TestUtils.FAST_RETRY;
import static com.bender.mq.impl.TestUtils.waitAtMost;
import static com.bender.mq.impl.TestUtils.waitUntilState;
import static java.time.Duration.ofMillis;
import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bender.mq.AmqpException;
import com.bender.mq.BrokerConnection;
import com.bender.mq.ChannelHandle;
import com.bender.mq.ConnectionManager;
import com.bender.mq.ConnectionState;
import com.bender.mq.QueueDecl;
import com.bender.mq.RetryPolicy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;

public class AmqpConnectionManagerTest {

  FakeBroker broker;
  TestUtils.StateRecorder recorder;
  AmqpConnectionManager connectionManager;
  String name;

  @BeforeEach
  void init(TestInfo info) {
    this.broker = new FakeBroker();
    this.recorder = new TestUtils.StateRecorder();
    this.name = TestUtils.name(info);
  }

  @AfterEach
  void tearDown() {
    if (this.connectionManager != null) {
      this.connectionManager.close();
    }
    this.broker.close();
  }

  @Test
  void connectShouldMoveToReady() {
    connectionManager = connectionManager(FAST_RETRY);
    assertThat(connectionManager).hasState(ConnectionState.DISCONNECTED);
    connectionManager.connect();
    assertThat(connectionManager).isReady();
    assertThat(recorder.states())
        .containsExactly(ConnectionState.CONNECTING, ConnectionState.READY);
    assertThat(broker.openConnectionCount()).isEqualTo(1);
    assertThat(connectionManager.name()).isEqualTo(name);
  }

  @Test
  void connectShouldDoNothingIfAlreadyConnected() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    connectionManager.connect();
    assertThat(broker.openAttempts()).isEqualTo(1);
    assertThat(broker.openConnectionCount()).isEqualTo(1);
  }

  @Test
  void connectShouldFailAfterMaxAttemptsWithBackoff() {
    RetryPolicy policy =
        RetryPolicy.exponential()
            .maxAttempts(3)
            .baseDelay(ofMillis(50))
            .maxDelay(ofSeconds(1))
            .seed(42)
            .build();
    connectionManager = connectionManager(policy);
    broker.stop();
    long start = System.nanoTime();
    assertThatThrownBy(() -> connectionManager.connect())
        .isInstanceOf(AmqpException.AmqpConnectFailedException.class)
        .hasCauseInstanceOf(AmqpException.AmqpConnectionException.class);
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

    assertThat(broker.openAttempts()).isEqualTo(3);
    Duration firstDelay = policy.nextDelay(1).get();
    Duration secondDelay = policy.nextDelay(2).get();
    assertThat(elapsed).isGreaterThanOrEqualTo(firstDelay.plus(secondDelay));
    List<Long> attempts = broker.openAttemptTimes();
    assertThat(attempts.get(1) - attempts.get(0)).isGreaterThanOrEqualTo(firstDelay.toNanos());
    assertThat(attempts.get(2) - attempts.get(1)).isGreaterThanOrEqualTo(secondDelay.toNanos());
    assertThat(connectionManager).isClosed();
    assertThat(recorder.states())
        .containsExactly(ConnectionState.CONNECTING, ConnectionState.CLOSED);
  }

  @Test
  void rejectedCredentialsShouldNotBeRetried() {
    connectionManager = connectionManager(FAST_RETRY);
    broker.rejectCredentials(true);
    assertThatThrownBy(() -> connectionManager.connect())
        .isInstanceOf(AmqpException.AmqpConnectFailedException.class)
        .hasCauseInstanceOf(AmqpException.AmqpSecurityException.class);
    assertThat(broker.openAttempts()).isEqualTo(1);
    assertThat(connectionManager).isClosed();
  }

  @Test
  void connectAfterCloseShouldFail() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.close();
    assertThat(connectionManager).isClosed();
    assertThatThrownBy(() -> connectionManager.connect())
        .isInstanceOf(AmqpException.AmqpConnectFailedException.class);
    assertThat(broker.openAttempts()).isZero();
  }

  @Test
  void currentChannelShouldConnectInBackgroundIfDisconnected() {
    connectionManager = connectionManager(FAST_RETRY);
    ChannelHandle channel = connectionManager.currentChannel();
    assertThat(channel.isOpen()).isTrue();
    assertThat(channel.generation()).isEqualTo(1);
    assertThat(connectionManager).isReady();
    assertThat(broker.openAttempts()).isEqualTo(1);
  }

  @Test
  void currentChannelShouldAcceptUnboundedTimeout() throws Exception {
    connectionManager = connectionManager(FAST_RETRY, Duration.ofSeconds(Long.MAX_VALUE));
    connectionManager.connect();
    broker.stop();
    assertThat(connectionManager).hasState(ConnectionState.DEGRADED);
    Thread starter =
        new Thread(
            () -> {
              try {
                Thread.sleep(200);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              broker.start();
            });
    starter.start();
    ChannelHandle channel = connectionManager.currentChannel();
    assertThat(channel.generation()).isEqualTo(2);
    starter.join();
  }

  @Test
  void stateListenersShouldReceiveConnectionGeneration() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    broker.kill();
    waitUntilState(connectionManager, ConnectionState.READY);
    waitAtMost(() -> recorder.states().size() == 4);
    assertThat(recorder.states())
        .containsExactly(
            ConnectionState.CONNECTING,
            ConnectionState.READY,
            ConnectionState.DEGRADED,
            ConnectionState.READY);
    assertThat(recorder.generations()).containsExactly(0L, 1L, 1L, 2L);
    assertThat(connectionManager.generation()).isEqualTo(2);
  }

  @Test
  void currentChannelShouldReturnSameChannelWhileReady() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    ChannelHandle channel = connectionManager.currentChannel();
    assertThat(connectionManager.currentChannel()).isSameAs(channel);
  }

  @Test
  void currentChannelShouldTimeOutIfBrokerUnreachable() {
    connectionManager = connectionManager(FAST_RETRY);
    broker.stop();
    assertThatThrownBy(() -> connectionManager.currentChannel(ofMillis(200)))
        .isInstanceOf(AmqpException.AmqpNotReadyException.class)
        .isNotInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThat(connectionManager).hasState(ConnectionState.CONNECTING);
    assertThat(broker.openAttempts()).isGreaterThanOrEqualTo(1);
  }

  @Test
  void currentChannelShouldFailImmediatelyIfClosed() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    connectionManager.close();
    long start = System.nanoTime();
    assertThatThrownBy(() -> connectionManager.currentChannel(ofSeconds(5)))
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(ofSeconds(1));
  }

  @Test
  void currentChannelShouldWaitForRecovery() throws Exception {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    broker.stop();
    assertThat(connectionManager).hasState(ConnectionState.DEGRADED);
    Thread starter =
        new Thread(
            () -> {
              try {
                Thread.sleep(200);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              broker.start();
            });
    starter.start();
    ChannelHandle channel = connectionManager.currentChannel(ofSeconds(5));
    assertThat(channel.generation()).isEqualTo(2);
    assertThat(connectionManager).isReady();
    starter.join();
  }

  @Test
  void linkLossShouldDegradeThenRecover() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    long generation = connectionManager.currentChannel().generation();

    broker.kill();
    waitAtMost(() -> recorder.states().size() == 4);
    assertThat(recorder.states())
        .containsExactly(
            ConnectionState.CONNECTING,
            ConnectionState.READY,
            ConnectionState.DEGRADED,
            ConnectionState.READY);
    assertThat(recorder.causes()).hasSize(1);
    assertThat(recorder.causes().get(0)).isInstanceOf(BrokerConnection.LinkLostException.class);
    assertThat(connectionManager.currentChannel().generation()).isEqualTo(generation + 1);
    assertThat(broker.openConnectionCount()).isEqualTo(1);
  }

  @Test
  void recoveryShouldCloseWhenAttemptsExhausted() {
    connectionManager = connectionManager(RetryPolicy.fixed(ofMillis(20), 3));
    connectionManager.connect();
    broker.stop();
    waitUntilState(connectionManager, ConnectionState.CLOSED);
    // 1 initial connection + 3 recovery attempts
    assertThat(broker.openAttempts()).isEqualTo(4);
    assertThat(recorder.states())
        .containsExactly(
            ConnectionState.CONNECTING,
            ConnectionState.READY,
            ConnectionState.DEGRADED,
            ConnectionState.CLOSED);
    assertThatThrownBy(() -> connectionManager.currentChannel())
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
  }

  @Test
  void staleLinkLossReportShouldBeIgnored() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    long staleGeneration = connectionManager.currentChannel().generation();
    broker.kill();
    waitUntilState(connectionManager, ConnectionState.READY);
    int attempts = broker.openAttempts();

    connectionManager.linkLost(
        staleGeneration, new BrokerConnection.LinkLostException("late report"));
    assertThat(connectionManager).isReady();
    assertThat(connectionManager.currentChannel().generation()).isEqualTo(staleGeneration + 1);
    assertThat(broker.openAttempts()).isEqualTo(attempts);
  }

  @Test
  void linkLossReportsForCurrentGenerationShouldTriggerOneRecovery() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    long generation = connectionManager.currentChannel().generation();
    connectionManager.linkLost(generation, new BrokerConnection.LinkLostException("first"));
    connectionManager.linkLost(generation, new BrokerConnection.LinkLostException("second"));
    waitUntilState(connectionManager, ConnectionState.READY);
    assertThat(connectionManager.currentChannel().generation()).isEqualTo(generation + 1);
    assertThat(broker.openAttempts()).isEqualTo(2);
  }

  @Test
  void reconnectListenersShouldRunByPhaseBeforeReady() {
    connectionManager = connectionManager(FAST_RETRY);
    List<String> calls = new CopyOnWriteArrayList<>();
    List<ConnectionState> statesDuringListeners = new CopyOnWriteArrayList<>();
    connectionManager.onReconnect(
        channel -> {
          calls.add("application");
          statesDuringListeners.add(connectionManager.state());
        });
    connectionManager.register(
        AmqpConnectionManager.PHASE_SUBSCRIPTION, channel -> calls.add("subscription"));
    connectionManager.register(
        AmqpConnectionManager.PHASE_TOPOLOGY, channel -> calls.add("topology"));
    connectionManager.connect();
    assertThat(calls).isEmpty();

    broker.kill();
    waitUntilState(connectionManager, ConnectionState.READY);
    assertThat(calls).containsExactly("topology", "subscription", "application");
    assertThat(statesDuringListeners).containsExactly(ConnectionState.DEGRADED);
  }

  @Test
  void reconnectListenerShouldReceiveChannelOfNewConnection() {
    connectionManager = connectionManager(FAST_RETRY);
    List<Long> generations = new CopyOnWriteArrayList<>();
    connectionManager.onReconnect(channel -> generations.add(channel.generation()));
    connectionManager.connect();
    broker.kill();
    waitUntilState(connectionManager, ConnectionState.READY);
    broker.kill();
    waitAtMost(() -> generations.size() == 2);
    assertThat(generations).containsExactly(2L, 3L);
  }

  @Test
  void unregisteredReconnectListenerShouldNotBeCalled() {
    connectionManager = connectionManager(FAST_RETRY);
    AtomicInteger calls = new AtomicInteger();
    ConnectionManager.Registration registration =
        connectionManager.onReconnect(channel -> calls.incrementAndGet());
    connectionManager.connect();
    registration.unregister();
    broker.kill();
    waitUntilState(connectionManager, ConnectionState.READY);
    assertThat(calls).hasValue(0);
  }

  @Test
  void linkLossInReconnectListenerShouldRestartRecoveryAttempt() {
    connectionManager = connectionManager(FAST_RETRY);
    AtomicInteger calls = new AtomicInteger();
    connectionManager.onReconnect(
        channel -> {
          if (calls.incrementAndGet() == 1) {
            throw new AmqpException.AmqpConnectionException("simulated link loss");
          }
        });
    connectionManager.connect();
    broker.kill();
    waitAtMost(() -> calls.get() == 2);
    waitUntilState(connectionManager, ConnectionState.READY);
    assertThat(broker.openAttempts()).isEqualTo(3);
    assertThat(broker.openConnectionCount()).isEqualTo(1);
    assertThat(connectionManager.currentChannel().generation()).isEqualTo(3);
  }

  @Test
  void failingReconnectListenerShouldNotPreventRecovery() {
    connectionManager = connectionManager(FAST_RETRY);
    AtomicInteger calls = new AtomicInteger();
    connectionManager.onReconnect(
        channel -> {
          calls.incrementAndGet();
          throw new IllegalStateException("application error");
        });
    connectionManager.connect();
    broker.kill();
    waitUntilState(connectionManager, ConnectionState.READY);
    assertThat(calls).hasValue(1);
    assertThat(broker.openAttempts()).isEqualTo(2);
  }

  @Test
  void failingStateListenerShouldNotPreventTransition() {
    connectionManager =
        (AmqpConnectionManager)
            new AmqpConnectionManagerBuilder()
                .brokerConnection(broker)
                .retryPolicy(FAST_RETRY)
                .listeners(
                    context -> {
                      throw new IllegalStateException("listener error");
                    },
                    recorder)
                .build();
    connectionManager.connect();
    assertThat(connectionManager).isReady();
    assertThat(recorder.states())
        .containsExactly(ConnectionState.CONNECTING, ConnectionState.READY);
  }

  @Test
  void closedSharedChannelShouldBeReplaced() throws Exception {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    ChannelHandle channel = connectionManager.currentChannel();
    broker.preDeclare(new QueueDecl("q", true, false));
    assertThatThrownBy(() -> channel.channel().declareQueue(new QueueDecl("q", false, false)))
        .isInstanceOf(BrokerConnection.ProtocolException.class);
    assertThat(channel.isOpen()).isFalse();

    ChannelHandle replacement = connectionManager.currentChannel();
    assertThat(replacement.isOpen()).isTrue();
    assertThat(replacement.generation()).isEqualTo(channel.generation());
    assertThat(connectionManager).isReady();
  }

  @Test
  void closeShouldBeIdempotentAndReleaseConnection() {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    connectionManager.close();
    connectionManager.close();
    assertThat(connectionManager).isClosed();
    assertThat(broker.openConnectionCount()).isZero();
    assertThat(recorder.states())
        .containsExactly(
            ConnectionState.CONNECTING, ConnectionState.READY, ConnectionState.CLOSED);
  }

  @Test
  void closeShouldStopRecovery() throws Exception {
    connectionManager = connectionManager(FAST_RETRY);
    connectionManager.connect();
    broker.stop();
    assertThat(connectionManager).hasState(ConnectionState.DEGRADED);
    connectionManager.close();
    assertThat(connectionManager).isClosed();
    broker.start();
    int attempts = broker.openAttempts();
    Thread.sleep(200);
    assertThat(broker.openAttempts()).isEqualTo(attempts);
    assertThat(broker.openConnectionCount()).isZero();
  }

  AmqpConnectionManager connectionManager(RetryPolicy retryPolicy) {
    return connectionManager(retryPolicy, ofSeconds(5));
  }

  AmqpConnectionManager connectionManager(RetryPolicy retryPolicy, Duration connectTimeout) {
    return (AmqpConnectionManager)
        new AmqpConnectionManagerBuilder()
            .brokerConnection(broker)
            .name(name)
            .retryPolicy(retryPolicy)
            .connectTimeout(connectTimeout)
            .listeners(recorder)
            .build();
  }
}
