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

import java.time.Duration;

/**
 * Owner of the connection to the broker.
 *
 * <p>The connection manager opens the connection with retries, detects link loss, and reconnects
 * automatically. It is the entry point to get {@link TopologyDeclarator}, {@link Publisher}, and
 * {@link Consumer} instances. Instances are thread-safe.
 *
 * <p>States and transitions are described in {@link ConnectionState}.
 *
 * @see com.bender.mq.impl.AmqpConnectionManagerBuilder
 */
public interface ConnectionManager extends AutoCloseable {

  String name();

  ConnectionState state();

  /**
   * Connect to the broker.
   *
   * <p>The call blocks until the connection is ready or the retry budget is exhausted. It returns
   * immediately if the connection is already connecting, ready, or recovering.
   *
   * @throws AmqpException.AmqpConnectFailedException if the connection cannot be established or
   *     the manager is closed
   */
  void connect();

  /**
   * Get the shared channel, waiting at most the configured connect timeout.
   *
   * @return the shared channel
   * @see #currentChannel(Duration)
   */
  ChannelHandle currentChannel();

  /**
   * Get the shared channel.
   *
   * <p>The call waits for the connection to be ready. It starts a connection in the background if
   * the manager is not connected yet.
   *
   * @param timeout maximum time to wait
   * @return the shared channel
   * @throws AmqpException.AmqpResourceClosedException if the manager is closed
   * @throws AmqpException.AmqpNotReadyException if the connection is not ready before the timeout
   */
  ChannelHandle currentChannel(Duration timeout);

  /**
   * Register a listener called after each reconnection.
   *
   * <p>The listener is called synchronously, with the state lock held, before the manager becomes
   * ready again. It runs after topology recovery and consumer resubscription.
   *
   * @param listener the listener
   * @return registration to unregister the listener
   */
  Registration onReconnect(ReconnectListener listener);

  /**
   * The declarator of this connection manager.
   *
   * <p>Topology declared with it is recovered after reconnection.
   *
   * @return the topology declarator
   */
  TopologyDeclarator topologyDeclarator();

  PublisherBuilder publisherBuilder();

  ConsumerBuilder consumerBuilder();

  /** Close the connection and its resources. Idempotent. */
  @Override
  void close();

  /** Callback for reconnections. */
  @FunctionalInterface
  interface ReconnectListener {

    /**
     * Called when the connection has been re-established.
     *
     * @param channel the new shared channel
     */
    void reconnected(ChannelHandle channel);
  }

  /** Registration of a listener. */
  interface Registration {

    /** Unregister the listener. Idempotent. */
    void unregister();
  }

  /** Listener of state changes. */
  @FunctionalInterface
  interface StateListener {

    void handle(Context context);
  }

  /** Context of a state change. */
  interface Context {

    ConnectionManager connectionManager();

    /**
     * The cause of the state change, if any.
     *
     * @return failure cause, can be null
     */
    Throwable failureCause();

    ConnectionState previousState();

    ConnectionState currentState();

    /**
     * Generation of the connection the state change is about.
     *
     * <p>0 before the first connection. Each new connection, including recovered ones, gets the
     * next generation, so a transition to {@link ConnectionState#READY} with a greater generation
     * than the previous one means the broker connection has been replaced.
     *
     * @return the connection generation
     */
    long generation();
  }
}
