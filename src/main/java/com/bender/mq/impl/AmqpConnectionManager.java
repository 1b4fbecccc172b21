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

import static java.lang.String.format;

import com.bender.mq.Address;
import com.bender.mq.AmqpException;
import com.bender.mq.BrokerConnection;
import com.bender.mq.ChannelHandle;
import com.bender.mq.ConnectionManager;
import com.bender.mq.ConnectionState;
import com.bender.mq.ConsumerBuilder;
import com.bender.mq.Credentials;
import com.bender.mq.PublisherBuilder;
import com.bender.mq.RetryPolicy;
import com.bender.mq.TopologyDeclarator;
import com.bender.mq.metrics.MetricsCollector;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection lifecycle and recovery.
 *
 * <p>State transitions happen with {@link #lock} held. Callers waiting for a ready connection wait
 * on {@link #stateChanged}, which is signalled on every transition. Recovery runs on a dedicated
 * thread.
 *
 * <p>Reconnect listeners run with the lock held, before the transition to {@link
 * ConnectionState#READY}, ordered by phase: topology first, then subscriptions, then application
 * listeners. A listener that fails with a link loss aborts the recovery attempt, which is then
 * retried.
 */
final class AmqpConnectionManager implements ConnectionManager {

  static final int PHASE_TOPOLOGY = 0;
  static final int PHASE_SUBSCRIPTION = 10;
  static final int PHASE_APPLICATION = 20;

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConnectionManager.class);

  private final String name;
  private final BrokerConnection brokerConnection;
  private final Address address;
  private final Credentials credentials;
  private final RetryPolicy retryPolicy;
  private final Duration connectTimeout;
  private final MetricsCollector metricsCollector;
  private final StateEventSupport stateEventSupport;
  private final ExecutorService recoveryExecutor;
  private final AmqpTopologyDeclarator topologyDeclarator;
  private final List<ReconnectRegistration> reconnectListeners = new CopyOnWriteArrayList<>();
  private final List<AutoCloseable> resources = new CopyOnWriteArrayList<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition stateChanged = this.lock.newCondition();
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  // guarded by lock
  private BrokerConnection.RawConnection connection;
  private DefaultChannelHandle sharedChannel;
  private long generation = 0;
  private Throwable failureCause;
  private boolean everConnected = false;

  AmqpConnectionManager(AmqpConnectionManagerBuilder builder) {
    this.name = builder.name() == null ? Utils.NAME_SUPPLIER.get() : builder.name();
    this.brokerConnection = builder.brokerConnection();
    this.address = builder.address();
    this.credentials = builder.credentials();
    this.retryPolicy = builder.retryPolicy();
    this.connectTimeout = builder.connectTimeout();
    this.metricsCollector = builder.metricsCollector();
    this.stateEventSupport = new StateEventSupport(builder.listeners());
    this.recoveryExecutor =
        Executors.newSingleThreadExecutor(
            Utils.threadFactory("bender-mq-connection-" + this.name + "-"));
    this.topologyDeclarator =
        new AmqpTopologyDeclarator(this, this.retryPolicy, this.metricsCollector);
    this.register(PHASE_TOPOLOGY, this.topologyDeclarator::replay);
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public ConnectionState state() {
    return this.state;
  }

  @Override
  public void connect() {
    this.lock.lock();
    try {
      if (this.state == ConnectionState.CLOSED) {
        throw new AmqpException.AmqpConnectFailedException(
            format("Connection manager '%s' is closed", this.name), this.failureCause);
      } else if (this.state != ConnectionState.DISCONNECTED) {
        LOGGER.debug("Connection '{}' is {}, nothing to do", this.name, this.state);
        return;
      }
      this.transition(ConnectionState.CONNECTING, null);
    } finally {
      this.lock.unlock();
    }
    this.establish(true);
  }

  @Override
  public ChannelHandle currentChannel() {
    return this.currentChannel(this.connectTimeout);
  }

  @Override
  public ChannelHandle currentChannel(Duration timeout) {
    long deadline = Utils.deadline(timeout);
    this.lock.lock();
    try {
      while (true) {
        switch (this.state) {
          case CLOSED:
            throw new AmqpException.AmqpResourceClosedException(
                format("Connection manager '%s' is closed", this.name), this.failureCause);
          case DISCONNECTED:
            this.transition(ConnectionState.CONNECTING, null);
            this.recoveryExecutor.execute(() -> this.establish(false));
            break;
          case READY:
            DefaultChannelHandle handle = this.readySharedChannel();
            if (handle != null) {
              return handle;
            }
            break;
          default:
            break;
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          throw new AmqpException.AmqpNotReadyException(
              "Connection '%s' not ready after %d ms (state is %s)",
              this.name, Utils.capWait(timeout).toMillis(), this.state);
        }
        try {
          this.stateChanged.awaitNanos(remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new AmqpException.AmqpNotReadyException(
              format("Interrupted while waiting for connection '%s'", this.name), e);
        }
      }
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public Registration onReconnect(ReconnectListener listener) {
    return this.register(PHASE_APPLICATION, listener);
  }

  @Override
  public TopologyDeclarator topologyDeclarator() {
    return this.topologyDeclarator;
  }

  @Override
  public PublisherBuilder publisherBuilder() {
    return new AmqpPublisherBuilder(this);
  }

  @Override
  public ConsumerBuilder consumerBuilder() {
    return new AmqpConsumerBuilder(this);
  }

  @Override
  public void close() {
    this.doClose(null);
  }

  Registration register(int phase, ReconnectListener listener) {
    ReconnectRegistration registration = new ReconnectRegistration(phase, listener);
    this.runLocked(() -> this.reconnectListeners.add(registration));
    return registration;
  }

  /**
   * Report a link loss.
   *
   * <p>The report degrades the connection only if it concerns the current connection.
   *
   * @param generation generation of the connection the failure happened on
   * @param cause the failure
   */
  void linkLost(long generation, Throwable cause) {
    this.lock.lock();
    try {
      if (this.state == ConnectionState.READY && generation == this.generation) {
        this.markDegraded(cause);
      } else {
        LOGGER.debug(
            "Ignoring link loss report for generation {} of connection '{}' "
                + "(current generation is {}, state is {})",
            generation,
            this.name,
            this.generation,
            this.state);
      }
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Open a dedicated channel, waiting for the connection to be ready.
   *
   * @param timeout maximum time to wait for the connection
   * @return the new channel
   */
  DefaultChannelHandle openChannel(Duration timeout) {
    this.lock.lock();
    try {
      this.currentChannel(timeout);
      return this.openChannelOnCurrentConnection();
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Open a channel on the current connection, whatever the state.
   *
   * <p>Used by reconnect listeners, before the connection is ready.
   *
   * @return the new channel
   */
  DefaultChannelHandle openChannelOnCurrentConnection() {
    this.lock.lock();
    try {
      if (this.connection == null) {
        throw new AmqpException.AmqpNotReadyException(
            "Connection '%s' is not established", this.name);
      }
      long currentGeneration = this.generation;
      try {
        return new DefaultChannelHandle(this.connection.openChannel(), currentGeneration);
      } catch (IOException e) {
        AmqpException exception =
            ExceptionUtils.convert(e, "Error while opening channel on connection '%s'", this.name);
        if (ExceptionUtils.isLinkLost(exception)) {
          this.linkLost(currentGeneration, e);
        }
        throw exception;
      }
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Whether a channel of the given generation belongs to the ready connection.
   *
   * @param generation the generation of the channel
   * @return true if the channel is usable
   */
  boolean isCurrent(long generation) {
    this.lock.lock();
    try {
      return this.state == ConnectionState.READY && this.generation == generation;
    } finally {
      this.lock.unlock();
    }
  }

  void runLocked(Runnable task) {
    this.lock.lock();
    try {
      task.run();
    } finally {
      this.lock.unlock();
    }
  }

  <T> T callLocked(Supplier<T> task) {
    this.lock.lock();
    try {
      return task.get();
    } finally {
      this.lock.unlock();
    }
  }

  void addResource(AutoCloseable resource) {
    this.resources.add(resource);
  }

  void removeResource(AutoCloseable resource) {
    this.resources.remove(resource);
  }

  RetryPolicy retryPolicy() {
    return this.retryPolicy;
  }

  Duration connectTimeout() {
    return this.connectTimeout;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  /**
   * Generation of the current connection, or of the last one if the connection is lost.
   *
   * @return the generation, 0 before the first connection
   */
  long generation() {
    this.lock.lock();
    try {
      return this.generation;
    } finally {
      this.lock.unlock();
    }
  }

  private void establish(boolean throwOnFailure) {
    try {
      RetryUtils.callAndMaybeRetry(
          () -> {
            this.openConnection();
            return null;
          },
          e -> ExceptionUtils.isLinkLost(e) && this.state != ConnectionState.CLOSED,
          this.retryPolicy,
          "Connection '%s' to %s",
          this.name,
          this.address);
      LOGGER.debug("Connection '{}' to {} established", this.name, this.address);
    } catch (RuntimeException e) {
      this.doClose(e);
      String message = format("Could not connect '%s' to %s", this.name, this.address);
      if (throwOnFailure) {
        throw new AmqpException.AmqpConnectFailedException(message, e);
      } else {
        LOGGER.warn("{}: {}", message, RetryUtils.exceptionMessage(e));
      }
    }
  }

  private void recover(BrokerConnection.RawConnection lostConnection) {
    Utils.maybeClose(
        lostConnection,
        e ->
            LOGGER.debug(
                "Error while closing lost connection '{}': {}", this.name, e.getMessage()));
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    try {
      RetryUtils.callAndMaybeRetry(
          () -> {
            this.openConnection();
            return null;
          },
          e -> ExceptionUtils.isLinkLost(e) && this.state != ConnectionState.CLOSED,
          this.retryPolicy,
          "Recovery of connection '%s'",
          this.name);
      LOGGER.info(
          "Connection '{}' to {} recovered in {} ms",
          this.name,
          this.address,
          stopWatch.stop().toMillis());
    } catch (RuntimeException e) {
      if (this.state != ConnectionState.CLOSED) {
        LOGGER.warn("Could not recover connection '{}', closing it", this.name, e);
        this.doClose(e);
      }
    }
  }

  private void openConnection() throws InterruptedException {
    Utils.throwIfInterrupted();
    BrokerConnection.RawConnection newConnection;
    try {
      newConnection = this.brokerConnection.open(this.address, this.credentials);
    } catch (IOException e) {
      throw ExceptionUtils.convert(e, "Error while opening connection to %s", this.address);
    }
    BrokerConnection.RawChannel channel;
    try {
      channel = newConnection.openChannel();
    } catch (IOException e) {
      this.closeQuietly(newConnection);
      throw ExceptionUtils.convert(e, "Error while opening channel on %s", this.address);
    }
    this.lock.lock();
    try {
      if (this.state == ConnectionState.CLOSED) {
        this.closeQuietly(newConnection);
        throw new AmqpException.AmqpResourceClosedException(
            format("Connection manager '%s' has been closed", this.name));
      }
      long newGeneration = ++this.generation;
      this.connection = newConnection;
      this.sharedChannel = new DefaultChannelHandle(channel, newGeneration);
      newConnection.addDisconnectListener(e -> this.linkLost(newGeneration, e));
      if (this.state == ConnectionState.DEGRADED) {
        try {
          this.dispatchReconnect(this.sharedChannel);
        } catch (AmqpException e) {
          this.connection = null;
          this.sharedChannel = null;
          this.closeQuietly(newConnection);
          throw e;
        }
        this.metricsCollector.recoverConnection();
      } else if (!this.everConnected) {
        this.everConnected = true;
        this.metricsCollector.openConnection();
      }
      this.transition(ConnectionState.READY, null);
      if (!newConnection.isOpen()) {
        this.markDegraded(
            new BrokerConnection.LinkLostException("Connection closed during establishment"));
      }
    } finally {
      this.lock.unlock();
    }
  }

  private DefaultChannelHandle readySharedChannel() {
    if (!this.connection.isOpen()) {
      this.markDegraded(new BrokerConnection.LinkLostException("Connection is closed"));
      return null;
    }
    if (!this.sharedChannel.isOpen()) {
      LOGGER.debug("Shared channel of connection '{}' is closed, opening a new one", this.name);
      try {
        this.sharedChannel =
            new DefaultChannelHandle(this.connection.openChannel(), this.generation);
      } catch (IOException e) {
        AmqpException exception =
            ExceptionUtils.convert(e, "Error while opening shared channel of '%s'", this.name);
        if (ExceptionUtils.isLinkLost(exception)) {
          this.markDegraded(e);
          return null;
        }
        throw exception;
      }
    }
    return this.sharedChannel;
  }

  private void markDegraded(Throwable cause) {
    LOGGER.info(
        "Connection '{}' to {} has been lost ({}), starting recovery",
        this.name,
        this.address,
        cause == null ? "unknown reason" : cause.getMessage());
    BrokerConnection.RawConnection lostConnection = this.connection;
    this.connection = null;
    this.sharedChannel = null;
    this.transition(ConnectionState.DEGRADED, cause);
    try {
      this.recoveryExecutor.execute(() -> this.recover(lostConnection));
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Recovery task of connection '{}' rejected", this.name);
    }
  }

  private void dispatchReconnect(ChannelHandle channel) {
    List<ReconnectRegistration> listeners = new ArrayList<>(this.reconnectListeners);
    listeners.sort(Comparator.comparingInt(r -> r.phase));
    LOGGER.debug(
        "Calling {} reconnect listener(s) of connection '{}'", listeners.size(), this.name);
    for (ReconnectRegistration registration : listeners) {
      try {
        registration.listener.reconnected(channel);
      } catch (AmqpException.AmqpConnectionException e) {
        LOGGER.info(
            "Connection '{}' lost again during recovery, restarting recovery", this.name);
        throw e;
      } catch (Exception e) {
        LOGGER.warn("Error in reconnect listener of connection '{}'", this.name, e);
      }
    }
  }

  private void doClose(Throwable cause) {
    BrokerConnection.RawConnection connectionToClose;
    this.lock.lock();
    try {
      if (this.state == ConnectionState.CLOSED) {
        return;
      }
      connectionToClose = this.connection;
      this.connection = null;
      this.sharedChannel = null;
      this.transition(ConnectionState.CLOSED, cause);
    } finally {
      this.lock.unlock();
    }
    for (AutoCloseable resource : new ArrayList<>(this.resources)) {
      Utils.maybeClose(
          resource,
          e -> LOGGER.info("Error while closing resource of connection '{}'", this.name, e));
    }
    this.resources.clear();
    this.closeQuietly(connectionToClose);
    this.recoveryExecutor.shutdownNow();
    if (this.everConnected) {
      this.metricsCollector.closeConnection();
    }
    LOGGER.debug("Connection manager '{}' closed", this.name);
  }

  private void transition(ConnectionState newState, Throwable cause) {
    ConnectionState previousState = this.state;
    if (!previousState.canTransitionTo(newState)) {
      throw new IllegalStateException(
          format(
              "Illegal transition from %s to %s for connection '%s'",
              previousState, newState, this.name));
    }
    this.state = newState;
    if (cause != null) {
      this.failureCause = cause;
    }
    LOGGER.debug("Connection '{}': {} -> {}", this.name, previousState, newState);
    this.stateChanged.signalAll();
    this.stateEventSupport.dispatch(this, this.generation, cause, previousState, newState);
  }

  private void closeQuietly(BrokerConnection.RawConnection c) {
    Utils.maybeClose(
        c, e -> LOGGER.debug("Error while closing connection '{}': {}", this.name, e.getMessage()));
  }

  @Override
  public String toString() {
    return "ConnectionManager{name='" + name + "', address=" + address + ", state=" + state + '}';
  }

  private final class ReconnectRegistration implements Registration {

    private final int phase;
    private final ReconnectListener listener;

    private ReconnectRegistration(int phase, ReconnectListener listener) {
      this.phase = phase;
      this.listener = listener;
    }

    @Override
    public void unregister() {
      runLocked(() -> reconnectListeners.remove(this));
    }
  }
}
