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

import com.bender.mq.AckDecision;
import com.bender.mq.AmqpException;
import com.bender.mq.ChannelHandle;
import com.bender.mq.ConnectionManager;
import com.bender.mq.ConnectionState;
import com.bender.mq.Consumer;
import com.bender.mq.InboundDelivery;
import com.bender.mq.Subscription;
import com.bender.mq.TopologySpec;
import com.bender.mq.metrics.MetricsCollector;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscription with its own channel and its own dispatching thread.
 *
 * <p>Subscribing, resubscribing, and cancelling happen with the lock of the connection manager
 * held, so a cancelled subscription is never resubscribed.
 */
final class AmqpSubscription implements Subscription {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpSubscription.class);

  private final AmqpConnectionManager connectionManager;
  private final AmqpConsumer consumer;
  private final TopologySpec topology;
  private final String queue;
  private final Consumer.DeliveryHandler handler;
  private final MetricsCollector metricsCollector;
  private final ExecutorService dispatcher;
  private final Set<PendingDelivery> pending = ConcurrentHashMap.newKeySet();
  private volatile boolean active = true;
  private volatile DefaultChannelHandle channel;
  private volatile String consumerTag;
  private volatile Thread dispatcherThread;
  private volatile ConnectionManager.Registration registration;

  AmqpSubscription(
      AmqpConnectionManager connectionManager,
      AmqpConsumer consumer,
      TopologySpec topology,
      String queue,
      Consumer.DeliveryHandler handler) {
    this.connectionManager = connectionManager;
    this.consumer = consumer;
    this.topology = topology;
    this.queue = queue;
    this.handler = handler;
    this.metricsCollector = connectionManager.metricsCollector();
    this.dispatcher =
        Executors.newSingleThreadExecutor(
            Utils.threadFactory("bender-mq-consumer-" + queue + "-"));
  }

  void start() {
    try {
      RetryUtils.callAndMaybeRetry(
          () -> {
            this.subscribeOnce();
            return null;
          },
          ExceptionUtils::isRetryable,
          this.connectionManager.retryPolicy(),
          "Subscription to queue '%s'",
          this.queue);
    } catch (RuntimeException e) {
      this.active = false;
      this.dispatcher.shutdownNow();
      throw e;
    }
    this.metricsCollector.openConsumer();
  }

  @Override
  public String queue() {
    return this.queue;
  }

  @Override
  public boolean isActive() {
    return this.active;
  }

  @Override
  public int pendingCount() {
    return this.pending.size();
  }

  @Override
  public void cancel() {
    boolean wasActive =
        this.connectionManager.callLocked(
            () -> {
              if (!this.active) {
                return false;
              }
              this.active = false;
              if (this.registration != null) {
                this.registration.unregister();
              }
              return true;
            });
    if (!wasActive) {
      return;
    }
    DefaultChannelHandle handle = this.channel;
    String tag = this.consumerTag;
    if (handle != null && handle.isOpen() && tag != null) {
      try {
        handle.channel().cancel(tag);
      } catch (IOException e) {
        LOGGER.debug("Error while cancelling subscription to '{}': {}", this.queue, e.getMessage());
      }
    }
    this.dispatcher.shutdown();
    if (Thread.currentThread() != this.dispatcherThread) {
      try {
        long timeout = Utils.capWait(this.connectionManager.connectTimeout()).toMillis();
        if (!this.dispatcher.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
          LOGGER.info(
              "Handler of subscription to '{}' still running after {} ms", this.queue, timeout);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    this.closeChannel(handle);
    this.consumer.remove(this);
    this.metricsCollector.closeConsumer();
    LOGGER.debug("Subscription to queue '{}' cancelled", this.queue);
  }

  void settle(PendingDelivery pendingDelivery, AckDecision decision) {
    pendingDelivery.settle();
    this.pending.remove(pendingDelivery);
    DefaultChannelHandle handle = pendingDelivery.channel();
    long tag = pendingDelivery.deliveryTag();
    if (!handle.isOpen() || !this.connectionManager.isCurrent(pendingDelivery.generation())) {
      LOGGER.debug(
          "Not settling delivery {} of connection generation {}, it will be redelivered",
          tag,
          pendingDelivery.generation());
      return;
    }
    try {
      if (decision.isAck()) {
        handle.channel().ack(tag);
        this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.ACKED);
      } else {
        handle.channel().reject(tag, decision.requeue());
        this.metricsCollector.consumeDisposition(
            decision.requeue()
                ? MetricsCollector.ConsumeDisposition.REQUEUED
                : MetricsCollector.ConsumeDisposition.DISCARDED);
      }
    } catch (IOException e) {
      AmqpException exception =
          ExceptionUtils.convert(e, "Error while settling delivery %d on '%s'", tag, this.queue);
      if (ExceptionUtils.isLinkLost(exception)) {
        LOGGER.debug("Link lost while settling delivery {}, it will be redelivered", tag);
        this.connectionManager.linkLost(pendingDelivery.generation(), e);
      } else {
        LOGGER.warn(exception.getMessage());
      }
    }
  }

  private void subscribeOnce() {
    this.connectionManager.currentChannel();
    this.connectionManager.runLocked(
        () -> {
          if (this.connectionManager.state() != ConnectionState.READY) {
            throw new AmqpException.AmqpNotReadyException(
                "Connection '%s' is not ready", this.connectionManager.name());
          }
          this.consumeOn(this.connectionManager.openChannelOnCurrentConnection());
          this.registration =
              this.connectionManager.register(
                  AmqpConnectionManager.PHASE_SUBSCRIPTION, this::resubscribe);
        });
  }

  private void resubscribe(ChannelHandle sharedChannel) {
    if (!this.active) {
      return;
    }
    DefaultChannelHandle previous = this.channel;
    this.channel = null;
    this.closeChannel(previous);
    try {
      this.consumeOn(this.connectionManager.openChannelOnCurrentConnection());
      LOGGER.debug(
          "Subscription to queue '{}' recovered on connection generation {}",
          this.queue,
          sharedChannel.generation());
    } catch (AmqpException.AmqpConnectionException e) {
      throw e;
    } catch (AmqpException e) {
      this.deactivate(e);
    }
  }

  private void onBrokerCancel(DefaultChannelHandle handle, String tag) {
    if (!this.active || handle != this.channel) {
      return;
    }
    LOGGER.info(
        "Consumer {} on queue '{}' cancelled by the broker, subscribing again", tag, this.queue);
    try {
      this.dispatcher.execute(() -> this.resubscribeAfterBrokerCancel(handle));
    } catch (RejectedExecutionException e) {
      LOGGER.debug(
          "Subscription to queue '{}' is shutting down, not subscribing again", this.queue);
    }
  }

  private void resubscribeAfterBrokerCancel(DefaultChannelHandle cancelled) {
    try {
      RetryUtils.callAndMaybeRetry(
          () -> {
            this.connectionManager.topologyDeclarator().ensure(this.topology);
            this.connectionManager.runLocked(
                () -> {
                  if (this.active && this.channel == cancelled) {
                    this.consumeOn(this.connectionManager.openChannelOnCurrentConnection());
                    this.closeChannel(cancelled);
                    LOGGER.debug("Subscription to queue '{}' restored", this.queue);
                  }
                });
            return null;
          },
          e -> this.active && ExceptionUtils.isRetryable(e),
          this.connectionManager.retryPolicy(),
          "Subscription to queue '%s' after cancellation",
          this.queue);
    } catch (RuntimeException e) {
      AmqpException cause =
          e instanceof AmqpException
              ? (AmqpException) e
              : new AmqpException("Error while subscribing to queue '" + this.queue + "'", e);
      this.connectionManager.runLocked(
          () -> {
            if (this.active && this.channel == cancelled) {
              this.deactivate(cause);
            }
          });
    }
  }

  // called with the lock of the connection manager held
  private void deactivate(AmqpException cause) {
    LOGGER.warn(
        "Could not recover subscription to queue '{}', cancelling it: {}",
        this.queue,
        cause.getMessage());
    this.active = false;
    if (this.registration != null) {
      this.registration.unregister();
    }
    this.closeChannel(this.channel);
    this.dispatcher.shutdown();
    this.consumer.remove(this);
    this.metricsCollector.closeConsumer();
    this.consumer.subscriptionFailed(this, cause);
  }

  private void consumeOn(DefaultChannelHandle handle) {
    try {
      String tag =
          handle
              .channel()
              .consume(
                  this.queue,
                  delivery -> this.onDelivery(handle, delivery),
                  cancelledTag -> this.onBrokerCancel(handle, cancelledTag));
      this.channel = handle;
      this.consumerTag = tag;
    } catch (IOException e) {
      this.closeChannel(handle);
      AmqpException exception =
          ExceptionUtils.convert(e, "Error while subscribing to queue '%s'", this.queue);
      if (ExceptionUtils.isLinkLost(exception)) {
        this.connectionManager.linkLost(handle.generation(), e);
      }
      throw exception;
    }
  }

  private void onDelivery(DefaultChannelHandle handle, InboundDelivery delivery) {
    if (!this.active) {
      try {
        handle.channel().reject(delivery.deliveryTag(), true);
      } catch (IOException e) {
        LOGGER.debug(
            "Error while requeuing delivery {} of cancelled subscription: {}",
            delivery.deliveryTag(),
            e.getMessage());
      }
      return;
    }
    PendingDelivery pendingDelivery = new PendingDelivery(handle, delivery);
    this.pending.add(pendingDelivery);
    this.metricsCollector.consume();
    try {
      this.dispatcher.execute(() -> this.dispatch(pendingDelivery));
    } catch (RejectedExecutionException e) {
      this.settle(pendingDelivery, AckDecision.reject(true));
    }
  }

  private void dispatch(PendingDelivery pendingDelivery) {
    this.dispatcherThread = Thread.currentThread();
    long tag = pendingDelivery.deliveryTag();
    AckDecision decision;
    Throwable failure = null;
    try {
      decision = this.handler.handle(pendingDelivery.delivery());
    } catch (Throwable e) {
      decision = null;
      failure = e;
    }
    if (decision == null) {
      decision = AckDecision.reject(true);
      String message =
          failure == null
              ? format("Handler returned no decision for delivery %d from '%s'", tag, this.queue)
              : format("Handler failed for delivery %d from '%s'", tag, this.queue);
      this.consumer.handlerFailed(new AmqpException.AmqpHandlerException(tag, message, failure));
    }
    this.settle(pendingDelivery, decision);
  }

  private void closeChannel(DefaultChannelHandle handle) {
    if (handle != null) {
      Utils.maybeClose(
          handle.channel(),
          e ->
              LOGGER.debug(
                  "Error while closing channel of subscription to '{}': {}",
                  this.queue,
                  e.getMessage()));
    }
  }

  @Override
  public String toString() {
    return "Subscription{queue='"
        + queue
        + "', topology="
        + topology
        + ", active="
        + active
        + '}';
  }
}
