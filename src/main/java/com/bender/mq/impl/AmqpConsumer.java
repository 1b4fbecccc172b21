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

import com.bender.mq.AmqpException;
import com.bender.mq.Consumer;
import com.bender.mq.Subscription;
import com.bender.mq.TopologySpec;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpConsumer implements Consumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConsumer.class);

  static final ErrorObserver LOGGING_ERROR_OBSERVER =
      e ->
          LOGGER.warn(
              "Handler failed for delivery {}, delivery has been requeued",
              e.deliveryTag(),
              e.getCause() == null ? e : e.getCause());

  private final AmqpConnectionManager connectionManager;
  private final ErrorObserver errorObserver;
  private final List<AmqpSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  AmqpConsumer(AmqpConsumerBuilder builder) {
    this.connectionManager = builder.connectionManager();
    this.errorObserver = builder.errorObserver();
    this.connectionManager.addResource(this);
  }

  @Override
  public Subscription subscribe(TopologySpec topology, String queue, DeliveryHandler handler) {
    if (queue == null || queue.isEmpty()) {
      throw new IllegalArgumentException("Queue cannot be null or empty");
    }
    if (handler == null) {
      throw new IllegalArgumentException("Handler cannot be null");
    }
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException("Consumer is closed");
    }
    this.connectionManager.topologyDeclarator().ensure(topology);
    AmqpSubscription subscription =
        new AmqpSubscription(this.connectionManager, this, topology, queue, handler);
    subscription.start();
    this.subscriptions.add(subscription);
    LOGGER.debug("Subscribed to queue '{}'", queue);
    return subscription;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.connectionManager.removeResource(this);
      for (AmqpSubscription subscription : new ArrayList<>(this.subscriptions)) {
        try {
          subscription.cancel();
        } catch (Exception e) {
          LOGGER.info("Error while cancelling subscription to '{}'", subscription.queue(), e);
        }
      }
    }
  }

  void handlerFailed(AmqpException.AmqpHandlerException exception) {
    try {
      this.errorObserver.onError(exception);
    } catch (Exception e) {
      LOGGER.warn("Error in consumer error observer", e);
    }
  }

  void subscriptionFailed(AmqpSubscription subscription, AmqpException cause) {
    try {
      this.errorObserver.onSubscriptionFailed(subscription, cause);
    } catch (Exception e) {
      LOGGER.warn("Error in consumer error observer", e);
    }
  }

  void remove(AmqpSubscription subscription) {
    this.subscriptions.remove(subscription);
  }

  int subscriptionCount() {
    return this.subscriptions.size();
  }
}
