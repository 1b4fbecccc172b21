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

import com.bender.mq.AmqpException;
import com.bender.mq.AmqpException.AmqpPublishFailedException;
import com.bender.mq.OutboundMessage;
import com.bender.mq.Publisher;
import com.bender.mq.RetryPolicy;
import com.bender.mq.StandardTopology;
import com.bender.mq.metrics.MetricsCollector;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher with its own channel.
 *
 * <p>The channel is replaced when it belongs to a previous connection generation. Sends are
 * serialized on the channel.
 */
final class AmqpPublisher implements Publisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpPublisher.class);

  private final AmqpConnectionManager connectionManager;
  private final RetryPolicy retryPolicy;
  private final MetricsCollector metricsCollector;
  private final ReentrantLock channelLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean standardTopologyDeclared = new AtomicBoolean(false);
  // guarded by channelLock
  private DefaultChannelHandle channel;

  AmqpPublisher(AmqpPublisherBuilder builder) {
    this.connectionManager = builder.connectionManager();
    this.retryPolicy = builder.retryPolicy();
    this.metricsCollector = this.connectionManager.metricsCollector();
    this.connectionManager.addResource(this);
    this.metricsCollector.openPublisher();
  }

  @Override
  public void publish(OutboundMessage message) {
    this.publish(message, null);
  }

  @Override
  public void publish(OutboundMessage message, Duration deadline) {
    if (message == null) {
      throw new IllegalArgumentException("Message cannot be null");
    }
    if (this.closed.get()) {
      throw new AmqpPublishFailedException(
          AmqpPublishFailedException.Reason.IO, "Publisher is closed", null);
    }
    long deadlineNanos = Utils.deadline(deadline);
    try {
      RetryUtils.callAndMaybeRetry(
          () -> {
            this.send(message, deadlineNanos);
            return null;
          },
          ExceptionUtils::isRetryable,
          this.retryPolicy,
          deadline,
          "Publishing to exchange '%s' with routing key '%s'",
          message.exchange(),
          message.routingKey());
    } catch (RuntimeException e) {
      this.metricsCollector.publishFailure();
      AmqpPublishFailedException.Reason reason =
          ExceptionUtils.isRetryable(e)
              ? AmqpPublishFailedException.Reason.TIMEOUT
              : AmqpPublishFailedException.Reason.IO;
      throw new AmqpPublishFailedException(
          reason,
          format(
              "Could not publish to exchange '%s' with routing key '%s' (reason: %s)",
              message.exchange(), message.routingKey(), RetryUtils.exceptionMessage(e)),
          e);
    }
    this.metricsCollector.publish();
  }

  @Override
  public void postToInfo(String routingKey, byte[] payload) {
    this.ensureStandardTopology();
    this.publish(StandardTopology.infoMessage(routingKey, payload));
  }

  @Override
  public void postTask(byte[] payload) {
    this.ensureStandardTopology();
    this.publish(StandardTopology.taskMessage(payload));
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.connectionManager.removeResource(this);
      this.channelLock.lock();
      try {
        this.closeChannel();
      } finally {
        this.channelLock.unlock();
      }
      this.metricsCollector.closePublisher();
    }
  }

  private void send(OutboundMessage message, long deadline) {
    this.channelLock.lock();
    try {
      if (this.closed.get()) {
        throw new AmqpException.AmqpResourceClosedException("Publisher is closed");
      }
      DefaultChannelHandle handle = this.channel;
      if (handle == null
          || !handle.isOpen()
          || !this.connectionManager.isCurrent(handle.generation())) {
        this.closeChannel();
        Duration timeout = RetryUtils.remaining(deadline, this.connectionManager.connectTimeout());
        handle = this.connectionManager.openChannel(timeout);
        handle.channel().addReturnCallback(this::returned);
        this.channel = handle;
        LOGGER.debug("Publisher opened channel for connection generation {}", handle.generation());
      }
      try {
        handle.channel().publish(message);
      } catch (IOException e) {
        this.channel = null;
        AmqpException exception =
            ExceptionUtils.convert(e, "Error while publishing to '%s'", message.exchange());
        if (ExceptionUtils.isLinkLost(exception)) {
          this.connectionManager.linkLost(handle.generation(), e);
        }
        throw exception;
      }
    } finally {
      this.channelLock.unlock();
    }
  }

  private void returned(int replyCode, String replyText, String exchange, String routingKey) {
    LOGGER.warn(
        "Message to exchange '{}' with routing key '{}' returned by the broker: {} {}",
        exchange,
        routingKey,
        replyCode,
        replyText);
    this.metricsCollector.publishReturned();
  }

  private void ensureStandardTopology() {
    if (!this.standardTopologyDeclared.get()) {
      this.connectionManager.topologyDeclarator().ensure(StandardTopology.all());
      this.standardTopologyDeclared.set(true);
    }
  }

  private void closeChannel() {
    if (this.channel != null) {
      Utils.maybeClose(
          this.channel.channel(),
          e -> LOGGER.debug("Error while closing publisher channel: {}", e.getMessage()));
      this.channel = null;
    }
  }
}
