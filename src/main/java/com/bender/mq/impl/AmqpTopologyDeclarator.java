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
import com.bender.mq.BindingDecl;
import com.bender.mq.ChannelHandle;
import com.bender.mq.ExchangeDecl;
import com.bender.mq.QueueDecl;
import com.bender.mq.RetryPolicy;
import com.bender.mq.TopologyDeclarator;
import com.bender.mq.TopologySpec;
import com.bender.mq.metrics.MetricsCollector;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpTopologyDeclarator implements TopologyDeclarator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpTopologyDeclarator.class);

  private final AmqpConnectionManager connectionManager;
  private final RetryPolicy retryPolicy;
  private final MetricsCollector metricsCollector;
  private final TopologyRecord record = new TopologyRecord();

  AmqpTopologyDeclarator(
      AmqpConnectionManager connectionManager,
      RetryPolicy retryPolicy,
      MetricsCollector metricsCollector) {
    this.connectionManager = connectionManager;
    this.retryPolicy = retryPolicy;
    this.metricsCollector = metricsCollector;
  }

  @Override
  public void ensure(TopologySpec topology) {
    if (topology == null || topology.isEmpty()) {
      return;
    }
    try {
      RetryUtils.callAndMaybeRetry(
          () -> {
            this.declareAndRecord(topology);
            return null;
          },
          ExceptionUtils::isRetryable,
          this.retryPolicy,
          "Declaration of %s",
          topology);
    } catch (AmqpException.AmqpDeclareFailedException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new AmqpException.AmqpDeclareFailedException(
          format("Could not declare %s (reason: %s)", topology, RetryUtils.exceptionMessage(e)),
          e);
    }
    this.metricsCollector.declareTopology();
  }

  @Override
  public TopologySpec recorded() {
    return this.record.snapshot();
  }

  void replay(ChannelHandle channel) {
    if (this.record.isEmpty()) {
      LOGGER.debug("No topology to recover");
      return;
    }
    TopologySpec topology = this.record.snapshot();
    LOGGER.debug(
        "Recovering topology: {} exchange(s), {} queue(s), {} binding(s)",
        topology.exchanges().size(),
        topology.queues().size(),
        topology.bindings().size());
    try {
      this.declare(channel, topology);
    } catch (AmqpException.AmqpConnectionException e) {
      throw e;
    } catch (AmqpException e) {
      LOGGER.warn("Error while recovering topology: {}", e.getMessage());
    }
  }

  // The declaration is recorded only if the connection it went to is still the current one.
  // Otherwise a recovery may have replayed the record before this declaration was in it.
  private void declareAndRecord(TopologySpec topology) {
    ChannelHandle channel = this.connectionManager.currentChannel();
    this.declare(channel, topology);
    boolean recorded =
        this.connectionManager.callLocked(
            () -> {
              if (this.connectionManager.isCurrent(channel.generation())) {
                this.record.record(topology);
                return true;
              }
              return false;
            });
    if (!recorded) {
      LOGGER.debug(
          "Connection changed while declaring {} on generation {}, declaring again",
          topology,
          channel.generation());
      throw new AmqpException.AmqpConnectionException(
          "Connection recovered while declaring %s", topology);
    }
  }

  private void declare(ChannelHandle channel, TopologySpec topology) {
    String current = null;
    try {
      for (ExchangeDecl exchange : topology.exchanges()) {
        current = "exchange '" + exchange.name() + "'";
        channel.channel().declareExchange(exchange);
      }
      for (QueueDecl queue : topology.queues()) {
        current = "queue '" + queue.name() + "'";
        channel.channel().declareQueue(queue);
      }
      for (BindingDecl binding : topology.bindings()) {
        current = binding.toString();
        channel.channel().declareBinding(binding);
      }
    } catch (IOException e) {
      AmqpException exception = ExceptionUtils.convert(e, "Error while declaring %s", current);
      if (ExceptionUtils.isConflict(exception)) {
        throw new AmqpException.AmqpTopologyConflictException(
            format(
                "Declaration of %s conflicts with an existing entity (%s)",
                current, e.getMessage()),
            e);
      } else if (ExceptionUtils.isLinkLost(exception)) {
        this.connectionManager.linkLost(channel.generation(), e);
        throw exception;
      } else {
        throw new AmqpException.AmqpDeclareFailedException(exception.getMessage(), exception);
      }
    }
  }
}
