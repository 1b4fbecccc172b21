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

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * API to send messages.
 *
 * <p>A publisher uses its own channel. Instances are thread-safe.
 */
public interface Publisher extends AutoCloseable {

  /**
   * Publish a message.
   *
   * <p>The publish is retried on link loss, within the limits of the retry policy. A successful
   * return means the broker received the message once. There is no publisher confirm.
   *
   * @param message the message
   * @throws AmqpException.AmqpPublishFailedException if the message cannot be sent
   */
  void publish(OutboundMessage message);

  /**
   * Publish a message, retrying at most until the deadline.
   *
   * @param message the message
   * @param deadline maximum time to spend on the call
   * @throws AmqpException.AmqpPublishFailedException if the message cannot be sent
   */
  void publish(OutboundMessage message, Duration deadline);

  /**
   * Publish a text message to the {@code info-topic} exchange.
   *
   * @param routingKey the routing key
   * @param payload the message body
   * @see StandardTopology
   */
  void postToInfo(String routingKey, byte[] payload);

  default void postToInfo(String routingKey, String payload) {
    postToInfo(routingKey, payload.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Publish a text message to the {@code task} exchange.
   *
   * @param payload the message body
   * @see StandardTopology
   */
  void postTask(byte[] payload);

  /** Close the publisher and release its channel. */
  @Override
  void close();
}
