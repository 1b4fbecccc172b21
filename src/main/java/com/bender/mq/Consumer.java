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

/**
 * API to receive messages.
 *
 * <p>A consumer can have several subscriptions. Each subscription has its own channel and runs its
 * handler on its own thread. Subscriptions are re-established after reconnection.
 */
public interface Consumer extends AutoCloseable {

  /**
   * Declare a topology and start consuming from a queue.
   *
   * @param topology the topology to declare first, can be empty
   * @param queue the queue to consume from
   * @param handler the delivery handler
   * @return the subscription
   * @throws AmqpException.AmqpDeclareFailedException if the topology cannot be declared
   * @throws AmqpException.AmqpNotReadyException if the connection is not ready in time
   */
  Subscription subscribe(TopologySpec topology, String queue, DeliveryHandler handler);

  /** Cancel all the subscriptions. */
  @Override
  void close();

  /** Application callback for deliveries. */
  @FunctionalInterface
  interface DeliveryHandler {

    /**
     * Process a delivery.
     *
     * <p>A handler that throws (an exception or an error) or returns null gets its delivery
     * rejected and requeued.
     *
     * @param delivery the delivery
     * @return the decision to send to the broker
     */
    AckDecision handle(InboundDelivery delivery);
  }

  /** Callback for handler failures. */
  @FunctionalInterface
  interface ErrorObserver {

    void onError(AmqpException.AmqpHandlerException exception);

    /**
     * Called when a subscription stops because it could not be re-established, after a
     * reconnection or a cancellation by the broker. The subscription is no longer active.
     *
     * <p>Does nothing by default, the failure is logged anyway.
     *
     * @param subscription the subscription
     * @param cause the failure
     */
    default void onSubscriptionFailed(Subscription subscription, AmqpException cause) {}
  }
}
