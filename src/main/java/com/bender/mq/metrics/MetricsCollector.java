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
package com.bender.mq.metrics;

/** Interface to collect execution data of the library. */
public interface MetricsCollector {

  /** Called when a {@link com.bender.mq.ConnectionManager} gets its first connection. */
  void openConnection();

  /** Called when a connected {@link com.bender.mq.ConnectionManager} is closed. */
  void closeConnection();

  /** Called when a {@link com.bender.mq.ConnectionManager} has recovered its connection. */
  void recoverConnection();

  /** Called when a new {@link com.bender.mq.Publisher} is opened. */
  void openPublisher();

  /** Called when a {@link com.bender.mq.Publisher} is closed. */
  void closePublisher();

  /** Called when a new {@link com.bender.mq.Subscription} starts. */
  void openConsumer();

  /** Called when a {@link com.bender.mq.Subscription} is cancelled. */
  void closeConsumer();

  /** Called when a message is published. */
  void publish();

  /** Called when a message could not be published. */
  void publishFailure();

  /** Called when the broker returns a mandatory message it could not route. */
  void publishReturned();

  /** Called when a delivery is dispatched to a handler. */
  void consume();

  /**
   * Called when a delivery is settled.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** Called when a topology has been declared. */
  void declareTopology();

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** see {@link com.bender.mq.AckDecision#ack()} */
    ACKED,
    /** see {@link com.bender.mq.AckDecision#reject(boolean)} with requeue */
    REQUEUED,
    /** see {@link com.bender.mq.AckDecision#reject(boolean)} without requeue */
    DISCARDED
  }
}
