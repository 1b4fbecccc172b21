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
 * Predefined exchanges and queues.
 *
 * <ul>
 *   <li>{@code info-topic}: durable topic exchange, bound to the {@code info} queue with {@code #}
 *   <li>{@code task}: durable direct exchange, bound to the {@code tasks} queue with {@code tasks}
 * </ul>
 */
public final class StandardTopology {

  public static final String INFO_EXCHANGE = "info-topic";
  public static final String INFO_QUEUE = "info";
  public static final String TASK_EXCHANGE = "task";
  public static final String TASK_QUEUE = "tasks";
  public static final String TASK_ROUTING_KEY = "tasks";
  public static final String CONTENT_TYPE = "text";

  private static final TopologySpec INFO =
      TopologySpec.builder()
          .exchange(INFO_EXCHANGE, ExchangeDecl.Type.TOPIC, true)
          .queue(INFO_QUEUE, true, false)
          .binding(INFO_QUEUE, INFO_EXCHANGE, "#")
          .build();

  private static final TopologySpec TASK =
      TopologySpec.builder()
          .exchange(TASK_EXCHANGE, ExchangeDecl.Type.DIRECT, true)
          .queue(TASK_QUEUE, true, false)
          .binding(TASK_QUEUE, TASK_EXCHANGE, TASK_ROUTING_KEY)
          .build();

  private static final TopologySpec ALL = TopologySpec.builder().add(INFO).add(TASK).build();

  private StandardTopology() {}

  public static TopologySpec info() {
    return INFO;
  }

  public static TopologySpec task() {
    return TASK;
  }

  public static TopologySpec all() {
    return ALL;
  }

  public static OutboundMessage infoMessage(String routingKey, byte[] payload) {
    return OutboundMessage.builder(INFO_EXCHANGE, routingKey)
        .payload(payload)
        .contentType(CONTENT_TYPE)
        .mandatory(true)
        .build();
  }

  public static OutboundMessage taskMessage(byte[] payload) {
    return OutboundMessage.builder(TASK_EXCHANGE, TASK_ROUTING_KEY)
        .payload(payload)
        .contentType(CONTENT_TYPE)
        .mandatory(true)
        .build();
  }
}
