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

import java.util.Objects;

/** Binding between an exchange and a queue. */
public final class BindingDecl {

  private final String queue;
  private final String exchange;
  private final String routingKey;

  public BindingDecl(String queue, String exchange, String routingKey) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.exchange = Objects.requireNonNull(exchange, "exchange");
    this.routingKey = routingKey == null ? "" : routingKey;
  }

  public String queue() {
    return this.queue;
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BindingDecl that = (BindingDecl) o;
    return queue.equals(that.queue)
        && exchange.equals(that.exchange)
        && routingKey.equals(that.routingKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(queue, exchange, routingKey);
  }

  @Override
  public String toString() {
    return "BindingDecl{"
        + "queue='"
        + queue
        + '\''
        + ", exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + '}';
  }
}
