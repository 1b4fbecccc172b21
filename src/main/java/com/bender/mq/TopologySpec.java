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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of exchanges, queues, and bindings to declare.
 *
 * <p>Declaration order is preserved. Identical declarations appear only once.
 *
 * @see TopologyDeclarator#ensure(TopologySpec)
 */
public final class TopologySpec {

  private static final TopologySpec EMPTY = new Builder().build();

  private final List<ExchangeDecl> exchanges;
  private final List<QueueDecl> queues;
  private final List<BindingDecl> bindings;

  private TopologySpec(
      List<ExchangeDecl> exchanges, List<QueueDecl> queues, List<BindingDecl> bindings) {
    this.exchanges = Collections.unmodifiableList(exchanges);
    this.queues = Collections.unmodifiableList(queues);
    this.bindings = Collections.unmodifiableList(bindings);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static TopologySpec empty() {
    return EMPTY;
  }

  public List<ExchangeDecl> exchanges() {
    return this.exchanges;
  }

  public List<QueueDecl> queues() {
    return this.queues;
  }

  public List<BindingDecl> bindings() {
    return this.bindings;
  }

  public boolean isEmpty() {
    return this.exchanges.isEmpty() && this.queues.isEmpty() && this.bindings.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TopologySpec that = (TopologySpec) o;
    return exchanges.equals(that.exchanges)
        && queues.equals(that.queues)
        && bindings.equals(that.bindings);
  }

  @Override
  public int hashCode() {
    return Objects.hash(exchanges, queues, bindings);
  }

  @Override
  public String toString() {
    return "TopologySpec{"
        + "exchanges="
        + exchanges
        + ", queues="
        + queues
        + ", bindings="
        + bindings
        + '}';
  }

  /** Builder for {@link TopologySpec}. */
  public static final class Builder {

    private final Map<String, ExchangeDecl> exchanges = new LinkedHashMap<>();
    private final Map<String, QueueDecl> queues = new LinkedHashMap<>();
    private final Set<BindingDecl> bindings = new LinkedHashSet<>();

    private Builder() {}

    public Builder exchange(String name, ExchangeDecl.Type type, boolean durable) {
      return this.exchange(new ExchangeDecl(name, type, durable));
    }

    /**
     * Add an exchange declaration.
     *
     * @param exchange the declaration
     * @return this builder
     * @throws IllegalArgumentException if an exchange with the same name and different
     *     parameters is already in the builder
     */
    public Builder exchange(ExchangeDecl exchange) {
      ExchangeDecl existing = this.exchanges.putIfAbsent(exchange.name(), exchange);
      if (existing != null && !existing.equals(exchange)) {
        throw new IllegalArgumentException(
            "Conflicting declarations for exchange '"
                + exchange.name()
                + "': "
                + existing
                + " and "
                + exchange);
      }
      return this;
    }

    public Builder queue(String name, boolean durable, boolean autoDelete) {
      return this.queue(new QueueDecl(name, durable, autoDelete));
    }

    /**
     * Add a queue declaration.
     *
     * @param queue the declaration
     * @return this builder
     * @throws IllegalArgumentException if a queue with the same name and different parameters is
     *     already in the builder
     */
    public Builder queue(QueueDecl queue) {
      QueueDecl existing = this.queues.putIfAbsent(queue.name(), queue);
      if (existing != null && !existing.equals(queue)) {
        throw new IllegalArgumentException(
            "Conflicting declarations for queue '"
                + queue.name()
                + "': "
                + existing
                + " and "
                + queue);
      }
      return this;
    }

    public Builder binding(String queue, String exchange, String routingKey) {
      return this.binding(new BindingDecl(queue, exchange, routingKey));
    }

    public Builder binding(BindingDecl binding) {
      this.bindings.add(binding);
      return this;
    }

    /**
     * Add all the declarations of another spec.
     *
     * @param spec the spec to merge
     * @return this builder
     */
    public Builder add(TopologySpec spec) {
      spec.exchanges().forEach(this::exchange);
      spec.queues().forEach(this::queue);
      spec.bindings().forEach(this::binding);
      return this;
    }

    public TopologySpec build() {
      return new TopologySpec(
          new ArrayList<>(this.exchanges.values()),
          new ArrayList<>(this.queues.values()),
          new ArrayList<>(this.bindings));
    }
  }
}
