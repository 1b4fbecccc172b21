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

import com.bender.mq.BindingDecl;
import com.bender.mq.ExchangeDecl;
import com.bender.mq.QueueDecl;
import com.bender.mq.TopologySpec;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Union of the successfully declared entities.
 *
 * <p>Exchanges and queues are identified by name, the last declaration wins. Bindings are
 * identified by queue, exchange, and routing key.
 */
final class TopologyRecord {

  private final Map<String, ExchangeDecl> exchanges = new LinkedHashMap<>();
  private final Map<String, QueueDecl> queues = new LinkedHashMap<>();
  private final Set<BindingDecl> bindings = new LinkedHashSet<>();

  synchronized void record(TopologySpec spec) {
    spec.exchanges().forEach(e -> this.exchanges.put(e.name(), e));
    spec.queues().forEach(q -> this.queues.put(q.name(), q));
    this.bindings.addAll(spec.bindings());
  }

  synchronized TopologySpec snapshot() {
    TopologySpec.Builder builder = TopologySpec.builder();
    this.exchanges.values().forEach(builder::exchange);
    this.queues.values().forEach(builder::queue);
    this.bindings.forEach(builder::binding);
    return builder.build();
  }

  synchronized boolean isEmpty() {
    return this.exchanges.isEmpty() && this.queues.isEmpty() && this.bindings.isEmpty();
  }
}
