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

/** Declaration of a queue. */
public final class QueueDecl {

  private final String name;
  private final boolean durable;
  private final boolean autoDelete;
  private final boolean exclusive;

  public QueueDecl(String name, boolean durable, boolean autoDelete) {
    this(name, durable, autoDelete, false);
  }

  public QueueDecl(String name, boolean durable, boolean autoDelete, boolean exclusive) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Queue name cannot be null or empty");
    }
    this.name = name;
    this.durable = durable;
    this.autoDelete = autoDelete;
    this.exclusive = exclusive;
  }

  public String name() {
    return this.name;
  }

  public boolean durable() {
    return this.durable;
  }

  public boolean autoDelete() {
    return this.autoDelete;
  }

  public boolean exclusive() {
    return this.exclusive;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    QueueDecl queueDecl = (QueueDecl) o;
    return durable == queueDecl.durable
        && autoDelete == queueDecl.autoDelete
        && exclusive == queueDecl.exclusive
        && name.equals(queueDecl.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, durable, autoDelete, exclusive);
  }

  @Override
  public String toString() {
    return "QueueDecl{"
        + "name='"
        + name
        + '\''
        + ", durable="
        + durable
        + ", autoDelete="
        + autoDelete
        + ", exclusive="
        + exclusive
        + '}';
  }
}
