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

/** Declaration of an exchange. */
public final class ExchangeDecl {

  /** Exchange types. */
  public enum Type {
    DIRECT("direct"),
    FANOUT("fanout"),
    TOPIC("topic"),
    HEADERS("headers");

    private final String value;

    Type(String value) {
      this.value = value;
    }

    /**
     * Name of the type on the wire.
     *
     * @return the AMQP name of the exchange type
     */
    public String value() {
      return this.value;
    }
  }

  private final String name;
  private final Type type;
  private final boolean durable;
  private final boolean autoDelete;

  public ExchangeDecl(String name, Type type, boolean durable) {
    this(name, type, durable, false);
  }

  public ExchangeDecl(String name, Type type, boolean durable, boolean autoDelete) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Exchange name cannot be null or empty");
    }
    this.name = name;
    this.type = Objects.requireNonNull(type, "type");
    this.durable = durable;
    this.autoDelete = autoDelete;
  }

  public String name() {
    return this.name;
  }

  public Type type() {
    return this.type;
  }

  public boolean durable() {
    return this.durable;
  }

  public boolean autoDelete() {
    return this.autoDelete;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ExchangeDecl that = (ExchangeDecl) o;
    return durable == that.durable
        && autoDelete == that.autoDelete
        && name.equals(that.name)
        && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, durable, autoDelete);
  }

  @Override
  public String toString() {
    return "ExchangeDecl{"
        + "name='"
        + name
        + '\''
        + ", type="
        + type
        + ", durable="
        + durable
        + ", autoDelete="
        + autoDelete
        + '}';
  }
}
