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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;
import java.util.Optional;

/**
 * A message to publish.
 *
 * <p>Instances are created with {@link #builder(String, String)} and are not retained by the
 * library once {@link Publisher#publish(OutboundMessage)} returns.
 */
public final class OutboundMessage {

  /** AMQP delivery mode. */
  public enum DeliveryMode {
    TRANSIENT(1),
    PERSISTENT(2);

    private final int value;

    DeliveryMode(int value) {
      this.value = value;
    }

    /**
     * Value of the delivery mode on the wire.
     *
     * @return 1 for transient, 2 for persistent
     */
    public int value() {
      return this.value;
    }
  }

  private static final byte[] EMPTY = new byte[0];

  private final String exchange;
  private final String routingKey;
  private final byte[] payload;
  private final DeliveryMode deliveryMode;
  private final String correlationId;
  private final String contentType;
  private final boolean mandatory;

  private OutboundMessage(Builder builder) {
    this.exchange = builder.exchange;
    this.routingKey = builder.routingKey;
    this.payload = builder.payload;
    this.deliveryMode = builder.deliveryMode;
    this.correlationId = builder.correlationId;
    this.contentType = builder.contentType;
    this.mandatory = builder.mandatory;
  }

  /**
   * Create a builder for a message.
   *
   * @param exchange the target exchange, empty string for the default exchange
   * @param routingKey the routing key
   * @return a message builder
   */
  public static Builder builder(String exchange, String routingKey) {
    return new Builder(exchange, routingKey);
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  @SuppressFBWarnings("EI_EXPOSE_REP")
  public byte[] payload() {
    return this.payload;
  }

  public DeliveryMode deliveryMode() {
    return this.deliveryMode;
  }

  public Optional<String> correlationId() {
    return Optional.ofNullable(this.correlationId);
  }

  public Optional<String> contentType() {
    return Optional.ofNullable(this.contentType);
  }

  public boolean mandatory() {
    return this.mandatory;
  }

  @Override
  public String toString() {
    return "OutboundMessage{"
        + "exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", size="
        + payload.length
        + ", deliveryMode="
        + deliveryMode
        + '}';
  }

  /** Builder for {@link OutboundMessage}. */
  public static final class Builder {

    private final String exchange;
    private final String routingKey;
    private byte[] payload = EMPTY;
    private DeliveryMode deliveryMode = DeliveryMode.TRANSIENT;
    private String correlationId;
    private String contentType;
    private boolean mandatory;

    private Builder(String exchange, String routingKey) {
      this.exchange = Objects.requireNonNull(exchange, "exchange");
      this.routingKey = Objects.requireNonNull(routingKey, "routingKey");
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public Builder payload(byte[] payload) {
      this.payload = payload == null ? EMPTY : payload;
      return this;
    }

    public Builder deliveryMode(DeliveryMode deliveryMode) {
      this.deliveryMode = Objects.requireNonNull(deliveryMode, "deliveryMode");
      return this;
    }

    public Builder persistent() {
      return this.deliveryMode(DeliveryMode.PERSISTENT);
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder mandatory(boolean mandatory) {
      this.mandatory = mandatory;
      return this;
    }

    public OutboundMessage build() {
      return new OutboundMessage(this);
    }
  }
}
