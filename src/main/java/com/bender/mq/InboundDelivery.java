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
import java.util.Optional;

/**
 * A message delivered by the broker to a consumer.
 *
 * <p>The delivery tag identifies the delivery on the channel it arrived on. It is settled by the
 * {@link AckDecision} returned by the {@link Consumer.DeliveryHandler}.
 */
public final class InboundDelivery {

  private final long deliveryTag;
  private final byte[] payload;
  private final boolean redelivered;
  private final String exchange;
  private final String routingKey;
  private final String correlationId;
  private final String contentType;

  public InboundDelivery(long deliveryTag, byte[] payload, boolean redelivered) {
    this(deliveryTag, payload, redelivered, "", "", null, null);
  }

  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public InboundDelivery(
      long deliveryTag,
      byte[] payload,
      boolean redelivered,
      String exchange,
      String routingKey,
      String correlationId,
      String contentType) {
    this.deliveryTag = deliveryTag;
    this.payload = payload == null ? new byte[0] : payload;
    this.redelivered = redelivered;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.correlationId = correlationId;
    this.contentType = contentType;
  }

  public long deliveryTag() {
    return this.deliveryTag;
  }

  @SuppressFBWarnings("EI_EXPOSE_REP")
  public byte[] payload() {
    return this.payload;
  }

  /**
   * Whether the broker already tried to deliver this message.
   *
   * <p>Deliveries left unacknowledged when a connection is lost are redelivered with this flag
   * set. Deduplication is the responsibility of the application.
   *
   * @return true if this is a redelivery
   */
  public boolean redelivered() {
    return this.redelivered;
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  public Optional<String> correlationId() {
    return Optional.ofNullable(this.correlationId);
  }

  public Optional<String> contentType() {
    return Optional.ofNullable(this.contentType);
  }

  @Override
  public String toString() {
    return "InboundDelivery{"
        + "deliveryTag="
        + deliveryTag
        + ", redelivered="
        + redelivered
        + ", routingKey='"
        + routingKey
        + '\''
        + '}';
  }
}
