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

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Raw access to an AMQP 0-9-1 broker.
 *
 * <p>This is the contract the library relies on to talk to the broker. It does not retry nor
 * recover anything: the {@link ConnectionManager} takes care of it. Implementations must report
 * errors with the following exceptions:
 *
 * <ul>
 *   <li>{@link LinkLostException} (or any other plain {@link IOException}) when the network link
 *       is lost or cannot be established, this is considered transient
 *   <li>{@link ProtocolException} when the broker rejects an operation (e.g. conflicting
 *       declaration)
 *   <li>{@link AuthenticationException} when the broker rejects the credentials
 * </ul>
 *
 * @see com.bender.mq.rabbitmq.RabbitMqBrokerConnection
 */
public interface BrokerConnection {

  /**
   * Open a connection to the broker.
   *
   * @param address broker address
   * @param credentials credentials
   * @return the open connection
   * @throws IOException if the connection cannot be opened
   */
  RawConnection open(Address address, Credentials credentials) throws IOException;

  /** A physical connection to the broker. */
  interface RawConnection extends AutoCloseable {

    /**
     * Open a new channel on this connection.
     *
     * @return the channel
     * @throws IOException if the channel cannot be opened
     */
    RawChannel openChannel() throws IOException;

    /**
     * Register a listener called when the connection is lost unexpectedly.
     *
     * <p>The listener is not called when the connection is closed with {@link #close()}.
     *
     * @param listener the listener
     */
    void addDisconnectListener(Consumer<LinkLostException> listener);

    boolean isOpen();

    @Override
    void close() throws IOException;
  }

  /** A channel of a {@link RawConnection}. */
  interface RawChannel extends AutoCloseable {

    void declareExchange(ExchangeDecl exchange) throws IOException;

    void declareQueue(QueueDecl queue) throws IOException;

    void declareBinding(BindingDecl binding) throws IOException;

    /**
     * Send a message.
     *
     * <p>A successful return means the broker accepted the frame, there is no confirm tracking.
     *
     * @param message the message
     * @throws IOException if the message could not be sent
     */
    void publish(OutboundMessage message) throws IOException;

    /**
     * Start consuming from a queue.
     *
     * <p>The callback is called for each delivery, until the subscription is cancelled or the
     * channel closed. A cancelled subscription cannot be restarted, a new one must be created.
     *
     * @param queue the queue to consume from
     * @param callback delivery callback
     * @param cancelCallback called when the broker cancels the subscription, e.g. because the
     *     queue has been deleted, not called after {@link #cancel(String)}
     * @return the consumer tag
     * @throws IOException if the subscription cannot be created
     */
    String consume(String queue, DeliveryCallback callback, CancelCallback cancelCallback)
        throws IOException;

    void cancel(String consumerTag) throws IOException;

    void ack(long deliveryTag) throws IOException;

    void reject(long deliveryTag, boolean requeue) throws IOException;

    /**
     * Register a callback for mandatory messages the broker could not route.
     *
     * @param callback the callback
     */
    void addReturnCallback(ReturnCallback callback);

    boolean isOpen();

    @Override
    void close() throws IOException;
  }

  /** Callback for raw deliveries. */
  @FunctionalInterface
  interface DeliveryCallback {

    void handle(InboundDelivery delivery);
  }

  /** Callback for subscriptions cancelled by the broker. */
  @FunctionalInterface
  interface CancelCallback {

    void cancelled(String consumerTag);
  }

  /** Callback for messages returned by the broker. */
  @FunctionalInterface
  interface ReturnCallback {

    void returned(int replyCode, String replyText, String exchange, String routingKey);
  }

  /** The link to the broker is lost or could not be established. */
  class LinkLostException extends IOException {

    public LinkLostException(String message) {
      super(message);
    }

    public LinkLostException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The broker rejected an operation. */
  class ProtocolException extends IOException {

    public static final int ACCESS_REFUSED = 403;
    public static final int NOT_FOUND = 404;
    public static final int RESOURCE_LOCKED = 405;
    public static final int PRECONDITION_FAILED = 406;

    private final int replyCode;

    public ProtocolException(int replyCode, String message) {
      super(message);
      this.replyCode = replyCode;
    }

    public ProtocolException(int replyCode, String message, Throwable cause) {
      super(message, cause);
      this.replyCode = replyCode;
    }

    public int replyCode() {
      return this.replyCode;
    }
  }

  /** The broker rejected the credentials. */
  class AuthenticationException extends IOException {

    public AuthenticationException(String message) {
      super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
