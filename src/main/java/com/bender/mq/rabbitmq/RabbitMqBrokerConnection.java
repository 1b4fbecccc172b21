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
package com.bender.mq.rabbitmq;

import com.bender.mq.Address;
import com.bender.mq.BindingDecl;
import com.bender.mq.BrokerConnection;
import com.bender.mq.Credentials;
import com.bender.mq.ExchangeDecl;
import com.bender.mq.InboundDelivery;
import com.bender.mq.OutboundMessage;
import com.bender.mq.QueueDecl;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerConnection} implementation on top of the RabbitMQ Java client (AMQP 0-9-1).
 *
 * <p>Automatic recovery of the RabbitMQ Java client is disabled: the {@link
 * com.bender.mq.ConnectionManager} takes care of recovery.
 */
public class RabbitMqBrokerConnection implements BrokerConnection {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitMqBrokerConnection.class);

  private final ConnectionFactory connectionFactory;

  public RabbitMqBrokerConnection() {
    this(new ConnectionFactory());
  }

  /**
   * Create an instance with a pre-configured connection factory (e.g. for timeouts or TLS).
   *
   * <p>Host, port, virtual host, and credentials of the factory are overridden on each {@link
   * #open(Address, Credentials)} call.
   *
   * @param connectionFactory the connection factory
   */
  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public RabbitMqBrokerConnection(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
    this.connectionFactory.setAutomaticRecoveryEnabled(false);
    this.connectionFactory.setTopologyRecoveryEnabled(false);
  }

  @Override
  public RawConnection open(Address address, Credentials credentials) throws IOException {
    Connection connection;
    synchronized (this.connectionFactory) {
      this.connectionFactory.setHost(address.host());
      this.connectionFactory.setPort(address.port());
      this.connectionFactory.setVirtualHost(address.virtualHost());
      this.connectionFactory.setUsername(credentials.username());
      this.connectionFactory.setPassword(credentials.password());
      try {
        connection = this.connectionFactory.newConnection();
      } catch (IOException | TimeoutException | ShutdownSignalException e) {
        throw convert(e);
      }
    }
    LOGGER.debug("Connection opened to {}", address);
    return new RabbitMqRawConnection(connection);
  }

  /**
   * Translate RabbitMQ Java client errors into {@link BrokerConnection} errors.
   *
   * <p>Channel-level closures become {@link ProtocolException}s with the reply code, other
   * closures and network failures are link losses.
   *
   * @param e the error from the RabbitMQ Java client
   * @return the corresponding error
   */
  static IOException convert(Exception e) {
    if (e instanceof LinkLostException
        || e instanceof ProtocolException
        || e instanceof AuthenticationException) {
      return (IOException) e;
    } else if (e instanceof AuthenticationFailureException) {
      return new AuthenticationException(e.getMessage(), e);
    }
    ShutdownSignalException signal = shutdownSignal(e);
    if (signal != null) {
      Object reason = signal.getReason();
      if (!signal.isHardError() && reason instanceof AMQP.Channel.Close) {
        AMQP.Channel.Close close = (AMQP.Channel.Close) reason;
        return new ProtocolException(close.getReplyCode(), close.getReplyText(), e);
      }
      return new LinkLostException(signal.getMessage(), e);
    }
    return new LinkLostException(e.getMessage() == null ? e.toString() : e.getMessage(), e);
  }

  private static ShutdownSignalException shutdownSignal(Throwable e) {
    Throwable current = e;
    while (current != null) {
      if (current instanceof ShutdownSignalException) {
        return (ShutdownSignalException) current;
      }
      current = current.getCause();
    }
    return null;
  }

  @FunctionalInterface
  private interface IoCall<T> {

    T call() throws IOException, TimeoutException;
  }

  private static <T> T call(IoCall<T> call) throws IOException {
    try {
      return call.call();
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      throw convert(e);
    }
  }

  static final class RabbitMqRawConnection implements RawConnection {

    private final Connection connection;

    RabbitMqRawConnection(Connection connection) {
      this.connection = connection;
    }

    @Override
    public RawChannel openChannel() throws IOException {
      Channel channel = call(this.connection::createChannel);
      if (channel == null) {
        throw new LinkLostException("No channel available on connection");
      }
      return new RabbitMqRawChannel(channel);
    }

    @Override
    public void addDisconnectListener(Consumer<LinkLostException> listener) {
      this.connection.addShutdownListener(
          cause -> {
            if (!cause.isInitiatedByApplication()) {
              listener.accept(new LinkLostException(cause.getMessage(), cause));
            }
          });
    }

    @Override
    public boolean isOpen() {
      return this.connection.isOpen();
    }

    @Override
    public void close() throws IOException {
      if (this.connection.isOpen()) {
        call(
            () -> {
              this.connection.close();
              return null;
            });
      }
    }
  }

  static final class RabbitMqRawChannel implements RawChannel {

    private final Channel channel;

    RabbitMqRawChannel(Channel channel) {
      this.channel = channel;
    }

    @Override
    public void declareExchange(ExchangeDecl exchange) throws IOException {
      call(
          () ->
              this.channel.exchangeDeclare(
                  exchange.name(),
                  exchange.type().value(),
                  exchange.durable(),
                  exchange.autoDelete(),
                  Collections.emptyMap()));
    }

    @Override
    public void declareQueue(QueueDecl queue) throws IOException {
      call(
          () ->
              this.channel.queueDeclare(
                  queue.name(),
                  queue.durable(),
                  queue.exclusive(),
                  queue.autoDelete(),
                  Collections.emptyMap()));
    }

    @Override
    public void declareBinding(BindingDecl binding) throws IOException {
      call(() -> this.channel.queueBind(binding.queue(), binding.exchange(), binding.routingKey()));
    }

    @Override
    public void publish(OutboundMessage message) throws IOException {
      AMQP.BasicProperties properties =
          new AMQP.BasicProperties.Builder()
              .deliveryMode(message.deliveryMode().value())
              .correlationId(message.correlationId().orElse(null))
              .contentType(message.contentType().orElse(null))
              .build();
      call(
          () -> {
            this.channel.basicPublish(
                message.exchange(),
                message.routingKey(),
                message.mandatory(),
                properties,
                message.payload());
            return null;
          });
    }

    @Override
    public String consume(String queue, DeliveryCallback callback, CancelCallback cancelCallback)
        throws IOException {
      return call(
          () ->
              this.channel.basicConsume(
                  queue,
                  false,
                  (consumerTag, delivery) -> callback.handle(toInboundDelivery(delivery)),
                  consumerTag -> {
                    LOGGER.debug(
                        "Consumer {} on queue '{}' cancelled by the broker", consumerTag, queue);
                    cancelCallback.cancelled(consumerTag);
                  }));
    }

    @Override
    public void cancel(String consumerTag) throws IOException {
      call(
          () -> {
            this.channel.basicCancel(consumerTag);
            return null;
          });
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
      call(
          () -> {
            this.channel.basicAck(deliveryTag, false);
            return null;
          });
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) throws IOException {
      call(
          () -> {
            this.channel.basicReject(deliveryTag, requeue);
            return null;
          });
    }

    @Override
    public void addReturnCallback(ReturnCallback callback) {
      this.channel.addReturnListener(
          returned ->
              callback.returned(
                  returned.getReplyCode(),
                  returned.getReplyText(),
                  returned.getExchange(),
                  returned.getRoutingKey()));
    }

    @Override
    public boolean isOpen() {
      return this.channel.isOpen();
    }

    @Override
    public void close() throws IOException {
      if (this.channel.isOpen()) {
        call(
            () -> {
              this.channel.close();
              return null;
            });
      }
    }

    static InboundDelivery toInboundDelivery(Delivery delivery) {
      AMQP.BasicProperties properties = delivery.getProperties();
      return new InboundDelivery(
          delivery.getEnvelope().getDeliveryTag(),
          delivery.getBody(),
          delivery.getEnvelope().isRedeliver(),
          delivery.getEnvelope().getExchange(),
          delivery.getEnvelope().getRoutingKey(),
          properties == null ? null : properties.getCorrelationId(),
          properties == null ? null : properties.getContentType());
    }
  }
}
