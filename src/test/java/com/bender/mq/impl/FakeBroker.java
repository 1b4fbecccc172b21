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

import com.bender.mq.Address;
import com.bender.mq.BindingDecl;
import com.bender.mq.BrokerConnection;
import com.bender.mq.Credentials;
import com.bender.mq.ExchangeDecl;
import com.bender.mq.InboundDelivery;
import com.bender.mq.OutboundMessage;
import com.bender.mq.QueueDecl;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory broker for tests.
 *
 * <p>Routes messages for direct, fanout, and topic exchanges, rejects conflicting declarations with
 * 406, requeues unacknowledged messages (flagged as redelivered) when a channel or connection
 * closes, and can simulate link losses and unreachable brokers. Deleting a queue cancels its
 * consumers. Deliveries, cancellations, and returns are dispatched on a dedicated thread, like a
 * real broker connection would.
 */
final class FakeBroker implements BrokerConnection, AutoCloseable {

  private final Map<String, ExchangeDecl> exchanges = new LinkedHashMap<>();
  private final Map<String, FakeQueue> queues = new LinkedHashMap<>();
  private final Set<BindingDecl> bindings = new LinkedHashSet<>();
  private final List<FakeConnection> connections = new ArrayList<>();
  private final List<String> declarations = new ArrayList<>();
  private final List<StoredMessage> published = new ArrayList<>();
  private final List<StoredMessage> acked = new ArrayList<>();
  private final List<Long> openAttemptTimes = new CopyOnWriteArrayList<>();
  private final List<Consumer<String>> declarationHooks = new CopyOnWriteArrayList<>();
  private final AtomicInteger declareFailures = new AtomicInteger(0);
  private final AtomicInteger publishFailures = new AtomicInteger(0);
  private final AtomicLong consumerTagSequence = new AtomicLong(0);
  private final ExecutorService dispatcher =
      Executors.newSingleThreadExecutor(Utils.threadFactory("fake-broker-dispatcher-"));
  private volatile boolean down = false;
  private volatile boolean rejectCredentials = false;

  @Override
  public RawConnection open(Address address, Credentials credentials) throws IOException {
    this.openAttemptTimes.add(System.nanoTime());
    if (this.down) {
      throw new LinkLostException("Connection refused: " + address);
    }
    if (this.rejectCredentials) {
      throw new AuthenticationException("ACCESS_REFUSED - Login was refused");
    }
    synchronized (this) {
      FakeConnection connection = new FakeConnection();
      this.connections.add(connection);
      return connection;
    }
  }

  /** Close all the connections abruptly, as a network failure would. */
  void kill() {
    List<FakeConnection> killed;
    synchronized (this) {
      killed = new ArrayList<>(this.connections);
      killed.forEach(FakeConnection::shutdown);
      this.connections.clear();
      this.dispatch();
    }
    killed.forEach(
        c -> c.fireDisconnect(new LinkLostException("Connection reset by broker")));
  }

  /** Kill the connections and refuse new ones. */
  void stop() {
    this.down = true;
    this.kill();
  }

  void start() {
    this.down = false;
  }

  void rejectCredentials(boolean reject) {
    this.rejectCredentials = reject;
  }

  /** The next declarations kill the connection and fail with a link loss. */
  void failNextDeclarations(int count) {
    this.declareFailures.set(count);
  }

  /** The next publishes kill the connection and fail with a link loss. */
  void failNextPublishes(int count) {
    this.publishFailures.set(count);
  }

  /**
   * Call the hook after each successful declaration, outside the broker lock.
   *
   * <p>The hook receives the declaration key, e.g. <code>queue:orders</code>.
   */
  void afterDeclaration(Consumer<String> hook) {
    this.declarationHooks.add(hook);
  }

  /** Delete the queue and its bindings, the broker cancels the consumers of the queue. */
  synchronized void deleteQueue(String name) {
    FakeQueue queue = this.queues.remove(name);
    if (queue == null) {
      return;
    }
    this.bindings.removeIf(b -> b.queue().equals(name));
    for (FakeConsumer consumer : new ArrayList<>(queue.consumers)) {
      consumer.cancelled = true;
      consumer.channel.consumers.values().remove(consumer);
      this.dispatcher.execute(
          () -> {
            if (consumer.channel.open) {
              consumer.cancelCallback.cancelled(consumer.tag);
            }
          });
    }
    queue.consumers.clear();
  }

  synchronized void preDeclare(ExchangeDecl exchange) {
    this.exchanges.put(exchange.name(), exchange);
  }

  synchronized void preDeclare(QueueDecl queue) {
    this.queues.put(queue.name(), new FakeQueue(queue));
  }

  synchronized void enqueue(String queue, String payload) {
    this.queues
        .get(queue)
        .ready
        .add(new StoredMessage("", queue, payload.getBytes(), null, null, false));
    this.dispatch();
  }

  int openAttempts() {
    return this.openAttemptTimes.size();
  }

  List<Long> openAttemptTimes() {
    return new ArrayList<>(this.openAttemptTimes);
  }

  synchronized int openConnectionCount() {
    return this.connections.size();
  }

  synchronized int openChannelCount() {
    return this.connections.stream()
        .mapToInt(c -> (int) c.channels.stream().filter(ch -> ch.open).count())
        .sum();
  }

  synchronized ExchangeDecl exchange(String name) {
    return this.exchanges.get(name);
  }

  synchronized QueueDecl queue(String name) {
    FakeQueue queue = this.queues.get(name);
    return queue == null ? null : queue.decl;
  }

  synchronized Set<BindingDecl> bindings() {
    return new LinkedHashSet<>(this.bindings);
  }

  synchronized List<String> declarations() {
    return new ArrayList<>(this.declarations);
  }

  synchronized long declarationCount(String declaration) {
    return this.declarations.stream().filter(declaration::equals).count();
  }

  synchronized int readyCount(String queue) {
    FakeQueue q = this.queues.get(queue);
    return q == null ? 0 : q.ready.size();
  }

  synchronized int consumerCount(String queue) {
    FakeQueue q = this.queues.get(queue);
    return q == null ? 0 : q.consumers.size();
  }

  synchronized int unackedCount() {
    return this.connections.stream()
        .flatMap(c -> c.channels.stream())
        .mapToInt(ch -> ch.unacked.size())
        .sum();
  }

  synchronized List<StoredMessage> published() {
    return new ArrayList<>(this.published);
  }

  synchronized List<StoredMessage> acked() {
    return new ArrayList<>(this.acked);
  }

  @Override
  public void close() {
    this.dispatcher.shutdownNow();
  }

  private void declared(String declaration) {
    this.declarationHooks.forEach(h -> h.accept(declaration));
  }

  // holds lock
  private void dispatch() {
    for (FakeQueue queue : this.queues.values()) {
      while (!queue.ready.isEmpty() && !queue.consumers.isEmpty()) {
        FakeConsumer consumer = queue.consumers.get(queue.next++ % queue.consumers.size());
        StoredMessage message = queue.ready.poll();
        long tag = consumer.channel.nextDeliveryTag++;
        consumer.channel.unacked.put(tag, new Unacked(queue, message));
        InboundDelivery delivery =
            new InboundDelivery(
                tag,
                message.payload,
                message.redelivered,
                message.exchange,
                message.routingKey,
                message.correlationId,
                message.contentType);
        this.dispatcher.execute(
            () -> {
              if (consumer.channel.open && !consumer.cancelled) {
                consumer.callback.handle(delivery);
              }
            });
      }
    }
  }

  // holds lock
  private List<FakeQueue> route(String exchangeName, String routingKey) {
    List<FakeQueue> destinations = new ArrayList<>();
    if (exchangeName.isEmpty()) {
      FakeQueue queue = this.queues.get(routingKey);
      if (queue != null) {
        destinations.add(queue);
      }
      return destinations;
    }
    ExchangeDecl exchange = this.exchanges.get(exchangeName);
    for (BindingDecl binding : this.bindings) {
      if (binding.exchange().equals(exchangeName)) {
        boolean matches;
        switch (exchange.type()) {
          case FANOUT:
          case HEADERS:
            matches = true;
            break;
          case TOPIC:
            matches = topicMatches(binding.routingKey(), routingKey);
            break;
          default:
            matches = binding.routingKey().equals(routingKey);
        }
        FakeQueue queue = this.queues.get(binding.queue());
        if (matches && queue != null && !destinations.contains(queue)) {
          destinations.add(queue);
        }
      }
    }
    return destinations;
  }

  static boolean topicMatches(String pattern, String routingKey) {
    String[] words = routingKey.isEmpty() ? new String[0] : routingKey.split("\\.", -1);
    return topicMatches(pattern.split("\\.", -1), 0, words, 0);
  }

  private static boolean topicMatches(String[] pattern, int i, String[] words, int j) {
    if (i == pattern.length) {
      return j == words.length;
    }
    if ("#".equals(pattern[i])) {
      for (int n = j; n <= words.length; n++) {
        if (topicMatches(pattern, i + 1, words, n)) {
          return true;
        }
      }
      return false;
    }
    if (j == words.length) {
      return false;
    }
    return ("*".equals(pattern[i]) || pattern[i].equals(words[j]))
        && topicMatches(pattern, i + 1, words, j + 1);
  }

  static final class StoredMessage {

    final String exchange;
    final String routingKey;
    final byte[] payload;
    final String correlationId;
    final String contentType;
    final boolean redelivered;

    private StoredMessage(
        String exchange,
        String routingKey,
        byte[] payload,
        String correlationId,
        String contentType,
        boolean redelivered) {
      this.exchange = exchange;
      this.routingKey = routingKey;
      this.payload = payload;
      this.correlationId = correlationId;
      this.contentType = contentType;
      this.redelivered = redelivered;
    }

    private StoredMessage redelivered() {
      return new StoredMessage(exchange, routingKey, payload, correlationId, contentType, true);
    }

    String body() {
      return new String(this.payload);
    }
  }

  private static final class FakeQueue {

    private final QueueDecl decl;
    private final Deque<StoredMessage> ready = new ArrayDeque<>();
    private final List<FakeConsumer> consumers = new ArrayList<>();
    private int next = 0;

    private FakeQueue(QueueDecl decl) {
      this.decl = decl;
    }
  }

  private static final class FakeConsumer {

    private final String tag;
    private final FakeChannel channel;
    private final FakeQueue queue;
    private final DeliveryCallback callback;
    private final CancelCallback cancelCallback;
    private volatile boolean cancelled = false;

    private FakeConsumer(
        String tag,
        FakeChannel channel,
        FakeQueue queue,
        DeliveryCallback callback,
        CancelCallback cancelCallback) {
      this.tag = tag;
      this.channel = channel;
      this.queue = queue;
      this.callback = callback;
      this.cancelCallback = cancelCallback;
    }
  }

  private static final class Unacked {

    private final FakeQueue queue;
    private final StoredMessage message;

    private Unacked(FakeQueue queue, StoredMessage message) {
      this.queue = queue;
      this.message = message;
    }
  }

  private final class FakeConnection implements RawConnection {

    private final List<FakeChannel> channels = new ArrayList<>();
    private final List<Consumer<LinkLostException>> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    @Override
    public RawChannel openChannel() throws IOException {
      synchronized (FakeBroker.this) {
        if (!this.open) {
          throw new LinkLostException("Connection is closed");
        }
        FakeChannel channel = new FakeChannel(this);
        this.channels.add(channel);
        return channel;
      }
    }

    @Override
    public void addDisconnectListener(Consumer<LinkLostException> listener) {
      this.listeners.add(listener);
    }

    @Override
    public boolean isOpen() {
      return this.open;
    }

    @Override
    public void close() {
      synchronized (FakeBroker.this) {
        this.shutdown();
        connections.remove(this);
        dispatch();
      }
    }

    // holds lock
    private void shutdown() {
      this.open = false;
      this.channels.forEach(ch -> ch.closeInternal(ProtocolException.NOT_FOUND));
    }

    private void fireDisconnect(LinkLostException cause) {
      this.listeners.forEach(l -> l.accept(cause));
    }
  }

  private final class FakeChannel implements RawChannel {

    private static final int CHANNEL_ERROR = 504;
    private static final int NO_ROUTE = 312;

    private final FakeConnection connection;
    private final NavigableMap<Long, Unacked> unacked = new TreeMap<>();
    private final Map<String, FakeConsumer> consumers = new LinkedHashMap<>();
    private final List<ReturnCallback> returnCallbacks = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private int closeReplyCode = CHANNEL_ERROR;
    private long nextDeliveryTag = 1;

    private FakeChannel(FakeConnection connection) {
      this.connection = connection;
    }

    @Override
    public void declareExchange(ExchangeDecl exchange) throws IOException {
      this.maybeFailDeclaration();
      String declaration = "exchange:" + exchange.name();
      synchronized (FakeBroker.this) {
        this.checkOpen();
        declarations.add(declaration);
        ExchangeDecl existing = exchanges.get(exchange.name());
        if (existing != null && !existing.equals(exchange)) {
          throw this.error(
              ProtocolException.PRECONDITION_FAILED,
              "PRECONDITION_FAILED - inequivalent arg for exchange '" + exchange.name() + "'");
        }
        exchanges.put(exchange.name(), exchange);
      }
      declared(declaration);
    }

    @Override
    public void declareQueue(QueueDecl queue) throws IOException {
      this.maybeFailDeclaration();
      String declaration = "queue:" + queue.name();
      synchronized (FakeBroker.this) {
        this.checkOpen();
        declarations.add(declaration);
        FakeQueue existing = queues.get(queue.name());
        if (existing != null && !existing.decl.equals(queue)) {
          throw this.error(
              ProtocolException.PRECONDITION_FAILED,
              "PRECONDITION_FAILED - inequivalent arg for queue '" + queue.name() + "'");
        }
        if (existing == null) {
          queues.put(queue.name(), new FakeQueue(queue));
        }
      }
      declared(declaration);
    }

    @Override
    public void declareBinding(BindingDecl binding) throws IOException {
      this.maybeFailDeclaration();
      String declaration = "binding:" + binding.queue() + ":" + binding.exchange();
      synchronized (FakeBroker.this) {
        this.checkOpen();
        declarations.add(declaration);
        if (!exchanges.containsKey(binding.exchange())) {
          throw this.error(
              ProtocolException.NOT_FOUND, "NOT_FOUND - no exchange '" + binding.exchange() + "'");
        }
        if (!queues.containsKey(binding.queue())) {
          throw this.error(
              ProtocolException.NOT_FOUND, "NOT_FOUND - no queue '" + binding.queue() + "'");
        }
        bindings.add(binding);
      }
      declared(declaration);
    }

    @Override
    public void publish(OutboundMessage message) throws IOException {
      if (publishFailures.getAndDecrement() > 0) {
        kill();
        throw new LinkLostException("Connection reset while publishing");
      }
      synchronized (FakeBroker.this) {
        this.checkOpen();
        if (!message.exchange().isEmpty() && !exchanges.containsKey(message.exchange())) {
          throw this.error(
              ProtocolException.NOT_FOUND, "NOT_FOUND - no exchange '" + message.exchange() + "'");
        }
        StoredMessage stored =
            new StoredMessage(
                message.exchange(),
                message.routingKey(),
                message.payload(),
                message.correlationId().orElse(null),
                message.contentType().orElse(null),
                false);
        published.add(stored);
        List<FakeQueue> destinations = route(message.exchange(), message.routingKey());
        destinations.forEach(q -> q.ready.add(stored));
        if (destinations.isEmpty() && message.mandatory()) {
          String exchange = message.exchange();
          String routingKey = message.routingKey();
          dispatcher.execute(
              () ->
                  this.returnCallbacks.forEach(
                      c -> c.returned(NO_ROUTE, "NO_ROUTE", exchange, routingKey)));
        }
        dispatch();
      }
    }

    @Override
    public String consume(String queue, DeliveryCallback callback, CancelCallback cancelCallback)
        throws IOException {
      synchronized (FakeBroker.this) {
        this.checkOpen();
        FakeQueue q = queues.get(queue);
        if (q == null) {
          throw this.error(ProtocolException.NOT_FOUND, "NOT_FOUND - no queue '" + queue + "'");
        }
        String tag = "ctag-" + consumerTagSequence.incrementAndGet();
        FakeConsumer consumer = new FakeConsumer(tag, this, q, callback, cancelCallback);
        this.consumers.put(tag, consumer);
        q.consumers.add(consumer);
        dispatch();
        return tag;
      }
    }

    @Override
    public void cancel(String consumerTag) throws IOException {
      synchronized (FakeBroker.this) {
        this.checkOpen();
        FakeConsumer consumer = this.consumers.remove(consumerTag);
        if (consumer != null) {
          consumer.cancelled = true;
          consumer.queue.consumers.remove(consumer);
        }
      }
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
      synchronized (FakeBroker.this) {
        this.checkOpen();
        Unacked removed = this.unacked.remove(deliveryTag);
        if (removed == null) {
          throw this.error(
              ProtocolException.PRECONDITION_FAILED,
              "PRECONDITION_FAILED - unknown delivery tag " + deliveryTag);
        }
        acked.add(removed.message);
      }
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) throws IOException {
      synchronized (FakeBroker.this) {
        this.checkOpen();
        Unacked removed = this.unacked.remove(deliveryTag);
        if (removed == null) {
          throw this.error(
              ProtocolException.PRECONDITION_FAILED,
              "PRECONDITION_FAILED - unknown delivery tag " + deliveryTag);
        }
        if (requeue) {
          removed.queue.ready.addFirst(removed.message.redelivered());
          dispatch();
        }
      }
    }

    @Override
    public void addReturnCallback(ReturnCallback callback) {
      this.returnCallbacks.add(callback);
    }

    @Override
    public boolean isOpen() {
      return this.open;
    }

    @Override
    public void close() {
      synchronized (FakeBroker.this) {
        this.closeInternal(CHANNEL_ERROR);
        dispatch();
      }
    }

    // holds lock
    private void closeInternal(int replyCode) {
      if (!this.open) {
        return;
      }
      this.open = false;
      this.closeReplyCode = replyCode;
      for (FakeConsumer consumer : this.consumers.values()) {
        consumer.cancelled = true;
        consumer.queue.consumers.remove(consumer);
      }
      this.consumers.clear();
      Iterator<Unacked> iterator = this.unacked.descendingMap().values().iterator();
      while (iterator.hasNext()) {
        Unacked u = iterator.next();
        u.queue.ready.addFirst(u.message.redelivered());
        iterator.remove();
      }
    }

    // holds lock
    private void checkOpen() throws IOException {
      if (!this.connection.open) {
        throw new LinkLostException("Connection is closed");
      }
      if (!this.open) {
        throw new ProtocolException(this.closeReplyCode, "Channel is closed");
      }
    }

    // holds lock
    private ProtocolException error(int replyCode, String message) {
      this.closeInternal(replyCode);
      dispatch();
      return new ProtocolException(replyCode, message);
    }

    private void maybeFailDeclaration() throws IOException {
      if (declareFailures.getAndDecrement() > 0) {
        kill();
        throw new LinkLostException("Connection reset while declaring");
      }
    }
  }
}
