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
import com.bender.mq.BrokerConnection;
import com.bender.mq.ConnectionManager;
import com.bender.mq.ConnectionManagerBuilder;
import com.bender.mq.Credentials;
import com.bender.mq.RetryPolicy;
import com.bender.mq.metrics.MetricsCollector;
import com.bender.mq.metrics.NoOpMetricsCollector;
import com.bender.mq.rabbitmq.RabbitMqBrokerConnection;
import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/** Builder to create a {@link ConnectionManager} instance. */
public class AmqpConnectionManagerBuilder implements ConnectionManagerBuilder {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5672;
  public static final String DEFAULT_VIRTUAL_HOST = "/";
  public static final String DEFAULT_USERNAME = "guest";
  public static final String DEFAULT_PASSWORD = "guest";
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  static final String PROPERTY_URI = "uri";
  static final String PROPERTY_NAME = "name";
  static final String PROPERTY_RETRY_MAX_ATTEMPTS = "retry.max_attempts";
  static final String PROPERTY_RETRY_BASE_DELAY = "retry.base_delay";
  static final String PROPERTY_RETRY_MAX_DELAY = "retry.max_delay";
  static final String PROPERTY_RETRY_MULTIPLIER = "retry.multiplier";
  static final String PROPERTY_RETRY_JITTER_FRACTION = "retry.jitter_fraction";
  static final String PROPERTY_CONNECT_TIMEOUT = "connect.timeout";

  private BrokerConnection brokerConnection;
  private Address address = new Address(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_VIRTUAL_HOST);
  private Credentials credentials = new Credentials(DEFAULT_USERNAME, DEFAULT_PASSWORD);
  private String name;
  private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
  private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
  private List<ConnectionManager.StateListener> listeners = Collections.emptyList();
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;

  public AmqpConnectionManagerBuilder() {}

  @Override
  public AmqpConnectionManagerBuilder brokerConnection(BrokerConnection brokerConnection) {
    this.brokerConnection = brokerConnection;
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder uri(String uriString) {
    URI uri = toUri(uriString);
    String host = uri.getHost() == null ? DEFAULT_HOST : uri.getHost();
    int port = uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort();

    String username = DEFAULT_USERNAME;
    String password = DEFAULT_PASSWORD;
    String userInfo = uri.getRawUserInfo();
    if (userInfo != null) {
      String[] userPassword = userInfo.split(":");
      if (userPassword.length > 2) {
        throw new IllegalArgumentException("Bad user info in URI " + userInfo);
      }
      username = uriDecode(userPassword[0]);
      if (userPassword.length == 2) {
        password = uriDecode(userPassword[1]);
      }
    }

    String virtualHost = DEFAULT_VIRTUAL_HOST;
    String path = uri.getRawPath();
    if (path != null && path.length() > 1) {
      String rawVirtualHost = path.substring(1);
      if (!"/".equals(rawVirtualHost) && rawVirtualHost.indexOf('/') != -1) {
        throw new IllegalArgumentException("Multiple segments in path of URI: " + path);
      }
      virtualHost = uriDecode(rawVirtualHost);
    }

    this.address = new Address(host, port, virtualHost);
    this.credentials = new Credentials(username, password);
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder address(Address address) {
    if (address == null) {
      throw new IllegalArgumentException("Address cannot be null");
    }
    this.address = address;
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder credentials(Credentials credentials) {
    if (credentials == null) {
      throw new IllegalArgumentException("Credentials cannot be null");
    }
    this.credentials = credentials;
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder retryPolicy(RetryPolicy retryPolicy) {
    if (retryPolicy == null) {
      throw new IllegalArgumentException("Retry policy cannot be null");
    }
    this.retryPolicy = retryPolicy;
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder connectTimeout(Duration timeout) {
    if (timeout == null || timeout.isNegative()) {
      throw new IllegalArgumentException("Connect timeout must be positive");
    }
    this.connectTimeout = timeout;
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder listeners(ConnectionManager.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners = Collections.emptyList();
    } else {
      this.listeners = new ArrayList<>(Arrays.asList(listeners));
    }
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public AmqpConnectionManagerBuilder properties(Properties properties) {
    String uri = properties.getProperty(PROPERTY_URI);
    if (uri != null) {
      this.uri(uri.trim());
    }
    String name = properties.getProperty(PROPERTY_NAME);
    if (name != null) {
      this.name(name.trim());
    }
    String connectTimeout = properties.getProperty(PROPERTY_CONNECT_TIMEOUT);
    if (connectTimeout != null) {
      this.connectTimeout(Utils.parseDuration(connectTimeout));
    }

    boolean retryConfigured = false;
    RetryPolicy.ExponentialBuilder retry = RetryPolicy.exponential();
    String value = properties.getProperty(PROPERTY_RETRY_MAX_ATTEMPTS);
    if (value != null) {
      retry.maxAttempts(parseInt(PROPERTY_RETRY_MAX_ATTEMPTS, value));
      retryConfigured = true;
    }
    value = properties.getProperty(PROPERTY_RETRY_BASE_DELAY);
    if (value != null) {
      retry.baseDelay(Utils.parseDuration(value));
      retryConfigured = true;
    }
    value = properties.getProperty(PROPERTY_RETRY_MAX_DELAY);
    if (value != null) {
      retry.maxDelay(Utils.parseDuration(value));
      retryConfigured = true;
    }
    value = properties.getProperty(PROPERTY_RETRY_MULTIPLIER);
    if (value != null) {
      retry.multiplier(parseDouble(PROPERTY_RETRY_MULTIPLIER, value));
      retryConfigured = true;
    }
    value = properties.getProperty(PROPERTY_RETRY_JITTER_FRACTION);
    if (value != null) {
      retry.jitterFraction(parseDouble(PROPERTY_RETRY_JITTER_FRACTION, value));
      retryConfigured = true;
    }
    if (retryConfigured) {
      this.retryPolicy(retry.build());
    }
    return this;
  }

  @Override
  public ConnectionManager build() {
    if (this.brokerConnection == null) {
      this.brokerConnection = new RabbitMqBrokerConnection();
    }
    return new AmqpConnectionManager(this);
  }

  BrokerConnection brokerConnection() {
    return this.brokerConnection;
  }

  Address address() {
    return this.address;
  }

  Credentials credentials() {
    return this.credentials;
  }

  String name() {
    return this.name;
  }

  RetryPolicy retryPolicy() {
    return this.retryPolicy;
  }

  Duration connectTimeout() {
    return this.connectTimeout;
  }

  List<ConnectionManager.StateListener> listeners() {
    return this.listeners;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for '" + key + "': " + value, e);
    }
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for '" + key + "': " + value, e);
    }
  }

  private static URI toUri(String uriString) {
    if (uriString == null) {
      throw new IllegalArgumentException("URI cannot be null");
    }
    try {
      URI uri = new URI(uriString);
      if (!"amqp".equalsIgnoreCase(uri.getScheme())) {
        throw new IllegalArgumentException(
            "Wrong scheme in AMQP URI: " + uri.getScheme() + ". Should be amqp");
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URI: " + uriString, e);
    }
  }

  private static String uriDecode(String s) {
    try {
      // URLDecoder decodes '+' to a space, as for form encoding
      return URLDecoder.decode(s.replace("+", "%2B"), "US-ASCII");
    } catch (UnsupportedEncodingException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
