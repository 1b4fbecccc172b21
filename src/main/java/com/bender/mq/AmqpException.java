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

/**
 * Root of the library exception hierarchy.
 *
 * <p>Every expected failure mode of a public operation is reported with a dedicated subclass, so
 * callers can tell transient problems (e.g. {@link AmqpNotReadyException}) from configuration
 * problems (e.g. {@link AmqpTopologyConflictException}).
 */
public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Transient loss of the link to the broker. Retried internally. */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpConnectionException(String format, Object... args) {
      super(format, args);
    }
  }

  /** The connection could not be established, the connection manager is closed. */
  public static class AmqpConnectFailedException extends AmqpException {

    public AmqpConnectFailedException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpConnectFailedException(String format, Object... args) {
      super(format, args);
    }
  }

  /** The broker rejected the credentials. Never retried. */
  public static class AmqpSecurityException extends AmqpException {

    public AmqpSecurityException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The broker rejected an operation at the protocol level. */
  public static class AmqpProtocolException extends AmqpException {

    private final int replyCode;

    public AmqpProtocolException(int replyCode, String message, Throwable cause) {
      super(message, cause);
      this.replyCode = replyCode;
    }

    /**
     * AMQP reply code sent by the broker.
     *
     * @return the reply code
     */
    public int replyCode() {
      return this.replyCode;
    }
  }

  /** The connection is not ready (yet). The caller can retry or wait. */
  public static class AmqpNotReadyException extends AmqpException {

    public AmqpNotReadyException(String format, Object... args) {
      super(format, args);
    }

    public AmqpNotReadyException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The resource is closed and will not become ready again. */
  public static class AmqpResourceClosedException extends AmqpNotReadyException {

    public AmqpResourceClosedException(String message) {
      super(message);
    }

    public AmqpResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A topology declaration failed. */
  public static class AmqpDeclareFailedException extends AmqpException {

    public AmqpDeclareFailedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * A declaration conflicts with an existing entity (e.g. different durability).
   *
   * <p>This is a configuration error, it is never retried.
   */
  public static class AmqpTopologyConflictException extends AmqpDeclareFailedException {

    public AmqpTopologyConflictException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A message could not be published. */
  public static class AmqpPublishFailedException extends AmqpException {

    /** Why the publish failed. */
    public enum Reason {
      /** The retry budget or the deadline got exhausted. */
      TIMEOUT,
      /** Non-retryable failure (protocol rejection, closed connection). */
      IO
    }

    private final Reason reason;

    public AmqpPublishFailedException(Reason reason, String message, Throwable cause) {
      super(message, cause);
      this.reason = reason;
    }

    public Reason reason() {
      return this.reason;
    }
  }

  /** A consumer handler failed while processing a delivery. */
  public static class AmqpHandlerException extends AmqpException {

    private final long deliveryTag;

    public AmqpHandlerException(long deliveryTag, String message, Throwable cause) {
      super(message, cause);
      this.deliveryTag = deliveryTag;
    }

    public long deliveryTag() {
      return this.deliveryTag;
    }
  }
}
