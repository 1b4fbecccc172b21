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

import com.bender.mq.AmqpException;
import com.bender.mq.BrokerConnection;
import java.io.IOException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static AmqpException convert(Exception e) {
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    } else if (e instanceof IOException) {
      return convert((IOException) e, null);
    } else {
      return new AmqpException(e);
    }
  }

  static AmqpException convert(IOException e, String format, Object... args) {
    String message;
    if (format == null) {
      message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    } else {
      message = String.format(format, args) + " (" + RetryUtils.exceptionMessage(e) + ")";
    }
    if (e instanceof BrokerConnection.AuthenticationException) {
      return new AmqpException.AmqpSecurityException(message, e);
    } else if (e instanceof BrokerConnection.ProtocolException) {
      return new AmqpException.AmqpProtocolException(
          ((BrokerConnection.ProtocolException) e).replyCode(), message, e);
    } else {
      return new AmqpException.AmqpConnectionException(message, e);
    }
  }

  static boolean isLinkLost(Exception e) {
    return e instanceof AmqpException.AmqpConnectionException;
  }

  /**
   * Whether an operation can be retried after this failure.
   *
   * <p>Link loss and not-ready connections can be retried, not a closed connection manager.
   *
   * @param e the failure
   * @return true if the operation can be retried
   */
  static boolean isRetryable(Exception e) {
    return isLinkLost(e)
        || (e instanceof AmqpException.AmqpNotReadyException
            && !(e instanceof AmqpException.AmqpResourceClosedException));
  }

  static boolean isConflict(AmqpException e) {
    return e instanceof AmqpException.AmqpProtocolException
        && ((AmqpException.AmqpProtocolException) e).replyCode()
            == BrokerConnection.ProtocolException.PRECONDITION_FAILED;
  }
}
