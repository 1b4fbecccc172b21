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

import com.bender.mq.Consumer;
import com.bender.mq.ConsumerBuilder;

class AmqpConsumerBuilder implements ConsumerBuilder {

  private final AmqpConnectionManager connectionManager;
  private Consumer.ErrorObserver errorObserver = AmqpConsumer.LOGGING_ERROR_OBSERVER;

  AmqpConsumerBuilder(AmqpConnectionManager connectionManager) {
    this.connectionManager = connectionManager;
  }

  @Override
  public ConsumerBuilder errorObserver(Consumer.ErrorObserver errorObserver) {
    if (errorObserver == null) {
      throw new IllegalArgumentException("Error observer cannot be null");
    }
    this.errorObserver = errorObserver;
    return this;
  }

  @Override
  public Consumer build() {
    return new AmqpConsumer(this);
  }

  AmqpConnectionManager connectionManager() {
    return this.connectionManager;
  }

  Consumer.ErrorObserver errorObserver() {
    return this.errorObserver;
  }
}
