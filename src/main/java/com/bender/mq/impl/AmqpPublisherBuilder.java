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

import com.bender.mq.Publisher;
import com.bender.mq.PublisherBuilder;
import com.bender.mq.RetryPolicy;

class AmqpPublisherBuilder implements PublisherBuilder {

  private final AmqpConnectionManager connectionManager;
  private RetryPolicy retryPolicy;

  AmqpPublisherBuilder(AmqpConnectionManager connectionManager) {
    this.connectionManager = connectionManager;
    this.retryPolicy = connectionManager.retryPolicy();
  }

  @Override
  public PublisherBuilder retryPolicy(RetryPolicy retryPolicy) {
    if (retryPolicy == null) {
      throw new IllegalArgumentException("Retry policy cannot be null");
    }
    this.retryPolicy = retryPolicy;
    return this;
  }

  @Override
  public Publisher build() {
    return new AmqpPublisher(this);
  }

  AmqpConnectionManager connectionManager() {
    return this.connectionManager;
  }

  RetryPolicy retryPolicy() {
    return this.retryPolicy;
  }
}
