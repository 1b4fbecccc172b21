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

import com.bender.mq.InboundDelivery;
import java.util.concurrent.atomic.AtomicBoolean;

/** A delivery waiting for its acknowledgement. It can be settled only once. */
final class PendingDelivery {

  private final AtomicBoolean settled = new AtomicBoolean(false);
  private final DefaultChannelHandle channel;
  private final InboundDelivery delivery;

  PendingDelivery(DefaultChannelHandle channel, InboundDelivery delivery) {
    this.channel = channel;
    this.delivery = delivery;
  }

  /**
   * Mark the delivery as settled.
   *
   * @throws IllegalStateException if the delivery has already been settled
   */
  void settle() {
    if (!this.settled.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "Delivery " + this.delivery.deliveryTag() + " has already been settled");
    }
  }

  boolean isSettled() {
    return this.settled.get();
  }

  DefaultChannelHandle channel() {
    return this.channel;
  }

  InboundDelivery delivery() {
    return this.delivery;
  }

  long deliveryTag() {
    return this.delivery.deliveryTag();
  }

  long generation() {
    return this.channel.generation();
  }
}
