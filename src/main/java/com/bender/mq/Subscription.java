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

/** Subscription to a queue. */
public interface Subscription {

  String queue();

  /**
   * Whether the subscription has not been cancelled.
   *
   * <p>A subscription stays active while the connection is recovering.
   *
   * @return true until {@link #cancel()} is called
   */
  boolean isActive();

  /**
   * Number of deliveries received and not settled yet.
   *
   * @return number of pending deliveries
   */
  int pendingCount();

  /**
   * Stop consuming.
   *
   * <p>Handler invocations in progress complete before the channel is closed. Idempotent.
   */
  void cancel();
}
