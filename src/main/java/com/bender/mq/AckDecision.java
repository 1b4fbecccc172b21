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

/** Outcome of the processing of a delivery, returned by a {@link Consumer.DeliveryHandler}. */
public final class AckDecision {

  private static final AckDecision ACK = new AckDecision(false, false);
  private static final AckDecision REJECT_REQUEUE = new AckDecision(true, true);
  private static final AckDecision REJECT_DISCARD = new AckDecision(true, false);

  private final boolean reject;
  private final boolean requeue;

  private AckDecision(boolean reject, boolean requeue) {
    this.reject = reject;
    this.requeue = requeue;
  }

  /**
   * Acknowledge the delivery, the broker can forget the message.
   *
   * @return the ack decision
   */
  public static AckDecision ack() {
    return ACK;
  }

  /**
   * Reject the delivery.
   *
   * @param requeue whether the broker should requeue the message
   * @return the reject decision
   */
  public static AckDecision reject(boolean requeue) {
    return requeue ? REJECT_REQUEUE : REJECT_DISCARD;
  }

  public boolean isAck() {
    return !this.reject;
  }

  public boolean isReject() {
    return this.reject;
  }

  public boolean requeue() {
    return this.requeue;
  }

  @Override
  public String toString() {
    return this.reject ? "Reject{requeue=" + this.requeue + "}" : "Ack";
  }
}
