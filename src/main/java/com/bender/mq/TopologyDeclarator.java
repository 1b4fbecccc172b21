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
 * Declares exchanges, queues, and bindings.
 *
 * <p>Declared entities are recorded and declared again after each reconnection, before consumers
 * subscribe again.
 */
public interface TopologyDeclarator {

  /**
   * Declare the exchanges, then the queues, then the bindings of a topology.
   *
   * <p>Declaring again an identical topology is a no-op for the broker. Link loss is retried.
   *
   * @param topology the topology to declare
   * @throws AmqpException.AmqpTopologyConflictException if an entity exists with different
   *     parameters
   * @throws AmqpException.AmqpDeclareFailedException if the declaration fails for another reason
   */
  void ensure(TopologySpec topology);

  /**
   * The topology recovered after reconnection.
   *
   * @return all the successfully declared entities
   */
  TopologySpec recorded();
}
