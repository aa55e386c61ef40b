/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tessera.common.logical.data.visitors;

import org.tessera.common.logical.PlanNode;

/**
 * Depth first walk over {@link PlanNode}s. For a plan like
 * <pre>
 * Projection: id
 *   Filter: state = 'CO'
 *     Scan: default.employee
 * </pre>
 * the callbacks run in the order preVisit(Projection), preVisit(Filter), preVisit(Scan), postVisit(Scan),
 * postVisit(Filter), postVisit(Projection).
 *
 * @param <E> exception thrown by the visitor
 */
public interface PlanVisitor<E extends Exception> {

  /**
   * Invoked on a node before any of its inputs have been visited. If true is returned the recursion continues.
   * If false is returned or an exception is thrown the recursion stops immediately.
   */
  boolean preVisit(PlanNode plan) throws E;

  /**
   * Invoked on a node after all of its inputs have been visited. The return value is handled the same as the
   * return value of {@link #preVisit(PlanNode)}.
   */
  default boolean postVisit(PlanNode plan) throws E {
    return true;
  }
}
