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
package org.tessera.common.logical;

import java.io.IOException;
import java.util.List;

import org.tessera.common.logical.data.CreateDatabasePlan;
import org.tessera.common.logical.data.DropDatabasePlan;
import org.tessera.common.logical.data.Filter;
import org.tessera.common.logical.data.Limit;
import org.tessera.common.logical.data.Projection;
import org.tessera.common.logical.data.Scan;
import org.tessera.common.logical.data.visitors.GraphvizVisitor;
import org.tessera.common.logical.data.visitors.IndentVisitor;
import org.tessera.common.logical.data.visitors.PlanVisitor;
import org.tessera.common.types.Schema;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a query plan. Nodes are immutable and only serialize the properties they annotate.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op")
@JsonSubTypes({
    @JsonSubTypes.Type(Scan.class),
    @JsonSubTypes.Type(Filter.class),
    @JsonSubTypes.Type(Projection.class),
    @JsonSubTypes.Type(Limit.class),
    @JsonSubTypes.Type(CreateDatabasePlan.class),
    @JsonSubTypes.Type(DropDatabasePlan.class)
})
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE,
    fieldVisibility = Visibility.NONE)
public abstract class PlanNode {

  /**
   * @return output schema of this node
   */
  public abstract Schema getSchema();

  /**
   * @return child inputs in visiting order, empty for leaves
   */
  public abstract List<PlanNode> getInputs();

  /**
   * @return one line description used by the printers
   */
  public abstract String display();

  /**
   * Walks this node and its inputs depth first. {@link PlanVisitor#preVisit} runs before the inputs are visited
   * and {@link PlanVisitor#postVisit} after. The walk stops as soon as a callback returns false or throws.
   *
   * @return false if the walk was stopped early
   */
  public <E extends Exception> boolean accept(PlanVisitor<E> visitor) throws E {
    if (!visitor.preVisit(this)) {
      return false;
    }
    for (PlanNode input : getInputs()) {
      if (!input.accept(visitor)) {
        return false;
      }
    }
    return visitor.postVisit(this);
  }

  /**
   * Formats the plan with one line per node, for example
   * <pre>
   * Limit: 10
   *   Filter: state = 'CO'
   *     Scan: default.employee
   * </pre>
   */
  public String displayIndent(boolean withSchema) {
    StringBuilder sb = new StringBuilder();
    try {
      accept(new IndentVisitor(sb, withSchema));
    } catch (IOException e) {
      throw new IllegalStateException("StringBuilder does not fail on append", e);
    }
    return sb.toString();
  }

  /**
   * Formats the plan in the DOT language. The output contains two clusters, the second one with schemas.
   */
  public String displayGraphviz() {
    StringBuilder sb = new StringBuilder();
    try {
      GraphvizVisitor.write(this, sb);
    } catch (IOException e) {
      throw new IllegalStateException("StringBuilder does not fail on append", e);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return displayIndent(false);
  }
}
