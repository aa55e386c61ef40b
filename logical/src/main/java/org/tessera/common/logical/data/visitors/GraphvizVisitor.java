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

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

import org.tessera.common.logical.PlanNode;

/**
 * Formats plans for graphical display using the DOT language of <a href="https://graphviz.org/">graphviz</a>.
 * Node ids are shared between clusters written by the same visitor so that a document can hold several
 * renderings of one plan.
 */
public class GraphvizVisitor implements PlanVisitor<IOException> {

  private final Appendable out;
  private boolean withSchema;
  private int idGen;

  // ids of all parent nodes of the node being visited
  private final Deque<Integer> parentIds = new ArrayDeque<>();

  public GraphvizVisitor(Appendable out) {
    this.out = out;
  }

  /**
   * Writes a complete DOT document with a plain cluster and a detailed cluster that includes schemas.
   */
  public static void write(PlanNode plan, Appendable out) throws IOException {
    GraphvizVisitor visitor = new GraphvizVisitor(out);
    out.append("// Begin Tessera GraphViz Plan (see https://graphviz.org)\n");
    out.append("digraph {\n");

    visitor.startCluster("Plan");
    plan.accept(visitor);
    visitor.endCluster();

    visitor.setWithSchema(true);
    visitor.startCluster("Detailed Plan");
    plan.accept(visitor);
    visitor.endCluster();

    out.append("}\n");
    out.append("// End Tessera GraphViz Plan\n");
  }

  public void setWithSchema(boolean withSchema) {
    this.withSchema = withSchema;
  }

  public void startCluster(String title) throws IOException {
    out.append("  subgraph cluster_").append(String.valueOf(nextId())).append('\n');
    out.append("  {\n");
    out.append("    graph[label=").append(quoted(title)).append("]\n");
  }

  public void endCluster() throws IOException {
    out.append("  }\n");
  }

  @Override
  public boolean preVisit(PlanNode plan) throws IOException {
    int id = nextId();

    String label = withSchema
        ? plan.display() + "\\nSchema: " + plan.getSchema()
        : plan.display();
    out.append("    ").append(String.valueOf(id)).append("[shape=box label=").append(quoted(label)).append("]\n");

    Integer parentId = parentIds.peek();
    if (parentId != null) {
      out.append("    ").append(String.valueOf(parentId)).append(" -> ").append(String.valueOf(id))
          .append(" [arrowhead=none, arrowtail=normal, dir=back]\n");
    }

    parentIds.push(id);
    return true;
  }

  @Override
  public boolean postVisit(PlanNode plan) {
    parentIds.pop();
    return true;
  }

  private int nextId() {
    return ++idGen;
  }

  /**
   * makes a quoted string suitable for inclusion in a graphviz chart
   */
  static String quoted(String label) {
    return "\"" + label.replace('"', '_') + "\"";
  }
}
