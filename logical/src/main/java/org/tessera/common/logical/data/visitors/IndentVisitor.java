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

import org.tessera.common.logical.PlanNode;

/**
 * Formats plans with a single line per node, children indented by two spaces.
 */
public class IndentVisitor implements PlanVisitor<IOException> {

  private final Appendable out;
  private final boolean withSchema;
  private int indent;

  /**
   * @param out destination of the formatted plan
   * @param withSchema whether each line ends with the node's output schema
   */
  public IndentVisitor(Appendable out, boolean withSchema) {
    this.out = out;
    this.withSchema = withSchema;
  }

  @Override
  public boolean preVisit(PlanNode plan) throws IOException {
    if (indent > 0) {
      out.append('\n');
    }
    for (int i = 0; i < indent; i++) {
      out.append("  ");
    }

    out.append(plan.display());
    if (withSchema) {
      out.append(' ').append(plan.getSchema().toString());
    }

    indent++;
    return true;
  }

  @Override
  public boolean postVisit(PlanNode plan) {
    indent--;
    return true;
  }
}
