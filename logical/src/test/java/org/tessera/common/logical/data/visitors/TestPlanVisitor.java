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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.tessera.categories.PlannerTest;
import org.tessera.common.logical.PlanNode;
import org.tessera.common.logical.data.Filter;
import org.tessera.common.logical.data.Limit;
import org.tessera.common.logical.data.Projection;
import org.tessera.common.logical.data.Scan;
import org.tessera.common.types.Field;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.Schema;

@Category(PlannerTest.class)
public class TestPlanVisitor {

  static PlanNode samplePlan() {
    Schema schema = Schema.of(Field.of("id", LogicalType.INT64), new Field("state", LogicalType.UTF8, false));
    Scan scan = new Scan("default", "employee", schema);
    Filter filter = new Filter(scan, "state = 'CO'");
    Projection projection = new Projection(filter, Arrays.asList("id"), Schema.of(Field.of("id", LogicalType.INT64)));
    return new Limit(projection, 10);
  }

  /**
   * Records the callbacks and returns false from the configured one.
   */
  private static class RecordingVisitor implements PlanVisitor<RuntimeException> {
    final List<String> events = new ArrayList<>();
    final String stopAt;

    RecordingVisitor(String stopAt) {
      this.stopAt = stopAt;
    }

    @Override
    public boolean preVisit(PlanNode plan) {
      String event = "pre " + plan.getClass().getSimpleName();
      events.add(event);
      return !event.equals(stopAt);
    }

    @Override
    public boolean postVisit(PlanNode plan) {
      String event = "post " + plan.getClass().getSimpleName();
      events.add(event);
      return !event.equals(stopAt);
    }
  }

  @Test
  public void testVisitOrder() {
    RecordingVisitor visitor = new RecordingVisitor(null);

    assertTrue(samplePlan().accept(visitor));
    assertEquals(Arrays.asList(
        "pre Limit", "pre Projection", "pre Filter", "pre Scan",
        "post Scan", "post Filter", "post Projection", "post Limit"), visitor.events);
  }

  @Test
  public void testEarlyStopInPreVisit() {
    RecordingVisitor visitor = new RecordingVisitor("pre Filter");

    assertFalse(samplePlan().accept(visitor));
    assertEquals(Arrays.asList("pre Limit", "pre Projection", "pre Filter"), visitor.events);
  }

  @Test
  public void testEarlyStopInPostVisit() {
    RecordingVisitor visitor = new RecordingVisitor("post Scan");

    assertFalse(samplePlan().accept(visitor));
    assertEquals(Arrays.asList("pre Limit", "pre Projection", "pre Filter", "pre Scan", "post Scan"),
        visitor.events);
  }

  @Test
  public void testExceptionStopsRecursion() {
    List<String> seen = new ArrayList<>();
    PlanVisitor<Exception> failing = plan -> {
      seen.add(plan.display());
      if (plan instanceof Filter) {
        throw new Exception("stop at filter");
      }
      return true;
    };

    try {
      samplePlan().accept(failing);
      fail("expected the visitor to throw");
    } catch (Exception e) {
      assertEquals("stop at filter", e.getMessage());
    }
    assertEquals(3, seen.size());
  }

  @Test
  public void testIndentDisplay() {
    String expected = "Limit: 10\n"
        + "  Projection: id\n"
        + "    Filter: state = 'CO'\n"
        + "      Scan: default.employee";
    assertEquals(expected, samplePlan().displayIndent(false));
  }

  @Test
  public void testIndentDisplayWithSchema() {
    String expected = "Limit: 10 [id:Int64;N]\n"
        + "  Projection: id [id:Int64;N]\n"
        + "    Filter: state = 'CO' [id:Int64;N, state:Utf8]\n"
        + "      Scan: default.employee [id:Int64;N, state:Utf8]";
    assertEquals(expected, samplePlan().displayIndent(true));
  }

  @Test
  public void testGraphviz() {
    String dot = samplePlan().displayGraphviz();

    assertTrue(dot, dot.startsWith("// Begin Tessera GraphViz Plan"));
    assertTrue(dot, dot.contains("  subgraph cluster_1\n"));
    assertTrue(dot, dot.contains("    graph[label=\"Plan\"]\n"));
    assertTrue(dot, dot.contains("    2[shape=box label=\"Limit: 10\"]\n"));
    assertTrue(dot, dot.contains("    2 -> 3 [arrowhead=none, arrowtail=normal, dir=back]\n"));
    // quotes are not allowed inside labels
    assertTrue(dot, dot.contains("label=\"Filter: state = 'CO'\""));
    assertTrue(dot, dot.contains("graph[label=\"Detailed Plan\"]"));
    assertTrue(dot, dot.contains("Limit: 10\\nSchema: [id:Int64;N]"));
    assertTrue(dot, dot.endsWith("// End Tessera GraphViz Plan\n"));
  }

  @Test
  public void testQuoted() {
    assertEquals("\"say _hi_\"", GraphvizVisitor.quoted("say \"hi\""));
  }
}
