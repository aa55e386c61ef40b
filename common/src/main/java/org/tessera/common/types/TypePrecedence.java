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
package org.tessera.common.types;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.graph.ImmutableValueGraph;
import com.google.common.graph.ValueGraphBuilder;

/**
 * Numeric widening graph used to pick the promotion type of two operands.
 */
public class TypePrecedence {

  // A weighted directed graph of lossless (or, for 64 bit integers into Float64, accepted) numeric widenings.
  // Every edge starts at 10f so that fewer conversions win. Conversions into floating point cost 11f so that
  // an integer target is preferred when both are reachable at the same depth.
  public static final ImmutableValueGraph<TypeId, Float> PROMOTION_GRAPH = ValueGraphBuilder
    .directed()
    .<TypeId, Float>immutable()

    // int widening
    .putEdgeValue(TypeId.INT8, TypeId.INT16, 10f)
    .putEdgeValue(TypeId.INT16, TypeId.INT32, 10f)
    .putEdgeValue(TypeId.INT32, TypeId.INT64, 10f)
    // int conversions
    .putEdgeValue(TypeId.INT16, TypeId.FLOAT32, 11f)
    .putEdgeValue(TypeId.INT32, TypeId.FLOAT64, 11f)
    .putEdgeValue(TypeId.INT64, TypeId.FLOAT64, 11f)

    // unsigned int widening
    .putEdgeValue(TypeId.UINT8, TypeId.UINT16, 10f)
    .putEdgeValue(TypeId.UINT16, TypeId.UINT32, 10f)
    .putEdgeValue(TypeId.UINT32, TypeId.UINT64, 10f)
    // unsigned into the next wider signed type
    .putEdgeValue(TypeId.UINT8, TypeId.INT16, 10f)
    .putEdgeValue(TypeId.UINT16, TypeId.INT32, 10f)
    .putEdgeValue(TypeId.UINT32, TypeId.INT64, 10f)
    // unsigned conversions
    .putEdgeValue(TypeId.UINT16, TypeId.FLOAT32, 11f)
    .putEdgeValue(TypeId.UINT32, TypeId.FLOAT64, 11f)
    .putEdgeValue(TypeId.UINT64, TypeId.FLOAT64, 11f)

    // float widening
    .putEdgeValue(TypeId.FLOAT32, TypeId.FLOAT64, 10f)

    .build();

  private TypePrecedence() {
  }

  /**
   * Searches the widening graph for the path of least total cost using Dijkstra's algorithm.
   * @param fromType type to convert from
   * @param toType type to convert to
   * @return 0 for identical types, a positive path cost, or +∞ if no path exists
   */
  public static float computeCost(TypeId fromType, TypeId toType) {
    if (fromType == toType) {
      return 0f;
    }
    if (!PROMOTION_GRAPH.nodes().contains(fromType) || !PROMOTION_GRAPH.nodes().contains(toType)) {
      return Float.POSITIVE_INFINITY;
    }

    TreeSet<VertexDatum> remaining = new TreeSet<>();
    Map<TypeId, VertexDatum> vertexData = new HashMap<>();
    Set<TypeId> shortestPath = new HashSet<>();

    VertexDatum sourceDatum = new VertexDatum(fromType, 0, null);
    remaining.add(sourceDatum);
    vertexData.put(fromType, sourceDatum);

    while (!remaining.isEmpty()) {
      VertexDatum vertexDatum = remaining.pollFirst();
      TypeId vertex = vertexDatum.vertex;
      shortestPath.add(vertex);

      if (vertex == toType) {
        return vertexDatum.totalDistance;
      }

      for (TypeId successor : PROMOTION_GRAPH.successors(vertex)) {
        if (shortestPath.contains(successor)) {
          continue;
        }

        float distance = PROMOTION_GRAPH.edgeValue(vertex, successor).orElseThrow(IllegalStateException::new);
        float totalDistance = vertexDatum.totalDistance + distance;

        VertexDatum successorDatum = vertexData.get(successor);
        if (successorDatum == null) {
          successorDatum = new VertexDatum(successor, totalDistance, vertexDatum);
          vertexData.put(successor, successorDatum);
          remaining.add(successorDatum);
        } else if (totalDistance < successorDatum.totalDistance) {
          // re-insert so that the TreeSet ordering reflects the new distance
          remaining.remove(successorDatum);
          successorDatum.totalDistance = totalDistance;
          successorDatum.predecessor = vertexDatum;
          remaining.add(successorDatum);
        }
      }
    }

    return Float.POSITIVE_INFINITY;
  }

  /**
   * Picks the numeric type both operands widen into at the least combined cost. Ties go to the type declared
   * first in {@link TypeId}, which puts integers ahead of floating point.
   *
   * @return the promotion type, or empty when either operand is not numeric
   */
  public static Optional<TypeId> getPromotionType(TypeId left, TypeId right) {
    if (!left.isNumeric() || !right.isNumeric()) {
      return Optional.empty();
    }
    if (left == right) {
      return Optional.of(left);
    }

    TypeId best = null;
    float bestCost = Float.POSITIVE_INFINITY;
    for (TypeId candidate : TypeId.values()) {
      if (!candidate.isNumeric()) {
        continue;
      }
      float cost = computeCost(left, candidate) + computeCost(right, candidate);
      if (cost < bestCost) {
        bestCost = cost;
        best = candidate;
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Logical type flavour of {@link #getPromotionType(TypeId, TypeId)}.
   */
  public static Optional<LogicalType> getPromotionType(LogicalType left, LogicalType right) {
    return getPromotionType(left.getTypeId(), right.getTypeId()).map(LogicalType::of);
  }

  static class VertexDatum implements Comparable<VertexDatum> {
    final TypeId vertex;
    float totalDistance;
    VertexDatum predecessor;

    VertexDatum(TypeId vertex, float totalDistance, VertexDatum predecessor) {
      this.vertex = vertex;
      this.totalDistance = totalDistance;
      this.predecessor = predecessor;
    }

    @Override
    public int compareTo(VertexDatum other) {
      int distComparison = Float.compare(this.totalDistance, other.totalDistance);
      // TreeSet uses this method to determine member equality, so vertices with the same
      // distance must still be told apart
      return distComparison != 0 ? distComparison : this.vertex.compareTo(other.vertex);
    }

    @Override
    public String toString() {
      return String.format("vertex: %s, totalDistance: %f, predecessor: %s", vertex, totalDistance, predecessor);
    }
  }
}
