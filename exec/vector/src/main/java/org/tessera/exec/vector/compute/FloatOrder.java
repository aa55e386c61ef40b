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
package org.tessera.exec.vector.compute;

/**
 * Total order over floating point values used by every comparison: -0.0 equals 0.0, NaN equals NaN and sorts
 * above every other value.
 */
final class FloatOrder {

  private FloatOrder() {
  }

  static boolean equal(double a, double b) {
    return a == b || (a != a && b != b);
  }

  static int compare(double a, double b) {
    if (a < b) {
      return -1;
    }
    if (a > b) {
      return 1;
    }
    if (a == b) {
      return 0;
    }
    // at least one NaN
    boolean aNaN = a != a;
    boolean bNaN = b != b;
    if (aNaN && bNaN) {
      return 0;
    }
    return aNaN ? 1 : -1;
  }
}
