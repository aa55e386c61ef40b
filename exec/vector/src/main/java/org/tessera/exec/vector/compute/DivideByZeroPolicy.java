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

import java.util.Locale;

import org.tessera.common.config.CommonConstants;
import org.tessera.common.exceptions.UserException;

/**
 * What division or remainder by zero produces. Chosen by {@link CommonConstants#DIVIDE_BY_ZERO_POLICY}.
 */
public enum DivideByZeroPolicy {
  /** the row becomes null and is counted in the {@link EvalContext} */
  NULL,
  /** the evaluation fails with DIVIDE_BY_ZERO */
  ERROR;

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DivideByZeroPolicy.class);

  public static DivideByZeroPolicy fromString(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw UserException.systemError(e)
          .message("Invalid value '%s' for %s, expected 'null' or 'error'", value,
              CommonConstants.DIVIDE_BY_ZERO_POLICY)
          .build(logger);
    }
  }
}
