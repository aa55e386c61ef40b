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
package org.tessera.common.exceptions;

import java.util.List;

import com.google.common.base.Throwables;

/**
 * Message helpers for {@link UserException}, walking cause chains with Guava's {@link Throwables}.
 */
class ErrorHelper {

  private ErrorHelper() {
  }

  /**
   * @return "[root exception class]: [root exception message]", or an empty string without a cause
   */
  static String getRootMessage(Throwable cause) {
    if (cause == null) {
      return "";
    }
    Throwable root = Throwables.getRootCause(cause);
    String message = root.getClass().getSimpleName();
    return root.getMessage() == null ? message : message + ": " + root.getMessage();
  }

  /**
   * Renders every throwable of the chain with its stack frames, outermost first.
   */
  static String buildCausesMessage(Throwable t) {
    if (t == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    List<Throwable> chain = Throwables.getCausalChain(t);
    for (int i = 0; i < chain.size(); i++) {
      Throwable ex = chain.get(i);
      sb.append(i == 0 ? "  (" : "  Caused By (")
          .append(ex.getClass().getCanonicalName())
          .append(") ")
          .append(ex.getMessage())
          .append('\n');
      for (StackTraceElement frame : ex.getStackTrace()) {
        sb.append("    ")
            .append(frame.getClassName()).append('.').append(frame.getMethodName())
            .append("():").append(frame.getLineNumber())
            .append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * @return the first UserException in the cause chain of {@code ex}, or null if there is none
   */
  static UserException findWrappedUserException(Throwable ex) {
    if (ex == null) {
      return null;
    }
    for (Throwable cause : Throwables.getCausalChain(ex)) {
      if (cause instanceof UserException) {
        return (UserException) cause;
      }
    }
    return null;
  }
}
