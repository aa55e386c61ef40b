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

import org.slf4j.Logger;

/**
 * Base class for all user facing exceptions. The goal is to separate out common error conditions where we can give
 * callers useful feedback.
 * <p>Every user exception carries an {@link ErrorType} and a context list. Messages of type related errors name
 * the offending logical types.
 * <p>Exceptions are created through the static builders, for example
 * <pre>
 *   throw UserException.typeMismatchError()
 *       .message("Cannot compare %s with %s", left, right)
 *       .build(logger);
 * </pre>
 * <p>INVARIANT_VIOLATION and SYSTEM errors are programming errors. They are logged at ERROR and must not be caught
 * and retried.
 */
public class UserException extends TesseraRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  /**
   * Wraps the passed exception inside a system error.
   * <p>If the wrapped exception is, or wraps, a user exception it will be returned by {@link Builder#build(Logger)}
   * instead of creating a new exception. Any added context will be added to the user exception as well.
   */
  public static Builder systemError(final Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  /**
   * Creates a builder for a cast between logical types that has no defined or lossless mapping.
   *
   * @see ErrorType#UNSUPPORTED_CAST
   */
  public static Builder unsupportedCastError() {
    return unsupportedCastError(null);
  }

  public static Builder unsupportedCastError(final Throwable cause) {
    return new Builder(ErrorType.UNSUPPORTED_CAST, cause);
  }

  /**
   * Creates a builder for operands that are not comparable or arithmetic-compatible.
   *
   * @see ErrorType#TYPE_MISMATCH
   */
  public static Builder typeMismatchError() {
    return new Builder(ErrorType.TYPE_MISMATCH, null);
  }

  /**
   * @see ErrorType#INDEX_OUT_OF_RANGE
   */
  public static Builder indexOutOfRangeError() {
    return new Builder(ErrorType.INDEX_OUT_OF_RANGE, null);
  }

  /**
   * @see ErrorType#DIVIDE_BY_ZERO
   */
  public static Builder divideByZeroError() {
    return new Builder(ErrorType.DIVIDE_BY_ZERO, null);
  }

  /**
   * @see ErrorType#UNKNOWN_FUNCTION
   */
  public static Builder unknownFunctionError() {
    return new Builder(ErrorType.UNKNOWN_FUNCTION, null);
  }

  /**
   * Creates a builder for a function invoked with arguments it cannot accept.
   *
   * @see ErrorType#FUNCTION
   */
  public static Builder functionError() {
    return functionError(null);
  }

  public static Builder functionError(final Throwable cause) {
    return new Builder(ErrorType.FUNCTION, cause);
  }

  /**
   * @see ErrorType#UNKNOWN_DATABASE
   */
  public static Builder unknownDatabaseError() {
    return new Builder(ErrorType.UNKNOWN_DATABASE, null);
  }

  /**
   * @see ErrorType#DATABASE_ALREADY_EXISTS
   */
  public static Builder databaseAlreadyExistsError() {
    return new Builder(ErrorType.DATABASE_ALREADY_EXISTS, null);
  }

  /**
   * @see ErrorType#UNKNOWN_TABLE
   */
  public static Builder unknownTableError() {
    return new Builder(ErrorType.UNKNOWN_TABLE, null);
  }

  /**
   * @see ErrorType#UNKNOWN_TABLE_FUNCTION
   */
  public static Builder unknownTableFunctionError() {
    return new Builder(ErrorType.UNKNOWN_TABLE_FUNCTION, null);
  }

  /**
   * Creates a builder for a violated internal invariant.
   *
   * @see ErrorType#INVARIANT_VIOLATION
   */
  public static Builder invariantViolation() {
    return invariantViolation(null);
  }

  public static Builder invariantViolation(final Throwable cause) {
    return new Builder(ErrorType.INVARIANT_VIOLATION, cause);
  }

  /**
   * Builder class for UserException. You can wrap an existing exception, in this case it will first check if
   * this exception is, or wraps, a UserException. If it does then the builder will use the user exception as it is
   * (it will ignore the message passed to the constructor) and will add any additional context information to the
   * exception's context
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    private Builder(final ErrorType errorType, final Throwable cause) {
      this.cause = cause;

      uex = ErrorHelper.findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
      } else {
        this.errorType = errorType;
        this.context = new UserExceptionContext();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * sets or replaces the error message.
     * <p>This will be ignored if this builder is wrapping a user exception
     *
     * @see String#format(String, Object...)
     */
    public Builder message(final String format, final Object... args) {
      // we can't replace the message of a user exception
      if (uex == null && format != null) {
        this.message = args.length == 0 ? format : String.format(format, args);
      }
      return this;
    }

    /**
     * add a string line to the bottom of the context
     */
    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    /**
     * add a string value to the bottom of the context
     */
    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    /**
     * add a long value to the bottom of the context
     */
    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    /**
     * pushes a string value to the top of the context
     */
    public Builder pushContext(final String name, final String value) {
      context.push(name, value);
      return this;
    }

    public Builder pushContext(final String name, final long value) {
      context.push(name, value);
      return this;
    }

    /**
     * builds a user exception or returns the wrapped one. Programming errors are logged at ERROR, everything else
     * at INFO since it is the caller's concern.
     *
     * @param logger the logger of the class raising the error
     * @return user exception
     */
    public UserException build(final Logger logger) {
      if (uex != null) {
        return uex;
      }

      boolean isProgrammingError = errorType == ErrorType.SYSTEM || errorType == ErrorType.INVARIANT_VIOLATION;

      // make sure system errors use the root error message and display the root cause class name
      if (errorType == ErrorType.SYSTEM && message == null) {
        message = ErrorHelper.getRootMessage(cause);
      }

      final UserException newException = new UserException(this);

      if (isProgrammingError) {
        logger.error(newException.getMessage(), newException);
      } else {
        logger.info("User Error Occurred: {}", newException.getOriginalMessage());
      }

      return newException;
    }
  }

  private final ErrorType errorType;

  private final UserExceptionContext context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public UserExceptionContext getContext() {
    return context;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  /**
   * generates the message that will be displayed to the caller without the stack trace.
   *
   * @return non verbose error message
   */
  @Override
  public String getMessage() {
    return generateMessage(true);
  }

  /**
   * @param includeErrorId whether the trailing [Error Id: ...] line is rendered
   */
  public String getMessage(boolean includeErrorId) {
    return generateMessage(includeErrorId);
  }

  /**
   * @return the error message that was passed to the builder
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  /**
   * generates the message that will be displayed to the caller. The message also contains the stack trace.
   *
   * @return verbose error message
   */
  public String getVerboseMessage() {
    return getVerboseMessage(true);
  }

  public String getVerboseMessage(boolean includeErrorId) {
    return generateMessage(includeErrorId) + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }

  /**
   * Generates a user error message that has the following structure:
   * ERROR TYPE ERROR: ERROR_MESSAGE
   * CONTEXT
   * [Error Id: ERROR_ID]
   */
  private String generateMessage(boolean includeErrorId) {
    return errorType + " ERROR: " + super.getMessage() + "\n\n" +
        context.generateContextMessage(includeErrorId);
  }
}
