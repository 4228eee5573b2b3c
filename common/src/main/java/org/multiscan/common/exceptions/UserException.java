/*
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
package org.multiscan.common.exceptions;

import java.util.List;

import org.slf4j.Logger;

/**
 * Base class for all errors surfaced by a multi-file scan. Every failure in
 * binding, pruning or per-file mapping aborts the scan with one of these.
 * <p>An exception is created through one of the static builders, one per
 * {@link ErrorType}:
 * <pre>
 * throw UserException.validationError()
 *     .message("Hive partition mismatch between file \"%s\" and \"%s\"", first, other)
 *     .addContext("Reader", "parquet")
 *     .build(logger);
 * </pre>
 * <p>If the wrapped cause already is, or wraps, a user exception, that exception
 * is returned by {@link Builder#build(Logger)} and any added context is appended
 * to it.
 *
 * @see ErrorType
 */
public class UserException extends ScanRuntimeException {
  private static final long serialVersionUID = 7813206427862127011L;

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(UserException.class);

  /**
   * Wraps the passed exception inside a system error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder systemError(final Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  /**
   * File access disabled by configuration.
   *
   * @see ErrorType#PERMISSION
   * @return user exception builder
   */
  public static Builder permissionError() {
    return permissionError(null);
  }

  public static Builder permissionError(final Throwable cause) {
    return new Builder(ErrorType.PERMISSION, cause);
  }

  /**
   * NULL or malformed input: path arguments, option values, persisted state.
   *
   * @see ErrorType#PARSE
   * @return user exception builder
   */
  public static Builder parseError() {
    return parseError(null);
  }

  public static Builder parseError(final Throwable cause) {
    return new Builder(ErrorType.PARSE, cause);
  }

  /**
   * A file could not be listed, or its schema does not fit the scan schema.
   *
   * @see ErrorType#DATA_READ
   * @return user exception builder
   */
  public static Builder dataReadError() {
    return dataReadError(null);
  }

  public static Builder dataReadError(final Throwable cause) {
    return new Builder(ErrorType.DATA_READ, cause);
  }

  /**
   * Schema or option inconsistency detected while binding the scan.
   *
   * @see ErrorType#VALIDATION
   * @return user exception builder
   */
  public static Builder validationError() {
    return validationError(null);
  }

  public static Builder validationError(final Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  /**
   * @see ErrorType#RESOURCE
   * @return user exception builder
   */
  public static Builder resourceError() {
    return resourceError(null);
  }

  public static Builder resourceError(final Throwable cause) {
    return new Builder(ErrorType.RESOURCE, cause);
  }

  /**
   * Invariant violation that correct binding makes unreachable. Logged as ERROR.
   *
   * @see ErrorType#INTERNAL_ERROR
   * @return user exception builder
   */
  public static Builder internalError() {
    return internalError(null);
  }

  public static Builder internalError(final Throwable cause) {
    return new Builder(ErrorType.INTERNAL_ERROR, cause);
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
     *
     * @param format format string
     * @param args Arguments referenced by the format specifiers in the format string
     * @return this builder
     */
    public Builder message(final String format, final Object... args) {
      // we can't replace the message of a user exception
      if (uex == null && format != null) {
        this.message = args.length == 0 ? format : String.format(format, args);
      }
      return this;
    }

    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    public Builder pushContext(final String value) {
      context.push(value);
      return this;
    }

    public Builder pushContext(final String name, final String value) {
      context.push(name, value);
      return this;
    }

    /**
     * Builds a user exception or returns the wrapped one, logging a newly
     * created exception to the given logger. Internal and system errors are
     * logged as ERROR, user mistakes as INFO.
     *
     * @param logger the logger of the class reporting the error
     * @return user exception
     */
    public UserException build(final Logger logger) {
      if (uex != null) {
        return uex;
      }

      boolean isSystemError = errorType == ErrorType.SYSTEM;

      // make sure system errors use the root error message and display the root cause class name
      if (isSystemError) {
        message = ErrorHelper.getRootMessage(cause);
      }

      final UserException newException = new UserException(this);

      if (isSystemError || errorType == ErrorType.INTERNAL_ERROR) {
        logger.error(newException.getMessage(), newException);
      } else {
        logger.info("User Error Occurred: {}", newException.getMessage(), newException);
      }

      return newException;
    }

    /**
     * Builds the exception, logging through the UserException logger.
     */
    public UserException build() {
      return build(logger);
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

  /**
   * generates the message that will be displayed to the client without the stack trace.
   *
   * @return non verbose error message
   */
  @Override
  public String getMessage() {
    return generateMessage(true);
  }

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
   * generates the message that will be displayed to the client. The message also contains the stack trace.
   *
   * @return verbose error message
   */
  public String getVerboseMessage() {
    return generateMessage(true) + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  public List<String> getContext() {
    return context.getContextLines();
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
