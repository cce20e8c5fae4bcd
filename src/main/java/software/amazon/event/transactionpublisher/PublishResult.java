/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher;

import static software.amazon.event.transactionpublisher.PublishResult.ErrorType.REPORT_ONLY;
import static software.amazon.event.transactionpublisher.PublishResult.ErrorType.RETRY;

/** Outcome of a single publish call. Failures are values, not exceptions. */
public final class PublishResult {

  public enum ErrorType {
    REPORT_ONLY,
    RETRY
  }

  public static class Error {

    private final ErrorType type;
    private final String message;
    private final Throwable cause;

    private Error(final ErrorType type, final String message, final Throwable cause) {
      this.message = message;
      this.cause = cause;
      this.type = type;
    }

    public static Error reportOnly(final String message, final Throwable cause) {
      return new Error(REPORT_ONLY, message, cause);
    }

    public static Error reportOnly(final String message) {
      return new Error(REPORT_ONLY, message, null);
    }

    public static Error retry(final String message, final Throwable cause) {
      return new Error(RETRY, message, cause);
    }

    public static Error retry(final Throwable cause) {
      return new Error(RETRY, String.valueOf(cause), cause);
    }

    public ErrorType getType() {
      return type;
    }

    public String getMessage() {
      return message;
    }

    public Throwable getCause() {
      return cause;
    }

    @Override
    public String toString() {
      return String.format("Error{type=%s, message=%s}", type, message);
    }
  }

  private static final PublishResult SUCCESS = new PublishResult(null);

  private final Error error;

  private PublishResult(Error error) {
    this.error = error;
  }

  public static PublishResult success() {
    return SUCCESS;
  }

  public static PublishResult failure(Error error) {
    if (error == null) throw new IllegalArgumentException("error must not be null");
    return new PublishResult(error);
  }

  public boolean isSuccess() {
    return !isFailure();
  }

  public boolean isFailure() {
    return error != null;
  }

  public Error error() {
    if (isSuccess())
      throw new IllegalStateException("Result is a success and cannot be accessed as failure.");
    return error;
  }

  @Override
  public String toString() {
    return isSuccess() ? "PublishResult{success}" : "PublishResult{failure=" + error + "}";
  }
}
