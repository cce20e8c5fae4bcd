/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.exceptions;

import software.amazon.event.transactionpublisher.model.PublishedTransaction;

/** Describes why a record was abandoned. Handed to listeners, never thrown by the publisher. */
public class TransactionPublishFailure extends RuntimeException {

  private final String refNo;
  private final int attempts;

  public TransactionPublishFailure(
      PublishedTransaction record, int attempts, String message, Throwable cause) {
    super(
        String.format(
            "errorMessage=%s refNo=%s closeOfBusinessDate=%s attempts=%d cause=%s",
            message, record.getRefNo(), record.getCloseOfBusinessDate(), attempts, cause),
        cause);
    this.refNo = record.getRefNo();
    this.attempts = attempts;
  }

  public String getRefNo() {
    return refNo;
  }

  /** Number of publish calls made for the record before it was abandoned. */
  public int getAttempts() {
    return attempts;
  }
}
