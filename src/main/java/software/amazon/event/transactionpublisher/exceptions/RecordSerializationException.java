/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.exceptions;

public class RecordSerializationException extends RuntimeException {

  public RecordSerializationException(String refNo, Throwable cause) {
    super(String.format("Unable to serialize record refNo=%s", refNo), cause);
  }
}
