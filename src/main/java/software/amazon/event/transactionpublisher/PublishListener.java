/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher;

import software.amazon.event.transactionpublisher.exceptions.TransactionPublishFailure;
import software.amazon.event.transactionpublisher.model.PublishedTransaction;

/**
 * Side channel for the per-record outcome of a publish call, since {@link TransactionPublisher}
 * never reports partial failures to its caller. Callbacks run on the publishing thread.
 */
public interface PublishListener {

  PublishListener NONE = new PublishListener() {};

  /**
   * @param record the published record
   * @param attempts number of publish calls it took, starting at 1
   */
  default void onPublished(PublishedTransaction record, int attempts) {}

  default void onAbandoned(PublishedTransaction record, TransactionPublishFailure failure) {}
}
