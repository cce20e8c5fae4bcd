/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.mapping;

import software.amazon.event.transactionpublisher.model.PublishedTransaction;

public interface RecordSerializer {
  String serialize(PublishedTransaction record);
}
