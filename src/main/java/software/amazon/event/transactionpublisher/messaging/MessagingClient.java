/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.messaging;

import software.amazon.event.transactionpublisher.PublishResult;

/**
 * Synchronous access to a message bus. Implementations must not throw on delivery problems but
 * return a failed {@link PublishResult} instead.
 */
public interface MessagingClient extends AutoCloseable {

  PublishResult publish(String topic, String payload);

  @Override
  void close();
}
