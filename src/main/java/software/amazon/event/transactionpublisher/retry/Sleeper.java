/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.retry;

import java.util.concurrent.TimeUnit;

/** Blocks the calling thread between two publish attempts. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD_SLEEP = TimeUnit.MILLISECONDS::sleep;

  void sleep(long millis) throws InterruptedException;
}
