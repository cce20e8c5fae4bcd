/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.util;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import software.amazon.event.transactionpublisher.PublishListener;
import software.amazon.event.transactionpublisher.exceptions.TransactionPublishFailure;
import software.amazon.event.transactionpublisher.logging.ContextAwareLoggerFactory;
import software.amazon.event.transactionpublisher.model.PublishedTransaction;

/**
 * The StatusReporter is a scheduled task that logs how many records the publisher delivered and
 * how many it abandoned.
 */
public class StatusReporter implements PublishListener {

  private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1);

  private final Logger log = ContextAwareLoggerFactory.getLogger(StatusReporter.class);
  private final AtomicInteger totalRecordsPublished = new AtomicInteger(0);
  private final AtomicInteger totalRecordsAbandoned = new AtomicInteger(0);

  private final long interval;
  private final TimeUnit timeUnit;

  public StatusReporter(long interval, TimeUnit timeUnit) {
    this.interval = interval;
    this.timeUnit = timeUnit;
  }

  @Override
  public void onPublished(PublishedTransaction record, int attempts) {
    totalRecordsPublished.incrementAndGet();
  }

  @Override
  public void onAbandoned(PublishedTransaction record, TransactionPublishFailure failure) {
    totalRecordsAbandoned.incrementAndGet();
  }

  public int getPublishedRecords() {
    return totalRecordsPublished.get();
  }

  public int getAbandonedRecords() {
    return totalRecordsAbandoned.get();
  }

  public boolean isRunning() {
    return !scheduler.isShutdown();
  }

  public void startAsync() {
    log.info("Starting status reporter");
    scheduler.scheduleAtFixedRate(
        () ->
            log.info(
                "Total records published={} abandoned={}",
                totalRecordsPublished.get(),
                totalRecordsAbandoned.get()),
        interval,
        interval,
        timeUnit);
  }

  public void stopAsync() {
    log.info("Stopping status reporter");
    scheduler.shutdown();
  }
}
