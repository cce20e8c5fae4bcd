/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher;

import static java.util.stream.Collectors.toList;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import software.amazon.event.transactionpublisher.calendar.BusinessCalendar;
import software.amazon.event.transactionpublisher.exceptions.TransactionPublishFailure;
import software.amazon.event.transactionpublisher.logging.ContextAwareLoggerFactory;
import software.amazon.event.transactionpublisher.mapping.JsonRecordSerializer;
import software.amazon.event.transactionpublisher.mapping.RecordSerializer;
import software.amazon.event.transactionpublisher.messaging.KafkaMessagingClient;
import software.amazon.event.transactionpublisher.messaging.MessagingClient;
import software.amazon.event.transactionpublisher.model.PublishedTransaction;
import software.amazon.event.transactionpublisher.model.Transaction;
import software.amazon.event.transactionpublisher.retry.RetryState;
import software.amazon.event.transactionpublisher.retry.Sleeper;
import software.amazon.event.transactionpublisher.util.StatusReporter;

/**
 * Publishes transaction records to a single topic, one record at a time. A failed publish call is
 * retried with exponential backoff until the record's {@link RetryState} runs out, after which the
 * record is abandoned and processing continues with the next one. Per-record failures are reported
 * to the {@link PublishListener} and never thrown to the caller.
 */
public class TransactionPublisher implements AutoCloseable {

  private final Logger log = ContextAwareLoggerFactory.getLogger(TransactionPublisher.class);

  private final MessagingClient messagingClient;
  private final String topic;
  private final Clock clock;
  private final RetryState defaultRetry;
  private final RecordSerializer serializer;
  private final Sleeper sleeper;
  private final PublishListener listener;
  private final StatusReporter statusReporter;

  /**
   * @param config Configuration of the publisher (topic, retries, Kafka producer properties etc.)
   */
  public TransactionPublisher(TransactionPublisherConfig config) {
    this(
        config,
        new KafkaMessagingClient(config.producerProperties, config.sendTimeout),
        new StatusReporter(config.statusInterval, TimeUnit.SECONDS));
  }

  private TransactionPublisher(
      TransactionPublisherConfig config,
      MessagingClient messagingClient,
      StatusReporter statusReporter) {
    this(
        messagingClient,
        config.topic,
        Clock.system(config.businessZone),
        config.getDefaultRetryState(),
        new JsonRecordSerializer(),
        Sleeper.THREAD_SLEEP,
        statusReporter,
        statusReporter);
    statusReporter.startAsync();
  }

  public TransactionPublisher(MessagingClient messagingClient, String topic, Clock clock) {
    this(
        messagingClient,
        topic,
        clock,
        RetryState.getDefault(),
        new JsonRecordSerializer(),
        Sleeper.THREAD_SLEEP,
        PublishListener.NONE);
  }

  /**
   * For testing to inject custom collaborators
   *
   * @param messagingClient client the records are published with
   * @param topic target topic
   * @param clock source of the instant the close of business date is derived from
   * @param defaultRetry retry state each record starts with
   * @param serializer converts records to payloads
   * @param sleeper blocks between two attempts
   * @param listener receives the outcome of each record
   */
  public TransactionPublisher(
      MessagingClient messagingClient,
      String topic,
      Clock clock,
      RetryState defaultRetry,
      RecordSerializer serializer,
      Sleeper sleeper,
      PublishListener listener) {
    this(messagingClient, topic, clock, defaultRetry, serializer, sleeper, listener, null);
  }

  private TransactionPublisher(
      MessagingClient messagingClient,
      String topic,
      Clock clock,
      RetryState defaultRetry,
      RecordSerializer serializer,
      Sleeper sleeper,
      PublishListener listener,
      StatusReporter statusReporter) {
    if (StringUtils.isBlank(topic)) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    this.messagingClient = Objects.requireNonNull(messagingClient, "messagingClient");
    this.topic = topic;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.defaultRetry = Objects.requireNonNull(defaultRetry, "defaultRetry");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.statusReporter = statusReporter;
  }

  /**
   * Stamps every transaction with the close of business date of the current clock instant and
   * publishes them in order.
   *
   * @param records transactions to publish
   */
  public void publish(List<Transaction> records) {
    Objects.requireNonNull(records, "records");
    var now = clock.instant();
    var stamped = records.stream().map(it -> stamp(it, now)).collect(toList());
    publish(stamped, 0, defaultRetry);
  }

  /** Publishes a single record that already carries its close of business date. */
  public void publish(PublishedTransaction record) {
    Objects.requireNonNull(record, "record");
    publish(List.of(record), 0, defaultRetry);
  }

  /**
   * Publishes <code>records[index]</code> under <code>retry</code> and every following record
   * under a fresh default retry state. Records are processed strictly in order: a record is
   * published or abandoned before the next one is attempted.
   *
   * @param records records to publish
   * @param index position of the first record to publish
   * @param retry retry state of the record at <code>index</code>
   */
  public void publish(List<PublishedTransaction> records, int index, RetryState retry) {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(retry, "retry");
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0 but was " + index);
    }
    if (index >= records.size()) {
      log.trace("Returning early: no records at index={} size={}", index, records.size());
      return;
    }

    var start = clock.instant();
    var state = retry;
    for (var i = index; i < records.size(); i++) {
      publishWithRetry(records.get(i), state);
      state = defaultRetry;
    }

    var completion = clock.instant();
    log.trace(
        "publish call completed: start={} completion={} durationMillis={} records={}",
        start,
        completion,
        Duration.between(start, completion).toMillis(),
        records.size() - index);
  }

  /** Stamps a transaction with the close of business date of the current clock instant. */
  public PublishedTransaction stamp(Transaction transaction) {
    return stamp(transaction, clock.instant());
  }

  private PublishedTransaction stamp(Transaction transaction, Instant now) {
    Objects.requireNonNull(transaction, "transaction");
    return PublishedTransaction.of(
        transaction, BusinessCalendar.previousBusinessDay(now, clock.getZone()));
  }

  private void publishWithRetry(PublishedTransaction record, RetryState initial) {
    Objects.requireNonNull(record, "record");
    if (initial.isExhausted()) {
      log.debug(
          "Skipping record with exhausted retry state: refNo={} attempt={} maxAttempts={}",
          record.getRefNo(),
          initial.getAttempt(),
          initial.getMaxAttempts());
      return;
    }

    String payload;
    try {
      payload = serializer.serialize(record);
    } catch (RuntimeException e) {
      abandon(record, 0, "Unable to serialize record", e);
      return;
    }

    var retry = initial;
    var attempts = 0;
    while (!retry.isExhausted()) {
      attempts++;
      log.trace(
          "publish attempt started: refNo={} attempt={} maxAttempts={}",
          record.getRefNo(),
          retry.getAttempt(),
          retry.getMaxAttempts());

      PublishResult result;
      try {
        result = messagingClient.publish(topic, payload);
      } catch (RuntimeException e) {
        abandon(record, attempts, "Messaging client failed unexpectedly", e);
        return;
      }
      if (result.isSuccess()) {
        notifyPublished(record, attempts);
        return;
      }

      var error = result.error();
      switch (error.getType()) {
        case REPORT_ONLY:
          abandon(record, attempts, error.getMessage(), error.getCause());
          return;

        case RETRY:
          if (retry.isLastTry()) {
            abandon(
                record,
                attempts,
                String.format(
                    "Not retrying failed publish call: reached max attempts attempt=%d "
                        + "maxAttempts=%d errorMessage=%s",
                    retry.getAttempt(),
                    retry.getMaxAttempts(),
                    error.getMessage()),
                error.getCause());
            return;
          }

          log.warn(
              "Retrying failed publish call: attempt={} maxAttempts={} delayMillis={} refNo={} "
                  + "errorMessage={}",
              retry.getAttempt(),
              retry.getMaxAttempts(),
              retry.getDelayMillis(),
              record.getRefNo(),
              error.getMessage());
          try {
            sleeper.sleep(retry.getDelayMillis());
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(record, attempts, "Interrupted while backing off", e);
            return;
          }
          retry = retry.next();
          break;
      }
    }
  }

  private void abandon(PublishedTransaction record, int attempts, String message, Throwable cause) {
    var failure = new TransactionPublishFailure(record, attempts, message, cause);
    log.error("Abandoning record: {}", failure.getMessage(), cause);
    try {
      listener.onAbandoned(record, failure);
    } catch (RuntimeException e) {
      log.warn("Publish listener failed on abandoned record: refNo={}", record.getRefNo(), e);
    }
  }

  private void notifyPublished(PublishedTransaction record, int attempts) {
    try {
      listener.onPublished(record, attempts);
    } catch (RuntimeException e) {
      log.warn("Publish listener failed on published record: refNo={}", record.getRefNo(), e);
    }
  }

  public String getTopic() {
    return topic;
  }

  public RetryState getDefaultRetry() {
    return defaultRetry;
  }

  @Override
  public void close() {
    log.trace("Closing transaction publisher");
    messagingClient.close();
    if (statusReporter != null && statusReporter.isRunning()) {
      statusReporter.stopAsync();
    }
  }
}
