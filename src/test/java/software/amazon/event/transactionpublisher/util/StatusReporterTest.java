/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.util;

import static ch.qos.logback.classic.Level.INFO;
import static ch.qos.logback.classic.Level.TRACE;
import static java.lang.Integer.parseInt;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.Comparator;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.event.transactionpublisher.TestUtils.ListAppender;
import software.amazon.event.transactionpublisher.TestUtils.OfPublishedTransaction;
import software.amazon.event.transactionpublisher.exceptions.TransactionPublishFailure;

public class StatusReporterTest {

  private static ListAppender appender;

  private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1);

  @BeforeAll
  public static void setup() {
    appender = ListAppender.of(StatusReporter.class, TRACE);
    appender.start();
  }

  @AfterAll
  public static void teardown() {
    appender.detach();
  }

  @AfterEach
  public void clearLoggingEvents() {
    appender.clear();
    scheduler.shutdownNow();
  }

  @Test
  @DisplayName("Status Reporter should log message of total published records")
  public void shouldContainLoggingEvent() {
    var sut = new StatusReporter(100, MILLISECONDS);
    sut.startAsync();

    var record = OfPublishedTransaction.withRefNo(1);
    var task =
        scheduler.scheduleAtFixedRate(() -> sut.onPublished(record, 1), 175, 75, MILLISECONDS);

    await()
        .atMost(200, SECONDS)
        .untilAsserted(
            () ->
                assertThat(appender.getLoggingEvents())
                    .filteredOn(level(INFO))
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .anySatisfy(message -> assertThat(message).endsWith("Starting status reporter"))
                    .filteredOn(contains("Total records published="))
                    .hasSizeGreaterThan(2)
                    .isSortedAccordingTo(matchGroupOf("Total records published=(\\d+)")));

    task.cancel(false);
    sut.stopAsync();
    assertThat(sut.isRunning()).isFalse();
  }

  @Test
  public void countsOutcomes() {
    var sut = new StatusReporter(1, SECONDS);
    var record = OfPublishedTransaction.withRefNo(1);

    sut.onPublished(record, 1);
    sut.onPublished(record, 3);
    sut.onAbandoned(record, new TransactionPublishFailure(record, 3, "timeout", null));

    assertThat(sut.getPublishedRecords()).isEqualTo(2);
    assertThat(sut.getAbandonedRecords()).isEqualTo(1);
  }

  private static Predicate<? super ILoggingEvent> level(Level expectedLevel) {
    return (event) -> event.getLevel() == expectedLevel;
  }

  private static Predicate<? super String> contains(String fragment) {
    return (value) -> value.contains(fragment);
  }

  private static Comparator<String> matchGroupOf(final String regex) {
    var pattern = Pattern.compile(regex);
    return Comparator.comparing(
        it -> {
          var matcher = pattern.matcher(it);
          return matcher.find() ? parseInt(matcher.group(1)) : -1;
        });
  }
}
