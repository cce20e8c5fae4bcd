/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher;

import static java.util.stream.Collectors.toList;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.LoggerFactory;
import software.amazon.event.transactionpublisher.model.PublishedTransaction;
import software.amazon.event.transactionpublisher.model.Transaction;

public abstract class TestUtils {

  private TestUtils() {}

  public static final LocalDate closeOfBusinessDate = LocalDate.of(2025, 4, 22);

  public abstract static class OfTransaction {

    private OfTransaction() {}

    public static List<Transaction> withRefNosIn(IntStream range) {
      return range.mapToObj(OfTransaction::withRefNo).collect(toList());
    }

    public static Transaction withRefNo(int id) {
      return Transaction.builder()
          .refNo(String.format("REF-%d", id))
          .cusip("3137EAEP0")
          .quantity(new BigDecimal(id))
          .build();
    }
  }

  public abstract static class OfPublishedTransaction {

    private OfPublishedTransaction() {}

    public static List<PublishedTransaction> withRefNosIn(IntStream range) {
      return range.mapToObj(OfPublishedTransaction::withRefNo).collect(toList());
    }

    public static PublishedTransaction withRefNo(int id) {
      return PublishedTransaction.of(OfTransaction.withRefNo(id), closeOfBusinessDate);
    }
  }

  public static class ListAppender extends AppenderBase<ILoggingEvent> {

    private final Logger logger;

    public ListAppender(final Logger logger) {
      this.logger = logger;
    }

    private final List<ILoggingEvent> events = new ArrayList<>();

    @Override
    protected void append(ILoggingEvent event) {
      synchronized (this) {
        events.add(event);
      }
    }

    public List<ILoggingEvent> getLoggingEvents() {
      synchronized (this) {
        return new ArrayList<>(events);
      }
    }

    public void clear() {
      synchronized (this) {
        events.clear();
      }
    }

    public void detach() {
      synchronized (this) {
        logger.detachAppender(this);
      }
    }

    public static ListAppender of(Class<?> clazz, Level level) {
      var logger = (Logger) LoggerFactory.getLogger(clazz);
      logger.setLevel(level);

      final var appender = new ListAppender(logger);
      appender.setContext((LoggerContext) LoggerFactory.getILoggerFactory());

      logger.addAppender(appender);
      return appender;
    }
  }
}
