/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.calendar;

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Business day arithmetic used to stamp records with their close of business date. A business day
 * is any Monday to Friday; holidays are not taken into account.
 */
public final class BusinessCalendar {

  private BusinessCalendar() {}

  /**
   * Returns the business day before the local date of <code>now</code> in <code>zone</code>. A
   * Monday resolves to the previous Friday, as do Saturday and Sunday.
   *
   * @param now reference instant
   * @param zone time zone used to resolve the local date of <code>now</code>
   * @return the most recent completed business day
   */
  public static LocalDate previousBusinessDay(Instant now, ZoneId zone) {
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(zone, "zone");

    var day = LocalDate.ofInstant(now, zone).minusDays(1);
    while (isWeekend(day)) {
      day = day.minusDays(1);
    }
    return day;
  }

  /**
   * Same as {@link #previousBusinessDay(Instant, ZoneId)} formatted as <code>YYYY-MM-DD</code>.
   */
  public static String previousBusinessDayAsString(Instant now, ZoneId zone) {
    return format(previousBusinessDay(now, zone));
  }

  public static String format(LocalDate date) {
    return ISO_LOCAL_DATE.format(date);
  }

  public static boolean isWeekend(LocalDate date) {
    var dayOfWeek = date.getDayOfWeek();
    return dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY;
  }
}
