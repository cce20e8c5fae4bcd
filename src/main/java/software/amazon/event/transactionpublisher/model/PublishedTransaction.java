/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.model;

import java.time.LocalDate;
import java.util.Objects;
import software.amazon.event.transactionpublisher.calendar.BusinessCalendar;

/** A {@link Transaction} stamped with the close of business date it is published under. */
public final class PublishedTransaction {

  private final Transaction transaction;
  private final LocalDate closeOfBusinessDate;

  private PublishedTransaction(Transaction transaction, LocalDate closeOfBusinessDate) {
    this.transaction = Objects.requireNonNull(transaction, "transaction");
    this.closeOfBusinessDate = Objects.requireNonNull(closeOfBusinessDate, "closeOfBusinessDate");
  }

  public static PublishedTransaction of(Transaction transaction, LocalDate closeOfBusinessDate) {
    return new PublishedTransaction(transaction, closeOfBusinessDate);
  }

  public Transaction getTransaction() {
    return transaction;
  }

  public String getRefNo() {
    return transaction.getRefNo();
  }

  /** @return close of business date as <code>YYYY-MM-DD</code> */
  public String getCloseOfBusinessDate() {
    return BusinessCalendar.format(closeOfBusinessDate);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PublishedTransaction)) return false;
    var that = (PublishedTransaction) o;
    return transaction.equals(that.transaction)
        && closeOfBusinessDate.equals(that.closeOfBusinessDate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(transaction, closeOfBusinessDate);
  }

  @Override
  public String toString() {
    return "PublishedTransaction["
        + "transaction="
        + transaction
        + ",closeOfBusinessDate="
        + getCloseOfBusinessDate()
        + "]";
  }
}
