/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ReflectionToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * A financial transaction before it is published. Only the reference number is mandatory; every
 * other field may be unknown or not applicable.
 */
public final class Transaction {

  private final String refNo;
  private final String apNumber;
  private final String cusip;
  private final BigDecimal quantity;
  private final BigDecimal amount;
  private final LocalDate settlementDate;
  private final LocalDate tradeDate;
  private final String fmuId;

  private Transaction(Builder builder) {
    if (StringUtils.isBlank(builder.refNo)) {
      throw new IllegalArgumentException("refNo must not be blank");
    }
    this.refNo = builder.refNo;
    this.apNumber = builder.apNumber;
    this.cusip = builder.cusip;
    this.quantity = builder.quantity;
    this.amount = builder.amount;
    this.settlementDate = builder.settlementDate;
    this.tradeDate = builder.tradeDate;
    this.fmuId = builder.fmuId;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .refNo(refNo)
        .apNumber(apNumber)
        .cusip(cusip)
        .quantity(quantity)
        .amount(amount)
        .settlementDate(settlementDate)
        .tradeDate(tradeDate)
        .fmuId(fmuId);
  }

  public String getRefNo() {
    return refNo;
  }

  public Optional<String> getApNumber() {
    return Optional.ofNullable(apNumber);
  }

  public Optional<String> getCusip() {
    return Optional.ofNullable(cusip);
  }

  public Optional<BigDecimal> getQuantity() {
    return Optional.ofNullable(quantity);
  }

  public Optional<BigDecimal> getAmount() {
    return Optional.ofNullable(amount);
  }

  public Optional<LocalDate> getSettlementDate() {
    return Optional.ofNullable(settlementDate);
  }

  public Optional<LocalDate> getTradeDate() {
    return Optional.ofNullable(tradeDate);
  }

  public Optional<String> getFmuId() {
    return Optional.ofNullable(fmuId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Transaction)) return false;
    var that = (Transaction) o;
    return refNo.equals(that.refNo)
        && Objects.equals(apNumber, that.apNumber)
        && Objects.equals(cusip, that.cusip)
        && Objects.equals(quantity, that.quantity)
        && Objects.equals(amount, that.amount)
        && Objects.equals(settlementDate, that.settlementDate)
        && Objects.equals(tradeDate, that.tradeDate)
        && Objects.equals(fmuId, that.fmuId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        refNo, apNumber, cusip, quantity, amount, settlementDate, tradeDate, fmuId);
  }

  @Override
  public String toString() {
    return ReflectionToStringBuilder.toString(this, ToStringStyle.SHORT_PREFIX_STYLE);
  }

  public static final class Builder {

    private String refNo;
    private String apNumber;
    private String cusip;
    private BigDecimal quantity;
    private BigDecimal amount;
    private LocalDate settlementDate;
    private LocalDate tradeDate;
    private String fmuId;

    private Builder() {}

    public Builder refNo(String refNo) {
      this.refNo = refNo;
      return this;
    }

    public Builder apNumber(String apNumber) {
      this.apNumber = apNumber;
      return this;
    }

    public Builder cusip(String cusip) {
      this.cusip = cusip;
      return this;
    }

    public Builder quantity(BigDecimal quantity) {
      this.quantity = quantity;
      return this;
    }

    public Builder amount(BigDecimal amount) {
      this.amount = amount;
      return this;
    }

    public Builder settlementDate(LocalDate settlementDate) {
      this.settlementDate = settlementDate;
      return this;
    }

    public Builder tradeDate(LocalDate tradeDate) {
      this.tradeDate = tradeDate;
      return this;
    }

    public Builder fmuId(String fmuId) {
      this.fmuId = fmuId;
      return this;
    }

    public Transaction build() {
      return new Transaction(this);
    }
  }
}
