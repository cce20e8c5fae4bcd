/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import software.amazon.event.transactionpublisher.calendar.BusinessCalendar;
import software.amazon.event.transactionpublisher.exceptions.RecordSerializationException;
import software.amazon.event.transactionpublisher.model.PublishedTransaction;

/**
 * Writes a {@link PublishedTransaction} as a flat JSON object. This payload is the contract with
 * downstream consumers:
 *
 * <ul>
 *   <li>keys appear in the order <code>refNo, apNumber, cusip, quantity, amount, settlementDate,
 *       tradeDate, fmuId, closeOfBusinessDate</code>
 *   <li>absent optional fields are omitted, never written as <code>null</code>
 *   <li>decimals are plain JSON numbers keeping their scale, dates are <code>YYYY-MM-DD</code>
 *       strings
 * </ul>
 */
public class JsonRecordSerializer implements RecordSerializer {

  private final JsonMapper objectMapper =
      JsonMapper.builder()
          .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
          .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
          .build();

  @Override
  public String serialize(PublishedTransaction record) {
    var transaction = record.getTransaction();

    var root = objectMapper.createObjectNode();
    root.put("refNo", transaction.getRefNo());
    transaction.getApNumber().ifPresent(it -> root.put("apNumber", it));
    transaction.getCusip().ifPresent(it -> root.put("cusip", it));
    transaction.getQuantity().ifPresent(it -> root.put("quantity", it));
    transaction.getAmount().ifPresent(it -> root.put("amount", it));
    transaction
        .getSettlementDate()
        .ifPresent(it -> root.put("settlementDate", BusinessCalendar.format(it)));
    transaction.getTradeDate().ifPresent(it -> root.put("tradeDate", BusinessCalendar.format(it)));
    transaction.getFmuId().ifPresent(it -> root.put("fmuId", it));
    root.put("closeOfBusinessDate", record.getCloseOfBusinessDate());

    return write(record, root);
  }

  private String write(PublishedTransaction record, ObjectNode root) {
    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new RecordSerializationException(record.getRefNo(), e);
    }
  }
}
