/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static software.amazon.event.transactionpublisher.PublishResult.Error.reportOnly;
import static software.amazon.event.transactionpublisher.PublishResult.Error.retry;
import static software.amazon.event.transactionpublisher.PublishResult.ErrorType.REPORT_ONLY;
import static software.amazon.event.transactionpublisher.PublishResult.ErrorType.RETRY;

import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

public class PublishResultTest {

  @Test
  public void success() {
    var result = PublishResult.success();

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.isFailure()).isFalse();
    assertThrows(IllegalStateException.class, result::error);
  }

  @Test
  public void retryableFailure() {
    var cause = new TimeoutException("no ack");

    var result = PublishResult.failure(retry(cause));

    assertThat(result.isFailure()).isTrue();
    assertThat(result.error().getType()).isEqualTo(RETRY);
    assertThat(result.error().getCause()).isSameAs(cause);
    assertThat(result.error().getMessage()).contains("no ack");
  }

  @Test
  public void reportOnlyFailure() {
    var result = PublishResult.failure(reportOnly("too large"));

    assertThat(result.error().getType()).isEqualTo(REPORT_ONLY);
    assertThat(result.error().getMessage()).isEqualTo("too large");
    assertThat(result.error().getCause()).isNull();
  }

  @Test
  public void failureRequiresError() {
    assertThrows(IllegalArgumentException.class, () -> PublishResult.failure(null));
  }
}
