/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.logging;

import org.apache.kafka.common.utils.LogContext;
import org.slf4j.Logger;
import software.amazon.event.transactionpublisher.util.PropertiesUtil;

/**
 * This logger factory creates logger with a static context. Each log message is prefixed with the
 * name and version of the publisher build, e.g. <code>[transaction-publisher@1.0.0] </code>. The
 * prefix pattern (RegEx) is <code>\[[\w.-]+@[\w.-]+] </code>.
 */
public class ContextAwareLoggerFactory {

  private static final LogContext context =
      new LogContext(
          String.format(
              "[%s@%s] ", PropertiesUtil.getPublisherName(), PropertiesUtil.getPublisherVersion()));

  /**
   * Return a logger named corresponding to the class passed as parameter and the static context
   * which prefix each log message.
   *
   * @param clazz the returned logger will be named after clazz
   * @return logger
   */
  public static Logger getLogger(Class<?> clazz) {
    return context.logger(clazz);
  }

  private ContextAwareLoggerFactory() {}
}
