/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.util;

import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtil {

  // the context aware logger factory depends on this class, so a plain logger is used here
  private static final Logger log = LoggerFactory.getLogger(PropertiesUtil.class);

  private static final String PUBLISHER_VERSION = "publisher.version";
  private static final String PUBLISHER_NAME = "publisher.name";
  private static final Properties properties = new Properties();

  static {
    var propertiesFile = "/TransactionPublisher.properties";
    try (InputStream stream = PropertiesUtil.class.getResourceAsStream(propertiesFile)) {
      if (stream == null) {
        log.warn("Properties file not found on classpath: {}", propertiesFile);
      } else {
        properties.load(stream);
      }
    } catch (Exception e) {
      log.error("Error while loading properties: ", e);
    }
  }

  public static String getPublisherVersion() {
    return properties.getProperty(PUBLISHER_VERSION, "unknown");
  }

  public static String getPublisherName() {
    return properties.getProperty(PUBLISHER_NAME, "transaction-publisher");
  }

  private PropertiesUtil() {}
}
