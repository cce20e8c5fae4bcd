/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher;

import static software.amazon.event.transactionpublisher.TransactionPublisherConfig.*;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.regex.Pattern;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.config.ConfigValue;

public class TransactionPublisherConfigValidator {

  // same rules as the Kafka broker applies to topic names
  private static final Pattern topicPattern = Pattern.compile("^[a-zA-Z0-9._-]{1,249}$");

  public static void validate(ConfigValue configValue) {
    switch (configValue.name()) {
      case TOPIC_CONFIG:
        {
          validateTopic(configValue);
          break;
        }
      case RETRIES_MAX_ATTEMPTS_CONFIG:
        {
          validateMaxAttempts(configValue);
          break;
        }
      case RETRIES_DELAY_CONFIG:
        {
          validateRetriesDelay(configValue);
          break;
        }
      case BUSINESS_ZONE_CONFIG:
        {
          validateBusinessZone(configValue);
          break;
        }
    }
  }

  private static void validateTopic(ConfigValue configValue) {
    var topic = (String) configValue.value();
    if (topic == null || topic.isBlank()) {
      throw new ConfigException(configValue.name(), topic, "Topic must not be blank.");
    }
    if (".".equals(topic) || "..".equals(topic) || !topicPattern.matcher(topic).matches()) {
      throw new ConfigException(
          configValue.name(),
          topic,
          "Topic must consist of at most 249 ASCII alphanumerics, '.', '_' or '-' "
              + "and must not be '.' or '..'.");
    }
  }

  private static void validateMaxAttempts(ConfigValue configValue) {
    var maxAttempts = (Integer) configValue.value();
    if (maxAttempts == null || maxAttempts < 1) {
      throw new ConfigException(
          configValue.name(), maxAttempts, "Maximum attempts must be at least 1.");
    }
  }

  private static void validateRetriesDelay(ConfigValue configValue) {
    var delay = (Integer) configValue.value();
    if (delay == null || delay < 0) {
      throw new ConfigException(
          configValue.name(), delay, "Retry delay must be zero or a positive number.");
    }
  }

  private static void validateBusinessZone(ConfigValue configValue) {
    var zone = (String) configValue.value();
    try {
      ZoneId.of(zone);
    } catch (DateTimeException | NullPointerException e) {
      throw new ConfigException(configValue.name(), zone, "Not a valid time zone id: " + e);
    }
  }

  private TransactionPublisherConfigValidator() {}
}
