/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher;

import java.time.ZoneId;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigValue;
import org.slf4j.Logger;
import software.amazon.event.transactionpublisher.logging.ContextAwareLoggerFactory;
import software.amazon.event.transactionpublisher.retry.RetryState;

public class TransactionPublisherConfig extends AbstractConfig {

  private static final Logger log =
      ContextAwareLoggerFactory.getLogger(TransactionPublisherConfig.class);

  static final String TOPIC_CONFIG = "publisher.topic";
  static final String RETRIES_MAX_ATTEMPTS_CONFIG = "publisher.retries.max.attempts";
  static final String RETRIES_DELAY_CONFIG = "publisher.retries.delay";
  static final String BUSINESS_ZONE_CONFIG = "publisher.business.zone";
  static final String SEND_TIMEOUT_CONFIG = "publisher.send.timeout.ms";
  static final String STATUS_INTERVAL_CONFIG = "publisher.status.interval.seconds";
  static final String PRODUCER_PREFIX = "publisher.producer.";

  private static final String TOPIC_DOC = "The topic transaction records are published to.";
  private static final String RETRIES_MAX_ATTEMPTS_DOC =
      "The maximum number of publish attempts per record, including the first one.";
  private static final String RETRIES_DELAY_DOC =
      "The delay in milliseconds before the first retry. It doubles with every further retry.";
  private static final String BUSINESS_ZONE_DEFAULT = "America/New_York";
  private static final String BUSINESS_ZONE_DOC =
      "The time zone used to resolve the close of business date of published records.";
  private static final int SEND_TIMEOUT_DEFAULT = 5000; // 5s
  private static final String SEND_TIMEOUT_DOC =
      "How long a single publish call waits for the broker acknowledgement in milliseconds.";
  private static final int STATUS_INTERVAL_DEFAULT = 60;
  private static final String STATUS_INTERVAL_DOC =
      "The interval in seconds between two status log lines of published and abandoned records.";

  public static final ConfigDef CONFIG_DEF = createConfigDef();
  public final String topic;
  public final int maxAttempts;
  public final long retriesDelay;
  public final ZoneId businessZone;
  public final int sendTimeout;
  public final int statusInterval;
  public final Map<String, Object> producerProperties;

  public TransactionPublisherConfig(final Map<?, ?> originalProps) {
    super(CONFIG_DEF, originalProps);
    this.topic = getString(TOPIC_CONFIG);
    this.maxAttempts = getInt(RETRIES_MAX_ATTEMPTS_CONFIG);
    this.retriesDelay = getInt(RETRIES_DELAY_CONFIG);
    this.businessZone = ZoneId.of(getString(BUSINESS_ZONE_CONFIG));
    this.sendTimeout = getInt(SEND_TIMEOUT_CONFIG);
    this.statusInterval = getInt(STATUS_INTERVAL_CONFIG);
    this.producerProperties = originalsWithPrefix(PRODUCER_PREFIX);

    log.info(
        "Publisher properties: topic={} maxAttempts={} retriesDelay={} businessZone={} "
            + "sendTimeout={} statusInterval={} producerProperties={}",
        topic,
        maxAttempts,
        retriesDelay,
        businessZone,
        sendTimeout,
        statusInterval,
        producerProperties.keySet());
  }

  /** The retry state every record starts with. */
  public RetryState getDefaultRetryState() {
    return RetryState.initial(maxAttempts, retriesDelay);
  }

  private static ConfigDef createConfigDef() {
    var configDef = new ConfigDef();
    addParams(configDef);
    return configDef;
  }

  private static void addParams(final ConfigDef configDef) {
    configDef.define(
        TOPIC_CONFIG,
        Type.STRING,
        ConfigDef.NO_DEFAULT_VALUE,
        validatedBy(),
        Importance.HIGH,
        TOPIC_DOC);
    configDef.define(
        RETRIES_MAX_ATTEMPTS_CONFIG,
        Type.INT,
        RetryState.DEFAULT_MAX_ATTEMPTS,
        validatedBy(),
        Importance.MEDIUM,
        RETRIES_MAX_ATTEMPTS_DOC);
    configDef.define(
        RETRIES_DELAY_CONFIG,
        Type.INT,
        (int) RetryState.DEFAULT_DELAY_MILLIS,
        validatedBy(),
        Importance.MEDIUM,
        RETRIES_DELAY_DOC);
    configDef.define(
        BUSINESS_ZONE_CONFIG,
        Type.STRING,
        BUSINESS_ZONE_DEFAULT,
        validatedBy(),
        Importance.MEDIUM,
        BUSINESS_ZONE_DOC);
    configDef.define(
        SEND_TIMEOUT_CONFIG,
        Type.INT,
        SEND_TIMEOUT_DEFAULT,
        ConfigDef.Range.atLeast(1),
        Importance.LOW,
        SEND_TIMEOUT_DOC);
    configDef.define(
        STATUS_INTERVAL_CONFIG,
        Type.INT,
        STATUS_INTERVAL_DEFAULT,
        ConfigDef.Range.atLeast(1),
        Importance.LOW,
        STATUS_INTERVAL_DOC);
  }

  private static ConfigDef.Validator validatedBy() {
    return (name, value) -> {
      var configValue = new ConfigValue(name);
      configValue.value(value);
      TransactionPublisherConfigValidator.validate(configValue);
    };
  }
}
