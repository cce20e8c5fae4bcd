/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.messaging;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static software.amazon.event.transactionpublisher.PublishResult.Error.reportOnly;
import static software.amazon.event.transactionpublisher.PublishResult.Error.retry;
import static software.amazon.event.transactionpublisher.PublishResult.failure;
import static software.amazon.event.transactionpublisher.PublishResult.success;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import software.amazon.event.transactionpublisher.PublishResult;
import software.amazon.event.transactionpublisher.logging.ContextAwareLoggerFactory;

/** {@link MessagingClient} backed by a Kafka {@link Producer}. */
public class KafkaMessagingClient implements MessagingClient {

  private static final Logger log = ContextAwareLoggerFactory.getLogger(KafkaMessagingClient.class);

  private final Producer<String, String> producer;
  private final long sendTimeoutMillis;

  /**
   * @param producerProperties Kafka producer properties (bootstrap servers, acks etc.)
   * @param sendTimeoutMillis how long a single send waits for the broker acknowledgement
   */
  public KafkaMessagingClient(Map<String, Object> producerProperties, long sendTimeoutMillis) {
    this(new KafkaProducer<>(withStringSerializers(producerProperties)), sendTimeoutMillis);
  }

  /**
   * For testing to inject a custom producer
   *
   * @param producer Kafka producer to be used
   * @param sendTimeoutMillis how long a single send waits for the broker acknowledgement
   */
  public KafkaMessagingClient(Producer<String, String> producer, long sendTimeoutMillis) {
    this.producer = producer;
    this.sendTimeoutMillis = sendTimeoutMillis;
  }

  @Override
  public PublishResult publish(String topic, String payload) {
    try {
      log.trace("Sending record to topic={}: {}", topic, payload);
      var metadata =
          producer.send(new ProducerRecord<>(topic, payload)).get(sendTimeoutMillis, MILLISECONDS);
      log.trace(
          "Record acknowledged: topic={} partition={} offset={}",
          metadata.topic(),
          metadata.partition(),
          metadata.offset());
      return success();
    } catch (ExecutionException e) {
      return classify(e.getCause() != null ? e.getCause() : e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return failure(retry("Interrupted while waiting for acknowledgement", e));
    } catch (TimeoutException e) {
      return failure(retry(String.format("No acknowledgement within %dms", sendTimeoutMillis), e));
    } catch (KafkaException e) {
      // send() may fail synchronously, e.g. on serialization or metadata errors
      return classify(e);
    } catch (RuntimeException e) {
      // e.g. IllegalStateException of a closed producer
      return failure(reportOnly(e.getClass().getSimpleName() + ": " + e.getMessage(), e));
    }
  }

  private static PublishResult classify(Throwable cause) {
    if (cause instanceof RecordTooLargeException
        || cause instanceof InvalidTopicException
        || cause instanceof AuthorizationException
        || cause instanceof SerializationException) {
      return failure(
          reportOnly(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause));
    }
    return failure(retry(cause));
  }

  @Override
  public void close() {
    log.trace("Closing Kafka producer");
    producer.close(Duration.ofMillis(sendTimeoutMillis));
  }

  private static Map<String, Object> withStringSerializers(Map<String, Object> properties) {
    var copy = new HashMap<>(properties);
    copy.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    copy.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return copy;
  }
}
