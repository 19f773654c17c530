package com.etendoerp.eventlog.delivery;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.etendoerp.eventlog.exception.ConfigException;
import com.etendoerp.eventlog.exception.DeliveryException;
import com.etendoerp.eventlog.model.LogRecord;

import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;
import reactor.kafka.sender.SenderResult;

/**
 * {@link LogSink} publishing each record as JSON to a Kafka topic.
 * <p>
 * {@link #consume(List)} blocks until every record of the batch is acknowledged by the broker
 * or the send timeout elapses. Records are keyed by channel so all events of a channel land on
 * the same partition in order.
 */
public class KafkaLogSink implements LogSink {
  private static final Logger log = LogManager.getLogger();

  public static final String BOOTSTRAP_SERVERS = "kafka.bootstrap_servers";
  public static final String TOPIC = "kafka.topic";
  public static final String CLIENT_ID = "kafka.client_id";
  public static final String SEND_TIMEOUT = "kafka.send_timeout";

  public static final String DEFAULT_CLIENT_ID = "eventlog-receiver";
  public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(30);

  private final KafkaSender<String, LogRecord> sender;
  private final String topic;
  private final String channel;
  private final Duration sendTimeout;

  public KafkaLogSink(KafkaSender<String, LogRecord> sender, String topic, String channel,
      Duration sendTimeout) {
    this.sender = sender;
    this.topic = topic;
    this.channel = channel;
    this.sendTimeout = sendTimeout;
  }

  /**
   * Creates a sink from flat properties ({@code kafka.bootstrap_servers}, {@code kafka.topic},
   * optional {@code kafka.client_id} and {@code kafka.send_timeout} in milliseconds).
   *
   * @throws ConfigException when the broker or the topic is missing
   */
  public static KafkaLogSink fromProperties(Properties props, String prefix, String channel) {
    String p = StringUtils.defaultString(prefix);
    String bootstrapServers = props.getProperty(p + BOOTSTRAP_SERVERS);
    String topic = props.getProperty(p + TOPIC);
    if (StringUtils.isBlank(bootstrapServers)) {
      throw new ConfigException(BOOTSTRAP_SERVERS + " is required");
    }
    if (StringUtils.isBlank(topic)) {
      throw new ConfigException(TOPIC + " is required");
    }
    String clientId = StringUtils.defaultIfBlank(props.getProperty(p + CLIENT_ID), DEFAULT_CLIENT_ID);
    Duration timeout = DEFAULT_SEND_TIMEOUT;
    String timeoutValue = props.getProperty(p + SEND_TIMEOUT);
    if (StringUtils.isNotBlank(timeoutValue)) {
      try {
        timeout = Duration.ofMillis(Long.parseLong(timeoutValue.trim()));
      } catch (NumberFormatException e) {
        throw new ConfigException("invalid duration (ms) for " + SEND_TIMEOUT + ": '" + timeoutValue + "'", e);
      }
    }
    return new KafkaLogSink(createSender(bootstrapServers.trim(), clientId), topic.trim(), channel, timeout);
  }

  /**
   * Creates a new KafkaSender producing JSON log records.
   */
  public static KafkaSender<String, LogRecord> createSender(String bootstrapServers, String clientId) {
    Map<String, Object> propsProducer = new HashMap<>();
    propsProducer.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    propsProducer.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
    propsProducer.put(ProducerConfig.ACKS_CONFIG, "all");
    propsProducer.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    propsProducer.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    propsProducer.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, LogRecordSerializer.class.getName());
    SenderOptions<String, LogRecord> senderOptions = SenderOptions.create(propsProducer);
    return KafkaSender.create(senderOptions);
  }

  @Override
  public void consume(List<LogRecord> records) {
    List<SenderResult<Integer>> results;
    try {
      results = sender.send(Flux.range(0, records.size())
              .map(i -> SenderRecord.create(
                  new ProducerRecord<>(topic, channel, records.get(i)), i)))
          .collectList()
          .block(sendTimeout);
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof SerializationException) {
        throw DeliveryException.permanent("log record cannot be serialized: " + cause.getMessage(), cause);
      }
      throw new DeliveryException(DeliveryException.Kind.TRANSIENT,
          "send to topic " + topic + " failed: " + cause.getMessage(), cause);
    }
    if (results == null || results.size() != records.size()) {
      throw new DeliveryException(DeliveryException.Kind.TRANSIENT,
          "broker acknowledged " + (results == null ? 0 : results.size()) + " of "
              + records.size() + " records", null);
    }
    for (SenderResult<Integer> result : results) {
      if (result.exception() != null) {
        throw new DeliveryException(DeliveryException.Kind.TRANSIENT,
            "record " + result.correlationMetadata() + " was not acknowledged: "
                + result.exception().getMessage(), result.exception());
      }
    }
    if (log.isDebugEnabled() && !results.isEmpty()) {
      RecordMetadata last = results.get(results.size() - 1).recordMetadata();
      log.debug("{} records sent, topic-partition={}-{} last offset={}", results.size(),
          last.topic(), last.partition(), last.offset());
    }
  }

  @Override
  public void close() {
    sender.close();
  }
}
