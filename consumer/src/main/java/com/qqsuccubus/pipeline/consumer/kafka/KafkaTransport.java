package com.qqsuccubus.pipeline.consumer.kafka;

import com.qqsuccubus.pipeline.consumer.config.ConsumerConfig;
import com.qqsuccubus.pipeline.core.dlq.DeadLetterHeaders;
import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import com.qqsuccubus.pipeline.core.model.Message;
import com.qqsuccubus.pipeline.core.pipeline.Transport;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOffset;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;
import reactor.kafka.sender.SenderResult;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Transport} over Kafka.
 * <p>
 * <b>Mapping:</b> partitionKey = partition number, sequenceToken = offset, key = record key,
 * headers decoded as UTF-8 (last value wins for repeated names).
 * </p>
 * <p>
 * Auto-commit is off; {@link #ack(Message)} hands the record to the {@link OffsetTracker} and
 * only the contiguous acknowledged prefix of each partition is committed.
 * </p>
 * <p>
 * {@link #pause(String)} and {@link #resume(String)} run on the consumer thread through
 * {@link KafkaReceiver#doOnConsumer}. Paused lanes are paused again when their partition is
 * reassigned after a rebalance.
 * </p>
 */
public class KafkaTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(KafkaTransport.class);

    private final ConsumerConfig config;
    private final KafkaSender<String, byte[]> sender;
    private final OffsetTracker<ReceiverOffset> offsets = new OffsetTracker<>();
    private final Map<String, TopicPartition> partitionsByLane = new ConcurrentHashMap<>();
    private final Set<String> pausedLanes = ConcurrentHashMap.newKeySet();
    private volatile KafkaReceiver<String, byte[]> receiver;

    public KafkaTransport(ConsumerConfig config) {
        this.config = config;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all"); // Required for idempotent producer
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        producerProps.put(ProducerConfig.CLIENT_ID_CONFIG, config.getNodeId() + "-dlq");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));
        log.info("Kafka dead-letter producer initialized");
    }

    @Override
    public synchronized Flux<Message> receive() {
        if (receiver != null) {
            return Flux.error(new IllegalStateException("Kafka receiver already subscribed"));
        }

        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(org.apache.kafka.clients.consumer.ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
            config.getKafkaBootstrap());
        consumerProps.put(org.apache.kafka.clients.consumer.ConsumerConfig.GROUP_ID_CONFIG, config.getGroupId());
        consumerProps.put(org.apache.kafka.clients.consumer.ConsumerConfig.CLIENT_ID_CONFIG, config.getNodeId());
        consumerProps.put(org.apache.kafka.clients.consumer.ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
            StringDeserializer.class);
        consumerProps.put(org.apache.kafka.clients.consumer.ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
            ByteArrayDeserializer.class);
        consumerProps.put(org.apache.kafka.clients.consumer.ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumerProps.put(org.apache.kafka.clients.consumer.ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        consumerProps.put(org.apache.kafka.clients.consumer.ConsumerConfig.MAX_POLL_RECORDS_CONFIG,
            config.getMaxPollRecords());

        ReceiverOptions<String, byte[]> options = ReceiverOptions.<String, byte[]>create(consumerProps)
            .commitInterval(config.getCommitInterval())
            .addAssignListener(partitions -> partitions.forEach(p -> {
                TopicPartition partition = p.topicPartition();
                log.info("Assigned partition {}", partition);
                partitionsByLane.put(trackerKey(partition), partition);
                if (pausedLanes.contains(trackerKey(partition))) {
                    pauseOnConsumer(trackerKey(partition), partition);
                }
            }))
            .addRevokeListener(partitions -> partitions.forEach(p -> {
                log.info("Revoked partition {}", p.topicPartition());
                offsets.revoke(trackerKey(p.topicPartition()));
            }))
            .subscription(config.getTopics());

        receiver = KafkaReceiver.create(options);
        log.info("Subscribed to topics {} as group {}", config.getTopics(), config.getGroupId());

        return receiver.receive()
            .map(record -> {
                offsets.register(trackerKey(record.receiverOffset().topicPartition()),
                    record.offset(), record.receiverOffset());
                return toMessage(record);
            });
    }

    @Override
    public void pause(String lane) {
        pausedLanes.add(lane);
        TopicPartition partition = partitionsByLane.get(lane);
        if (partition != null) {
            pauseOnConsumer(lane, partition);
        }
    }

    @Override
    public void resume(String lane) {
        TopicPartition partition = partitionsByLane.get(lane);
        if (!pausedLanes.remove(lane) || partition == null || receiver == null) {
            return;
        }
        receiver.doOnConsumer(consumer -> {
                consumer.resume(List.of(partition));
                return partition;
            })
            .subscribe(
                p -> log.info("Resumed fetching {}", p),
                error -> log.warn("Could not resume {}: {}", partition, error.toString()));
    }

    public boolean isPaused(String lane) {
        return pausedLanes.contains(lane);
    }

    private void pauseOnConsumer(String lane, TopicPartition partition) {
        if (receiver == null) {
            return;
        }
        receiver.doOnConsumer(consumer -> {
                consumer.pause(List.of(partition));
                return partition;
            })
            .subscribe(
                p -> log.info("Paused fetching {} ({} records pending)", p, offsets.pending(lane)),
                error -> log.warn("Could not pause {}: {}", partition, error.toString()));
    }

    @Override
    public Mono<Void> ack(Message message) {
        return Mono.fromRunnable(() -> offsets
            .ack(trackerKey(message), message.getSequenceToken())
            .ifPresent(ReceiverOffset::acknowledge));
    }

    @Override
    public Mono<Void> republish(String destination, DeadLetterEnvelope envelope) {
        ProducerRecord<String, byte[]> record = toProducerRecord(destination, envelope);
        String coordinates = envelope.getOriginalMessage().coordinates();
        return sender.send(Mono.just(SenderRecord.create(record, coordinates)))
            .flatMap(result -> result.exception() != null
                ? Mono.<SenderResult<String>>error(result.exception())
                : Mono.just(result))
            .doOnNext(result -> log.debug("Published dead letter for {} to {}-{}@{}", result.correlationMetadata(),
                destination, result.recordMetadata().partition(), result.recordMetadata().offset()))
            .then();
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
            sender.close();
            log.info("Kafka transport closed");
        });
    }

    /**
     * Converts a consumed record into a pipeline message.
     */
    public static Message toMessage(ConsumerRecord<String, byte[]> record) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Header header : record.headers()) {
            headers.put(header.key(), header.value() == null
                ? ""
                : new String(header.value(), StandardCharsets.UTF_8));
        }
        return Message.builder()
            .topic(record.topic())
            .partitionKey(Integer.toString(record.partition()))
            .key(record.key())
            .sequenceToken(record.offset())
            .payload(record.value())
            .headers(headers)
            .deliveryTimestamp(record.timestamp() >= 0 ? Instant.ofEpochMilli(record.timestamp()) : null)
            .build();
    }

    /**
     * Builds the dead-letter record: original key and payload, original plus {@code dlq-*} headers.
     */
    public static ProducerRecord<String, byte[]> toProducerRecord(String destination, DeadLetterEnvelope envelope) {
        Message original = envelope.getOriginalMessage();
        RecordHeaders headers = new RecordHeaders();
        DeadLetterHeaders.of(envelope)
            .forEach((name, value) -> headers.add(name, value.getBytes(StandardCharsets.UTF_8)));
        return new ProducerRecord<>(destination, null, original.getKey(), original.getPayload(), headers);
    }

    private static String trackerKey(TopicPartition partition) {
        return partition.topic() + "-" + partition.partition();
    }

    private static String trackerKey(Message message) {
        return message.lane();
    }
}
