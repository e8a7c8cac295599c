/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventrouter.destination.kafka;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.eventrouter.api.DestinationDeliveryException;
import org.eventrouter.api.EventDestination;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.api.SubjectReference;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Publishes every envelope as JSON to a Kafka topic. The record key is {@code <namespace>/<name>} of the involved
 * object so that all events about the same object end up in the same partition.
 * <p>
 * Sends are asynchronous, failures are logged from the producer callback.
 * </p>
 */
public class KafkaDestination implements EventDestination {
    private static final Logger log = LoggerFactory.getLogger(KafkaDestination.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final Producer<String, String> producer;
    private final String topic;
    private final JacksonEnvelopeCodec codec;

    public KafkaDestination(Producer<String, String> producer, String topic, JacksonEnvelopeCodec codec) {
        requireNonNull(producer, Producer.class.getSimpleName() + " cannot be null");
        requireNonNull(codec, JacksonEnvelopeCodec.class.getSimpleName() + " cannot be null");
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        this.producer = producer;
        this.topic = topic;
        this.codec = codec;
    }

    /**
     * Create a {@link KafkaDestination} backed by a {@link KafkaProducer} with string serializers.
     *
     * @param brokers  The bootstrap servers
     * @param topic    The topic to publish to
     * @param clientId The producer client id
     * @param acks     The producer acknowledgement setting ({@code 0}, {@code 1} or {@code all})
     */
    public static KafkaDestination create(List<String> brokers, String topic, String clientId, String acks, JacksonEnvelopeCodec codec) {
        return new KafkaDestination(new KafkaProducer<>(producerConfig(brokers, clientId, acks)), topic, codec);
    }

    static Map<String, Object> producerConfig(List<String> brokers, String clientId, String acks) {
        if (brokers == null || brokers.isEmpty()) {
            throw new IllegalArgumentException("brokers cannot be empty");
        }
        Map<String, Object> config = new HashMap<>();
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", brokers));
        config.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        config.put(ProducerConfig.ACKS_CONFIG, acks);
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        return config;
    }

    @Override
    public void deliver(EventEnvelope envelope) {
        String key = key(envelope);
        try {
            producer.send(new ProducerRecord<>(topic, key, codec.toJson(envelope)), (metadata, exception) -> {
                if (exception != null) {
                    log.error("Failed to publish {} event with key {} to topic {}", envelope.verb(), key, topic,
                            new DestinationDeliveryException("Kafka send failed", exception));
                } else {
                    log.trace("Published {} event with key {} to {}-{}@{}", envelope.verb(), key, metadata.topic(), metadata.partition(), metadata.offset());
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to publish {} event with key {} to topic {}", envelope.verb(), key, topic,
                    new DestinationDeliveryException("Kafka send failed", e));
        }
    }

    static @Nullable String key(EventEnvelope envelope) {
        SubjectReference involvedObject = envelope.event().involvedObject();
        if (involvedObject == null) {
            return null;
        }
        return orEmpty(involvedObject.namespace()) + "/" + orEmpty(involvedObject.name());
    }

    private static String orEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }

    @Override
    public void close() {
        try {
            producer.flush();
        } finally {
            producer.close(CLOSE_TIMEOUT);
        }
    }
}
