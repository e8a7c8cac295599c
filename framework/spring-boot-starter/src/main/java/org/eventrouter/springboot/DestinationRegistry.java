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

package org.eventrouter.springboot;

import org.eventrouter.api.EventDestination;
import org.eventrouter.api.StartupConfigurationException;
import org.eventrouter.destination.http.HttpDestination;
import org.eventrouter.destination.http.InfluxDbDestination;
import org.eventrouter.destination.http.RestClientDestination;
import org.eventrouter.destination.http.RocksetDestination;
import org.eventrouter.destination.kafka.KafkaDestination;
import org.eventrouter.destination.log.LogDestination;
import org.eventrouter.destination.log.StdoutDestination;
import org.eventrouter.destination.log.SyslogDestination;
import org.eventrouter.destination.s3.S3Destination;
import org.eventrouter.springboot.EventRouterProperties.HttpProperties;
import org.eventrouter.springboot.EventRouterProperties.InfluxDbProperties;
import org.eventrouter.springboot.EventRouterProperties.KafkaProperties;
import org.eventrouter.springboot.EventRouterProperties.RocksetProperties;
import org.eventrouter.springboot.EventRouterProperties.S3Properties;
import org.eventrouter.springboot.EventRouterProperties.SyslogProperties;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Maps sink names to {@link DestinationFactory destination factories}. Names are case-insensitive. A sink name that
 * isn't registered resolves to {@value #STDOUT}.
 */
public class DestinationRegistry {
    private static final Logger log = LoggerFactory.getLogger(DestinationRegistry.class);

    public static final String STDOUT = "stdout";

    private final Map<String, DestinationFactory> factories = new LinkedHashMap<>();

    /**
     * @return A registry with the stdout, log, glog, syslog, http, influxdb, rockset, kafka and s3 sinks registered.
     */
    public static DestinationRegistry withDefaults() {
        DestinationFactory logFactory = context -> new LogDestination(context.codec());
        return new DestinationRegistry()
                .register(STDOUT, context -> new StdoutDestination(context.codec(), context.properties().getStdout().getJsonNamespace()))
                .register("log", logFactory)
                .register("glog", logFactory)
                .register("syslog", DestinationRegistry::syslog)
                .register("http", DestinationRegistry::http)
                .register("influxdb", DestinationRegistry::influxDb)
                .register("rockset", DestinationRegistry::rockset)
                .register("kafka", DestinationRegistry::kafka)
                .register("s3", DestinationRegistry::s3);
    }

    public DestinationRegistry register(String sink, DestinationFactory factory) {
        requireNonNull(factory, DestinationFactory.class.getSimpleName() + " cannot be null");
        factories.put(normalize(sink), factory);
        return this;
    }

    public boolean contains(@Nullable String sink) {
        return sink != null && factories.containsKey(normalize(sink));
    }

    public Set<String> sinks() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * Create the destination registered for {@code sink}.
     *
     * @throws StartupConfigurationException If the factory fails, for example because a required property is missing.
     */
    public EventDestination create(@Nullable String sink, DestinationFactory.Context context) {
        requireNonNull(context, "context cannot be null");
        String name = resolve(sink);
        DestinationFactory factory = factories.get(name);
        if (factory == null) {
            throw new StartupConfigurationException("No destination registered for sink \"" + name + "\"");
        }
        final EventDestination destination;
        try {
            destination = factory.create(context);
        } catch (StartupConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StartupConfigurationException("Failed to create destination for sink \"" + name + "\": " + e.getMessage(), e);
        }
        log.info("Forwarding events to sink {} ({})", name, destination.getClass().getSimpleName());
        return destination;
    }

    String resolve(@Nullable String sink) {
        if (sink == null || sink.isBlank()) {
            log.warn("No sink configured, falling back to {}", STDOUT);
            return STDOUT;
        }
        String name = normalize(sink);
        if (!factories.containsKey(name)) {
            log.warn("Unknown sink \"{}\", falling back to {}. Known sinks are {}", sink, STDOUT, factories.keySet());
            return STDOUT;
        }
        return name;
    }

    private static String normalize(String sink) {
        requireNonNull(sink, "sink cannot be null");
        return sink.trim().toLowerCase(Locale.ROOT);
    }

    private static EventDestination syslog(DestinationFactory.Context context) {
        SyslogProperties syslog = context.properties().getSyslog();
        return new SyslogDestination(context.codec(), syslog.getHost(), syslog.getPort(), SyslogDestination.Protocol.parse(syslog.getProtocol()), syslog.getAppName());
    }

    private static EventDestination http(DestinationFactory.Context context) {
        HttpProperties http = context.properties().getHttp();
        String url = required(http.getUrl(), "eventrouter.http.url");
        return new HttpDestination(context.restClientBuilder().clone().build(), URI.create(url), HttpDestination.Format.parse(http.getFormat()), context.codec(),
                RestClientDestination.defaultRetryStrategy(http.getMaxAttempts(), http.getInitialBackoff(), http.getMaxBackoff()));
    }

    private static EventDestination influxDb(DestinationFactory.Context context) {
        InfluxDbProperties influxDb = context.properties().getInfluxdb();
        String url = required(influxDb.getUrl(), "eventrouter.influxdb.url");
        HttpProperties http = context.properties().getHttp();
        return new InfluxDbDestination(context.restClientBuilder().clone().build(), url, influxDb.getDatabase(), influxDb.getMeasurement(), influxDb.getUsername(), influxDb.getPassword(),
                RestClientDestination.defaultRetryStrategy(influxDb.getMaxAttempts(), http.getInitialBackoff(), http.getMaxBackoff()));
    }

    private static EventDestination rockset(DestinationFactory.Context context) {
        RocksetProperties rockset = context.properties().getRockset();
        String apiKey = required(rockset.getApiKey(), "eventrouter.rockset.api-key");
        String collection = required(rockset.getCollection(), "eventrouter.rockset.collection");
        HttpProperties http = context.properties().getHttp();
        return new RocksetDestination(context.restClientBuilder().clone().build(), rockset.getApiServer(), apiKey, rockset.getWorkspace(), collection, context.codec(),
                RestClientDestination.defaultRetryStrategy(rockset.getMaxAttempts(), http.getInitialBackoff(), http.getMaxBackoff()));
    }

    private static EventDestination kafka(DestinationFactory.Context context) {
        KafkaProperties kafka = context.properties().getKafka();
        if (kafka.getBrokers() == null || kafka.getBrokers().isEmpty()) {
            throw new StartupConfigurationException("eventrouter.kafka.brokers must be set when sink is kafka");
        }
        return KafkaDestination.create(kafka.getBrokers(), kafka.getTopic(), kafka.getClientId(), kafka.getAcks(), context.codec());
    }

    private static EventDestination s3(DestinationFactory.Context context) {
        S3Properties s3 = context.properties().getS3();
        String bucket = required(s3.getBucket(), "eventrouter.s3.bucket");
        String region = required(s3.getRegion(), "eventrouter.s3.region");
        return S3Destination.create(region, bucket, s3.getPrefix(), s3.getMaxBufferedEvents(), s3.getUploadInterval(), context.codec());
    }

    private static String required(@Nullable String value, String property) {
        if (value == null || value.isBlank()) {
            throw new StartupConfigurationException(property + " must be set");
        }
        return value;
    }
}
