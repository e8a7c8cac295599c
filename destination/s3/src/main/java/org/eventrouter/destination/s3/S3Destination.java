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

package org.eventrouter.destination.s3;

import org.eventrouter.api.DestinationDeliveryException;
import org.eventrouter.api.EventDestination;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Buffers envelopes as newline delimited JSON and uploads the buffer as a new object to an S3 bucket when
 * {@code maxBufferedEvents} is reached, every {@code uploadInterval}, and on {@link #close()}.
 * <p>
 * Objects are named {@code <prefix>/<yyyy>/<MM>/<dd>/<epoch millis>-<uuid>.json}. A failed upload is logged and the
 * events in it are dropped.
 * </p>
 */
public class S3Destination implements EventDestination {
    private static final Logger log = LoggerFactory.getLogger(S3Destination.class);
    private static final DateTimeFormatter DATE_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd").withZone(ZoneOffset.UTC);
    static final String CONTENT_TYPE = "application/x-ndjson";

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;
    private final int maxBufferedEvents;
    private final JacksonEnvelopeCodec codec;
    private final Clock clock;
    private final @Nullable ScheduledExecutorService scheduler;

    private final List<String> buffer = new ArrayList<>();

    /**
     * Create an {@link S3Destination} with an {@link S3Client} for the given region, using the default credentials provider chain.
     */
    public static S3Destination create(String region, String bucket, String prefix, int maxBufferedEvents, Duration uploadInterval, JacksonEnvelopeCodec codec) {
        requireNonNull(region, "region cannot be null");
        S3Client s3Client = S3Client.builder().region(Region.of(region)).build();
        return new S3Destination(s3Client, bucket, prefix, maxBufferedEvents, uploadInterval, codec);
    }

    /**
     * @param s3Client          The client to upload with. It's closed when the destination is closed.
     * @param bucket            The bucket to upload to
     * @param prefix            Key prefix of the uploaded objects
     * @param maxBufferedEvents Upload as soon as this many events are buffered
     * @param uploadInterval    Upload whatever is buffered this often, {@link Duration#ZERO} disables periodic uploads
     * @param codec             The codec used to serialize envelopes
     */
    public S3Destination(S3Client s3Client, String bucket, String prefix, int maxBufferedEvents, Duration uploadInterval, JacksonEnvelopeCodec codec) {
        this(s3Client, bucket, prefix, maxBufferedEvents, uploadInterval, codec, Clock.systemUTC());
    }

    S3Destination(S3Client s3Client, String bucket, String prefix, int maxBufferedEvents, Duration uploadInterval, JacksonEnvelopeCodec codec, Clock clock) {
        requireNonNull(s3Client, S3Client.class.getSimpleName() + " cannot be null");
        requireNonNull(codec, JacksonEnvelopeCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        requireNonNull(uploadInterval, "uploadInterval cannot be null");
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket cannot be null or blank");
        } else if (maxBufferedEvents < 1) {
            throw new IllegalArgumentException("maxBufferedEvents must be greater than 0");
        } else if (uploadInterval.isNegative()) {
            throw new IllegalArgumentException("uploadInterval cannot be negative");
        }
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : stripSlashes(prefix);
        this.maxBufferedEvents = maxBufferedEvents;
        this.codec = codec;
        this.clock = clock;
        if (uploadInterval.isZero()) {
            this.scheduler = null;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "eventrouter-s3-upload");
                thread.setDaemon(true);
                return thread;
            });
            long millis = uploadInterval.toMillis();
            this.scheduler.scheduleWithFixedDelay(this::upload, millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void deliver(EventEnvelope envelope) {
        final String json;
        try {
            json = codec.toJson(envelope);
        } catch (RuntimeException e) {
            log.error("Failed to buffer {} event", envelope.verb(), new DestinationDeliveryException("Failed to serialize envelope", e));
            return;
        }

        boolean full;
        synchronized (buffer) {
            buffer.add(json);
            full = buffer.size() >= maxBufferedEvents;
        }
        if (full) {
            upload();
        }
    }

    /**
     * Upload buffered events, if any.
     */
    public void upload() {
        final List<String> events;
        synchronized (buffer) {
            if (buffer.isEmpty()) {
                return;
            }
            events = new ArrayList<>(buffer);
            buffer.clear();
        }

        String key = objectKey();
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(CONTENT_TYPE)
                    .build();
            s3Client.putObject(request, RequestBody.fromString(String.join("\n", events) + "\n", StandardCharsets.UTF_8));
            log.debug("Uploaded {} event(s) to s3://{}/{}", events.size(), bucket, key);
        } catch (RuntimeException e) {
            log.error("Failed to upload {} event(s) to s3://{}/{}, events are dropped", events.size(), bucket, key,
                    new DestinationDeliveryException("S3 upload failed", e));
        }
    }

    int buffered() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    String objectKey() {
        long now = clock.millis();
        String name = DATE_PATH.format(clock.instant()) + "/" + now + "-" + UUID.randomUUID() + ".json";
        return prefix.isEmpty() ? name : prefix + "/" + name;
    }

    @Override
    public void close() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        upload();
        s3Client.close();
    }

    private static String stripSlashes(String value) {
        String result = value.trim();
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
