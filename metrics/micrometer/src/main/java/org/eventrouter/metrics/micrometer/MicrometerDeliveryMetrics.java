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

package org.eventrouter.metrics.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.eventrouter.api.DeliveryMetrics;
import org.eventrouter.api.EventCategory;
import org.eventrouter.api.EventOrigin;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.SubjectReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * {@link DeliveryMetrics} backed by four Micrometer counters, one per {@link EventCategory}:
 * {@value #WARNINGS}, {@value #NORMAL}, {@value #INFO} and {@value #UNKNOWN}. Each counter is tagged with the kind,
 * name and namespace of the involved object, the reason and the host that reported the event.
 */
public class MicrometerDeliveryMetrics implements DeliveryMetrics {
    private static final Logger log = LoggerFactory.getLogger(MicrometerDeliveryMetrics.class);

    public static final String WARNINGS = "eventrouter.warnings";
    public static final String NORMAL = "eventrouter.normal";
    public static final String INFO = "eventrouter.info";
    public static final String UNKNOWN = "eventrouter.unknown";

    public static final String TAG_KIND = "involved_object_kind";
    public static final String TAG_NAME = "involved_object_name";
    public static final String TAG_NAMESPACE = "involved_object_namespace";
    public static final String TAG_REASON = "reason";
    public static final String TAG_SOURCE = "source";

    private static final Map<EventCategory, String> COUNTER_NAMES = new EnumMap<>(Map.of(
            EventCategory.WARNING, WARNINGS,
            EventCategory.NORMAL, NORMAL,
            EventCategory.INFO, INFO,
            EventCategory.UNKNOWN, UNKNOWN));

    private static final Map<EventCategory, String> DESCRIPTIONS = new EnumMap<>(Map.of(
            EventCategory.WARNING, "Total number of warning events",
            EventCategory.NORMAL, "Total number of normal events",
            EventCategory.INFO, "Total number of info events",
            EventCategory.UNKNOWN, "Total number of events of unknown type"));

    private final MeterRegistry meterRegistry;

    public MicrometerDeliveryMetrics(MeterRegistry meterRegistry) {
        requireNonNull(meterRegistry, MeterRegistry.class.getSimpleName() + " cannot be null");
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void record(@Nullable EventRecord record) {
        if (record == null) {
            return;
        }
        EventCategory category = record.category();
        try {
            Counter.builder(COUNTER_NAMES.get(category))
                    .description(DESCRIPTIONS.get(category))
                    .tags(tags(record))
                    .register(meterRegistry)
                    .increment();
        } catch (RuntimeException e) {
            log.debug("Failed to increment {} counter", COUNTER_NAMES.get(category), e);
        }
    }

    static Tags tags(EventRecord record) {
        SubjectReference involvedObject = record.involvedObject();
        EventOrigin source = record.source();
        return Tags.of(
                TAG_KIND, orEmpty(involvedObject == null ? null : involvedObject.kind()),
                TAG_NAME, orEmpty(involvedObject == null ? null : involvedObject.name()),
                TAG_NAMESPACE, orEmpty(involvedObject == null ? null : involvedObject.namespace()),
                TAG_REASON, orEmpty(record.reason()),
                TAG_SOURCE, orEmpty(source == null ? null : source.host()));
    }

    private static String orEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }
}
