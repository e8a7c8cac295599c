package org.eventrouter.metrics.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.eventrouter.api.EventOrigin;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.ObjectIdentity;
import org.eventrouter.api.SubjectReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Micrometer delivery metrics")
@DisplayNameGeneration(ReplaceUnderscores.class)
class MicrometerDeliveryMetricsTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MicrometerDeliveryMetrics metrics = new MicrometerDeliveryMetrics(meterRegistry);

    @Test
    void warning_event_increments_only_the_warnings_counter() {
        // When
        metrics.record(eventRecord("Warning"));

        // Then
        assertAll(
                () -> assertThat(count(MicrometerDeliveryMetrics.WARNINGS)).isEqualTo(1.0),
                () -> assertThat(count(MicrometerDeliveryMetrics.NORMAL)).isZero(),
                () -> assertThat(count(MicrometerDeliveryMetrics.INFO)).isZero(),
                () -> assertThat(count(MicrometerDeliveryMetrics.UNKNOWN)).isZero()
        );
    }

    @Test
    void unrecognized_type_increments_only_the_unknown_counter() {
        // When
        metrics.record(eventRecord("Catastrophic"));

        // Then
        assertAll(
                () -> assertThat(count(MicrometerDeliveryMetrics.UNKNOWN)).isEqualTo(1.0),
                () -> assertThat(count(MicrometerDeliveryMetrics.WARNINGS)).isZero(),
                () -> assertThat(count(MicrometerDeliveryMetrics.NORMAL)).isZero(),
                () -> assertThat(count(MicrometerDeliveryMetrics.INFO)).isZero()
        );
    }

    @Test
    void counters_are_tagged_with_involved_object_reason_and_source_host() {
        // When
        metrics.record(eventRecord("Normal"));
        metrics.record(eventRecord("Normal"));

        // Then
        Counter counter = meterRegistry.get(MicrometerDeliveryMetrics.NORMAL)
                .tag("involved_object_kind", "Pod")
                .tag("involved_object_name", "pod-a")
                .tag("involved_object_namespace", "default")
                .tag("reason", "Started")
                .tag("source", "node-1")
                .counter();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void missing_tag_values_are_rendered_as_empty_strings() {
        // When
        metrics.record(new EventRecord(new ObjectIdentity("a", null, "1"), "Info", null, null, 1, null, null, null, null));

        // Then
        Counter counter = meterRegistry.get(MicrometerDeliveryMetrics.INFO)
                .tag("involved_object_kind", "")
                .tag("reason", "")
                .tag("source", "")
                .counter();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void missing_record_is_ignored() {
        metrics.record(null);

        assertThat(meterRegistry.getMeters()).isEmpty();
    }

    @Test
    void registry_failures_are_swallowed() {
        // Given
        MeterRegistry failingRegistry = new SimpleMeterRegistry();
        failingRegistry.config().meterFilter(new MeterFilter() {
            @Override
            public Meter.Id map(Meter.Id id) {
                throw new IllegalStateException("expected");
            }
        });

        // When / Then
        assertThatCode(() -> new MicrometerDeliveryMetrics(failingRegistry).record(eventRecord("Warning"))).doesNotThrowAnyException();
    }

    private double count(String name) {
        return meterRegistry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }

    private static EventRecord eventRecord(String type) {
        return new EventRecord(new ObjectIdentity("pod-a.17b", "default", "1"), type, "Started", "Started container", 1,
                new SubjectReference("Pod", "pod-a", "default", "v1", "uid-1"), new EventOrigin("kubelet", "node-1"), null, null);
    }
}
