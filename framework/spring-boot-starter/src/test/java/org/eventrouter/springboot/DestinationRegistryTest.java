package org.eventrouter.springboot;

import org.eventrouter.api.EventDestination;
import org.eventrouter.api.StartupConfigurationException;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.eventrouter.destination.log.StdoutDestination;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Destination Registry")
@DisplayNameGeneration(ReplaceUnderscores.class)
class DestinationRegistryTest {

    private final EventRouterProperties properties = new EventRouterProperties();
    private final DestinationFactory.Context context = new DestinationFactory.Context(properties, new JacksonEnvelopeCodec(), RestClient.builder());

    @Test
    void registers_all_built_in_sinks() {
        assertThat(DestinationRegistry.withDefaults().sinks())
                .containsExactlyInAnyOrder("stdout", "log", "glog", "syslog", "http", "influxdb", "rockset", "kafka", "s3");
    }

    @Test
    void resolves_empty_and_unknown_sinks_to_stdout() {
        DestinationRegistry registry = DestinationRegistry.withDefaults();

        assertAll(
                () -> assertThat(registry.resolve(null)).isEqualTo("stdout"),
                () -> assertThat(registry.resolve(" ")).isEqualTo("stdout"),
                () -> assertThat(registry.resolve("eventhub")).isEqualTo("stdout"),
                () -> assertThat(registry.resolve(" Kafka ")).isEqualTo("kafka")
        );
    }

    @Test
    void creates_stdout_destination_for_unknown_sink() {
        EventDestination destination = DestinationRegistry.withDefaults().create("unknown", context);

        assertThat(destination).isInstanceOf(StdoutDestination.class);
    }

    @Test
    void wraps_factory_failures_in_startup_configuration_exception() {
        // Given
        DestinationRegistry registry = new DestinationRegistry()
                .register("stdout", __ -> new StdoutDestination(new JacksonEnvelopeCodec(), null))
                .register("broken", __ -> {
                    throw new IllegalStateException("boom");
                });

        // When
        Throwable throwable = catchThrowable(() -> registry.create("broken", context));

        // Then
        assertThat(throwable).isExactlyInstanceOf(StartupConfigurationException.class)
                .hasMessage("Failed to create destination for sink \"broken\": boom")
                .hasCauseExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void requires_rockset_api_key() {
        properties.setSink("rockset");
        properties.getRockset().setCollection("events");

        Throwable throwable = catchThrowable(() -> DestinationRegistry.withDefaults().create("rockset", context));

        assertThat(throwable).isExactlyInstanceOf(StartupConfigurationException.class).hasMessage("eventrouter.rockset.api-key must be set");
    }

    @Test
    void requires_s3_bucket() {
        Throwable throwable = catchThrowable(() -> DestinationRegistry.withDefaults().create("s3", context));

        assertThat(throwable).isExactlyInstanceOf(StartupConfigurationException.class).hasMessage("eventrouter.s3.bucket must be set");
    }

    @Test
    void rejects_unsupported_syslog_protocol() {
        properties.getSyslog().setProtocol("tls");

        Throwable throwable = catchThrowable(() -> DestinationRegistry.withDefaults().create("syslog", context));

        assertThat(throwable).isExactlyInstanceOf(StartupConfigurationException.class)
                .hasMessageContaining("Unsupported syslog protocol: tls, expecting udp or tcp");
    }
}
