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

import io.micrometer.core.instrument.MeterRegistry;
import org.eventrouter.api.DeliveryMetrics;
import org.eventrouter.api.EventDestination;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.eventrouter.metrics.micrometer.MicrometerDeliveryMetrics;
import org.eventrouter.position.FilePositionStorage;
import org.eventrouter.position.InMemoryPositionStorage;
import org.eventrouter.position.PositionStorage;
import org.eventrouter.router.ChangeRouter;
import org.eventrouter.router.ChangeRouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;

/**
 * Event router autoconfiguration. Creates the destination named by {@code eventrouter.sink}, the position storage, the
 * delivery metrics and a started {@link ChangeRouter} that a change feed can dispatch notifications to.
 */
@AutoConfiguration
@EnableConfigurationProperties(EventRouterProperties.class)
public class EventRouterAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(EventRouterAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(JacksonEnvelopeCodec.class)
    public JacksonEnvelopeCodec eventRouterEnvelopeCodec() {
        return new JacksonEnvelopeCodec();
    }

    @Bean
    @ConditionalOnMissingBean(DestinationRegistry.class)
    public DestinationRegistry eventRouterDestinationRegistry(ObjectProvider<DestinationRegistryCustomizer> customizers) {
        DestinationRegistry registry = DestinationRegistry.withDefaults();
        customizers.orderedStream().forEach(customizer -> customizer.customize(registry));
        return registry;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(EventDestination.class)
    public EventDestination eventRouterDestination(DestinationRegistry registry, EventRouterProperties properties, JacksonEnvelopeCodec codec,
                                                   ObjectProvider<RestClient.Builder> restClientBuilder) {
        DestinationFactory.Context context = new DestinationFactory.Context(properties, codec, restClientBuilder.getIfAvailable(RestClient::builder));
        return registry.create(properties.getSink(), context);
    }

    @Bean
    @ConditionalOnMissingBean(PositionStorage.class)
    public PositionStorage eventRouterPositionStorage(EventRouterProperties properties) {
        String file = properties.getPosition().getFile();
        if (file == null || file.isBlank()) {
            return new InMemoryPositionStorage();
        }
        return new FilePositionStorage(Path.of(file));
    }

    @Bean
    @ConditionalOnMissingBean(DeliveryMetrics.class)
    public DeliveryMetrics eventRouterDeliveryMetrics(EventRouterProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
        if (!properties.isEnablePrometheus()) {
            log.info("Delivery metrics are disabled");
            return DeliveryMetrics.disabled();
        }
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("Delivery metrics are disabled since there's no {} available", MeterRegistry.class.getSimpleName());
            return DeliveryMetrics.disabled();
        }
        return new MicrometerDeliveryMetrics(registry);
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean(ChangeRouter.class)
    public ChangeRouter changeRouter(EventDestination destination, PositionStorage positionStorage, DeliveryMetrics deliveryMetrics, EventRouterProperties properties) {
        String routerId = properties.getPosition().getRouterId();
        String storedPosition = positionStorage.read(routerId);
        String initialPosition = storedPosition == null ? properties.getInitialPosition() : storedPosition;
        log.info("Starting router {} from position {}", routerId, initialPosition == null ? "<none>" : initialPosition);
        ChangeRouterConfig config = ChangeRouterConfig.defaults()
                .positionOrdering(properties.getPositionOrdering())
                .initialPosition(initialPosition)
                .checkpoint(positionStorage.checkpointFor(routerId))
                .metrics(deliveryMetrics);
        return new ChangeRouter(destination, config);
    }
}
