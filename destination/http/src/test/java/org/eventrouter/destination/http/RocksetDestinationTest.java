package org.eventrouter.destination.http;

import org.eventrouter.api.EventEnvelope;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.eventrouter.retry.RetryStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eventrouter.destination.http.HttpDestinationTest.eventRecord;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("Rockset destination")
@DisplayNameGeneration(ReplaceUnderscores.class)
class RocksetDestinationTest {

    @Test
    void adds_envelope_as_document_to_collection() {
        // Given
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RocksetDestination destination = new RocksetDestination(builder.build(), "https://rockset.example.com/", "secret", "commons", "events",
                new JacksonEnvelopeCodec(), RetryStrategy.none());

        server.expect(requestTo("https://rockset.example.com/v1/orgs/self/ws/commons/collections/events/docs"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "ApiKey secret"))
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].verb").value("ADDED"))
                .andExpect(jsonPath("$.data[0].event.reason").value("BackOff"))
                .andRespond(withSuccess());

        // When
        destination.deliver(EventEnvelope.added(eventRecord("1")));

        // Then
        server.verify();
    }

    @Test
    void documents_endpoint_is_built_from_api_server_workspace_and_collection() {
        assertThat(RocksetDestination.documentsEndpoint(RocksetDestination.DEFAULT_API_SERVER, "ws", "c"))
                .hasToString("https://api.rs2.usw2.rockset.com/v1/orgs/self/ws/ws/collections/c/docs");
    }

    @Test
    void api_key_is_required() {
        assertThatThrownBy(() -> new RocksetDestination(RestClient.create(), RocksetDestination.DEFAULT_API_SERVER, "", "ws", "c", new JacksonEnvelopeCodec(), RetryStrategy.none()))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("apiKey cannot be null or blank");
    }
}
