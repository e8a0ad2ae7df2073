/* (C)2026 */
package com.ammann.logquery.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.logquery.enumeration.StatementKind;
import com.ammann.logquery.exception.ValidationException;
import com.ammann.logquery.observability.ObservabilityEvent;
import com.ammann.logquery.observability.ObservabilityRecord;
import com.ammann.logquery.observability.ObservabilityRecorder;
import com.ammann.logquery.properties.ApiProperties;
import com.ammann.logquery.query.PredicateCompiler;
import com.ammann.logquery.query.QueryVariantBuilder;
import com.ammann.logquery.query.RequestValidator;
import com.ammann.logquery.service.LogQueryService;
import com.ammann.logquery.service.QueryExecutionService;
import com.ammann.logquery.service.ResponseCompressionService;
import com.ammann.logquery.service.ResultAssembler;
import com.ammann.logquery.support.InMemoryLogSink;
import com.ammann.logquery.support.LogRows;
import com.ammann.logquery.support.RecordingLogStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogQueryResourceTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ExecutorService executor;
    private RecordingLogStore store;
    private InMemoryLogSink sink;
    private LogQueryResource resource;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        store = new RecordingLogStore();
        sink = new InMemoryLogSink();
        resource = buildResource(true);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private LogQueryResource buildResource(boolean compressionEnabled) {
        LogQueryResource built = new LogQueryResource();
        built.queryService = new LogQueryService(
                new RequestValidator(),
                new PredicateCompiler(),
                new QueryVariantBuilder(),
                new QueryExecutionService(store, executor, Duration.ofSeconds(5)),
                new ResultAssembler(mapper),
                10000);
        built.recorder = new ObservabilityRecorder(sink, new SimpleMeterRegistry());
        built.compressionService = new ResponseCompressionService(compressionEnabled);
        built.objectMapper = mapper;
        return built;
    }

    private JsonNode body(Response response) throws IOException {
        byte[] payload = (byte[]) response.getEntity();
        if ("gzip".equals(response.getHeaderString(HttpHeaders.CONTENT_ENCODING))) {
            try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(payload))) {
                payload = in.readAllBytes();
            }
        }
        return mapper.readTree(payload);
    }

    @Test
    void resourceIsMountedAtQueryPath() {
        assertThat(LogQueryResource.class.getAnnotation(Path.class).value())
                .isEqualTo(ApiProperties.Query.BASE);
    }

    @Nested
    @DisplayName("Validation failures")
    class ValidationFailureTests {

        @Test
        void malformedBodyIsBadRequestWithCompletionRecord() throws IOException {
            Response response = resource.facetedQuery("{not json", null, null, null);

            assertThat(response.getStatus()).isEqualTo(400);
            assertThat(body(response).get("error").asText()).isEqualTo(ValidationException.MALFORMED_BODY);
            assertThat(response.getHeaderString(ApiProperties.COMPRESSION_HEADER)).isEqualTo("false");

            ObservabilityRecord completed = sink.single(ObservabilityEvent.REQUEST_COMPLETED);
            assertThat(completed.field("status")).isEqualTo(400);
            assertThat(completed.field("row_count")).isEqualTo(0);
            assertThat(completed.field("error")).isEqualTo(ValidationException.MALFORMED_BODY);
            assertThat(sink.single(ObservabilityEvent.REQUEST_ARRIVED).field("request")).isEqualTo("{not json");
            assertThat(store.executed()).isEmpty();
        }

        @Test
        void simpleQueryWithoutWindowIsBadRequest() throws IOException {
            Response response = resource.simpleQuery("{\"filters\":{\"user_id\":\"a\"}}", "gzip", null, null);

            assertThat(response.getStatus()).isEqualTo(400);
            assertThat(body(response).get("error").asText()).isEqualTo(ValidationException.MISSING_TIME_WINDOW);
            assertThat(sink.records(ObservabilityEvent.SQL_EXECUTED)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Successful queries")
    class SuccessTests {

        @Test
        void facetedQueryReturnsCompressedCompositeResult() throws IOException {
            store.returning(StatementKind.ROWS, LogRows.logRows(2))
                    .returning(StatementKind.COUNT, List.of(LogRows.countRow(2)))
                    .returning(StatementKind.GROUP, List.of(LogRows.groupRow("user-0", 1), LogRows.groupRow("user-1", 1)));

            Response response = resource.facetedQuery(
                    "{\"interval\":\"24 hours\",\"groupBy\":\"user_id\"}", "gzip, deflate", null, null);

            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(response.getHeaderString(ApiProperties.COMPRESSION_HEADER)).isEqualTo("true");
            assertThat(response.getHeaderString(HttpHeaders.CONTENT_ENCODING)).isEqualTo("gzip");

            JsonNode json = body(response);
            assertThat(json.get("rows")).hasSize(2);
            assertThat(json.at("/rows/0/id").asText()).isEqualTo("inst-0_2024-01-01T00:00:00Z");
            assertThat(json.get("totalCount").asLong()).isEqualTo(2L);
            assertThat(json.get("groupData")).hasSize(2);
            assertThat(json.get("chartData")).isEmpty();

            ObservabilityRecord completed = sink.single(ObservabilityEvent.REQUEST_COMPLETED);
            assertThat(completed.field("compressed")).isEqualTo(true);
            assertThat(completed.field("response_size")).isEqualTo((long) ((byte[]) response.getEntity()).length);
        }

        @Test
        void simpleQueryReturnsRowArrayUncompressedWhenDisabled() throws IOException {
            resource = buildResource(false);
            store.returning(StatementKind.ROWS, LogRows.logRows(3));

            Response response = resource.simpleQuery("{\"interval\":\"1 hour\"}", "gzip", "203.0.113.9", null);

            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(response.getHeaderString(ApiProperties.COMPRESSION_HEADER)).isEqualTo("false");
            assertThat(response.getHeaderString(HttpHeaders.CONTENT_ENCODING)).isNull();
            assertThat(body(response).isArray()).isTrue();
            assertThat(body(response)).hasSize(3);
            assertThat(sink.single(ObservabilityEvent.REQUEST_COMPLETED).endpoint()).isEqualTo("/query");
            assertThat(sink.single(ObservabilityEvent.REQUEST_COMPLETED).remoteAddress()).isEqualTo("203.0.113.9");
        }
    }

    @Test
    void storeFailureIsServerError() throws IOException {
        store.failing(StatementKind.ROWS, new SQLException("canceling statement due to statement timeout"));

        Response response = resource.facetedQuery("{}", null, null, null);

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response).get("error").asText()).contains("statement timeout");
        assertThat(sink.single(ObservabilityEvent.REQUEST_COMPLETED).field("status")).isEqualTo(500);
    }

    @Nested
    @DisplayName("Remote address")
    class RemoteAddressTests {

        @Test
        void prefersFirstForwardedHop() {
            assertThat(LogQueryResource.remoteAddress(" 198.51.100.7 , 10.0.0.1", null)).isEqualTo("198.51.100.7");
        }

        @Test
        void fallsBackToConnectionPeer() {
            SocketAddress peer = mock(SocketAddress.class);
            when(peer.host()).thenReturn("192.168.1.5");
            HttpServerRequest request = mock(HttpServerRequest.class);
            when(request.remoteAddress()).thenReturn(peer);

            assertThat(LogQueryResource.remoteAddress(null, request)).isEqualTo("192.168.1.5");
        }

        @Test
        void unknownWithoutAnySource() {
            assertThat(LogQueryResource.remoteAddress("  ", null)).isEqualTo("unknown");
        }
    }
}
