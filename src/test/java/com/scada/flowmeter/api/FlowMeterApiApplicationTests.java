package com.scada.flowmeter.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Boots the whole service on an in-memory H2 database and exercises upload and retrieval end to end.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "spring.r2dbc.url=r2dbc:h2:mem:///applicationtest?options=DB_CLOSE_DELAY=-1",
                "flowmeter.environment=test"
        }
)
class FlowMeterApiApplicationTests {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void uploadedReading_shouldBeRetrievableByDevice() {
        webTestClient.post().uri("/api/flowmeter/upload")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"deviceid": "FM-E2E", "FT1MassFlow": "$$12.5$$", "FT1Temp": "$$   $$", "FT2Density": "abc"}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.device_id").isEqualTo("FM-E2E")
                .jsonPath("$.environment").isEqualTo("test");

        webTestClient.get().uri("/api/flowmeter/data?device_id=FM-E2E")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalCount").isEqualTo(1)
                .jsonPath("$.data[0].DeviceId").isEqualTo("FM-E2E")
                .jsonPath("$.data[0].FT1MassFlow").isEqualTo(12.5)
                .jsonPath("$.data[0].FT1Temp").isEmpty()
                .jsonPath("$.data[0].FT2Density").isEmpty();
    }

    @Test
    void uploadedReadingWithPaddedDeviceId_shouldBeFoundByThatDeviceId() {
        webTestClient.post().uri("/api/flowmeter/upload")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"deviceid\": \" FM-PAD \", \"FT1MassFlow\": \"$$7.5$$\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.device_id").isEqualTo("FM-PAD");

        webTestClient.get().uri(uriBuilder -> uriBuilder.path("/api/flowmeter/data")
                        .queryParam("device_id", " FM-PAD ")
                        .build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalCount").isEqualTo(1)
                .jsonPath("$.data[0].DeviceId").isEqualTo("FM-PAD");

        webTestClient.get().uri("/api/flowmeter/latest?device_id=FM-PAD")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(1)
                .jsonPath("$.data[0].FT1MassFlow").isEqualTo(7.5);
    }

    @Test
    void uploadWithoutDeviceId_shouldNotCreateRecord() {
        long before = totalCount();

        webTestClient.post().uri("/api/flowmeter/upload")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"FT1MassFlow\": \"$$3$$\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Device ID is required");

        assertEquals(before, totalCount());
    }

    @Test
    void health_shouldReportConnectedDatabase() {
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.database").isEqualTo("connected");
    }

    private long totalCount() {
        Map<?, ?> body = webTestClient.get().uri("/api/flowmeter/data")
                .exchange()
                .expectStatus().isOk()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody();
        assertNotNull(body);
        return ((Number) body.get("totalCount")).longValue();
    }
}
