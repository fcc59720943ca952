package com.nicuanalytics.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.nicuanalytics.exception.ReferenceDataException;
import com.nicuanalytics.exception.ReferenceDataUnavailableException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.*;

class ReferenceDataClientTest {

    static WireMockServer wireMock;

    private ReferenceDataClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        client = new ReferenceDataClient();
        ReflectionTestUtils.setField(client, "baseUrl", wireMock.baseUrl());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 2);
        client.init();
    }

    @AfterEach
    void resetStubs() {
        wireMock.resetAll();
    }

    @Test
    void fetchTable_readsCodeDescriptionRows() {
        wireMock.stubFor(get(urlEqualTo("/reference-tables/REF_BIRTHWEIGHT_ICD"))
            .willReturn(okJson("""
                [{"code":"P0701","description":"500-749g"},
                 {"code":" P0702 ","description":"750-999g"}]
                """)));

        StepVerifier.create(client.fetchTable("REF_BIRTHWEIGHT_ICD", "req-1"))
            .assertNext(table -> assertThat(table)
                .containsEntry("P0701", "500-749g")
                .containsEntry("P0702", "750-999g"))
            .verifyComplete();

        wireMock.verify(getRequestedFor(urlEqualTo("/reference-tables/REF_BIRTHWEIGHT_ICD"))
            .withHeader("X-Request-ID", equalTo("req-1")));
    }

    @Test
    void fetchTable_serverError_isUnavailable() {
        wireMock.stubFor(get(urlEqualTo("/reference-tables/REF_GEST_AGE_ICD"))
            .willReturn(aResponse().withStatus(500).withBody("database down")));

        StepVerifier.create(client.fetchTable("REF_GEST_AGE_ICD", "req-2"))
            .expectError(ReferenceDataUnavailableException.class)
            .verify();
    }

    @Test
    void fetchTable_unknownTable_isReferenceDataError() {
        wireMock.stubFor(get(urlEqualTo("/reference-tables/NOPE"))
            .willReturn(aResponse().withStatus(404).withBody("no such table")));

        StepVerifier.create(client.fetchTable("NOPE", "req-3"))
            .expectErrorSatisfies(ex -> assertThat(ex)
                .isInstanceOf(ReferenceDataException.class)
                .hasMessageContaining("404"))
            .verify();
    }

    @Test
    void fetchTable_rowWithoutDescription_isReferenceDataError() {
        wireMock.stubFor(get(urlEqualTo("/reference-tables/REF_BIRTHWEIGHT_ICD"))
            .willReturn(okJson("[{\"code\":\"P0701\"}]")));

        StepVerifier.create(client.fetchTable("REF_BIRTHWEIGHT_ICD", "req-4"))
            .expectError(ReferenceDataException.class)
            .verify();
    }

    @Test
    void fetchTable_connectionRefused_isUnavailableAfterRetries() {
        ReflectionTestUtils.setField(client, "baseUrl", "http://localhost:1");
        client.init();

        StepVerifier.create(client.fetchTable("REF_BIRTHWEIGHT_ICD", "req-5"))
            .expectError(ReferenceDataUnavailableException.class)
            .verify();
    }
}
