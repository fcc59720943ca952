package com.nicuanalytics.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.nicuanalytics.exception.ReferenceDataException;
import com.nicuanalytics.exception.ReferenceDataUnavailableException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class ReferenceDataClient {

    @Value("${nicu.reference.base-url}")
    private String baseUrl;

    @Value("${nicu.reference.timeout-seconds:10}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
        log.info("ReferenceDataClient initialised → {}", baseUrl);
    }

    public Mono<Map<String, String>> fetchTable(String tableName, String requestId) {
        return webClient.get().uri("/reference-tables/{name}", tableName)
            .header("X-Request-ID", requestId)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(b -> new ReferenceDataException(
                        "Reference table '" + tableName + "' rejected (" + resp.statusCode().value() + "): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(b -> new ReferenceDataUnavailableException(new RuntimeException(b))))
            .bodyToFlux(JsonNode.class)
            .collect(LinkedHashMap<String, String>::new, (rows, row) -> addRow(tableName, rows, row))
            .map(rows -> (Map<String, String>) rows)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new ReferenceDataUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, ReferenceDataUnavailableException::new);
    }

    private void addRow(String tableName, Map<String, String> rows, JsonNode row) {
        if (row == null || !row.hasNonNull("code") || !row.hasNonNull("description")) {
            throw new ReferenceDataException(
                "Reference table '" + tableName + "' row missing 'code' or 'description': " + row);
        }
        rows.putIfAbsent(row.get("code").asText().trim(), row.get("description").asText());
    }
}
