package com.nicuanalytics.service;

import com.nicuanalytics.client.ReferenceDataClient;
import com.nicuanalytics.exception.ReferenceDataException;
import com.nicuanalytics.model.ReferenceCodeSets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceDataService {

    private final ReferenceDataClient client;
    private final Map<String, Map<String, String>> tables = new ConcurrentHashMap<>();

    @Value("${nicu.reference.birthweight-table:REF_BIRTHWEIGHT_ICD}")
    private String birthweightTable;

    @Value("${nicu.reference.gestational-age-table:REF_GEST_AGE_ICD}")
    private String gestationalAgeTable;

    @Value("${nicu.reference.timeout-seconds:10}")
    private int timeoutSeconds;

    public ReferenceCodeSets codeSets(String requestId) {
        return ReferenceCodeSets.builder()
            .birthweightCategories(table(birthweightTable, requestId))
            .gestationalAgeCategories(table(gestationalAgeTable, requestId))
            .build();
    }

    Map<String, String> table(String name, String requestId) {
        Map<String, String> cached = tables.get(name);
        if (cached != null) {
            return cached;
        }
        Map<String, String> loaded = client.fetchTable(name, requestId)
            .blockOptional(Duration.ofSeconds(timeoutSeconds * 3L))
            .map(Map::copyOf)
            .orElseThrow(() -> new ReferenceDataException("Reference table '" + name + "' returned no body"));
        Map<String, String> winner = tables.putIfAbsent(name, loaded);
        log.info("Reference table loaded | table={} | codes={} | requestId={}", name, loaded.size(), requestId);
        return winner != null ? winner : loaded;
    }

    public void evictAll() {
        tables.clear();
        log.info("Reference table cache cleared");
    }
}
