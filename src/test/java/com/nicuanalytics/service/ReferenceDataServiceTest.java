package com.nicuanalytics.service;

import com.nicuanalytics.client.ReferenceDataClient;
import com.nicuanalytics.exception.ReferenceDataException;
import com.nicuanalytics.exception.ReferenceDataUnavailableException;
import com.nicuanalytics.model.ReferenceCodeSets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReferenceDataServiceTest {

    @Mock ReferenceDataClient client;
    @InjectMocks ReferenceDataService service;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(service, "birthweightTable", "REF_BIRTHWEIGHT_ICD");
        ReflectionTestUtils.setField(service, "gestationalAgeTable", "REF_GEST_AGE_ICD");
        ReflectionTestUtils.setField(service, "timeoutSeconds", 1);
    }

    private void stubTables() {
        when(client.fetchTable(eq("REF_BIRTHWEIGHT_ICD"), anyString()))
            .thenReturn(Mono.just(Map.of("P0701", "500-749g")));
        when(client.fetchTable(eq("REF_GEST_AGE_ICD"), anyString()))
            .thenReturn(Mono.just(Map.of("P0724", "<24 weeks")));
    }

    @Test
    void codeSets_loadsBothTables() {
        stubTables();

        ReferenceCodeSets codeSets = service.codeSets("req-1");

        assertThat(codeSets.getBirthweightCategories()).containsEntry("P0701", "500-749g");
        assertThat(codeSets.getGestationalAgeCategories()).containsEntry("P0724", "<24 weeks");
    }

    @Test
    void codeSets_servesSecondCallFromCache() {
        stubTables();

        service.codeSets("req-1");
        service.codeSets("req-2");

        verify(client, times(1)).fetchTable(eq("REF_BIRTHWEIGHT_ICD"), anyString());
        verify(client, times(1)).fetchTable(eq("REF_GEST_AGE_ICD"), anyString());
    }

    @Test
    void evictAll_forcesReload() {
        stubTables();

        service.codeSets("req-1");
        service.evictAll();
        service.codeSets("req-2");

        verify(client, times(2)).fetchTable(eq("REF_BIRTHWEIGHT_ICD"), anyString());
    }

    @Test
    void table_emptyBodyIsReferenceDataError() {
        when(client.fetchTable(eq("REF_BIRTHWEIGHT_ICD"), anyString())).thenReturn(Mono.empty());

        assertThatThrownBy(() -> service.codeSets("req-1"))
            .isInstanceOf(ReferenceDataException.class)
            .hasMessageContaining("REF_BIRTHWEIGHT_ICD");
    }

    @Test
    void table_unavailableServiceIsNotCached() {
        when(client.fetchTable(eq("REF_BIRTHWEIGHT_ICD"), anyString()))
            .thenReturn(Mono.error(new ReferenceDataUnavailableException(new ConnectException("refused"))))
            .thenReturn(Mono.just(Map.of("P0701", "500-749g")));
        when(client.fetchTable(eq("REF_GEST_AGE_ICD"), anyString())).thenReturn(Mono.just(Map.of()));

        assertThatThrownBy(() -> service.codeSets("req-1"))
            .isInstanceOf(ReferenceDataUnavailableException.class);
        assertThat(service.codeSets("req-2").getBirthweightCategories()).hasSize(1);
    }
}
