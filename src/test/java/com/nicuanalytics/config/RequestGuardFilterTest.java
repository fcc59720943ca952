package com.nicuanalytics.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.*;

class RequestGuardFilterTest {

    private RequestGuardFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RequestGuardFilter();
        ReflectionTestUtils.setField(filter, "apiKeyEnabled", true);
        ReflectionTestUtils.setField(filter, "apiKeyHeader", "X-API-Key");
        ReflectionTestUtils.setField(filter, "apiKeyValues", "key-one, key-two");
    }

    @Test
    void validKey_passesAndEchoesRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/rollups");
        request.addHeader("X-API-Key", "key-two");
        request.addHeader("X-Request-ID", "trace-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getHeader("X-Request-ID")).isEqualTo("trace-1");
    }

    @Test
    void missingKey_isRejectedWith401() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/rollups/history");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("\"errorCode\":\"UNAUTHORIZED\"");
        assertThat(response.getHeader("X-Request-ID")).isNotBlank();
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void nonApiPaths_skipTheGuard() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getHeader("X-Request-ID")).isNull();
    }
}
