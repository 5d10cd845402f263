package com.fourpaws.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestContextFilterTest {

    private final RequestContextFilter filter = new RequestContextFilter();

    @Test
    void organizationIdIsTakenFromTheRoute() {
        assertThat(RequestContextFilter.resolveOrganizationId(
                "/organizations/3F2504E0-4F89-11D3-9A0C-0305E82C3301/animals"))
                .isEqualTo("3f2504e0-4f89-11d3-9a0c-0305e82c3301");
        assertThat(RequestContextFilter.resolveOrganizationId("/organizations")).isNull();
        assertThat(RequestContextFilter.resolveOrganizationId("/health")).isNull();
    }

    @Test
    void requestIdIsPropagatedAndClearedAfterwards() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET",
                "/organizations/3f2504e0-4f89-11d3-9a0c-0305e82c3301/animals");
        request.addHeader(RequestContextFilter.REQUEST_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenRequestId = new AtomicReference<>();
        AtomicReference<String> seenOrganization = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seenRequestId.set(MDC.get("requestId"));
                seenOrganization.set(MDC.get("organizationId"));
            }
        });

        assertThat(seenRequestId.get()).isEqualTo("req-42");
        assertThat(seenOrganization.get()).isEqualTo("3f2504e0-4f89-11d3-9a0c-0305e82c3301");
        assertThat(response.getHeader(RequestContextFilter.REQUEST_ID_HEADER)).isEqualTo("req-42");
        assertThat(MDC.get("requestId")).isNull();
        assertThat(MDC.get("organizationId")).isNull();
    }
}
