package com.sandy.aiot.gateway.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.gateway.vo.DiagnosticIntent;
import com.sandy.aiot.gateway.vo.DiagnosticRequest;
import com.sandy.aiot.gateway.vo.EventGap;
import com.sandy.aiot.gateway.vo.GapAnalysis;
import com.sandy.aiot.gateway.vo.PatternDetectionResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApiLoggingAspectTest {

    private final ApiLoggingAspect aspect = new ApiLoggingAspect(new ObjectMapper());

    @Test
    void webhookBodyIsLoggedBySizeOnly() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/webhook/smartthings");
        request.addHeader("X-ST-HMAC", "deadbeef");
        byte[] body = "{\"secretPayload\":true}".getBytes();

        String line = aspect.describeRequest(request, new Object[]{body, request});

        assertEquals("bodyBytes=" + body.length + " signed=true", line);
        assertFalse(line.contains("secretPayload"));
        assertFalse(line.contains("deadbeef"));
    }

    @Test
    void pathVariablesAndDiagnosticIntentAreLogged() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/events/device/lamp-1/gaps");
        request.setQueryString("hours=24");
        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("deviceId", "lamp-1"));

        assertEquals("deviceId=lamp-1 query=hours=24", aspect.describeRequest(request, new Object[]{"lamp-1", null, 24}));
        assertEquals("intent=ISSUE_DIAGNOSIS device=Hall Lamp", aspect.describeRequest(null,
                new Object[]{DiagnosticRequest.builder().intent(DiagnosticIntent.ISSUE_DIAGNOSIS).device("Hall Lamp").build()}));
    }

    @Test
    void largeResultsAreSummarisedAsCounts() {
        GapAnalysis gaps = GapAnalysis.builder().thresholdMs(3_600_000)
                .gaps(List.of(EventGap.builder().durationMs(7_200_000).suspicious(true).build()))
                .suspiciousGaps(List.of(EventGap.builder().durationMs(7_200_000).suspicious(true).build()))
                .build();
        assertEquals("gaps=1 suspiciousGaps=1 thresholdMs=3600000", aspect.describe(gaps));

        PatternDetectionResult detection = PatternDetectionResult.builder().deviceId("lamp-1").eventsAnalyzed(42).build();
        assertEquals("deviceId=lamp-1 eventsAnalyzed=42 patterns=[]", aspect.describe(detection));

        assertEquals("result=<event stream>", aspect.describe(new SseEmitter()));
        assertEquals("items=3", aspect.describe(List.of(1, 2, 3)));
    }

    @Test
    void responseEntityCarriesStatus() {
        String line = aspect.describe(ResponseEntity.status(401).body(Map.of("error", "Unauthorized")));
        assertEquals("status=401 body={\"error\":\"Unauthorized\"}", line);
    }
}
