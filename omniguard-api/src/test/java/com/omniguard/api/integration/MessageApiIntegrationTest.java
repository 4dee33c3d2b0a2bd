package com.omniguard.api.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omniguard.api.OmniGuardApiApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the message, quota, audit and key endpoints.
 * Each test uses its own identity so quota and throttle state do not leak between tests.
 */
@SpringBootTest(
    classes = OmniGuardApiApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class MessageApiIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private String baseUrl;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port + "/api/v1";
    }

    private HttpHeaders headersFor(String identityId, String tier, String roles) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Identity-Id", identityId);
        headers.set("X-Identity-Tier", tier);
        if (roles != null) {
            headers.set("X-Identity-Roles", roles);
        }
        return headers;
    }

    private HttpHeaders userHeaders() {
        return headersFor("user-" + UUID.randomUUID().toString().substring(0, 8), "FREE", null);
    }

    private ResponseEntity<String> send(HttpHeaders headers, String text) {
        return restTemplate.exchange(baseUrl + "/messages", HttpMethod.POST,
                new HttpEntity<>(Map.of("text", text), headers), String.class);
    }

    private ResponseEntity<String> get(String path, HttpHeaders headers) {
        return restTemplate.exchange(baseUrl + path, HttpMethod.GET, new HttpEntity<>(headers), String.class);
    }

    private JsonNode json(ResponseEntity<String> response) throws Exception {
        return objectMapper.readTree(response.getBody());
    }

    // ==================== Messages ====================

    @Test
    void sendMessage_deliversAndReadsBack() throws Exception {
        HttpHeaders headers = userHeaders();

        ResponseEntity<String> sent = send(headers, "Talking helps, thank you.");

        assertThat(sent.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        JsonNode body = json(sent);
        assertThat(body.get("status").asText()).isEqualTo("DELIVERED");
        assertThat(body.get("remaining").asInt()).isEqualTo(49);
        String messageId = body.get("messageId").asText();

        ResponseEntity<String> read = get("/messages/" + messageId, headers);
        assertThat(read.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(json(read).get("text").asText()).isEqualTo("Talking helps, thank you.");
    }

    @Test
    void sendMessage_withInjection_returns422() throws Exception {
        ResponseEntity<String> response = send(userHeaders(), "'; DROP TABLE users; --");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        JsonNode body = json(response);
        assertThat(body.get("status").asText()).isEqualTo("CONTENT_BLOCKED");
        assertThat(body.get("reasons").get(0).asText()).isEqualTo("INJECTION_DETECTED");
        assertThat(body.get("messageId").isNull()).isTrue();
    }

    @Test
    void sendMessage_withoutText_returns400() throws Exception {
        ResponseEntity<String> response = restTemplate.exchange(baseUrl + "/messages", HttpMethod.POST,
                new HttpEntity<>(Map.of(), userHeaders()), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(json(response).get("code").asText()).isEqualTo("MSG_003");
    }

    @Test
    void readMessage_ofAnotherIdentity_returns404() throws Exception {
        ResponseEntity<String> sent = send(userHeaders(), "just for me");
        String messageId = json(sent).get("messageId").asText();

        ResponseEntity<String> read = get("/messages/" + messageId, userHeaders());

        assertThat(read.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(json(read).get("code").asText()).isEqualTo("MSG_001");
    }

    @Test
    void quota_reflectsDeliveredMessages() throws Exception {
        HttpHeaders headers = headersFor("guest-" + UUID.randomUUID().toString().substring(0, 8), "GUEST", null);
        send(headers, "first message");
        send(headers, "second message");

        ResponseEntity<String> response = get("/quota", headers);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode body = json(response);
        assertThat(body.get("capacity").asInt()).isEqualTo(10);
        assertThat(body.get("used").asInt()).isEqualTo(2);
        assertThat(body.get("remaining").asInt()).isEqualTo(8);
        assertThat(body.get("resetAt").asText()).endsWith("T00:00:00Z");
    }

    // ==================== Throttling ====================

    @Test
    void burstOfRequests_isThrottledWith429() throws Exception {
        HttpHeaders headers = headersFor("guest-" + UUID.randomUUID().toString().substring(0, 8), "GUEST", null);

        for (int i = 0; i < 5; i++) {
            ResponseEntity<String> response = send(headers, "message " + i);
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
            assertThat(response.getHeaders().containsKey("X-Rate-Limit-Remaining")).isTrue();
        }

        ResponseEntity<String> throttled = send(headers, "one too many");

        assertThat(throttled.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(throttled.getHeaders().getFirst("X-Rate-Limit-Retry-After-Seconds")).isNotNull();
        assertThat(json(throttled).get("code").asText()).isEqualTo("THROTTLE_001");
    }

    // ==================== Security ====================

    @Test
    void requestWithoutIdentity_returns401() {
        ResponseEntity<String> response = get("/quota", new HttpHeaders());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void auditEndpoints_requireOperatorRole() {
        ResponseEntity<String> response = get("/audit/verify", userHeaders());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void healthEndpoint_isPublic() throws Exception {
        ResponseEntity<String> response = get("/health", new HttpHeaders());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(json(response).get("status").asText()).isEqualTo("UP");
    }

    // ==================== Operator ====================

    @Test
    void operator_canVerifyAndExportAuditChain() throws Exception {
        send(userHeaders(), "something to audit");
        HttpHeaders operator = headersFor("ops-1", "FREE", "OPERATOR");

        ResponseEntity<String> verify = get("/audit/verify", operator);
        ResponseEntity<String> export = get("/audit/export", operator);

        assertThat(verify.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(json(verify).get("valid").asBoolean()).isTrue();
        assertThat(export.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(json(export).get("entryCount").asInt()).isPositive();
    }

    @Test
    void unfreeze_whenNotFrozen_returns409() throws Exception {
        HttpHeaders operator = headersFor("ops-1", "FREE", "OPERATOR");

        ResponseEntity<String> response = restTemplate.exchange(baseUrl + "/audit/unfreeze", HttpMethod.POST,
                new HttpEntity<>(operator), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(json(response).get("code").asText()).isEqualTo("AUDIT_001");
    }

    @Test
    void operator_canRotateKey_andOldMessagesStayReadable() throws Exception {
        HttpHeaders user = userHeaders();
        String messageId = json(send(user, "written before rotation")).get("messageId").asText();
        HttpHeaders operator = headersFor("ops-1", "FREE", "OPERATOR");

        ResponseEntity<String> rotated = restTemplate.exchange(baseUrl + "/keys/rotate", HttpMethod.POST,
                new HttpEntity<>(operator), String.class);
        String activeKeyId = json(rotated).get("activeKeyId").asText();

        assertThat(rotated.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(json(get("/keys/active", operator)).get("activeKeyId").asText()).isEqualTo(activeKeyId);
        assertThat(json(get("/messages/" + messageId, user)).get("text").asText())
                .isEqualTo("written before rotation");
    }
}
