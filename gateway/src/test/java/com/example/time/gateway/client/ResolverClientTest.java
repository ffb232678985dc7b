package com.example.time.gateway.client;

import com.example.time.gateway.config.GatewayConfig;
import com.example.time.gateway.config.GatewayProperties;
import com.example.time.gateway.exception.ResolverException;
import com.example.time.gateway.exception.ResolverException.FailureKind;
import com.example.time.gateway.support.StubResolver;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ResolverClientTest {

    private static final Duration TIMEOUT = Duration.ofMillis(500);
    private static final StubResolver STUB = new StubResolver(Duration.ofSeconds(3));

    @AfterAll
    static void stopStub() {
        STUB.close();
    }

    @BeforeEach
    void resetStub() {
        STUB.reset();
    }

    private static ResolverClient clientFor(String url) {
        GatewayProperties properties = new GatewayProperties(URI.create(url), TIMEOUT, Duration.ofMillis(500));
        WebClient webClient = new GatewayConfig().resolverWebClient(WebClient.builder(), properties);
        return new ResolverClient(webClient, properties);
    }

    @Test
    void forwardsTimezoneAndRequestIdOnce() {
        StepVerifier.create(clientFor(STUB.baseUrl()).fetchTime("US/Eastern", "req-1"))
                .assertNext(body -> {
                    assertThat(body.getTimezone()).isEqualTo("US/Eastern");
                    assertThat(body.getRequestId()).isEqualTo("req-1");
                    assertThat(body.getTimestamp()).isEqualTo(StubResolver.FIXED_TIMESTAMP);
                    assertThat(body.getSource()).isEqualTo("api2");
                })
                .verifyComplete();

        assertThat(STUB.calls()).isEqualTo(1);
        assertThat(STUB.requestIdHeaders()).containsExactly("req-1");
        assertThat(STUB.queries().get(0)).contains("request_id=req-1").contains("timezone=US%2FEastern");
    }

    @Test
    void omitsTimezoneWhenClientSentNone() {
        StepVerifier.create(clientFor(STUB.baseUrl()).fetchTime(null, "req-2"))
                .assertNext(body -> assertThat(body.getTimezone()).isEqualTo("UTC"))
                .verifyComplete();

        assertThat(STUB.queries().get(0)).doesNotContain("timezone");
    }

    @Test
    void toleratesTrailingSlashInBaseUrl() {
        StepVerifier.create(clientFor(STUB.baseUrl() + "/").fetchTime("EST", "req-3"))
                .assertNext(body -> assertThat(body.getTimezone()).isEqualTo("EST"))
                .verifyComplete();
    }

    @Test
    void keepsResolverRequestIdVerbatim() {
        StepVerifier.create(clientFor(STUB.baseUrl()).fetchTime("OTHER_ID", "req-4"))
                .assertNext(body -> assertThat(body.getRequestId()).isEqualTo("resolver-minted-id"))
                .verifyComplete();
    }

    @Test
    void errorStatusIsBadStatus() {
        StepVerifier.create(clientFor(STUB.baseUrl()).fetchTime("BROKEN", "req-5"))
                .expectErrorSatisfies(error -> assertFailure(error, FailureKind.BAD_STATUS, "req-5"))
                .verify();
        assertThat(STUB.calls()).isEqualTo(1);
    }

    @Test
    void unparseableBodyIsBadResponse() {
        StepVerifier.create(clientFor(STUB.baseUrl()).fetchTime("GARBAGE", "req-6"))
                .expectErrorSatisfies(error -> assertFailure(error, FailureKind.BAD_RESPONSE, "req-6"))
                .verify();
    }

    @Test
    void incompleteBodyIsBadResponse() {
        StepVerifier.create(clientFor(STUB.baseUrl()).fetchTime("PARTIAL", "req-7"))
                .expectErrorSatisfies(error -> assertFailure(error, FailureKind.BAD_RESPONSE, "req-7"))
                .verify();
    }

    @Test
    void slowResolverTimesOutWithoutRetry() {
        StepVerifier.create(clientFor(STUB.baseUrl()).fetchTime("SLOW", "req-8"))
                .expectErrorSatisfies(error -> assertFailure(error, FailureKind.TIMEOUT, "req-8"))
                .verify(Duration.ofSeconds(2));
        assertThat(STUB.calls()).isEqualTo(1);
    }

    @Test
    void unreachableResolverIsUnavailable() {
        StepVerifier.create(clientFor("http://127.0.0.1:1").fetchTime("UTC", "req-9"))
                .expectErrorSatisfies(error -> assertFailure(error, FailureKind.UNAVAILABLE, "req-9"))
                .verify(Duration.ofSeconds(2));
    }

    @Test
    void translateKeepsExistingResolverException() {
        ResolverException original = new ResolverException(FailureKind.TIMEOUT, "req-10", "late");

        assertThat(ResolverClient.translate(original, "other")).isSameAs(original);
        assertThat(ResolverClient.translate(new IllegalStateException("boom"), "req-10").getKind())
                .isEqualTo(FailureKind.UNAVAILABLE);
    }

    private static void assertFailure(Throwable error, FailureKind kind, String requestId) {
        assertThat(error).isInstanceOf(ResolverException.class);
        ResolverException failure = (ResolverException) error;
        assertThat(failure.getKind()).isEqualTo(kind);
        assertThat(failure.getRequestId()).isEqualTo(requestId);
    }
}
