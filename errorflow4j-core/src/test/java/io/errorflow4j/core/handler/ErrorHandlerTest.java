/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.errorflow4j.core.api.ErrorClassifier;
import io.errorflow4j.core.api.LogSink;
import io.errorflow4j.core.api.model.CaptureEvent;
import io.errorflow4j.core.api.model.ErrorCategory;
import io.errorflow4j.core.api.model.RequestExpectation;
import io.errorflow4j.core.api.shape.CategorizedException;
import io.errorflow4j.core.api.shape.ErrorflowException;
import io.errorflow4j.core.api.shape.HttpClientException;
import io.errorflow4j.core.dedup.DedupCache;
import io.errorflow4j.core.report.Reporter;
import io.errorflow4j.core.sanitize.DataSanitizer;
import io.errorflow4j.core.sanitize.SanitizationPolicy;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorHandler")
class ErrorHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RecordingLogSink sink;
    private Reporter reporter;
    private RequestExpectations expectations;
    private ErrorHandler handler;

    @BeforeEach
    void setUp() {
        sink = new RecordingLogSink();
        reporter = mock(Reporter.class);
        expectations = new RequestExpectations();
        handler = ErrorHandler.builder()
                .sink(sink)
                .reporter(reporter)
                .requestContext(expectations)
                .build();
    }

    private static Map<String, Object> json(String line) throws Exception {
        return MAPPER.readValue(line, new TypeReference<Map<String, Object>>() {});
    }

    private static HttpClientException notFound() {
        return HttpClientException.builder()
                .status(404)
                .statusText("Not Found")
                .method("GET")
                .url("https://api.example.com/users/42")
                .build();
    }

    @Nested
    @DisplayName("captureError")
    class Capture {

        @Test
        @DisplayName("writes the sanitized record as pretty JSON")
        void writesRecord() throws Exception {
            handler.captureError(new RuntimeException("Database connection failed: ECONNREFUSED"), "dbClient");

            assertThat(sink.errors).hasSize(1);
            assertThat(sink.errors.get(0)).contains("\n");
            assertThat(json(sink.errors.get(0)))
                    .containsEntry("source", "dbClient")
                    .containsEntry("context", "Database Error")
                    .containsEntry("message", "Database connection failed: ECONNREFUSED")
                    .containsEntry("category", "CONNECTION")
                    .doesNotContainKeys("statusCode", "url", "stack");
            verify(reporter).report(new CaptureEvent("dbClient", ErrorCategory.CONNECTION, CaptureEvent.Outcome.LOGGED));
        }

        @Test
        @DisplayName("HTTP errors get a second line with the exchange details")
        void httpDetailsLine() throws Exception {
            handler.captureError(notFound(), "usersApi");

            assertThat(sink.errors).hasSize(2);
            assertThat(json(sink.errors.get(0)))
                    .containsEntry("message", "HTTP 404: Not Found (GET /users/42)")
                    .containsEntry("category", "NOT_FOUND")
                    .containsEntry("statusCode", 404)
                    .containsEntry("url", "/users/42")
                    .doesNotContainKey("details");
            Map<String, Object> extra = json(sink.errors.get(1));
            assertThat(extra).containsEntry("source", "usersApi").containsEntry("type", "Not Found");
            assertThat(extra.get("details")).asInstanceOf(InstanceOfAssertFactories.MAP)
                    .containsEntry("status", 404)
                    .containsEntry("url", "/users/42");
        }

        @Test
        @DisplayName("details without status text are typed Unknown")
        void unknownType() throws Exception {
            handler.captureError(
                    new CategorizedException(ErrorCategory.VALIDATION, "bad order", Map.of("id", 7)), "orders");

            assertThat(sink.errors).hasSize(2);
            assertThat(json(sink.errors.get(1))).containsEntry("type", ErrorHandler.UNKNOWN_TYPE);
        }

        @Test
        @DisplayName("sensitive values never reach the sink")
        void neverLeaksSecrets() {
            var error = HttpClientException.builder()
                    .status(500)
                    .headers(Map.of("Authorization", "Bearer s3cr3t-value"))
                    .responseData(Map.of("accessToken", "tok-123", "nested", Map.of("password", "pw-456")))
                    .build();

            handler.captureError(error, "api");

            assertThat(String.join("\n", sink.errors))
                    .doesNotContain("s3cr3t-value", "tok-123", "pw-456")
                    .contains(SanitizationPolicy.DEFAULT_MASK);
        }
    }

    @Nested
    @DisplayName("deduplication")
    class Dedup {

        @Test
        @DisplayName("the same fingerprint is logged once")
        void logsOnce() {
            handler.captureError(new RuntimeException("boom"), "svc");
            handler.captureError(new RuntimeException("boom"), "svc");

            assertThat(sink.errors).hasSize(1);
            assertThat(handler.cacheSize()).isEqualTo(1);
            verify(reporter).report(new CaptureEvent("svc", ErrorCategory.UNKNOWN, CaptureEvent.Outcome.DUPLICATE));
        }

        @Test
        @DisplayName("a different source is a different fingerprint")
        void differentSource() {
            handler.captureError(new RuntimeException("boom"), "svc-a");
            handler.captureError(new RuntimeException("boom"), "svc-b");

            assertThat(sink.errors).hasSize(2);
        }

        @Test
        @DisplayName("after the bound, only the evicted fingerprint is logged again")
        void evictedIsLoggedAgain() {
            for (int i = 0; i <= DedupCache.DEFAULT_MAX_ENTRIES; i++) {
                handler.captureError(new RuntimeException("failure " + i), "svc");
            }
            assertThat(sink.errors).hasSize(DedupCache.DEFAULT_MAX_ENTRIES + 1);

            handler.captureError(new RuntimeException("failure 1"), "svc");
            handler.captureError(new RuntimeException("failure 1000"), "svc");
            assertThat(sink.errors).hasSize(DedupCache.DEFAULT_MAX_ENTRIES + 1);

            handler.captureError(new RuntimeException("failure 0"), "svc");
            assertThat(sink.errors).hasSize(DedupCache.DEFAULT_MAX_ENTRIES + 2);
        }

        @Test
        @DisplayName("resetCache forgets every fingerprint")
        void reset() {
            handler.captureError(new RuntimeException("boom"), "svc");
            handler.resetCache();
            handler.captureError(new RuntimeException("boom"), "svc");

            assertThat(sink.errors).hasSize(2);
            assertThat(handler.cacheSize()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("expected errors")
    class Expected {

        @Test
        @DisplayName("a declared status in a negative test is logged at info only")
        void negativeTest() {
            expectations.register("login rejects bad password", RequestExpectation.negative(401));
            var error = HttpClientException.builder().status(401).statusText("Unauthorized").build();

            handler.captureError(error, "authApi", "login rejects bad password");

            assertThat(sink.errors).isEmpty();
            assertThat(sink.infos)
                    .containsExactly("Expected error in negative test [login rejects bad password]: Status 401");
            assertThat(handler.cacheSize()).isZero();
            verify(reporter)
                    .report(new CaptureEvent("authApi", ErrorCategory.AUTHENTICATION, CaptureEvent.Outcome.EXPECTED));
        }

        @Test
        @DisplayName("a declared status outside a negative test is a real error")
        void notNegative() {
            expectations.register("ctx", new RequestExpectation(Set.of(401), false));

            handler.captureError(HttpClientException.builder().status(401).build(), "authApi", "ctx");

            assertThat(sink.infos).isEmpty();
            assertThat(sink.errors).isNotEmpty();
        }

        @Test
        @DisplayName("an undeclared status in a negative test is a real error")
        void undeclaredStatus() {
            expectations.register("ctx", RequestExpectation.negative(404));

            handler.captureError(HttpClientException.builder().status(500).build(), "api", "ctx");

            assertThat(sink.infos).isEmpty();
            assertThat(sink.errors).isNotEmpty();
        }
    }

    @Nested
    @DisplayName("failures inside the handler")
    class Failures {

        @Test
        @DisplayName("are reduced to a fallback record")
        void fallbackRecord() throws Exception {
            ErrorClassifier broken = mock(ErrorClassifier.class);
            when(broken.inferContext(any())).thenThrow(new IllegalStateException("classifier exploded\nat x"));
            ErrorHandler h = ErrorHandler.builder().classifier(broken).sink(sink).reporter(reporter).build();

            h.captureError(new RuntimeException("boom"), "svc");

            assertThat(sink.errors).hasSize(1);
            assertThat(json(sink.errors.get(0)))
                    .containsExactly(
                            entry("source", "svc"),
                            entry("context", ErrorHandler.FAILURE_CONTEXT),
                            entry("message", "classifier exploded"),
                            entry("category", "UNKNOWN"));
            verify(reporter).report(new CaptureEvent("svc", ErrorCategory.UNKNOWN, CaptureEvent.Outcome.HANDLER_FAILURE));
        }

        @Test
        @DisplayName("a self-referencing map is logged with the cycle marked")
        void cyclicMap() throws Exception {
            Map<String, Object> a = new HashMap<>();
            Map<String, Object> b = new HashMap<>();
            a.put("message", "boom");
            a.put("child", b);
            b.put("parentRef", a);

            assertThatCode(() -> handler.captureError(a, "svc")).doesNotThrowAnyException();

            assertThat(sink.errors).hasSize(2);
            assertThat(json(sink.errors.get(0)))
                    .containsEntry("message", "boom")
                    .containsEntry("context", "General Error");
            assertThat(sink.errors.get(1)).contains(DataSanitizer.CIRCULAR);
            verify(reporter).report(new CaptureEvent("svc", ErrorCategory.UNKNOWN, CaptureEvent.Outcome.LOGGED));
        }

        @Test
        @DisplayName("a stack overflow while building the record is reduced to a fallback record")
        void stackOverflow() throws Exception {
            ErrorClassifier broken = mock(ErrorClassifier.class);
            when(broken.inferContext(any())).thenThrow(new StackOverflowError());
            ErrorHandler h = ErrorHandler.builder().classifier(broken).sink(sink).reporter(reporter).build();

            assertThatCode(() -> h.captureError(new RuntimeException("boom"), "svc")).doesNotThrowAnyException();

            assertThat(sink.errors).hasSize(1);
            assertThat(json(sink.errors.get(0)))
                    .containsEntry("context", ErrorHandler.FAILURE_CONTEXT)
                    .containsEntry("message", "StackOverflowError");
            verify(reporter).report(new CaptureEvent("svc", ErrorCategory.UNKNOWN, CaptureEvent.Outcome.HANDLER_FAILURE));
        }

        @Test
        @DisplayName("never escape, even when the sink itself fails")
        void sinkFailure() {
            LogSink failing = mock(LogSink.class);
            doThrow(new IllegalStateException("disk full")).when(failing).error(anyString());
            ErrorHandler h = ErrorHandler.builder().sink(failing).build();

            assertThatCode(() -> h.captureError(new RuntimeException("boom"), "svc")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("a failing reporter does not affect logging")
        void reporterFailure() {
            doThrow(new IllegalStateException("metrics down")).when(reporter).report(any());

            assertThatCode(() -> handler.captureError(new RuntimeException("boom"), "svc"))
                    .doesNotThrowAnyException();
            assertThat(sink.errors).hasSize(1);
        }
    }

    @Test
    @DisplayName("logAndThrow logs, then throws")
    void logAndThrow() {
        assertThatThrownBy(() -> handler.logAndThrow("Checkout total mismatch", "checkout"))
                .isInstanceOf(ErrorflowException.class)
                .hasMessage("Checkout total mismatch");
        assertThat(sink.errors).hasSize(1);
        assertThat(sink.errors.get(0)).contains("Checkout total mismatch");
    }

    @Test
    @DisplayName("logAndContinue marks the context as non-fatal")
    void logAndContinue() throws Exception {
        handler.logAndContinue(new RuntimeException("first"), "svc", "Cleanup");
        handler.logAndContinue(new RuntimeException("second"), "svc");

        assertThat(json(sink.errors.get(0))).containsEntry("context", "Cleanup (non-fatal)");
        assertThat(json(sink.errors.get(1))).containsEntry("context", ErrorHandler.NON_FATAL_CONTEXT);
    }

    @Test
    @DisplayName("helper operations delegate to the pipeline")
    void helpers() {
        assertThat(handler.getErrorMessage(notFound())).isEqualTo("HTTP 404: Not Found (GET /users/42)");
        assertThat(handler.createErrorDetails(notFound(), "api", null).statusCode()).isEqualTo(404);
        assertThat(handler.sanitizeObject(Map.of("stack", "x", "token", "t")))
                .isEqualTo(Map.of("token", SanitizationPolicy.DEFAULT_MASK));
        assertThat(handler.sanitizeData(Map.of("password", "p")))
                .isEqualTo(Map.of("password", SanitizationPolicy.DEFAULT_MASK));
        assertThat(handler.sanitizeByPaths(Map.of("a", Map.of("b", "c")), List.of("a.b"), "#"))
                .isEqualTo(Map.of("a", Map.of("b", "#")));
    }
}
