/*
 * Copyright (c) 2025 Errorflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.errorflow4j.core.api.shape;

import java.util.LinkedHashMap;
import java.util.Map;

/** Ready-made {@link HttpClientError} carrier for clients that do not expose their own exception type. */
public class HttpClientException extends RuntimeException implements HttpClientError {
    private static final long serialVersionUID = 1L;

    private final Integer status;
    private final String statusText;
    private final transient Object responseData;
    private final String requestUrl;
    private final String requestMethod;
    private final transient Map<String, Object> requestHeaders;

    protected HttpClientException(Builder b) {
        super(b.message, b.cause);
        this.status = b.status;
        this.statusText = b.statusText;
        this.responseData = b.responseData;
        this.requestUrl = b.requestUrl;
        this.requestMethod = b.requestMethod;
        this.requestHeaders = (b.requestHeaders == null) ? null : new LinkedHashMap<>(b.requestHeaders);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Integer status() {
        return status;
    }

    @Override
    public String statusText() {
        return statusText;
    }

    @Override
    public Object responseData() {
        return responseData;
    }

    @Override
    public String requestUrl() {
        return requestUrl;
    }

    @Override
    public String requestMethod() {
        return requestMethod;
    }

    @Override
    public Map<String, ?> requestHeaders() {
        return requestHeaders;
    }

    public static final class Builder {
        private String message;
        private Throwable cause;
        private Integer status;
        private String statusText;
        private Object responseData;
        private String requestUrl;
        private String requestMethod;
        private Map<String, ?> requestHeaders;

        private Builder() {}

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public Builder status(Integer status) {
            this.status = status;
            return this;
        }

        public Builder statusText(String statusText) {
            this.statusText = statusText;
            return this;
        }

        public Builder responseData(Object responseData) {
            this.responseData = responseData;
            return this;
        }

        public Builder url(String url) {
            this.requestUrl = url;
            return this;
        }

        public Builder method(String method) {
            this.requestMethod = method;
            return this;
        }

        public Builder headers(Map<String, ?> headers) {
            this.requestHeaders = headers;
            return this;
        }

        public HttpClientException build() {
            if (message == null) {
                message = (status == null) ? "Network Error" : "Request failed with status code " + status;
            }
            return new HttpClientException(this);
        }
    }
}
