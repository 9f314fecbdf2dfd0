package com.vlrnotify.infrastructure.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Utility for making bounded HTTP requests that exchange JSON.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;

    /**
     * Non-2xx answer from the remote side.
     */
    public static class HttpStatusException extends IOException {
        private final int status;
        private final String body;

        public HttpStatusException(int status, String body) {
            super("HTTP request failed with status " + status);
            this.status = status;
            this.body = body;
        }

        public int getStatus() {
            return status;
        }

        public String getBody() {
            return body;
        }
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    /**
     * Makes a GET request and returns the response as JsonNode.
     * Connect, connection-lease and read each give up after {@code timeout}.
     */
    public static JsonNode getJson(String url, Map<String, String> headers, Duration timeout) throws IOException {
        return execute(new HttpGet(url), headers, timeout);
    }

    /**
     * Makes a GET request with query parameters and returns the response as JsonNode.
     */
    public static JsonNode getJson(String baseUrl, Map<String, String> params, Map<String, String> headers,
                                   Duration timeout) throws IOException {
        return getJson(buildUrl(baseUrl, params), headers, timeout);
    }

    /**
     * Makes a POST request with a JSON body and returns the response as JsonNode
     * (an empty object node when the response has no body).
     */
    public static JsonNode postJson(String url, JsonNode body, Map<String, String> headers, Duration timeout)
            throws IOException {
        HttpPost request = new HttpPost(url);
        request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        return execute(request, headers, timeout);
    }

    static String buildUrl(String baseUrl, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return baseUrl;
        }
        StringBuilder urlBuilder = new StringBuilder(baseUrl);
        urlBuilder.append(baseUrl.contains("?") ? "&" : "?");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            urlBuilder.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append("=")
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .append("&");
        }
        // Remove trailing &
        urlBuilder.setLength(urlBuilder.length() - 1);
        return urlBuilder.toString();
    }

    private static JsonNode execute(HttpUriRequestBase request, Map<String, String> headers, Duration timeout)
            throws IOException {
        Timeout limit = Timeout.of(timeout);
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(limit)
                .setSocketTimeout(limit)
                .build())
            .build();
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(limit)
            .setResponseTimeout(limit)
            .build();

        try (CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build()) {

            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String contentType = entity != null ? entity.getContentType() : null;
                String responseBody;
                try {
                    responseBody = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
                } catch (ParseException e) {
                    throw new IOException("Failed to parse response", e);
                }

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("HTTP {} {} failed with status {}", request.getMethod(), request.getRequestUri(), statusCode);
                    logResponseBodyPreview(responseBody);
                    throw new HttpStatusException(statusCode, responseBody);
                }

                if (responseBody.isBlank()) {
                    return objectMapper.createObjectNode();
                }

                // If content-type is null or empty, we'll still try to parse as JSON
                if (contentType != null && !contentType.isEmpty()
                        && !contentType.toLowerCase().startsWith("application/json")) {
                    logger.error("Expected JSON but received content-type: {}. URL: {}", contentType, request.getRequestUri());
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Expected JSON response but received: " + contentType);
                }

                try {
                    return objectMapper.readTree(responseBody);
                } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
                    logger.error("Failed to parse JSON. URL: {}", request.getRequestUri());
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
                }
            }
        }
    }
}
