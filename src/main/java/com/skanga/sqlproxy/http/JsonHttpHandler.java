package com.skanga.sqlproxy.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.sqlproxy.config.ResourceManager;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for handlers that speak JSON.
 * Answers CORS preflight requests, always closes the exchange and turns uncaught exceptions into
 * a 500 response with a generic {@code detail}.
 */
public abstract class JsonHttpHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(JsonHttpHandler.class);
    protected static final ObjectMapper objectMapper = new ObjectMapper();
    static final String CONTENT_TYPE_JSON = "application/json; charset=utf-8";

    @Override
    public final void handle(HttpExchange httpExchange) throws IOException {
        try {
            addCorsHeaders(httpExchange);
            if ("OPTIONS".equalsIgnoreCase(httpExchange.getRequestMethod())) {
                httpExchange.sendResponseHeaders(204, -1);
                return;
            }
            handleRequest(httpExchange);
        } catch (Exception e) {
            logger.error("Unhandled error serving {} {}", httpExchange.getRequestMethod(),
                    httpExchange.getRequestURI().getPath(), e);
            // Nothing more can be sent once the status line is out
            if (httpExchange.getResponseCode() == -1) {
                sendError(httpExchange, 500, ResourceManager.getErrorMessage("http.internal.error"));
            }
        } finally {
            httpExchange.close();
        }
    }

    /**
     * Handles one request. Implementations must send a response on every path that returns normally.
     */
    protected abstract void handleRequest(HttpExchange httpExchange) throws Exception;

    protected void sendJson(HttpExchange httpExchange, int statusCode, JsonNode responseNode) throws IOException {
        byte[] responseBytes = objectMapper.writeValueAsBytes(responseNode);
        httpExchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE_JSON);
        httpExchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream responseBody = httpExchange.getResponseBody()) {
            responseBody.write(responseBytes);
        }
    }

    /**
     * Sends {@code {"detail": "..."}} with the given status.
     */
    protected void sendError(HttpExchange httpExchange, int statusCode, String errorDetail) throws IOException {
        ObjectNode errorNode = objectMapper.createObjectNode();
        errorNode.put("detail", errorDetail);
        sendJson(httpExchange, statusCode, errorNode);
    }

    protected void sendMethodNotAllowed(HttpExchange httpExchange, String allowedMethods) throws IOException {
        httpExchange.getResponseHeaders().set("Allow", allowedMethods);
        sendError(httpExchange, 405, ResourceManager.getErrorMessage("http.method.not.allowed"));
    }

    protected void sendNotFound(HttpExchange httpExchange) throws IOException {
        sendError(httpExchange, 404, ResourceManager.getErrorMessage("http.not.found"));
    }

    /**
     * Decodes the query string; later occurrences of a name win.
     */
    protected static Map<String, String> parseQueryParams(String rawQuery) {
        Map<String, String> queryParams = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return queryParams;
        }
        for (String queryPair : rawQuery.split("&")) {
            if (queryPair.isEmpty()) {
                continue;
            }
            int equalsPos = queryPair.indexOf('=');
            String paramName = equalsPos >= 0 ? queryPair.substring(0, equalsPos) : queryPair;
            String paramValue = equalsPos >= 0 ? queryPair.substring(equalsPos + 1) : "";
            queryParams.put(URLDecoder.decode(paramName, StandardCharsets.UTF_8),
                    URLDecoder.decode(paramValue, StandardCharsets.UTF_8));
        }
        return queryParams;
    }

    private static void addCorsHeaders(HttpExchange httpExchange) {
        httpExchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        httpExchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        httpExchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
    }
}
