package com.skanga.sqlproxy.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.sqlproxy.SqlProxyServer;
import com.skanga.sqlproxy.db.DatabaseService;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;

/**
 * Serves {@code GET /} and {@code GET /health}. Any other path under the root context is a 404.
 */
public class HealthCheckHandler extends JsonHttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(HealthCheckHandler.class);
    private final DatabaseService databaseService;

    public HealthCheckHandler(DatabaseService databaseService) {
        this.databaseService = databaseService;
    }

    @Override
    protected void handleRequest(HttpExchange httpExchange) throws IOException {
        String requestPath = httpExchange.getRequestURI().getPath();
        if (!"/".equals(requestPath) && !"/health".equals(requestPath) && !"/health/".equals(requestPath)) {
            sendNotFound(httpExchange);
            return;
        }
        if (!"GET".equalsIgnoreCase(httpExchange.getRequestMethod())) {
            sendMethodNotAllowed(httpExchange, "GET");
            return;
        }

        ObjectNode healthNode = objectMapper.createObjectNode();
        healthNode.put("status", "healthy");
        healthNode.put("service", SqlProxyServer.SERVICE_NAME);
        try {
            healthNode.put("database", databaseService.getDatabaseProductName());
        } catch (SQLException e) {
            logger.warn("Health check could not reach the database: {}", e.getMessage());
            healthNode.put("database", "unavailable");
        }

        ObjectNode poolNode = healthNode.putObject("pool");
        poolNode.put("active", databaseService.getActiveConnections());
        poolNode.put("idle", databaseService.getIdleConnections());
        poolNode.put("total", databaseService.getTotalConnections());
        poolNode.put("waiting", databaseService.getThreadsAwaitingConnection());

        sendJson(httpExchange, 200, healthNode);
    }
}
