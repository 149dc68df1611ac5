package com.skanga.sqlproxy.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.skanga.sqlproxy.config.ResourceManager;
import com.skanga.sqlproxy.db.DatabaseService;
import com.skanga.sqlproxy.db.DatabaseUnavailableException;
import com.skanga.sqlproxy.db.PaginationInfo;
import com.skanga.sqlproxy.db.QueryExecutionException;
import com.skanga.sqlproxy.db.QueryResult;
import com.skanga.sqlproxy.db.QueryValidationException;
import com.skanga.sqlproxy.db.ResultMarshaller;
import com.skanga.sqlproxy.db.TableNotFoundException;
import com.skanga.sqlproxy.db.TablePage;
import com.skanga.sqlproxy.db.TableSchema;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Serves the {@code /api} routes:
 * <ul>
 *   <li>{@code GET /api/tables?page=&page_size=}</li>
 *   <li>{@code GET /api/tables/{table_name}/schema}</li>
 *   <li>{@code POST /api/query} with body {@code {"query": "..."}}</li>
 * </ul>
 */
public class ApiHttpHandler extends JsonHttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiHttpHandler.class);
    private static final Pattern TABLES_PATH = Pattern.compile("^/api/tables/?$");
    private static final Pattern SCHEMA_PATH = Pattern.compile("^/api/tables/([^/]*)/schema/?$");
    private static final Pattern QUERY_PATH = Pattern.compile("^/api/query/?$");
    // Leaves room for JSON escaping around the longest accepted query
    private static final int BODY_OVERHEAD_BYTES = 64 * 1024;
    // Stays below the JVM array size limit after the extra byte read to detect oversize bodies
    private static final int MAX_BODY_BYTES = Integer.MAX_VALUE - 16;

    private final DatabaseService databaseService;
    private final ResultMarshaller resultMarshaller;

    public ApiHttpHandler(DatabaseService databaseService) {
        this.databaseService = databaseService;
        this.resultMarshaller = new ResultMarshaller();
    }

    @Override
    protected void handleRequest(HttpExchange httpExchange) throws IOException {
        String requestMethod = httpExchange.getRequestMethod();
        String requestPath = httpExchange.getRequestURI().getRawPath();

        try {
            if (TABLES_PATH.matcher(requestPath).matches()) {
                if (!"GET".equalsIgnoreCase(requestMethod)) {
                    sendMethodNotAllowed(httpExchange, "GET");
                    return;
                }
                handleListTables(httpExchange);
                return;
            }

            Matcher schemaMatcher = SCHEMA_PATH.matcher(requestPath);
            if (schemaMatcher.matches()) {
                if (!"GET".equalsIgnoreCase(requestMethod)) {
                    sendMethodNotAllowed(httpExchange, "GET");
                    return;
                }
                handleTableSchema(httpExchange, decodePathSegment(schemaMatcher.group(1)));
                return;
            }

            if (QUERY_PATH.matcher(requestPath).matches()) {
                if (!"POST".equalsIgnoreCase(requestMethod)) {
                    sendMethodNotAllowed(httpExchange, "POST");
                    return;
                }
                handleExecuteQuery(httpExchange);
                return;
            }

            sendNotFound(httpExchange);
        } catch (IllegalArgumentException e) {
            logger.debug("Invalid request parameters for {} {}: {}", requestMethod, requestPath, e.getMessage());
            sendError(httpExchange, 422, e.getMessage());
        } catch (QueryValidationException e) {
            sendError(httpExchange, 400, e.getMessage());
        } catch (TableNotFoundException e) {
            sendError(httpExchange, 404, e.getMessage());
        } catch (DatabaseUnavailableException e) {
            logger.warn("Database unavailable while serving {} {}: {}", requestMethod, requestPath,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            sendError(httpExchange, 503, e.getMessage());
        } catch (QueryExecutionException e) {
            sendError(httpExchange, e.isClientError() ? 400 : 500, e.getMessage());
        } catch (SQLException e) {
            logger.error("Database error while serving {} {} (SQLState {})", requestMethod, requestPath,
                    e.getSQLState(), e);
            sendError(httpExchange, 500, ResourceManager.getErrorMessage("query.execution.internal"));
        }
    }

    private void handleListTables(HttpExchange httpExchange) throws IOException, SQLException {
        Map<String, String> queryParams = parseQueryParams(httpExchange.getRequestURI().getRawQuery());
        int page = parseIntParam(queryParams, "page", PaginationInfo.DEFAULT_PAGE);
        int pageSize = parseIntParam(queryParams, "page_size", PaginationInfo.DEFAULT_PAGE_SIZE);

        TablePage tablePage = databaseService.listTables(page, pageSize);
        sendJson(httpExchange, 200, resultMarshaller.toJson(tablePage));
    }

    private void handleTableSchema(HttpExchange httpExchange, String tableName) throws IOException, SQLException {
        if (tableName.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("request.table.name.missing"));
        }
        TableSchema tableSchema = databaseService.getTableSchema(tableName);
        sendJson(httpExchange, 200, resultMarshaller.toJson(tableSchema));
    }

    private void handleExecuteQuery(HttpExchange httpExchange) throws IOException, SQLException {
        String sqlQuery = readQueryField(httpExchange);
        QueryResult queryResult = databaseService.executeQuery(sqlQuery);
        sendJson(httpExchange, 200, resultMarshaller.toJson(queryResult));
    }

    /**
     * Extracts the non-empty string {@code query} field from the JSON request body.
     *
     * @throws IllegalArgumentException if the body is not such an object
     */
    private String readQueryField(HttpExchange httpExchange) throws IOException {
        int maxBodyBytes = (int) Math.min(
                (long) databaseService.getDatabaseConfig().maxSqlLength() * 4 + BODY_OVERHEAD_BYTES,
                MAX_BODY_BYTES);
        byte[] requestBytes;
        try (InputStream requestBody = httpExchange.getRequestBody()) {
            requestBytes = requestBody.readNBytes(maxBodyBytes + 1);
        }
        if (requestBytes.length > maxBodyBytes) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("request.body.invalid"));
        }

        JsonNode requestNode;
        try {
            requestNode = objectMapper.readTree(requestBytes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("request.body.invalid"), e);
        }
        JsonNode queryNode = requestNode == null ? null : requestNode.get("query");
        if (requestNode == null || !requestNode.isObject() || queryNode == null || !queryNode.isTextual()
                || queryNode.asText().isEmpty()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("request.body.invalid"));
        }
        return queryNode.asText();
    }

    // Percent-decoding only; a literal '+' in a path stays a plus sign.
    static String decodePathSegment(String rawSegment) {
        return URLDecoder.decode(rawSegment.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static int parseIntParam(Map<String, String> queryParams, String paramName, int defaultValue) {
        String paramValue = queryParams.get(paramName);
        if (paramValue == null || paramValue.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(paramValue.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("request.parameter.not.integer", paramName), e);
        }
    }
}
