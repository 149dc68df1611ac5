package com.skanga.sqlproxy;

import com.skanga.sqlproxy.config.CliUtils;
import com.skanga.sqlproxy.config.ConfigParams;
import com.skanga.sqlproxy.config.ResourceManager;
import com.skanga.sqlproxy.db.DatabaseService;
import com.skanga.sqlproxy.http.ApiHttpHandler;
import com.skanga.sqlproxy.http.HealthCheckHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP server exposing the read-only database gateway.
 * Serves the table listing, table schema and query endpoints under {@code /api/} and a
 * health check on {@code /} and {@code /health}.
 */
public class SqlProxyServer {
    public static final String SERVICE_NAME = "sql-query-proxy";
    public static final int DEFAULT_HTTP_THREADS = 16;

    private static final Logger logger = LoggerFactory.getLogger(SqlProxyServer.class);
    private static final int STOP_DELAY_SECONDS = 2;

    private final DatabaseService databaseService;
    private volatile boolean shutdown;

    /**
     * Creates a server with a new database service for the given configuration.
     *
     * @param configParams Gateway configuration
     * @throws IllegalStateException if the database cannot be reached
     */
    public SqlProxyServer(ConfigParams configParams) {
        this(new DatabaseService(configParams));
    }

    /**
     * Creates a server around an existing database service.
     * Useful for testing or when you want to manage the database service externally.
     *
     * @param databaseService Pre-configured database service
     */
    public SqlProxyServer(DatabaseService databaseService) {
        this.databaseService = databaseService;
    }

    public DatabaseService getDatabaseService() {
        return databaseService;
    }

    /**
     * Starts the HTTP server with the default number of worker threads.
     *
     * @see #startHttpMode(String, int, int)
     */
    public void startHttpMode(String bindAddress, int listenPort) throws IOException {
        startHttpMode(bindAddress, listenPort, DEFAULT_HTTP_THREADS);
    }

    /**
     * Starts the server on the specified address and port.
     * Blocks the calling thread until it is interrupted, then stops the server.
     *
     * @param bindAddress The address to bind to (e.g., "localhost", "0.0.0.0")
     * @param listenPort  The port number to listen on
     * @param httpThreads Number of threads serving requests concurrently
     * @throws IOException if the server cannot be started (e.g., port already in use)
     */
    public void startHttpMode(String bindAddress, int listenPort, int httpThreads) throws IOException {
        logger.info("Starting {} on {}:{} with {} worker threads...", CliUtils.SERVER_NAME, bindAddress, listenPort,
                httpThreads);

        HttpServer httpServer = null;
        ExecutorService requestExecutor = null;
        try {
            InetSocketAddress socketAddress = new InetSocketAddress(bindAddress, listenPort);
            httpServer = HttpServer.create(socketAddress, 0);
            httpServer.createContext("/api/", new ApiHttpHandler(databaseService));
            httpServer.createContext("/", new HealthCheckHandler(databaseService));
            requestExecutor = Executors.newFixedThreadPool(httpThreads, new WorkerThreadFactory());
            httpServer.setExecutor(requestExecutor);

            httpServer.start();

            logger.info("{} started on {}:{}", CliUtils.SERVER_NAME, bindAddress, listenPort);
            logger.info("Tables endpoint: http://{}:{}/api/tables", bindAddress, listenPort);
            logger.info("Health check: http://{}:{}/health", bindAddress, listenPort);

            // Keep the calling thread alive until interrupted
            try {
                Thread.currentThread().join();
            } catch (InterruptedException e) {
                logger.info("Server interrupted, shutting down...");
                Thread.currentThread().interrupt();
            }
        } catch (BindException e) {
            logger.error(ResourceManager.getErrorMessage("http.server.port.inuse", listenPort));
            throw new IOException(ResourceManager.getErrorMessage("http.server.port.inuse", listenPort), e);
        } catch (IOException e) {
            logger.error(ResourceManager.getErrorMessage("http.server.generic.error", listenPort, e.getMessage()));
            throw new IOException(ResourceManager.getErrorMessage("http.server.generic.error", listenPort,
                    e.getMessage()), e);
        } finally {
            if (httpServer != null) {
                httpServer.stop(STOP_DELAY_SECONDS);
                logger.info("HTTP server stopped");
            }
            if (requestExecutor != null) {
                requestExecutor.shutdown();
                try {
                    if (!requestExecutor.awaitTermination(STOP_DELAY_SECONDS, TimeUnit.SECONDS)) {
                        requestExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    requestExecutor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Releases the database pool. This method is idempotent and safe to call multiple times.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down {}...", CliUtils.SERVER_NAME);
        if (databaseService != null) {
            databaseService.close();
        }
        logger.info("{} shutdown complete", CliUtils.SERVER_NAME);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger threadCount = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread workerThread = new Thread(runnable, "sqlproxy-http-" + threadCount.incrementAndGet());
            workerThread.setDaemon(true);
            return workerThread;
        }
    }

    /**
     * Main entry point. Loads configuration, connects to the database and serves HTTP until stopped.
     * Exit codes: 0 after help or version, 1 for startup failures, 2 for configuration errors,
     * 3 for unexpected errors.
     *
     * @param args Command line arguments for configuration
     */
    public static void main(String[] args) {
        if (CliUtils.handleHelpAndVersion(args)) {
            System.exit(0);
        }
        try {
            ConfigParams configParams = CliUtils.loadConfiguration(args);
            String bindAddress = CliUtils.getBindAddress(args);
            int httpPort = CliUtils.getHttpPort(args);
            int httpThreads = CliUtils.getHttpThreads(args);
            logger.info("Loaded configuration: {}", configParams);

            SqlProxyServer proxyServer = new SqlProxyServer(configParams);
            Runtime.getRuntime().addShutdownHook(new Thread(proxyServer::shutdown, "sqlproxy-shutdown"));

            proxyServer.startHttpMode(bindAddress, httpPort, httpThreads);
        } catch (IllegalArgumentException e) {
            logger.error("Configuration error: {}", e.getMessage());
            System.exit(2);
        } catch (IOException e) {
            if (e.getMessage() != null && e.getMessage().contains("configuration file")) {
                logger.error("Configuration error: {}", e.getMessage());
                System.exit(2);
            }
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (IllegalStateException e) {
            logger.error("Failed to start server: {}", e.getMessage(), e);
            System.exit(1);
        } catch (Exception e) {
            logger.error("Unexpected error during startup", e);
            System.exit(3);
        }
    }
}
