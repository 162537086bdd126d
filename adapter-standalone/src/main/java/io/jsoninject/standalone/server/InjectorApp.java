package io.jsoninject.standalone.server;

import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import io.jsoninject.core.engine.JsonInjector;
import io.jsoninject.core.source.SourceAdapters;
import io.jsoninject.core.spi.QueryExecutor;
import io.jsoninject.standalone.config.ConfigLoader;
import io.jsoninject.standalone.config.ServerConfig;
import io.jsoninject.standalone.jdbc.DataSourceFactory;
import io.jsoninject.standalone.jdbc.JdbcQueryExecutor;
import io.jsoninject.standalone.page.PageDefinition;
import io.jsoninject.standalone.page.PageLoader;
import io.jsoninject.standalone.page.PageRenderer;
import io.jsoninject.standalone.procedure.ProcedureRegistry;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone page server.
 *
 * <ol>
 *   <li>Load configuration from YAML plus the environment overlay
 *   <li>Open the connection pool, when a datasource is configured
 *   <li>Discover procedures and build the injector
 *   <li>Load and validate all pages
 *   <li>Start Javalin with the page and health routes
 * </ol>
 *
 * <p>Kept apart from {@link io.jsoninject.standalone.StandaloneMain} so tests can start and stop a
 * server without going through {@code main()}.
 */
public final class InjectorApp {

    private static final Logger LOG = LoggerFactory.getLogger(InjectorApp.class);

    /** Used when no datasource is configured: query sources fail at render time. */
    static final QueryExecutor NO_DATASOURCE = (sql, binds) -> {
        throw new SQLException("No datasource configured; set datasource.url or DB_URL");
    };

    private final Javalin app;
    private final HikariDataSource dataSource;
    private final Map<String, PageDefinition> pages;
    private final InjectionCounters counters;
    private final ServerConfig config;

    private InjectorApp(
            Javalin app,
            HikariDataSource dataSource,
            Map<String, PageDefinition> pages,
            InjectionCounters counters,
            ServerConfig config) {
        this.app = app;
        this.dataSource = dataSource;
        this.pages = pages;
        this.counters = counters;
        this.config = config;
    }

    /**
     * Resolves and loads the configuration file named by {@code args}, configures logging, then
     * starts the server.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/json-inject.yaml})
     */
    public static InjectorApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /**
     * Starts the server from an already loaded configuration. Logging is left as it is.
     *
     * @return a running application
     */
    public static InjectorApp start(ServerConfig config) {
        long startTime = System.nanoTime();

        HikariDataSource dataSource = null;
        QueryExecutor queries = NO_DATASOURCE;
        if (config.dataSource().configured()) {
            dataSource = DataSourceFactory.create(config.dataSource());
            queries = new JdbcQueryExecutor(dataSource);
            LOG.info("Datasource configured: {}", config.dataSource());
        } else {
            LOG.info("No datasource configured; sql and jsonsql injections will fail");
        }

        try {
            ProcedureRegistry procedures =
                    ProcedureRegistry.discover(queries, Thread.currentThread().getContextClassLoader());
            InjectionCounters counters = new InjectionCounters();
            JsonInjector injector = new JsonInjector(
                    SourceAdapters.defaults(queries, procedures, config.injection()), config.injection(), counters);

            Map<String, PageDefinition> pages = new PageLoader(injector).loadAll(Path.of(config.pagesDir()));

            Javalin app = Javalin.create();
            if (config.healthEnabled()) {
                app.get(config.healthPath(), new HealthHandler(pages.size(), counters));
            }
            app.get("/pages/{id}", new PageHandler(pages, new PageRenderer(injector), config.cspNonce()));
            app.start(config.host(), config.port());

            long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
            LOG.info(
                    "json-inject started: port={}, pages={}, procedures={}, datasource={}, chunkSize={}, startupMs={}",
                    app.port(),
                    pages.size(),
                    procedures.names().size(),
                    config.dataSource().configured(),
                    config.injection().chunkSize(),
                    elapsedMs);
            return new InjectorApp(app, dataSource, pages, counters, config);
        } catch (RuntimeException e) {
            if (dataSource != null) {
                dataSource.close();
            }
            throw e;
        }
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    /** Loaded pages by id. */
    public Map<String, PageDefinition> pages() {
        return pages;
    }

    public InjectionCounters counters() {
        return counters;
    }

    public ServerConfig config() {
        return config;
    }

    /** Stops Javalin, then closes the connection pool. */
    public void stop() {
        app.stop();
        if (dataSource != null) {
            dataSource.close();
        }
        LOG.info("json-inject stopped");
    }
}
