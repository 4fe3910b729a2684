package de.elomagic.ddlexport;

import de.elomagic.ddlexport.exporter.CancellationToken;
import de.elomagic.ddlexport.exporter.ExportOptions;
import de.elomagic.ddlexport.exporter.ExportOrchestrator;
import de.elomagic.ddlexport.exporter.ExportSummary;
import de.elomagic.ddlexport.exporter.LoggingExportListener;
import de.elomagic.ddlexport.exporter.OracleSessionFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command line entry point.
 * <p>
 * Usage: <code>java -jar ddl-export.jar [config.properties]</code>
 */
public class App {

    private static final Logger LOGGER = LogManager.getLogger(App.class);

    private static final long SHUTDOWN_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(30);

    private final CancellationToken cancellationToken = new CancellationToken();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean();

    public static void main( String[] args ) {
        App app = new App();
        ExitStatus status;
        try {
            loadProperties(args.length > 0 ? Paths.get(args[0]) : null);
            status = app.start();
        } catch (Exception e) {
            LOGGER.error(e.getMessage(), e);
            status = ExitStatus.FAILED;
        }

        LogManager.shutdown();

        // When the JVM is already shutting down, System.exit would block until our own shutdown hook returns
        if (!app.shutdownRequested.get()) {
            System.exit(status.getCode());
        }
    }

    /**
     * Loads the settings into the system properties. Properties set with <code>-D</code> take precedence over the
     * configuration files.
     */
    static void loadProperties(Path configFile) throws IOException {
        Properties properties = new Properties();
        properties.putAll(readDefaults());

        Path devFile = Paths.get("application-dev.properties");
        if (Files.exists(devFile)) {
            readFile(devFile, properties);
        }

        if (configFile != null) {
            readFile(configFile, properties);
        }

        properties.stringPropertyNames()
                .stream()
                .filter(key -> System.getProperty(key) == null)
                .forEach(key -> System.setProperty(key, properties.getProperty(key)));
    }

    private static Properties readDefaults() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = App.class.getResourceAsStream("/application.properties")) {
            if (in != null) {
                properties.load(in);
            }
        }
        return properties;
    }

    private static void readFile(@NotNull Path file, @NotNull Properties properties) throws IOException {
        LOGGER.info("Reading configuration file '{}'", file.toAbsolutePath());
        try (Reader reader = Files.newBufferedReader(file)) {
            properties.load(reader);
        }
    }

    @NotNull
    ExitStatus start() {
        ExportOrchestrator orchestrator = new ExportOrchestrator(
                new OracleSessionFactory(Configuration.getList(Configuration.EXPORT_SCHEMAS)),
                ExportOptions.fromConfiguration(),
                Clock.systemDefaultZone(),
                cancellationToken,
                new LoggingExportListener());

        Thread hook = createShutdownHook(Thread.currentThread());
        Runtime.getRuntime().addShutdownHook(hook);

        ExportSummary summary;
        try {
            summary = orchestrator.run();
        } finally {
            removeShutdownHook(hook);
        }

        return summary.getStatus();
    }

    /**
     * Ctrl+C cancels the running export and waits until the export thread has released the connection.
     */
    @NotNull
    private Thread createShutdownHook(@NotNull Thread exportThread) {
        return new Thread(() -> {
            shutdownRequested.set(true);
            if (cancellationToken.cancel()) {
                LOGGER.warn("Cancellation requested. Waiting for the export to stop");
            }
            try {
                exportThread.join(SHUTDOWN_TIMEOUT_MILLIS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "ddl-export-shutdown");
    }

    private void removeShutdownHook(@NotNull Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM is shutting down, shutdown hook stays registered");
        }
    }

}
