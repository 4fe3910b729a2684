package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.AppRuntimeException;
import de.elomagic.ddlexport.ExitStatus;
import de.elomagic.ddlexport.catalog.EnumerationException;
import de.elomagic.ddlexport.catalog.ObjectEnumerator;
import de.elomagic.ddlexport.dto.ArtifactEntry;
import de.elomagic.ddlexport.dto.ExportResult;
import de.elomagic.ddlexport.dto.ExportRun;
import de.elomagic.ddlexport.dto.ObjectDescriptor;
import de.elomagic.ddlexport.dto.ObjectType;
import de.elomagic.ddlexport.dto.SchemaTarget;
import de.elomagic.ddlexport.metadata.MetadataService;
import de.elomagic.ddlexport.writer.ArtifactWriter;
import de.elomagic.ddlexport.writer.ExportOutputWriter;
import de.elomagic.ddlexport.writer.OutputLayout;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives a single export run.
 * <p>
 * Schemas, object types and objects are processed sequentially in a deterministic order. A failing object is written
 * as error marker and never stops the run. Only a failed connection or a failed schema enumeration fails the run.
 */
public class ExportOrchestrator {

    public enum State {
        IDLE,
        CONNECTED,
        ENUMERATING,
        EXPORTING,
        CLOSED
    }

    private static final Logger LOGGER = LogManager.getLogger(ExportOrchestrator.class);

    private final SessionFactory sessionFactory;
    private final ExportOptions options;
    private final Clock clock;
    private final CancellationToken cancellationToken;
    private final ExportListener listener;

    private State state = State.IDLE;
    private ExportSummary summary;

    public ExportOrchestrator(
            @NotNull SessionFactory sessionFactory,
            @NotNull ExportOptions options,
            @NotNull Clock clock,
            @NotNull CancellationToken cancellationToken,
            @NotNull ExportListener listener) {
        this.sessionFactory = sessionFactory;
        this.options = options;
        this.clock = clock;
        this.cancellationToken = cancellationToken;
        this.listener = listener;
    }

    @NotNull
    public State getState() {
        return state;
    }

    /**
     * Executes the export. Never throws, the outcome is reported by the returned summary.
     *
     * @throws IllegalStateException When called a second time
     */
    @NotNull
    public ExportSummary run() {
        if (state != State.IDLE) {
            throw new IllegalStateException("Export orchestrator can only run once");
        }

        summary = new ExportSummary();
        DatabaseSession session = null;
        try {
            checkCancelled();
            session = sessionFactory.open(options.transformConfig);
            state = State.CONNECTED;

            Instant startTime = clock.instant();
            Path root = OutputLayout.resolveRunDirectory(options.outputBasePath, options.directoryPrefix, startTime, clock.getZone());
            ExportOutputWriter writer = new ExportOutputWriter(new OutputLayout(root), options.encoding, clock);
            writer.createRootDirectory();
            summary.setOutputRoot(root);

            state = State.ENUMERATING;
            List<String> schemas = session.getEnumerator().listSchemas();
            ExportRun run = new ExportRun(root, startTime, schemas, options.objectTypes);
            listener.onRunStarted(run);

            state = State.EXPORTING;
            for (int i = 0; i < run.schemas.size(); i++) {
                checkCancelled();
                exportSchema(session, writer, run, run.schemas.get(i), i + 1);
            }

            summary.setStatus(ExitStatus.SUCCESS);
            LOGGER.info("Export finished with {} failed object(s). Output written to '{}'", summary.getObjectsFailed(), root.toAbsolutePath());
        } catch (ExportCancelledException ex) {
            summary.setStatus(ExitStatus.CANCELLED);
            if (summary.getOutputRoot() == null) {
                LOGGER.warn("Export cancelled by user before any output was written");
            } else {
                LOGGER.warn("Export cancelled by user. Partial output in '{}'", summary.getOutputRoot().toAbsolutePath());
            }
        } catch (ExportConnectionException ex) {
            LOGGER.error("Export aborted, no database connection: {}", ex.getMessage(), ex);
        } catch (EnumerationException ex) {
            LOGGER.error("Export aborted, unable to enumerate schemas: {}", ex.getMessage(), ex);
        } catch (AppRuntimeException ex) {
            LOGGER.error("Export aborted: {}", ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            LOGGER.error("Export aborted by unexpected error: {}", ex.getMessage(), ex);
        } finally {
            closeSession(session);
            state = State.CLOSED;
            notifyRunFinished();
        }

        return summary;
    }

    private void exportSchema(@NotNull DatabaseSession session, @NotNull ExportOutputWriter writer, @NotNull ExportRun run, @NotNull String schema, int index) {
        SchemaTarget target = new SchemaTarget(schema);
        listener.onSchemaStarted(target, index, run.schemas.size());

        for (ObjectType type : run.objectTypes) {
            checkCancelled();
            try {
                target.objects.put(type, session.getEnumerator().listObjects(schema, type));
            } catch (EnumerationException ex) {
                LOGGER.error("Skipping {} objects of schema '{}': {}", type.getLabel(), schema, ex.getMessage(), ex);
                target.failedTypes.add(type);
                summary.incrementTypesFailed();
            }
        }

        try {
            writer.createSchemaDirectory(schema);
            writer.writeSchemaInfo(target, run.objectTypes);
        } catch (AppRuntimeException ex) {
            LOGGER.error("Skipping schema '{}': {}", schema, ex.getMessage(), ex);
            return;
        }

        Set<String> packageBodies = resolvePackageBodies(session.getEnumerator(), target);
        // Body results of the package pass, reused for the package body artifact
        Map<String, ExportResult> packageBodyResults = new HashMap<>();

        for (ObjectType type : run.objectTypes) {
            List<ObjectDescriptor> objects = target.getObjects(type);
            if (!objects.isEmpty()) {
                exportType(session.getMetadataService(), writer, schema, type, objects, packageBodies, packageBodyResults);
            }
        }

        summary.incrementSchemasExported();
    }

    private void exportType(
            @NotNull MetadataService metadataService,
            @NotNull ExportOutputWriter writer,
            @NotNull String schema,
            @NotNull ObjectType type,
            @NotNull List<ObjectDescriptor> objects,
            @Nullable Set<String> packageBodies,
            @NotNull Map<String, ExportResult> packageBodyResults) {
        checkCancelled();
        listener.onTypeStarted(schema, type, objects.size());

        try (ArtifactWriter artifact = writer.openArtifact(schema, type)) {
            for (int i = 0; i < objects.size(); i++) {
                checkCancelled();
                ArtifactEntry entry = exportEntry(metadataService, objects.get(i), packageBodies, packageBodyResults);
                // An interrupted thread closes the file channel, so nothing is written after a cancellation
                checkCancelled();
                artifact.append(entry);
                listener.onObjectExported(entry, i + 1, objects.size());
            }
            summary.incrementArtifactsWritten();
        } catch (IOException | AppRuntimeException ex) {
            summary.incrementArtifactsFailed();
            LOGGER.error("Unable to write {} artifact of schema '{}': {}", type.getLabel(), schema, ex.getMessage(), ex);
        }
    }

    @NotNull
    private ArtifactEntry exportEntry(
            @NotNull MetadataService metadataService,
            @NotNull ObjectDescriptor descriptor,
            @Nullable Set<String> packageBodies,
            @NotNull Map<String, ExportResult> packageBodyResults) {
        if (descriptor.objectType == ObjectType.PACKAGE_BODY && packageBodyResults.containsKey(descriptor.name)) {
            LOGGER.debug("Reusing body of package {}", descriptor);
            return new ArtifactEntry(descriptor, packageBodyResults.get(descriptor.name));
        }

        ExportResult result = exportObject(metadataService, descriptor.objectType, descriptor.name, descriptor.owningSchema);

        if (descriptor.objectType != ObjectType.PACKAGE) {
            return new ArtifactEntry(descriptor, result);
        }

        ExportResult bodyResult;
        if (packageBodies != null && !packageBodies.contains(descriptor.name)) {
            LOGGER.debug("No package body found for {}", descriptor);
            bodyResult = ExportResult.absent();
        } else {
            checkCancelled();
            bodyResult = exportObject(metadataService, ObjectType.PACKAGE_BODY, descriptor.name, descriptor.owningSchema);
            packageBodyResults.put(descriptor.name, bodyResult);
        }

        return new ArtifactEntry(descriptor, result, bodyResult);
    }

    /**
     * Requests the DDL of a single object. Failures are logged and returned, never thrown.
     */
    @NotNull
    private ExportResult exportObject(@NotNull MetadataService metadataService, @NotNull ObjectType type, @NotNull String name, @NotNull String schema) {
        try {
            ExportResult result = ExportResult.success(metadataService.getDdl(type, name, schema));
            summary.incrementObjectsExported();
            return result;
        } catch (ExportCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            summary.incrementObjectsFailed();
            LOGGER.error("Error getting DDL for {} {}.{}: {}", type.getLabel(), schema, name, ex.getMessage());
            return ExportResult.failure(ex.getMessage());
        }
    }

    /**
     * Returns the names of the package bodies of the schema or null when they are unknown. When unknown, the body of
     * every package is requested.
     */
    @Nullable
    private Set<String> resolvePackageBodies(@NotNull ObjectEnumerator enumerator, @NotNull SchemaTarget target) {
        if (target.getObjects(ObjectType.PACKAGE).isEmpty()) {
            return Set.of();
        }

        if (target.objects.containsKey(ObjectType.PACKAGE_BODY)) {
            return toNames(target.getObjects(ObjectType.PACKAGE_BODY));
        }

        if (target.failedTypes.contains(ObjectType.PACKAGE_BODY)) {
            return null;
        }

        // Package bodies not requested as own type
        try {
            return toNames(enumerator.listObjects(target.name, ObjectType.PACKAGE_BODY));
        } catch (EnumerationException ex) {
            LOGGER.warn("Unable to read package bodies of schema '{}': {}", target.name, ex.getMessage());
            return null;
        }
    }

    @NotNull
    private static Set<String> toNames(@NotNull List<ObjectDescriptor> objects) {
        return objects.stream().map(o -> o.name).collect(Collectors.toSet());
    }

    private void checkCancelled() throws ExportCancelledException {
        if (cancellationToken.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new ExportCancelledException();
        }
    }

    private void notifyRunFinished() {
        try {
            listener.onRunFinished(summary);
        } catch (RuntimeException ex) {
            LOGGER.warn("Export listener failed: {}", ex.getMessage(), ex);
        }
    }

    private void closeSession(@Nullable DatabaseSession session) {
        if (session == null) {
            return;
        }

        try {
            session.close();
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to close database session: {}", ex.getMessage(), ex);
        }
    }

}
