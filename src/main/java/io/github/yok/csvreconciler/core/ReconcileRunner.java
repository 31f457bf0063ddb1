package io.github.yok.csvreconciler.core;

import io.github.yok.csvreconciler.config.PathsConfig;
import io.github.yok.csvreconciler.db.ConnectionFactory;
import io.github.yok.csvreconciler.schema.TableDescriptor;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Runs one reconciliation batch over every configured entity.
 *
 * <p>
 * For each entity, in declaration order:
 * </p>
 * <ol>
 * <li>Loads the CSV extract with {@link TabularLoader}. An empty dataset is recorded as
 * {@code No data found in CSV file.} and the entity is skipped.</li>
 * <li>Validates the whole dataset with {@link SchemaValidator#validateDataset}. The outcome is
 * only reported; processing continues either way.</li>
 * <li>For every row: archives it, then validates it and upserts it when valid.</li>
 * </ol>
 *
 * <p>
 * After all entities the {@link ErrorLedger} is flushed exactly once through a fresh connection. A
 * flush failure propagates; every other failure has already been recorded and does not stop the
 * batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ReconcileRunner {

    private final PathsConfig pathsConfig;

    private final List<TableDescriptor> descriptors;

    private final TabularLoader loader;

    private final SchemaValidator validator;

    private final DualWriteReconciler reconciler;

    private final ConnectionFactory connectionFactory;

    private final ErrorLedger ledger;

    /**
     * Creates a runner.
     *
     * @param pathsConfig resolves entity files inside the data directory
     * @param descriptors entity descriptors in processing order
     * @param loader CSV loader
     * @param validator schema validator
     * @param reconciler raw/canonical writer
     * @param connectionFactory source of the connection used to flush the ledger
     * @param ledger error ledger of this run
     */
    public ReconcileRunner(PathsConfig pathsConfig, List<TableDescriptor> descriptors,
            TabularLoader loader, SchemaValidator validator, DualWriteReconciler reconciler,
            ConnectionFactory connectionFactory, ErrorLedger ledger) {
        this.pathsConfig = pathsConfig;
        this.descriptors = descriptors;
        this.loader = loader;
        this.validator = validator;
        this.reconciler = reconciler;
        this.connectionFactory = connectionFactory;
        this.ledger = ledger;
    }

    /**
     * Runs the batch.
     *
     * @param targetEntities entities to process; empty means all configured entities
     * @return counters of the run
     * @throws SQLException if the error ledger cannot be persisted
     */
    public RunSummary execute(List<String> targetEntities) throws SQLException {
        List<TableDescriptor> selected = select(targetEntities);
        log.info("=== ReconcileRunner started (entities={}) ===",
                selected.stream().map(TableDescriptor::getName).collect(Collectors.toList()));

        RunSummary summary = new RunSummary();
        for (TableDescriptor descriptor : selected) {
            processEntity(descriptor, summary.start(descriptor.getName()));
        }

        summary.setErrorCount(ledger.size());
        try (Connection conn = connectionFactory.open()) {
            ledger.flush(conn);
        }

        log.info("=== ReconcileRunner finished ===");
        logSummary(summary);
        return summary;
    }

    private void processEntity(TableDescriptor descriptor, EntitySummary counters) {
        String entity = descriptor.getName();
        Path file = pathsConfig.resolveSource(descriptor.getFile());
        ITable dataset = loader.load(entity, file, ledger);

        List<SourceRow> rows;
        try {
            rows = SourceRow.listOf(dataset);
        } catch (DataSetException e) {
            ledger.add(entity, "Error reading CSV file: " + file + ". Error: " + e.getMessage());
            counters.markSkipped();
            return;
        }
        if (rows.isEmpty()) {
            ledger.add(entity, "No data found in CSV file.");
            counters.markSkipped();
            log.info("[{}] No data → skipping", entity);
            return;
        }
        counters.setLoaded(rows.size());

        if (!validator.validateDataset(dataset, descriptor, ledger)) {
            log.warn("[{}] Schema validation failed; continuing with row-level checks", entity);
        }

        for (SourceRow row : rows) {
            counters.recordArchive(reconciler.archive(row, descriptor, ledger));
            if (validator.validateRow(row, descriptor, ledger)) {
                counters.recordUpsert(reconciler.upsert(row, descriptor, ledger));
            } else {
                counters.recordRejected();
            }
        }
        log.info("[{}] Processed rows={} | archived={}, upserted={}, rejected={}", entity,
                rows.size(), counters.getArchived(), counters.getUpserted(),
                counters.getRejected());
    }

    private List<TableDescriptor> select(List<String> targetEntities) {
        if (targetEntities == null || targetEntities.isEmpty()) {
            return descriptors;
        }
        Set<String> targets = targetEntities.stream().map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        Set<String> known = descriptors.stream().map(TableDescriptor::getName)
                .collect(Collectors.toSet());
        for (String target : targets) {
            if (!known.contains(target)) {
                log.warn("Unknown target entity: {} → ignored", target);
            }
        }
        List<TableDescriptor> selected = new ArrayList<>();
        for (TableDescriptor descriptor : descriptors) {
            if (targets.contains(descriptor.getName())) {
                selected.add(descriptor);
            } else {
                log.info("[{}] Not targeted → skipping", descriptor.getName());
            }
        }
        return selected;
    }

    private void logSummary(RunSummary summary) {
        log.info("===== Summary =====");
        int maxNameLen = summary.getEntities().keySet().stream().mapToInt(String::length).max()
                .orElse(0);
        String fmt = "  Entity[%-" + Math.max(maxNameLen, 1) + "s] loaded=%d archived=%d"
                + " archiveFailed=%d valid=%d upserted=%d upsertFailed=%d rejected=%d%s";
        for (EntitySummary s : summary.getEntities().values()) {
            log.info(String.format(fmt, s.getEntity(), s.getLoaded(), s.getArchived(),
                    s.getArchiveFailed(), s.getValid(), s.getUpserted(), s.getUpsertFailed(),
                    s.getRejected(), s.isSkipped() ? " (skipped)" : ""));
        }
        log.info("  Errors recorded={}", summary.getErrorCount());
        log.info("== Reconciliation of all entities has completed ==");
    }
}
