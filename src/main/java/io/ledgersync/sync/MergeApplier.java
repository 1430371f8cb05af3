package io.ledgersync.sync;

import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.model.CellKey;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.storage.LedgerStore;
import io.ledgersync.storage.LedgerTransaction;
import io.ledgersync.storage.MetadataStore;
import io.ledgersync.storage.UnsupportedSchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies remote change records last-writer-wins. A record only lands when its timestamp is newer
 * than the cell clock of its cell, so applying the same records again changes nothing.
 */
public final class MergeApplier {
    private static final Logger LOG = LoggerFactory.getLogger(MergeApplier.class);

    private final LedgerStore store;
    private final MetadataStore metadata;

    public MergeApplier(LedgerStore store, MetadataStore metadata) {
        this.store = store;
        this.metadata = metadata;
    }

    /**
     * Writes {@code records} through {@code tx}. Nothing is written when any record names an
     * unknown dataset or column. {@code prefs} values are returned in the summary, not written.
     */
    public ApplySummary apply(LedgerTransaction tx, List<ChangeRecord> records) {
        if (records == null || records.isEmpty()) {
            return ApplySummary.empty();
        }
        validate(records);

        int applied = 0;
        int skipped = 0;
        int groups = 0;
        Map<String, Object> preferences = new LinkedHashMap<>();
        String groupDataset = null;
        String groupRow = null;
        Map<String, Object> groupValues = new LinkedHashMap<>();

        for (ChangeRecord record : records) {
            if (!isNewer(tx, record)) {
                skipped++;
                continue;
            }
            tx.recordCellTimestamp(record.cell(), record.timestamp());
            applied++;
            if (record.isPreference()) {
                preferences.put(record.row(), record.value().value());
                continue;
            }
            if (!record.dataset().equals(groupDataset) || !record.row().equals(groupRow)) {
                if (!groupValues.isEmpty()) {
                    tx.update(groupDataset, groupRow, groupValues);
                    groups++;
                }
                groupDataset = record.dataset();
                groupRow = record.row();
                groupValues = new LinkedHashMap<>();
            }
            groupValues.put(record.column(), record.value());
        }
        if (!groupValues.isEmpty()) {
            tx.update(groupDataset, groupRow, groupValues);
            groups++;
        }
        LOG.debug("Merged {} records into {} row updates ({} stale, {} prefs)",
                applied, groups, skipped, preferences.size());
        return new ApplySummary(applied, skipped, groups, preferences.size(), preferences);
    }

    /**
     * Publishes the {@code prefs} values of a batch to the metadata store. Runs before the batch
     * commits; a failed patch rolls the batch back and a later redelivery patches again.
     */
    public void publishPreferences(ApplySummary summary) {
        if (summary == null || summary.preferences().isEmpty()) {
            return;
        }
        metadata.patch(summary.preferences());
    }

    private void validate(List<ChangeRecord> records) {
        for (ChangeRecord record : records) {
            if (record.isPreference()) {
                continue;
            }
            if (store.resolveDataset(record.dataset()).isEmpty()) {
                throw new UnsupportedSchemaException("Unknown dataset in change record: " + record.dataset());
            }
            if (store.resolveColumn(record.dataset(), record.column()).isEmpty()) {
                throw new UnsupportedSchemaException(
                        "Unknown column in change record: " + record.dataset() + "." + record.column());
            }
        }
    }

    private static boolean isNewer(LedgerTransaction tx, ChangeRecord record) {
        CellKey cell = record.cell();
        Optional<LogicalTimestamp> current = tx.cellTimestamp(cell);
        return current.isEmpty() || record.timestamp().isAfter(current.get());
    }
}
