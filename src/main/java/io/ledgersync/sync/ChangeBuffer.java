package io.ledgersync.sync;

import io.ledgersync.clock.TimestampIssuer;
import io.ledgersync.model.CellKey;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.Variant;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending edits of one ledger session. A repeated write to the same cell replaces the value and
 * keeps the cell's first position.
 */
public final class ChangeBuffer {
    private final Map<CellKey, Variant> pending = new LinkedHashMap<>();

    public void record(String dataset, String row, String column, Variant value) {
        pending.put(new CellKey(dataset, row, column), value == null ? Variant.ofNull() : value);
    }

    /**
     * Stamps every pending edit in recorded order and empties the buffer.
     */
    public List<ChangeRecord> flush(TimestampIssuer issuer) {
        List<ChangeRecord> out = new ArrayList<>(pending.size());
        for (Map.Entry<CellKey, Variant> e : pending.entrySet()) {
            CellKey cell = e.getKey();
            out.add(new ChangeRecord(cell.dataset(), cell.row(), cell.column(), e.getValue(), issuer.issue()));
        }
        pending.clear();
        return out;
    }

    public void discard() {
        pending.clear();
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
