package io.ledgersync.storage;

import java.util.List;

import static io.ledgersync.storage.ColumnDef.bool;
import static io.ledgersync.storage.ColumnDef.integer;
import static io.ledgersync.storage.ColumnDef.real;
import static io.ledgersync.storage.ColumnDef.text;

/**
 * Datasets this replica understands. A change record naming anything else is rejected.
 */
public enum LedgerEntity implements EntityType {
    TRANSACTIONS("transactions", List.of(
            bool("isParent"),
            bool("isChild"),
            text("acct"),
            text("category"),
            integer("amount"),
            text("description"),
            text("notes"),
            integer("date"),
            text("financial_id"),
            text("type"),
            text("location"),
            text("error"),
            text("imported_description"),
            bool("starting_balance_flag"),
            text("transferred_id"),
            real("sort_order"),
            bool("tombstone"),
            bool("cleared"),
            bool("pending"),
            text("parent_id"),
            text("schedule"),
            bool("reconciled")
    )),
    ACCOUNTS("accounts", List.of(
            text("account_id"),
            text("name"),
            integer("balance_current"),
            integer("balance_available"),
            integer("balance_limit"),
            text("mask"),
            text("official_name"),
            text("subtype"),
            text("bank"),
            bool("offbudget"),
            bool("closed"),
            bool("tombstone"),
            real("sort_order"),
            text("type"),
            text("account_sync_source"),
            text("last_sync"),
            text("last_reconciled")
    )),
    PAYEES("payees", List.of(
            text("name"),
            text("transfer_acct"),
            text("category"),
            bool("tombstone"),
            bool("favorite"),
            bool("learn_categories")
    )),
    PAYEE_MAPPING("payee_mapping", List.of(
            text("targetId")
    )),
    CATEGORIES("categories", List.of(
            text("name"),
            bool("is_income"),
            text("cat_group"),
            real("sort_order"),
            bool("tombstone"),
            bool("hidden"),
            text("goal_def")
    )),
    CATEGORY_GROUPS("category_groups", List.of(
            text("name"),
            bool("is_income"),
            real("sort_order"),
            bool("tombstone"),
            bool("hidden")
    )),
    CATEGORY_MAPPING("category_mapping", List.of(
            text("transferId")
    )),
    BANKS("banks", List.of(
            text("bank_id"),
            text("name"),
            bool("tombstone")
    )),
    NOTES("notes", List.of(
            text("note")
    ));

    private final String dataset;
    private final List<ColumnDef> columns;

    LedgerEntity(String dataset, List<ColumnDef> columns) {
        this.dataset = dataset;
        this.columns = columns;
    }

    @Override
    public String dataset() {
        return dataset;
    }

    @Override
    public List<ColumnDef> columns() {
        return columns;
    }
}
