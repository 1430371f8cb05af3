package io.ledgersync.model;

public record CellKey(String dataset, String row, String column) {
}
