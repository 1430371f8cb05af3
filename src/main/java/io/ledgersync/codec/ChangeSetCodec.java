package io.ledgersync.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.Variant;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary (CBOR) encoding of a change set. Every value carries an explicit kind tag so integers,
 * doubles and strings survive the round trip unchanged.
 */
public final class ChangeSetCodec {
    public static final String SCHEMA = "ledgersync.changeset.v1";

    private final CBORFactory factory;
    private final ObjectMapper mapper;

    public ChangeSetCodec() {
        this.factory = new CBORFactory();
        this.mapper = new ObjectMapper(factory);
    }

    public byte[] encode(List<ChangeRecord> records) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator gen = factory.createGenerator(out)) {
            gen.writeStartObject();
            gen.writeStringField("schema", SCHEMA);
            gen.writeArrayFieldStart("records");
            for (ChangeRecord record : records) {
                gen.writeStartObject();
                gen.writeStringField("d", record.dataset());
                gen.writeStringField("r", record.row());
                gen.writeStringField("c", record.column());
                gen.writeStringField("t", record.timestamp().toString());
                writeValue(gen, record.value());
                gen.writeEndObject();
            }
            gen.writeEndArray();
            gen.writeEndObject();
        } catch (IOException e) {
            throw new CodecException("Failed to encode change set", e);
        }
        return out.toByteArray();
    }

    /**
     * Decodes a whole change set or fails; never returns a partial list.
     */
    public List<ChangeRecord> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new CodecException("Empty change set payload");
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new CodecException("Malformed change set payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new CodecException("Change set payload is not an object");
        }
        String schema = root.path("schema").asText("");
        if (!SCHEMA.equals(schema)) {
            throw new CodecException("Unsupported change set schema: " + schema);
        }
        JsonNode records = root.path("records");
        if (!records.isArray()) {
            throw new CodecException("Change set payload missing records");
        }
        List<ChangeRecord> out = new ArrayList<>(records.size());
        for (JsonNode node : records) {
            out.add(readRecord(node));
        }
        return out;
    }

    private void writeValue(JsonGenerator gen, Variant value) throws IOException {
        gen.writeStringField("k", kindTag(value.kind()));
        gen.writeFieldName("v");
        switch (value.kind()) {
            case NULL -> gen.writeNull();
            case BOOLEAN -> gen.writeBoolean((Boolean) value.value());
            case INTEGER -> gen.writeNumber((Long) value.value());
            case REAL -> gen.writeNumber((Double) value.value());
            case STRING -> gen.writeString((String) value.value());
        }
    }

    private ChangeRecord readRecord(JsonNode node) {
        try {
            String dataset = requiredText(node, "d");
            String row = requiredText(node, "r");
            String column = requiredText(node, "c");
            LogicalTimestamp timestamp = LogicalTimestamp.parse(requiredText(node, "t"));
            Variant value = readValue(node.path("k").asText(""), node.path("v"));
            return new ChangeRecord(dataset, row, column, value, timestamp);
        } catch (IllegalArgumentException e) {
            throw new CodecException("Malformed change record: " + e.getMessage(), e);
        }
    }

    private Variant readValue(String tag, JsonNode v) {
        return switch (tag) {
            case "0" -> Variant.ofNull();
            case "B" -> {
                if (!v.isBoolean()) {
                    throw new IllegalArgumentException("expected boolean value");
                }
                yield Variant.of(v.booleanValue());
            }
            case "I" -> {
                if (!v.isIntegralNumber() || !v.canConvertToLong()) {
                    throw new IllegalArgumentException("expected 64-bit integer value");
                }
                yield Variant.of(v.longValue());
            }
            case "R" -> {
                if (!v.isNumber()) {
                    throw new IllegalArgumentException("expected real value");
                }
                yield Variant.of(v.doubleValue());
            }
            case "S" -> {
                if (!v.isTextual()) {
                    throw new IllegalArgumentException("expected string value");
                }
                yield Variant.of(v.textValue());
            }
            default -> throw new IllegalArgumentException("unknown value kind tag '" + tag + "'");
        };
    }

    private static String kindTag(Variant.Kind kind) {
        return switch (kind) {
            case NULL -> "0";
            case BOOLEAN -> "B";
            case INTEGER -> "I";
            case REAL -> "R";
            case STRING -> "S";
        };
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.textValue().isBlank()) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value.textValue();
    }
}
