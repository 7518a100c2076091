package io.tablexform.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.tablexform.core.error.TransformParseException;
import io.tablexform.core.model.Aggregate;
import io.tablexform.core.model.Aggregation;
import io.tablexform.core.model.ColumnConversion;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.Condition;
import io.tablexform.core.model.ConditionOperator;
import io.tablexform.core.model.FilterRows;
import io.tablexform.core.model.GroupBy;
import io.tablexform.core.model.RenameColumn;
import io.tablexform.core.model.SampleRows;
import io.tablexform.core.model.SelectColumns;
import io.tablexform.core.model.ShuffleRows;
import io.tablexform.core.model.SortColumn;
import io.tablexform.core.model.Transform;
import io.tablexform.core.model.TransformSequence;
import io.tablexform.core.model.TransformType;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Parses transform sequences from their JSON or YAML wire form.
 *
 * <p>
 * The document is either an array of transforms or an object with a single {@code transforms}
 * array. Each transform is an object with a {@code type} discriminator and snake_case fields.
 * Field names emitted by the browser widget ({@code column_id}, {@code data_type},
 * {@code na_position}, ...) are accepted as aliases of the canonical names; giving both an alias
 * and its canonical name is an error. Unknown keys are rejected.
 *
 * <p>
 * Every failure is a {@link TransformParseException} carrying the index of the offending
 * element. Thread-safe.
 */
public final class TransformSequenceParser {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final String TYPE = "type";
    private static final String INLINE_SOURCE = "<inline>";

    /** Canonical field names per transform kind, excluding {@code type}. */
    private static final Map<TransformType, Set<String>> KNOWN_KEYS = new EnumMap<>(TransformType.class);

    /** Widget field names mapped to their canonical names, per transform kind. */
    private static final Map<TransformType, Map<String, String>> FIELD_ALIASES = new EnumMap<>(TransformType.class);

    private static final Set<String> KNOWN_CONDITION_KEYS = Set.of("column_id", "operator", "value");
    private static final Map<String, String> CONDITION_ALIASES = Map.of("column", "column_id");

    static {
        KNOWN_KEYS.put(TransformType.COLUMN_CONVERSION, Set.of("column", "target_type", "error_policy"));
        KNOWN_KEYS.put(TransformType.RENAME_COLUMN, Set.of("column", "new_name"));
        KNOWN_KEYS.put(TransformType.SORT_COLUMN, Set.of("column", "ascending", "null_position"));
        KNOWN_KEYS.put(TransformType.FILTER_ROWS, Set.of("conditions", "operation"));
        KNOWN_KEYS.put(TransformType.GROUP_BY, Set.of("group_columns", "aggregation", "drop_null_groups"));
        KNOWN_KEYS.put(TransformType.AGGREGATE, Set.of("columns", "functions"));
        KNOWN_KEYS.put(TransformType.SELECT_COLUMNS, Set.of("columns"));
        KNOWN_KEYS.put(TransformType.SHUFFLE_ROWS, Set.of("seed"));
        KNOWN_KEYS.put(TransformType.SAMPLE_ROWS, Set.of("count", "seed", "with_replacement"));

        FIELD_ALIASES.put(
                TransformType.COLUMN_CONVERSION,
                Map.of("column_id", "column", "data_type", "target_type", "errors", "error_policy"));
        FIELD_ALIASES.put(TransformType.RENAME_COLUMN, Map.of("column_id", "column", "new_column_id", "new_name"));
        FIELD_ALIASES.put(TransformType.SORT_COLUMN, Map.of("column_id", "column", "na_position", "null_position"));
        FIELD_ALIASES.put(TransformType.FILTER_ROWS, Map.of("where", "conditions"));
        FIELD_ALIASES.put(
                TransformType.GROUP_BY, Map.of("column_ids", "group_columns", "drop_na", "drop_null_groups"));
        FIELD_ALIASES.put(TransformType.AGGREGATE, Map.of("column_ids", "columns", "aggregations", "functions"));
        FIELD_ALIASES.put(TransformType.SELECT_COLUMNS, Map.of("column_ids", "columns"));
        FIELD_ALIASES.put(TransformType.SHUFFLE_ROWS, Map.of());
        FIELD_ALIASES.put(TransformType.SAMPLE_ROWS, Map.of("n", "count", "replace", "with_replacement"));
    }

    /** Parses a JSON document held in memory. */
    public TransformSequence parse(String json) {
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TransformParseException("Failed to parse JSON: " + e.getOriginalMessage(), e, INLINE_SOURCE, null);
        }
        return parse(root, INLINE_SOURCE);
    }

    /** Parses a {@code .json}, {@code .yaml} or {@code .yml} file. */
    public TransformSequence parse(Path path) {
        String source = path.toString();
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper;
        if (name.endsWith(".json")) {
            mapper = JSON_MAPPER;
        } else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            mapper = YAML_MAPPER;
        } else {
            throw new TransformParseException(
                    "Unsupported sequence file extension (expected .json, .yaml or .yml)", source, null);
        }
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new TransformParseException("Failed to read or parse " + source + ": " + e.getMessage(), e, source, null);
        }
        return parse(root, source);
    }

    /** Parses an already decoded tree. */
    public TransformSequence parse(JsonNode root) {
        return parse(root, INLINE_SOURCE);
    }

    private TransformSequence parse(JsonNode root, String source) {
        JsonNode elements = root;
        if (root != null && root.isObject()) {
            rejectUnknownKeys(root, Set.of("transforms"), "document root", source, null);
            elements = root.get("transforms");
        }
        if (elements == null || !elements.isArray()) {
            throw new TransformParseException(
                    "Expected an array of transforms or an object with a 'transforms' array", source, null);
        }
        List<Transform> transforms = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            transforms.add(parseTransform(elements.get(i), source, i));
        }
        return new TransformSequence(transforms);
    }

    private Transform parseTransform(JsonNode element, String source, int index) {
        if (element == null || !element.isObject()) {
            throw new TransformParseException("Transform must be an object", source, index);
        }
        JsonNode typeNode = element.get(TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new TransformParseException("Missing or invalid required field: '" + TYPE + "'", source, index);
        }
        TransformType type;
        try {
            type = TransformType.fromWireName(typeNode.asText());
        } catch (IllegalArgumentException e) {
            throw new TransformParseException(e.getMessage(), e, source, index);
        }

        ObjectNode fields = canonicalize((ObjectNode) element, FIELD_ALIASES.get(type), type.wireName(), source, index);
        fields.remove(TYPE);
        rejectUnknownKeys(fields, KNOWN_KEYS.get(type), type.wireName(), source, index);

        try {
            return switch (type) {
                case COLUMN_CONVERSION -> new ColumnConversion(
                        requireString(fields, "column", source, index),
                        requireEnum(fields, "target_type", ColumnType::fromWireName, source, index),
                        optionalEnum(
                                fields,
                                "error_policy",
                                ColumnConversion.ErrorPolicy::fromWireName,
                                ColumnConversion.ErrorPolicy.RAISE,
                                source,
                                index));
                case RENAME_COLUMN -> new RenameColumn(
                        requireString(fields, "column", source, index),
                        requireString(fields, "new_name", source, index));
                case SORT_COLUMN -> new SortColumn(
                        requireString(fields, "column", source, index),
                        optionalBoolean(fields, "ascending", true, source, index),
                        optionalEnum(
                                fields,
                                "null_position",
                                SortColumn.NullPosition::fromWireName,
                                SortColumn.NullPosition.LAST,
                                source,
                                index));
                case FILTER_ROWS -> new FilterRows(
                        parseConditions(fields, source, index),
                        optionalEnum(
                                fields,
                                "operation",
                                FilterRows.Operation::fromWireName,
                                FilterRows.Operation.KEEP,
                                source,
                                index));
                case GROUP_BY -> new GroupBy(
                        requireStringList(fields, "group_columns", source, index),
                        requireEnum(fields, "aggregation", Aggregation::fromWireName, source, index),
                        optionalBoolean(fields, "drop_null_groups", true, source, index));
                case AGGREGATE -> new Aggregate(
                        requireStringList(fields, "columns", source, index),
                        requireEnumList(fields, "functions", Aggregation::fromWireName, source, index));
                case SELECT_COLUMNS -> new SelectColumns(requireStringList(fields, "columns", source, index));
                case SHUFFLE_ROWS -> new ShuffleRows(optionalLong(fields, "seed", source, index));
                case SAMPLE_ROWS -> new SampleRows(
                        requireInt(fields, "count", source, index),
                        optionalLong(fields, "seed", source, index),
                        optionalBoolean(fields, "with_replacement", false, source, index));
            };
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new TransformParseException(
                    "Invalid " + type.wireName() + " transform: " + e.getMessage(), e, source, index);
        }
    }

    private List<Condition> parseConditions(ObjectNode fields, String source, int index) {
        JsonNode node = fields.get("conditions");
        if (node == null || !node.isArray()) {
            throw new TransformParseException("Missing or invalid required field: 'conditions'", source, index);
        }
        List<Condition> conditions = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw new TransformParseException("Each condition must be an object", source, index);
            }
            ObjectNode condition = canonicalize((ObjectNode) element, CONDITION_ALIASES, "condition", source, index);
            rejectUnknownKeys(condition, KNOWN_CONDITION_KEYS, "condition", source, index);
            conditions.add(new Condition(
                    requireString(condition, "column_id", source, index),
                    requireEnum(condition, "operator", ConditionOperator::fromWireName, source, index),
                    condition.get("value")));
        }
        return conditions;
    }

    /** Copy of {@code node} with alias keys renamed to their canonical names. */
    private static ObjectNode canonicalize(
            ObjectNode node, Map<String, String> aliases, String blockName, String source, int index) {
        ObjectNode canonical = JSON_MAPPER.createObjectNode();
        for (Map.Entry<String, JsonNode> field : node.properties()) {
            String key = aliases.getOrDefault(field.getKey(), field.getKey());
            if (canonical.has(key)) {
                throw new TransformParseException(
                        "Field '" + key + "' given more than once in '" + blockName + "' (alias '" + field.getKey()
                                + "')",
                        source,
                        index);
            }
            canonical.set(key, field.getValue());
        }
        return canonical;
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String source, Integer index) {
        Set<String> unknown = new LinkedHashSet<>();
        node.fieldNames().forEachRemaining(key -> {
            if (!knownKeys.contains(key)) {
                unknown.add(key);
            }
        });
        if (!unknown.isEmpty()) {
            throw new TransformParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + knownKeys,
                    source,
                    index);
        }
    }

    private static String requireString(JsonNode node, String field, String source, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new TransformParseException("Missing or invalid required field: '" + field + "'", source, index);
        }
        return value.asText();
    }

    private static List<String> requireStringList(JsonNode node, String field, String source, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new TransformParseException(
                    "Missing or invalid required field: '" + field + "' (expected an array of strings)", source, index);
        }
        List<String> result = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new TransformParseException(
                        "Field '" + field + "' must contain only strings, got: " + item, source, index);
            }
            result.add(item.asText());
        }
        return result;
    }

    private static <E> E requireEnum(
            JsonNode node, String field, Function<String, E> lookup, String source, int index) {
        return parseEnum(requireString(node, field, source, index), lookup, source, index);
    }

    private static <E> E optionalEnum(
            JsonNode node, String field, Function<String, E> lookup, E defaultValue, String source, int index) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return requireEnum(node, field, lookup, source, index);
    }

    private static <E> List<E> requireEnumList(
            JsonNode node, String field, Function<String, E> lookup, String source, int index) {
        List<E> result = new ArrayList<>();
        for (String name : requireStringList(node, field, source, index)) {
            result.add(parseEnum(name, lookup, source, index));
        }
        return result;
    }

    private static <E> E parseEnum(String name, Function<String, E> lookup, String source, int index) {
        try {
            return lookup.apply(name);
        } catch (IllegalArgumentException e) {
            throw new TransformParseException(e.getMessage(), e, source, index);
        }
    }

    private static boolean optionalBoolean(
            JsonNode node, String field, boolean defaultValue, String source, int index) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new TransformParseException("Field '" + field + "' must be a boolean, got: " + value, source, index);
        }
        return value.booleanValue();
    }

    private static int requireInt(JsonNode node, String field, String source, int index) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new TransformParseException("Missing or invalid required field: '" + field + "'", source, index);
        }
        return value.intValue();
    }

    private static Long optionalLong(JsonNode node, String field, String source, int index) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new TransformParseException("Field '" + field + "' must be an integer, got: " + value, source, index);
        }
        return value.longValue();
    }
}
