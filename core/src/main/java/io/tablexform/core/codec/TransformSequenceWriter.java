package io.tablexform.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tablexform.core.model.Aggregate;
import io.tablexform.core.model.Aggregation;
import io.tablexform.core.model.ColumnConversion;
import io.tablexform.core.model.Condition;
import io.tablexform.core.model.FilterRows;
import io.tablexform.core.model.GroupBy;
import io.tablexform.core.model.RenameColumn;
import io.tablexform.core.model.SampleRows;
import io.tablexform.core.model.SelectColumns;
import io.tablexform.core.model.ShuffleRows;
import io.tablexform.core.model.SortColumn;
import io.tablexform.core.model.Transform;
import io.tablexform.core.model.TransformSequence;
import java.io.UncheckedIOException;

/**
 * Writes transform sequences in their canonical JSON wire form: a top-level array, canonical
 * field names, and every optional field spelled out. The output parses back to an equal
 * sequence with {@link TransformSequenceParser}.
 */
public final class TransformSequenceWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public String write(TransformSequence sequence) {
        try {
            return MAPPER.writeValueAsString(toTree(sequence));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize transform sequence", e);
        }
    }

    public ArrayNode toTree(TransformSequence sequence) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Transform transform : sequence.transforms()) {
            array.add(toTree(transform));
        }
        return array;
    }

    public ObjectNode toTree(Transform transform) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", transform.type().wireName());
        switch (transform.type()) {
            case COLUMN_CONVERSION -> {
                ColumnConversion t = (ColumnConversion) transform;
                node.put("column", t.column());
                node.put("target_type", t.targetType().wireName());
                node.put("error_policy", t.errorPolicy().wireName());
            }
            case RENAME_COLUMN -> {
                RenameColumn t = (RenameColumn) transform;
                node.put("column", t.column());
                node.put("new_name", t.newName());
            }
            case SORT_COLUMN -> {
                SortColumn t = (SortColumn) transform;
                node.put("column", t.column());
                node.put("ascending", t.ascending());
                node.put("null_position", t.nullPosition().wireName());
            }
            case FILTER_ROWS -> {
                FilterRows t = (FilterRows) transform;
                ArrayNode conditions = node.putArray("conditions");
                for (Condition condition : t.conditions()) {
                    ObjectNode c = conditions.addObject();
                    c.put("column_id", condition.column());
                    c.put("operator", condition.operator().wireName());
                    JsonNode operand = condition.operand();
                    if (operand != null) {
                        c.set("value", operand);
                    }
                }
                node.put("operation", t.operation().wireName());
            }
            case GROUP_BY -> {
                GroupBy t = (GroupBy) transform;
                ArrayNode columns = node.putArray("group_columns");
                t.groupColumns().forEach(columns::add);
                node.put("aggregation", t.aggregation().wireName());
                node.put("drop_null_groups", t.dropNullGroups());
            }
            case AGGREGATE -> {
                Aggregate t = (Aggregate) transform;
                ArrayNode columns = node.putArray("columns");
                t.columns().forEach(columns::add);
                ArrayNode functions = node.putArray("functions");
                for (Aggregation function : t.functions()) {
                    functions.add(function.wireName());
                }
            }
            case SELECT_COLUMNS -> {
                SelectColumns t = (SelectColumns) transform;
                ArrayNode columns = node.putArray("columns");
                t.columns().forEach(columns::add);
            }
            case SHUFFLE_ROWS -> {
                ShuffleRows t = (ShuffleRows) transform;
                if (t.seed() != null) {
                    node.put("seed", t.seed());
                }
            }
            case SAMPLE_ROWS -> {
                SampleRows t = (SampleRows) transform;
                node.put("count", t.count());
                if (t.seed() != null) {
                    node.put("seed", t.seed());
                }
                node.put("with_replacement", t.withReplacement());
            }
        }
        return node;
    }
}
