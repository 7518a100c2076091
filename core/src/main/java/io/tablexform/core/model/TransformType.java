package io.tablexform.core.model;

/**
 * The closed set of transform kinds, each with its wire discriminator and the record class
 * that models it.
 */
public enum TransformType {
    COLUMN_CONVERSION("column_conversion", ColumnConversion.class),
    RENAME_COLUMN("rename_column", RenameColumn.class),
    SORT_COLUMN("sort_column", SortColumn.class),
    FILTER_ROWS("filter_rows", FilterRows.class),
    GROUP_BY("group_by", GroupBy.class),
    AGGREGATE("aggregate", Aggregate.class),
    SELECT_COLUMNS("select_columns", SelectColumns.class),
    SHUFFLE_ROWS("shuffle_rows", ShuffleRows.class),
    SAMPLE_ROWS("sample_rows", SampleRows.class);

    private final String wireName;
    private final Class<? extends Transform> modelClass;

    TransformType(String wireName, Class<? extends Transform> modelClass) {
        this.wireName = wireName;
        this.modelClass = modelClass;
    }

    /** Value of the {@code type} discriminator on the wire. */
    public String wireName() {
        return wireName;
    }

    /** Record class carrying this kind's parameters. */
    public Class<? extends Transform> modelClass() {
        return modelClass;
    }

    /**
     * Looks up a kind by its wire discriminator.
     *
     * @throws IllegalArgumentException if no kind has that discriminator
     */
    public static TransformType fromWireName(String name) {
        for (TransformType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transform type: '" + name + "'");
    }
}
