package io.tablexform.core.model;

import java.util.Objects;

/**
 * Renames one column, keeping its position.
 *
 * @param column  current name
 * @param newName name after the transform
 */
public record RenameColumn(String column, String newName) implements Transform {

    public RenameColumn {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(newName, "newName must not be null");
        if (newName.isEmpty()) {
            throw new IllegalArgumentException("newName must not be empty");
        }
    }

    @Override
    public TransformType type() {
        return TransformType.RENAME_COLUMN;
    }
}
