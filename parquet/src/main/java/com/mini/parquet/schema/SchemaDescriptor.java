package com.mini.parquet.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mini.parquet.format.ColumnField;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema 描述
 * 字段名到 {@link FieldDescriptor} 的有序映射，顺序与文件中的字段顺序一致
 */
public class SchemaDescriptor {

    private final Map<String, FieldDescriptor> fields;

    public SchemaDescriptor(List<FieldDescriptor> fields) {
        Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
        for (FieldDescriptor field : fields) {
            byName.put(field.getName(), field);
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static SchemaDescriptor fromJson(LinkedHashMap<String, FieldDescriptor> fields) {
        return new SchemaDescriptor(new ArrayList<>(fields.values()));
    }

    public static SchemaDescriptor of(List<ColumnField> columns) {
        List<FieldDescriptor> fields = new ArrayList<>(columns.size());
        for (ColumnField column : columns) {
            fields.add(FieldDescriptor.of(column));
        }
        return new SchemaDescriptor(fields);
    }

    @JsonValue
    public Map<String, FieldDescriptor> asMap() {
        return fields;
    }

    @Nullable
    public FieldDescriptor getField(String name) {
        return fields.get(name);
    }

    public List<String> fieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return new ArrayList<>(fields.values())
                .equals(new ArrayList<>(((SchemaDescriptor) o).fields.values()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(fields.values()).hashCode();
    }

    @Override
    public String toString() {
        return "SchemaDescriptor" + fields.values();
    }
}
