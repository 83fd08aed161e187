package com.mini.parquet.schema;

import com.mini.parquet.exception.FileAccessException;
import com.mini.parquet.format.parquet.ParquetColumnarFileOpener;
import com.mini.parquet.testutils.ParquetFixtures;
import com.mini.parquet.utils.SerializationUtils;
import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SchemaInspector 测试
 */
public class SchemaInspectorTest {

    @TempDir
    Path tempDir;

    private SchemaInspector inspector;

    @BeforeEach
    public void setup() {
        inspector = new SchemaInspector(new ParquetColumnarFileOpener(new Configuration()));
    }

    @Test
    public void testUsersSchema() throws IOException {
        String path = ParquetFixtures.writeUsers(tempDir).toString();

        SchemaDescriptor schema = inspector.getSchema(path);

        assertEquals(6, schema.size());
        assertEquals(Arrays.asList("id", "name", "active", "score", "age", "metadata"), schema.fieldNames());

        assertEquals(new FieldDescriptor("id", "INT64", false, false, "none"), schema.getField("id"));
        assertEquals(new FieldDescriptor("name", "BINARY", false, false, "STRING"), schema.getField("name"));
        assertEquals("BOOLEAN", schema.getField("active").getTypeName());
        assertEquals("DOUBLE", schema.getField("score").getTypeName());

        FieldDescriptor age = schema.getField("age");
        assertEquals("INT32", age.getTypeName());
        assertTrue(age.isOptional());
        assertFalse(age.isRepeated());
        assertEquals(FieldDescriptor.NO_LOGICAL_TYPE, age.getLogicalType());

        assertTrue(schema.getField("metadata").isOptional());
        assertNull(schema.getField("missing"));
    }

    @Test
    public void testSchemaAsWeakMap() throws IOException {
        String path = ParquetFixtures.writeUsers(tempDir).toString();

        Map<String, Object> map = SerializationUtils.toMap(inspector.getSchema(path));

        assertEquals(Arrays.asList("id", "name", "active", "score", "age", "metadata"),
                Arrays.asList(map.keySet().toArray()));
        @SuppressWarnings("unchecked")
        Map<String, Object> name = (Map<String, Object>) map.get("name");
        assertEquals("BINARY", name.get("type"));
        assertEquals(false, name.get("optional"));
        assertEquals(false, name.get("repeated"));
        assertEquals("STRING", name.get("logical"));
    }

    @Test
    public void testSchemaJsonRoundTrip() throws IOException {
        SchemaDescriptor schema = inspector.getSchema(ParquetFixtures.writeUsers(tempDir).toString());

        String json = SerializationUtils.toJson(schema);
        SchemaDescriptor restored = SerializationUtils.fromJson(json, SchemaDescriptor.class);

        assertEquals(schema, restored);
        assertEquals(schema.fieldNames(), restored.fieldNames());
    }

    @Test
    public void testMissingFile() {
        String path = tempDir.resolve("nope.parquet").toString();
        FileAccessException e = assertThrows(FileAccessException.class, () -> inspector.getSchema(path));
        assertEquals(path, e.getPath());
    }
}
