/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.reader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.ColumnMetaData;
import org.apache.parquet.format.ColumnOrder;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.format.Encoding;
import org.apache.parquet.format.FieldRepetitionType;
import org.apache.parquet.format.MicroSeconds;
import org.apache.parquet.format.RowGroup;
import org.apache.parquet.format.Statistics;
import org.apache.parquet.format.TypeDefinedOrder;
import org.apache.parquet.format.Util;
import org.junit.jupiter.api.Test;

import dev.heartwood.MalformedMetadataException;
import dev.heartwood.MalformedSchemaException;
import dev.heartwood.internal.thrift.CompactProtocolWriter;
import dev.heartwood.internal.thrift.ThriftCompactReader;
import dev.heartwood.metadata.ConvertedType;
import dev.heartwood.metadata.FileMetaData;
import dev.heartwood.metadata.KeyValue;
import dev.heartwood.metadata.LogicalType;
import dev.heartwood.metadata.PhysicalType;
import dev.heartwood.metadata.RepetitionType;
import dev.heartwood.metadata.SchemaElement;
import dev.heartwood.schema.ColumnDescriptor;
import dev.heartwood.schema.FileSchema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Decodes footers serialized by parquet-format's own Thrift writer.
 */
class ParquetMetadataReaderTest {

    @Test
    void decodesFooterWrittenByParquetFormat() throws Exception {
        FileMetaData metaData = ParquetMetadataReader.readFileMetaData(ByteBuffer.wrap(referenceFooter()));

        assertThat(metaData.version()).isEqualTo(2);
        assertThat(metaData.numRows()).isEqualTo(300L);
        assertThat(metaData.rowGroupCount()).isEqualTo(2);
        assertThat(metaData.createdBy()).isEqualTo("parquet-mr version 1.13.1 (build abc)");
        assertThat(metaData.keyValueMetadata()).containsExactly(
                new KeyValue("writer.model.name", "example"),
                new KeyValue("no.value", null));

        assertThat(metaData.schema()).extracting(SchemaElement::name)
                .containsExactly("spark_schema", "id", "name", "ts", "amount", "tags", "list", "element");
    }

    @Test
    void decodesSchemaElementFields() throws Exception {
        List<SchemaElement> schema = ParquetMetadataReader.readFileMetaData(ByteBuffer.wrap(referenceFooter())).schema();

        SchemaElement root = schema.get(0);
        assertThat(root.isGroup()).isTrue();
        assertThat(root.repetitionType()).isNull();
        assertThat(root.numChildren()).isEqualTo(5);

        SchemaElement id = schema.get(1);
        assertThat(id.type()).isEqualTo(PhysicalType.INT64);
        assertThat(id.repetitionType()).isEqualTo(RepetitionType.REQUIRED);
        assertThat(id.logicalType()).isNull();
        assertThat(id.fieldId()).isNull();

        SchemaElement name = schema.get(2);
        assertThat(name.type()).isEqualTo(PhysicalType.BYTE_ARRAY);
        assertThat(name.convertedType()).isEqualTo(ConvertedType.UTF8);
        assertThat(name.logicalType()).isEqualTo(new LogicalType.StringType());

        SchemaElement ts = schema.get(3);
        assertThat(ts.convertedType()).isEqualTo(ConvertedType.TIMESTAMP_MICROS);
        assertThat(ts.logicalType()).isEqualTo(new LogicalType.TimestampType(true, LogicalType.TimeUnit.MICROS));

        SchemaElement amount = schema.get(4);
        assertThat(amount.type()).isEqualTo(PhysicalType.FIXED_LEN_BYTE_ARRAY);
        assertThat(amount.typeLength()).isEqualTo(16);
        assertThat(amount.convertedType()).isEqualTo(ConvertedType.DECIMAL);
        assertThat(amount.scale()).isEqualTo(2);
        assertThat(amount.precision()).isEqualTo(38);
        assertThat(amount.logicalType()).isEqualTo(new LogicalType.DecimalType(2, 38));

        SchemaElement tags = schema.get(5);
        assertThat(tags.convertedType()).isEqualTo(ConvertedType.LIST);
        assertThat(tags.logicalType()).isEqualTo(new LogicalType.ListType());

        SchemaElement element = schema.get(7);
        assertThat(element.type()).isEqualTo(PhysicalType.INT32);
        assertThat(element.convertedType()).isEqualTo(ConvertedType.INT_8);
        assertThat(element.logicalType()).isEqualTo(new LogicalType.IntType(8, true));
        assertThat(element.fieldId()).isEqualTo(7);
    }

    @Test
    void readsSchemaWithLevels() throws Exception {
        FileSchema schema = ParquetMetadataReader.readSchema(ByteBuffer.wrap(referenceFooter()));

        assertThat(schema.getName()).isEqualTo("spark_schema");
        assertThat(schema.getColumns())
                .extracting(ColumnDescriptor::dottedPath, ColumnDescriptor::maxDefinitionLevel, ColumnDescriptor::maxRepetitionLevel)
                .containsExactly(
                        tuple("id", 0, 0),
                        tuple("name", 1, 0),
                        tuple("ts", 1, 0),
                        tuple("amount", 0, 0),
                        tuple("tags.list.element", 3, 1));
        assertThat(schema.getColumn("amount").typeLength()).isEqualTo(16);
        assertThat(schema.isFlatSchema()).isFalse();
    }

    @Test
    void leavesCallerBufferUntouched() throws Exception {
        byte[] footer = referenceFooter();
        byte[] padded = new byte[footer.length + 12];
        System.arraycopy(footer, 0, padded, 4, footer.length);

        ByteBuffer buffer = ByteBuffer.wrap(padded);
        buffer.position(4).limit(4 + footer.length);

        FileMetaData metaData = ParquetMetadataReader.readFileMetaData(buffer);

        assertThat(metaData.numRows()).isEqualTo(300L);
        assertThat(buffer.position()).isEqualTo(4);
        assertThat(buffer.limit()).isEqualTo(4 + footer.length);
    }

    @Test
    void decodesSameBufferConcurrently() throws Exception {
        ByteBuffer shared = ByteBuffer.wrap(referenceFooter());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<FileSchema>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> ParquetMetadataReader.readSchema(shared)));
            }
            for (Future<FileSchema> future : futures) {
                FileSchema schema = future.get();
                assertThat(schema.getColumnCount()).isEqualTo(5);
                assertThat(schema.getColumn(4).maxDefinitionLevel()).isEqualTo(3);
            }
        }
        finally {
            executor.shutdownNow();
        }
        assertThat(shared.position()).isZero();
    }

    @Test
    void rejectsTruncatedFooter() throws Exception {
        byte[] footer = referenceFooter();

        for (int length : new int[]{ 0, 1, footer.length / 3, footer.length / 2, footer.length - 1 }) {
            ByteBuffer truncated = ByteBuffer.wrap(Arrays.copyOf(footer, length));
            assertThatThrownBy(() -> ParquetMetadataReader.readFileMetaData(truncated))
                    .as("footer truncated to %d bytes", length)
                    .isInstanceOf(MalformedMetadataException.class);
        }
    }

    @Test
    void rejectsFooterWithoutSchema() {
        byte[] footer = new CompactProtocolWriter()
                .writeI32Field(1, 1)
                .writeI64Field(3, 10)
                .writeFieldHeader(ThriftCompactReader.TYPE_LIST, 4).writeListHeader(ThriftCompactReader.TYPE_STRUCT, 0)
                .writeStop()
                .toByteArray();

        assertThatThrownBy(() -> ParquetMetadataReader.readFileMetaData(ByteBuffer.wrap(footer)))
                .isInstanceOf(MalformedMetadataException.class)
                .hasMessage("FileMetaData missing required field: schema");
    }

    @Test
    void rejectsFooterWithoutRowGroups() {
        CompactProtocolWriter writer = new CompactProtocolWriter()
                .writeI32Field(1, 1)
                .writeFieldHeader(ThriftCompactReader.TYPE_LIST, 2).writeListHeader(ThriftCompactReader.TYPE_STRUCT, 1);
        writer.beginStruct().writeStringField(4, "root").writeI32Field(5, 0).endStruct();
        byte[] footer = writer.writeI64Field(3, 0).writeStop().toByteArray();

        assertThatThrownBy(() -> ParquetMetadataReader.readFileMetaData(ByteBuffer.wrap(footer)))
                .isInstanceOf(MalformedMetadataException.class)
                .hasMessage("FileMetaData missing required field: row_groups");
    }

    @Test
    void acceptsMinimalFooter() throws Exception {
        CompactProtocolWriter writer = new CompactProtocolWriter()
                .writeI32Field(1, 1)
                .writeFieldHeader(ThriftCompactReader.TYPE_LIST, 2).writeListHeader(ThriftCompactReader.TYPE_STRUCT, 2);
        writer.beginStruct().writeStringField(4, "schema").writeI32Field(5, 1).endStruct();
        writer.beginStruct().writeI32Field(1, 1).writeI32Field(3, 1).writeStringField(4, "x").endStruct();
        writer.writeI64Field(3, 0)
                .writeFieldHeader(ThriftCompactReader.TYPE_LIST, 4).writeListHeader(ThriftCompactReader.TYPE_STRUCT, 0)
                .writeStop();

        FileMetaData metaData = ParquetMetadataReader.readFileMetaData(ByteBuffer.wrap(writer.toByteArray()));

        assertThat(metaData.createdBy()).isNull();
        assertThat(metaData.keyValueMetadata()).isEmpty();
        assertThat(metaData.rowGroupCount()).isZero();

        FileSchema schema = ParquetMetadataReader.readSchema(ByteBuffer.wrap(writer.toByteArray()));
        assertThat(schema.getColumn("x").maxDefinitionLevel()).isEqualTo(1);
        assertThat(schema.isFlatSchema()).isTrue();
    }

    @Test
    void reportsSchemaErrorsSeparately() {
        CompactProtocolWriter writer = new CompactProtocolWriter()
                .writeI32Field(1, 1)
                .writeFieldHeader(ThriftCompactReader.TYPE_LIST, 2).writeListHeader(ThriftCompactReader.TYPE_STRUCT, 1);
        writer.beginStruct().writeStringField(4, "schema").writeI32Field(5, 2).endStruct();
        writer.writeI64Field(3, 0)
                .writeFieldHeader(ThriftCompactReader.TYPE_LIST, 4).writeListHeader(ThriftCompactReader.TYPE_STRUCT, 0)
                .writeStop();

        assertThatThrownBy(() -> ParquetMetadataReader.readSchema(ByteBuffer.wrap(writer.toByteArray())))
                .isInstanceOf(MalformedSchemaException.class)
                .hasMessageContaining("Unexpected end of schema elements");
    }

    private static byte[] referenceFooter() throws IOException {
        List<org.apache.parquet.format.SchemaElement> schema = new ArrayList<>();

        org.apache.parquet.format.SchemaElement root = new org.apache.parquet.format.SchemaElement("spark_schema");
        root.setNum_children(5);
        schema.add(root);

        schema.add(primitive("id", org.apache.parquet.format.Type.INT64, FieldRepetitionType.REQUIRED));

        org.apache.parquet.format.SchemaElement name = primitive("name", org.apache.parquet.format.Type.BYTE_ARRAY, FieldRepetitionType.OPTIONAL);
        name.setConverted_type(org.apache.parquet.format.ConvertedType.UTF8);
        name.setLogicalType(org.apache.parquet.format.LogicalType.STRING(new org.apache.parquet.format.StringType()));
        schema.add(name);

        org.apache.parquet.format.SchemaElement ts = primitive("ts", org.apache.parquet.format.Type.INT64, FieldRepetitionType.OPTIONAL);
        ts.setConverted_type(org.apache.parquet.format.ConvertedType.TIMESTAMP_MICROS);
        ts.setLogicalType(org.apache.parquet.format.LogicalType.TIMESTAMP(
                new org.apache.parquet.format.TimestampType(true, org.apache.parquet.format.TimeUnit.MICROS(new MicroSeconds()))));
        schema.add(ts);

        org.apache.parquet.format.SchemaElement amount = primitive("amount", org.apache.parquet.format.Type.FIXED_LEN_BYTE_ARRAY,
                FieldRepetitionType.REQUIRED);
        amount.setType_length(16);
        amount.setConverted_type(org.apache.parquet.format.ConvertedType.DECIMAL);
        amount.setScale(2);
        amount.setPrecision(38);
        amount.setLogicalType(org.apache.parquet.format.LogicalType.DECIMAL(new org.apache.parquet.format.DecimalType(2, 38)));
        schema.add(amount);

        org.apache.parquet.format.SchemaElement tags = new org.apache.parquet.format.SchemaElement("tags");
        tags.setRepetition_type(FieldRepetitionType.OPTIONAL);
        tags.setNum_children(1);
        tags.setConverted_type(org.apache.parquet.format.ConvertedType.LIST);
        tags.setLogicalType(org.apache.parquet.format.LogicalType.LIST(new org.apache.parquet.format.ListType()));
        schema.add(tags);

        org.apache.parquet.format.SchemaElement list = new org.apache.parquet.format.SchemaElement("list");
        list.setRepetition_type(FieldRepetitionType.REPEATED);
        list.setNum_children(1);
        schema.add(list);

        org.apache.parquet.format.SchemaElement element = primitive("element", org.apache.parquet.format.Type.INT32, FieldRepetitionType.OPTIONAL);
        element.setConverted_type(org.apache.parquet.format.ConvertedType.INT_8);
        element.setLogicalType(org.apache.parquet.format.LogicalType.INTEGER(new org.apache.parquet.format.IntType((byte) 8, true)));
        element.setField_id(7);
        schema.add(element);

        List<RowGroup> rowGroups = List.of(rowGroup(0, 100), rowGroup(4096, 200));

        org.apache.parquet.format.FileMetaData fileMetaData = new org.apache.parquet.format.FileMetaData(2, schema, 300L, rowGroups);
        org.apache.parquet.format.KeyValue model = new org.apache.parquet.format.KeyValue("writer.model.name");
        model.setValue("example");
        fileMetaData.setKey_value_metadata(List.of(model, new org.apache.parquet.format.KeyValue("no.value")));
        fileMetaData.setCreated_by("parquet-mr version 1.13.1 (build abc)");

        List<ColumnOrder> columnOrders = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            columnOrders.add(ColumnOrder.TYPE_ORDER(new TypeDefinedOrder()));
        }
        fileMetaData.setColumn_orders(columnOrders);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Util.writeFileMetaData(fileMetaData, out);
        return out.toByteArray();
    }

    private static org.apache.parquet.format.SchemaElement primitive(String name, org.apache.parquet.format.Type type,
                                                                     FieldRepetitionType repetition) {
        org.apache.parquet.format.SchemaElement element = new org.apache.parquet.format.SchemaElement(name);
        element.setType(type);
        element.setRepetition_type(repetition);
        return element;
    }

    private static RowGroup rowGroup(long offset, long numRows) {
        ColumnMetaData columnMetaData = new ColumnMetaData(
                org.apache.parquet.format.Type.INT64,
                List.of(Encoding.PLAIN, Encoding.RLE),
                List.of("id"),
                CompressionCodec.SNAPPY,
                numRows,
                numRows * 8,
                numRows * 4,
                offset + 4);

        Statistics statistics = new Statistics();
        statistics.setNull_count(0);
        statistics.setMin_value("min".getBytes(StandardCharsets.UTF_8));
        statistics.setMax_value("max".getBytes(StandardCharsets.UTF_8));
        columnMetaData.setStatistics(statistics);

        ColumnChunk chunk = new ColumnChunk(offset);
        chunk.setMeta_data(columnMetaData);

        return new RowGroup(List.of(chunk), numRows * 8, numRows);
    }
}
