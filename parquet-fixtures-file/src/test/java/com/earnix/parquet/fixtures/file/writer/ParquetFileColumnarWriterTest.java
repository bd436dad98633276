package com.earnix.parquet.fixtures.file.writer;

import com.earnix.parquet.fixtures.batch.ColumnDefinition;
import com.earnix.parquet.fixtures.batch.ColumnType;
import com.earnix.parquet.fixtures.batch.ColumnValues;
import com.earnix.parquet.fixtures.batch.FixtureSchema;
import com.earnix.parquet.fixtures.batch.RowBatch;
import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import com.earnix.parquet.fixtures.file.reader.ParquetColumnarFileReader;
import com.earnix.parquet.fixtures.writer.ParquetColumnarWriter;
import com.earnix.parquet.fixtures.writer.ParquetFileInfo;
import com.earnix.parquet.fixtures.writer.ParquetWriterUtils;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.KeyValue;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Types;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertThrows;

public class ParquetFileColumnarWriterTest
{
	private static final FixtureSchema SCHEMA = FixtureSchema.of(//
			ColumnDefinition.of("id", ColumnType.INT32),//
			ColumnDefinition.of("name", ColumnType.STRING),//
			ColumnDefinition.of("age", ColumnType.INT32));

	private static final RowBatch ROWS = RowBatch.of(SCHEMA,//
			ColumnValues.ofInts(1, 2, 3, 4, 5),//
			ColumnValues.ofStrings("Alice", "Bob", "Charlie", "Diana", "Eve"),//
			ColumnValues.ofInts(25, 30, 35, 28, 32));

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path write(String fileName, RowBatch rows, ParquetWriteConfig config) throws IOException
	{
		Path file = folder.getRoot().toPath().resolve(fileName);
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, rows.getSchema(),
				config))
		{
			writer.writeRowBatch(rows);
			ParquetFileInfo info = writer.finishAndWriteFooterMetadata();
			Assert.assertEquals(Files.size(file), info.getTotalParquetFileSize());
			Assert.assertEquals(rows.getSchema().toMessageType(), info.getMessageType());
			Assert.assertEquals(info.getFileMetaData().getNum_rows(), rows.getNumRows());
			Assert.assertTrue(info.getFooterMetadataOffset() < info.getTotalParquetFileSize() - 8);
		}
		return file;
	}

	@Test
	public void testRoundTripAllCodecsAndVersions() throws IOException
	{
		for (ParquetProperties.WriterVersion version : ParquetProperties.WriterVersion.values())
		{
			for (CompressionCodec codec : Arrays.asList(CompressionCodec.UNCOMPRESSED, CompressionCodec.SNAPPY,
					CompressionCodec.ZSTD))
			{
				ParquetWriteConfig config = new ParquetWriteConfig(
						ParquetProperties.builder().withWriterVersion(version).build(), codec);
				Path file = write(version + "_" + codec + ".parquet", ROWS, config);

				ParquetColumnarFileReader reader = new ParquetColumnarFileReader(file);
				Assert.assertEquals(SCHEMA, reader.getSchema());
				Assert.assertEquals(1, reader.getNumRowGroups());
				Assert.assertEquals(5L, reader.getTotalNumRows());
				Assert.assertEquals(ROWS, reader.readAll());

				int expectedVersion = version == ParquetProperties.WriterVersion.PARQUET_2_0 ? 2 : 1;
				Assert.assertEquals(expectedVersion, reader.readMetaData().getVersion());
				for (ColumnChunk chunk : reader.readMetaData().getRow_groups().get(0).getColumns())
					Assert.assertEquals(codec, chunk.getMeta_data().getCodec());
			}
		}
	}

	@Test
	public void testFooter() throws IOException
	{
		Path file = write("footer.parquet", ROWS, new ParquetWriteConfig());
		ParquetColumnarFileReader reader = new ParquetColumnarFileReader(file);
		FileMetaData metaData = reader.readMetaData();
		Assert.assertEquals(ParquetWriterUtils.CREATED_BY, metaData.getCreated_by());
		Assert.assertEquals(1, metaData.getVersion());
		Assert.assertEquals(FixtureSchema.ROOT_NAME, metaData.getSchema().get(0).getName());
		Assert.assertEquals(3, metaData.getSchema().get(0).getNum_children());
		Assert.assertFalse(metaData.isSetKey_value_metadata());

		MessageType messageType = reader.getMessageType();
		Assert.assertEquals(SCHEMA.toMessageType(), messageType);
		Assert.assertEquals(LogicalTypeAnnotation.stringType(),
				messageType.getType("name").getLogicalTypeAnnotation());

		long offset = 4;
		for (ColumnChunk chunk : metaData.getRow_groups().get(0).getColumns())
		{
			Assert.assertEquals(offset, chunk.getFile_offset());
			Assert.assertEquals(chunk.getMeta_data().isSetDictionary_page_offset(),
					chunk.getMeta_data().getData_page_offset() > offset);
			offset += chunk.getMeta_data().getTotal_compressed_size();
		}
	}

	@Test
	public void testRowGroupLimitSplitsBatch() throws IOException
	{
		ParquetWriteConfig config = new ParquetWriteConfig(ParquetProperties.builder().build(),
				CompressionCodec.UNCOMPRESSED, ParquetWriteConfig.DEFAULT_ZSTD_COMPRESSION_LEVEL, 2);
		Path file = write("split.parquet", ROWS, config);

		ParquetColumnarFileReader reader = new ParquetColumnarFileReader(file);
		Assert.assertEquals(3, reader.getNumRowGroups());
		Assert.assertEquals(2L, reader.getNumRowsInRowGroup(0));
		Assert.assertEquals(2L, reader.getNumRowsInRowGroup(1));
		Assert.assertEquals(1L, reader.getNumRowsInRowGroup(2));
		Assert.assertEquals(5L, reader.getTotalNumRows());

		List<RowBatch> rowGroups = reader.readRowGroups();
		Assert.assertEquals(ROWS.slice(2, 4), rowGroups.get(1));
		Assert.assertEquals(ROWS, reader.readAll());
	}

	@Test
	public void testKeyValueMetadata() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("kv.parquet");
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, SCHEMA,
				new ParquetWriteConfig()))
		{
			KeyValue keyValue = new KeyValue("fixture");
			keyValue.setValue("simple");
			writer.addKeyValue(keyValue);
			writer.writeRowBatch(ROWS);
			writer.finishAndWriteFooterMetadata();
		}
		FileMetaData metaData = new ParquetColumnarFileReader(file).readMetaData();
		Assert.assertEquals("simple", metaData.getKey_value_metadata().get(0).getValue());
	}

	@Test
	public void testExistingFileIsTruncated() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("truncate.parquet");
		Files.write(file, new byte[100_000]);
		write("truncate.parquet", ROWS, new ParquetWriteConfig());
		Path fresh = write("fresh.parquet", ROWS, new ParquetWriteConfig());
		Assert.assertArrayEquals(Files.readAllBytes(fresh), Files.readAllBytes(file));
	}

	@Test
	public void testMissingColumnRejected() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("missing.parquet");
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, SCHEMA,
				new ParquetWriteConfig()))
		{
			ColumnDescriptor id = SCHEMA.toMessageType().getColumns().get(0);
			assertThrows(IllegalStateException.class, () -> writer.writeRowGroup(1,
					rowGroupWriter -> rowGroupWriter.writeValues(w -> w.writeColumn(id, new int[] { 1 }))));
		}
	}

	@Test
	public void testDuplicateColumnRejected() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("duplicate.parquet");
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, SCHEMA,
				new ParquetWriteConfig()))
		{
			ColumnDescriptor id = SCHEMA.toMessageType().getColumns().get(0);
			writer.startNewRowGroup(1);
			writer.getCurrentRowGroupWriter().writeValues(w -> w.writeColumn(id, new int[] { 1 }));
			assertThrows(IllegalStateException.class,
					() -> writer.getCurrentRowGroupWriter().writeValues(w -> w.writeColumn(id, new int[] { 2 })));
		}
	}

	@Test
	public void testWrongRowCountRejected() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("rows.parquet");
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, SCHEMA,
				new ParquetWriteConfig()))
		{
			ColumnDescriptor id = SCHEMA.toMessageType().getColumns().get(0);
			writer.startNewRowGroup(2);
			assertThrows(IllegalStateException.class,
					() -> writer.getCurrentRowGroupWriter().writeValues(w -> w.writeColumn(id, new int[] { 1 })));
		}
	}

	@Test
	public void testColumnWithWrongTypeRejected() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("type.parquet");
		ColumnDescriptor longId = new ColumnDescriptor(new String[] { "id" },
				Types.required(PrimitiveType.PrimitiveTypeName.INT64).named("id"), 0, 0);
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, SCHEMA,
				new ParquetWriteConfig()))
		{
			writer.startNewRowGroup(1);
			assertThrows(IllegalStateException.class,
					() -> writer.getCurrentRowGroupWriter().writeValues(w -> w.writeColumn(longId, new long[] { 1L })));
		}
	}

	@Test
	public void testFooterWithoutRowGroupsRejected() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("empty.parquet");
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, SCHEMA,
				new ParquetWriteConfig()))
		{
			assertThrows(IllegalStateException.class, writer::finishAndWriteFooterMetadata);
			assertThrows(IllegalStateException.class, writer::finishRowGroup);
		}
	}

	@Test
	public void testFooterWrittenOnce() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("once.parquet");
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, SCHEMA,
				new ParquetWriteConfig()))
		{
			writer.writeRowBatch(ROWS);
			writer.finishAndWriteFooterMetadata();
			assertThrows(IllegalStateException.class, writer::finishAndWriteFooterMetadata);
			assertThrows(IllegalStateException.class, () -> writer.writeRowBatch(ROWS));
		}
	}

	@Test
	public void testUnsupportedSchemasRejected()
	{
		MessageType optional = Types.buildMessage().optional(PrimitiveType.PrimitiveTypeName.INT32).named("a")
				.named("schema");
		MessageType nested = Types.buildMessage().requiredGroup().required(PrimitiveType.PrimitiveTypeName.INT32)
				.named("inner").named("outer").named("schema");
		for (MessageType messageType : Arrays.asList(optional, nested))
		{
			Path file = folder.getRoot().toPath().resolve("unsupported.parquet");
			assertThrows(IllegalArgumentException.class,
					() -> ParquetFileColumnarWriterFactory.createWriter(file, messageType, new ParquetWriteConfig()));
		}
	}

	@Test
	public void testBatchWithOtherSchemaRejected() throws IOException
	{
		Path file = folder.getRoot().toPath().resolve("other.parquet");
		FixtureSchema other = FixtureSchema.of(ColumnDefinition.of("value", ColumnType.INT32));
		try (ParquetColumnarWriter writer = ParquetFileColumnarWriterFactory.createWriter(file, SCHEMA,
				new ParquetWriteConfig()))
		{
			assertThrows(IllegalArgumentException.class,
					() -> writer.writeRowBatch(RowBatch.of(other, ColumnValues.ofInts(42))));
		}
	}
}
