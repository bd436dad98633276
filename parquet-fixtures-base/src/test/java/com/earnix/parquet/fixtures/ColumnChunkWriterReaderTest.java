package com.earnix.parquet.fixtures;

import com.earnix.parquet.fixtures.batch.ColumnDefinition;
import com.earnix.parquet.fixtures.batch.ColumnType;
import com.earnix.parquet.fixtures.batch.ColumnValues;
import com.earnix.parquet.fixtures.batch.FixtureSchema;
import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import com.earnix.parquet.fixtures.reader.ParquetReaderUtils;
import com.earnix.parquet.fixtures.reader.chunk.ChunkValuesReader;
import com.earnix.parquet.fixtures.reader.chunk.ColumnValuesChunkReader;
import com.earnix.parquet.fixtures.reader.chunk.internal.ChunkValuesReaderFactory;
import com.earnix.parquet.fixtures.reader.chunk.internal.InMemChunk;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkPages;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkWriter;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkWriterImpl;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.column.statistics.Statistics;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.format.Encoding;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertThrows;

public class ColumnChunkWriterReaderTest
{
	private static final List<CompressionCodec> CODECS = Arrays.asList(CompressionCodec.UNCOMPRESSED,
			CompressionCodec.SNAPPY, CompressionCodec.ZSTD);

	private static final List<ParquetProperties.WriterVersion> VERSIONS = Arrays.asList(
			ParquetProperties.WriterVersion.PARQUET_1_0, ParquetProperties.WriterVersion.PARQUET_2_0);

	private static ColumnDescriptor descriptor(ColumnType type)
	{
		return FixtureSchema.of(ColumnDefinition.of("col", type)).toMessageType().getColumns().get(0);
	}

	private static ParquetWriteConfig config(ParquetProperties.WriterVersion version, CompressionCodec codec)
	{
		return new ParquetWriteConfig(ParquetProperties.builder().withWriterVersion(version).build(), codec);
	}

	private static InMemChunk writeAndRead(ColumnValues values, ParquetWriteConfig config) throws IOException
	{
		ColumnDescriptor descriptor = descriptor(values.getType());
		ColumnChunkWriter writer = new ColumnChunkWriterImpl(config);
		ColumnChunkPages pages = values.writeTo(writer, descriptor);
		Assert.assertEquals(values.size(), pages.getNumValues());

		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		pages.writeToOutputStream(baos);
		Assert.assertEquals(pages.totalBytesForStorage(), baos.size());

		return ParquetReaderUtils.readInMemChunk(descriptor, new ByteArrayInputStream(baos.toByteArray()),
				baos.size(), config.getCompressionCodec());
	}

	@Test
	public void testAllTypesAllCodecs() throws IOException
	{
		List<ColumnValues> columns = Arrays.asList(//
				ColumnValues.ofInts(1, 2, 3, Integer.MIN_VALUE, Integer.MAX_VALUE),//
				ColumnValues.ofLongs(100L, 200L, 300L, Long.MIN_VALUE),//
				ColumnValues.ofFloats(1.1f, 2.2f, 3.3f, -0.0f, Float.MAX_VALUE),//
				ColumnValues.ofDoubles(10.1, 20.2, 30.3, Double.MAX_VALUE),//
				ColumnValues.ofStrings("foo", "bar", "baz", "", "été"),//
				ColumnValues.ofBooleans(true, false, true));

		for (ParquetProperties.WriterVersion version : VERSIONS)
		{
			for (CompressionCodec codec : CODECS)
			{
				for (ColumnValues values : columns)
				{
					InMemChunk chunk = writeAndRead(values, config(version, codec));
					Assert.assertEquals(values.size(), chunk.getTotalValues());
					Assert.assertFalse(chunk.getDataPages().isEmpty());
					Assert.assertEquals(version + " " + codec + " " + values.getType(), values,
							ColumnValuesChunkReader.readValues(chunk));
				}
			}
		}
	}

	@Test
	public void testRepeatedValuesUseDictionary() throws IOException
	{
		int[] vals = new int[1000];
		for (int i = 0; i < vals.length; i++)
			vals[i] = i % 4;

		ColumnValues values = ColumnValues.ofInts(vals);
		ParquetWriteConfig config = config(ParquetProperties.WriterVersion.PARQUET_1_0, CompressionCodec.SNAPPY);
		ColumnChunkPages pages = values.writeTo(new ColumnChunkWriterImpl(config), descriptor(ColumnType.INT32));
		Assert.assertTrue(pages.hasDictionaryPage());
		Assert.assertTrue(pages.getDictionaryPageBytes() > 0);
		Assert.assertTrue(pages.getEncodingSet().contains(Encoding.PLAIN_DICTIONARY));

		InMemChunk chunk = writeAndRead(values, config);
		Assert.assertNotNull(chunk.getDictionaryPage());
		ChunkValuesReader reader = ChunkValuesReaderFactory.createChunkReader(chunk);
		Assert.assertTrue(reader.isDictionaryEncoded());
		Assert.assertEquals(values, ColumnValuesChunkReader.readValues(chunk));
	}

	@Test
	public void testBooleansNeverUseDictionary() throws IOException
	{
		boolean[] vals = new boolean[500];
		for (int i = 0; i < vals.length; i++)
			vals[i] = i % 3 == 0;

		ColumnValues values = ColumnValues.ofBooleans(vals);
		ParquetWriteConfig config = config(ParquetProperties.WriterVersion.PARQUET_1_0, CompressionCodec.UNCOMPRESSED);
		ColumnChunkPages pages = values.writeTo(new ColumnChunkWriterImpl(config), descriptor(ColumnType.BOOLEAN));
		Assert.assertFalse(pages.hasDictionaryPage());
		Assert.assertNull(writeAndRead(values, config).getDictionaryPage());
	}

	@Test
	public void testStatistics()
	{
		ColumnValues values = ColumnValues.ofInts(25, 30, 35, 28, 32);
		ColumnChunkPages pages = values.writeTo(new ColumnChunkWriterImpl(new ParquetWriteConfig()),
				descriptor(ColumnType.INT32));
		Assert.assertEquals(25, pages.getStatistics().genericGetMin());
		Assert.assertEquals(35, pages.getStatistics().genericGetMax());
		Assert.assertEquals(0L, pages.getStatistics().getNumNulls());
	}

	@Test
	public void testStatisticsNotShared()
	{
		ColumnDescriptor descriptor = descriptor(ColumnType.INT32);
		Statistics<?> statistics = Statistics.createStats(descriptor.getPrimitiveType());
		statistics.updateStats(5);
		ColumnChunkPages pages = new ColumnChunkPages(descriptor, null, Collections.emptyList(),
				CompressionCodec.UNCOMPRESSED, statistics);

		// neither the caller's instance nor a returned one reaches the stored statistics
		statistics.updateStats(100);
		pages.getStatistics().updateStats(-100);
		pages.getStatistics().incrementNumNulls();

		Assert.assertEquals(5, pages.getStatistics().genericGetMin());
		Assert.assertEquals(5, pages.getStatistics().genericGetMax());
		Assert.assertEquals(0L, pages.getStatistics().getNumNulls());
	}

	@Test
	public void testReaderNext() throws IOException
	{
		InMemChunk chunk = writeAndRead(ColumnValues.ofLongs(100L, 200L, 300L), new ParquetWriteConfig());
		ChunkValuesReader reader = ChunkValuesReaderFactory.createChunkReader(chunk);
		Assert.assertEquals(100L, reader.getLong());
		Assert.assertTrue(reader.next());
		// moving on without reading the current value
		Assert.assertTrue(reader.next());
		Assert.assertEquals(300L, reader.getLong());
		Assert.assertFalse(reader.next());
	}

	@Test
	public void testEmptyColumnRejected()
	{
		ColumnChunkWriter writer = new ColumnChunkWriterImpl(new ParquetWriteConfig());
		assertThrows(IllegalStateException.class, () -> writer.writeColumn(descriptor(ColumnType.INT32), new int[0]));
	}

	@Test
	public void testWrongPhysicalTypeRejected()
	{
		ColumnChunkWriter writer = new ColumnChunkWriterImpl(new ParquetWriteConfig());
		assertThrows(IllegalArgumentException.class,
				() -> writer.writeColumn(descriptor(ColumnType.INT64), new int[] { 1 }));
		assertThrows(IllegalArgumentException.class,
				() -> writer.writeColumn(descriptor(ColumnType.BOOLEAN), new String[] { "a" }));
	}

	@Test
	public void testNullStringRejected()
	{
		ColumnChunkWriter writer = new ColumnChunkWriterImpl(new ParquetWriteConfig());
		assertThrows(IllegalArgumentException.class,
				() -> writer.writeColumn(descriptor(ColumnType.STRING), new String[] { "a", null }));
	}
}
