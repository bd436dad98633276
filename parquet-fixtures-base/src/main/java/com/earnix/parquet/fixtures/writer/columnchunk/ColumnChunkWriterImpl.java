package com.earnix.parquet.fixtures.writer.columnchunk;

import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;

import java.util.function.Consumer;

public class ColumnChunkWriterImpl implements ColumnChunkWriter
{
	private final ParquetWriteConfig config;

	/**
	 * Create a new chunk writer impl. This is an abstraction for writing columns to data pages
	 *
	 * @param config the encoding properties and compression codec to write the pages with
	 */
	public ColumnChunkWriterImpl(ParquetWriteConfig config)
	{
		this.config = config;
	}

	@Override
	public ColumnChunkPages writeColumn(ColumnDescriptor column, int[] vals)
	{
		expectType(column, PrimitiveTypeName.INT32);
		return internalWriteColumn(column, writer -> {
			for (int val : vals)
				writer.write(val);
		});
	}

	@Override
	public ColumnChunkPages writeColumn(ColumnDescriptor column, long[] vals)
	{
		expectType(column, PrimitiveTypeName.INT64);
		return internalWriteColumn(column, writer -> {
			for (long val : vals)
				writer.write(val);
		});
	}

	@Override
	public ColumnChunkPages writeColumn(ColumnDescriptor column, float[] vals)
	{
		expectType(column, PrimitiveTypeName.FLOAT);
		return internalWriteColumn(column, writer -> {
			for (float val : vals)
				writer.write(val);
		});
	}

	@Override
	public ColumnChunkPages writeColumn(ColumnDescriptor column, double[] vals)
	{
		expectType(column, PrimitiveTypeName.DOUBLE);
		return internalWriteColumn(column, writer -> {
			for (double val : vals)
				writer.write(val);
		});
	}

	@Override
	public ColumnChunkPages writeColumn(ColumnDescriptor column, boolean[] vals)
	{
		expectType(column, PrimitiveTypeName.BOOLEAN);
		return internalWriteColumn(column, writer -> {
			for (boolean val : vals)
				writer.write(val);
		});
	}

	@Override
	public ColumnChunkPages writeColumn(ColumnDescriptor column, String[] vals)
	{
		expectType(column, PrimitiveTypeName.BINARY);
		return internalWriteColumn(column, writer -> {
			for (String val : vals)
			{
				if (val == null)
					throw new IllegalArgumentException("Null value in required column " + column);
				writer.write(Binary.fromString(val));
			}
		});
	}

	private ColumnChunkPages internalWriteColumn(ColumnDescriptor column, Consumer<ColumnChunkValuesWriter> values)
	{
		try (ColumnChunkValuesWriter columnChunkValuesWriter = new ColumnChunkValuesWriter(column, config))
		{
			values.accept(columnChunkValuesWriter);
			return columnChunkValuesWriter.finishAndGetPages();
		}
	}

	private static void expectType(ColumnDescriptor column, PrimitiveTypeName expected)
	{
		PrimitiveTypeName actual = column.getPrimitiveType().getPrimitiveTypeName();
		if (actual != expected)
		{
			throw new IllegalArgumentException(
					"Column " + column + " has physical type " + actual + " but " + expected + " values were given");
		}
	}
}
