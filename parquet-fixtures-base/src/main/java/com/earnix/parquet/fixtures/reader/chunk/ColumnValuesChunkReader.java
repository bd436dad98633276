package com.earnix.parquet.fixtures.reader.chunk;

import com.earnix.parquet.fixtures.batch.ColumnType;
import com.earnix.parquet.fixtures.batch.ColumnValues;
import com.earnix.parquet.fixtures.reader.chunk.internal.ChunkValuesReaderFactory;
import com.earnix.parquet.fixtures.reader.chunk.internal.InMemChunk;

/**
 * Decodes a whole column chunk into {@link ColumnValues}
 */
public class ColumnValuesChunkReader
{
	/**
	 * @param chunk the decompressed chunk of a required column
	 * @return all values of the chunk in order
	 */
	public static ColumnValues readValues(InMemChunk chunk)
	{
		ColumnType type = ColumnType.fromPrimitiveType(chunk.getDescriptor().getPrimitiveType());
		int numValues = Math.toIntExact(chunk.getTotalValues());
		ChunkValuesReader reader = ChunkValuesReaderFactory.createChunkReader(chunk);
		switch (type)
		{
			case INT32:
			{
				int[] vals = new int[numValues];
				for (int i = 0; i < numValues; i++, reader.next())
					vals[i] = reader.getInteger();
				return ColumnValues.ofInts(vals);
			}
			case INT64:
			{
				long[] vals = new long[numValues];
				for (int i = 0; i < numValues; i++, reader.next())
					vals[i] = reader.getLong();
				return ColumnValues.ofLongs(vals);
			}
			case FLOAT32:
			{
				float[] vals = new float[numValues];
				for (int i = 0; i < numValues; i++, reader.next())
					vals[i] = reader.getFloat();
				return ColumnValues.ofFloats(vals);
			}
			case FLOAT64:
			{
				double[] vals = new double[numValues];
				for (int i = 0; i < numValues; i++, reader.next())
					vals[i] = reader.getDouble();
				return ColumnValues.ofDoubles(vals);
			}
			case STRING:
			{
				String[] vals = new String[numValues];
				for (int i = 0; i < numValues; i++, reader.next())
					vals[i] = reader.getBinary().toStringUsingUTF8();
				return ColumnValues.ofStrings(vals);
			}
			case BOOLEAN:
			{
				boolean[] vals = new boolean[numValues];
				for (int i = 0; i < numValues; i++, reader.next())
					vals[i] = reader.getBoolean();
				return ColumnValues.ofBooleans(vals);
			}
			default:
				throw new IllegalStateException("Unknown type " + type);
		}
	}
}
