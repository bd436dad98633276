package com.earnix.parquet.fixtures.writer.columnchunk;

import org.apache.parquet.column.ColumnDescriptor;

/**
 * Encodes a whole column chunk at once. The column must be required and the values must not be empty.
 */
public interface ColumnChunkWriter
{
	ColumnChunkPages writeColumn(ColumnDescriptor columnDescriptor, int[] vals);

	ColumnChunkPages writeColumn(ColumnDescriptor columnDescriptor, long[] vals);

	ColumnChunkPages writeColumn(ColumnDescriptor columnDescriptor, float[] vals);

	ColumnChunkPages writeColumn(ColumnDescriptor columnDescriptor, double[] vals);

	ColumnChunkPages writeColumn(ColumnDescriptor columnDescriptor, boolean[] vals);

	/**
	 * Write a UTF-8 string column. Null elements are rejected.
	 */
	ColumnChunkPages writeColumn(ColumnDescriptor columnDescriptor, String[] vals);
}
