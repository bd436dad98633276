package com.earnix.parquet.fixtures.writer.rowgroup;

import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkPages;

import java.io.IOException;

public interface RowGroupWriter
{
	/**
	 * Write column data as primitive values
	 *
	 * @param writer a function that passes values into the writer which then returns pages
	 * @throws IOException on failure
	 */
	void writeValues(ChunkValuesWritingFunction writer) throws IOException;

	/**
	 * Write the already encoded pages of a column chunk
	 *
	 * @param columnChunkPages the pages to write
	 * @throws IOException on failure
	 */
	void writeValues(ColumnChunkPages columnChunkPages) throws IOException;
}
