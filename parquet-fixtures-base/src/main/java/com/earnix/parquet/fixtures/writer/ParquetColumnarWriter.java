package com.earnix.parquet.fixtures.writer;

import com.earnix.parquet.fixtures.batch.RowBatch;
import com.earnix.parquet.fixtures.writer.rowgroup.RowGroupWriter;
import org.apache.parquet.format.KeyValue;

import java.io.Closeable;
import java.io.IOException;

public interface ParquetColumnarWriter extends Closeable
{
	/**
	 * Append a row group to the file.
	 *
	 * @param numRows          the number of rows in the row group
	 * @param rowGroupAppender The callback to get the RowGroupAppender. Passed as a callback to ensure that start and
	 *                         finish are called as expected
	 * @throws IOException on IO Failure
	 */
	default void writeRowGroup(long numRows, RowGroupAppender rowGroupAppender) throws IOException
	{
		RowGroupWriter rowGroupWriter = startNewRowGroup(numRows);
		rowGroupAppender.append(rowGroupWriter);
		finishRowGroup();
	}

	/**
	 * Append all rows of the batch, split into as many row groups as the configured row limit requires. The schema of
	 * the batch must be the schema of the file.
	 *
	 * @param rowBatch the rows to append
	 * @throws IOException on IO Failure
	 */
	void writeRowBatch(RowBatch rowBatch) throws IOException;

	/**
	 * Start a new row group with the specified number of rows
	 *
	 * @param numRows the number of rows of data in this row group
	 * @return the row group writer
	 * @throws IOException on failure to write to the destination
	 */
	RowGroupWriter startNewRowGroup(long numRows) throws IOException;

	/**
	 * @return the current row group writer that is opened for writing
	 */
	RowGroupWriter getCurrentRowGroupWriter();

	/**
	 * Mark the current row group as finished. This also validates that all columns are written to prevent corrupted
	 * partial parquet files
	 */
	void finishRowGroup() throws IOException;

	/**
	 * Add key value metadata to the footer. Must be called before {@link #finishAndWriteFooterMetadata()}
	 *
	 * @param keyValue the key value to add
	 */
	void addKeyValue(KeyValue keyValue);

	/**
	 * Finish the parquet file. Writes the footer metadata. Note that {@link #close()} should still be called after.
	 */
	ParquetFileInfo finishAndWriteFooterMetadata() throws IOException;

	@FunctionalInterface
	interface RowGroupAppender
	{
		void append(RowGroupWriter rowGroupWriter) throws IOException;
	}
}
