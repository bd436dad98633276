package com.earnix.parquet.fixtures.file.writer;

import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkPages;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkWriter;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkWriterImpl;
import com.earnix.parquet.fixtures.writer.rowgroup.ChunkValuesWritingFunction;
import com.earnix.parquet.fixtures.writer.rowgroup.ColumnChunkInfo;
import com.earnix.parquet.fixtures.writer.rowgroup.RowGroupInfo;
import com.earnix.parquet.fixtures.writer.rowgroup.RowGroupWriter;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes the column chunks of one row group to a file, one after the other starting at a fixed offset
 */
public class FileRowGroupWriterImpl implements RowGroupWriter
{
	private static final Logger LOG = LoggerFactory.getLogger(FileRowGroupWriterImpl.class);

	private final MessageType messageType;
	private final FileChannel output;
	private final ColumnChunkWriter columnChunkWriter;
	private final long numRows;
	private final long startingOffset;
	private long currOffset;
	private final List<ColumnChunkInfo> chunkInfoList = new ArrayList<>();
	private boolean closed = false;

	/**
	 * @param messageType    the message type used to validate all columns in this row group are written
	 * @param config         the encoding and compression settings for column writing
	 * @param numRows        the number of rows in this row group
	 * @param output         the file channel to output the data to
	 * @param startingOffset the starting offset in the output file
	 */
	public FileRowGroupWriterImpl(MessageType messageType, ParquetWriteConfig config, long numRows, FileChannel output,
			long startingOffset)
	{
		if (numRows <= 0)
			throw new IllegalArgumentException("A row group must contain rows: " + numRows);
		this.messageType = messageType;
		this.output = output;
		this.columnChunkWriter = new ColumnChunkWriterImpl(config);
		this.numRows = numRows;
		this.startingOffset = startingOffset;
		this.currOffset = startingOffset;
	}

	@Override
	public void writeValues(ChunkValuesWritingFunction writer) throws IOException
	{
		assertNotClosed();
		writeValues(writer.apply(columnChunkWriter));
	}

	@Override
	public void writeValues(ColumnChunkPages pages) throws IOException
	{
		assertNotClosed();
		validateColumn(pages);
		long writeOffset = this.currOffset;
		pages.writeToFile(output, writeOffset);
		this.currOffset += pages.totalBytesForStorage();
		chunkInfoList.add(new ColumnChunkInfo(pages, writeOffset));
		LOG.debug("Wrote chunk {} of {} bytes at offset {}", pages.getColumnDescriptor(),
				pages.totalBytesForStorage(), writeOffset);
	}

	private void validateColumn(ColumnChunkPages pages)
	{
		ColumnDescriptor descriptor = pages.getColumnDescriptor();
		int idx = messageType.getColumns().indexOf(descriptor);
		if (idx < 0)
			throw new IllegalStateException("Column " + descriptor + " is not in schema " + messageType);
		if (!messageType.getColumns().get(idx).getPrimitiveType().equals(descriptor.getPrimitiveType()))
		{
			throw new IllegalStateException(
					"Column " + descriptor.getPrimitiveType() + " does not match the schema column "
							+ messageType.getColumns().get(idx).getPrimitiveType());
		}
		for (ColumnChunkInfo info : chunkInfoList)
		{
			if (info.getDescriptor().equals(descriptor))
				throw new IllegalStateException("Column " + descriptor + " was already written in this row group");
		}
		if (pages.getNumValues() != numRows)
		{
			throw new IllegalStateException(
					"The number of values in the chunk " + descriptor + " is " + pages.getNumValues()
							+ " but the row group declared " + numRows + " rows");
		}
	}

	/**
	 * Finish the row group and position the channel after its last chunk
	 *
	 * @return the placement of the row group and its chunks
	 * @throws IOException on failure to position the channel
	 */
	public RowGroupInfo closeAndValidateAllColumnsWritten() throws IOException
	{
		assertNotClosed();
		this.closed = true;
		Set<ColumnDescriptor> descriptors = chunkInfoList.stream().map(ColumnChunkInfo::getDescriptor)
				.collect(Collectors.toSet());
		if (!new HashSet<>(messageType.getColumns()).equals(descriptors))
		{
			throw new IllegalStateException(
					"Not all columns in this row group were written. required: " + messageType.getColumns() + " "
							+ "actual: " + descriptors);
		}

		this.output.position(this.currOffset);
		return new RowGroupInfo(startingOffset, currOffset - startingOffset, numRows, chunkInfoList);
	}

	private void assertNotClosed()
	{
		if (closed)
			throw new IllegalStateException("Row group already finished");
	}
}
