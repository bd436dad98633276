package com.earnix.parquet.fixtures.writer.columnchunk;

import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import com.earnix.parquet.fixtures.writer.compressors.Compressors;
import com.earnix.parquet.fixtures.writer.page.InMemPageWriter;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.ColumnWriteStore;
import org.apache.parquet.column.ColumnWriter;
import org.apache.parquet.column.page.PageWriteStore;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the values of one required column chunk one at a time, and hands out the resultant pages at the end.
 */
public class ColumnChunkValuesWriter implements AutoCloseable
{
	private static final Logger LOG = LoggerFactory.getLogger(ColumnChunkValuesWriter.class);

	static final String SINGLE_COLUMN_SCHEMA_NAME = "single_column";

	private final ColumnDescriptor columnDescriptor;

	// nulled out on close so a finished writer holds no page memory
	private PageWriteStore pageWriteStore;
	private ColumnWriteStore writeStore;
	private ColumnWriter columnWriter;
	private InMemPageWriter inMemPageWriter;

	private ColumnChunkPages pages = null;

	private long numVals = 0;

	public ColumnChunkValuesWriter(ColumnDescriptor columnDescriptor, ParquetWriteConfig config)
	{
		if (columnDescriptor.getPrimitiveType().getRepetition() != Type.Repetition.REQUIRED)
		{
			throw new IllegalArgumentException("Only required columns are supported: " + columnDescriptor);
		}
		this.columnDescriptor = columnDescriptor;
		this.inMemPageWriter = new InMemPageWriter(columnDescriptor, config.getCompressionCodec(),
				Compressors.forCodec(config.getCompressionCodec(), config.getZstdCompressionLevel()));

		pageWriteStore = descriptor -> {
			if (!columnDescriptor.equals(descriptor))
			{
				throw new IllegalArgumentException(
						"unexpected descriptor: " + descriptor + ". expected: " + columnDescriptor);
			}
			return inMemPageWriter;
		};
		MessageType singleColumn = new MessageType(SINGLE_COLUMN_SCHEMA_NAME, columnDescriptor.getPrimitiveType());
		writeStore = config.getParquetProperties().newColumnWriteStore(singleColumn, pageWriteStore);

		boolean success = false;
		try
		{
			columnWriter = writeStore.getColumnWriter(columnDescriptor);
			success = true;
		}
		finally
		{
			if (!success)
				writeStore.close();
		}
	}

	/**
	 * Finish writing this chunk and get the associated pages
	 *
	 * @return the column chunk pages
	 */
	public ColumnChunkPages finishAndGetPages()
	{
		if (pages == null)
		{
			if (numVals == 0)
			{
				throw new IllegalStateException("A column chunk cannot contain zero values " + columnDescriptor);
			}
			writeStore.flush();
			if (inMemPageWriter.getTotalValueCount() != numVals)
			{
				throw new IllegalStateException(
						"Wrote " + numVals + " values but the pages of " + columnDescriptor + " contain "
								+ inMemPageWriter.getTotalValueCount());
			}

			pages = new ColumnChunkPages(columnDescriptor, inMemPageWriter.getDictionaryPage(),
					inMemPageWriter.getPages(), inMemPageWriter.getCompressionCodec(),
					inMemPageWriter.getChunkStatistics());
			LOG.debug("Finished chunk {} with {} values in {} bytes", columnDescriptor, numVals,
					pages.totalBytesForStorage());
			close();
		}
		return pages;
	}

	public boolean isFinished()
	{
		return pages != null;
	}

	private void assertWritable()
	{
		if (isFinished() || columnWriter == null)
		{
			throw new IllegalStateException("Already finished writing column " + columnDescriptor);
		}
	}

	/**
	 * Release the write store. The store also closes the column writer it handed out.
	 */
	@Override
	public void close()
	{
		try
		{
			if (writeStore != null)
				writeStore.close();
		}
		catch (RuntimeException ex)
		{
			LOG.warn("Exception closing write store of column {}", columnDescriptor, ex);
			throw ex;
		}
		finally
		{
			columnWriter = null;
			writeStore = null;
			pageWriteStore = null;
			inMemPageWriter = null;
		}
	}

	public void write(int value)
	{
		assertWritable();
		columnWriter.write(value, 0, maxDefinitionLevel());
		wroteValue();
	}

	public void write(long value)
	{
		assertWritable();
		columnWriter.write(value, 0, maxDefinitionLevel());
		wroteValue();
	}

	public void write(boolean value)
	{
		assertWritable();
		columnWriter.write(value, 0, maxDefinitionLevel());
		wroteValue();
	}

	public void write(Binary value)
	{
		assertWritable();
		columnWriter.write(value, 0, maxDefinitionLevel());
		wroteValue();
	}

	public void write(float value)
	{
		assertWritable();
		columnWriter.write(value, 0, maxDefinitionLevel());
		wroteValue();
	}

	public void write(double value)
	{
		assertWritable();
		columnWriter.write(value, 0, maxDefinitionLevel());
		wroteValue();
	}

	private int maxDefinitionLevel()
	{
		return columnDescriptor.getMaxDefinitionLevel();
	}

	private void wroteValue()
	{
		writeStore.endRecord();
		++numVals;
	}

	public long getNumValues()
	{
		return numVals;
	}

	public ColumnDescriptor getColumnDescriptor()
	{
		return columnDescriptor;
	}
}
