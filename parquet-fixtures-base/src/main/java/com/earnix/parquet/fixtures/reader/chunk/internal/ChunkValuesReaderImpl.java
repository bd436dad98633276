package com.earnix.parquet.fixtures.reader.chunk.internal;

import com.earnix.parquet.fixtures.reader.chunk.ChunkValuesReader;
import org.apache.parquet.io.api.Binary;

/**
 * Note that this class is *NOT* threadsafe
 */
public class ChunkValuesReaderImpl implements ChunkValuesReader
{
	private final ParquetExtendedColumnReader columnReader;
	private final long numValues;
	private long numValuesRead;

	public ChunkValuesReaderImpl(InMemChunk chunk)
	{
		if (chunk.getTotalValues() <= 0)
			throw new IllegalArgumentException("Chunk has no values: " + chunk.getDescriptor());
		columnReader = new ParquetExtendedColumnReader(chunk);
		numValues = chunk.getTotalValues();
		numValuesRead = 0;
	}

	@Override
	public boolean next()
	{
		if (++numValuesRead >= numValues)
		{
			return false;
		}

		// skip() only skips the data value if it was not read yet, so it is a noop after a getter was called.
		// consume() then moves the repetition and definition levels on to the next value.
		columnReader.skip();
		columnReader.consume();
		return true;
	}

	@Override
	public int getInteger()
	{
		return columnReader.getInteger();
	}

	@Override
	public boolean getBoolean()
	{
		return columnReader.getBoolean();
	}

	@Override
	public long getLong()
	{
		return columnReader.getLong();
	}

	@Override
	public Binary getBinary()
	{
		return columnReader.getBinary();
	}

	@Override
	public float getFloat()
	{
		return columnReader.getFloat();
	}

	@Override
	public double getDouble()
	{
		return columnReader.getDouble();
	}

	@Override
	public boolean isDictionaryEncoded()
	{
		return columnReader.currentPageUsesDictionary();
	}
}
