package com.earnix.parquet.fixtures.reader.chunk.internal;

import org.apache.parquet.VersionParser;
import org.apache.parquet.column.Dictionary;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.impl.ColumnReaderImpl;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.io.api.PrimitiveConverter;

/**
 * A column reader over an {@link InMemChunk} that exposes the current value directly instead of pushing it into a
 * converter. This class shouldn't be directly used. Use {@link ChunkValuesReaderImpl} instead
 */
public class ParquetExtendedColumnReader extends ColumnReaderImpl
{
	private static final DummyConverter dummyConverter = new DummyConverter();

	// not a parquet-mr version so no corrupted file workarounds get triggered
	private static final VersionParser.ParsedVersion writerVersion = new VersionParser.ParsedVersion(
			"parquet-fixtures", "1.0.0", "none");

	private final MemPageReader memPageReader;

	ParquetExtendedColumnReader(InMemChunk inMemChunk)
	{
		this(inMemChunk, inMemChunk.toPageReader());
	}

	private ParquetExtendedColumnReader(InMemChunk inMemChunk, MemPageReader pageReader)
	{
		super(inMemChunk.getDescriptor(), pageReader, dummyConverter, writerVersion);
		this.memPageReader = pageReader;
	}

	/**
	 * @return whether the current page being read uses a dictionary encoding. This must not be called after all values
	 * 		are read.
	 */
	public boolean currentPageUsesDictionary()
	{
		Encoding encoding = memPageReader.getValuesEncoding();
		return encoding != null && encoding.usesDictionary();
	}

	private static class DummyConverter extends PrimitiveConverter
	{
		@Override
		public void addBinary(Binary value)
		{
		}

		@Override
		public void addBoolean(boolean value)
		{
		}

		@Override
		public void addDouble(double value)
		{
		}

		@Override
		public void addFloat(float value)
		{
		}

		@Override
		public void addInt(int value)
		{
		}

		@Override
		public void addLong(long value)
		{
		}

		@Override
		public boolean hasDictionarySupport()
		{
			// support dictionary otherwise getCurrentValueDictionaryID() will not work
			return true;
		}

		@Override
		public void setDictionary(Dictionary dictionary)
		{
			// values are read from the column reader
		}

		@Override
		public void addValueFromDictionary(int dictionaryId)
		{
			// values are read from the column reader
		}
	}
}
