package com.earnix.parquet.fixtures.reader.chunk.internal;

import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DictionaryPage;

import java.util.Collections;
import java.util.List;

/**
 * The decompressed pages of one column chunk. Pages are backed by byte arrays so the chunk can be read any number of
 * times.
 */
public class InMemChunk
{
	private final ColumnDescriptor descriptor;
	private final DictionaryPage dictionaryPage;
	private final List<DataPage> dataPages;
	private final long totalValues;

	public InMemChunk(ColumnDescriptor descriptor, DictionaryPage dictionaryPage, List<DataPage> dataPages,
			long totalValues)
	{
		this.descriptor = descriptor;
		this.dictionaryPage = dictionaryPage;
		this.dataPages = Collections.unmodifiableList(dataPages);
		this.totalValues = totalValues;
	}

	public ColumnDescriptor getDescriptor()
	{
		return descriptor;
	}

	/**
	 * @return the dictionary page or null if the chunk has none
	 */
	public DictionaryPage getDictionaryPage()
	{
		return dictionaryPage;
	}

	public List<DataPage> getDataPages()
	{
		return dataPages;
	}

	public long getTotalValues()
	{
		return totalValues;
	}

	/**
	 * @return a new page reader positioned before the first data page
	 */
	public MemPageReader toPageReader()
	{
		return new MemPageReader(dictionaryPage, dataPages.iterator(), totalValues);
	}
}
