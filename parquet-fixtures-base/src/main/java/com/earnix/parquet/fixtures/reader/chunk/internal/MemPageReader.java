package com.earnix.parquet.fixtures.reader.chunk.internal;

import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DataPageV1;
import org.apache.parquet.column.page.DataPageV2;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.column.page.PageReader;

import java.util.Iterator;

/**
 * Inspired by MemPageReader in parquet test project. Store pages in memory to be consumed by
 * {@link ParquetExtendedColumnReader}
 */
public class MemPageReader implements PageReader
{
	private final DictionaryPage dictionaryPage;
	private final Iterator<? extends DataPage> dataPageIterator;
	private final long totalValueCount;
	private DataPage currentPage;

	/**
	 * Construct a new in memory page reader
	 *
	 * @param dictionaryPage   the dictionary page if used by any datapages, or null if not
	 * @param dataPageIterator the iterator for the DataPages (supports both V1 and V2)
	 * @param totalValueCount  the total number of values
	 */
	public MemPageReader(DictionaryPage dictionaryPage, Iterator<? extends DataPage> dataPageIterator,
			long totalValueCount)
	{
		this.dictionaryPage = dictionaryPage;
		this.dataPageIterator = dataPageIterator;
		this.totalValueCount = totalValueCount;
	}

	@Override
	public DictionaryPage readDictionaryPage()
	{
		return dictionaryPage;
	}

	@Override
	public long getTotalValueCount()
	{
		return totalValueCount;
	}

	@Override
	public DataPage readPage()
	{
		currentPage = dataPageIterator.hasNext() ? dataPageIterator.next() : null;
		return currentPage;
	}

	/**
	 * @return the encoding of the values in the last read DataPage, or null before the first page
	 */
	public Encoding getValuesEncoding()
	{
		if (currentPage == null)
			return null;
		if (currentPage instanceof DataPageV2)
			return ((DataPageV2) currentPage).getDataEncoding();
		if (currentPage instanceof DataPageV1)
			return ((DataPageV1) currentPage).getValueEncoding();
		throw new IllegalStateException("Unknown data page class: " + currentPage.getClass());
	}
}
