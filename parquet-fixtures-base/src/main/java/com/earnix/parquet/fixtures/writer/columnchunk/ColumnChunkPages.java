package com.earnix.parquet.fixtures.writer.columnchunk;

import com.earnix.parquet.fixtures.utils.ParquetEnumUtils;
import org.apache.parquet.bytes.BytesInput;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DataPageV1;
import org.apache.parquet.column.page.DataPageV2;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.column.statistics.Statistics;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.format.DataPageHeader;
import org.apache.parquet.format.DataPageHeaderV2;
import org.apache.parquet.format.DictionaryPageHeader;
import org.apache.parquet.format.Encoding;
import org.apache.parquet.format.PageHeader;
import org.apache.parquet.format.PageType;
import org.apache.parquet.format.Util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * All serialized pages of a single column chunk, headers included. This class is Immutable and Thread Safe.
 */
public class ColumnChunkPages
{
	private final ColumnDescriptor columnDescriptor;
	private final Set<Encoding> encodingSet = EnumSet.noneOf(Encoding.class);
	private final List<byte[]> headersAndPages;
	private final long numValues;
	private final long uncompressedBytes;
	private final long compressedBytes;
	private final long dictionaryPageBytes;
	private final CompressionCodec compressionCodec;
	private final Statistics<?> statistics;

	public ColumnChunkPages(ColumnDescriptor columnDescriptor, DictionaryPage dictionaryPage,
			List<? extends DataPage> dataPages, CompressionCodec compressionCodec, Statistics<?> statistics)
	{
		this.columnDescriptor = columnDescriptor;
		this.compressionCodec = compressionCodec;
		this.statistics = statistics.copy();
		int numPages = dictionaryPage == null ? dataPages.size() : dataPages.size() + 1;
		this.headersAndPages = new ArrayList<>(2 * numPages);

		long uncompressedBytes = 0;
		if (dictionaryPage != null)
		{
			uncompressedBytes += addDictionaryPage(dictionaryPage);
		}
		// the dictionary page is always the first page of the chunk
		this.dictionaryPageBytes = totalStoredBytes();

		long numValues = 0;
		for (DataPage dataPage : dataPages)
		{
			if (dataPage instanceof DataPageV2)
			{
				uncompressedBytes += addPage((DataPageV2) dataPage);
			}
			else if (dataPage instanceof DataPageV1)
			{
				uncompressedBytes += addPage((DataPageV1) dataPage);
			}
			else
			{
				throw new IllegalStateException("Unknown data page class: " + dataPage.getClass());
			}
			numValues += dataPage.getValueCount();
		}
		this.uncompressedBytes = uncompressedBytes;
		this.compressedBytes = totalStoredBytes();
		this.numValues = numValues;
	}

	private long totalStoredBytes()
	{
		return this.headersAndPages.stream().mapToLong(bytes -> bytes.length).sum();
	}

	private int addDictionaryPage(DictionaryPage dictionaryPage)
	{
		DictionaryPageHeader dictionaryPageHeader = new DictionaryPageHeader();
		Encoding enc = ParquetEnumUtils.convert(dictionaryPage.getEncoding());
		dictionaryPageHeader.setEncoding(enc);
		encodingSet.add(enc);
		dictionaryPageHeader.setIs_sorted(false);
		dictionaryPageHeader.setNum_values(dictionaryPage.getDictionarySize());

		PageHeader pageHeader = new PageHeader();
		pageHeader.setType(PageType.DICTIONARY_PAGE);
		pageHeader.setDictionary_page_header(dictionaryPageHeader);
		pageHeader.setUncompressed_page_size(dictionaryPage.getUncompressedSize());
		pageHeader.setCompressed_page_size(dictionaryPage.getCompressedSize());

		int headerSize = storeHeaderBytes(pageHeader);
		addBytes(dictionaryPage.getBytes());
		return headerSize + dictionaryPage.getUncompressedSize();
	}

	private int addPage(DataPageV1 dataPage)
	{
		DataPageHeader dataPageHeader = new DataPageHeader();
		dataPageHeader.setNum_values(dataPage.getValueCount());
		Encoding valuesEncoding = ParquetEnumUtils.convert(dataPage.getValueEncoding());
		Encoding dlEncoding = ParquetEnumUtils.convert(dataPage.getDlEncoding());
		Encoding rlEncoding = ParquetEnumUtils.convert(dataPage.getRlEncoding());
		dataPageHeader.setEncoding(valuesEncoding);
		dataPageHeader.setDefinition_level_encoding(dlEncoding);
		dataPageHeader.setRepetition_level_encoding(rlEncoding);
		encodingSet.add(valuesEncoding);
		encodingSet.add(dlEncoding);
		encodingSet.add(rlEncoding);

		PageHeader pageHeader = new PageHeader();
		pageHeader.setType(PageType.DATA_PAGE);
		pageHeader.setData_page_header(dataPageHeader);
		pageHeader.setUncompressed_page_size(dataPage.getUncompressedSize());
		pageHeader.setCompressed_page_size(dataPage.getCompressedSize());

		int headerSize = storeHeaderBytes(pageHeader);
		addBytes(dataPage.getBytes());
		return headerSize + dataPage.getUncompressedSize();
	}

	private int addPage(DataPageV2 dataPage)
	{
		DataPageHeaderV2 dataPageHeader = new DataPageHeaderV2();
		dataPageHeader.setNum_values(dataPage.getValueCount());
		dataPageHeader.setNum_nulls(dataPage.getNullCount());
		dataPageHeader.setNum_rows(dataPage.getRowCount());
		Encoding enc = ParquetEnumUtils.convert(dataPage.getDataEncoding());
		encodingSet.add(enc);
		dataPageHeader.setEncoding(enc);

		dataPageHeader.setDefinition_levels_byte_length(Math.toIntExact(dataPage.getDefinitionLevels().size()));
		dataPageHeader.setRepetition_levels_byte_length(Math.toIntExact(dataPage.getRepetitionLevels().size()));
		dataPageHeader.setIs_compressed(dataPage.isCompressed());

		PageHeader pageHeader = new PageHeader();
		pageHeader.setType(PageType.DATA_PAGE_V2);
		pageHeader.setData_page_header_v2(dataPageHeader);
		pageHeader.setUncompressed_page_size(dataPage.getUncompressedSize());
		pageHeader.setCompressed_page_size(dataPage.getCompressedSize());

		int headerSize = storeHeaderBytes(pageHeader);
		addBytes(dataPage.getRepetitionLevels());
		addBytes(dataPage.getDefinitionLevels());
		addBytes(dataPage.getData());
		return headerSize + dataPage.getUncompressedSize();
	}

	private void addBytes(BytesInput input)
	{
		try
		{
			if (input.size() > 0)
				headersAndPages.add(input.toByteArray());
		}
		catch (IOException ex)
		{
			throw new UncheckedIOException(ex);
		}
	}

	private int storeHeaderBytes(PageHeader pageHeader)
	{
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		try
		{
			Util.writePageHeader(pageHeader, baos);
		}
		catch (IOException ex)
		{
			// should never happen with byte array output stream.
			throw new UncheckedIOException(ex);
		}
		byte[] written = baos.toByteArray();
		headersAndPages.add(written);
		return written.length;
	}

	/**
	 * Write the bytes of this chunk to an output stream
	 *
	 * @param os the output stream to write the bytes to
	 * @throws IOException on failure to write to the OutputStream
	 */
	public void writeToOutputStream(OutputStream os) throws IOException
	{
		for (byte[] toWrite : headersAndPages)
			os.write(toWrite);
	}

	/**
	 * Write the bytes of this chunk to a file
	 *
	 * @param fc             the file channel of the file
	 * @param startingOffset the starting offset to write to in the file
	 * @throws IOException on failure to write to the file
	 */
	public void writeToFile(FileChannel fc, long startingOffset) throws IOException
	{
		long offset = startingOffset;
		for (byte[] b : this.headersAndPages)
		{
			offset += ChunkWritingUtils.writeByteBufferToChannelFully(fc, ByteBuffer.wrap(b), offset);
		}
	}

	public ColumnDescriptor getColumnDescriptor()
	{
		return columnDescriptor;
	}

	/**
	 * @return The total number of bytes that this chunk will take when persisted
	 */
	public long totalBytesForStorage()
	{
		return compressedBytes;
	}

	/**
	 * @return The number of bytes this chunk will take when the pages are uncompressed.
	 */
	public long getUncompressedBytes()
	{
		return uncompressedBytes;
	}

	/**
	 * @return the number of bytes of the dictionary page including its header, 0 if there is no dictionary
	 */
	public long getDictionaryPageBytes()
	{
		return dictionaryPageBytes;
	}

	public boolean hasDictionaryPage()
	{
		return dictionaryPageBytes > 0;
	}

	/**
	 * @return The number of values stored in this chunk
	 */
	public long getNumValues()
	{
		return numValues;
	}

	/**
	 * @return the set of {@link Encoding} used by the pages (must be populated in metadata of parquet file)
	 */
	public Set<Encoding> getEncodingSet()
	{
		return Collections.unmodifiableSet(encodingSet);
	}

	public CompressionCodec getCompressionCodec()
	{
		return compressionCodec;
	}

	/**
	 * @return the statistics of all values in the chunk
	 */
	public Statistics<?> getStatistics()
	{
		return statistics.copy();
	}
}
