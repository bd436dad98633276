package com.earnix.parquet.fixtures.reader.chunk.internal;

import com.earnix.parquet.fixtures.writer.compressors.Compressors;
import org.apache.commons.io.IOUtils;
import org.apache.parquet.bytes.BytesInput;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DataPageV1;
import org.apache.parquet.column.page.DataPageV2;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.format.DataPageHeader;
import org.apache.parquet.format.DataPageHeaderV2;
import org.apache.parquet.format.DictionaryPageHeader;
import org.apache.parquet.format.PageHeader;
import org.apache.parquet.format.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import static com.earnix.parquet.fixtures.utils.ParquetEnumUtils.convert;

/**
 * A factory to read a column chunk into uncompressed in memory pages.
 */
public class ChunkDecompressToPageStoreFactory
{
	private static final Logger LOG = LoggerFactory.getLogger(ChunkDecompressToPageStoreFactory.class);
	private static final byte[] EMPTY = new byte[0];

	/**
	 * Decompress all pages of a column chunk
	 *
	 * @param descriptor the descriptor of the column
	 * @param chunkBytes the stored bytes of the chunk, page headers included
	 * @param codec      the compression codec used for the pages
	 * @return the in memory chunk
	 * @throws IOException on a malformed page header or page
	 */
	public static InMemChunk buildInMemChunk(ColumnDescriptor descriptor, byte[] chunkBytes, CompressionCodec codec)
			throws IOException
	{
		ByteArrayInputStream is = new ByteArrayInputStream(chunkBytes);
		boolean isFirstPage = true;
		DictionaryPage dictionaryPage = null;
		List<DataPage> dataPageList = new ArrayList<>();
		long totalValues = 0L;
		while (is.available() > 0)
		{
			PageHeader pageHeader = Util.readPageHeader(is);
			if (pageHeader.isSetDictionary_page_header())
			{
				if (!isFirstPage)
				{
					throw new IOException("Dictionary page is only possible at the beginning of " + descriptor);
				}
				dictionaryPage = readDictPage(is, codec, pageHeader);
			}
			else if (pageHeader.isSetData_page_header_v2())
			{
				totalValues += pageHeader.getData_page_header_v2().getNum_values();
				dataPageList.add(readDataPageV2(is, pageHeader, codec));
			}
			else if (pageHeader.isSetData_page_header())
			{
				totalValues += pageHeader.getData_page_header().getNum_values();
				dataPageList.add(readDataPage(is, pageHeader, codec));
			}
			else
			{
				throw new IOException("Unsupported page type " + pageHeader.getType() + " in " + descriptor);
			}
			isFirstPage = false;
		}
		LOG.debug("Read {} data pages with {} values for {}", dataPageList.size(), totalValues, descriptor);
		return new InMemChunk(descriptor, dictionaryPage, dataPageList, totalValues);
	}

	private static DictionaryPage readDictPage(InputStream is, CompressionCodec codec, PageHeader pageHeader)
			throws IOException
	{
		DictionaryPageHeader dictionaryPageHeader = pageHeader.getDictionary_page_header();
		byte[] compressedBytes = readPageFully(is, pageHeader.getCompressed_page_size());
		byte[] dictBytes = Compressors.decompress(codec, compressedBytes, pageHeader.getUncompressed_page_size());
		Encoding dictEncoding = convert(dictionaryPageHeader.getEncoding());
		return new DictionaryPage(wrap(dictBytes), dictionaryPageHeader.getNum_values(), dictEncoding);
	}

	private static DataPage readDataPage(InputStream is, PageHeader pageHeader, CompressionCodec codec)
			throws IOException
	{
		DataPageHeader dataPageHeader = pageHeader.getData_page_header();

		byte[] compressed = readPageFully(is, pageHeader.getCompressed_page_size());
		byte[] uncompressed = Compressors.decompress(codec, compressed, pageHeader.getUncompressed_page_size());

		return new DataPageV1(wrap(uncompressed), dataPageHeader.getNum_values(), uncompressed.length, null,
				convert(dataPageHeader.getRepetition_level_encoding()),
				convert(dataPageHeader.getDefinition_level_encoding()), convert(dataPageHeader.getEncoding()));
	}

	private static DataPage readDataPageV2(InputStream is, PageHeader pageHeader, CompressionCodec codec)
			throws IOException
	{
		DataPageHeaderV2 dataPageHeaderV2 = pageHeader.getData_page_header_v2();

		byte[] repetitionLevelBytes = readPageFully(is, dataPageHeaderV2.getRepetition_levels_byte_length());
		byte[] defLevelBytes = readPageFully(is, dataPageHeaderV2.getDefinition_levels_byte_length());

		// a missing is_compressed flag means compressed
		boolean compressed = !dataPageHeaderV2.isSetIs_compressed() || dataPageHeaderV2.isIs_compressed();
		CompressionCodec usedCodec = compressed ? codec : CompressionCodec.UNCOMPRESSED;
		int defAndRepLen = dataPageHeaderV2.getDefinition_levels_byte_length()
				+ dataPageHeaderV2.getRepetition_levels_byte_length();
		byte[] dataBytesCompressed = readPageFully(is, pageHeader.getCompressed_page_size() - defAndRepLen);
		byte[] dataBytes = Compressors.decompress(usedCodec, dataBytesCompressed,
				pageHeader.getUncompressed_page_size() - defAndRepLen);

		return DataPageV2.uncompressed(dataPageHeaderV2.getNum_rows(), dataPageHeaderV2.getNum_nulls(),
				dataPageHeaderV2.getNum_values(), wrap(repetitionLevelBytes), wrap(defLevelBytes),
				convert(dataPageHeaderV2.getEncoding()), wrap(dataBytes), null);
	}

	private static BytesInput wrap(byte[] bytes)
	{
		if (bytes.length == 0)
			return BytesInput.empty();
		return BytesInput.from(bytes);
	}

	private static byte[] readPageFully(InputStream is, int bytesToRead) throws IOException
	{
		if (bytesToRead < 0)
			throw new IOException("Negative page length " + bytesToRead);
		if (bytesToRead == 0)
			return EMPTY;
		byte[] bytes = new byte[bytesToRead];
		IOUtils.readFully(is, bytes);
		return bytes;
	}
}
