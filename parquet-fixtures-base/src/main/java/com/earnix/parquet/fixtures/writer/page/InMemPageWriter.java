package com.earnix.parquet.fixtures.writer.page;

import com.earnix.parquet.fixtures.writer.compressors.Compressor;
import org.apache.parquet.bytes.BytesInput;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DataPageV1;
import org.apache.parquet.column.page.DataPageV2;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.column.page.PageWriter;
import org.apache.parquet.column.statistics.SizeStatistics;
import org.apache.parquet.column.statistics.Statistics;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.io.ParquetEncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.apache.parquet.bytes.BytesInput.copy;

/**
 * Keeps the pages of a single column chunk in memory, compressing them on the way in. Adapted from MemPageWriter in
 * the tests of parquet-column.
 */
public class InMemPageWriter implements PageWriter
{
	private static final Logger LOG = LoggerFactory.getLogger(InMemPageWriter.class);

	private final List<DataPage> pages = new ArrayList<>();
	private final Compressor compressor;
	private final CompressionCodec compressionCodec;
	private final Statistics<?> chunkStatistics;
	private DictionaryPage dictionaryPage;
	private long memSize = 0;
	private long totalValueCount = 0;

	/**
	 * @param descriptor       the column the pages belong to
	 * @param compressionCodec the codec the compressor implements
	 * @param compressor       the compressor, or empty to store pages uncompressed
	 */
	public InMemPageWriter(ColumnDescriptor descriptor, CompressionCodec compressionCodec,
			Optional<Compressor> compressor)
	{
		if (compressor.isPresent() == (compressionCodec == CompressionCodec.UNCOMPRESSED))
			throw new IllegalArgumentException("Compressor does not match codec " + compressionCodec);
		this.compressionCodec = compressionCodec;
		this.compressor = compressor.orElse(null);
		this.chunkStatistics = Statistics.createStats(descriptor.getPrimitiveType());
	}

	@Override
	public void writePage(BytesInput bytesInput, int valueCount, Statistics statistics, Encoding rlEncoding,
			Encoding dlEncoding, Encoding valuesEncoding) throws IOException
	{
		if (valueCount == 0)
		{
			throw new ParquetEncodingException("illegal page of 0 values");
		}
		memSize += bytesInput.size();

		byte[] uncompressed = bytesInput.toByteArray();
		BytesInput pageBytes = compressor == null ? BytesInput.from(uncompressed) : compress(uncompressed);
		pages.add(new DataPageV1(pageBytes, valueCount, uncompressed.length, statistics, rlEncoding, dlEncoding,
				valuesEncoding));
		pageWritten(valueCount, statistics);
		LOG.debug("v1 page written for {} bytes and {} records", uncompressed.length, valueCount);
	}

	@Override
	public void writePage(BytesInput bytesInput, int valueCount, int rowCount, Statistics<?> statistics,
			Encoding rlEncoding, Encoding dlEncoding, Encoding valuesEncoding) throws IOException
	{
		writePage(bytesInput, valueCount, statistics, rlEncoding, dlEncoding, valuesEncoding);
	}

	@Override
	public void writePage(BytesInput bytesInput, int valueCount, int rowCount, Statistics<?> statistics,
			SizeStatistics sizeStatistics, Encoding rlEncoding, Encoding dlEncoding, Encoding valuesEncoding)
			throws IOException
	{
		writePage(bytesInput, valueCount, statistics, rlEncoding, dlEncoding, valuesEncoding);
	}

	@Override
	public void writePageV2(int rowCount, int nullCount, int valueCount, BytesInput repetitionLevels,
			BytesInput definitionLevels, Encoding dataEncoding, BytesInput data, Statistics<?> statistics)
			throws IOException
	{
		if (valueCount == 0)
		{
			throw new ParquetEncodingException("illegal page of 0 values");
		}
		long size = repetitionLevels.size() + definitionLevels.size() + data.size();
		memSize += size;

		DataPage page = null;
		if (compressor != null)
		{
			byte[] toCompress = data.toByteArray();
			BytesInput compressed = compress(toCompress);

			// if the compressed length is greater or equal to than the uncompressed size, don't compress!
			if (compressed.size() < toCompress.length)
			{
				int uncompressedLen = Math.toIntExact(
						repetitionLevels.size() + definitionLevels.size() + toCompress.length);
				page = DataPageV2.compressed(rowCount, nullCount, valueCount, copy(repetitionLevels),
						copy(definitionLevels), dataEncoding, compressed, uncompressedLen, statistics);
			}
		}

		if (page == null)
		{
			page = DataPageV2.uncompressed(rowCount, nullCount, valueCount, copy(repetitionLevels),
					copy(definitionLevels), dataEncoding, copy(data), statistics);
		}
		pages.add(page);
		pageWritten(valueCount, statistics);
		LOG.debug("v2 page written for {} bytes and {} records", size, valueCount);
	}

	@Override
	public void writePageV2(int rowCount, int nullCount, int valueCount, BytesInput repetitionLevels,
			BytesInput definitionLevels, Encoding dataEncoding, BytesInput data, Statistics<?> statistics,
			SizeStatistics sizeStatistics) throws IOException
	{
		writePageV2(rowCount, nullCount, valueCount, repetitionLevels, definitionLevels, dataEncoding, data,
				statistics);
	}

	private void pageWritten(int valueCount, Statistics<?> statistics)
	{
		totalValueCount += valueCount;
		if (statistics != null)
			chunkStatistics.mergeStatistics(statistics);
	}

	private BytesInput compress(byte[] toCompress)
	{
		byte[] compressed = new byte[compressor.maxCompressedLength(toCompress.length)];
		int compressedLen = compressor.compress(toCompress, compressed);
		if (compressedLen < compressed.length / 2)
			compressed = Arrays.copyOf(compressed, compressedLen);
		return BytesInput.from(compressed, 0, compressedLen);
	}

	@Override
	public long getMemSize()
	{
		return memSize;
	}

	public List<DataPage> getPages()
	{
		return Collections.unmodifiableList(pages);
	}

	/**
	 * @return the dictionary page or null if the chunk is not dictionary encoded
	 */
	public DictionaryPage getDictionaryPage()
	{
		return dictionaryPage;
	}

	public long getTotalValueCount()
	{
		return totalValueCount;
	}

	/**
	 * @return the statistics of all pages written so far
	 */
	public Statistics<?> getChunkStatistics()
	{
		return chunkStatistics;
	}

	public CompressionCodec getCompressionCodec()
	{
		return compressionCodec;
	}

	@Override
	public long allocatedSize()
	{
		// this store keeps only the bytes written
		return memSize;
	}

	@Override
	public void writeDictionaryPage(DictionaryPage dictionaryPage) throws IOException
	{
		if (this.dictionaryPage != null)
		{
			throw new ParquetEncodingException("Only one dictionary page per block");
		}
		this.memSize += dictionaryPage.getBytes().size();
		if (compressor != null)
		{
			if (dictionaryPage.getCompressedSize() != dictionaryPage.getUncompressedSize())
				throw new IllegalStateException("Dictionary should not be compressed at this point..");

			this.dictionaryPage = new DictionaryPage(compress(dictionaryPage.getBytes().toByteArray()),
					dictionaryPage.getUncompressedSize(), dictionaryPage.getDictionarySize(),
					dictionaryPage.getEncoding());
		}
		else
		{
			this.dictionaryPage = dictionaryPage.copy();
		}
		LOG.debug("dictionary page written for {} bytes and {} records", dictionaryPage.getBytes().size(),
				dictionaryPage.getDictionarySize());
	}

	@Override
	public String memUsageString(String prefix)
	{
		return String.format("%s %,d bytes", prefix, memSize);
	}
}
