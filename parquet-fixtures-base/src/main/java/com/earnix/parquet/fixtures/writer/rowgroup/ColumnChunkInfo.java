package com.earnix.parquet.fixtures.writer.rowgroup;

import com.earnix.parquet.fixtures.utils.ParquetEnumUtils;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkPages;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.ColumnMetaData;
import org.apache.parquet.format.Statistics;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;

/**
 * Metadata about a written column chunk and its placement within a parquet file
 */
public class ColumnChunkInfo
{
	private final ColumnChunkPages pages;
	private final long startingOffset;

	public ColumnChunkInfo(ColumnChunkPages pages, long startingOffset)
	{
		this.pages = pages;
		this.startingOffset = startingOffset;
	}

	public ColumnDescriptor getDescriptor()
	{
		return pages.getColumnDescriptor();
	}

	/**
	 * @return the offset of this column chunk within the parquet file
	 */
	public long getStartingOffset()
	{
		return startingOffset;
	}

	/**
	 * @return the constructed {@link ColumnChunk} for this column chunk
	 */
	public ColumnChunk buildChunkFromInfo()
	{
		ColumnChunk columnChunk = new ColumnChunk();
		columnChunk.setFile_offset(startingOffset);
		columnChunk.setMeta_data(getColumnMetaData());
		return columnChunk;
	}

	private ColumnMetaData getColumnMetaData()
	{
		ColumnMetaData columnMetaData = new ColumnMetaData();

		if (pages.hasDictionaryPage())
		{
			columnMetaData.setDictionary_page_offset(startingOffset);
			columnMetaData.setData_page_offset(startingOffset + pages.getDictionaryPageBytes());
		}
		else
		{
			columnMetaData.setData_page_offset(startingOffset);
		}
		columnMetaData.setTotal_compressed_size(pages.totalBytesForStorage());
		columnMetaData.setTotal_uncompressed_size(pages.getUncompressedBytes());
		columnMetaData.setNum_values(pages.getNumValues());

		columnMetaData.setPath_in_schema(Arrays.asList(getDescriptor().getPath()));
		columnMetaData.setType(ParquetEnumUtils.convert(getDescriptor().getPrimitiveType().getPrimitiveTypeName()));

		// the set of all encodings
		columnMetaData.setEncodings(new ArrayList<>(pages.getEncodingSet()));

		columnMetaData.setCodec(pages.getCompressionCodec());
		Statistics statistics = toFormatStatistics(pages.getStatistics());
		if (statistics != null)
			columnMetaData.setStatistics(statistics);
		return columnMetaData;
	}

	private static Statistics toFormatStatistics(org.apache.parquet.column.statistics.Statistics<?> stats)
	{
		if (stats == null || stats.isEmpty())
			return null;

		Statistics formatStats = new Statistics();
		formatStats.setNull_count(stats.getNumNulls());
		if (stats.hasNonNullValue())
		{
			formatStats.setMin_value(ByteBuffer.wrap(stats.getMinBytes()));
			formatStats.setMax_value(ByteBuffer.wrap(stats.getMaxBytes()));
		}
		return formatStats;
	}

	/**
	 * @return the compressed size of this chunk including the page headers. See:
	 *        {@link ColumnMetaData#total_compressed_size}
	 */
	public long getCompressedSize()
	{
		return pages.totalBytesForStorage();
	}

	/**
	 * @return the uncompressed size of this chunk including the page headers. See:
	 *        {@link ColumnMetaData#total_uncompressed_size}
	 */
	public long getUncompressedSize()
	{
		return pages.getUncompressedBytes();
	}
}
