package com.earnix.parquet.fixtures.reader;

import com.earnix.parquet.fixtures.reader.chunk.internal.ChunkDecompressToPageStoreFactory;
import com.earnix.parquet.fixtures.reader.chunk.internal.InMemChunk;
import com.earnix.parquet.fixtures.utils.ParquetMagicUtils;
import org.apache.commons.io.IOUtils;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.CompressionCodec;

import java.io.IOException;
import java.io.InputStream;

public class ParquetReaderUtils
{
	/**
	 * @param columnChunk the chunk to get the length of
	 * @return the length of the column chunk as stored in the parquet file
	 */
	public static long getLen(ColumnChunk columnChunk)
	{
		return columnChunk.getMeta_data().getTotal_compressed_size();
	}

	/**
	 * @param columnChunk the column chunk metadata
	 * @return the start offset of the column chunk in the parquet file.
	 */
	public static long getStartOffset(ColumnChunk columnChunk)
	{
		long startOffset = columnChunk.getMeta_data().getData_page_offset();

		// only use the dictionary as the start offset if it is valid. This should match the logic in the open source
		// java parquet driver in ParquetMetadataConverter.getOffset()
		if (columnChunk.getMeta_data().isSetDictionary_page_offset()
				&& columnChunk.getMeta_data().getDictionary_page_offset() > 0L
				&& columnChunk.getMeta_data().getDictionary_page_offset() < startOffset)
		{
			startOffset = columnChunk.getMeta_data().getDictionary_page_offset();
		}

		if (startOffset < ParquetMagicUtils.magicLength())
			throw new IllegalArgumentException("Corrupted chunk metadata invalid startOffset.");

		return startOffset;
	}

	/**
	 * Read a whole column chunk from the stream and decompress its pages
	 *
	 * @param colDescriptor    the column of the chunk
	 * @param is               the stream positioned at the start of the chunk. It is not closed
	 * @param chunkLen         the length of the chunk as stored
	 * @param compressionCodec the codec the pages were compressed with
	 * @return the decompressed chunk
	 * @throws IOException on failure to read the chunk
	 */
	public static InMemChunk readInMemChunk(ColumnDescriptor colDescriptor, InputStream is, long chunkLen,
			CompressionCodec compressionCodec) throws IOException
	{
		byte[] chunkBytes = IOUtils.toByteArray(is, chunkLen);
		return ChunkDecompressToPageStoreFactory.buildInMemChunk(colDescriptor, chunkBytes, compressionCodec);
	}
}
