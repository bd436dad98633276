package com.earnix.parquet.fixtures.file.reader;

import com.earnix.parquet.fixtures.batch.ColumnValues;
import com.earnix.parquet.fixtures.batch.FixtureSchema;
import com.earnix.parquet.fixtures.batch.RowBatch;
import com.earnix.parquet.fixtures.reader.ParquetMetadataUtils;
import com.earnix.parquet.fixtures.reader.ParquetReaderUtils;
import com.earnix.parquet.fixtures.reader.chunk.ColumnValuesChunkReader;
import com.earnix.parquet.fixtures.reader.chunk.internal.InMemChunk;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.ColumnMetaData;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.RowGroup;
import org.apache.parquet.schema.MessageType;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.earnix.parquet.fixtures.reader.ParquetReaderUtils.getLen;
import static com.earnix.parquet.fixtures.reader.ParquetReaderUtils.getStartOffset;

/**
 * Read a flat parquet file column by column, decoding every row group into a {@link RowBatch}
 */
public class ParquetColumnarFileReader
{
	private final Path parquetFilePath;
	private FileMetaData metaData;
	private MessageType messageType;
	private FixtureSchema schema;

	public ParquetColumnarFileReader(Path parquetFilePath)
	{
		this.parquetFilePath = parquetFilePath;
	}

	public FileMetaData readMetaData() throws IOException
	{
		if (metaData == null)
			metaData = ParquetFileMetadataReader.readFileMetadata(parquetFilePath);
		return metaData;
	}

	/**
	 * @return the schema stored in the footer, logical types included
	 * @throws IOException on failure to read the footer or an unsupported schema
	 */
	public MessageType getMessageType() throws IOException
	{
		if (messageType == null)
			messageType = ParquetMetadataUtils.buildMessageType(readMetaData());
		return messageType;
	}

	/**
	 * @return the schema as fixture columns
	 * @throws IOException on failure to read the footer
	 * @throws IllegalArgumentException if a column type is not supported
	 */
	public FixtureSchema getSchema() throws IOException
	{
		if (schema == null)
			schema = FixtureSchema.fromMessageType(getMessageType());
		return schema;
	}

	public int getNumRowGroups() throws IOException
	{
		return readMetaData().getRow_groupsSize();
	}

	public long getNumRowsInRowGroup(int rowGroup) throws IOException
	{
		return readMetaData().getRow_groups().get(rowGroup).getNum_rows();
	}

	public long getTotalNumRows() throws IOException
	{
		return readMetaData().getNum_rows();
	}

	/**
	 * Read a single column chunk with its pages decompressed
	 *
	 * @param rowGroup the index of the row group
	 * @param column   the index of the column in the schema
	 * @return the chunk
	 * @throws IOException on failure to read
	 */
	public InMemChunk readChunk(int rowGroup, int column) throws IOException
	{
		try (FileChannel fc = FileChannel.open(parquetFilePath))
		{
			RowGroup group = readMetaData().getRow_groups().get(rowGroup);
			return readChunk(fc, group, getMessageType().getColumns().get(column));
		}
	}

	/**
	 * @param rowGroup the index of the row group
	 * @return all rows of the row group
	 * @throws IOException on failure to read
	 */
	public RowBatch readRowGroup(int rowGroup) throws IOException
	{
		try (FileChannel fc = FileChannel.open(parquetFilePath))
		{
			return readRowGroup(fc, readMetaData().getRow_groups().get(rowGroup));
		}
	}

	public List<RowBatch> readRowGroups() throws IOException
	{
		List<RowBatch> batches = new ArrayList<>(getNumRowGroups());
		try (FileChannel fc = FileChannel.open(parquetFilePath))
		{
			for (RowGroup rowGroup : readMetaData().getRow_groups())
			{
				batches.add(readRowGroup(fc, rowGroup));
			}
		}
		return batches;
	}

	/**
	 * @return all rows of the file in a single batch
	 * @throws IOException on failure to read
	 */
	public RowBatch readAll() throws IOException
	{
		List<RowBatch> batches = readRowGroups();
		if (batches.isEmpty())
			throw new IOException("File " + parquetFilePath + " has no row groups");
		return RowBatch.concat(batches);
	}

	private RowBatch readRowGroup(FileChannel fc, RowGroup rowGroup) throws IOException
	{
		List<ColumnDescriptor> descriptors = getMessageType().getColumns();
		List<ColumnValues> columns = new ArrayList<>(descriptors.size());
		for (ColumnDescriptor descriptor : descriptors)
		{
			ColumnValues values = ColumnValuesChunkReader.readValues(readChunk(fc, rowGroup, descriptor));
			if (values.size() != rowGroup.getNum_rows())
			{
				throw new IOException(
						"Column " + descriptor + " has " + values.size() + " values but the row group has "
								+ rowGroup.getNum_rows() + " rows");
			}
			columns.add(values);
		}
		return new RowBatch(getSchema(), columns);
	}

	private InMemChunk readChunk(FileChannel fc, RowGroup rowGroup, ColumnDescriptor descriptor) throws IOException
	{
		ColumnChunk columnChunk = findChunk(rowGroup, descriptor);
		ColumnMetaData columnMetaData = columnChunk.getMeta_data();
		fc.position(getStartOffset(columnChunk));
		return ParquetReaderUtils.readInMemChunk(descriptor, Channels.newInputStream(fc), getLen(columnChunk),
				columnMetaData.getCodec());
	}

	private static ColumnChunk findChunk(RowGroup rowGroup, ColumnDescriptor descriptor) throws IOException
	{
		for (ColumnChunk columnChunk : rowGroup.getColumns())
		{
			// we don't support getting chunks from other files.
			if (columnChunk.getFile_path() != null)
				throw new UnsupportedEncodingException("Chunk in external file " + columnChunk.getFile_path());
			if (columnChunk.getMeta_data().getPath_in_schema().equals(Arrays.asList(descriptor.getPath())))
				return columnChunk;
		}
		throw new IOException("Row group has no chunk for column " + descriptor);
	}
}
