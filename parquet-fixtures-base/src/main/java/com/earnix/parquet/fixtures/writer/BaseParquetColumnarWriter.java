package com.earnix.parquet.fixtures.writer;

import com.earnix.parquet.fixtures.batch.ColumnType;
import com.earnix.parquet.fixtures.batch.ColumnValues;
import com.earnix.parquet.fixtures.batch.FixtureSchema;
import com.earnix.parquet.fixtures.batch.RowBatch;
import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import com.earnix.parquet.fixtures.writer.rowgroup.RowGroupInfo;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.KeyValue;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * an abstract class containing fields common to ParquetWriters.
 */
public abstract class BaseParquetColumnarWriter implements ParquetColumnarWriter
{
	private static final Logger LOG = LoggerFactory.getLogger(BaseParquetColumnarWriter.class);

	private final MessageType messageType;

	protected final ParquetWriteConfig config;
	protected final List<RowGroupInfo> rowGroupInfos = new ArrayList<>();
	private final List<KeyValue> keyValues = new ArrayList<>();

	protected BaseParquetColumnarWriter(MessageType messageType, ParquetWriteConfig config)
	{
		this.messageType = requireNonNull(messageType, "messageType");
		this.config = requireNonNull(config, "config");
		validateMessageType(messageType);
	}

	private static void validateMessageType(MessageType messageType)
	{
		if (messageType.getColumns().isEmpty())
			throw new IllegalArgumentException("Schema has no columns: " + messageType);
		for (ColumnDescriptor desc : messageType.getColumns())
		{
			validateDescriptor(desc);
		}
	}

	private static void validateDescriptor(ColumnDescriptor desc)
	{
		if (desc.getPath().length > 1)
			throw new IllegalArgumentException("Nesting not supported : " + desc);

		if (desc.getPrimitiveType().getRepetition() != Type.Repetition.REQUIRED)
			throw new IllegalArgumentException("Not supported repetition type: " + desc);

		// rejects physical types and annotations that have no column type
		ColumnType.fromPrimitiveType(desc.getPrimitiveType());
	}

	protected MessageType getMessageType()
	{
		return messageType;
	}

	@Override
	public void writeRowBatch(RowBatch rowBatch) throws IOException
	{
		FixtureSchema schema = rowBatch.getSchema();
		if (!schema.toMessageType().equals(messageType))
		{
			throw new IllegalArgumentException(
					"Batch schema " + schema.toMessageType() + " does not match file schema " + messageType);
		}
		if (rowBatch.getNumRows() == 0)
			throw new IllegalArgumentException("Cannot write an empty batch");

		List<ColumnDescriptor> descriptors = messageType.getColumns();
		int rowLimit = config.getRowGroupRowLimit();
		for (int from = 0; from < rowBatch.getNumRows(); from += rowLimit)
		{
			RowBatch rowGroup = rowBatch.slice(from, Math.min(rowBatch.getNumRows(), from + rowLimit));
			LOG.debug("Writing row group of {} rows starting at row {}", rowGroup.getNumRows(), from);
			writeRowGroup(rowGroup.getNumRows(), rowGroupWriter -> {
				for (int col = 0; col < descriptors.size(); col++)
				{
					ColumnValues values = rowGroup.getColumn(col);
					ColumnDescriptor descriptor = descriptors.get(col);
					rowGroupWriter.writeValues(columnChunkWriter -> values.writeTo(columnChunkWriter, descriptor));
				}
			});
		}
	}

	protected FileMetaData buildFileMetadata()
	{
		if (rowGroupInfos.isEmpty())
			throw new IllegalStateException("cannot build parquet file without row groups");
		return ParquetWriterUtils.getFileMetaData(messageType, rowGroupInfos, keyValues, config.getFormatVersion());
	}

	@Override
	public void addKeyValue(KeyValue keyValue)
	{
		this.keyValues.add(new KeyValue(keyValue));
	}
}
