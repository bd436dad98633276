package com.earnix.parquet.fixtures.file.writer;

import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import com.earnix.parquet.fixtures.utils.ParquetMagicUtils;
import com.earnix.parquet.fixtures.writer.BaseParquetColumnarWriter;
import com.earnix.parquet.fixtures.writer.ParquetFileInfo;
import com.earnix.parquet.fixtures.writer.ParquetWriterUtils;
import com.earnix.parquet.fixtures.writer.rowgroup.RowGroupInfo;
import com.earnix.parquet.fixtures.writer.rowgroup.RowGroupWriter;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.schema.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;

/**
 * Writes a parquet file to a local file channel: the leading magic, the row groups in order, then the footer. The
 * channel is owned by this writer and closed by {@link #close()}.
 */
public class ParquetFileColumnarWriterImpl extends BaseParquetColumnarWriter
{
	private static final Logger LOG = LoggerFactory.getLogger(ParquetFileColumnarWriterImpl.class);

	private final FileChannel fileChannel;
	private FileRowGroupWriterImpl lastWriter = null;
	private long offsetInFile = 0;
	private boolean finished = false;

	ParquetFileColumnarWriterImpl(FileChannel fileChannel, MessageType messageType, ParquetWriteConfig config)
	{
		super(messageType, config);
		this.fileChannel = fileChannel;
	}

	@Override
	public RowGroupWriter startNewRowGroup(long numRows) throws IOException
	{
		if (finished)
			throw new IllegalStateException("Footer already written");
		if (lastWriter != null)
		{
			throw new IllegalStateException("Last writer was not closed");
		}
		if (rowGroupInfos.isEmpty() && offsetInFile == 0)
		{
			fileChannel.position(0L);
			ParquetMagicUtils.writeMagicBytes(fileChannel);
			offsetInFile = fileChannel.position();
		}

		lastWriter = new FileRowGroupWriterImpl(getMessageType(), config, numRows, fileChannel, offsetInFile);
		return lastWriter;
	}

	@Override
	public RowGroupWriter getCurrentRowGroupWriter()
	{
		return lastWriter;
	}

	@Override
	public void finishRowGroup() throws IOException
	{
		if (lastWriter == null)
			throw new IllegalStateException("No row group was started");
		RowGroupInfo rowGrpInfo;
		try
		{
			rowGrpInfo = lastWriter.closeAndValidateAllColumnsWritten();
		}
		finally
		{
			lastWriter = null;
		}
		offsetInFile += rowGrpInfo.getCompressedSize();
		rowGroupInfos.add(rowGrpInfo);
		LOG.debug("Finished row group {} with {} rows and {} bytes", rowGroupInfos.size() - 1,
				rowGrpInfo.getNumRows(), rowGrpInfo.getCompressedSize());
	}

	@Override
	public ParquetFileInfo finishAndWriteFooterMetadata() throws IOException
	{
		if (lastWriter != null)
			throw new IllegalStateException("Last writer was not closed");
		if (finished)
			throw new IllegalStateException("Footer already written");

		long footerMetadataOffset = offsetInFile;
		FileMetaData fileMetaData = buildFileMetadata();
		fileChannel.position(footerMetadataOffset);
		offsetInFile += ParquetWriterUtils.writeFooterMetadataAndMagic(fileChannel, fileMetaData);
		finished = true;

		LOG.debug("Wrote footer at offset {}, file size {}", footerMetadataOffset, offsetInFile);
		return new ParquetFileInfo(footerMetadataOffset, offsetInFile, getMessageType(), fileMetaData);
	}

	@Override
	public void close() throws IOException
	{
		if (!finished)
			LOG.warn("Closing parquet file before the footer was written, the file is incomplete");
		fileChannel.close();
	}
}
