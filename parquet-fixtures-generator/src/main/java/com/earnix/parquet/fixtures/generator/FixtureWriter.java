package com.earnix.parquet.fixtures.generator;

import com.earnix.parquet.fixtures.batch.FixtureSchema;
import com.earnix.parquet.fixtures.batch.RowBatch;
import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import com.earnix.parquet.fixtures.file.writer.ParquetFileColumnarWriterFactory;
import com.earnix.parquet.fixtures.writer.ParquetColumnarWriter;
import com.earnix.parquet.fixtures.writer.ParquetFileInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Serializes a row batch into a parquet file in the output directory
 */
public class FixtureWriter
{
	private static final Logger LOG = LoggerFactory.getLogger(FixtureWriter.class);

	private final Path outputDir;
	private final ParquetWriteConfig config;
	private final PrintStream out;

	public FixtureWriter(Path outputDir, ParquetWriteConfig config, PrintStream out)
	{
		this.outputDir = outputDir;
		this.config = config;
		this.out = out;
	}

	/**
	 * Create or truncate the file, write the batch as a single parquet file and close it.
	 *
	 * @param fileName the name of the file in the output directory
	 * @param schema   the schema of the file
	 * @param batch    the rows to write
	 * @throws FixtureWriteException naming the file and the stage that failed
	 */
	public void write(String fileName, FixtureSchema schema, RowBatch batch) throws FixtureWriteException
	{
		Path target = outputDir.resolve(fileName);

		FileChannel channel;
		try
		{
			channel = ParquetFileColumnarWriterFactory.openOutputChannel(target);
		}
		catch (IOException | RuntimeException ex)
		{
			throw new FixtureWriteException(fileName, FixtureWriteException.Stage.CREATE_FILE, ex);
		}

		ParquetColumnarWriter writer;
		try
		{
			writer = ParquetFileColumnarWriterFactory.createWriter(channel, schema.toMessageType(), config);
		}
		catch (RuntimeException ex)
		{
			FixtureWriteException failure = new FixtureWriteException(fileName,
					FixtureWriteException.Stage.INITIALIZE_WRITER, ex);
			closeAfterFailure(channel, failure);
			throw failure;
		}

		try (ParquetColumnarWriter fileWriter = writer)
		{
			fileWriter.writeRowBatch(batch);
			ParquetFileInfo fileInfo = fileWriter.finishAndWriteFooterMetadata();
			LOG.debug("Wrote {} rows to {} in {} bytes", batch.getNumRows(), target,
					fileInfo.getTotalParquetFileSize());
		}
		catch (IOException | RuntimeException ex)
		{
			throw new FixtureWriteException(fileName, FixtureWriteException.Stage.WRITE_BATCH, ex);
		}

		out.println("Successfully created " + fileName);
	}

	private static void closeAfterFailure(FileChannel channel, FixtureWriteException failure)
	{
		try
		{
			channel.close();
		}
		catch (IOException closeEx)
		{
			LOG.warn("Failed to close {} after failure", failure.getFileName(), closeEx);
			failure.addSuppressed(closeEx);
		}
	}
}
