package com.earnix.parquet.fixtures.file.writer;

import com.earnix.parquet.fixtures.batch.FixtureSchema;
import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import com.earnix.parquet.fixtures.writer.ParquetColumnarWriter;
import org.apache.parquet.schema.MessageType;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

public class ParquetFileColumnarWriterFactory
{
	/**
	 * Open a channel for a new parquet file. An existing file is truncated.
	 *
	 * @param outputFile the file to create
	 * @return the open channel
	 * @throws IOException if the file cannot be created
	 */
	public static FileChannel openOutputChannel(Path outputFile) throws IOException
	{
		return FileChannel.open(outputFile, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE,
				StandardOpenOption.CREATE);
	}

	/**
	 * Create a writer over an open channel. The writer takes ownership of the channel.
	 *
	 * @param fileChannel the channel from {@link #openOutputChannel(Path)}
	 * @param messageType the schema of the file
	 * @param config      the writing settings
	 * @return the writer
	 * @throws IllegalArgumentException if the schema cannot be written
	 */
	public static ParquetColumnarWriter createWriter(FileChannel fileChannel, MessageType messageType,
			ParquetWriteConfig config)
	{
		return new ParquetFileColumnarWriterImpl(fileChannel, messageType, config);
	}

	/**
	 * Create a new parquet file and a writer for it
	 *
	 * @param outputFile the file to create
	 * @param schema     the schema of the file
	 * @param config     the writing settings
	 * @return the writer
	 * @throws IOException if the file cannot be created
	 */
	public static ParquetColumnarWriter createWriter(Path outputFile, FixtureSchema schema, ParquetWriteConfig config)
			throws IOException
	{
		return createWriter(outputFile, schema.toMessageType(), config);
	}

	public static ParquetColumnarWriter createWriter(Path outputFile, MessageType messageType,
			ParquetWriteConfig config) throws IOException
	{
		FileChannel fileChannel = openOutputChannel(outputFile);
		boolean success = false;
		try
		{
			ParquetColumnarWriter writer = createWriter(fileChannel, messageType, config);
			success = true;
			return writer;
		}
		finally
		{
			if (!success)
				fileChannel.close();
		}
	}
}
