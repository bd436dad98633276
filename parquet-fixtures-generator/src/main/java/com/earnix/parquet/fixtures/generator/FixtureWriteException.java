package com.earnix.parquet.fixtures.generator;

import java.io.IOException;

/**
 * A fatal failure to write one fixture file
 */
public class FixtureWriteException extends IOException
{
	private static final long serialVersionUID = 1L;

	public enum Stage
	{
		CREATE_FILE("Failed to create %s"),
		INITIALIZE_WRITER("Failed to create writer for %s"),
		WRITE_BATCH("Failed to write record to %s");

		private final String messageFormat;

		Stage(String messageFormat)
		{
			this.messageFormat = messageFormat;
		}

		String describe(String fileName)
		{
			return String.format(messageFormat, fileName);
		}
	}

	private final String fileName;
	private final Stage stage;

	public FixtureWriteException(String fileName, Stage stage, Throwable cause)
	{
		super(stage.describe(fileName) + " [" + stage.name() + "]: " + cause, cause);
		this.fileName = fileName;
		this.stage = stage;
	}

	public String getFileName()
	{
		return fileName;
	}

	public Stage getStage()
	{
		return stage;
	}
}
