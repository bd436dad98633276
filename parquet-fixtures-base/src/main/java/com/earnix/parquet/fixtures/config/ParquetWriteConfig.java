package com.earnix.parquet.fixtures.config;

import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.format.CompressionCodec;

import java.util.Objects;

/**
 * Settings for writing parquet files. The default configuration matches a stock parquet writer: no compression,
 * version 1 data pages with dictionary encoding, and very large row groups.
 */
public class ParquetWriteConfig
{
	/**
	 * Default maximum number of rows in a single row group
	 */
	public static final int DEFAULT_ROW_GROUP_ROW_LIMIT = 64 * 1024 * 1024;

	public static final int DEFAULT_ZSTD_COMPRESSION_LEVEL = 3;

	private final ParquetProperties parquetProperties;
	private final CompressionCodec compressionCodec;
	private final int zstdCompressionLevel;
	private final int rowGroupRowLimit;

	public ParquetWriteConfig()
	{
		this(ParquetProperties.builder().build(), CompressionCodec.UNCOMPRESSED);
	}

	public ParquetWriteConfig(ParquetProperties parquetProperties, CompressionCodec compressionCodec)
	{
		this(parquetProperties, compressionCodec, DEFAULT_ZSTD_COMPRESSION_LEVEL, DEFAULT_ROW_GROUP_ROW_LIMIT);
	}

	public ParquetWriteConfig(ParquetProperties parquetProperties, CompressionCodec compressionCodec,
			int zstdCompressionLevel, int rowGroupRowLimit)
	{
		this.parquetProperties = Objects.requireNonNull(parquetProperties, "parquetProperties");
		this.compressionCodec = Objects.requireNonNull(compressionCodec, "compressionCodec");
		if (rowGroupRowLimit <= 0)
			throw new IllegalArgumentException("rowGroupRowLimit must be positive: " + rowGroupRowLimit);
		this.zstdCompressionLevel = zstdCompressionLevel;
		this.rowGroupRowLimit = rowGroupRowLimit;
	}

	public ParquetProperties getParquetProperties()
	{
		return parquetProperties;
	}

	public CompressionCodec getCompressionCodec()
	{
		return compressionCodec;
	}

	public int getZstdCompressionLevel()
	{
		return zstdCompressionLevel;
	}

	public int getRowGroupRowLimit()
	{
		return rowGroupRowLimit;
	}

	/**
	 * @return the parquet footer format version matching the data pages this configuration writes
	 */
	public int getFormatVersion()
	{
		return parquetProperties.getWriterVersion() == ParquetProperties.WriterVersion.PARQUET_2_0 ? 2 : 1;
	}
}
