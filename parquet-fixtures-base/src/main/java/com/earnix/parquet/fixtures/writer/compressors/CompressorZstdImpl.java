package com.earnix.parquet.fixtures.writer.compressors;

import com.github.luben.zstd.Zstd;

public class CompressorZstdImpl implements Compressor
{
	private final int compressionLevel;

	public CompressorZstdImpl(int compressionLevel)
	{
		this.compressionLevel = compressionLevel;
	}

	@Override
	public int compress(byte[] input, byte[] output)
	{
		long compressedSize = Zstd.compress(output, input, compressionLevel);
		if (Zstd.isError(compressedSize))
		{
			throw new IllegalStateException("Error compressing bytes: " + Zstd.getErrorName(compressedSize));
		}
		return Math.toIntExact(compressedSize);
	}

	@Override
	public int maxCompressedLength(int numBytes)
	{
		return Math.toIntExact(Zstd.compressBound(numBytes));
	}

	@Override
	public byte[] decompress(byte[] input, int uncompressedSize)
	{
		byte[] uncompressed = new byte[uncompressedSize];
		long code = Zstd.decompress(uncompressed, input);
		if (Zstd.isError(code))
			throw new IllegalStateException(Zstd.getErrorName(code));
		return uncompressed;
	}

	public int getCompressionLevel()
	{
		return compressionLevel;
	}
}
