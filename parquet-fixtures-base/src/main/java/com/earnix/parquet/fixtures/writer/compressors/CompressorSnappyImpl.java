package com.earnix.parquet.fixtures.writer.compressors;

import org.xerial.snappy.Snappy;

import java.io.IOException;
import java.io.UncheckedIOException;

public class CompressorSnappyImpl implements Compressor
{
	@Override
	public int maxCompressedLength(int numBytes)
	{
		return Snappy.maxCompressedLength(numBytes);
	}

	@Override
	public int compress(byte[] input, byte[] output)
	{
		try
		{
			return Snappy.compress(input, 0, input.length, output, 0);
		}
		catch (IOException ex)
		{
			throw new UncheckedIOException(ex);
		}
	}

	@Override
	public byte[] decompress(byte[] input, int uncompressedSize)
	{
		try
		{
			byte[] uncompressed = Snappy.uncompress(input);
			if (uncompressed.length != uncompressedSize)
			{
				throw new IllegalStateException(
						"Expected " + uncompressedSize + " bytes after decompression, got " + uncompressed.length);
			}
			return uncompressed;
		}
		catch (IOException ex)
		{
			throw new UncheckedIOException(ex);
		}
	}
}
