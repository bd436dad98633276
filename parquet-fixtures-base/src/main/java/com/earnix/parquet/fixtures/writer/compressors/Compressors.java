package com.earnix.parquet.fixtures.writer.compressors;

import org.apache.parquet.format.CompressionCodec;

import java.util.Optional;

public class Compressors
{
	// the level only matters when compressing
	private static final int DECOMPRESSION_LEVEL = 0;

	/**
	 * Get the compressor for a codec
	 *
	 * @param codec                the compression codec
	 * @param zstdCompressionLevel the level to use if the codec is zstd
	 * @return the compressor, or empty if the codec is {@link CompressionCodec#UNCOMPRESSED}
	 * @throws IllegalArgumentException on an unsupported codec
	 */
	public static Optional<Compressor> forCodec(CompressionCodec codec, int zstdCompressionLevel)
	{
		switch (codec)
		{
			case UNCOMPRESSED:
				return Optional.empty();
			case SNAPPY:
				return Optional.of(new CompressorSnappyImpl());
			case ZSTD:
				return Optional.of(new CompressorZstdImpl(zstdCompressionLevel));
			default:
				throw new IllegalArgumentException("Unsupported compression: " + codec);
		}
	}

	/**
	 * Decompress bytes
	 *
	 * @param codec            the codec the bytes were compressed with
	 * @param compressed       the compressed bytes
	 * @param uncompressedSize the expected size after decompression
	 * @return the uncompressed bytes
	 */
	public static byte[] decompress(CompressionCodec codec, byte[] compressed, int uncompressedSize)
	{
		Optional<Compressor> compressor = forCodec(codec, DECOMPRESSION_LEVEL);
		if (!compressor.isPresent())
			return compressed;
		return compressor.get().decompress(compressed, uncompressedSize);
	}
}
