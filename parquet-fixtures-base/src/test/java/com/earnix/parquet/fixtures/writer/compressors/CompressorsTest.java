package com.earnix.parquet.fixtures.writer.compressors;

import org.apache.parquet.format.CompressionCodec;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.Assert.assertThrows;

public class CompressorsTest
{
	private static final byte[] DATA = "Alice Bob Charlie Diana Eve Alice Bob Charlie Diana Eve"
			.getBytes(StandardCharsets.UTF_8);

	@Test
	public void testUncompressedHasNoCompressor()
	{
		Assert.assertFalse(Compressors.forCodec(CompressionCodec.UNCOMPRESSED, 3).isPresent());
		Assert.assertSame(DATA, Compressors.decompress(CompressionCodec.UNCOMPRESSED, DATA, DATA.length));
	}

	@Test
	public void testSnappy()
	{
		checkCompressor(CompressionCodec.SNAPPY);
	}

	@Test
	public void testZstd()
	{
		checkCompressor(CompressionCodec.ZSTD);
	}

	@Test
	public void testUnsupportedCodec()
	{
		assertThrows(IllegalArgumentException.class, () -> Compressors.forCodec(CompressionCodec.LZO, 3));
	}

	private static void checkCompressor(CompressionCodec codec)
	{
		Optional<Compressor> compressor = Compressors.forCodec(codec, 3);
		Assert.assertTrue(compressor.isPresent());
		byte[] out = new byte[compressor.get().maxCompressedLength(DATA.length)];
		int len = compressor.get().compress(DATA, out);
		Assert.assertTrue(len > 0);
		byte[] compressed = Arrays.copyOf(out, len);
		Assert.assertArrayEquals(DATA, Compressors.decompress(codec, compressed, DATA.length));
	}
}
