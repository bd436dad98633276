package com.earnix.parquet.fixtures.utils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;

/**
 * The magic bytes that open and close every parquet file
 */
public class ParquetMagicUtils
{
	public static final String PARQUET_MAGIC = "PAR1";
	private static final byte[] PARQUET_MAGIC_BYTES = PARQUET_MAGIC.getBytes(StandardCharsets.US_ASCII);

	/**
	 * @return the number of magic bytes
	 */
	public static int magicLength()
	{
		return PARQUET_MAGIC_BYTES.length;
	}

	/**
	 * Consume the magic from the buffer
	 *
	 * @param buf the byte buffer to check
	 * @return whether the buffer started with the magic
	 */
	public static boolean expectMagic(ByteBuffer buf)
	{
		if (buf.remaining() < PARQUET_MAGIC_BYTES.length)
			return false;
		for (byte magicByte : PARQUET_MAGIC_BYTES)
		{
			if (buf.get() != magicByte)
				return false;
		}
		return true;
	}

	public static void writeMagicBytes(WritableByteChannel channel) throws IOException
	{
		ByteBuffer bb = ByteBuffer.wrap(PARQUET_MAGIC_BYTES);
		do
		{
			int bytesWritten = channel.write(bb);
			if (bytesWritten <= 0)
				throw new IOException("Could not write magic bytes");
		}
		while (bb.hasRemaining());
	}
}
