package com.earnix.parquet.fixtures.file.reader;

import com.earnix.parquet.fixtures.utils.ParquetMagicUtils;
import org.apache.commons.io.IOUtils;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Reads the footer of a local parquet file after validating the magic at both ends
 */
public class ParquetFileMetadataReader
{
	private static final Logger LOG = LoggerFactory.getLogger(ParquetFileMetadataReader.class);

	public static FileMetaData readFileMetadata(Path path) throws IOException
	{
		try (FileChannel fc = FileChannel.open(path))
		{
			return readMetadata(fc);
		}
	}

	static FileMetaData readMetadata(FileChannel fc) throws IOException
	{
		long startPos = validateMagicAndFindFooter(fc);
		fc.position(startPos);
		return Util.readFileMetaData(Channels.newInputStream(fc));
	}

	private static long validateMagicAndFindFooter(FileChannel fc) throws IOException
	{
		// we want to read the integer length of the footer, and then the magic bytes.
		int numBytesToRead = Integer.BYTES + ParquetMagicUtils.magicLength();
		long fileSize = fc.size();
		if (fileSize < ParquetMagicUtils.magicLength() + numBytesToRead)
			throw new IOException("File of " + fileSize + " bytes is too small to be a parquet file");

		ByteBuffer buf = ByteBuffer.allocate(numBytesToRead);
		buf.order(ByteOrder.LITTLE_ENDIAN);// the footer length is little endian

		// position right before the end of the file
		fc.position(fileSize - numBytesToRead);
		IOUtils.readFully(fc, buf);
		buf.flip();
		int numBytesInFooter = buf.getInt();
		LOG.debug("Footer is {} bytes", numBytesInFooter);

		if (!ParquetMagicUtils.expectMagic(buf))
			throw new IOException("Missing trailing " + ParquetMagicUtils.PARQUET_MAGIC + " magic");

		buf.clear();
		buf.limit(ParquetMagicUtils.magicLength());
		fc.position(0L);
		IOUtils.readFully(fc, buf);
		buf.flip();
		if (!ParquetMagicUtils.expectMagic(buf))
			throw new IOException("Missing leading " + ParquetMagicUtils.PARQUET_MAGIC + " magic");

		long startPos = fileSize - numBytesInFooter - numBytesToRead;
		if (numBytesInFooter <= 0 || startPos < ParquetMagicUtils.magicLength())
			throw new IOException("Invalid footer length " + numBytesInFooter + " for file of " + fileSize + " bytes");
		return startPos;
	}
}
