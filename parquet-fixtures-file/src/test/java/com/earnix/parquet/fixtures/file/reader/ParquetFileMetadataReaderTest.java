package com.earnix.parquet.fixtures.file.reader;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertThrows;

public class ParquetFileMetadataReaderTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testTooSmall() throws IOException
	{
		Path file = folder.newFile("small.parquet").toPath();
		Files.write(file, "PAR1PAR1".getBytes(StandardCharsets.US_ASCII));
		IOException ex = assertThrows(IOException.class, () -> ParquetFileMetadataReader.readFileMetadata(file));
		Assert.assertTrue(ex.getMessage().contains("too small"));
	}

	@Test
	public void testMissingTrailingMagic() throws IOException
	{
		Path file = folder.newFile("text.parquet").toPath();
		Files.write(file, "PAR1 this is not a parquet file".getBytes(StandardCharsets.US_ASCII));
		IOException ex = assertThrows(IOException.class, () -> ParquetFileMetadataReader.readFileMetadata(file));
		Assert.assertTrue(ex.getMessage().contains("trailing"));
	}

	@Test
	public void testMissingLeadingMagic() throws IOException
	{
		Path file = folder.newFile("lead.parquet").toPath();
		byte[] bytes = new byte[] { 'X', 'X', 'X', 'X', 0, 1, 0, 0, 0, 'P', 'A', 'R', '1' };
		Files.write(file, bytes);
		IOException ex = assertThrows(IOException.class, () -> ParquetFileMetadataReader.readFileMetadata(file));
		Assert.assertTrue(ex.getMessage().contains("leading"));
	}

	@Test
	public void testInvalidFooterLength() throws IOException
	{
		Path file = folder.newFile("len.parquet").toPath();
		byte[] bytes = new byte[] { 'P', 'A', 'R', '1', 0, 100, 0, 0, 0, 'P', 'A', 'R', '1' };
		Files.write(file, bytes);
		IOException ex = assertThrows(IOException.class, () -> ParquetFileMetadataReader.readFileMetadata(file));
		Assert.assertTrue(ex.getMessage().contains("Invalid footer length"));
	}
}
