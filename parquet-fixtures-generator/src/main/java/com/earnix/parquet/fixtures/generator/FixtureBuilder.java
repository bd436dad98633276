package com.earnix.parquet.fixtures.generator;

import com.earnix.parquet.fixtures.config.ParquetWriteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Generates the parquet fixture files in the working directory. Any failure aborts the run.
 */
public class FixtureBuilder
{
	private static final Logger LOG = LoggerFactory.getLogger(FixtureBuilder.class);

	private final FixtureWriter writer;
	private final PrintStream out;

	public FixtureBuilder(Path outputDir, PrintStream out)
	{
		this(new FixtureWriter(outputDir, new ParquetWriteConfig(), out), out);
	}

	FixtureBuilder(FixtureWriter writer, PrintStream out)
	{
		this.writer = writer;
		this.out = out;
	}

	/**
	 * Write every recipe in order and print the summary. Stops at the first failure, files written before it are
	 * kept.
	 *
	 * @throws FixtureWriteException for the first file that failed
	 */
	public void generateAll() throws FixtureWriteException
	{
		out.println("Generating spec-compliant Parquet test files...");
		for (FixtureRecipe recipe : FixtureRecipe.values())
		{
			out.println("Creating " + recipe.getFileName() + "...");
			recipe.writeWith(writer);
		}

		out.println("Done! Generated:");
		for (FixtureRecipe recipe : FixtureRecipe.values())
		{
			out.println("  - " + recipe.getFileName() + " (" + recipe.getDescription() + ")");
		}
	}

	public static void main(String[] args)
	{
		FixtureBuilder builder = new FixtureBuilder(Paths.get("").toAbsolutePath(), System.out);
		try
		{
			builder.generateAll();
		}
		catch (FixtureWriteException ex)
		{
			// the diagnostic goes to stderr once, the trace only when debugging
			LOG.debug("Generation aborted at stage {}", ex.getStage(), ex);
			System.err.println(ex.getMessage());
			System.exit(1);
		}
	}
}
