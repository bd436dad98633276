package com.earnix.parquet.fixtures.generator;

import com.earnix.parquet.fixtures.batch.ColumnDefinition;
import com.earnix.parquet.fixtures.batch.ColumnType;
import com.earnix.parquet.fixtures.batch.ColumnValues;
import com.earnix.parquet.fixtures.batch.FixtureSchema;
import com.earnix.parquet.fixtures.batch.RowBatch;

/**
 * The fixture files, in the order they are generated. Each recipe builds a fresh batch with hard coded values.
 */
public enum FixtureRecipe
{
	/**
	 * Simplest possible case
	 */
	MINIMAL("minimal.parquet", "1 column, 1 row")
	{
		@Override
		public RowBatch build()
		{
			FixtureSchema schema = FixtureSchema.of(ColumnDefinition.of("value", ColumnType.INT32));
			return RowBatch.of(schema, ColumnValues.ofInts(42));
		}
	},

	/**
	 * Basic multi-column case
	 */
	SIMPLE("simple.parquet", "3 columns, 5 rows")
	{
		@Override
		public RowBatch build()
		{
			FixtureSchema schema = FixtureSchema.of(//
					ColumnDefinition.of("id", ColumnType.INT32),//
					ColumnDefinition.of("name", ColumnType.STRING),//
					ColumnDefinition.of("age", ColumnType.INT32));
			return RowBatch.of(schema,//
					ColumnValues.ofInts(1, 2, 3, 4, 5),//
					ColumnValues.ofStrings("Alice", "Bob", "Charlie", "Diana", "Eve"),//
					ColumnValues.ofInts(25, 30, 35, 28, 32));
		}
	},

	/**
	 * All major data types
	 */
	TYPES("types.parquet", "6 columns, 3 rows, all major types")
	{
		@Override
		public RowBatch build()
		{
			FixtureSchema schema = FixtureSchema.of(//
					ColumnDefinition.of("int32_col", ColumnType.INT32),//
					ColumnDefinition.of("int64_col", ColumnType.INT64),//
					ColumnDefinition.of("float32_col", ColumnType.FLOAT32),//
					ColumnDefinition.of("float64_col", ColumnType.FLOAT64),//
					ColumnDefinition.of("string_col", ColumnType.STRING),//
					ColumnDefinition.of("bool_col", ColumnType.BOOLEAN));
			return RowBatch.of(schema,//
					ColumnValues.ofInts(1, 2, 3),//
					ColumnValues.ofLongs(100L, 200L, 300L),//
					ColumnValues.ofFloats(1.1f, 2.2f, 3.3f),//
					ColumnValues.ofDoubles(10.1, 20.2, 30.3),//
					ColumnValues.ofStrings("foo", "bar", "baz"),//
					ColumnValues.ofBooleans(true, false, true));
		}
	};

	private final String fileName;
	private final String description;

	FixtureRecipe(String fileName, String description)
	{
		this.fileName = fileName;
		this.description = description;
	}

	public String getFileName()
	{
		return fileName;
	}

	/**
	 * @return a short description of the shape of the file, e.g. "1 column, 1 row"
	 */
	public String getDescription()
	{
		return description;
	}

	public abstract RowBatch build();

	/**
	 * Build the batch and write it with the writer
	 *
	 * @param writer the writer for the output directory
	 * @throws FixtureWriteException if the file could not be written
	 */
	public void writeWith(FixtureWriter writer) throws FixtureWriteException
	{
		RowBatch batch = build();
		writer.write(fileName, batch.getSchema(), batch);
	}
}
