package com.earnix.parquet.fixtures.generator;

import com.earnix.parquet.fixtures.batch.ColumnDefinition;
import com.earnix.parquet.fixtures.batch.ColumnType;
import com.earnix.parquet.fixtures.batch.ColumnValues;
import com.earnix.parquet.fixtures.batch.FixtureSchema;
import com.earnix.parquet.fixtures.batch.RowBatch;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class FixtureRecipeTest
{
	@Test
	public void testOrderAndFileNames()
	{
		Assert.assertEquals(Arrays.asList("minimal.parquet", "simple.parquet", "types.parquet"),
				Arrays.stream(FixtureRecipe.values()).map(FixtureRecipe::getFileName).collect(Collectors.toList()));
	}

	@Test
	public void testMinimal()
	{
		RowBatch batch = FixtureRecipe.MINIMAL.build();
		FixtureSchema schema = batch.getSchema();
		Assert.assertEquals(1, schema.getNumColumns());
		Assert.assertEquals("value", schema.getColumn(0).getName());
		Assert.assertEquals(ColumnType.INT32, schema.getColumn(0).getType());
		Assert.assertEquals(ColumnValues.ofInts(42), batch.getColumn("value"));
	}

	@Test
	public void testSimple()
	{
		RowBatch batch = FixtureRecipe.SIMPLE.build();
		Assert.assertEquals(5, batch.getNumRows());
		Assert.assertEquals(Arrays.asList("id", "name", "age"), columnNames(batch));
		Assert.assertEquals(ColumnValues.ofInts(1, 2, 3, 4, 5), batch.getColumn("id"));
		Assert.assertEquals(ColumnValues.ofStrings("Alice", "Bob", "Charlie", "Diana", "Eve"), batch.getColumn("name"));
		Assert.assertEquals(ColumnValues.ofInts(25, 30, 35, 28, 32), batch.getColumn("age"));
	}

	@Test
	public void testTypes()
	{
		RowBatch batch = FixtureRecipe.TYPES.build();
		Assert.assertEquals(3, batch.getNumRows());
		Assert.assertEquals(
				Arrays.asList("int32_col", "int64_col", "float32_col", "float64_col", "string_col", "bool_col"),
				columnNames(batch));
		Assert.assertEquals(Arrays.asList(ColumnType.INT32, ColumnType.INT64, ColumnType.FLOAT32, ColumnType.FLOAT64,
						ColumnType.STRING, ColumnType.BOOLEAN),
				batch.getSchema().getColumns().stream().map(ColumnDefinition::getType).collect(Collectors.toList()));
		Assert.assertArrayEquals(new float[] { 1.1f, 2.2f, 3.3f }, batch.getColumn("float32_col").toFloatArray(), 0f);
		Assert.assertArrayEquals(new double[] { 10.1, 20.2, 30.3 }, batch.getColumn("float64_col").toDoubleArray(),
				0d);
		Assert.assertArrayEquals(new boolean[] { true, false, true }, batch.getColumn("bool_col").toBooleanArray());
	}

	@Test
	public void testEachBuildIsFresh()
	{
		Assert.assertEquals(FixtureRecipe.TYPES.build(), FixtureRecipe.TYPES.build());
		Assert.assertNotSame(FixtureRecipe.TYPES.build(), FixtureRecipe.TYPES.build());
	}

	private static List<String> columnNames(RowBatch batch)
	{
		return batch.getSchema().getColumns().stream().map(ColumnDefinition::getName).collect(Collectors.toList());
	}
}
