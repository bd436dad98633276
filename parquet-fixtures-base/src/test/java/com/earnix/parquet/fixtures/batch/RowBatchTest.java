package com.earnix.parquet.fixtures.batch;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertThrows;

public class RowBatchTest
{
	private static final FixtureSchema SCHEMA = FixtureSchema.of(//
			ColumnDefinition.of("id", ColumnType.INT32),//
			ColumnDefinition.of("name", ColumnType.STRING));

	@Test
	public void testColumnsMustHaveEqualLength()
	{
		assertThrows(IllegalArgumentException.class,
				() -> RowBatch.of(SCHEMA, ColumnValues.ofInts(1, 2), ColumnValues.ofStrings("a")));
	}

	@Test
	public void testColumnTypesMustMatchSchema()
	{
		assertThrows(IllegalArgumentException.class,
				() -> RowBatch.of(SCHEMA, ColumnValues.ofLongs(1L), ColumnValues.ofStrings("a")));
	}

	@Test
	public void testColumnCountMustMatchSchema()
	{
		assertThrows(IllegalArgumentException.class, () -> RowBatch.of(SCHEMA, ColumnValues.ofInts(1)));
	}

	@Test
	public void testNullColumnNamedInError()
	{
		NullPointerException first = assertThrows(NullPointerException.class,
				() -> RowBatch.of(SCHEMA, null, ColumnValues.ofStrings("a")));
		Assert.assertEquals("id", first.getMessage());

		NullPointerException second = assertThrows(NullPointerException.class,
				() -> RowBatch.of(SCHEMA, ColumnValues.ofInts(1), null));
		Assert.assertEquals("name", second.getMessage());
	}

	@Test
	public void testLookupByName()
	{
		RowBatch batch = RowBatch.of(SCHEMA, ColumnValues.ofInts(1, 2), ColumnValues.ofStrings("a", "b"));
		Assert.assertEquals(2, batch.getNumRows());
		Assert.assertEquals(ColumnValues.ofStrings("a", "b"), batch.getColumn("name"));
		assertThrows(IllegalArgumentException.class, () -> batch.getColumn("age"));
	}

	@Test
	public void testSliceAndConcatKeepOrder()
	{
		RowBatch batch = RowBatch.of(SCHEMA, ColumnValues.ofInts(1, 2, 3, 4, 5),
				ColumnValues.ofStrings("a", "b", "c", "d", "e"));
		RowBatch first = batch.slice(0, 2);
		RowBatch second = batch.slice(2, 5);
		Assert.assertEquals(RowBatch.of(SCHEMA, ColumnValues.ofInts(1, 2), ColumnValues.ofStrings("a", "b")), first);
		Assert.assertEquals(3, second.getNumRows());
		Assert.assertEquals(batch, RowBatch.concat(Arrays.asList(first, second)));
	}

	@Test
	public void testConcatRejectsDifferentSchemas()
	{
		RowBatch batch = RowBatch.of(SCHEMA, ColumnValues.ofInts(1), ColumnValues.ofStrings("a"));
		RowBatch other = RowBatch.of(FixtureSchema.of(ColumnDefinition.of("id", ColumnType.INT32)),
				ColumnValues.ofInts(1));
		assertThrows(IllegalArgumentException.class, () -> RowBatch.concat(Arrays.asList(batch, other)));
	}
}
