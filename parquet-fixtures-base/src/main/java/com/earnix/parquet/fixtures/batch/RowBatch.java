package com.earnix.parquet.fixtures.batch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A schema together with one {@link ColumnValues} per column. All columns contain the same number of rows. This class
 * is immutable.
 */
public final class RowBatch
{
	private final FixtureSchema schema;
	private final List<ColumnValues> columns;
	private final int numRows;

	public RowBatch(FixtureSchema schema, List<ColumnValues> columns)
	{
		this.schema = Objects.requireNonNull(schema, "schema");
		if (columns.size() != schema.getNumColumns())
		{
			throw new IllegalArgumentException(
					"Expected " + schema.getNumColumns() + " columns for schema " + schema + " but got "
							+ columns.size());
		}

		for (int i = 0; i < columns.size(); i++)
		{
			Objects.requireNonNull(columns.get(i), schema.getColumn(i).getName());
		}

		int rows = columns.get(0).size();
		for (int i = 0; i < columns.size(); i++)
		{
			ColumnDefinition definition = schema.getColumn(i);
			ColumnValues column = columns.get(i);
			if (column.getType() != definition.getType())
			{
				throw new IllegalArgumentException(
						"Column " + definition.getName() + " is " + definition.getType() + " but values are "
								+ column.getType());
			}
			if (column.size() != rows)
			{
				throw new IllegalArgumentException(
						"Column " + definition.getName() + " has " + column.size() + " rows, expected " + rows);
			}
		}
		this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
		this.numRows = rows;
	}

	public static RowBatch of(FixtureSchema schema, ColumnValues... columns)
	{
		return new RowBatch(schema, Arrays.asList(columns));
	}

	/**
	 * Concatenate batches with the same schema into a single batch, keeping row order
	 *
	 * @param batches the batches to concatenate. Must not be empty
	 * @return the concatenated batch
	 */
	public static RowBatch concat(List<RowBatch> batches)
	{
		if (batches.isEmpty())
			throw new IllegalArgumentException("Nothing to concatenate");
		if (batches.size() == 1)
			return batches.get(0);

		FixtureSchema schema = batches.get(0).getSchema();
		List<ColumnValues> merged = new ArrayList<>(schema.getNumColumns());
		for (int col = 0; col < schema.getNumColumns(); col++)
		{
			List<ColumnValues> parts = new ArrayList<>(batches.size());
			for (RowBatch batch : batches)
			{
				if (!schema.equals(batch.getSchema()))
					throw new IllegalArgumentException("Schema mismatch: " + schema + " vs " + batch.getSchema());
				parts.add(batch.getColumn(col));
			}
			merged.add(concatColumn(schema.getColumn(col).getType(), parts));
		}
		return new RowBatch(schema, merged);
	}

	private static ColumnValues concatColumn(ColumnType type, List<ColumnValues> parts)
	{
		int total = parts.stream().mapToInt(ColumnValues::size).sum();
		int offset = 0;
		switch (type)
		{
			case INT32:
			{
				int[] out = new int[total];
				for (ColumnValues part : parts)
				{
					int[] vals = part.toIntArray();
					System.arraycopy(vals, 0, out, offset, vals.length);
					offset += vals.length;
				}
				return ColumnValues.ofInts(out);
			}
			case INT64:
			{
				long[] out = new long[total];
				for (ColumnValues part : parts)
				{
					long[] vals = part.toLongArray();
					System.arraycopy(vals, 0, out, offset, vals.length);
					offset += vals.length;
				}
				return ColumnValues.ofLongs(out);
			}
			case FLOAT32:
			{
				float[] out = new float[total];
				for (ColumnValues part : parts)
				{
					float[] vals = part.toFloatArray();
					System.arraycopy(vals, 0, out, offset, vals.length);
					offset += vals.length;
				}
				return ColumnValues.ofFloats(out);
			}
			case FLOAT64:
			{
				double[] out = new double[total];
				for (ColumnValues part : parts)
				{
					double[] vals = part.toDoubleArray();
					System.arraycopy(vals, 0, out, offset, vals.length);
					offset += vals.length;
				}
				return ColumnValues.ofDoubles(out);
			}
			case STRING:
			{
				String[] out = new String[total];
				for (ColumnValues part : parts)
				{
					String[] vals = part.toStringArray();
					System.arraycopy(vals, 0, out, offset, vals.length);
					offset += vals.length;
				}
				return ColumnValues.ofStrings(out);
			}
			case BOOLEAN:
			{
				boolean[] out = new boolean[total];
				for (ColumnValues part : parts)
				{
					boolean[] vals = part.toBooleanArray();
					System.arraycopy(vals, 0, out, offset, vals.length);
					offset += vals.length;
				}
				return ColumnValues.ofBooleans(out);
			}
			default:
				throw new IllegalStateException("Unknown type " + type);
		}
	}

	public FixtureSchema getSchema()
	{
		return schema;
	}

	public int getNumRows()
	{
		return numRows;
	}

	public int getNumColumns()
	{
		return columns.size();
	}

	public List<ColumnValues> getColumns()
	{
		return columns;
	}

	public ColumnValues getColumn(int idx)
	{
		return columns.get(idx);
	}

	public ColumnValues getColumn(String name)
	{
		return columns.get(schema.indexOf(name));
	}

	/**
	 * @param from the first row (inclusive)
	 * @param to   the last row (exclusive)
	 * @return a batch with the same schema containing the rows in range
	 */
	public RowBatch slice(int from, int to)
	{
		List<ColumnValues> sliced = new ArrayList<>(columns.size());
		for (ColumnValues column : columns)
		{
			sliced.add(column.slice(from, to));
		}
		return new RowBatch(schema, sliced);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		RowBatch rowBatch = (RowBatch) o;
		return schema.equals(rowBatch.schema) && columns.equals(rowBatch.columns);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(schema, columns);
	}

	@Override
	public String toString()
	{
		return "RowBatch{rows=" + numRows + ", schema=" + schema + ", columns=" + columns + '}';
	}
}
