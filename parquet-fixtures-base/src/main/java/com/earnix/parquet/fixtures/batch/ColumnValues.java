package com.earnix.parquet.fixtures.batch;

import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkPages;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkWriter;
import org.apache.parquet.column.ColumnDescriptor;

import java.util.Arrays;
import java.util.Objects;

/**
 * The values of a single column, one per row. Values are never null. This class is immutable - arrays passed in are
 * copied and arrays handed out are copies.
 */
public final class ColumnValues
{
	private final ColumnType type;

	// one of int[], long[], float[], double[], String[] or boolean[] depending on the type
	private final Object values;
	private final int size;

	private ColumnValues(ColumnType type, Object values, int size)
	{
		this.type = type;
		this.values = values;
		this.size = size;
	}

	public static ColumnValues ofInts(int... vals)
	{
		return new ColumnValues(ColumnType.INT32, vals.clone(), vals.length);
	}

	public static ColumnValues ofLongs(long... vals)
	{
		return new ColumnValues(ColumnType.INT64, vals.clone(), vals.length);
	}

	public static ColumnValues ofFloats(float... vals)
	{
		return new ColumnValues(ColumnType.FLOAT32, vals.clone(), vals.length);
	}

	public static ColumnValues ofDoubles(double... vals)
	{
		return new ColumnValues(ColumnType.FLOAT64, vals.clone(), vals.length);
	}

	public static ColumnValues ofStrings(String... vals)
	{
		for (int i = 0; i < vals.length; i++)
		{
			if (vals[i] == null)
				throw new IllegalArgumentException("Null value at row " + i);
		}
		return new ColumnValues(ColumnType.STRING, vals.clone(), vals.length);
	}

	public static ColumnValues ofBooleans(boolean... vals)
	{
		return new ColumnValues(ColumnType.BOOLEAN, vals.clone(), vals.length);
	}

	public ColumnType getType()
	{
		return type;
	}

	public int size()
	{
		return size;
	}

	/**
	 * @param row the row index
	 * @return the boxed value at the row
	 */
	public Object get(int row)
	{
		Objects.checkIndex(row, size);
		switch (type)
		{
			case INT32:
				return ((int[]) values)[row];
			case INT64:
				return ((long[]) values)[row];
			case FLOAT32:
				return ((float[]) values)[row];
			case FLOAT64:
				return ((double[]) values)[row];
			case STRING:
				return ((String[]) values)[row];
			case BOOLEAN:
				return ((boolean[]) values)[row];
			default:
				throw new IllegalStateException("Unknown type " + type);
		}
	}

	public int[] toIntArray()
	{
		return ((int[]) valuesOf(ColumnType.INT32)).clone();
	}

	public long[] toLongArray()
	{
		return ((long[]) valuesOf(ColumnType.INT64)).clone();
	}

	public float[] toFloatArray()
	{
		return ((float[]) valuesOf(ColumnType.FLOAT32)).clone();
	}

	public double[] toDoubleArray()
	{
		return ((double[]) valuesOf(ColumnType.FLOAT64)).clone();
	}

	public String[] toStringArray()
	{
		return ((String[]) valuesOf(ColumnType.STRING)).clone();
	}

	public boolean[] toBooleanArray()
	{
		return ((boolean[]) valuesOf(ColumnType.BOOLEAN)).clone();
	}

	private Object valuesOf(ColumnType expected)
	{
		if (type != expected)
			throw new IllegalStateException("Column of type " + type + " cannot be read as " + expected);
		return values;
	}

	/**
	 * @param from the first row (inclusive)
	 * @param to   the last row (exclusive)
	 * @return the values of the rows in range
	 */
	public ColumnValues slice(int from, int to)
	{
		Objects.checkFromToIndex(from, to, size);
		switch (type)
		{
			case INT32:
				return new ColumnValues(type, Arrays.copyOfRange((int[]) values, from, to), to - from);
			case INT64:
				return new ColumnValues(type, Arrays.copyOfRange((long[]) values, from, to), to - from);
			case FLOAT32:
				return new ColumnValues(type, Arrays.copyOfRange((float[]) values, from, to), to - from);
			case FLOAT64:
				return new ColumnValues(type, Arrays.copyOfRange((double[]) values, from, to), to - from);
			case STRING:
				return new ColumnValues(type, Arrays.copyOfRange((String[]) values, from, to), to - from);
			case BOOLEAN:
				return new ColumnValues(type, Arrays.copyOfRange((boolean[]) values, from, to), to - from);
			default:
				throw new IllegalStateException("Unknown type " + type);
		}
	}

	/**
	 * Encode these values as a column chunk
	 *
	 * @param writer     the column chunk writer
	 * @param descriptor the parquet column to write to
	 * @return the encoded pages
	 */
	public ColumnChunkPages writeTo(ColumnChunkWriter writer, ColumnDescriptor descriptor)
	{
		switch (type)
		{
			case INT32:
				return writer.writeColumn(descriptor, (int[]) values);
			case INT64:
				return writer.writeColumn(descriptor, (long[]) values);
			case FLOAT32:
				return writer.writeColumn(descriptor, (float[]) values);
			case FLOAT64:
				return writer.writeColumn(descriptor, (double[]) values);
			case STRING:
				return writer.writeColumn(descriptor, (String[]) values);
			case BOOLEAN:
				return writer.writeColumn(descriptor, (boolean[]) values);
			default:
				throw new IllegalStateException("Unknown type " + type);
		}
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		ColumnValues that = (ColumnValues) o;
		// Arrays.equals compares floating point values by their bits
		return type == that.type && Arrays.deepEquals(new Object[] { values }, new Object[] { that.values });
	}

	@Override
	public int hashCode()
	{
		return 31 * type.hashCode() + Arrays.deepHashCode(new Object[] { values });
	}

	@Override
	public String toString()
	{
		String str = Arrays.deepToString(new Object[] { values });
		// strip the wrapping array
		return type + str.substring(1, str.length() - 1);
	}
}
