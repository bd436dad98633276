package com.earnix.parquet.fixtures.batch;

import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered list of uniquely named columns. This class is immutable.
 */
public final class FixtureSchema
{
	/**
	 * The name of the root element of the parquet schema
	 */
	public static final String ROOT_NAME = "schema";

	private final List<ColumnDefinition> columns;
	private final Map<String, Integer> columnIndex;

	public FixtureSchema(List<ColumnDefinition> columns)
	{
		if (columns.isEmpty())
			throw new IllegalArgumentException("A schema must contain at least one column");

		Map<String, Integer> index = new HashMap<>();
		for (int i = 0; i < columns.size(); i++)
		{
			String name = columns.get(i).getName();
			if (index.put(name, i) != null)
				throw new IllegalArgumentException("Duplicate column name: " + name);
		}
		this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
		this.columnIndex = Collections.unmodifiableMap(index);
	}

	public static FixtureSchema of(ColumnDefinition... columns)
	{
		return new FixtureSchema(Arrays.asList(columns));
	}

	/**
	 * Build a schema from a flat parquet message type
	 *
	 * @param messageType the parquet schema
	 * @return the fixture schema
	 * @throws IllegalArgumentException if the message type is nested or contains unsupported column types
	 */
	public static FixtureSchema fromMessageType(MessageType messageType)
	{
		List<ColumnDefinition> definitions = new ArrayList<>(messageType.getFieldCount());
		for (Type field : messageType.getFields())
		{
			if (!field.isPrimitive())
				throw new IllegalArgumentException("Nesting not supported: " + field);
			PrimitiveType primitiveType = field.asPrimitiveType();
			definitions.add(new ColumnDefinition(primitiveType.getName(), ColumnType.fromPrimitiveType(primitiveType)));
		}
		return new FixtureSchema(definitions);
	}

	/**
	 * Convert this schema to a parquet schema. All columns are required as fixtures never contain nulls.
	 *
	 * @return the parquet message type
	 */
	public MessageType toMessageType()
	{
		List<Type> fields = new ArrayList<>(columns.size());
		for (ColumnDefinition column : columns)
		{
			fields.add(column.getType().toPrimitiveType(column.getName(), Type.Repetition.REQUIRED));
		}
		return new MessageType(ROOT_NAME, fields);
	}

	public List<ColumnDefinition> getColumns()
	{
		return columns;
	}

	public int getNumColumns()
	{
		return columns.size();
	}

	public ColumnDefinition getColumn(int idx)
	{
		return columns.get(idx);
	}

	/**
	 * @param name the column name
	 * @return the position of the column in this schema
	 * @throws IllegalArgumentException if there is no such column
	 */
	public int indexOf(String name)
	{
		Integer idx = columnIndex.get(name);
		if (idx == null)
			throw new IllegalArgumentException("No column named " + name + " in " + this);
		return idx;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		return columns.equals(((FixtureSchema) o).columns);
	}

	@Override
	public int hashCode()
	{
		return columns.hashCode();
	}

	@Override
	public String toString()
	{
		return columns.toString();
	}
}
