package com.earnix.parquet.fixtures.batch;

import java.util.Objects;

/**
 * The name and type of a single column in a {@link FixtureSchema}
 */
public final class ColumnDefinition
{
	private final String name;
	private final ColumnType type;

	public ColumnDefinition(String name, ColumnType type)
	{
		Objects.requireNonNull(name, "name");
		if (name.isEmpty())
			throw new IllegalArgumentException("Column name must not be empty");
		this.name = name;
		this.type = Objects.requireNonNull(type, "type");
	}

	public static ColumnDefinition of(String name, ColumnType type)
	{
		return new ColumnDefinition(name, type);
	}

	public String getName()
	{
		return name;
	}

	public ColumnType getType()
	{
		return type;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		ColumnDefinition that = (ColumnDefinition) o;
		return name.equals(that.name) && type == that.type;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, type);
	}

	@Override
	public String toString()
	{
		return name + ":" + type;
	}
}
