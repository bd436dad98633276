package com.earnix.parquet.fixtures.batch;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;

import java.util.Objects;

/**
 * The column types a fixture can contain, and their mapping to Parquet primitive types.
 */
public enum ColumnType
{
	INT32(PrimitiveType.PrimitiveTypeName.INT32, null),
	INT64(PrimitiveType.PrimitiveTypeName.INT64, null),
	FLOAT32(PrimitiveType.PrimitiveTypeName.FLOAT, null),
	FLOAT64(PrimitiveType.PrimitiveTypeName.DOUBLE, null),
	STRING(PrimitiveType.PrimitiveTypeName.BINARY, LogicalTypeAnnotation.stringType()),
	BOOLEAN(PrimitiveType.PrimitiveTypeName.BOOLEAN, null);

	private final PrimitiveType.PrimitiveTypeName primitiveTypeName;
	private final LogicalTypeAnnotation logicalTypeAnnotation;

	ColumnType(PrimitiveType.PrimitiveTypeName primitiveTypeName, LogicalTypeAnnotation logicalTypeAnnotation)
	{
		this.primitiveTypeName = primitiveTypeName;
		this.logicalTypeAnnotation = logicalTypeAnnotation;
	}

	public PrimitiveType.PrimitiveTypeName getPrimitiveTypeName()
	{
		return primitiveTypeName;
	}

	/**
	 * @return the logical type annotation written with this type, or null if the physical type is used as is
	 */
	public LogicalTypeAnnotation getLogicalTypeAnnotation()
	{
		return logicalTypeAnnotation;
	}

	/**
	 * Build the parquet column for this type
	 *
	 * @param name       the name of the column
	 * @param repetition the repetition of the column
	 * @return the parquet primitive type
	 */
	public PrimitiveType toPrimitiveType(String name, Type.Repetition repetition)
	{
		Types.PrimitiveBuilder<PrimitiveType> builder = Types.primitive(primitiveTypeName, repetition);
		if (logicalTypeAnnotation != null)
			builder = builder.as(logicalTypeAnnotation);
		return builder.named(name);
	}

	/**
	 * Find the column type of a parquet column
	 *
	 * @param primitiveType the parquet column
	 * @return the matching column type
	 * @throws IllegalArgumentException if the parquet column has no matching column type
	 */
	public static ColumnType fromPrimitiveType(PrimitiveType primitiveType)
	{
		for (ColumnType columnType : values())
		{
			if (columnType.primitiveTypeName == primitiveType.getPrimitiveTypeName() && Objects.equals(
					columnType.logicalTypeAnnotation, primitiveType.getLogicalTypeAnnotation()))
			{
				return columnType;
			}
		}
		throw new IllegalArgumentException("Unsupported column type: " + primitiveType);
	}
}
