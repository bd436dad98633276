package com.earnix.parquet.fixtures.utils;

import org.apache.parquet.format.LogicalType;
import org.apache.parquet.format.LogicalTypes;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.OriginalType;

import java.util.Optional;

/**
 * Converts logical types between the thrift footer metadata and parquet-column. Only the annotations that fixture
 * columns carry are supported; parquet-hadoop has the complete conversion but we do not want to depend on hadoop.
 */
public class LogicalTypeConverterUtils
{
	/**
	 * @param annotation the parquet-column annotation
	 * @return the thrift logical type
	 * @throws IllegalArgumentException if the annotation is not supported
	 */
	public static LogicalType toLogicalType(LogicalTypeAnnotation annotation)
	{
		return annotation.accept(new LogicalTypeAnnotation.LogicalTypeAnnotationVisitor<LogicalType>()
		{
			@Override
			public Optional<LogicalType> visit(LogicalTypeAnnotation.StringLogicalTypeAnnotation stringLogicalType)
			{
				return Optional.of(LogicalTypes.UTF8);
			}
		}).orElseThrow(() -> new IllegalArgumentException("Unsupported logical type: " + annotation));
	}

	/**
	 * Read the annotation of a schema element. The logical type takes precedence, the converted type is used for
	 * files that only carry the legacy annotation.
	 *
	 * @param schemaElement the footer schema element
	 * @return the annotation or null if the element has none
	 * @throws IllegalArgumentException if the logical type is not supported
	 */
	public static LogicalTypeAnnotation getLogicalTypeAnnotation(SchemaElement schemaElement)
	{
		if (schemaElement.isSetLogicalType())
		{
			LogicalType logicalType = schemaElement.getLogicalType();
			if (logicalType.isSetSTRING())
				return LogicalTypeAnnotation.stringType();
			throw new IllegalArgumentException(
					"Unsupported logical type " + logicalType + " for " + schemaElement.getName());
		}
		if (schemaElement.isSetConverted_type())
		{
			OriginalType originalType = ParquetEnumUtils.convert(schemaElement.getConverted_type());
			return LogicalTypeAnnotation.fromOriginalType(originalType, null);
		}
		return null;
	}
}
