package com.earnix.parquet.fixtures.reader;

import com.earnix.parquet.fixtures.utils.LogicalTypeConverterUtils;
import com.earnix.parquet.fixtures.utils.ParquetEnumUtils;
import org.apache.parquet.format.FieldRepetitionType;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;

import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Utils for processing parquet metadata
 */
public class ParquetMetadataUtils
{
	private static final String STRUCTURED_FILES_UNSUPPORTED = "Structured files are not supported";

	/**
	 * Build a message type schema from parquet footer metadata, restoring the logical type annotations
	 *
	 * @param md the parquet footer metadata
	 * @return the message type
	 * @throws UnsupportedEncodingException if the schema is nested or uses an unsupported repetition
	 */
	public static MessageType buildMessageType(FileMetaData md) throws UnsupportedEncodingException
	{
		Iterator<SchemaElement> it = md.getSchemaIterator();
		if (it == null || !it.hasNext())
			throw new UnsupportedEncodingException("Footer has no schema");
		SchemaElement root = it.next();
		if (root.getNum_children() + 1 != md.getSchemaSize())
		{
			throw new UnsupportedEncodingException(STRUCTURED_FILES_UNSUPPORTED);
		}

		List<Type> primitiveTypeList = new ArrayList<>(root.getNum_children());
		while (it.hasNext())
		{
			primitiveTypeList.add(buildPrimitiveType(it.next()));
		}
		return new MessageType(root.getName(), primitiveTypeList);
	}

	private static PrimitiveType buildPrimitiveType(SchemaElement schemaElement) throws UnsupportedEncodingException
	{
		String nameKey = schemaElement.getName();
		if (!schemaElement.isSetType() || schemaElement.getNum_children() > 0)
			throw new UnsupportedEncodingException(STRUCTURED_FILES_UNSUPPORTED + ": " + nameKey);
		if (schemaElement.getRepetition_type() != FieldRepetitionType.OPTIONAL
				&& schemaElement.getRepetition_type() != FieldRepetitionType.REQUIRED)
		{
			throw new UnsupportedEncodingException(
					"Field: " + nameKey + " Unsupported: " + schemaElement.getRepetition_type());
		}

		Type.Repetition repetition = ParquetEnumUtils.convert(schemaElement.getRepetition_type());
		PrimitiveType.PrimitiveTypeName primitiveTypeName = ParquetEnumUtils.convert(schemaElement.getType());
		Types.PrimitiveBuilder<PrimitiveType> builder = Types.primitive(primitiveTypeName, repetition);
		if (primitiveTypeName == PrimitiveType.PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY)
		{
			if (!schemaElement.isSetType_length() || schemaElement.getType_length() <= 0)
				throw new IllegalStateException("fixed length binary must have a valid len");
			builder.length(schemaElement.getType_length());
		}

		LogicalTypeAnnotation annotation = LogicalTypeConverterUtils.getLogicalTypeAnnotation(schemaElement);
		if (annotation != null)
			builder.as(annotation);
		return builder.named(nameKey);
	}
}
