package com.earnix.parquet.fixtures.utils;

import org.apache.parquet.column.Encoding;
import org.apache.parquet.format.ConvertedType;
import org.apache.parquet.schema.OriginalType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.junit.Assert;
import org.junit.Test;

public class ParquetEnumUtilsTest
{
	@Test
	public void testEncodingConversion()
	{
		for (Encoding encoding : Encoding.values())
		{
			Assert.assertEquals(encoding, ParquetEnumUtils.convert(ParquetEnumUtils.convert(encoding)));
		}
	}

	@Test
	public void testPrimitiveTypeConversion()
	{
		for (PrimitiveType.PrimitiveTypeName typeName : PrimitiveType.PrimitiveTypeName.values())
		{
			Assert.assertEquals(typeName, ParquetEnumUtils.convert(ParquetEnumUtils.convert(typeName)));
		}
		Assert.assertEquals(org.apache.parquet.format.Type.BYTE_ARRAY,
				ParquetEnumUtils.convert(PrimitiveType.PrimitiveTypeName.BINARY));
	}

	@Test
	public void testRepetitionConversion()
	{
		for (Type.Repetition repetition : Type.Repetition.values())
		{
			Assert.assertEquals(repetition, ParquetEnumUtils.convert(ParquetEnumUtils.convert(repetition)));
		}
	}

	@Test
	public void testStringConvertedType()
	{
		Assert.assertEquals(ConvertedType.UTF8, ParquetEnumUtils.convert(OriginalType.UTF8));
		Assert.assertEquals(OriginalType.UTF8, ParquetEnumUtils.convert(ConvertedType.UTF8));
	}
}
