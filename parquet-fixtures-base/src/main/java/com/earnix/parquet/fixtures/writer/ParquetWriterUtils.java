package com.earnix.parquet.fixtures.writer;

import com.earnix.parquet.fixtures.utils.LogicalTypeConverterUtils;
import com.earnix.parquet.fixtures.utils.ParquetEnumUtils;
import com.earnix.parquet.fixtures.utils.ParquetMagicUtils;
import com.earnix.parquet.fixtures.writer.rowgroup.ColumnChunkInfo;
import com.earnix.parquet.fixtures.writer.rowgroup.RowGroupInfo;
import org.apache.commons.io.output.CountingOutputStream;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.ColumnOrder;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.KeyValue;
import org.apache.parquet.format.RowGroup;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.format.TypeDefinedOrder;
import org.apache.parquet.format.Util;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.OriginalType;
import org.apache.parquet.schema.PrimitiveType;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility class for functions that assist in writing parquet files
 */
public class ParquetWriterUtils
{
	public static final String CREATED_BY = "parquet-fixtures version 1.0.0";

	/**
	 * Write the serialized footer, its little endian length and the trailing magic
	 *
	 * @param fileChannel  the channel positioned at the end of the last row group
	 * @param fileMetaData the footer to write
	 * @return the number of bytes written
	 * @throws IOException on failure to write
	 */
	public static long writeFooterMetadataAndMagic(WritableByteChannel fileChannel, FileMetaData fileMetaData)
			throws IOException
	{
		CountingOutputStream os = new CountingOutputStream(Channels.newOutputStream(fileChannel));
		Util.writeFileMetaData(fileMetaData, os);
		int byteCount = Math.toIntExact(os.getByteCount());
		writeLittleEndianInt(os, byteCount);
		os.flush();
		ParquetMagicUtils.writeMagicBytes(fileChannel);
		return os.getByteCount() + ParquetMagicUtils.magicLength();
	}

	/**
	 * Build Parquet Footer metadata
	 *
	 * @param messageType   the schema info
	 * @param rowGroupInfos the info on the row groups
	 * @param keyValues     additional key value metadata
	 * @param formatVersion the footer format version
	 * @return the built file metadata
	 */
	public static FileMetaData getFileMetaData(MessageType messageType, List<RowGroupInfo> rowGroupInfos,
			List<KeyValue> keyValues, int formatVersion)
	{
		if (rowGroupInfos.isEmpty())
			throw new IllegalStateException("No groups written");

		// C++ parquet driver requires row group columns to be in the same order as the schema.
		Map<ColumnDescriptor, Integer> schemaOrder = computeOrderingFromSchema(messageType);

		FileMetaData fileMetaData = new FileMetaData();
		fileMetaData.setVersion(formatVersion);
		fileMetaData.setSchema(getSchemaElements(messageType));

		long totalNumRows = rowGroupInfos.stream().mapToLong(RowGroupInfo::getNumRows).sum();
		fileMetaData.setNum_rows(totalNumRows);
		fileMetaData.setRow_groups(getRowGroupList(schemaOrder, rowGroupInfos));
		if (!keyValues.isEmpty())
			fileMetaData.setKey_value_metadata(new ArrayList<>(keyValues));
		fileMetaData.setCreated_by(CREATED_BY);
		fileMetaData.setColumn_orders(getColumnOrders(messageType));
		return fileMetaData;
	}

	static Map<ColumnDescriptor, Integer> computeOrderingFromSchema(MessageType messageType)
	{
		Map<ColumnDescriptor, Integer> schemaOrder = new HashMap<>();
		int idx = 0;
		for (ColumnDescriptor descriptor : messageType.getColumns())
		{
			schemaOrder.put(descriptor, idx++);
		}
		return schemaOrder;
	}

	private static List<RowGroup> getRowGroupList(Map<ColumnDescriptor, Integer> schemaOrder,
			List<RowGroupInfo> rowGroupInfos)
	{
		return rowGroupInfos.stream()//
				.map(rowGroupInfo -> getRowGroup(schemaOrder, rowGroupInfo))//
				.collect(Collectors.toList());
	}

	private static RowGroup getRowGroup(Map<ColumnDescriptor, Integer> schemaOrder, RowGroupInfo rowGroupInfo)
	{
		RowGroup rowGroup = new RowGroup();
		rowGroup.setFile_offset(rowGroupInfo.getStartingOffset());
		rowGroup.setNum_rows(rowGroupInfo.getNumRows());
		rowGroup.setColumns(getChunks(schemaOrder, rowGroupInfo));
		rowGroup.setTotal_compressed_size(rowGroupInfo.getCompressedSize());
		rowGroup.setTotal_byte_size(rowGroupInfo.getUncompressedSize());
		return rowGroup;
	}

	private static List<ColumnChunk> getChunks(Map<ColumnDescriptor, Integer> schemaOrder, RowGroupInfo rowGroupInfo)
	{
		ColumnChunk[] ret = new ColumnChunk[schemaOrder.size()];
		for (ColumnChunkInfo info : rowGroupInfo.getCols())
		{
			Integer idx = schemaOrder.get(info.getDescriptor());
			if (idx == null)
				throw new IllegalStateException("Column not in schema: " + info.getDescriptor());
			ret[idx] = info.buildChunkFromInfo();
		}
		return Collections.unmodifiableList(Arrays.asList(ret));
	}

	private static List<ColumnOrder> getColumnOrders(MessageType messageType)
	{
		List<ColumnOrder> columnOrders = new ArrayList<>(messageType.getColumns().size());
		for (int i = 0; i < messageType.getColumns().size(); i++)
		{
			ColumnOrder columnOrder = new ColumnOrder();
			columnOrder.setTYPE_ORDER(new TypeDefinedOrder());
			columnOrders.add(columnOrder);
		}
		return columnOrders;
	}

	public static void writeLittleEndianInt(OutputStream os, int byteCount) throws IOException
	{
		byte[] toWrite = new byte[Integer.BYTES];
		ByteBuffer.wrap(toWrite).order(ByteOrder.LITTLE_ENDIAN).putInt(byteCount);
		os.write(toWrite);
	}

	static List<SchemaElement> getSchemaElements(MessageType messageType)
	{
		List<SchemaElement> schemaElementList = new ArrayList<>(1 + messageType.getColumns().size());

		SchemaElement root = new SchemaElement();
		root.setName(messageType.getName());
		root.setNum_children(messageType.getColumns().size());
		schemaElementList.add(root);

		for (ColumnDescriptor descriptor : messageType.getColumns())
		{
			PrimitiveType primitiveType = descriptor.getPrimitiveType();
			SchemaElement schemaElement = new SchemaElement();
			schemaElement.setName(primitiveType.getName());
			schemaElement.setType(ParquetEnumUtils.convert(primitiveType.getPrimitiveTypeName()));
			schemaElement.setRepetition_type(ParquetEnumUtils.convert(primitiveType.getRepetition()));

			LogicalTypeAnnotation annotation = primitiveType.getLogicalTypeAnnotation();
			if (annotation != null)
			{
				OriginalType originalType = annotation.toOriginalType();
				if (originalType != null)
					schemaElement.setConverted_type(ParquetEnumUtils.convert(originalType));
				schemaElement.setLogicalType(LogicalTypeConverterUtils.toLogicalType(annotation));
			}
			schemaElementList.add(schemaElement);
		}
		return schemaElementList;
	}
}
