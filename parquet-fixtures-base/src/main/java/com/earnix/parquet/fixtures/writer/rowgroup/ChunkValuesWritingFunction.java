package com.earnix.parquet.fixtures.writer.rowgroup;

import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkPages;
import com.earnix.parquet.fixtures.writer.columnchunk.ColumnChunkWriter;

import java.io.IOException;

@FunctionalInterface
public interface ChunkValuesWritingFunction
{
	ColumnChunkPages apply(ColumnChunkWriter columnChunkWriter) throws IOException;
}
