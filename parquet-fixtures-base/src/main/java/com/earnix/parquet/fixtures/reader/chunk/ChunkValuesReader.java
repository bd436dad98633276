package com.earnix.parquet.fixtures.reader.chunk;

import org.apache.parquet.io.api.Binary;

/**
 * A reader for the values of a required column chunk. The reader starts positioned on the first value.
 */
public interface ChunkValuesReader
{
	/**
	 * @return Iterate to the next value. False if there are no more values
	 */
	boolean next();

	int getInteger();

	boolean getBoolean();

	long getLong();

	Binary getBinary();

	float getFloat();

	double getDouble();

	/**
	 * @return whether the page of the current value is dictionary encoded
	 */
	boolean isDictionaryEncoded();
}
