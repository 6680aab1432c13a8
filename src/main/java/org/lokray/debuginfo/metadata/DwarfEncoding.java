package org.lokray.debuginfo.metadata;

/**
 * DW_ATE base type encodings used for primitive types.
 */
public enum DwarfEncoding
{
	BOOLEAN(0x02),
	FLOAT(0x04),
	SIGNED(0x05),
	UNSIGNED(0x07);

	private final int value;

	DwarfEncoding(int value)
	{
		this.value = value;
	}

	public int getValue()
	{
		return value;
	}
}
