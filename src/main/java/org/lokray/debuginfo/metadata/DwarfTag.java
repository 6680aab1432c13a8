package org.lokray.debuginfo.metadata;

public enum DwarfTag
{
	CLASS_TYPE(0x02),
	STRUCTURE_TYPE(0x13),

	AUTO_VARIABLE(0x100),
	ARG_VARIABLE(0x101);

	private final int value;

	DwarfTag(int value)
	{
		this.value = value;
	}

	public int getValue()
	{
		return value;
	}
}
