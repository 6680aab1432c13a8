package org.lokray.debuginfo.codegen;

/**
 * Index of a slot in a {@link DescriptorArena}. Compared by identity.
 */
public final class DescriptorHandle
{
	private final int index;

	DescriptorHandle(int index)
	{
		this.index = index;
	}

	public int getIndex()
	{
		return index;
	}

	@Override
	public String toString()
	{
		return "#" + index;
	}
}
