package org.lokray.debuginfo.codegen;

public class TypeEntry
{
	private final DescriptorHandle handle;
	private final TypeEntryKind kind;

	TypeEntry(DescriptorHandle handle, TypeEntryKind kind)
	{
		this.handle = handle;
		this.kind = kind;
	}

	public DescriptorHandle getHandle()
	{
		return handle;
	}

	public TypeEntryKind getKind()
	{
		return kind;
	}
}
