package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.model.CompiledClass;

/**
 * Debug description of one aggregate of the unit.
 */
public class ClassEntry
{
	private final CompiledClass compiledClass;
	private final DescriptorHandle handle;
	private final ClassState state;
	private boolean membersFinalized = false;
	private int memberCount = 0;

	ClassEntry(CompiledClass compiledClass, DescriptorHandle handle, ClassState state)
	{
		this.compiledClass = compiledClass;
		this.handle = handle;
		this.state = state;
	}

	public CompiledClass getCompiledClass()
	{
		return compiledClass;
	}

	public DescriptorHandle getHandle()
	{
		return handle;
	}

	public ClassState getState()
	{
		return state;
	}

	public boolean isMembersFinalized()
	{
		return membersFinalized;
	}

	public int getMemberCount()
	{
		return memberCount;
	}

	void markMembersFinalized(int memberCount)
	{
		if (state != ClassState.COMPLETE)
		{
			throw new IllegalStateException(compiledClass.getType().getFullName() + " is forward declared and cannot get members.");
		}
		if (membersFinalized)
		{
			throw new IllegalStateException("Members of " + compiledClass.getType().getFullName() + " were already finalized.");
		}
		this.membersFinalized = true;
		this.memberCount = memberCount;
	}
}
