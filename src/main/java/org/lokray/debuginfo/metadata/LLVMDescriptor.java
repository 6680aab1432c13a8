package org.lokray.debuginfo.metadata;

import org.bytedeco.llvm.LLVM.LLVMMetadataRef;

import java.util.Objects;

/**
 * A {@link DebugDescriptor} backed by an LLVM metadata node.
 */
public class LLVMDescriptor implements DebugDescriptor
{
	private final LLVMMetadataRef ref;

	public LLVMDescriptor(LLVMMetadataRef ref)
	{
		this.ref = Objects.requireNonNull(ref, "ref");
	}

	public LLVMMetadataRef getRef()
	{
		return ref;
	}

	@Override
	public String toString()
	{
		return "LLVMDescriptor@" + Long.toHexString(ref.address());
	}
}
