package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Every descriptor the type caches hand out lives in one slot of this arena.
 * Caches keep {@link DescriptorHandle}s, so rewriting a slot once (when a class
 * gets its members) is seen by every cache entry that shares the handle.
 */
public class DescriptorArena
{
	private final List<DebugDescriptor> slots = new ArrayList<>();

	public DescriptorHandle allocate(DebugDescriptor descriptor)
	{
		slots.add(Objects.requireNonNull(descriptor, "descriptor"));
		return new DescriptorHandle(slots.size() - 1);
	}

	public DebugDescriptor get(DescriptorHandle handle)
	{
		return slots.get(handle.getIndex());
	}

	public void replace(DescriptorHandle handle, DebugDescriptor descriptor)
	{
		slots.set(handle.getIndex(), Objects.requireNonNull(descriptor, "descriptor"));
	}

	public int size()
	{
		return slots.size();
	}
}
