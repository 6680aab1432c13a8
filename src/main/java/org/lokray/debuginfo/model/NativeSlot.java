package org.lokray.debuginfo.model;

import java.util.Objects;

/**
 * Native storage of a local or an argument, together with its managed type.
 */
public class NativeSlot
{
	private final NativeValue storage;
	private final CompiledType type;

	public NativeSlot(NativeValue storage, CompiledType type)
	{
		this.storage = Objects.requireNonNull(storage, "storage");
		this.type = Objects.requireNonNull(type, "type");
	}

	public NativeValue getStorage()
	{
		return storage;
	}

	public CompiledType getType()
	{
		return type;
	}
}
