package org.lokray.debuginfo.model;

import java.util.Objects;

/**
 * One laid-out field of an aggregate.
 */
public class FieldLayout
{
	private final String name;
	private final int structIndex;
	private final CompiledType type;

	public FieldLayout(String name, int structIndex, CompiledType type)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.structIndex = structIndex;
		this.type = Objects.requireNonNull(type, "type");
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Index of the field inside the native value struct.
	 */
	public int getStructIndex()
	{
		return structIndex;
	}

	public CompiledType getType()
	{
		return type;
	}

	@Override
	public String toString()
	{
		return name + "#" + structIndex + ": " + type.getFullName();
	}
}
