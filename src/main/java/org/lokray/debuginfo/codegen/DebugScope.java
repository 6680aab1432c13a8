package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.model.ScopeNode;

/**
 * A lexical scope of the function being compiled, stored in the scope arena of a {@link ScopeTracker}.
 */
public class DebugScope
{
	static final int NO_PARENT = -1;

	private final int index;
	private final int parentIndex;
	private final ScopeNode source;
	private final DebugDescriptor generated;

	DebugScope(int index, int parentIndex, ScopeNode source, DebugDescriptor generated)
	{
		this.index = index;
		this.parentIndex = parentIndex;
		this.source = source;
		this.generated = generated;
	}

	public int getIndex()
	{
		return index;
	}

	/**
	 * Arena index of the enclosing scope, {@code -1} for the function root.
	 */
	public int getParentIndex()
	{
		return parentIndex;
	}

	public boolean isRoot()
	{
		return parentIndex == NO_PARENT;
	}

	/**
	 * @return the scope tree node, {@code null} for a root without scope tree
	 */
	public ScopeNode getSource()
	{
		return source;
	}

	/**
	 * @return the lexical block (or function) descriptor, {@code null} when the scope has no start position
	 */
	public DebugDescriptor getGenerated()
	{
		return generated;
	}

	@Override
	public String toString()
	{
		return "DebugScope#" + index + (source != null ? source.toString() : "[root]");
	}
}
