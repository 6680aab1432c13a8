// File: src/main/java/org/lokray/debuginfo/model/ScopeNode.java
package org.lokray.debuginfo.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the lexical-scope tree of a method body. Children are strictly
 * nested inside their parent and do not overlap each other.
 */
public class ScopeNode
{
	private final Instruction start;
	private final Instruction end;
	private final List<LocalVariable> variables = new ArrayList<>();
	private final List<ScopeNode> scopes = new ArrayList<>();

	public ScopeNode(Instruction start, Instruction end)
	{
		this.start = Objects.requireNonNull(start, "start");
		this.end = Objects.requireNonNull(end, "end");
	}

	public ScopeNode addVariable(LocalVariable variable)
	{
		variables.add(variable);
		return this;
	}

	public ScopeNode addScope(ScopeNode scope)
	{
		scopes.add(scope);
		return this;
	}

	public Instruction getStart()
	{
		return start;
	}

	/**
	 * Last instruction covered by the scope.
	 */
	public Instruction getEnd()
	{
		return end;
	}

	public boolean hasVariables()
	{
		return !variables.isEmpty();
	}

	public List<LocalVariable> getVariables()
	{
		return Collections.unmodifiableList(variables);
	}

	public boolean hasScopes()
	{
		return !scopes.isEmpty();
	}

	public List<ScopeNode> getScopes()
	{
		return Collections.unmodifiableList(scopes);
	}

	@Override
	public String toString()
	{
		return "[" + start.getOffset() + ".." + end.getOffset() + "]";
	}
}
