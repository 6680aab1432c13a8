package org.lokray.debuginfo.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Instructions, scope tree and local names of a method.
 */
public class MethodBody
{
	private final List<Instruction> instructions;
	private final ScopeNode scope;
	private final List<String> variableNames;

	/**
	 * @param instructions  the instruction sequence, must not be empty
	 * @param scope         the top-level scope, or {@code null} when the body carries no scope tree
	 * @param variableNames source names of the locals by index, entries may be {@code null}
	 */
	public MethodBody(List<Instruction> instructions, ScopeNode scope, List<String> variableNames)
	{
		Objects.requireNonNull(instructions, "instructions");
		if (instructions.isEmpty())
		{
			throw new IllegalArgumentException("A method body needs at least one instruction.");
		}
		this.instructions = List.copyOf(instructions);
		this.scope = scope;
		this.variableNames = variableNames == null ? Collections.emptyList() : Collections.unmodifiableList(variableNames);
	}

	public List<Instruction> getInstructions()
	{
		return instructions;
	}

	public Instruction getFirstInstruction()
	{
		return instructions.get(0);
	}

	public ScopeNode getScope()
	{
		return scope;
	}

	public List<String> getVariableNames()
	{
		return variableNames;
	}
}
