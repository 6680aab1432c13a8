// File: src/main/java/org/lokray/debuginfo/codegen/ScopeTracker.java
package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DwarfTag;
import org.lokray.debuginfo.model.CompiledFunction;
import org.lokray.debuginfo.model.Instruction;
import org.lokray.debuginfo.model.LocalVariable;
import org.lokray.debuginfo.model.NativeSlot;
import org.lokray.debuginfo.model.ScopeNode;
import org.lokray.debuginfo.model.SequencePoint;
import org.lokray.debuginfo.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;

/**
 * Follows the lexical scopes of one function while its instructions are lowered.
 * <p>
 * Scopes live in an arena and refer to their parent by index; the active
 * scopes are a stack of arena indices whose bottom is always the function root.
 */
public class ScopeTracker
{
	private final DebugCompilationUnit unit;
	private final CompiledFunction function;
	private final DebugDescriptor file;
	private final LocationEmitter locationEmitter;
	private final VariableEmitter variableEmitter;

	private final List<DebugScope> scopes = new ArrayList<>();
	private final Stack<Integer> active = new Stack<>();

	public ScopeTracker(DebugCompilationUnit unit, CompiledFunction function, DebugDescriptor file,
	                    LocationEmitter locationEmitter, VariableEmitter variableEmitter)
	{
		this.unit = unit;
		this.function = function;
		this.file = file;
		this.locationEmitter = locationEmitter;
		this.variableEmitter = variableEmitter;
	}

	/**
	 * Creates the function root scope and makes it the bottom of the stack.
	 *
	 * @param source        the body's top-level scope, may be {@code null}
	 * @param functionScope the function descriptor
	 */
	public DebugScope createRoot(ScopeNode source, DebugDescriptor functionScope)
	{
		if (!scopes.isEmpty())
		{
			throw new IllegalStateException("Root scope of " + function.getName() + " already created.");
		}
		DebugScope root = new DebugScope(0, DebugScope.NO_PARENT, source, functionScope);
		scopes.add(root);
		active.push(root.getIndex());
		return root;
	}

	/**
	 * Moves the cursor to {@code instruction}: leaves the scopes that ended
	 * before it, enters the scopes starting at it and updates the current location.
	 */
	public void advance(Instruction instruction)
	{
		if (active.isEmpty())
		{
			throw new IllegalStateException("advance() called before the root scope of " + function.getName() + " was created.");
		}

		// Exit finished scopes, innermost first; the root stays
		while (active.size() > 1)
		{
			DebugScope top = scopes.get(active.peek());
			if (top.getSource() != null && instruction.getOffset() > top.getSource().getEnd().getOffset())
			{
				active.pop();
				Debug.logDebug("ScopeTracker: left " + top + " at " + instruction);
			}
			else
			{
				break;
			}
		}

		DebugScope current = scopes.get(active.peek());
		boolean foundNewScope = true;
		while (foundNewScope)
		{
			foundNewScope = false;
			ScopeNode source = current.getSource();
			if (source != null && source.hasScopes())
			{
				for (ScopeNode child : source.getScopes())
				{
					if (child.getStart().getOffset() == instruction.getOffset())
					{
						current = createScope(current, child);
						active.push(current.getIndex());
						Debug.logDebug("ScopeTracker: entered " + current + " at " + instruction);
						enterScope(current);
						foundNewScope = true;
						break;
					}
				}
			}
		}

		if (instruction.getSequencePoint() != null)
		{
			locationEmitter.setLocation(instruction.getSequencePoint(), effectiveDescriptor(current));
		}
	}

	/**
	 * Creates the scope for {@code source} nested in {@code parent}. Without a
	 * start position no lexical block is created and the parent's is used instead.
	 */
	public DebugScope createScope(DebugScope parent, ScopeNode source)
	{
		SequencePoint sequencePoint = source.getStart().getSequencePoint();
		DebugDescriptor generated = null;
		if (sequencePoint != null)
		{
			generated = unit.getBuilder().createLexicalBlock(effectiveDescriptor(parent), file,
					sequencePoint.getStartLine(), sequencePoint.getStartColumn());
		}

		DebugScope scope = new DebugScope(scopes.size(), parent.getIndex(), source, generated);
		scopes.add(scope);
		return scope;
	}

	/**
	 * Points the location at the scope start and declares the locals of the scope.
	 */
	public void enterScope(DebugScope scope)
	{
		ScopeNode source = scope.getSource();
		if (source == null)
		{
			return;
		}

		DebugDescriptor descriptor = effectiveDescriptor(scope);
		SequencePoint sequencePoint = source.getStart().getSequencePoint();
		locationEmitter.setLocation(sequencePoint, descriptor);

		List<NativeSlot> locals = function.getLocals();
		for (LocalVariable local : source.getVariables())
		{
			if (local.getIndex() < 0 || local.getIndex() >= locals.size())
			{
				unit.getErrorHandler().logWarning(function.getName(),
						"scope " + source + " declares local " + local.getIndex() + " ('" + local.getName() + "') but the function has " + locals.size() + " locals");
				continue;
			}
			variableEmitter.emit(descriptor, locals.get(local.getIndex()), DwarfTag.AUTO_VARIABLE,
					localName(local.getName(), local.getIndex()), sequencePoint, 0);
		}
	}

	/**
	 * The descriptor of the scope, or of its nearest ancestor that has one.
	 */
	public DebugDescriptor effectiveDescriptor(DebugScope scope)
	{
		DebugScope s = scope;
		while (s.getGenerated() == null && !s.isRoot())
		{
			s = scopes.get(s.getParentIndex());
		}
		return s.getGenerated();
	}

	public DebugScope current()
	{
		return scopes.get(active.peek());
	}

	public DebugScope getRoot()
	{
		return scopes.get(0);
	}

	/**
	 * Number of active scopes, root included.
	 */
	public int depth()
	{
		return active.size();
	}

	/**
	 * Every scope created so far, in creation order.
	 */
	public List<DebugScope> getScopes()
	{
		return Collections.unmodifiableList(scopes);
	}

	static String localName(String name, int index)
	{
		return name == null || name.isEmpty() ? "var" + index : name;
	}
}
