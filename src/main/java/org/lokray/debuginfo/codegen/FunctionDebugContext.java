package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.model.CompiledFunction;
import org.lokray.debuginfo.model.Instruction;

/**
 * Debug state of one function being compiled. Not shared between functions.
 */
public class FunctionDebugContext
{
	private final CompiledFunction function;
	private final DebugDescriptor file;
	private final LocationEmitter locationEmitter;
	private final VariableEmitter variableEmitter;
	private final ScopeTracker scopeTracker;
	private final boolean enabled;
	private DebugDescriptor functionScope = DebugDescriptor.EMPTY;

	FunctionDebugContext(DebugCompilationUnit unit, CompiledFunction function, DebugDescriptor file)
	{
		this(unit, function, file, true);
	}

	private FunctionDebugContext(DebugCompilationUnit unit, CompiledFunction function, DebugDescriptor file, boolean enabled)
	{
		this.enabled = enabled;
		this.function = function;
		this.file = file;
		this.locationEmitter = new LocationEmitter(unit.getBuilder());
		this.variableEmitter = new VariableEmitter(unit, file);
		this.scopeTracker = new ScopeTracker(unit, function, file, locationEmitter, variableEmitter);
	}

	/**
	 * A context that emits nothing, for units compiled without debug info.
	 */
	static FunctionDebugContext disabled(DebugCompilationUnit unit, CompiledFunction function)
	{
		return new FunctionDebugContext(unit, function, DebugDescriptor.EMPTY, false);
	}

	/**
	 * Called by the code generator before lowering each instruction.
	 */
	public void advance(Instruction instruction)
	{
		if (!enabled)
		{
			return;
		}
		scopeTracker.advance(instruction);
	}

	public boolean isEnabled()
	{
		return enabled;
	}

	public CompiledFunction getFunction()
	{
		return function;
	}

	public DebugDescriptor getFile()
	{
		return file;
	}

	public DebugDescriptor getFunctionScope()
	{
		return functionScope;
	}

	void setFunctionScope(DebugDescriptor functionScope)
	{
		this.functionScope = functionScope;
	}

	public LocationEmitter getLocationEmitter()
	{
		return locationEmitter;
	}

	public VariableEmitter getVariableEmitter()
	{
		return variableEmitter;
	}

	public ScopeTracker getScopeTracker()
	{
		return scopeTracker;
	}
}
