// File: src/main/java/org/lokray/debuginfo/model/CompiledFunction.java
package org.lokray.debuginfo.model;

import java.util.List;
import java.util.Objects;

/**
 * A function about to be lowered, with the native storage the code generator
 * allocated for its locals and arguments.
 */
public class CompiledFunction
{
	private final CompiledType declaringType;
	private final String name;
	private final MethodBody body;
	private final List<NativeSlot> locals;
	private final List<NativeSlot> arguments;
	private final NativeValue generatedValue;

	public CompiledFunction(CompiledType declaringType, String name, MethodBody body,
	                        List<NativeSlot> locals, List<NativeSlot> arguments, NativeValue generatedValue)
	{
		this.declaringType = Objects.requireNonNull(declaringType, "declaringType");
		this.name = Objects.requireNonNull(name, "name");
		this.body = Objects.requireNonNull(body, "body");
		this.locals = List.copyOf(locals);
		this.arguments = List.copyOf(arguments);
		this.generatedValue = Objects.requireNonNull(generatedValue, "generatedValue");
	}

	public CompiledType getDeclaringType()
	{
		return declaringType;
	}

	public String getName()
	{
		return name;
	}

	public MethodBody getBody()
	{
		return body;
	}

	public List<NativeSlot> getLocals()
	{
		return locals;
	}

	public List<NativeSlot> getArguments()
	{
		return arguments;
	}

	public NativeValue getGeneratedValue()
	{
		return generatedValue;
	}
}
