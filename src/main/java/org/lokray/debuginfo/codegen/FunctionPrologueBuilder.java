// File: src/main/java/org/lokray/debuginfo/codegen/FunctionPrologueBuilder.java
package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DebugMetadataBuilder;
import org.lokray.debuginfo.metadata.DwarfTag;
import org.lokray.debuginfo.model.CompiledFunction;
import org.lokray.debuginfo.model.MethodBody;
import org.lokray.debuginfo.model.NativeSlot;
import org.lokray.debuginfo.model.SequencePoint;
import org.lokray.debuginfo.util.Debug;
import org.lokray.debuginfo.util.FileUtils;

import java.util.Collections;
import java.util.List;

/**
 * Sets up the debug information of a function before its body is lowered:
 * source file, function descriptor, root scope, initial location, locals and arguments.
 */
public class FunctionPrologueBuilder
{
	private final DebugCompilationUnit unit;

	public FunctionPrologueBuilder(DebugCompilationUnit unit)
	{
		this.unit = unit;
	}

	public FunctionDebugContext build(CompiledFunction function)
	{
		DebugMetadataBuilder builder = unit.getBuilder();
		MethodBody body = function.getBody();
		SequencePoint start = body.getFirstInstruction().getSequencePoint();

		int line = 0;
		String url;
		if (start != null)
		{
			url = start.getDocumentUrl();
			line = start.getStartLine();
		}
		else
		{
			url = unit.getModuleIdentity();
		}

		DebugDescriptor file = builder.createFile(FileUtils.getFileName(url), FileUtils.getDirectory(url));
		FunctionDebugContext context = new FunctionDebugContext(unit, function, file);

		DebugDescriptor owner = unit.getTypeCatalog().classDebugType(unit.getTypeSystem().getClass(function.getDeclaringType()));

		// Parameter types are not described
		List<DebugDescriptor> parameterTypes = Collections.emptyList();
		DebugDescriptor functionType = builder.createSubroutineType(file, parameterTypes);

		DebugDescriptor functionScope = builder.createFunctionScope(owner, function.getName(), qualifiedName(function),
				file, line, functionType, false, true, unit.getOptions().isOptimized(), function.getGeneratedValue());
		context.setFunctionScope(functionScope);

		ScopeTracker scopeTracker = context.getScopeTracker();
		DebugScope root = scopeTracker.createRoot(body.getScope(), functionScope);

		context.getLocationEmitter().setLocation(start, functionScope);
		if (body.getScope() != null)
		{
			scopeTracker.enterScope(root);
		}
		else
		{
			// No scope tree: every local lives in the function scope
			List<NativeSlot> locals = function.getLocals();
			List<String> names = body.getVariableNames();
			for (int index = 0; index < locals.size(); index++)
			{
				String name = index < names.size() ? names.get(index) : null;
				context.getVariableEmitter().emit(functionScope, locals.get(index), DwarfTag.AUTO_VARIABLE,
						ScopeTracker.localName(name, index), start, 0);
			}
		}

		List<NativeSlot> arguments = function.getArguments();
		for (int index = 0; index < arguments.size(); index++)
		{
			NativeSlot argument = arguments.get(index);
			String name = argument.getStorage().getName();
			if (name == null || name.isEmpty())
			{
				name = "arg" + index;
			}
			context.getVariableEmitter().emit(functionScope, argument, DwarfTag.ARG_VARIABLE, name, start, index + 1);
		}

		Debug.logDebug("FunctionPrologueBuilder: " + qualifiedName(function) + " in " + url + ":" + line
				+ " (" + function.getLocals().size() + " locals, " + arguments.size() + " arguments)");
		return context;
	}

	/**
	 * {@code Namespace.Type} + {@code Name} rendered as {@code Namespace::Type::Name}
	 * (with the configured separator) so that debuggers see namespaces.
	 */
	public String qualifiedName(CompiledFunction function)
	{
		String separator = unit.getOptions().getNamespaceSeparator();
		return function.getDeclaringType().getFullName().replace(".", separator) + separator + function.getName();
	}
}
