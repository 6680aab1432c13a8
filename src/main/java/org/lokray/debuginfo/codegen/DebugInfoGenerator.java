// File: src/main/java/org/lokray/debuginfo/codegen/DebugInfoGenerator.java
package org.lokray.debuginfo.codegen;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.debuginfo.dto.DebugInfoDTO;
import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DebugMetadataBuilder;
import org.lokray.debuginfo.model.CompiledClass;
import org.lokray.debuginfo.model.CompiledFunction;
import org.lokray.debuginfo.model.CompiledType;
import org.lokray.debuginfo.model.TypeSystem;
import org.lokray.debuginfo.util.Debug;
import org.lokray.debuginfo.util.DebugInfoDTOConverter;
import org.lokray.debuginfo.util.DebugInfoOptions;
import org.lokray.debuginfo.util.ErrorHandler;
import org.lokray.debuginfo.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Entry point of debug info synthesis for one compilation unit.
 * <p>
 * The code generator calls {@link #beginFunction(CompiledFunction)} before
 * lowering a function body, {@link FunctionDebugContext#advance} before each
 * instruction, {@link #onLayoutComputed(CompiledType)} whenever the type system
 * finishes the layout of a type, and {@link #finish()} once the module is done.
 */
public class DebugInfoGenerator
{
	private final DebugCompilationUnit unit;
	private final FunctionPrologueBuilder prologueBuilder;
	private boolean finished = false;

	public DebugInfoGenerator(DebugMetadataBuilder builder, TypeSystem typeSystem, DebugInfoOptions options,
	                          ErrorHandler errorHandler, String moduleIdentity)
	{
		this.unit = new DebugCompilationUnit(builder, typeSystem, options, errorHandler, moduleIdentity);
		this.prologueBuilder = new FunctionPrologueBuilder(unit);

		if (!options.isEnabled())
		{
			Debug.logDebug("DebugInfoGenerator: debug info disabled for " + moduleIdentity);
			return;
		}

		DebugDescriptor compileUnit = builder.createCompileUnit(FileUtils.getFileName(moduleIdentity),
				FileUtils.getDirectory(moduleIdentity), options.getProducer(), options.isOptimized());
		unit.setCompileUnit(compileUnit);
		Debug.logDebug("DebugInfoGenerator: compile unit for " + moduleIdentity + " (" + options.getProducer() + ")");
	}

	public FunctionDebugContext beginFunction(CompiledFunction function)
	{
		checkNotFinished();
		if (!isEnabled())
		{
			return FunctionDebugContext.disabled(unit, function);
		}
		return prologueBuilder.build(function);
	}

	/**
	 * Completes the class of {@code type} if it was waiting for its layout.
	 *
	 * @return whether a parked class was retried
	 */
	public boolean onLayoutComputed(CompiledType type)
	{
		checkNotFinished();
		if (!isEnabled() || !type.getMetadataKind().isAggregate())
		{
			return false;
		}
		CompiledClass compiledClass = unit.getTypeSystem().getClass(type);
		return unit.getWorklist().retry(compiledClass);
	}

	/**
	 * Completes what can still be completed, finalizes the builder and writes
	 * the debug type dump if one was requested.
	 */
	public void finish() throws IOException
	{
		checkNotFinished();
		finished = true;
		if (!isEnabled())
		{
			return;
		}

		ClassCompletionWorklist worklist = unit.getWorklist();
		worklist.drain();
		List<CompiledClass> incomplete = worklist.retryParked();
		for (CompiledClass compiledClass : incomplete)
		{
			unit.getErrorHandler().logWarning(compiledClass.getType().getFullName(),
					"layout never became available, class is described without members");
		}

		unit.getBuilder().finish();
		Debug.logDebug("DebugInfoGenerator: finished " + unit.getModuleIdentity() + " with "
				+ unit.getTypeCatalog().getClassEntries().size() + " classes, " + incomplete.size() + " incomplete.");

		Path dumpPath = unit.getOptions().getDumpPath();
		if (dumpPath != null)
		{
			writeDebugTypeDump(DebugInfoDTOConverter.toDTO(unit), dumpPath);
		}
	}

	/**
	 * Writes the debug type snapshot as JSON.
	 */
	private static void writeDebugTypeDump(DebugInfoDTO dto, Path outPath) throws IOException
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().create();
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, gson.toJson(dto), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote debug type dump to: " + outPath);
	}

	private void checkNotFinished()
	{
		if (finished)
		{
			throw new IllegalStateException("Debug info of " + unit.getModuleIdentity() + " was already finished.");
		}
	}

	/**
	 * Without {@code -g} nothing is synthesized and the builder is never called.
	 */
	public boolean isEnabled()
	{
		return unit.getOptions().isEnabled();
	}

	public boolean isFinished()
	{
		return finished;
	}

	public DebugCompilationUnit getUnit()
	{
		return unit;
	}
}
