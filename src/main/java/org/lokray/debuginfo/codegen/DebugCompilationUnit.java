package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DebugMetadataBuilder;
import org.lokray.debuginfo.model.TypeSystem;
import org.lokray.debuginfo.util.DebugInfoOptions;
import org.lokray.debuginfo.util.ErrorHandler;

import java.util.concurrent.locks.ReentrantLock;

/**
 * State shared by every function of one compilation unit: the builder, the
 * collaborators, and the namespace, type and class caches.
 * <p>
 * The caches are mutated in place when classes are completed, so every
 * read-modify-write on them happens under {@link #getLock()}.
 */
public class DebugCompilationUnit
{
	private final DebugMetadataBuilder builder;
	private final TypeSystem typeSystem;
	private final DebugInfoOptions options;
	private final ErrorHandler errorHandler;
	private final String moduleIdentity;
	private final ReentrantLock lock = new ReentrantLock();
	private final DescriptorArena arena = new DescriptorArena();
	private final NamespaceRegistry namespaces;
	private final ClassCompletionWorklist worklist;
	private final TypeDebugCatalog typeCatalog;
	private DebugDescriptor compileUnit = DebugDescriptor.EMPTY;

	public DebugCompilationUnit(DebugMetadataBuilder builder, TypeSystem typeSystem, DebugInfoOptions options,
	                            ErrorHandler errorHandler, String moduleIdentity)
	{
		this.builder = builder;
		this.typeSystem = typeSystem;
		this.options = options;
		this.errorHandler = errorHandler;
		this.moduleIdentity = moduleIdentity;
		this.namespaces = new NamespaceRegistry(builder, lock);
		this.worklist = new ClassCompletionWorklist(this);
		this.typeCatalog = new TypeDebugCatalog(this);
	}

	public DebugMetadataBuilder getBuilder()
	{
		return builder;
	}

	public TypeSystem getTypeSystem()
	{
		return typeSystem;
	}

	public DebugInfoOptions getOptions()
	{
		return options;
	}

	public ErrorHandler getErrorHandler()
	{
		return errorHandler;
	}

	/**
	 * Identity of the module being compiled; used as source file of functions without sequence points.
	 */
	public String getModuleIdentity()
	{
		return moduleIdentity;
	}

	public ReentrantLock getLock()
	{
		return lock;
	}

	public DescriptorArena getArena()
	{
		return arena;
	}

	public NamespaceRegistry getNamespaces()
	{
		return namespaces;
	}

	public ClassCompletionWorklist getWorklist()
	{
		return worklist;
	}

	public TypeDebugCatalog getTypeCatalog()
	{
		return typeCatalog;
	}

	public DebugDescriptor getCompileUnit()
	{
		return compileUnit;
	}

	void setCompileUnit(DebugDescriptor compileUnit)
	{
		this.compileUnit = compileUnit;
	}
}
