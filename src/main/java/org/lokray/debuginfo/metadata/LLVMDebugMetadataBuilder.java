package org.lokray.debuginfo.metadata;

import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMDIBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMMetadataRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.lokray.debuginfo.model.NativeValue;
import org.lokray.debuginfo.util.Debug;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * {@link DebugMetadataBuilder} on top of the LLVM C API DIBuilder.
 * <p>
 * The C API cannot change the elements of an existing composite, so classes
 * created without members are emitted as replaceable (temporary) composites.
 * {@link #setCompositeMembers} builds the final class node and RAUWs the
 * temporary one, which also fixes every pointer and member that referenced it.
 */
public class LLVMDebugMetadataBuilder implements DebugMetadataBuilder
{
	private final LLVMContext llvm;
	private final LLVMDIBuilderRef diBuilder;
	private final LLVMMetadataRef emptyExpression;
	// Temporary class nodes waiting for their members
	private final Map<DebugDescriptor, PendingClass> pendingClasses = new IdentityHashMap<>();
	private LLVMMetadataRef currentLocation;
	private boolean finished = false;

	public LLVMDebugMetadataBuilder(LLVMContext llvm)
	{
		this.llvm = llvm;
		this.diBuilder = LLVMCreateDIBuilder(llvm.getModule());
		this.emptyExpression = LLVMDIBuilderCreateExpression(diBuilder, new long[0], 0);
	}

	@Override
	public DebugDescriptor createCompileUnit(String fileName, String directory, String producer, boolean optimized)
	{
		LLVMMetadataRef file = LLVMDIBuilderCreateFile(diBuilder, fileName, len(fileName), directory, len(directory));
		LLVMMetadataRef unit = LLVMDIBuilderCreateCompileUnit(diBuilder,
				LLVMDWARFSourceLanguageC_plus_plus,
				file,
				producer, len(producer),
				optimized ? 1 : 0,
				"", 0,      // flags
				0,          // runtime version
				"", 0,      // split name
				LLVMDWARFEmissionFull,
				0,          // DWO id
				0,          // split debug inlining
				0,          // debug info for profiling
				"", 0,      // sysroot
				"", 0);     // SDK
		return new LLVMDescriptor(unit);
	}

	@Override
	public DebugDescriptor createFile(String fileName, String directory)
	{
		return new LLVMDescriptor(LLVMDIBuilderCreateFile(diBuilder, fileName, len(fileName), directory, len(directory)));
	}

	@Override
	public DebugDescriptor createNamespace(DebugDescriptor parent, String name)
	{
		return new LLVMDescriptor(LLVMDIBuilderCreateNameSpace(diBuilder, unwrap(parent), name, len(name), 0));
	}

	@Override
	public DebugDescriptor createBasicType(String name, long sizeInBits, long alignInBits, DwarfEncoding encoding)
	{
		// The C API derives the alignment of basic types from their size
		return new LLVMDescriptor(LLVMDIBuilderCreateBasicType(diBuilder, name, len(name), sizeInBits, encoding.getValue(), LLVMDIFlagZero));
	}

	@Override
	public DebugDescriptor createPointerType(DebugDescriptor pointee, long sizeInBits, long alignInBits, String name)
	{
		return new LLVMDescriptor(LLVMDIBuilderCreatePointerType(diBuilder, unwrap(pointee), sizeInBits, (int) alignInBits, 0, name, len(name)));
	}

	@Override
	public DebugDescriptor createForwardDeclaration(DwarfTag tag, String name, DebugDescriptor scope,
	                                                long sizeInBits, long alignInBits, String uniqueId)
	{
		LLVMMetadataRef decl = LLVMDIBuilderCreateForwardDecl(diBuilder, tag.getValue(), name, len(name),
				unwrap(scope), (LLVMMetadataRef) null, 0, 0, sizeInBits, (int) alignInBits, uniqueId, len(uniqueId));
		return new LLVMDescriptor(decl);
	}

	@Override
	public DebugDescriptor createClassType(DebugDescriptor scope, String name, DebugDescriptor base,
	                                       long sizeInBits, long alignInBits, List<DebugDescriptor> members, String uniqueId)
	{
		PendingClass pending = new PendingClass(scope, name, base, sizeInBits, alignInBits, uniqueId);
		if (!members.isEmpty())
		{
			return new LLVMDescriptor(buildClass(pending, members));
		}

		LLVMMetadataRef temporary = LLVMDIBuilderCreateReplaceableCompositeType(diBuilder,
				DwarfTag.CLASS_TYPE.getValue(), name, len(name), unwrap(scope), (LLVMMetadataRef) null, 0, 0,
				sizeInBits, (int) alignInBits, LLVMDIFlagZero, uniqueId, len(uniqueId));
		LLVMDescriptor descriptor = new LLVMDescriptor(temporary);
		pendingClasses.put(descriptor, pending);
		return descriptor;
	}

	@Override
	public DebugDescriptor setCompositeMembers(DebugDescriptor composite, List<DebugDescriptor> members)
	{
		PendingClass pending = pendingClasses.remove(composite);
		if (pending == null)
		{
			throw new IllegalStateException("Members of " + composite + " were already set or it was not created by this builder.");
		}

		LLVMMetadataRef complete = buildClass(pending, members);
		LLVMMetadataReplaceAllUsesWith(unwrap(composite), complete);
		return new LLVMDescriptor(complete);
	}

	private LLVMMetadataRef buildClass(PendingClass pending, List<DebugDescriptor> members)
	{
		PointerPointer<LLVMMetadataRef> elements = toPointerPointer(members);
		return LLVMDIBuilderCreateClassType(diBuilder, unwrap(pending.scope), pending.name, len(pending.name),
				(LLVMMetadataRef) null, 0, pending.sizeInBits, (int) pending.alignInBits, 0, LLVMDIFlagZero,
				unwrap(pending.base), elements, members.size(), (LLVMMetadataRef) null, (LLVMMetadataRef) null,
				pending.uniqueId, len(pending.uniqueId));
	}

	@Override
	public DebugDescriptor createMemberType(DebugDescriptor owner, String name, long sizeInBits, long alignInBits,
	                                        long offsetInBits, DebugDescriptor type)
	{
		return new LLVMDescriptor(LLVMDIBuilderCreateMemberType(diBuilder, unwrap(owner), name, len(name),
				(LLVMMetadataRef) null, 0, sizeInBits, (int) alignInBits, offsetInBits, LLVMDIFlagZero, unwrap(type)));
	}

	@Override
	public DebugDescriptor createSubroutineType(DebugDescriptor file, List<DebugDescriptor> parameterTypes)
	{
		PointerPointer<LLVMMetadataRef> parameters = toPointerPointer(parameterTypes);
		return new LLVMDescriptor(LLVMDIBuilderCreateSubroutineType(diBuilder, unwrap(file), parameters, parameterTypes.size(), LLVMDIFlagZero));
	}

	@Override
	public DebugDescriptor createLexicalBlock(DebugDescriptor parent, DebugDescriptor file, int line, int column)
	{
		return new LLVMDescriptor(LLVMDIBuilderCreateLexicalBlock(diBuilder, unwrap(parent), unwrap(file), line, column));
	}

	@Override
	public DebugDescriptor createFunctionScope(DebugDescriptor owner, String name, String qualifiedName, DebugDescriptor file,
	                                           int line, DebugDescriptor subroutineType, boolean localToUnit,
	                                           boolean definition, boolean optimized, NativeValue function)
	{
		LLVMMetadataRef subprogram = LLVMDIBuilderCreateFunction(diBuilder, unwrap(owner), name, len(name),
				qualifiedName, len(qualifiedName), unwrap(file), line, unwrap(subroutineType),
				localToUnit ? 1 : 0, definition ? 1 : 0, line, LLVMDIFlagZero, optimized ? 1 : 0);
		LLVMSetSubprogram(unwrapValue(function), subprogram);
		return new LLVMDescriptor(subprogram);
	}

	@Override
	public DebugDescriptor createLocalVariable(DebugDescriptor scope, DwarfTag tag, String name, DebugDescriptor file,
	                                           int line, DebugDescriptor type, int argIndex)
	{
		LLVMMetadataRef variable;
		if (tag == DwarfTag.ARG_VARIABLE)
		{
			variable = LLVMDIBuilderCreateParameterVariable(diBuilder, unwrap(scope), name, len(name), argIndex,
					unwrap(file), line, unwrap(type), 1, LLVMDIFlagZero);
		}
		else if (tag == DwarfTag.AUTO_VARIABLE)
		{
			variable = LLVMDIBuilderCreateAutoVariable(diBuilder, unwrap(scope), name, len(name),
					unwrap(file), line, unwrap(type), 1, LLVMDIFlagZero, 0);
		}
		else
		{
			throw new IllegalArgumentException("Not a variable tag: " + tag);
		}
		return new LLVMDescriptor(variable);
	}

	@Override
	public void bindVariableDeclaration(NativeValue storage, DebugDescriptor variable)
	{
		if (currentLocation == null)
		{
			throw new IllegalStateException("No current debug location, setCurrentLocation must be called first.");
		}
		LLVMBasicBlockRef block = LLVMGetInsertBlock(llvm.getBuilder());
		if (block == null || block.isNull())
		{
			throw new IllegalStateException("The IR builder has no insertion block.");
		}
		LLVMDIBuilderInsertDeclareAtEnd(diBuilder, unwrapValue(storage), unwrap(variable), emptyExpression, currentLocation, block);
	}

	@Override
	public void setCurrentLocation(int line, int column, DebugDescriptor scope)
	{
		currentLocation = LLVMDIBuilderCreateDebugLocation(llvm.getContext(), line, column, unwrap(scope), (LLVMMetadataRef) null);
		LLVMSetCurrentDebugLocation2(llvm.getBuilder(), currentLocation);
	}

	@Override
	public void finish()
	{
		if (finished)
		{
			return;
		}

		// Classes that never got their members still need a real node
		for (DebugDescriptor temporary : new ArrayList<>(pendingClasses.keySet()))
		{
			Debug.logDebug("LLVMDebugMetadataBuilder: resolving " + pendingClasses.get(temporary).name + " without members.");
			setCompositeMembers(temporary, List.of());
		}

		LLVMDIBuilderFinalize(diBuilder);

		String key = "Debug Info Version";
		LLVMValueRef version = LLVMConstInt(LLVMInt32TypeInContext(llvm.getContext()), LLVMDebugMetadataVersion(), 0);
		LLVMAddModuleFlag(llvm.getModule(), LLVMModuleFlagBehaviorWarning, key, len(key), LLVMValueAsMetadata(version));

		LLVMDisposeDIBuilder(diBuilder);
		finished = true;
	}

	private static LLVMMetadataRef unwrap(DebugDescriptor descriptor)
	{
		if (descriptor == null || descriptor.isEmpty())
		{
			return null;
		}
		if (descriptor instanceof LLVMDescriptor llvmDescriptor)
		{
			return llvmDescriptor.getRef();
		}
		throw new IllegalArgumentException("Descriptor was not created by an LLVM builder: " + descriptor);
	}

	private static LLVMValueRef unwrapValue(NativeValue value)
	{
		if (value instanceof LLVMNativeValue llvmValue)
		{
			return llvmValue.getValue();
		}
		throw new IllegalArgumentException("Not an LLVM value: " + value);
	}

	private static PointerPointer<LLVMMetadataRef> toPointerPointer(List<DebugDescriptor> descriptors)
	{
		if (descriptors.isEmpty())
		{
			return null;
		}
		LLVMMetadataRef[] refs = new LLVMMetadataRef[descriptors.size()];
		for (int i = 0; i < refs.length; i++)
		{
			refs[i] = unwrap(descriptors.get(i));
		}
		return new PointerPointer<>(refs);
	}

	// The C API takes explicit byte lengths
	private static long len(String s)
	{
		return s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length;
	}

	private static class PendingClass
	{
		final DebugDescriptor scope;
		final String name;
		final DebugDescriptor base;
		final long sizeInBits;
		final long alignInBits;
		final String uniqueId;

		PendingClass(DebugDescriptor scope, String name, DebugDescriptor base, long sizeInBits, long alignInBits, String uniqueId)
		{
			this.scope = scope;
			this.name = name;
			this.base = base;
			this.sizeInBits = sizeInBits;
			this.alignInBits = alignInBits;
			this.uniqueId = uniqueId;
		}
	}
}
