// File: src/main/java/org/lokray/debuginfo/metadata/DebugMetadataBuilder.java
package org.lokray.debuginfo.metadata;

import org.lokray.debuginfo.model.NativeValue;

import java.util.List;

/**
 * The native debug-metadata writer. Calls are order sensitive: locations and
 * variable declarations apply to the code generator's current insertion point.
 * <p>
 * Sizes, alignments and offsets are in bits. {@link DebugDescriptor#EMPTY} is
 * accepted wherever a scope or base type is optional.
 */
public interface DebugMetadataBuilder
{
	DebugDescriptor createCompileUnit(String fileName, String directory, String producer, boolean optimized);

	DebugDescriptor createFile(String fileName, String directory);

	DebugDescriptor createNamespace(DebugDescriptor parent, String name);

	DebugDescriptor createBasicType(String name, long sizeInBits, long alignInBits, DwarfEncoding encoding);

	DebugDescriptor createPointerType(DebugDescriptor pointee, long sizeInBits, long alignInBits, String name);

	DebugDescriptor createForwardDeclaration(DwarfTag tag, String name, DebugDescriptor scope,
	                                         long sizeInBits, long alignInBits, String uniqueId);

	DebugDescriptor createClassType(DebugDescriptor scope, String name, DebugDescriptor base,
	                                long sizeInBits, long alignInBits, List<DebugDescriptor> members, String uniqueId);

	/**
	 * Gives a class created by {@link #createClassType} its final member list.
	 * <p>
	 * Every node that already references {@code composite} (pointer types,
	 * members, base class links, function scopes) is redirected to the returned
	 * descriptor, so descriptors handed out before completion stay valid.
	 *
	 * @return the descriptor that replaces {@code composite}
	 */
	DebugDescriptor setCompositeMembers(DebugDescriptor composite, List<DebugDescriptor> members);

	DebugDescriptor createMemberType(DebugDescriptor owner, String name, long sizeInBits, long alignInBits,
	                                 long offsetInBits, DebugDescriptor type);

	DebugDescriptor createSubroutineType(DebugDescriptor file, List<DebugDescriptor> parameterTypes);

	DebugDescriptor createLexicalBlock(DebugDescriptor parent, DebugDescriptor file, int line, int column);

	DebugDescriptor createFunctionScope(DebugDescriptor owner, String name, String qualifiedName, DebugDescriptor file,
	                                    int line, DebugDescriptor subroutineType, boolean localToUnit,
	                                    boolean definition, boolean optimized, NativeValue function);

	/**
	 * @param argIndex 1-based position for {@link DwarfTag#ARG_VARIABLE}, 0 otherwise
	 */
	DebugDescriptor createLocalVariable(DebugDescriptor scope, DwarfTag tag, String name, DebugDescriptor file,
	                                    int line, DebugDescriptor type, int argIndex);

	/**
	 * Declares {@code storage} as the home of {@code variable} at the current
	 * insertion point, tagged with the current location.
	 */
	void bindVariableDeclaration(NativeValue storage, DebugDescriptor variable);

	void setCurrentLocation(int line, int column, DebugDescriptor scope);

	/**
	 * Resolves whatever is still pending and finalizes the metadata.
	 */
	void finish();
}
