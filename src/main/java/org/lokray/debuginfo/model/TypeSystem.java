package org.lokray.debuginfo.model;

/**
 * Layout and ABI queries answered by the type system.
 */
public interface TypeSystem
{
	/**
	 * The class behind an aggregate type. The same instance must be returned for the same type.
	 */
	CompiledClass getClass(CompiledType type);

	long abiSizeInBits(CompiledType type, Representation representation);

	long abiAlignmentInBits(CompiledType type, Representation representation);

	/**
	 * Structural offset of a field inside the value representation of its owner.
	 */
	long fieldOffsetInBits(CompiledType owner, FieldLayout field);

	/**
	 * Offset of the field data inside the object representation (the runtime object header size).
	 */
	long objectHeaderSizeInBits(CompiledType owner);

	/**
	 * The native pointer-sized signed integer ({@code IntPtr}).
	 */
	CompiledType getNativeIntType();
}
