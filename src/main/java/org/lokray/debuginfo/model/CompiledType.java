// File: src/main/java/org/lokray/debuginfo/model/CompiledType.java
package org.lokray.debuginfo.model;

import java.util.List;
import java.util.Optional;

/**
 * A type of the managed type system, as seen by debug info synthesis.
 * <p>
 * Implementations are provided by the type system. Instances are used as cache
 * keys, so they must have stable {@code equals}/{@code hashCode}.
 */
public interface CompiledType
{
	MetadataKind getMetadataKind();

	/**
	 * Short name, e.g. {@code List`1}.
	 */
	String getName();

	/**
	 * Dotted full name, e.g. {@code System.Collections.Generic.List`1}.
	 */
	String getFullName();

	/**
	 * Dotted namespace path, empty for the global namespace.
	 */
	String getNamespace();

	/**
	 * Whether the type is defined in the unit being compiled.
	 */
	boolean isLocal();

	default boolean isValueType()
	{
		return getStackRepresentation() == StackRepresentation.VALUE;
	}

	default boolean isEnum()
	{
		return false;
	}

	StackRepresentation getStackRepresentation();

	/**
	 * Whether field offsets are given explicitly instead of computed by the native layout.
	 */
	default boolean hasExplicitLayout()
	{
		return false;
	}

	/**
	 * Pointee of a pointer or by-reference type.
	 */
	default CompiledType getElementType()
	{
		throw new UnsupportedOperationException(getFullName() + " has no element type");
	}

	/**
	 * Underlying integer type of an enum.
	 */
	default CompiledType getEnumUnderlyingType()
	{
		throw new UnsupportedOperationException(getFullName() + " is not an enum");
	}

	/**
	 * Fields in layout order, or empty while the layout has not been computed yet.
	 */
	Optional<List<FieldLayout>> getFields();
}
