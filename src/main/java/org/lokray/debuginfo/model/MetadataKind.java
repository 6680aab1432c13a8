package org.lokray.debuginfo.model;

/**
 * Metadata kind tag carried by every type of the managed type system.
 */
public enum MetadataKind
{
	VOID,
	BOOLEAN,
	CHAR,
	SBYTE,
	BYTE,
	INT16,
	UINT16,
	INT32,
	UINT32,
	INT64,
	UINT64,
	SINGLE,
	DOUBLE,
	STRING,
	POINTER,
	BY_REFERENCE,
	VALUE_TYPE,
	CLASS,
	VAR,
	ARRAY,
	GENERIC_INSTANCE,
	TYPED_BY_REFERENCE,
	INT_PTR,
	UINT_PTR,
	FUNCTION_POINTER,
	OBJECT,
	MVAR,
	REQUIRED_MODIFIER,
	OPTIONAL_MODIFIER,
	SENTINEL,
	PINNED;

	public boolean isPrimitive()
	{
		switch (this)
		{
			case BOOLEAN:
			case CHAR:
			case SBYTE:
			case BYTE:
			case INT16:
			case UINT16:
			case INT32:
			case UINT32:
			case INT64:
			case UINT64:
			case SINGLE:
			case DOUBLE:
			case INT_PTR:
			case UINT_PTR:
				return true;
			default:
				return false;
		}
	}

	public boolean isPointerLike()
	{
		return this == POINTER || this == BY_REFERENCE;
	}

	/**
	 * Kinds whose debug type is described by a class entry (possibly behind a pointer).
	 */
	public boolean isAggregate()
	{
		switch (this)
		{
			case ARRAY:
			case STRING:
			case TYPED_BY_REFERENCE:
			case GENERIC_INSTANCE:
			case VALUE_TYPE:
			case CLASS:
			case OBJECT:
				return true;
			default:
				return false;
		}
	}
}
