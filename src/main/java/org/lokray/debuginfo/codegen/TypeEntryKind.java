package org.lokray.debuginfo.codegen;

/**
 * How a type cache entry was produced.
 */
public enum TypeEntryKind
{
	BASIC,
	POINTER,
	// shares the handle of the underlying integer type
	ENUM,
	// shares the handle of its class entry
	VALUE_CLASS,
	REFERENCE_CLASS,
	// shares the handle of the native integer type
	FALLBACK
}
