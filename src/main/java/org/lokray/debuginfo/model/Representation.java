package org.lokray.debuginfo.model;

/**
 * Which native shape of a type an ABI query is about.
 */
public enum Representation
{
	/**
	 * The shape used for locals, arguments and fields (a pointer for reference types).
	 */
	DEFAULT,
	/**
	 * The inline field data.
	 */
	VALUE,
	/**
	 * The heap object: header followed by the field data.
	 */
	OBJECT
}
