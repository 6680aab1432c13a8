package org.lokray.debuginfo.model;

/**
 * How values of a type live on the evaluation stack: inline, or as a pointer to
 * a heap object that starts with the runtime object header.
 */
public enum StackRepresentation
{
	VALUE,
	OBJECT
}
