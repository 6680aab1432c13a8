package org.lokray.debuginfo.codegen;

public enum ClassState
{
	/**
	 * Opaque declaration of a type defined outside the unit. Terminal, never gets members.
	 */
	FORWARD_DECLARED,
	/**
	 * Full class description of a type defined in the unit. Members are filled in once by the completion worklist.
	 */
	COMPLETE
}
