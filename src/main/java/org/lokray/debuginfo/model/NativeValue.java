package org.lokray.debuginfo.model;

/**
 * A value produced by the code generator: a function, or the storage slot
 * (alloca) of a local or an argument.
 */
public interface NativeValue
{
	/**
	 * @return the IR name of the value, may be empty.
	 */
	String getName();
}
