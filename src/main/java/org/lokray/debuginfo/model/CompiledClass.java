package org.lokray.debuginfo.model;

/**
 * The class view of an aggregate type: its type plus its base class link.
 */
public interface CompiledClass
{
	CompiledType getType();

	/**
	 * @return the base class, or {@code null} for roots and value types without one.
	 */
	CompiledClass getBaseClass();
}
