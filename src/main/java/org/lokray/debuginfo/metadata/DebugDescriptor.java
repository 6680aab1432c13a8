package org.lokray.debuginfo.metadata;

/**
 * Opaque handle to a node created by a {@link DebugMetadataBuilder}. Never inspected
 * by the synthesis code, only cached and handed back to the builder.
 */
public interface DebugDescriptor
{
	/**
	 * "No scope" / "no type": the global namespace, a missing base class, and so on.
	 */
	DebugDescriptor EMPTY = new DebugDescriptor()
	{
		@Override
		public String toString()
		{
			return "<empty>";
		}
	};

	default boolean isEmpty()
	{
		return this == EMPTY;
	}
}
