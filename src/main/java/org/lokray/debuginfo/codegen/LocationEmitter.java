package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DebugMetadataBuilder;
import org.lokray.debuginfo.model.SequencePoint;

/**
 * Points the builder's current location at a source position. Every native
 * instruction generated afterwards carries that location.
 */
public class LocationEmitter
{
	private final DebugMetadataBuilder builder;
	private int line;
	private int column;
	private DebugDescriptor scope;

	public LocationEmitter(DebugMetadataBuilder builder)
	{
		this.builder = builder;
	}

	/**
	 * @param sequencePoint the position, {@code null} gives line and column 0
	 * @param scope         the innermost scope with a generated descriptor
	 */
	public void setLocation(SequencePoint sequencePoint, DebugDescriptor scope)
	{
		this.line = sequencePoint != null ? sequencePoint.getStartLine() : 0;
		this.column = sequencePoint != null ? sequencePoint.getStartColumn() : 0;
		this.scope = scope;
		builder.setCurrentLocation(line, column, scope);
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public DebugDescriptor getScope()
	{
		return scope;
	}
}
