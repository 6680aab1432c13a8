package org.lokray.debuginfo.model;

/**
 * An instruction of a method body, reduced to what debug info needs.
 */
public class Instruction
{
	private final int offset;
	private final SequencePoint sequencePoint;

	public Instruction(int offset, SequencePoint sequencePoint)
	{
		this.offset = offset;
		this.sequencePoint = sequencePoint;
	}

	public Instruction(int offset)
	{
		this(offset, null);
	}

	public int getOffset()
	{
		return offset;
	}

	/**
	 * @return the sequence point, or {@code null} when the instruction has no source position.
	 */
	public SequencePoint getSequencePoint()
	{
		return sequencePoint;
	}

	@Override
	public String toString()
	{
		return "IL_" + String.format("%04x", offset);
	}
}
