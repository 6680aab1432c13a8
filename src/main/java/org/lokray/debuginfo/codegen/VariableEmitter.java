package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DwarfTag;
import org.lokray.debuginfo.model.NativeSlot;
import org.lokray.debuginfo.model.SequencePoint;

/**
 * Emits one debug variable and binds it to its native storage.
 */
public class VariableEmitter
{
	private final DebugCompilationUnit unit;
	private final DebugDescriptor file;

	public VariableEmitter(DebugCompilationUnit unit, DebugDescriptor file)
	{
		this.unit = unit;
		this.file = file;
	}

	/**
	 * @param argIndex 1-based argument position, 0 for locals
	 */
	public DebugDescriptor emit(DebugDescriptor scope, NativeSlot slot, DwarfTag tag, String name,
	                            SequencePoint sequencePoint, int argIndex)
	{
		DebugDescriptor debugType;
		unit.getLock().lock();
		try
		{
			TypeDebugCatalog catalog = unit.getTypeCatalog();
			catalog.debugTypeOf(slot.getType());

			// Fields and other dependent types; deferred until here to break cycles
			unit.getWorklist().drain();

			// Read it again, completion rewrites class descriptors
			debugType = catalog.debugTypeOf(slot.getType());
		}
		finally
		{
			unit.getLock().unlock();
		}

		int line = sequencePoint != null ? sequencePoint.getStartLine() : 0;
		DebugDescriptor variable = unit.getBuilder().createLocalVariable(scope, tag, name, file, line, debugType, argIndex);
		unit.getBuilder().bindVariableDeclaration(slot.getStorage(), variable);
		return variable;
	}
}
