// File: src/main/java/org/lokray/debuginfo/codegen/ClassCompletionWorklist.java
package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DebugMetadataBuilder;
import org.lokray.debuginfo.model.CompiledClass;
import org.lokray.debuginfo.model.CompiledType;
import org.lokray.debuginfo.model.FieldLayout;
import org.lokray.debuginfo.model.Representation;
import org.lokray.debuginfo.model.StackRepresentation;
import org.lokray.debuginfo.model.TypeSystem;
import org.lokray.debuginfo.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;

/**
 * Local classes whose debug description was created without members.
 * <p>
 * Members are filled in here rather than when the class is created, because
 * resolving a field type can lead back to the class itself. Draining is a loop:
 * resolving fields can enqueue further classes.
 * <p>
 * A class whose layout is not known yet is parked. Parked classes are only
 * retried on request ({@link #retry(CompiledClass)}, {@link #retryParked()}).
 */
public class ClassCompletionWorklist
{
	private final DebugCompilationUnit unit;
	private final Queue<ClassEntry> queue = new ArrayDeque<>();
	private final Map<CompiledClass, ClassEntry> parked = new LinkedHashMap<>();

	ClassCompletionWorklist(DebugCompilationUnit unit)
	{
		this.unit = unit;
	}

	void enqueue(ClassEntry entry)
	{
		if (entry.getState() != ClassState.COMPLETE)
		{
			throw new IllegalArgumentException("Forward declared classes are never completed: " + entry.getCompiledClass().getType().getFullName());
		}
		queue.add(entry);
	}

	/**
	 * Completes every queued class, including the ones queued while completing.
	 *
	 * @return the number of classes that got their members
	 */
	public int drain()
	{
		unit.getLock().lock();
		try
		{
			int completed = 0;
			ClassEntry entry;
			while ((entry = queue.poll()) != null)
			{
				if (entry.isMembersFinalized())
				{
					continue;
				}
				if (complete(entry))
				{
					completed++;
				}
			}
			return completed;
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	private boolean complete(ClassEntry entry)
	{
		CompiledType type = entry.getCompiledClass().getType();
		Optional<List<FieldLayout>> fields = type.getFields();
		if (fields.isEmpty())
		{
			parked.put(entry.getCompiledClass(), entry);
			Debug.logDebug("ClassCompletionWorklist: layout of " + type.getFullName() + " not available yet, parked.");
			return false;
		}
		parked.remove(entry.getCompiledClass());

		TypeSystem typeSystem = unit.getTypeSystem();
		DebugMetadataBuilder builder = unit.getBuilder();
		DescriptorArena arena = unit.getArena();
		TypeDebugCatalog catalog = unit.getTypeCatalog();

		DebugDescriptor owner = arena.get(entry.getHandle());
		boolean isObject = type.getStackRepresentation() == StackRepresentation.OBJECT;
		List<DebugDescriptor> members = new ArrayList<>(fields.get().size());

		for (FieldLayout field : fields.get())
		{
			DebugDescriptor fieldType = catalog.debugTypeOf(field.getType());
			long size = typeSystem.abiSizeInBits(field.getType(), Representation.DEFAULT);
			long align = typeSystem.abiAlignmentInBits(field.getType(), Representation.DEFAULT);

			long offset = type.hasExplicitLayout()
					? (long) field.getStructIndex() * 8
					: typeSystem.fieldOffsetInBits(type, field);

			// Object header (vtable pointer etc.) precedes the field data
			if (isObject)
			{
				offset += typeSystem.objectHeaderSizeInBits(type);
			}

			members.add(builder.createMemberType(owner, field.getName(), size, align, offset, fieldType));
		}

		DebugDescriptor completed = builder.setCompositeMembers(owner, members);
		arena.replace(entry.getHandle(), completed);
		entry.markMembersFinalized(members.size());

		Debug.logDebug("ClassCompletionWorklist: completed " + type.getFullName() + " with " + members.size() + " members.");
		return true;
	}

	/**
	 * Re-queues a parked class, typically once its layout has been computed, and drains.
	 *
	 * @return whether the class was parked
	 */
	public boolean retry(CompiledClass compiledClass)
	{
		unit.getLock().lock();
		try
		{
			ClassEntry entry = parked.remove(compiledClass);
			if (entry == null)
			{
				return false;
			}
			queue.add(entry);
			drain();
			return true;
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	/**
	 * Re-queues every parked class and drains once.
	 *
	 * @return the classes that are still parked afterwards
	 */
	public List<CompiledClass> retryParked()
	{
		unit.getLock().lock();
		try
		{
			Iterator<ClassEntry> it = parked.values().iterator();
			while (it.hasNext())
			{
				queue.add(it.next());
				it.remove();
			}
			drain();
			return List.copyOf(parked.keySet());
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	public boolean isQueued(CompiledClass compiledClass)
	{
		unit.getLock().lock();
		try
		{
			for (ClassEntry entry : queue)
			{
				if (entry.getCompiledClass().equals(compiledClass))
				{
					return true;
				}
			}
			return false;
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	public boolean isParked(CompiledClass compiledClass)
	{
		unit.getLock().lock();
		try
		{
			return parked.containsKey(compiledClass);
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	public int queuedCount()
	{
		unit.getLock().lock();
		try
		{
			return queue.size();
		}
		finally
		{
			unit.getLock().unlock();
		}
	}
}
