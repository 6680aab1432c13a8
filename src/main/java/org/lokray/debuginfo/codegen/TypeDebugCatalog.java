// File: src/main/java/org/lokray/debuginfo/codegen/TypeDebugCatalog.java
package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DebugMetadataBuilder;
import org.lokray.debuginfo.metadata.DwarfEncoding;
import org.lokray.debuginfo.metadata.DwarfTag;
import org.lokray.debuginfo.model.CompiledClass;
import org.lokray.debuginfo.model.CompiledType;
import org.lokray.debuginfo.model.MetadataKind;
import org.lokray.debuginfo.model.Representation;
import org.lokray.debuginfo.model.StackRepresentation;
import org.lokray.debuginfo.model.TypeSystem;
import org.lokray.debuginfo.util.Debug;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps managed types to debug types, and aggregates to their class entries.
 * <p>
 * Class entries are inserted before anything they depend on is resolved and
 * their fields are only looked at by the {@link ClassCompletionWorklist}, which
 * is what lets self-referencing and mutually recursive types terminate.
 */
public class TypeDebugCatalog
{
	private static final Map<MetadataKind, String> PRIMITIVE_NAMES = new EnumMap<>(MetadataKind.class);
	private static final Map<MetadataKind, DwarfEncoding> PRIMITIVE_ENCODINGS = new EnumMap<>(MetadataKind.class);

	static
	{
		primitive(MetadataKind.BOOLEAN, "bool", DwarfEncoding.BOOLEAN);
		primitive(MetadataKind.SBYTE, "sbyte", DwarfEncoding.SIGNED);
		primitive(MetadataKind.BYTE, "byte", DwarfEncoding.UNSIGNED);
		primitive(MetadataKind.INT16, "short", DwarfEncoding.SIGNED);
		primitive(MetadataKind.UINT16, "ushort", DwarfEncoding.UNSIGNED);
		primitive(MetadataKind.INT32, "int", DwarfEncoding.SIGNED);
		primitive(MetadataKind.UINT32, "uint", DwarfEncoding.UNSIGNED);
		primitive(MetadataKind.INT64, "long", DwarfEncoding.SIGNED);
		primitive(MetadataKind.UINT64, "ulong", DwarfEncoding.UNSIGNED);
		primitive(MetadataKind.SINGLE, "float", DwarfEncoding.FLOAT);
		primitive(MetadataKind.DOUBLE, "double", DwarfEncoding.FLOAT);
		primitive(MetadataKind.CHAR, "char", DwarfEncoding.UNSIGNED);
		primitive(MetadataKind.INT_PTR, "IntPtr", DwarfEncoding.SIGNED);
		primitive(MetadataKind.UINT_PTR, "UIntPtr", DwarfEncoding.UNSIGNED);
	}

	private static void primitive(MetadataKind kind, String name, DwarfEncoding encoding)
	{
		PRIMITIVE_NAMES.put(kind, name);
		PRIMITIVE_ENCODINGS.put(kind, encoding);
	}

	private final DebugCompilationUnit unit;
	private final DebugMetadataBuilder builder;
	private final TypeSystem typeSystem;
	private final DescriptorArena arena;
	private final Map<CompiledType, TypeEntry> typeCache = new LinkedHashMap<>();
	private final Map<CompiledClass, ClassEntry> classEntries = new LinkedHashMap<>();

	TypeDebugCatalog(DebugCompilationUnit unit)
	{
		this.unit = unit;
		this.builder = unit.getBuilder();
		this.typeSystem = unit.getTypeSystem();
		this.arena = unit.getArena();
	}

	/**
	 * Returns the debug type of {@code type}, creating it (and whatever it
	 * depends on) on first request. Types of unknown kind degrade to the native
	 * integer type.
	 */
	public DebugDescriptor debugTypeOf(CompiledType type)
	{
		Objects.requireNonNull(type, "type");
		unit.getLock().lock();
		try
		{
			return arena.get(resolve(type).getHandle());
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	/**
	 * Returns the class descriptor of an aggregate: a full class type for local
	 * classes (members filled in later), a forward declaration otherwise.
	 */
	public DebugDescriptor classDebugType(CompiledClass compiledClass)
	{
		Objects.requireNonNull(compiledClass, "compiledClass");
		unit.getLock().lock();
		try
		{
			return arena.get(classEntry(compiledClass).getHandle());
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	private TypeEntry resolve(CompiledType type)
	{
		TypeEntry cached = typeCache.get(type);
		if (cached != null)
		{
			return cached;
		}

		MetadataKind kind = type.getMetadataKind();

		if (kind.isPrimitive())
		{
			long size = typeSystem.abiSizeInBits(type, Representation.DEFAULT);
			long align = typeSystem.abiAlignmentInBits(type, Representation.DEFAULT);
			DebugDescriptor basic = builder.createBasicType(PRIMITIVE_NAMES.get(kind), size, align, PRIMITIVE_ENCODINGS.get(kind));
			return cache(type, new TypeEntry(arena.allocate(basic), TypeEntryKind.BASIC));
		}

		if (kind.isPointerLike())
		{
			// Element first: an aggregate pointee is already in the class table before its fields are looked at
			DebugDescriptor element = arena.get(resolve(type.getElementType()).getHandle());

			cached = typeCache.get(type);
			if (cached != null)
			{
				return cached;
			}

			long size = typeSystem.abiSizeInBits(type, Representation.DEFAULT);
			long align = typeSystem.abiAlignmentInBits(type, Representation.DEFAULT);
			DebugDescriptor pointer = builder.createPointerType(element, size, align, type.getName());
			return cache(type, new TypeEntry(arena.allocate(pointer), TypeEntryKind.POINTER));
		}

		if (kind.isAggregate())
		{
			if (type.isEnum())
			{
				TypeEntry underlying = resolve(type.getEnumUnderlyingType());
				return cache(type, new TypeEntry(underlying.getHandle(), TypeEntryKind.ENUM));
			}

			ClassEntry classEntry = classEntry(typeSystem.getClass(type));

			// Might have been done through recursion already
			cached = typeCache.get(type);
			if (cached != null)
			{
				return cached;
			}

			if (type.isValueType())
			{
				// Same slot as the class entry, so completing the class updates this entry too
				return cache(type, new TypeEntry(classEntry.getHandle(), TypeEntryKind.VALUE_CLASS));
			}

			// Reference types are passed around as pointers to the object
			long size = typeSystem.abiSizeInBits(type, Representation.DEFAULT);
			long align = typeSystem.abiAlignmentInBits(type, Representation.DEFAULT);
			DebugDescriptor pointer = builder.createPointerType(arena.get(classEntry.getHandle()), size, align, "");
			return cache(type, new TypeEntry(arena.allocate(pointer), TypeEntryKind.REFERENCE_CLASS));
		}

		return fallback(type);
	}

	private TypeEntry fallback(CompiledType type)
	{
		CompiledType nativeInt = typeSystem.getNativeIntType();
		if (!nativeInt.getMetadataKind().isPrimitive())
		{
			throw new IllegalStateException("The native integer type must be primitive, got " + nativeInt.getMetadataKind());
		}

		unit.getErrorHandler().logWarning(type.getFullName(),
				"no debug type for metadata kind " + type.getMetadataKind() + ", described as " + nativeInt.getName());
		TypeEntry nativeEntry = resolve(nativeInt);
		return cache(type, new TypeEntry(nativeEntry.getHandle(), TypeEntryKind.FALLBACK));
	}

	private TypeEntry cache(CompiledType type, TypeEntry entry)
	{
		typeCache.put(type, entry);
		return entry;
	}

	ClassEntry classEntry(CompiledClass compiledClass)
	{
		ClassEntry entry = classEntries.get(compiledClass);
		if (entry != null)
		{
			return entry;
		}

		CompiledType type = compiledClass.getType();
		DebugDescriptor namespace = unit.getNamespaces().resolve(type.getNamespace());

		Representation representation = type.getStackRepresentation() == StackRepresentation.OBJECT ? Representation.OBJECT : Representation.VALUE;
		long size = typeSystem.abiSizeInBits(type, representation);
		long align = typeSystem.abiAlignmentInBits(type, representation);

		if (type.isLocal())
		{
			CompiledClass baseClass = compiledClass.getBaseClass();
			DebugDescriptor base = baseClass != null ? arena.get(classEntry(baseClass).getHandle()) : DebugDescriptor.EMPTY;

			DebugDescriptor debugClass = builder.createClassType(namespace, type.getName(), base, size, align, Collections.emptyList(), type.getFullName());
			entry = new ClassEntry(compiledClass, arena.allocate(debugClass), ClassState.COMPLETE);
			classEntries.put(compiledClass, entry);
			unit.getWorklist().enqueue(entry);
			Debug.logDebug("TypeDebugCatalog: created class " + type.getFullName() + " (" + size + " bits), members pending.");
		}
		else
		{
			DebugDescriptor declaration = builder.createForwardDeclaration(DwarfTag.CLASS_TYPE, type.getName(), namespace, size, align, type.getFullName());
			entry = new ClassEntry(compiledClass, arena.allocate(declaration), ClassState.FORWARD_DECLARED);
			classEntries.put(compiledClass, entry);
			Debug.logDebug("TypeDebugCatalog: forward declared " + type.getFullName());
		}

		return entry;
	}

	/**
	 * @return the class entry, or {@code null} if the class was never requested
	 */
	public ClassEntry getClassEntry(CompiledClass compiledClass)
	{
		unit.getLock().lock();
		try
		{
			return classEntries.get(compiledClass);
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	/**
	 * @return the type cache entry, or {@code null} if the type was never requested
	 */
	public TypeEntry getTypeEntry(CompiledType type)
	{
		unit.getLock().lock();
		try
		{
			return typeCache.get(type);
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	public List<ClassEntry> getClassEntries()
	{
		unit.getLock().lock();
		try
		{
			return List.copyOf(classEntries.values());
		}
		finally
		{
			unit.getLock().unlock();
		}
	}

	public Map<CompiledType, TypeEntry> getTypeEntries()
	{
		unit.getLock().lock();
		try
		{
			return Collections.unmodifiableMap(new LinkedHashMap<>(typeCache));
		}
		finally
		{
			unit.getLock().unlock();
		}
	}
}
