package org.lokray.debuginfo.testutils;

import org.lokray.debuginfo.model.CompiledType;
import org.lokray.debuginfo.model.FieldLayout;
import org.lokray.debuginfo.model.MetadataKind;
import org.lokray.debuginfo.model.Representation;
import org.lokray.debuginfo.model.TypeSystem;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 64-bit type system for tests. Fields are packed without padding in struct
 * index order; reference types are pointer sized; the object header is 64 bits.
 */
public class FakeTypeSystem implements TypeSystem
{
	public static final FakeType INT32 = FakeType.primitive(MetadataKind.INT32, "Int32");
	public static final FakeType INT64 = FakeType.primitive(MetadataKind.INT64, "Int64");
	public static final FakeType BOOLEAN = FakeType.primitive(MetadataKind.BOOLEAN, "Boolean");
	public static final FakeType DOUBLE = FakeType.primitive(MetadataKind.DOUBLE, "Double");
	public static final FakeType INT_PTR = FakeType.primitive(MetadataKind.INT_PTR, "IntPtr");

	private final Map<CompiledType, FakeClass> classes = new IdentityHashMap<>();
	private final Map<CompiledType, Long> sizeOverrides = new HashMap<>();
	private CompiledType nativeIntType = INT_PTR;
	private long objectHeaderSizeInBits = 64;

	@Override
	public FakeClass getClass(CompiledType type)
	{
		return classes.computeIfAbsent(type, FakeClass::new);
	}

	public void setBaseClass(CompiledType derived, CompiledType base)
	{
		getClass(derived).setBaseClass(getClass(base));
	}

	@Override
	public long abiSizeInBits(CompiledType type, Representation representation)
	{
		Long override = sizeOverrides.get(type);
		if (override != null)
		{
			return override;
		}

		switch (type.getMetadataKind())
		{
			case BOOLEAN:
			case SBYTE:
			case BYTE:
				return 8;
			case INT16:
			case UINT16:
			case CHAR:
				return 16;
			case INT32:
			case UINT32:
			case SINGLE:
				return 32;
			default:
				break;
		}

		if (type.isEnum())
		{
			return abiSizeInBits(type.getEnumUnderlyingType(), representation);
		}
		if (type.getMetadataKind().isAggregate())
		{
			boolean reference = !type.isValueType();
			if (representation == Representation.DEFAULT && reference)
			{
				return 64;
			}
			long size = fieldsSize(type);
			return reference && representation == Representation.OBJECT ? size + objectHeaderSizeInBits : size;
		}
		return 64;
	}

	private long fieldsSize(CompiledType type)
	{
		long size = 0;
		for (FieldLayout field : type.getFields().orElse(List.of()))
		{
			size += abiSizeInBits(field.getType(), Representation.DEFAULT);
		}
		return size;
	}

	@Override
	public long abiAlignmentInBits(CompiledType type, Representation representation)
	{
		return Math.min(64, Math.max(8, abiSizeInBits(type, Representation.DEFAULT)));
	}

	@Override
	public long fieldOffsetInBits(CompiledType owner, FieldLayout field)
	{
		long offset = 0;
		for (FieldLayout other : owner.getFields().orElse(List.of()))
		{
			if (other.getStructIndex() < field.getStructIndex())
			{
				offset += abiSizeInBits(other.getType(), Representation.DEFAULT);
			}
		}
		return offset;
	}

	@Override
	public long objectHeaderSizeInBits(CompiledType owner)
	{
		return objectHeaderSizeInBits;
	}

	public void setObjectHeaderSizeInBits(long objectHeaderSizeInBits)
	{
		this.objectHeaderSizeInBits = objectHeaderSizeInBits;
	}

	public void setSize(CompiledType type, long sizeInBits)
	{
		sizeOverrides.put(type, sizeInBits);
	}

	@Override
	public CompiledType getNativeIntType()
	{
		return nativeIntType;
	}

	public void setNativeIntType(CompiledType nativeIntType)
	{
		this.nativeIntType = nativeIntType;
	}
}
