package org.lokray.debuginfo.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DebugMetadataBuilder;
import org.lokray.debuginfo.metadata.DwarfEncoding;
import org.lokray.debuginfo.metadata.DwarfTag;
import org.lokray.debuginfo.model.NativeSlot;
import org.lokray.debuginfo.model.NativeValue;
import org.lokray.debuginfo.model.SequencePoint;
import org.lokray.debuginfo.testutils.FakeTypeSystem;
import org.lokray.debuginfo.util.DebugInfoOptions;
import org.lokray.debuginfo.util.ErrorHandler;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class VariableEmitterTest
{
	@Mock
	private DebugMetadataBuilder builder;

	@Mock
	private DebugDescriptor scope;

	@Mock
	private DebugDescriptor file;

	@Mock
	private DebugDescriptor intType;

	@Mock
	private DebugDescriptor variable;

	@Mock
	private NativeValue storage;

	private DebugCompilationUnit unit;

	@BeforeEach
	void setUp()
	{
		unit = new DebugCompilationUnit(builder, new FakeTypeSystem(), DebugInfoOptions.defaults(), new ErrorHandler(), "App.dll");
	}

	@Test
	void emit_shouldCreateVariableAndBindItToStorage()
	{
		when(builder.createBasicType(eq("int"), anyLong(), anyLong(), eq(DwarfEncoding.SIGNED))).thenReturn(intType);
		when(builder.createLocalVariable(scope, DwarfTag.ARG_VARIABLE, "count", file, 7, intType, 2)).thenReturn(variable);

		VariableEmitter emitter = new VariableEmitter(unit, file);
		DebugDescriptor result = emitter.emit(scope, new NativeSlot(storage, FakeTypeSystem.INT32), DwarfTag.ARG_VARIABLE,
				"count", new SequencePoint("/src/Program.cs", 7, 3), 2);

		assertThat(result).isSameAs(variable);
		InOrder order = inOrder(builder);
		order.verify(builder).createBasicType(any(), anyLong(), anyLong(), any());
		order.verify(builder).createLocalVariable(scope, DwarfTag.ARG_VARIABLE, "count", file, 7, intType, 2);
		order.verify(builder).bindVariableDeclaration(storage, variable);
	}

	@Test
	void emit_withoutSequencePoint_shouldUseLineZero()
	{
		when(builder.createBasicType(eq("int"), anyLong(), anyLong(), eq(DwarfEncoding.SIGNED))).thenReturn(intType);
		when(builder.createLocalVariable(scope, DwarfTag.AUTO_VARIABLE, "var0", file, 0, intType, 0)).thenReturn(variable);

		VariableEmitter emitter = new VariableEmitter(unit, file);
		DebugDescriptor result = emitter.emit(scope, new NativeSlot(storage, FakeTypeSystem.INT32), DwarfTag.AUTO_VARIABLE,
				"var0", null, 0);

		assertThat(result).isSameAs(variable);
	}
}
