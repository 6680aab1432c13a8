package org.lokray.debuginfo.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DwarfTag;
import org.lokray.debuginfo.model.CompiledFunction;
import org.lokray.debuginfo.model.Instruction;
import org.lokray.debuginfo.model.LocalVariable;
import org.lokray.debuginfo.model.MethodBody;
import org.lokray.debuginfo.model.NativeSlot;
import org.lokray.debuginfo.model.ScopeNode;
import org.lokray.debuginfo.model.SequencePoint;
import org.lokray.debuginfo.testutils.RecordingMetadataBuilder;
import org.lokray.debuginfo.testutils.RecordingMetadataBuilder.Node;
import org.lokray.debuginfo.testutils.FakeNativeValue;
import org.lokray.debuginfo.testutils.FakeType;
import org.lokray.debuginfo.testutils.FakeTypeSystem;
import org.lokray.debuginfo.util.DebugInfoOptions;
import org.lokray.debuginfo.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ScopeTracker}: push/pop along the instruction stream,
 * lexical blocks, locations and scope locals.
 */
class ScopeTrackerTest
{
	private static final String SOURCE = "/src/app/Program.cs";

	private RecordingMetadataBuilder builder;
	private ErrorHandler errorHandler;
	private DebugCompilationUnit unit;
	private DebugDescriptor file;
	private DebugDescriptor functionScope;

	@BeforeEach
	void setUp()
	{
		builder = new RecordingMetadataBuilder();
		errorHandler = new ErrorHandler();
		unit = new DebugCompilationUnit(builder, new FakeTypeSystem(), DebugInfoOptions.defaults(), errorHandler, "App.dll");
		file = builder.createFile("Program.cs", "/src/app");
		functionScope = builder.createLexicalBlock(DebugDescriptor.EMPTY, file, 1, 1);
	}

	private static Instruction at(int offset)
	{
		return new Instruction(offset, new SequencePoint(SOURCE, offset + 10, 5));
	}

	private ScopeTracker tracker(ScopeNode root, List<NativeSlot> locals)
	{
		List<Instruction> instructions = new ArrayList<>();
		instructions.add(root.getStart());
		MethodBody body = new MethodBody(instructions, root, null);
		CompiledFunction function = new CompiledFunction(FakeType.referenceType("App", "Program"), "Main", body,
				locals, List.of(), new FakeNativeValue("Main"));
		ScopeTracker tracker = new ScopeTracker(unit, function, file, new LocationEmitter(builder), new VariableEmitter(unit, file));
		tracker.createRoot(root, functionScope);
		return tracker;
	}

	@Test
	@Tag("unit")
	void advance_nestedScope_shouldBePushedAtStartAndPoppedAfterEnd()
	{
		ScopeNode child = new ScopeNode(at(2), at(5));
		ScopeNode root = new ScopeNode(at(0), at(9)).addScope(child);
		ScopeTracker tracker = tracker(root, List.of());

		List<Integer> depths = new ArrayList<>();
		for (int offset : new int[]{0, 1, 2, 3, 5, 7, 9})
		{
			tracker.advance(at(offset));
			depths.add(tracker.depth());
		}

		assertThat(depths).containsExactly(1, 1, 2, 2, 2, 1, 1);
		assertThat(builder.count("createLexicalBlock")).isEqualTo(2);
		assertThat(tracker.getScopes()).hasSize(2);
		assertThat(tracker.current()).isSameAs(tracker.getRoot());
	}

	@Test
	@Tag("unit")
	void advance_insideChild_shouldTargetLexicalBlock()
	{
		ScopeNode child = new ScopeNode(at(2), at(5));
		ScopeNode root = new ScopeNode(at(0), at(9)).addScope(child);
		ScopeTracker tracker = tracker(root, List.of());

		tracker.advance(at(2));
		tracker.advance(at(3));

		Node block = (Node) tracker.current().getGenerated();
		assertThat(block.kind).isEqualTo("block");
		assertThat(block.scope).isSameAs(functionScope);
		assertThat(block.line).isEqualTo(12);
		assertThat(builder.lastLocation().scope).isSameAs(block);
		assertThat(builder.lastLocation().line).isEqualTo(13);

		tracker.advance(at(7));
		assertThat(builder.lastLocation().scope).isSameAs(functionScope);
	}

	@Test
	@Tag("unit")
	void advance_zeroWidthNestedScopes_shouldPushAndPopTogether()
	{
		ScopeNode inner = new ScopeNode(at(2), at(2));
		ScopeNode outer = new ScopeNode(at(2), at(2)).addScope(inner);
		ScopeNode root = new ScopeNode(at(0), at(9)).addScope(outer);
		ScopeTracker tracker = tracker(root, List.of());

		tracker.advance(at(0));
		tracker.advance(at(2));
		assertThat(tracker.depth()).isEqualTo(3);
		assertThat(tracker.getScopes().get(2).getParentIndex()).isEqualTo(1);

		tracker.advance(at(3));
		assertThat(tracker.depth()).isEqualTo(1);
	}

	@Test
	@Tag("unit")
	void advance_rootIsNeverPopped()
	{
		ScopeNode root = new ScopeNode(at(0), at(3));
		ScopeTracker tracker = tracker(root, List.of());

		tracker.advance(at(0));
		tracker.advance(at(50));

		assertThat(tracker.depth()).isEqualTo(1);
		assertThat(tracker.current().isRoot()).isTrue();
	}

	@Test
	@Tag("unit")
	void createScope_withoutStartPosition_shouldFallBackToParentDescriptor()
	{
		ScopeNode child = new ScopeNode(new Instruction(2), at(5));
		ScopeNode root = new ScopeNode(at(0), at(9)).addScope(child);
		ScopeTracker tracker = tracker(root, List.of());

		tracker.advance(at(2));

		assertThat(tracker.depth()).isEqualTo(2);
		assertThat(tracker.current().getGenerated()).isNull();
		assertThat(tracker.effectiveDescriptor(tracker.current())).isSameAs(functionScope);
		assertThat(builder.count("createLexicalBlock")).isEqualTo(1);

		tracker.advance(at(3));
		assertThat(builder.lastLocation().scope).isSameAs(functionScope);
	}

	@Test
	@Tag("unit")
	void advance_instructionWithoutSequencePoint_shouldKeepLocation()
	{
		ScopeNode root = new ScopeNode(at(0), at(9));
		ScopeTracker tracker = tracker(root, List.of());

		tracker.advance(at(0));
		long locations = builder.count("setCurrentLocation");
		tracker.advance(new Instruction(1));

		assertThat(builder.count("setCurrentLocation")).isEqualTo(locations);
		assertThat(builder.lastLocation().line).isEqualTo(10);
	}

	@Test
	@Tag("unit")
	void enterScope_shouldDeclareScopeLocals()
	{
		NativeSlot counter = new NativeSlot(new FakeNativeValue("counter.addr"), FakeTypeSystem.INT32);
		NativeSlot temp = new NativeSlot(new FakeNativeValue("tmp.addr"), FakeTypeSystem.INT64);
		ScopeNode child = new ScopeNode(at(2), at(5))
				.addVariable(new LocalVariable(0, "counter"))
				.addVariable(new LocalVariable(1, null));
		ScopeNode root = new ScopeNode(at(0), at(9)).addScope(child);
		ScopeTracker tracker = tracker(root, List.of(counter, temp));

		tracker.advance(at(2));

		List<Node> variables = builder.nodesOfKind("variable");
		assertThat(variables).extracting(v -> v.name).containsExactly("counter", "var1");
		assertThat(variables).extracting(v -> v.tag).containsOnly(DwarfTag.AUTO_VARIABLE);
		assertThat(variables.get(0).scope).isSameAs(tracker.current().getGenerated());
		assertThat(variables.get(0).line).isEqualTo(12);
		assertThat(variables.get(0).argIndex).isZero();
		assertThat(builder.getBindings()).extracting(b -> b.storage).containsExactly(counter.getStorage(), temp.getStorage());
	}

	@Test
	@Tag("unit")
	void enterScope_localOutOfRange_shouldWarnAndSkip()
	{
		ScopeNode root = new ScopeNode(at(0), at(9)).addVariable(new LocalVariable(3, "ghost"));
		ScopeTracker tracker = tracker(root, List.of());

		tracker.enterScope(tracker.getRoot());

		assertThat(builder.count("createLocalVariable")).isZero();
		assertThat(errorHandler.getWarnings()).hasSize(1);
		assertThat(errorHandler.getWarnings().get(0)).contains("ghost", "local 3");
	}

	@Test
	@Tag("unit")
	void createRoot_twice_shouldThrow()
	{
		ScopeTracker tracker = tracker(new ScopeNode(at(0), at(1)), List.of());

		assertThatThrownBy(() -> tracker.createRoot(null, functionScope)).isInstanceOf(IllegalStateException.class);
	}

	@Test
	@Tag("unit")
	void localName_shouldNameUnnamedLocalsByIndex()
	{
		assertThat(ScopeTracker.localName("x", 0)).isEqualTo("x");
		assertThat(ScopeTracker.localName("", 4)).isEqualTo("var4");
		assertThat(ScopeTracker.localName(null, 7)).isEqualTo("var7");
	}
}
