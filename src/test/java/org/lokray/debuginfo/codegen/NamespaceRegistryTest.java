package org.lokray.debuginfo.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.testutils.RecordingMetadataBuilder;
import org.lokray.debuginfo.testutils.RecordingMetadataBuilder.Node;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NamespaceRegistry}.
 */
class NamespaceRegistryTest
{
	private RecordingMetadataBuilder builder;
	private ReentrantLock lock;
	private NamespaceRegistry registry;

	@BeforeEach
	void setUp()
	{
		builder = new RecordingMetadataBuilder();
		lock = new ReentrantLock();
		registry = new NamespaceRegistry(builder, lock);
	}

	@Test
	@Tag("unit")
	void resolve_prefixOfResolvedPath_shouldReuseIntermediateNamespace()
	{
		DebugDescriptor abc = registry.resolve("A.B.C");
		assertThat(registry.size()).isEqualTo(3);

		DebugDescriptor ab = registry.resolve("A.B");

		assertThat(registry.size()).isEqualTo(3);
		assertThat(builder.count("createNamespace")).isEqualTo(3);
		assertThat(((Node) abc).scope).isSameAs(ab);
		assertThat(((Node) ab).name).isEqualTo("B");
	}

	@Test
	@Tag("unit")
	void resolve_shouldCreateParentsBeforeChildren()
	{
		Node c = (Node) registry.resolve("A.B.C");
		Node b = (Node) c.scope;
		Node a = (Node) b.scope;

		assertThat(a.name).isEqualTo("A");
		assertThat(a.scope).isSameAs(DebugDescriptor.EMPTY);
		assertThat(a.id).isLessThan(b.id);
		assertThat(b.id).isLessThan(c.id);
		assertThat(registry.paths()).containsExactly("A", "A.B", "A.B.C");
	}

	@Test
	@Tag("unit")
	void resolve_samePathTwice_shouldBeIdempotent()
	{
		DebugDescriptor first = registry.resolve("System.Collections");
		DebugDescriptor second = registry.resolve("System.Collections");

		assertThat(second).isSameAs(first);
		assertThat(builder.count("createNamespace")).isEqualTo(2);
	}

	@Test
	@Tag("unit")
	void resolve_emptyPath_shouldReturnGlobalNamespace()
	{
		assertThat(registry.resolve("")).isSameAs(DebugDescriptor.EMPTY);
		assertThat(registry.resolve(null)).isSameAs(DebugDescriptor.EMPTY);
		assertThat(registry.size()).isZero();
	}

	@Test
	@Tag("unit")
	void resolve_siblingNamespaces_shouldShareParent()
	{
		Node collections = (Node) registry.resolve("System.Collections");
		Node io = (Node) registry.resolve("System.IO");

		assertThat(collections.scope).isSameAs(io.scope);
		assertThat(registry.size()).isEqualTo(3);
	}

	@Test
	@Tag("unit")
	void size_shouldWaitForUnitLock() throws Exception
	{
		registry.resolve("A.B");
		ExecutorService executor = Executors.newSingleThreadExecutor();
		lock.lock();
		try
		{
			Callable<Integer> sizeCall = registry::size;
			Future<Integer> size = executor.submit(sizeCall);
			Thread.sleep(100);
			assertThat(size.isDone()).isFalse();

			lock.unlock();
			assertThat(size.get(5, TimeUnit.SECONDS)).isEqualTo(2);
		}
		finally
		{
			if (lock.isHeldByCurrentThread())
			{
				lock.unlock();
			}
			executor.shutdownNow();
		}
	}
}
