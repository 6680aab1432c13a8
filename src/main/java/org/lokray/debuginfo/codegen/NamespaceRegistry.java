// File: src/main/java/org/lokray/debuginfo/codegen/NamespaceRegistry.java
package org.lokray.debuginfo.codegen;

import org.lokray.debuginfo.metadata.DebugDescriptor;
import org.lokray.debuginfo.metadata.DebugMetadataBuilder;
import org.lokray.debuginfo.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Debug namespaces of the unit, kept as a trie keyed by path segment. A parent
 * namespace is always created before its children and nothing is ever removed.
 */
public class NamespaceRegistry
{
	private static final String SEPARATOR_REGEX = "\\.";

	private final DebugMetadataBuilder builder;
	private final ReentrantLock lock;
	private final Node root = new Node("", DebugDescriptor.EMPTY);
	private int size = 0;

	public NamespaceRegistry(DebugMetadataBuilder builder, ReentrantLock lock)
	{
		this.builder = builder;
		this.lock = lock;
	}

	/**
	 * Returns the debug namespace for a dotted path, creating the missing
	 * segments from the outermost inwards.
	 *
	 * @param path dotted namespace, e.g. {@code System.Collections}; empty for the global namespace
	 * @return the namespace descriptor, {@link DebugDescriptor#EMPTY} for the global namespace
	 */
	public DebugDescriptor resolve(String path)
	{
		if (path == null || path.isEmpty())
		{
			return DebugDescriptor.EMPTY;
		}

		lock.lock();
		try
		{
			Node node = root;
			for (String segment : path.split(SEPARATOR_REGEX, -1))
			{
				Node child = node.children.get(segment);
				if (child == null)
				{
					DebugDescriptor descriptor = builder.createNamespace(node.descriptor, segment);
					child = new Node(segment, descriptor);
					node.children.put(segment, child);
					size++;
					Debug.logDebug("NamespaceRegistry: created namespace '" + segment + "' for " + path);
				}
				node = child;
			}
			return node.descriptor;
		}
		finally
		{
			lock.unlock();
		}
	}

	/**
	 * Number of namespace descriptors created so far.
	 */
	public int size()
	{
		lock.lock();
		try
		{
			return size;
		}
		finally
		{
			lock.unlock();
		}
	}

	/**
	 * Full paths of all created namespaces, parents before children.
	 */
	public List<String> paths()
	{
		List<String> out = new ArrayList<>();
		lock.lock();
		try
		{
			for (Node child : root.children.values())
			{
				collect(child, child.segment, out);
			}
		}
		finally
		{
			lock.unlock();
		}
		return out;
	}

	private static void collect(Node node, String path, List<String> out)
	{
		out.add(path);
		for (Node child : node.children.values())
		{
			collect(child, path + "." + child.segment, out);
		}
	}

	private static class Node
	{
		final String segment;
		final DebugDescriptor descriptor;
		final Map<String, Node> children = new LinkedHashMap<>();

		Node(String segment, DebugDescriptor descriptor)
		{
			this.segment = segment;
			this.descriptor = descriptor;
		}
	}
}
