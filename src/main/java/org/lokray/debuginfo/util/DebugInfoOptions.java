package org.lokray.debuginfo.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Debug-information settings of the compiler driver.
 * <p>
 * {@link #parse(String[])} only consumes the flags it knows about; everything
 * else is handed back through {@link #getRemainingArgs()} so the driver's own
 * argument parser can process it.
 */
public class DebugInfoOptions
{
	public static final String DEFAULT_PRODUCER = "nebulac 0.1.0-alpha";
	public static final String DEFAULT_NAMESPACE_SEPARATOR = "::";

	private final List<String> remainingArgs = new ArrayList<>();
	private boolean enabled = false;
	private boolean verbose = false;
	private boolean optimized = false;
	private String producer = DEFAULT_PRODUCER;
	// gdb and lldb both understand '::' as namespace separator
	private String namespaceSeparator = DEFAULT_NAMESPACE_SEPARATOR;
	private Path dumpPath = null;

	private DebugInfoOptions()
	{
	}

	/**
	 * Options with debug info enabled and everything else at its default.
	 */
	public static DebugInfoOptions defaults()
	{
		DebugInfoOptions options = new DebugInfoOptions();
		options.enabled = true;
		return options;
	}

	public static DebugInfoOptions parse(String[] args)
	{
		DebugInfoOptions parsed = new DebugInfoOptions();

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];

			try
			{
				// --- Flags with no argument ---
				if (arg.equals("-g") || arg.equals("--debug"))
				{
					parsed.enabled = true;
					continue;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsed.verbose = true;
					Debug.ENABLE_DEBUG = true;
					parsed.remainingArgs.add(arg); // the driver wants it too
					continue;
				}
				if (arg.equals("--optimized"))
				{
					parsed.optimized = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("--producer"))
				{
					parsed.producer = getNextArg(args, i + 1, arg);
					i++;
					continue;
				}
				if (arg.equals("--namespace-separator"))
				{
					parsed.namespaceSeparator = getNextArg(args, i + 1, arg);
					i++;
					continue;
				}
				if (arg.equals("--dump-debug-types"))
				{
					parsed.dumpPath = Paths.get(getNextArg(args, i + 1, arg));
					i++;
					parsed.enabled = true;
					continue;
				}

				parsed.remainingArgs.add(arg);
			}
			catch (IllegalArgumentException e)
			{
				Debug.logError(e.getMessage());
			}
		}

		return parsed;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	// --- Getters ---

	public List<String> getRemainingArgs()
	{
		return remainingArgs;
	}

	public boolean isEnabled()
	{
		return enabled;
	}

	public boolean isVerbose()
	{
		return verbose;
	}

	public boolean isOptimized()
	{
		return optimized;
	}

	public String getProducer()
	{
		return producer;
	}

	public String getNamespaceSeparator()
	{
		return namespaceSeparator;
	}

	public Path getDumpPath()
	{
		return dumpPath;
	}
}
