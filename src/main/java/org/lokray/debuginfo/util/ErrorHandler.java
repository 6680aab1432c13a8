// File: src/main/java/org/lokray/debuginfo/util/ErrorHandler.java
package org.lokray.debuginfo.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the degradations that happen while synthesizing debug information.
 * None of them abort compilation; they are reported so the driver can tell the
 * user that some debug info is approximate.
 */
public class ErrorHandler
{
	private final List<String> warnings = new ArrayList<>();

	public void logWarning(String context, String msg)
	{
		String warning = String.format("[Debug Info] %s - %s", context, msg);
		Debug.logWarning(warning);
		warnings.add(warning);
	}

	public boolean hasWarnings()
	{
		return !warnings.isEmpty();
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}
}
