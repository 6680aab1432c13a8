package org.lokray.debuginfo.util;

public class FileUtils
{
	/**
	 * File name part of a document url; both '/' and '\' separate directories
	 * since debug documents may come from another platform.
	 */
	public static String getFileName(String url)
	{
		int separator = lastSeparator(url);
		return separator >= 0 ? url.substring(separator + 1) : url;
	}

	/**
	 * Directory part of a document url, empty when there is none.
	 */
	public static String getDirectory(String url)
	{
		int separator = lastSeparator(url);
		if (separator < 0)
		{
			return "";
		}
		// keep the root separator of "/file.cs"
		return separator == 0 ? url.substring(0, 1) : url.substring(0, separator);
	}

	private static int lastSeparator(String url)
	{
		return Math.max(url.lastIndexOf('/'), url.lastIndexOf('\\'));
	}
}
