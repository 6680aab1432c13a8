package org.lokray.debuginfo.model;

/**
 * A local declared in a lexical scope: index into the function's locals plus its source name.
 */
public class LocalVariable
{
	private final int index;
	private final String name;

	public LocalVariable(int index, String name)
	{
		this.index = index;
		this.name = name;
	}

	public int getIndex()
	{
		return index;
	}

	/**
	 * @return the source name, may be {@code null} or empty for compiler generated locals.
	 */
	public String getName()
	{
		return name;
	}
}
