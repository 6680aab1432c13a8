package org.lokray.debuginfo.model;

import java.util.Objects;

/**
 * Maps an instruction to a position in a source document.
 */
public class SequencePoint
{
	private final String documentUrl;
	private final int startLine;
	private final int startColumn;
	private final int endLine;
	private final int endColumn;

	public SequencePoint(String documentUrl, int startLine, int startColumn, int endLine, int endColumn)
	{
		this.documentUrl = Objects.requireNonNull(documentUrl, "documentUrl");
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.endLine = endLine;
		this.endColumn = endColumn;
	}

	public SequencePoint(String documentUrl, int startLine, int startColumn)
	{
		this(documentUrl, startLine, startColumn, startLine, startColumn);
	}

	public String getDocumentUrl()
	{
		return documentUrl;
	}

	public int getStartLine()
	{
		return startLine;
	}

	public int getStartColumn()
	{
		return startColumn;
	}

	public int getEndLine()
	{
		return endLine;
	}

	public int getEndColumn()
	{
		return endColumn;
	}

	@Override
	public String toString()
	{
		return documentUrl + ":" + startLine + ":" + startColumn;
	}
}
