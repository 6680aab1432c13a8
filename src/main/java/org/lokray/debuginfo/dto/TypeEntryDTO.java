package org.lokray.debuginfo.dto;

public class TypeEntryDTO
{
	public String type;
	public String metadataKind;
	public String kind;
	public int slot;
}
