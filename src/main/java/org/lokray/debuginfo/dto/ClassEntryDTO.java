package org.lokray.debuginfo.dto;

public class ClassEntryDTO
{
	public String name;
	public String state;
	public boolean membersFinalized;
	public int memberCount;
	public boolean parked;
}
