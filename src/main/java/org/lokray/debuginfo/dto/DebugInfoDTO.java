package org.lokray.debuginfo.dto;

import java.util.ArrayList;
import java.util.List;

public class DebugInfoDTO
{
	public String module;
	public List<String> namespaces = new ArrayList<>();
	public List<ClassEntryDTO> classes = new ArrayList<>();
	public List<TypeEntryDTO> types = new ArrayList<>();
	public List<String> warnings = new ArrayList<>();
}
