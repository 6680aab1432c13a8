package org.lokray.debuginfo.util;

import org.lokray.debuginfo.codegen.ClassEntry;
import org.lokray.debuginfo.codegen.DebugCompilationUnit;
import org.lokray.debuginfo.codegen.TypeEntry;
import org.lokray.debuginfo.dto.ClassEntryDTO;
import org.lokray.debuginfo.dto.DebugInfoDTO;
import org.lokray.debuginfo.dto.TypeEntryDTO;
import org.lokray.debuginfo.model.CompiledType;

import java.util.Map;

public class DebugInfoDTOConverter
{
	public static DebugInfoDTO toDTO(DebugCompilationUnit unit)
	{
		DebugInfoDTO dto = new DebugInfoDTO();
		dto.module = unit.getModuleIdentity();
		dto.namespaces.addAll(unit.getNamespaces().paths());

		for (ClassEntry entry : unit.getTypeCatalog().getClassEntries())
		{
			ClassEntryDTO classDto = new ClassEntryDTO();
			classDto.name = entry.getCompiledClass().getType().getFullName();
			classDto.state = entry.getState().name();
			classDto.membersFinalized = entry.isMembersFinalized();
			classDto.memberCount = entry.getMemberCount();
			classDto.parked = unit.getWorklist().isParked(entry.getCompiledClass());
			dto.classes.add(classDto);
		}

		for (Map.Entry<CompiledType, TypeEntry> e : unit.getTypeCatalog().getTypeEntries().entrySet())
		{
			TypeEntryDTO typeDto = new TypeEntryDTO();
			typeDto.type = e.getKey().getFullName();
			typeDto.metadataKind = e.getKey().getMetadataKind().name();
			typeDto.kind = e.getValue().getKind().name();
			typeDto.slot = e.getValue().getHandle().getIndex();
			dto.types.add(typeDto);
		}

		dto.warnings.addAll(unit.getErrorHandler().getWarnings());
		return dto;
	}
}
