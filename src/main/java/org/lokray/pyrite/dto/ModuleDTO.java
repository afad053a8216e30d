package org.lokray.pyrite.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ModuleDTO
{
	public String name;
	public String path;
	public Map<String, List<String>> imports = new LinkedHashMap<>();
	public List<DeclarationDTO> declarations = new ArrayList<>();
	public List<ModuleDTO> submodules = new ArrayList<>();
}
