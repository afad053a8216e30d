package org.lokray.pyrite.dto;

import java.util.ArrayList;
import java.util.List;

public class DeclarationDTO
{
	public String kind;
	public String name;
	public String type;
	public List<DeclarationDTO> members = new ArrayList<>();
}
