package com.netbric.vmdkops.vim;

public enum ControllerKind
{
	PARAVIRTUAL, LSI_LOGIC, LSI_LOGIC_SAS, BUS_LOGIC, OTHER
}
