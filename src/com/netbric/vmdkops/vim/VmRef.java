package com.netbric.vmdkops.vim;

/**
 * Handle of a VM inside one hypervisor session.
 */
public class VmRef
{
	public final String id;
	public final String name;

	public VmRef(String id, String name)
	{
		this.id = id;
		this.name = name;
	}

	@Override
	public String toString()
	{
		return name + "(" + id + ")";
	}
}
