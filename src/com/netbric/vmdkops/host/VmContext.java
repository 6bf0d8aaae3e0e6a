package com.netbric.vmdkops.host;

/**
 * Identity of the VM that sent the current request.
 */
public class VmContext
{
	public final String name;
	public final String uuid;
	public final String configPath;

	public VmContext(String name, String uuid, String configPath)
	{
		this.name = name;
		this.uuid = uuid;
		this.configPath = configPath;
	}

	@Override
	public String toString()
	{
		return String.format("VM %s uuid=%s cfg=%s", name, uuid, configPath);
	}
}
