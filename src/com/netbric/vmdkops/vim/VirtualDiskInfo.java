package com.netbric.vmdkops.vim;

public class VirtualDiskInfo extends VirtualDeviceInfo
{
	public static final String MODE_PERSISTENT = "persistent";

	public final String backingFileName;
	public final String diskMode;
	public final String label;

	public VirtualDiskInfo(int key, int controllerKey, int unitNumber, String backingFileName)
	{
		this(key, controllerKey, unitNumber, backingFileName, null, null);
	}

	public VirtualDiskInfo(int key, int controllerKey, int unitNumber, String backingFileName, String diskMode,
			String label)
	{
		super(key, controllerKey, unitNumber);
		this.backingFileName = backingFileName;
		this.diskMode = diskMode;
		this.label = label;
	}

	@Override
	public String toString()
	{
		return String.format("disk key=%d controller=%d unit=%d backing=%s", key, controllerKey, unitNumber,
				backingFileName);
	}
}
