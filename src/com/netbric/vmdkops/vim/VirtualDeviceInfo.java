package com.netbric.vmdkops.vim;

/**
 * Immutable view of one VM device as returned by a single enumeration call.
 * Only SCSI controllers and disks are represented.
 */
public abstract class VirtualDeviceInfo
{
	public final int key;
	public final Integer controllerKey;
	public final Integer unitNumber;

	protected VirtualDeviceInfo(int key, Integer controllerKey, Integer unitNumber)
	{
		this.key = key;
		this.controllerKey = controllerKey;
		this.unitNumber = unitNumber;
	}
}
