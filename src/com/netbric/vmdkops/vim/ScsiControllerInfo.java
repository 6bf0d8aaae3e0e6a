package com.netbric.vmdkops.vim;

public class ScsiControllerInfo extends VirtualDeviceInfo
{
	/** SCSI controller keys are 1000 + bus number. */
	public static final int KEY_OFFSET = 1000;

	public final ControllerKind kind;
	public final int busNumber;

	public ScsiControllerInfo(int key, ControllerKind kind, int busNumber)
	{
		super(key, null, null);
		this.kind = kind;
		this.busNumber = busNumber;
	}

	public static ScsiControllerInfo onBus(ControllerKind kind, int busNumber)
	{
		return new ScsiControllerInfo(KEY_OFFSET + busNumber, kind, busNumber);
	}

	@Override
	public String toString()
	{
		return String.format("%s controller key=%d bus=%d", kind, key, busNumber);
	}
}
