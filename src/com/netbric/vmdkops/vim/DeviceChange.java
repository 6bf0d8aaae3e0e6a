package com.netbric.vmdkops.vim;

public class DeviceChange
{
	public enum Operation
	{
		ADD, REMOVE
	}

	public final Operation operation;
	public final VirtualDeviceInfo device;

	private DeviceChange(Operation operation, VirtualDeviceInfo device)
	{
		this.operation = operation;
		this.device = device;
	}

	public static DeviceChange add(VirtualDeviceInfo device)
	{
		return new DeviceChange(Operation.ADD, device);
	}

	public static DeviceChange remove(VirtualDeviceInfo device)
	{
		return new DeviceChange(Operation.REMOVE, device);
	}

	@Override
	public String toString()
	{
		return operation + " " + device;
	}
}
