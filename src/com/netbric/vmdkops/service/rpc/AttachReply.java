package com.netbric.vmdkops.service.rpc;

import com.google.gson.annotations.SerializedName;

public class AttachReply
{
	@SerializedName("Unit")
	public String unit;
	@SerializedName("Bus")
	public String bus;

	public AttachReply(int unit, int bus)
	{
		this.unit = String.valueOf(unit);
		this.bus = String.valueOf(bus);
	}
}
