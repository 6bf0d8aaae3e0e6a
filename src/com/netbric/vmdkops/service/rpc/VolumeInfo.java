package com.netbric.vmdkops.service.rpc;

import java.util.HashMap;
import java.util.Map;

import com.google.gson.annotations.SerializedName;

public class VolumeInfo
{
	@SerializedName("Name")
	public String name;
	// reserved, always empty for now
	@SerializedName("Attributes")
	public Map<String, String> attributes = new HashMap<>();

	public VolumeInfo(String name)
	{
		this.name = name;
	}
}
