package com.netbric.vmdkops.service.rpc;

import java.util.Map;

import com.google.gson.annotations.SerializedName;

/**
 * Request envelope sent by the guest side plugin:
 * {@code {"cmd": "...", "details": {"Name": "...", "Opts": {...}}}}.
 */
public class VmdkRequest
{
	public String cmd;
	public Details details;

	public static class Details
	{
		@SerializedName("Name")
		public String name;
		@SerializedName("Opts")
		public Map<String, String> opts;
	}

	public VmdkRequest()
	{
	}

	public VmdkRequest(String cmd, String name, Map<String, String> opts)
	{
		this.cmd = cmd;
		this.details = new Details();
		this.details.name = name;
		this.details.opts = opts;
	}
}
