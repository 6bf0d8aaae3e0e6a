package com.netbric.vmdkops.service.rpc;

import com.google.gson.annotations.SerializedName;

public class ErrorReply
{
	@SerializedName("Error")
	public String error;

	public ErrorReply(String error)
	{
		this.error = error;
	}
}
