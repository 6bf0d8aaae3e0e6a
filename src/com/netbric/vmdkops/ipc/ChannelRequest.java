package com.netbric.vmdkops.ipc;

/**
 * One raw request as delivered by the transport, tagged with the cartel id of
 * the sending VMX process.
 */
public class ChannelRequest
{
	public final int cartelId;
	public final byte[] payload;

	public ChannelRequest(int cartelId, byte[] payload)
	{
		this.cartelId = cartelId;
		this.payload = payload;
	}
}
