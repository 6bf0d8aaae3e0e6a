package com.netbric.vmdkops.ipc;

import java.io.IOException;

import com.netbric.vmdkops.service.exception.TransientChannelException;

public interface RequestChannel
{
	/**
	 * Blocks until the next request arrives.
	 */
	ChannelRequest nextRequest() throws TransientChannelException;

	/**
	 * Sends the reply for a request returned by {@link #nextRequest()}. Each
	 * request is replied to at most once.
	 */
	void reply(ChannelRequest request, String json) throws IOException;

	void close();
}
