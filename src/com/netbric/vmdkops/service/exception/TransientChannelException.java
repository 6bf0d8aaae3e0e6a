package com.netbric.vmdkops.service.exception;

/**
 * Receiving from the request channel failed in a way the channel is expected
 * to recover from.
 */
public class TransientChannelException extends Exception
{
	private static final long serialVersionUID = 1L;

	public TransientChannelException(String message)
	{
		super(message);
	}

	public TransientChannelException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
