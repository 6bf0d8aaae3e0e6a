package com.netbric.vmdkops.service.exception;

/**
 * Terminates the service: the request channel stopped recovering or the
 * hypervisor session can no longer be re-established.
 */
public class FatalException extends Exception
{
	private static final long serialVersionUID = 1L;

	public FatalException(String message)
	{
		super(message);
	}

	public FatalException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
