package com.netbric.vmdkops.service.exception;

/**
 * Base of every error that fails a single request. The server loop turns it
 * into an error reply and keeps serving.
 */
public class StateException extends Exception
{
	private static final long serialVersionUID = 1L;

	public int state = 0;

	public StateException(String message)
	{
		super(message);
	}

	public StateException(int errorState, String message)
	{
		super(message);
		state = errorState;
	}

	public StateException(int errorState, String message, Throwable cause)
	{
		super(message, cause);
		state = errorState;
	}
}
