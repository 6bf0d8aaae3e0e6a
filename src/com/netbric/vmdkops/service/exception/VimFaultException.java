package com.netbric.vmdkops.service.exception;

import com.netbric.vmdkops.service.rpc.RetCode;

/**
 * A call into the hypervisor API failed. Callers decide on the reaction by
 * {@link Kind}; only {@link Kind#AUTH_EXPIRED} is ever retried.
 */
public class VimFaultException extends StateException
{
	private static final long serialVersionUID = 1L;

	public enum Kind
	{
		AUTH_EXPIRED, DEVICE_FAULT, GENERIC
	}

	private final Kind kind;

	public VimFaultException(Kind kind, String message)
	{
		super(RetCode.REMOTE_ERROR, message);
		this.kind = kind;
	}

	public VimFaultException(Kind kind, String message, Throwable cause)
	{
		super(RetCode.REMOTE_ERROR, message, cause);
		this.kind = kind;
	}

	public Kind getKind()
	{
		return kind;
	}

	public boolean isAuthExpired()
	{
		return kind == Kind.AUTH_EXPIRED;
	}
}
