package com.netbric.vmdkops.service.exception;

import com.netbric.vmdkops.service.rpc.RetCode;

public class InvalidParamException extends StateException
{
	private static final long serialVersionUID = 1L;

	public InvalidParamException(String message)
	{
		super(RetCode.INVALID_ARG, message);
	}

	public InvalidParamException(int errorState, String message)
	{
		super(errorState, message);
	}
}
