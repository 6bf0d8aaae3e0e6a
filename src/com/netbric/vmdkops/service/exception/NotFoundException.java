package com.netbric.vmdkops.service.exception;

import com.netbric.vmdkops.service.rpc.RetCode;

public class NotFoundException extends StateException
{
	private static final long serialVersionUID = 1L;

	public NotFoundException(String message)
	{
		super(RetCode.NOT_FOUND, message);
	}
}
