package com.netbric.vmdkops.service.exception;

import java.util.Collections;
import java.util.List;

import com.netbric.vmdkops.service.rpc.RetCode;

public class HypervisorFaultException extends StateException
{
	private static final long serialVersionUID = 1L;

	private final List<String> faultMessages;

	public HypervisorFaultException(String message)
	{
		this(message, Collections.emptyList());
	}

	public HypervisorFaultException(String message, List<String> faultMessages)
	{
		super(RetCode.REMOTE_ERROR, message);
		this.faultMessages = faultMessages;
	}

	public List<String> getFaultMessages()
	{
		return faultMessages;
	}
}
