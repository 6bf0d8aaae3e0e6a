package com.netbric.vmdkops.service.exception;

public class LoggedException extends StateException
{
	private static final long serialVersionUID = 1L;

	public LoggedException(org.slf4j.Logger log, int errorState, String format, Object... args)
	{
		super(errorState, String.format(format, args));
		log.error(getMessage());
	}
}
