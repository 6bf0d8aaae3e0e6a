package com.netbric.vmdkops.service.exception;

import com.netbric.vmdkops.service.rpc.RetCode;

/**
 * An external tool exited with a non-zero status. The message already contains
 * the captured stdout/stderr of the tool.
 */
public class ToolException extends StateException
{
	private static final long serialVersionUID = 1L;

	private final int exitCode;
	private final String output;

	public ToolException(String message, int exitCode, String output)
	{
		super(RetCode.TOOL_ERROR, message);
		this.exitCode = exitCode;
		this.output = output;
	}

	public int getExitCode()
	{
		return exitCode;
	}

	public String getOutput()
	{
		return output;
	}
}
