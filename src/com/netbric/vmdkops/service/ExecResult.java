package com.netbric.vmdkops.service;

public class ExecResult
{
	public final int exitCode;
	public final String output;

	public ExecResult(int exitCode, String output)
	{
		this.exitCode = exitCode;
		this.output = output;
	}

	public boolean succeeded()
	{
		return exitCode == 0;
	}
}
