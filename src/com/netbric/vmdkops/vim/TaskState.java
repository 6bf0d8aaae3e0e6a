package com.netbric.vmdkops.vim;

public enum TaskState
{
	QUEUED, RUNNING, SUCCESS, ERROR;

	public boolean isTerminal()
	{
		return this == SUCCESS || this == ERROR;
	}
}
