package com.netbric.vmdkops.service.rpc;

public interface RetCode
{
	public static final int OK = 0;
	public static final int INVALID_OP = 1;
	public static final int INVALID_ARG = 2;
	public static final int ALREADY_EXISTS = 3;
	public static final int TOOL_ERROR = 4;
	public static final int REMOTE_ERROR = 5;
	public static final int METADATA_ERROR = 6;
	public static final int NOT_FOUND = 7;
	public static final int NO_SLOT = 8;
}
