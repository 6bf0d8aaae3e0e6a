package com.netbric.vmdkops.service;

import java.io.IOException;

/**
 * Runs an external program to completion. A non-zero exit status is reported
 * through the result, it is not an exception.
 */
public interface ToolInvoker
{
	ExecResult invoke(String executable, String... args) throws IOException;
}
