package com.netbric.vmdkops.vim;

import com.netbric.vmdkops.service.exception.VimFaultException;

public interface HypervisorConnector
{
	/**
	 * Logs in and returns a fresh session.
	 *
	 * @param callerId identity attached to the session for log correlation
	 */
	HypervisorSession connect(String callerId) throws VimFaultException;
}
