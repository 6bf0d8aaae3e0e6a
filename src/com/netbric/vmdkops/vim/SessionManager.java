package com.netbric.vmdkops.vim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.service.exception.FatalException;
import com.netbric.vmdkops.service.exception.NotFoundException;
import com.netbric.vmdkops.service.exception.VimFaultException;

/**
 * Owns the single hypervisor session of the process. The session is replaced
 * as a whole on reconnect; holders must always go through {@link #getSession()}.
 */
public class SessionManager
{
	static final Logger logger = LoggerFactory.getLogger(SessionManager.class);
	public static final String DEFAULT_CALLER_ID = "dvolplug";

	private final HypervisorConnector connector;
	private final String callerId;
	private volatile HypervisorSession session;

	public SessionManager(HypervisorConnector connector, String callerId)
	{
		this.connector = connector;
		this.callerId = callerId;
	}

	public String getCallerId()
	{
		return callerId;
	}

	public synchronized HypervisorSession connect() throws VimFaultException
	{
		if (session == null)
		{
			session = connector.connect(callerId);
			logger.info("Connected to hypervisor as caller {}", callerId);
		}
		return session;
	}

	/**
	 * Drops the current session and logs in again. Failing to log in is not
	 * recoverable.
	 */
	public synchronized HypervisorSession reconnect() throws FatalException
	{
		logger.warn("Reconnecting to hypervisor");
		HypervisorSession fresh;
		try
		{
			fresh = connector.connect(callerId);
		}
		catch (VimFaultException e)
		{
			throw new FatalException("Failed to reconnect to hypervisor: " + e.getMessage(), e);
		}
		HypervisorSession old = session;
		session = fresh;
		if (old != null)
			old.disconnect();
		return fresh;
	}

	public HypervisorSession getSession() throws VimFaultException
	{
		HypervisorSession s = session;
		if (s == null)
			return connect();
		return s;
	}

	/**
	 * Looks a VM up by name, re-authenticating once if the session expired.
	 */
	public VmRef findVm(String vmName) throws VimFaultException, NotFoundException, FatalException
	{
		VmRef vm;
		try
		{
			vm = getSession().findVmByName(vmName);
		}
		catch (VimFaultException e)
		{
			if (!e.isAuthExpired())
				throw e;
			vm = reconnect().findVmByName(vmName);
		}
		if (vm == null)
			throw new NotFoundException("VM " + vmName + " not found");
		return vm;
	}

	public synchronized void disconnect()
	{
		if (session != null)
		{
			session.disconnect();
			session = null;
			logger.info("Disconnected from hypervisor");
		}
	}
}
