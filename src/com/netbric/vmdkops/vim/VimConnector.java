package com.netbric.vmdkops.vim;

import java.net.MalformedURLException;
import java.net.URL;
import java.rmi.RemoteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.service.Config;
import com.netbric.vmdkops.service.exception.ConfigException;
import com.netbric.vmdkops.service.exception.VimFaultException;
import com.vmware.vim25.mo.ServiceInstance;

/**
 * Logs in to the local host agent. The default user {@code dcui} is a local
 * administrator that keeps its permissions when the host is in lockdown mode.
 */
public class VimConnector implements HypervisorConnector
{
	static final Logger logger = LoggerFactory.getLogger(VimConnector.class);

	private final String url;
	private final String user;
	private final String password;
	private final boolean ignoreCert;

	public VimConnector(String url, String user, String password, boolean ignoreCert)
	{
		this.url = url;
		this.user = user;
		this.password = password;
		this.ignoreCert = ignoreCert;
	}

	public VimConnector(Config cfg) throws ConfigException
	{
		this(cfg.getString("hypervisor", "url", "https://localhost/sdk"),
				cfg.getString("hypervisor", "user", "dcui"),
				cfg.getString("hypervisor", "password", ""),
				cfg.getBoolean("hypervisor", "ignore_cert", true));
	}

	@Override
	public HypervisorSession connect(String callerId) throws VimFaultException
	{
		logger.info("Connecting to {} as '{}'", url, user);
		try
		{
			ServiceInstance si = new ServiceInstance(new URL(url), user, password, ignoreCert);
			return new VimSession(si, callerId);
		}
		catch (MalformedURLException e)
		{
			throw new VimFaultException(VimFaultException.Kind.GENERIC, "Invalid hypervisor url " + url, e);
		}
		catch (RemoteException e)
		{
			throw VimSession.toFault(String.format("Failed to connect to %s as '%s'", url, user), e);
		}
	}
}
