package com.netbric.vmdkops.host;

import java.util.Map;

import com.netbric.vmdkops.service.exception.StateException;

/**
 * Read access to the host kernel's process and VM group tables.
 */
public interface HostIntrospection
{
	/**
	 * @return id of the VMM group leader owning the calling cartel
	 */
	String getVmmLeader(int cartelId) throws StateException;

	/**
	 * @return group attributes, at least {@code displayName}, {@code uuid} and {@code cfgPath}
	 */
	Map<String, String> getVmmGroupInfo(String vmmLeader) throws StateException;
}
