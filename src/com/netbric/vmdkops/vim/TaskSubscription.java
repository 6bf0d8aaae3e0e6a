package com.netbric.vmdkops.vim;

import com.netbric.vmdkops.service.exception.VimFaultException;

/**
 * Incremental change feed over a set of tasks. Must be closed to release the
 * server side filter.
 */
public interface TaskSubscription extends AutoCloseable
{
	/**
	 * Blocks until there are changes newer than {@code version}.
	 *
	 * @param version cursor returned by the previous update, null on the first call
	 */
	TaskUpdate waitForUpdate(String version) throws VimFaultException;

	@Override
	void close();
}
