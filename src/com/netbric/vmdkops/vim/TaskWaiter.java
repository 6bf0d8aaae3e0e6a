package com.netbric.vmdkops.vim;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.service.exception.FatalException;
import com.netbric.vmdkops.service.exception.HypervisorFaultException;
import com.netbric.vmdkops.service.exception.VimFaultException;

/**
 * Blocks until hypervisor tasks reach a terminal state. There is no timeout:
 * a task that never finishes keeps the caller waiting.
 */
public class TaskWaiter
{
	static final Logger logger = LoggerFactory.getLogger(TaskWaiter.class);

	private final SessionManager sessionManager;

	public TaskWaiter(SessionManager sessionManager)
	{
		this.sessionManager = sessionManager;
	}

	/**
	 * Returns once every task succeeded. The first task seen in error state
	 * fails the whole wait, tasks still pending are not awaited.
	 */
	public void waitForTasks(List<TaskRef> tasks)
			throws VimFaultException, HypervisorFaultException, FatalException
	{
		Set<TaskRef> pending = new LinkedHashSet<>(tasks);
		Map<TaskRef, TaskState> states = new HashMap<>();
		try (TaskSubscription sub = subscribe(tasks))
		{
			String version = null;
			while (!pending.isEmpty())
			{
				TaskUpdate update = sub.waitForUpdate(version);
				for (TaskChange change : update.changes)
				{
					if (!pending.contains(change.task))
						continue;
					TaskState prev = states.put(change.task, change.state);
					logger.debug("Task {}: {} -> {}", change.task, prev, change.state);
					if (change.state == TaskState.SUCCESS)
					{
						pending.remove(change.task);
					}
					else if (change.state == TaskState.ERROR)
					{
						String msg = change.error != null ? change.error : "Task " + change.task + " failed";
						throw new HypervisorFaultException(msg, change.faultMessages);
					}
				}
				version = update.version;
			}
		}
	}

	private TaskSubscription subscribe(List<TaskRef> tasks) throws VimFaultException, FatalException
	{
		try
		{
			return sessionManager.getSession().subscribe(tasks);
		}
		catch (VimFaultException e)
		{
			if (!e.isAuthExpired())
				throw e;
			logger.warn("Reconnecting and retry");
			return sessionManager.reconnect().subscribe(tasks);
		}
	}
}
