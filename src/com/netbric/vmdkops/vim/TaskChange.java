package com.netbric.vmdkops.vim;

import java.util.Collections;
import java.util.List;

/**
 * One observed state transition of a task. {@code error} and
 * {@code faultMessages} are only filled for {@link TaskState#ERROR}.
 */
public class TaskChange
{
	public final TaskRef task;
	public final TaskState state;
	public final String error;
	public final List<String> faultMessages;

	public TaskChange(TaskRef task, TaskState state)
	{
		this(task, state, null, Collections.emptyList());
	}

	public TaskChange(TaskRef task, TaskState state, String error, List<String> faultMessages)
	{
		this.task = task;
		this.state = state;
		this.error = error;
		this.faultMessages = faultMessages;
	}
}
