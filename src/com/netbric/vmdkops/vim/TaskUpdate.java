package com.netbric.vmdkops.vim;

import java.util.List;

public class TaskUpdate
{
	public final String version;
	public final List<TaskChange> changes;

	public TaskUpdate(String version, List<TaskChange> changes)
	{
		this.version = version;
		this.changes = changes;
	}
}
