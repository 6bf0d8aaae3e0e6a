package com.netbric.vmdkops.vim;

import java.util.Objects;

public class TaskRef
{
	public final String id;

	public TaskRef(String id)
	{
		this.id = id;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof TaskRef))
			return false;
		return id.equals(((TaskRef) o).id);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id);
	}

	@Override
	public String toString()
	{
		return id;
	}
}
