package com.netbric.vmdkops.meta;

import java.util.HashMap;
import java.util.Map;

public class VolumeMetadata
{
	public String status;
	public String attachedVMUuid;
	public Map<String, String> volOpts = new HashMap<>();

	public VolumeMetadata()
	{
	}

	public VolumeMetadata(String status, Map<String, String> volOpts)
	{
		this.status = status;
		if (volOpts != null)
			this.volOpts.putAll(volOpts);
	}

	public boolean isAttached()
	{
		return VolumeStatus.ATTACHED.equals(status);
	}
}
