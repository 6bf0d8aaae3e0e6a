package com.netbric.vmdkops.meta;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public class InMemoryMetadataStore implements VolumeMetadataStore
{
	public final Map<String, VolumeMetadata> records = new HashMap<>();
	public final Set<String> deleted = new HashSet<>();
	public boolean failWrites = false;

	@Override
	public boolean create(String vmdkPath, String initialStatus, Map<String, String> opts)
	{
		return setAll(vmdkPath, new VolumeMetadata(initialStatus, opts));
	}

	@Override
	public VolumeMetadata getAll(String vmdkPath)
	{
		VolumeMetadata m = records.get(vmdkPath);
		if (m == null)
			return null;
		// hand out a copy like a real store would
		VolumeMetadata copy = new VolumeMetadata(m.status, m.volOpts);
		copy.attachedVMUuid = m.attachedVMUuid;
		return copy;
	}

	@Override
	public boolean setAll(String vmdkPath, VolumeMetadata meta)
	{
		if (failWrites)
			return false;
		records.put(vmdkPath, meta);
		return true;
	}

	@Override
	public boolean delete(String vmdkPath)
	{
		deleted.add(vmdkPath);
		records.remove(vmdkPath);
		return true;
	}
}
