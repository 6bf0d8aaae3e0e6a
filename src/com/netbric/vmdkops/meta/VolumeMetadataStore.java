package com.netbric.vmdkops.meta;

import java.util.Map;

/**
 * Key/value metadata kept per volume, addressed by the volume's descriptor
 * path. Write operations report failure through their return value.
 */
public interface VolumeMetadataStore
{
	boolean create(String vmdkPath, String initialStatus, Map<String, String> opts);

	/**
	 * @return the stored record, or null when the volume has none or it can't be read
	 */
	VolumeMetadata getAll(String vmdkPath);

	boolean setAll(String vmdkPath, VolumeMetadata meta);

	boolean delete(String vmdkPath);
}
