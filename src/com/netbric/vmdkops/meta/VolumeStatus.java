package com.netbric.vmdkops.meta;

public class VolumeStatus
{
	public static final String DETACHED = "detached";
	public static final String ATTACHED = "attached";
}
