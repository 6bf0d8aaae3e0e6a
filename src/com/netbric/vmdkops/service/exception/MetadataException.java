package com.netbric.vmdkops.service.exception;

import com.netbric.vmdkops.service.rpc.RetCode;

/**
 * Volume metadata could not be written although the disk operation itself
 * succeeded.
 */
public class MetadataException extends StateException
{
	private static final long serialVersionUID = 1L;

	public MetadataException(String message)
	{
		super(RetCode.METADATA_ERROR, message);
	}
}
