package com.netbric.vmdkops.service.handler;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.host.VmContext;
import com.netbric.vmdkops.service.exception.FatalException;
import com.netbric.vmdkops.service.exception.InvalidParamException;
import com.netbric.vmdkops.service.exception.StateException;
import com.netbric.vmdkops.service.rpc.RetCode;

/**
 * Routes one decoded request to the volume or attach handler.
 */
public class RequestDispatcher
{
	static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

	public static final String CMD_CREATE = "create";
	public static final String CMD_REMOVE = "remove";
	public static final String CMD_LIST = "list";
	public static final String CMD_ATTACH = "attach";
	public static final String CMD_DETACH = "detach";

	static final List<String> KNOWN_COMMANDS = Arrays.asList(CMD_CREATE, CMD_REMOVE, CMD_LIST, CMD_ATTACH,
			CMD_DETACH);

	private final VolumePathResolver volumePaths;
	private final VmdkHandler vmdkHandler;
	private final DiskAttachHandler attachHandler;

	public RequestDispatcher(VolumePathResolver volumePaths, VmdkHandler vmdkHandler, DiskAttachHandler attachHandler)
	{
		this.volumePaths = volumePaths;
		this.vmdkHandler = vmdkHandler;
		this.attachHandler = attachHandler;
	}

	/**
	 * @return the reply object to serialize, null for operations without a result
	 */
	public Object execute(VmContext vmCtx, String cmd, String volName, Map<String, String> opts)
			throws StateException, FatalException
	{
		logger.debug("execute: cmd={} name={} {}", cmd, volName, vmCtx);
		if (!KNOWN_COMMANDS.contains(cmd))
			throw new InvalidParamException(RetCode.INVALID_OP, "Unknown command:" + cmd);
		if (!CMD_LIST.equals(cmd))
			checkVolumeName(volName);

		String volDir = volumePaths.getVolumePath(vmCtx);
		String vmdkPath = volDir + "/" + volName + VmdkHandler.VMDK_EXT;

		if (CMD_CREATE.equals(cmd))
		{
			vmdkHandler.create(vmdkPath, volName, opts);
			return null;
		}
		else if (CMD_REMOVE.equals(cmd))
		{
			vmdkHandler.remove(vmdkPath);
			return null;
		}
		else if (CMD_LIST.equals(cmd))
			return vmdkHandler.list(volDir);
		else if (CMD_ATTACH.equals(cmd))
			return attachHandler.attach(vmdkPath, vmCtx);
		else if (CMD_DETACH.equals(cmd))
		{
			attachHandler.detach(vmdkPath, vmCtx);
			return null;
		}
		else
			throw new InvalidParamException(RetCode.INVALID_OP, "Unknown command:" + cmd);
	}

	static void checkVolumeName(String volName) throws InvalidParamException
	{
		if (StringUtils.isEmpty(volName))
			throw new InvalidParamException("Invalid argument: Name");
		if (volName.contains("/"))
			throw new InvalidParamException("Invalid volume name:" + volName);
	}
}
