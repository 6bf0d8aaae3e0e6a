package com.netbric.vmdkops.service.handler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.host.VmContext;
import com.netbric.vmdkops.service.ExternalTools;
import com.netbric.vmdkops.service.exception.InvalidParamException;
import com.netbric.vmdkops.service.exception.ToolException;

/**
 * Locates the volume directory of the datastore the requesting VM lives on.
 * The directory is a sibling of the VM folder, e.g. for
 * {@code /vmfs/volumes/ds1/vm1/vm1.vmx} it is {@code /vmfs/volumes/ds1/dockvols}.
 */
public class VolumePathResolver
{
	static final Logger logger = LoggerFactory.getLogger(VolumePathResolver.class);
	public static final String DEFAULT_DIR_NAME = "dockvols";

	private final ExternalTools tools;
	private final String dirName;

	public VolumePathResolver(ExternalTools tools, String dirName)
	{
		this.tools = tools;
		this.dirName = dirName;
	}

	public String getVolumePath(VmContext vmCtx) throws InvalidParamException, ToolException
	{
		Path cfg = Paths.get(vmCtx.configPath);
		if (cfg.getParent() == null || cfg.getParent().getParent() == null)
			throw new InvalidParamException("Unexpected VM config path " + vmCtx.configPath);
		Path volDir = cfg.getParent().getParent().resolve(dirName);
		String path = volDir.toString();
		if (Files.isDirectory(volDir))
			return path;

		logger.info("Creating volume directory {}", path);
		try
		{
			tools.makeVolumeDir(path);
		}
		catch (ToolException e)
		{
			throw new ToolException("Failed initializing volume path " + path + ". " + e.getOutput(),
					e.getExitCode(), e.getOutput());
		}
		return path;
	}
}
