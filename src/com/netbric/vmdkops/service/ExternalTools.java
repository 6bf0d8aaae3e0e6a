package com.netbric.vmdkops.service;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.service.exception.ConfigException;
import com.netbric.vmdkops.service.exception.ToolException;

/**
 * Command lines of the host utilities the service drives. Every method either
 * returns normally or throws a {@link ToolException} carrying the tool output.
 */
public class ExternalTools
{
	static final Logger logger = LoggerFactory.getLogger(ExternalTools.class);

	private final ToolInvoker invoker;
	private final String vmkfstools;
	private final String mkfs;
	private final String osfsMkdir;
	private final String objtool;

	public ExternalTools(ToolInvoker invoker, String vmkfstools, String mkfs, String osfsMkdir, String objtool)
	{
		this.invoker = invoker;
		this.vmkfstools = vmkfstools;
		this.mkfs = mkfs;
		this.osfsMkdir = osfsMkdir;
		this.objtool = objtool;
	}

	public ExternalTools(ToolInvoker invoker, Config cfg) throws ConfigException
	{
		this(invoker,
				cfg.getString("tools", "vmkfstools", "/sbin/vmkfstools"),
				cfg.getString("tools", "mkfs", "/usr/lib/vmware/vmdkops/bin/mkfs.ext4"),
				cfg.getString("tools", "osfs_mkdir", "/usr/lib/vmware/osfs/bin/osfs-mkdir"),
				cfg.getString("tools", "objtool", "/usr/lib/vmware/osfs/bin/objtool"));
	}

	public void createDisk(String size, String vmdkPath) throws ToolException
	{
		run("Failed to create " + vmdkPath, vmkfstools, "-d", "thin", "-c", size, vmdkPath);
	}

	public void deleteDisk(String vmdkPath) throws ToolException
	{
		run("Failed to remove " + vmdkPath, vmkfstools, "-U", vmdkPath);
	}

	public void formatExt4(String label, String backingPath) throws ToolException
	{
		run("Failed to format " + backingPath, mkfs, "-qF", "-L", label, backingPath);
	}

	public void makeVolumeDir(String path) throws ToolException
	{
		run("Failed to create " + path, osfsMkdir, "-n", path);
	}

	public void openVsanObject(String objectId) throws ToolException
	{
		run("Failed to open vsan object " + objectId, objtool, "open", "-u", objectId);
	}

	private void run(String failure, String executable, String... args) throws ToolException
	{
		ExecResult r;
		try
		{
			r = invoker.invoke(executable, args);
		}
		catch (IOException e)
		{
			throw new ToolException(failure + ". " + e.getMessage(), -1, e.getMessage());
		}
		if (!r.succeeded())
		{
			logger.warn("{} exited with {}: {}", executable, r.exitCode, r.output);
			throw new ToolException(failure + ". " + r.output, r.exitCode, r.output);
		}
	}
}
