package com.netbric.vmdkops.service.handler;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.meta.VolumeMetadataStore;
import com.netbric.vmdkops.meta.VolumeStatus;
import com.netbric.vmdkops.service.ExternalTools;
import com.netbric.vmdkops.service.exception.InvalidParamException;
import com.netbric.vmdkops.service.exception.MetadataException;
import com.netbric.vmdkops.service.exception.StateException;
import com.netbric.vmdkops.service.exception.ToolException;
import com.netbric.vmdkops.service.rpc.RetCode;
import com.netbric.vmdkops.service.rpc.VolumeInfo;

/**
 * Creates, removes and lists the VMDK files backing container volumes.
 */
public class VmdkHandler
{
	static final Logger logger = LoggerFactory.getLogger(VmdkHandler.class);

	public static final String VMDK_EXT = ".vmdk";
	public static final String DESCRIPTOR_SIGNATURE = "# Disk DescriptorFile";
	// files smaller than that are assumed to be descriptors
	public static final long MAX_DESCRIPTOR_SIZE = 10000;
	public static final String DEFAULT_DISK_SIZE = "100mb";

	static final Pattern VSAN_URI = Pattern.compile("RW .* VMFS \"vsan://(.*)\"");

	private final ExternalTools tools;
	private final VolumeMetadataStore metadata;
	private final String defaultSize;
	private final String vsanDeviceDir;

	public VmdkHandler(ExternalTools tools, VolumeMetadataStore metadata, String defaultSize, String vsanDeviceDir)
	{
		this.tools = tools;
		this.metadata = metadata;
		this.defaultSize = defaultSize;
		this.vsanDeviceDir = vsanDeviceDir;
	}

	public void create(String vmdkPath, String volName, Map<String, String> opts) throws StateException
	{
		logger.info("*** createVMDK: {} opts={}", vmdkPath, opts);
		if (Files.exists(Paths.get(vmdkPath)))
			throw new InvalidParamException(RetCode.ALREADY_EXISTS, "File " + vmdkPath + " already exists");

		String size = defaultSize;
		if (opts != null && StringUtils.isNotEmpty(opts.get("size")))
			size = opts.get("size");
		logger.debug("Setting size to {}", size);
		tools.createDisk(size, vmdkPath);

		if (!metadata.create(vmdkPath, VolumeStatus.DETACHED, opts))
		{
			String msg = "Failed to create meta-data store for " + vmdkPath;
			logger.warn(msg);
			try
			{
				tools.deleteDisk(vmdkPath);
			}
			catch (ToolException e)
			{
				logger.error("Rollback of {} failed: {}", vmdkPath, e.getMessage());
			}
			throw new MetadataException(msg);
		}

		format(vmdkPath, volName);
	}

	public void remove(String vmdkPath) throws ToolException
	{
		logger.info("*** removeVMDK: {}", vmdkPath);
		tools.deleteDisk(vmdkPath);
		if (!metadata.delete(vmdkPath))
			logger.warn("Volume {} removed but its metadata was left behind", vmdkPath);
	}

	public List<VolumeInfo> list(String volumeDir)
	{
		List<VolumeInfo> vols = new ArrayList<>();
		File[] files = new File(volumeDir).listFiles();
		if (files == null)
		{
			logger.warn("Failed to list {}", volumeDir);
			return vols;
		}
		for (File f : files)
		{
			if (isDescriptor(f))
				vols.add(new VolumeInfo(StringUtils.removeEnd(f.getName(), VMDK_EXT)));
		}
		return vols;
	}

	static boolean isDescriptor(File f)
	{
		if (!f.getName().endsWith(VMDK_EXT) || !f.isFile() || f.length() >= MAX_DESCRIPTOR_SIZE)
			return false;
		try (BufferedReader r = Files.newBufferedReader(f.toPath(), StandardCharsets.ISO_8859_1))
		{
			String line = r.readLine();
			return line != null && line.startsWith(DESCRIPTOR_SIGNATURE);
		}
		catch (IOException e)
		{
			logger.warn("Failed to open {} for descriptor check", f);
			return false;
		}
	}

	/**
	 * Formats the new disk as ext4. On failure the disk is deleted again.
	 */
	void format(String vmdkPath, String volName) throws ToolException
	{
		String backing = getBacking(vmdkPath);
		ToolException failure;
		if (backing == null)
		{
			failure = new ToolException("Failed to format " + vmdkPath + ". No backing found.", -1, "");
		}
		else
		{
			try
			{
				tools.formatExt4(volName, backing);
				return;
			}
			catch (ToolException e)
			{
				failure = new ToolException("Failed to format " + vmdkPath + ". " + e.getOutput(), e.getExitCode(),
						e.getOutput());
			}
		}
		logger.warn(failure.getMessage());
		try
		{
			tools.deleteDisk(vmdkPath);
		}
		catch (ToolException e)
		{
			throw new ToolException(
					"Unable to format " + vmdkPath + " and unable to delete volume. Please delete it manually.",
					e.getExitCode(), e.getOutput());
		}
		metadata.delete(vmdkPath);
		throw failure;
	}

	/**
	 * @return path usable by mkfs for the disk data, or null if there is none
	 */
	String getBacking(String vmdkPath)
	{
		Path flat = Paths.get(StringUtils.removeEnd(vmdkPath, VMDK_EXT) + "-flat" + VMDK_EXT);
		if (Files.isRegularFile(flat))
			return flat.toString();

		String data;
		try
		{
			data = new String(Files.readAllBytes(Paths.get(vmdkPath)), StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			logger.warn("Failed to read descriptor {}: {}", vmdkPath, e.toString());
			return null;
		}
		// only vsan objects for now
		Matcher m = VSAN_URI.matcher(data);
		if (!m.find())
			return null;
		String objectId = m.group(1);
		logger.debug("Got volume UUID {}", objectId);
		try
		{
			tools.openVsanObject(objectId);
		}
		catch (ToolException e)
		{
			return null;
		}
		Path dev = Paths.get(vsanDeviceDir, objectId);
		return Files.exists(dev) ? dev.toString() : null;
	}
}
