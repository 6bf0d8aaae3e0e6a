package com.netbric.vmdkops.meta;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Keeps each volume's record in a JSON file next to its descriptor,
 * {@code <name>-meta.json}.
 */
public class SidecarMetadataStore implements VolumeMetadataStore
{
	static final Logger logger = LoggerFactory.getLogger(SidecarMetadataStore.class);
	public static final String SIDECAR_SUFFIX = "-meta.json";

	private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

	public static Path sidecarPath(String vmdkPath)
	{
		return Paths.get(StringUtils.removeEnd(vmdkPath, ".vmdk") + SIDECAR_SUFFIX);
	}

	@Override
	public boolean create(String vmdkPath, String initialStatus, Map<String, String> opts)
	{
		Path p = sidecarPath(vmdkPath);
		if (Files.exists(p))
		{
			logger.warn("Metadata for {} already exists, overwriting", vmdkPath);
		}
		return setAll(vmdkPath, new VolumeMetadata(initialStatus, opts));
	}

	@Override
	public VolumeMetadata getAll(String vmdkPath)
	{
		Path p = sidecarPath(vmdkPath);
		if (!Files.isRegularFile(p))
			return null;
		try (Reader r = Files.newBufferedReader(p, StandardCharsets.UTF_8))
		{
			return gson.fromJson(r, VolumeMetadata.class);
		}
		catch (IOException | JsonParseException e)
		{
			logger.warn("Failed to read metadata {}: {}", p, e.toString());
			return null;
		}
	}

	@Override
	public boolean setAll(String vmdkPath, VolumeMetadata meta)
	{
		Path p = sidecarPath(vmdkPath);
		Path tmp = p.resolveSibling(p.getFileName() + ".tmp");
		try
		{
			try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8))
			{
				gson.toJson(meta, w);
			}
			Files.move(tmp, p, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			return true;
		}
		catch (IOException e)
		{
			logger.warn("Failed to save metadata {}: {}", p, e.toString());
			try
			{
				Files.deleteIfExists(tmp);
			}
			catch (IOException e1)
			{
				logger.debug("Failed to clean up {}", tmp, e1);
			}
			return false;
		}
	}

	@Override
	public boolean delete(String vmdkPath)
	{
		try
		{
			Files.deleteIfExists(sidecarPath(vmdkPath));
			return true;
		}
		catch (IOException e)
		{
			logger.warn("Failed to delete metadata for {}: {}", vmdkPath, e.toString());
			return false;
		}
	}
}
