package com.netbric.vmdkops.service;

import java.io.File;
import java.io.IOException;

import org.ini4j.Wini;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.service.exception.ConfigException;

public class Config
{
	public static final String DEFAULT_PATH = "/etc/vmware/vmdkops/vmdkops.conf";
	static final Logger logger = LoggerFactory.getLogger(Config.class);
	Wini cfg;

	public Config(String path) throws ConfigException
	{
		cfg = new Wini();
		File f = new File(path);
		if (!f.exists())
		{
			logger.warn("Config file:{} not found, using built-in defaults", path);
			return;
		}
		try
		{
			cfg.load(f);
		}
		catch (IOException e)
		{
			throw new ConfigException(String.format("Fail to load config file:%s", path), e);
		}
	}

	public String getString(String section, String key, String defaultVal, boolean mandatory) throws ConfigException
	{
		String rst = cfg.get(section, key, String.class);
		if (rst != null)
			return rst;
		if (mandatory)
			throw new ConfigException(String.format("need config item %s.%s", section, key));
		return defaultVal;
	}

	public String getString(String section, String key, String defaultVal) throws ConfigException
	{
		return getString(section, key, defaultVal, false);
	}

	public boolean getBoolean(String section, String key, boolean defaultVal) throws ConfigException
	{
		String v = getString(section, key, null, false);
		if (v == null)
			return defaultVal;
		return "true".equalsIgnoreCase(v) || "1".equals(v) || "yes".equalsIgnoreCase(v);
	}
}
