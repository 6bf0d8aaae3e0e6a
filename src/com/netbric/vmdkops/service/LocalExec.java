package com.netbric.vmdkops.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.PumpStreamHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalExec implements ToolInvoker
{
	static Map<String, String> env = new HashMap<String, String>();

	static
	{
		env.put("LANG", "en_US.UTF-8");
	}

	static final Logger logger = LoggerFactory.getLogger(LocalExec.class);

	@Override
	public ExecResult invoke(String executable, String... args) throws IOException
	{
		CommandLine cl = new CommandLine(executable);
		for (String a : args)
			cl.addArgument(a, false);
		ByteArrayOutputStream stdouterr = new ByteArrayOutputStream(8192);
		DefaultExecutor exec = new DefaultExecutor();
		exec.setStreamHandler(new PumpStreamHandler(stdouterr, stdouterr));
		logger.debug("Running cmd {}", cl);
		int rc;
		try
		{
			rc = exec.execute(cl, env);
		}
		catch (ExecuteException e)
		{
			rc = e.getExitValue();
		}
		return new ExecResult(rc, stdouterr.toString(StandardCharsets.UTF_8).trim());
	}
}
