package com.netbric.vmdkops.cli;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.netbric.vmdkops.ipc.UnixSocketClient;
import com.netbric.vmdkops.service.rpc.VmdkRequest;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;

/**
 * vmdkcli: sends a single request to the local vmdkops service, the same way
 * the guest plugin does, and prints the reply.
 */
public class CliMain
{
	static {
		System.setProperty(org.slf4j.impl.SimpleLogger.DEFAULT_LOG_LEVEL_KEY, "WARN");
	}
	static final Logger logger = LoggerFactory.getLogger(CliMain.class);
	static final String defaultSocketPath = "/var/run/vmdkops/vmdkops.sock";

	public static void main(String[] args)
	{
		try
		{
			ArgumentParser cp = buildParser();
			Namespace cmd = cp.parseArgs(args);
			String reply = run(cmd);
			System.out.println(prettyPrint(reply));
			if (isError(reply))
				System.exit(1);
		}
		catch (HelpScreenException e)
		{
			return;
		}
		catch (Exception e1)
		{
			logger.error("Failed: {}", e1.getMessage());
			System.exit(1);
		}
	}

	static ArgumentParser buildParser()
	{
		ArgumentParser cp = ArgumentParsers.newFor("vmdkcli").build()
				.description("vmdkops service command line tool");
		cp.addArgument("-s").metavar("socket_path").help("service socket path").setDefault(defaultSocketPath);
		cp.addArgument("--cartel").type(Integer.class).metavar("cartel_id")
				.help("cartel id of the VMX process to act for").setDefault(0);
		Subparsers sps = cp.addSubparsers().dest("cmd_verb");

		Subparser sp = sps.addParser("create");
		sp.description("Create volume");
		sp.addArgument("-n").help("Volume name to create").required(true).metavar("volume_name");
		sp.addArgument("-o").help("Volume option, e.g. size=10gb").action(Arguments.append()).metavar("key=value");

		sp = sps.addParser("remove");
		sp.description("Remove volume");
		sp.addArgument("-n").help("Volume name to remove").required(true).metavar("volume_name");

		sp = sps.addParser("list");
		sp.description("List volumes");

		sp = sps.addParser("attach");
		sp.description("Attach volume to the VM");
		sp.addArgument("-n").help("Volume name to attach").required(true).metavar("volume_name");

		sp = sps.addParser("detach");
		sp.description("Detach volume from the VM");
		sp.addArgument("-n").help("Volume name to detach").required(true).metavar("volume_name");
		return cp;
	}

	static String run(Namespace cmd) throws IOException
	{
		String json = buildRequest(cmd);
		logger.debug("Sending {}", json);
		return UnixSocketClient.call(Paths.get(cmd.getString("s")), cmd.getInt("cartel"), json);
	}

	static String buildRequest(Namespace cmd)
	{
		String verb = cmd.getString("cmd_verb");
		Map<String, String> opts = parseOptions(cmd.<String>getList("o"));
		String name = cmd.getString("n");
		return new Gson().toJson(new VmdkRequest(verb, name == null ? "" : name, opts));
	}

	static Map<String, String> parseOptions(List<String> kvs)
	{
		Map<String, String> opts = new HashMap<>();
		if (kvs == null)
			return opts;
		for (String kv : kvs)
		{
			int i = kv.indexOf('=');
			if (i <= 0)
				throw new IllegalArgumentException("Invalid option '" + kv + "', expect key=value");
			opts.put(kv.substring(0, i), kv.substring(i + 1));
		}
		return opts;
	}

	static boolean isError(String reply)
	{
		JsonElement e = JsonParser.parseString(reply);
		return e.isJsonObject() && e.getAsJsonObject().has("Error");
	}

	private static String prettyPrint(String reply)
	{
		return new GsonBuilder().setPrettyPrinting().create().toJson(JsonParser.parseString(reply));
	}
}
