package com.netbric.vmdkops.service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;

import org.ini4j.Wini;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.host.IdentityResolver;
import com.netbric.vmdkops.host.VsishHostIntrospection;
import com.netbric.vmdkops.ipc.UnixSocketRequestChannel;
import com.netbric.vmdkops.meta.SidecarMetadataStore;
import com.netbric.vmdkops.meta.VolumeMetadataStore;
import com.netbric.vmdkops.service.exception.FatalException;
import com.netbric.vmdkops.service.exception.VimFaultException;
import com.netbric.vmdkops.service.handler.DiskAttachHandler;
import com.netbric.vmdkops.service.handler.RequestDispatcher;
import com.netbric.vmdkops.service.handler.VmdkHandler;
import com.netbric.vmdkops.service.handler.VolumePathResolver;
import com.netbric.vmdkops.vim.SessionManager;
import com.netbric.vmdkops.vim.TaskWaiter;
import com.netbric.vmdkops.vim.VimConnector;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

public class Main
{
	static {
		System.setProperty("org.slf4j.simpleLogger.showDateTime", "true");
		System.setProperty("org.slf4j.simpleLogger.dateTimeFormat", "[yyyy/MM/dd H:mm:ss.SSS]");
	}
	static final String DEFAULT_LOG_LEVEL = "INFO";
	static Logger logger;

	public static void main(String[] args)
	{
		ArgumentParser parser = ArgumentParsers.newFor("vmdkops").build()
				.description("VMDK volume service for container hosts");
		parser.addArgument("-c")
				.metavar("conf")
				.setDefault(Config.DEFAULT_PATH)
				.help("config file path");

		Namespace cmd;
		try
		{
			cmd = parser.parseArgs(args);
		}
		catch (HelpScreenException e)
		{
			return;
		}
		catch (ArgumentParserException e)
		{
			parser.handleError(e);
			System.exit(1);
			return;
		}

		String cfgPath = cmd.getString("c");
		// must be set before the first logger is created
		System.setProperty(org.slf4j.impl.SimpleLogger.DEFAULT_LOG_LEVEL_KEY, readLogLevel(cfgPath));
		logger = LoggerFactory.getLogger(Main.class);
		try
		{
			logger.info("use config file: {}", cfgPath);
			Config cfg = new Config(cfgPath);

			LocalExec exec = new LocalExec();
			ExternalTools tools = new ExternalTools(exec, cfg);
			VolumeMetadataStore metadata = new SidecarMetadataStore();
			VmdkHandler vmdkHandler = new VmdkHandler(tools, metadata,
					cfg.getString("volumes", "default_size", VmdkHandler.DEFAULT_DISK_SIZE),
					cfg.getString("volumes", "vsan_device_dir", "/vmfs/devices/vsan"));

			SessionManager sessions = new SessionManager(new VimConnector(cfg),
					cfg.getString("hypervisor", "caller_id", SessionManager.DEFAULT_CALLER_ID));
			try
			{
				sessions.connect();
			}
			catch (VimFaultException e)
			{
				logger.error("Failed to connect to hypervisor: {}", e.getMessage());
				System.exit(1);
				return;
			}

			DiskAttachHandler attachHandler = new DiskAttachHandler(sessions, new TaskWaiter(sessions), metadata);
			VolumePathResolver volumePaths = new VolumePathResolver(tools,
					cfg.getString("volumes", "dir_name", VolumePathResolver.DEFAULT_DIR_NAME));
			RequestDispatcher dispatcher = new RequestDispatcher(volumePaths, vmdkHandler, attachHandler);
			IdentityResolver identity = new IdentityResolver(
					new VsishHostIntrospection(exec, cfg.getString("tools", "vsish", "/bin/vsish")));

			UnixSocketRequestChannel channel = new UnixSocketRequestChannel(
					Paths.get(cfg.getString("service", "socket_path", "/var/run/vmdkops/vmdkops.sock")));
			channel.open();

			VmdkOpsServer server = new VmdkOpsServer(channel, identity, dispatcher, sessions.getCallerId());
			Runtime.getRuntime().addShutdownHook(new Thread(() -> {
				logger.info("Shutting down");
				server.stop();
				sessions.disconnect();
			}));
			server.run();
		}
		catch (FatalException e)
		{
			logger.error("Fatal error, exiting: {}", e.getMessage());
			System.exit(2);
		}
		catch (Exception e1)
		{
			logger.error("Failed to run vmdkops service", e1);
			System.exit(1);
		}
	}

	/**
	 * Reads only the log level, without going through {@link Config} which
	 * already logs.
	 */
	static String readLogLevel(String cfgPath)
	{
		File f = new File(cfgPath);
		if (!f.exists())
			return DEFAULT_LOG_LEVEL;
		try
		{
			String level = new Wini(f).get("service", "log_level");
			return level == null ? DEFAULT_LOG_LEVEL : level;
		}
		catch (IOException e)
		{
			// Config reports the broken file right after
			System.err.println("Failed to read " + cfgPath + ": " + e.getMessage());
			return DEFAULT_LOG_LEVEL;
		}
	}
}
