package com.netbric.vmdkops.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.netbric.vmdkops.host.IdentityResolver;
import com.netbric.vmdkops.host.VmContext;
import com.netbric.vmdkops.ipc.ChannelRequest;
import com.netbric.vmdkops.ipc.RequestChannel;
import com.netbric.vmdkops.service.exception.FatalException;
import com.netbric.vmdkops.service.exception.InvalidParamException;
import com.netbric.vmdkops.service.exception.StateException;
import com.netbric.vmdkops.service.exception.TransientChannelException;
import com.netbric.vmdkops.service.handler.RequestDispatcher;
import com.netbric.vmdkops.service.rpc.ErrorReply;
import com.netbric.vmdkops.service.rpc.VmdkRequest;

/**
 * Receive / dispatch / reply loop. Requests are served one at a time in the
 * calling thread.
 */
public class VmdkOpsServer
{
	static final Logger logger = LoggerFactory.getLogger(VmdkOpsServer.class);
	public static final int MAX_SKIP_COUNT = 100;

	private final RequestChannel channel;
	private final IdentityResolver identity;
	private final RequestDispatcher dispatcher;
	private final String callerId;
	private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
	private volatile boolean running = true;

	public VmdkOpsServer(RequestChannel channel, IdentityResolver identity, RequestDispatcher dispatcher,
			String callerId)
	{
		this.channel = channel;
		this.identity = identity;
		this.dispatcher = dispatcher;
		this.callerId = callerId;
	}

	/**
	 * Serves requests until {@link #stop()} is called or the channel keeps
	 * failing.
	 */
	public void run() throws FatalException
	{
		int skipCount = MAX_SKIP_COUNT;
		logger.info("Started vmdkops service");
		while (running)
		{
			ChannelRequest req;
			try
			{
				req = channel.nextRequest();
			}
			catch (TransientChannelException e)
			{
				if (!running)
					break;
				skipCount--;
				logger.warn("Failed to receive request ({} retries left): {}", skipCount, e.getMessage());
				if (skipCount <= 0)
				{
					logger.error("Too many errors from channel - giving up.");
					throw new FatalException("Too many errors from channel - giving up.", e);
				}
				continue;
			}
			skipCount = MAX_SKIP_COUNT;

			String reply = handleRequest(req);
			try
			{
				channel.reply(req, reply);
			}
			catch (IOException e)
			{
				logger.warn("Failed to send reply for cartel {}: {}", req.cartelId, e.getMessage());
			}
		}
		logger.info("vmdkops service stopped");
	}

	/**
	 * Turns one raw request into the JSON reply. Never throws for a failure of
	 * the request itself.
	 */
	String handleRequest(ChannelRequest req) throws FatalException
	{
		MDC.put("caller", callerId);
		try
		{
			VmContext vmCtx = identity.resolve(req.cartelId);
			MDC.put("vm", vmCtx.name);

			VmdkRequest r = parse(req.payload);
			Object result = dispatcher.execute(vmCtx, r.cmd, r.details.name, r.details.opts);
			String json = gson.toJson(result);
			logger.debug("Reply: {}", json);
			return json;
		}
		catch (StateException e)
		{
			logger.error("Request from cartel {} failed: {}", req.cartelId, e.getMessage());
			return gson.toJson(new ErrorReply(e.getMessage()));
		}
		catch (RuntimeException e)
		{
			logger.error("Unexpected error handling request from cartel " + req.cartelId, e);
			return gson.toJson(new ErrorReply(e.toString()));
		}
		finally
		{
			MDC.remove("vm");
			MDC.remove("caller");
		}
	}

	VmdkRequest parse(byte[] payload) throws InvalidParamException
	{
		String txt = new String(payload, StandardCharsets.UTF_8);
		logger.debug("Request: {}", txt);
		VmdkRequest r;
		try
		{
			r = gson.fromJson(txt, VmdkRequest.class);
		}
		catch (JsonParseException e)
		{
			throw new InvalidParamException(String.format("Failed to parse json '%s'.", txt));
		}
		if (r == null || r.cmd == null || r.details == null)
			throw new InvalidParamException("Invalid request: 'cmd' and 'details' are required");
		return r;
	}

	public void stop()
	{
		running = false;
		channel.close();
	}
}
