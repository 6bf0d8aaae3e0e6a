package com.netbric.vmdkops.host;

import java.io.IOException;
import java.io.StringReader;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import com.netbric.vmdkops.service.ExecResult;
import com.netbric.vmdkops.service.ToolInvoker;
import com.netbric.vmdkops.service.exception.InvalidParamException;
import com.netbric.vmdkops.service.exception.StateException;
import com.netbric.vmdkops.service.exception.ToolException;

/**
 * Reads the VSI nodes through the {@code vsish} utility.
 */
public class VsishHostIntrospection implements HostIntrospection
{
	static final Logger logger = LoggerFactory.getLogger(VsishHostIntrospection.class);

	private final ToolInvoker invoker;
	private final String vsish;

	public VsishHostIntrospection(ToolInvoker invoker, String vsish)
	{
		this.invoker = invoker;
		this.vsish = vsish;
	}

	@Override
	public String getVmmLeader(int cartelId) throws StateException
	{
		String out = get(String.format("/userworld/cartel/%d/vmmLeader", cartelId)).trim();
		if (!StringUtils.isNumeric(out))
			throw new InvalidParamException("Unexpected vmmLeader for cartel " + cartelId + ": " + out);
		return out;
	}

	@Override
	public Map<String, String> getVmmGroupInfo(String vmmLeader) throws StateException
	{
		String node = String.format("/vm/%s/vmmGroupInfo", vmmLeader);
		String out = get(node);
		try
		{
			JsonReader reader = new JsonReader(new StringReader(out));
			reader.setLenient(true);
			JsonElement e = JsonParser.parseReader(reader);
			if (!e.isJsonObject())
				throw new InvalidParamException("Unexpected content of " + node);
			JsonObject o = e.getAsJsonObject();
			Map<String, String> info = new HashMap<>();
			for (Map.Entry<String, JsonElement> entry : o.entrySet())
			{
				if (entry.getValue().isJsonPrimitive())
					info.put(entry.getKey(), entry.getValue().getAsString());
			}
			return info;
		}
		catch (JsonParseException e)
		{
			throw new InvalidParamException("Failed to parse " + node + ": " + e.getMessage());
		}
	}

	private String get(String node) throws ToolException
	{
		ExecResult r;
		try
		{
			r = invoker.invoke(vsish, "-e", "-p", "get", node);
		}
		catch (IOException e)
		{
			throw new ToolException("Failed to read " + node + ". " + e.getMessage(), -1, e.getMessage());
		}
		if (!r.succeeded())
			throw new ToolException("Failed to read " + node + ". " + r.output, r.exitCode, r.output);
		logger.debug("{} = {}", node, r.output);
		return r.output;
	}
}
