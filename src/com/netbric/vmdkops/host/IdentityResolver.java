package com.netbric.vmdkops.host;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.netbric.vmdkops.service.exception.InvalidParamException;
import com.netbric.vmdkops.service.exception.StateException;

/**
 * Maps the cartel id delivered with a request to the VM that sent it.
 */
public class IdentityResolver
{
	private final HostIntrospection host;

	public IdentityResolver(HostIntrospection host)
	{
		this.host = host;
	}

	public VmContext resolve(int cartelId) throws StateException
	{
		String leader = host.getVmmLeader(cartelId);
		Map<String, String> groupInfo = host.getVmmGroupInfo(leader);
		String name = groupInfo.get("displayName");
		String cfgPath = groupInfo.get("cfgPath");
		if (StringUtils.isEmpty(name) || StringUtils.isEmpty(cfgPath))
			throw new InvalidParamException("Incomplete VM group info for cartel " + cartelId);
		return new VmContext(name, formatUuid(groupInfo.get("uuid")), cfgPath);
	}

	/**
	 * Converts the raw VSI uuid (32 hex digits, possibly separated by spaces or
	 * dashes) to the 8-4-4-4-12 form used as VM key by the management API.
	 */
	public static String formatUuid(String raw) throws InvalidParamException
	{
		StringBuilder hex = new StringBuilder(32);
		if (raw != null)
		{
			for (char c : raw.toCharArray())
			{
				if (Character.digit(c, 16) >= 0)
					hex.append(Character.toLowerCase(c));
			}
		}
		if (hex.length() != 32)
			throw new InvalidParamException("Invalid VM uuid: " + raw);
		String s = hex.toString();
		return String.format("%s-%s-%s-%s-%s", s.substring(0, 8), s.substring(8, 12), s.substring(12, 16),
				s.substring(16, 20), s.substring(20, 32));
	}
}
