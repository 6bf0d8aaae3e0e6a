package com.netbric.vmdkops.vim;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.netbric.vmdkops.service.exception.VimFaultException;
import com.vmware.vim25.LocalizableMessage;
import com.vmware.vim25.LocalizedMethodFault;
import com.vmware.vim25.NotAuthenticated;
import com.vmware.vim25.VmConfigFault;

public class VimSessionTest
{
	private static LocalizableMessage message(String key, String text)
	{
		LocalizableMessage m = new LocalizableMessage();
		m.setKey(key);
		m.setMessage(text);
		return m;
	}

	private static LocalizedMethodFault taskError(String localized, LocalizableMessage... msgs)
	{
		VmConfigFault fault = new VmConfigFault();
		fault.setFaultMessage(msgs);
		LocalizedMethodFault lf = new LocalizedMethodFault();
		lf.setFault(fault);
		lf.setLocalizedMessage(localized);
		return lf;
	}

	@Test
	void faultMessagesComeFromTheFault()
	{
		LocalizedMethodFault lf = taskError("Invalid configuration for device '0'.",
				message("msg.disk.busy", "Device busy"),
				message("msg.guest.noresponse", "Guest did not respond"));

		assertEquals(Arrays.asList("Device busy", "Guest did not respond"),
				VimSession.faultMessages(lf, lf.getLocalizedMessage()));
	}

	@Test
	void localizedMessageWhenFaultCarriesNone()
	{
		LocalizedMethodFault lf = taskError("Invalid configuration for device '0'.");

		assertEquals(Collections.singletonList("Invalid configuration for device '0'."),
				VimSession.faultMessages(lf, lf.getLocalizedMessage()));
		assertEquals(Collections.singletonList("Task task-1 failed"),
				VimSession.faultMessages(null, "Task task-1 failed"));
	}

	@Test
	void faultClassification()
	{
		assertEquals(VimFaultException.Kind.AUTH_EXPIRED,
				VimSession.toFault("Failed to find VM vm1", new NotAuthenticated()).getKind());
		assertEquals(VimFaultException.Kind.DEVICE_FAULT,
				VimSession.toFault("Failed to reconfigure VM vm1", new RuntimeException(new VmConfigFault())).getKind());
		assertEquals(VimFaultException.Kind.GENERIC,
				VimSession.toFault("Failed to create task filter", new IllegalStateException("boom")).getKind());
	}
}
