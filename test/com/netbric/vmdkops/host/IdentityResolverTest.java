package com.netbric.vmdkops.host;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.netbric.vmdkops.service.exception.InvalidParamException;
import com.netbric.vmdkops.service.exception.NotFoundException;

public class IdentityResolverTest
{
	@Test
	void resolvesCartelToVm() throws Exception
	{
		FakeHostIntrospection host = new FakeHostIntrospection().addVm(1234, "1230", "ubuntu-1",
				"564d1a2b3c4d5e6f7a8b9c0d1e2f3a4b", "/vmfs/volumes/datastore1/ubuntu-1/ubuntu-1.vmx");

		VmContext vm = new IdentityResolver(host).resolve(1234);

		assertEquals("ubuntu-1", vm.name);
		assertEquals("564d1a2b-3c4d-5e6f-7a8b-9c0d1e2f3a4b", vm.uuid);
		assertEquals("/vmfs/volumes/datastore1/ubuntu-1/ubuntu-1.vmx", vm.configPath);
	}

	@Test
	void uuidSeparatorsAndCaseAreNormalized() throws Exception
	{
		assertEquals("564d1a2b-3c4d-5e6f-7a8b-9c0d1e2f3a4b",
				IdentityResolver.formatUuid("56 4d 1a 2b 3c 4d 5e 6f-7a 8b 9c 0d 1e 2f 3a 4b"));
		assertEquals("564d1a2b-3c4d-5e6f-7a8b-9c0d1e2f3a4b",
				IdentityResolver.formatUuid("564D1A2B3C4D5E6F7A8B9C0D1E2F3A4B"));
	}

	@Test
	void malformedUuidIsRejected()
	{
		assertThrows(InvalidParamException.class, () -> IdentityResolver.formatUuid("564d1a2b"));
		assertThrows(InvalidParamException.class,
				() -> IdentityResolver.formatUuid("564d1a2b3c4d5e6f7a8b9c0d1e2f3a4b00"));
		assertThrows(InvalidParamException.class, () -> IdentityResolver.formatUuid(null));
	}

	@Test
	void unknownCartelFails()
	{
		IdentityResolver r = new IdentityResolver(new FakeHostIntrospection());
		assertThrows(NotFoundException.class, () -> r.resolve(99));
	}

	@Test
	void incompleteGroupInfoFails()
	{
		FakeHostIntrospection host = new FakeHostIntrospection().addVm(7, "7", "vm7",
				"564d1a2b3c4d5e6f7a8b9c0d1e2f3a4b", "/vmfs/volumes/ds/vm7/vm7.vmx");
		host.groups.get("7").remove("cfgPath");

		assertThrows(InvalidParamException.class, () -> new IdentityResolver(host).resolve(7));
	}
}
