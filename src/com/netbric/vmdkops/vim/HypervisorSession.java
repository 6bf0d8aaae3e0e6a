package com.netbric.vmdkops.vim;

import java.util.List;

import com.netbric.vmdkops.service.exception.VimFaultException;

/**
 * Authenticated connection to the hypervisor management API. Calls made with
 * an expired login fail with {@code VimFaultException.Kind.AUTH_EXPIRED}.
 */
public interface HypervisorSession
{
	/**
	 * @return the VM, or null if no VM has that name
	 */
	VmRef findVmByName(String vmName) throws VimFaultException;

	/**
	 * Enumerates the SCSI controllers and virtual disks of a VM.
	 */
	List<VirtualDeviceInfo> getDevices(VmRef vm) throws VimFaultException;

	/**
	 * Submits one reconfigure request carrying all changes and returns the
	 * asynchronous task executing it.
	 */
	TaskRef reconfigure(VmRef vm, List<DeviceChange> changes) throws VimFaultException;

	/**
	 * Creates a change filter reporting state transitions of the given tasks.
	 */
	TaskSubscription subscribe(List<TaskRef> tasks) throws VimFaultException;

	void disconnect();
}
