package com.netbric.vmdkops.service.handler;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.host.VmContext;
import com.netbric.vmdkops.meta.VolumeMetadata;
import com.netbric.vmdkops.meta.VolumeMetadataStore;
import com.netbric.vmdkops.meta.VolumeStatus;
import com.netbric.vmdkops.service.exception.FatalException;
import com.netbric.vmdkops.service.exception.HypervisorFaultException;
import com.netbric.vmdkops.service.exception.LoggedException;
import com.netbric.vmdkops.service.exception.NotFoundException;
import com.netbric.vmdkops.service.exception.StateException;
import com.netbric.vmdkops.service.exception.VimFaultException;
import com.netbric.vmdkops.service.rpc.AttachReply;
import com.netbric.vmdkops.service.rpc.RetCode;
import com.netbric.vmdkops.vim.ControllerKind;
import com.netbric.vmdkops.vim.DeviceChange;
import com.netbric.vmdkops.vim.ScsiControllerInfo;
import com.netbric.vmdkops.vim.SessionManager;
import com.netbric.vmdkops.vim.TaskRef;
import com.netbric.vmdkops.vim.TaskWaiter;
import com.netbric.vmdkops.vim.VirtualDeviceInfo;
import com.netbric.vmdkops.vim.VirtualDiskInfo;
import com.netbric.vmdkops.vim.VmRef;

/**
 * Attaches volumes to the requesting VM on a PVSCSI controller (PVSCSI avoids
 * SCSI rescans in the guest) and detaches them again.
 *
 * Slot selection reads the device list and submits the reconfigure without
 * any lock, so requests for the same VM must not run concurrently.
 */
public class DiskAttachHandler
{
	static final Logger logger = LoggerFactory.getLogger(DiskAttachHandler.class);

	public static final int MAX_SCSI_CONTROLLERS = 4;
	public static final int MAX_UNIT_NUMBER = 15;
	// taken by the controller itself
	public static final int RESERVED_UNIT_NUMBER = 7;
	public static final String DISK_LABEL = "dockerDataVolume";
	static final ControllerKind PREFERRED_CONTROLLER = ControllerKind.PARAVIRTUAL;

	private final SessionManager sessions;
	private final TaskWaiter taskWaiter;
	private final VolumeMetadataStore metadata;

	public DiskAttachHandler(SessionManager sessions, TaskWaiter taskWaiter, VolumeMetadataStore metadata)
	{
		this.sessions = sessions;
		this.taskWaiter = taskWaiter;
		this.metadata = metadata;
	}

	public AttachReply attach(String vmdkPath, VmContext vmCtx) throws StateException, FatalException
	{
		VmRef vm = sessions.findVm(vmCtx.name);
		logger.info("*** attachVMDK: {} to {} uuid={}", vmdkPath, vmCtx.name, vmCtx.uuid);

		List<VirtualDeviceInfo> devices = sessions.getSession().getDevices(vm);
		List<DeviceChange> changes = new ArrayList<>();

		List<ScsiControllerInfo> controllers = new ArrayList<>();
		ScsiControllerInfo preferred = null;
		for (VirtualDeviceInfo d : devices)
		{
			if (d instanceof ScsiControllerInfo)
			{
				ScsiControllerInfo c = (ScsiControllerInfo) d;
				controllers.add(c);
				if (preferred == null && c.kind == PREFERRED_CONTROLLER)
					preferred = c;
			}
		}

		int controllerKey;
		int busNumber;
		Integer diskSlot = null;
		if (preferred != null)
		{
			controllerKey = preferred.key;
			busNumber = preferred.busNumber;
		}
		else
		{
			logger.warn("PVSCSI adapter is missing - trying to add one...");
			Integer freeBus = lowestFreeBus(controllers);
			if (freeBus == null)
				throw new LoggedException(logger, RetCode.NO_SLOT,
						"Failed to place PVSCSI adapter - out of bus slots. VM=%s", vmCtx.uuid);
			busNumber = freeBus;
			ScsiControllerInfo ctl = ScsiControllerInfo.onBus(PREFERRED_CONTROLLER, busNumber);
			controllerKey = ctl.key;
			// starting on a fresh controller
			diskSlot = 0;
			changes.add(DeviceChange.add(ctl));
		}

		VirtualDiskInfo existing = findDeviceByPath(vmdkPath, devices);
		if (existing != null)
		{
			logger.warn("Disk {} already attached. VM={}", vmdkPath, vmCtx.uuid);
			setStatusAttached(vmdkPath, vmCtx.uuid);
			return new AttachReply(existing.unitNumber, existing.controllerKey - ScsiControllerInfo.KEY_OFFSET);
		}

		if (diskSlot == null)
		{
			diskSlot = lowestFreeUnit(devices, controllerKey);
			if (diskSlot == null)
				throw new LoggedException(logger, RetCode.NO_SLOT,
						"Failed to place new disk - out of disk slots. VM=%s", vmCtx.uuid);
		}
		logger.debug("controllerKey={} slot={}", controllerKey, diskSlot);

		changes.add(DeviceChange.add(new VirtualDiskInfo(0, controllerKey, diskSlot, vmdkPath,
				VirtualDiskInfo.MODE_PERSISTENT, DISK_LABEL)));
		try
		{
			TaskRef task = sessions.getSession().reconfigure(vm, changes);
			taskWaiter.waitForTasks(Collections.singletonList(task));
		}
		catch (HypervisorFaultException | VimFaultException e)
		{
			throw attachFailure(vmdkPath, vmCtx.uuid, e);
		}

		setStatusAttached(vmdkPath, vmCtx.uuid);
		logger.info("Disk {} successfully attached. diskSlot={}, busNumber={}", vmdkPath, diskSlot, busNumber);
		return new AttachReply(diskSlot, busNumber);
	}

	public void detach(String vmdkPath, VmContext vmCtx) throws StateException, FatalException
	{
		VmRef vm = sessions.findVm(vmCtx.name);
		logger.info("*** detachVMDK: {} from {} VM uuid={}", vmdkPath, vmCtx.name, vmCtx.uuid);

		VirtualDiskInfo device = findDeviceByPath(vmdkPath, sessions.getSession().getDevices(vm));
		if (device == null)
		{
			// expected when the attach failed (e.g. disk in use by another VM)
			// and the caller still sends a detach
			String msg = String.format("*** Detach failed: disk=%s not found. VM=%s", vmdkPath, vmCtx.uuid);
			logger.warn(msg);
			throw new NotFoundException(msg);
		}

		try
		{
			TaskRef task = sessions.getSession().reconfigure(vm,
					Collections.singletonList(DeviceChange.remove(device)));
			taskWaiter.waitForTasks(Collections.singletonList(task));
		}
		catch (HypervisorFaultException | VimFaultException e)
		{
			List<String> faults = faultMessagesOf(e);
			for (String f : faults)
				logger.warn(f);
			String detail = faults.isEmpty() ? e.getMessage() : String.join("; ", faults);
			throw new HypervisorFaultException("Failed to detach " + vmdkPath + ": " + detail, faults);
		}

		setStatusDetached(vmdkPath);
		logger.info("Disk detached {}", vmdkPath);
	}

	private HypervisorFaultException attachFailure(String vmdkPath, String vmUuid, StateException e)
	{
		String msg = e.getMessage();
		// metadata only adds a hint, the hypervisor's answer stands
		VolumeMetadata meta = metadata.getAll(vmdkPath);
		if (meta != null && meta.isAttached() && !vmUuid.equals(meta.attachedVMUuid))
			msg += String.format(" disk %s already attached to VM=%s", vmdkPath, meta.attachedVMUuid);
		logger.error("Attach of {} failed: {}", vmdkPath, msg);
		return new HypervisorFaultException(msg, faultMessagesOf(e));
	}

	private static List<String> faultMessagesOf(StateException e)
	{
		if (e instanceof HypervisorFaultException)
			return ((HypervisorFaultException) e).getFaultMessages();
		return Collections.emptyList();
	}

	/**
	 * Finds the disk backed by the given volume. Backing names look like
	 * {@code [datastore] <dir>/<name>.vmdk}, where dir is the real name of the
	 * volume directory (it may be a symlink).
	 */
	static VirtualDiskInfo findDeviceByPath(String vmdkPath, List<VirtualDeviceInfo> devices)
	{
		String virtualDisk = volumeDiskName(vmdkPath);
		for (VirtualDeviceInfo d : devices)
		{
			if (!(d instanceof VirtualDiskInfo))
				continue;
			VirtualDiskInfo disk = (VirtualDiskInfo) d;
			if (disk.backingFileName == null)
				continue;
			String backing = stripDatastore(disk.backingFileName);
			if (backing.equals(virtualDisk) || backing.endsWith("/" + virtualDisk))
			{
				logger.debug("findDeviceByPath: MATCH: {}", disk.backingFileName);
				return disk;
			}
		}
		return null;
	}

	static String volumeDiskName(String vmdkPath)
	{
		Path p = Paths.get(vmdkPath);
		Path dir = p.getParent();
		String dirName;
		try
		{
			dirName = dir.toRealPath().getFileName().toString();
		}
		catch (IOException e)
		{
			dirName = dir.getFileName().toString();
		}
		return dirName + "/" + p.getFileName();
	}

	static String stripDatastore(String backingFileName)
	{
		if (backingFileName.startsWith("["))
		{
			int i = backingFileName.indexOf("] ");
			if (i >= 0)
				return backingFileName.substring(i + 2);
		}
		return backingFileName;
	}

	static Integer lowestFreeBus(List<ScsiControllerInfo> controllers)
	{
		if (controllers.size() >= MAX_SCSI_CONTROLLERS)
			return null;
		Set<Integer> taken = new HashSet<>();
		for (ScsiControllerInfo c : controllers)
			taken.add(c.busNumber);
		for (int bus = 0; bus < MAX_SCSI_CONTROLLERS; bus++)
		{
			if (!taken.contains(bus))
				return bus;
		}
		return null;
	}

	static Integer lowestFreeUnit(List<VirtualDeviceInfo> devices, int controllerKey)
	{
		Set<Integer> taken = new HashSet<>();
		for (VirtualDeviceInfo d : devices)
		{
			if (d instanceof VirtualDiskInfo && d.controllerKey != null && d.controllerKey == controllerKey)
				taken.add(d.unitNumber);
		}
		for (int unit = 0; unit <= MAX_UNIT_NUMBER; unit++)
		{
			if (unit != RESERVED_UNIT_NUMBER && !taken.contains(unit))
				return unit;
		}
		return null;
	}

	private void setStatusAttached(String vmdkPath, String vmUuid)
	{
		logger.debug("Set status=attached disk={} VM={}", vmdkPath, vmUuid);
		VolumeMetadata meta = metadata.getAll(vmdkPath);
		if (meta == null)
			meta = new VolumeMetadata();
		meta.status = VolumeStatus.ATTACHED;
		meta.attachedVMUuid = vmUuid;
		if (!metadata.setAll(vmdkPath, meta))
			logger.warn("Attach: Failed to save Disk metadata {}", vmdkPath);
	}

	private void setStatusDetached(String vmdkPath)
	{
		logger.debug("Set status=detached disk={}", vmdkPath);
		VolumeMetadata meta = metadata.getAll(vmdkPath);
		if (meta == null)
			meta = new VolumeMetadata();
		meta.status = VolumeStatus.DETACHED;
		meta.attachedVMUuid = null;
		if (!metadata.setAll(vmdkPath, meta))
			logger.warn("Detach: Failed to save Disk metadata {}", vmdkPath);
	}
}
