package com.netbric.vmdkops.vim;

import java.rmi.RemoteException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netbric.vmdkops.service.exception.VimFaultException;
import com.vmware.vim25.Description;
import com.vmware.vim25.LocalizableMessage;
import com.vmware.vim25.LocalizedMethodFault;
import com.vmware.vim25.ManagedObjectReference;
import com.vmware.vim25.MethodFault;
import com.vmware.vim25.NotAuthenticated;
import com.vmware.vim25.ObjectSpec;
import com.vmware.vim25.ObjectUpdate;
import com.vmware.vim25.ParaVirtualSCSIController;
import com.vmware.vim25.PropertyChange;
import com.vmware.vim25.PropertyFilterSpec;
import com.vmware.vim25.PropertyFilterUpdate;
import com.vmware.vim25.PropertySpec;
import com.vmware.vim25.TaskInfo;
import com.vmware.vim25.TaskInfoState;
import com.vmware.vim25.UpdateSet;
import com.vmware.vim25.VirtualBusLogicController;
import com.vmware.vim25.VirtualDevice;
import com.vmware.vim25.VirtualDeviceConfigSpec;
import com.vmware.vim25.VirtualDeviceConfigSpecOperation;
import com.vmware.vim25.VirtualDeviceFileBackingInfo;
import com.vmware.vim25.VirtualDisk;
import com.vmware.vim25.VirtualDiskFlatVer2BackingInfo;
import com.vmware.vim25.VirtualLsiLogicController;
import com.vmware.vim25.VirtualLsiLogicSASController;
import com.vmware.vim25.VirtualMachineConfigInfo;
import com.vmware.vim25.VirtualMachineConfigSpec;
import com.vmware.vim25.VirtualSCSIController;
import com.vmware.vim25.VirtualSCSISharing;
import com.vmware.vim25.VmConfigFault;
import com.vmware.vim25.mo.InventoryNavigator;
import com.vmware.vim25.mo.ManagedEntity;
import com.vmware.vim25.mo.PropertyCollector;
import com.vmware.vim25.mo.PropertyFilter;
import com.vmware.vim25.mo.ServiceInstance;
import com.vmware.vim25.mo.Task;
import com.vmware.vim25.mo.VirtualMachine;

/**
 * {@link HypervisorSession} over the vSphere web services API.
 */
public class VimSession implements HypervisorSession
{
	static final Logger logger = LoggerFactory.getLogger(VimSession.class);

	/** Backing file names given as a plain path carry an empty datastore prefix. */
	static final String NO_DATASTORE = "[] ";

	private final ServiceInstance si;
	private final String callerId;

	VimSession(ServiceInstance si, String callerId)
	{
		this.si = si;
		this.callerId = callerId;
	}

	@Override
	public VmRef findVmByName(String vmName) throws VimFaultException
	{
		try
		{
			ManagedEntity me = new InventoryNavigator(si.getRootFolder()).searchManagedEntity("VirtualMachine",
					vmName);
			if (me == null)
				return null;
			return new VmRef(me.getMOR().get_value(), vmName);
		}
		catch (RemoteException | RuntimeException e)
		{
			throw toFault("Failed to find VM " + vmName, e);
		}
	}

	@Override
	public List<VirtualDeviceInfo> getDevices(VmRef vm) throws VimFaultException
	{
		List<VirtualDeviceInfo> out = new ArrayList<>();
		for (VirtualDevice d : rawDevices(vm))
		{
			if (d instanceof VirtualSCSIController)
			{
				out.add(new ScsiControllerInfo(d.getKey(), kindOf(d), ((VirtualSCSIController) d).getBusNumber()));
			}
			else if (d instanceof VirtualDisk)
			{
				String fileName = null;
				if (d.getBacking() instanceof VirtualDeviceFileBackingInfo)
					fileName = ((VirtualDeviceFileBackingInfo) d.getBacking()).getFileName();
				int controllerKey = d.getControllerKey() == null ? -1 : d.getControllerKey();
				int unitNumber = d.getUnitNumber() == null ? -1 : d.getUnitNumber();
				out.add(new VirtualDiskInfo(d.getKey(), controllerKey, unitNumber, fileName));
			}
		}
		return Collections.unmodifiableList(out);
	}

	@Override
	public TaskRef reconfigure(VmRef vm, List<DeviceChange> changes) throws VimFaultException
	{
		VirtualDeviceConfigSpec[] specs = new VirtualDeviceConfigSpec[changes.size()];
		VirtualDevice[] current = null;
		for (int i = 0; i < specs.length; i++)
		{
			DeviceChange c = changes.get(i);
			VirtualDeviceConfigSpec ds = new VirtualDeviceConfigSpec();
			if (c.operation == DeviceChange.Operation.ADD)
			{
				ds.setOperation(VirtualDeviceConfigSpecOperation.add);
				ds.setDevice(toVimDevice(c.device));
			}
			else
			{
				if (current == null)
					current = rawDevices(vm);
				ds.setOperation(VirtualDeviceConfigSpecOperation.remove);
				ds.setDevice(findByKey(current, c.device.key));
			}
			specs[i] = ds;
		}
		VirtualMachineConfigSpec spec = new VirtualMachineConfigSpec();
		spec.setDeviceChange(specs);
		try
		{
			Task task = vmObject(vm).reconfigVM_Task(spec);
			logger.debug("Reconfigure of {} submitted by {} as task {}", vm, callerId, task.getMOR().get_value());
			return new TaskRef(task.getMOR().get_value());
		}
		catch (RemoteException | RuntimeException e)
		{
			throw toFault("Failed to reconfigure VM " + vm.name, e);
		}
	}

	@Override
	public TaskSubscription subscribe(List<TaskRef> tasks) throws VimFaultException
	{
		ObjectSpec[] objs = new ObjectSpec[tasks.size()];
		for (int i = 0; i < objs.length; i++)
		{
			ObjectSpec os = new ObjectSpec();
			os.setObj(taskMor(tasks.get(i)));
			os.setSkip(Boolean.FALSE);
			objs[i] = os;
		}
		PropertySpec ps = new PropertySpec();
		ps.setType("Task");
		ps.setAll(Boolean.FALSE);
		ps.setPathSet(new String[] { "info.state" });

		PropertyFilterSpec fs = new PropertyFilterSpec();
		fs.setObjectSet(objs);
		fs.setPropSet(new PropertySpec[] { ps });
		try
		{
			PropertyCollector pc = si.getPropertyCollector();
			PropertyFilter filter = pc.createFilter(fs, true);
			return new VimTaskSubscription(pc, filter);
		}
		catch (RemoteException | RuntimeException e)
		{
			throw toFault("Failed to create task filter", e);
		}
	}

	@Override
	public void disconnect()
	{
		try
		{
			si.getServerConnection().logout();
		}
		catch (RuntimeException e)
		{
			logger.warn("Logout failed: {}", e.toString());
		}
	}

	private class VimTaskSubscription implements TaskSubscription
	{
		private final PropertyCollector pc;
		private final PropertyFilter filter;

		VimTaskSubscription(PropertyCollector pc, PropertyFilter filter)
		{
			this.pc = pc;
			this.filter = filter;
		}

		@Override
		public TaskUpdate waitForUpdate(String version) throws VimFaultException
		{
			UpdateSet update;
			try
			{
				update = pc.waitForUpdates(version == null ? "" : version);
			}
			catch (RemoteException | RuntimeException e)
			{
				throw toFault("Failed waiting for task updates", e);
			}
			List<TaskChange> changes = new ArrayList<>();
			PropertyFilterUpdate[] filterSets = update.getFilterSet();
			if (filterSets != null)
			{
				for (PropertyFilterUpdate fu : filterSets)
				{
					if (fu.getObjectSet() == null)
						continue;
					for (ObjectUpdate ou : fu.getObjectSet())
					{
						if (ou.getChangeSet() == null)
							continue;
						for (PropertyChange ch : ou.getChangeSet())
						{
							TaskInfoState st;
							if ("info".equals(ch.getName()) && ch.getVal() instanceof TaskInfo)
								st = ((TaskInfo) ch.getVal()).getState();
							else if ("info.state".equals(ch.getName()) && ch.getVal() instanceof TaskInfoState)
								st = (TaskInfoState) ch.getVal();
							else
								continue;
							changes.add(toChange(ou.getObj(), st));
						}
					}
				}
			}
			return new TaskUpdate(update.getVersion(), changes);
		}

		@Override
		public void close()
		{
			try
			{
				filter.destroyPropertyFilter();
			}
			catch (RemoteException | RuntimeException e)
			{
				logger.warn("Failed to destroy task filter: {}", e.toString());
			}
		}
	}

	private TaskChange toChange(ManagedObjectReference mor, TaskInfoState st)
	{
		TaskRef ref = new TaskRef(mor.get_value());
		if (st == TaskInfoState.success)
			return new TaskChange(ref, TaskState.SUCCESS);
		if (st == TaskInfoState.running)
			return new TaskChange(ref, TaskState.RUNNING);
		if (st == TaskInfoState.queued)
			return new TaskChange(ref, TaskState.QUEUED);

		String msg = "Task " + ref + " failed";
		LocalizedMethodFault lf = null;
		try
		{
			lf = new Task(si.getServerConnection(), mor).getTaskInfo().getError();
			if (lf != null && lf.getLocalizedMessage() != null)
				msg = lf.getLocalizedMessage();
		}
		catch (RemoteException | RuntimeException e)
		{
			logger.warn("Failed to read error of task {}: {}", ref, e.toString());
		}
		return new TaskChange(ref, TaskState.ERROR, msg, faultMessages(lf, msg));
	}

	/**
	 * Messages carried by the fault itself, or {@code fallback} alone when the
	 * fault has none.
	 */
	static List<String> faultMessages(LocalizedMethodFault lf, String fallback)
	{
		List<String> out = new ArrayList<>();
		MethodFault fault = lf == null ? null : lf.getFault();
		LocalizableMessage[] msgs = fault == null ? null : fault.getFaultMessage();
		if (msgs != null)
		{
			for (LocalizableMessage m : msgs)
			{
				if (m != null && m.getMessage() != null)
					out.add(m.getMessage());
			}
		}
		if (out.isEmpty())
			out.add(fallback);
		return out;
	}

	private VirtualMachine vmObject(VmRef vm)
	{
		ManagedObjectReference mor = new ManagedObjectReference();
		mor.setType("VirtualMachine");
		mor.set_value(vm.id);
		return new VirtualMachine(si.getServerConnection(), mor);
	}

	private static ManagedObjectReference taskMor(TaskRef task)
	{
		ManagedObjectReference mor = new ManagedObjectReference();
		mor.setType("Task");
		mor.set_value(task.id);
		return mor;
	}

	private VirtualDevice[] rawDevices(VmRef vm) throws VimFaultException
	{
		try
		{
			VirtualMachineConfigInfo cfg = vmObject(vm).getConfig();
			if (cfg == null || cfg.getHardware() == null || cfg.getHardware().getDevice() == null)
				return new VirtualDevice[0];
			return cfg.getHardware().getDevice();
		}
		catch (RuntimeException e)
		{
			throw toFault("Failed to read devices of VM " + vm.name, e);
		}
	}

	private static VirtualDevice findByKey(VirtualDevice[] devices, int key) throws VimFaultException
	{
		for (VirtualDevice d : devices)
		{
			if (d.getKey() == key)
				return d;
		}
		throw new VimFaultException(VimFaultException.Kind.DEVICE_FAULT, "Device " + key + " is no longer present");
	}

	private static ControllerKind kindOf(VirtualDevice d)
	{
		if (d instanceof ParaVirtualSCSIController)
			return ControllerKind.PARAVIRTUAL;
		if (d instanceof VirtualLsiLogicSASController)
			return ControllerKind.LSI_LOGIC_SAS;
		if (d instanceof VirtualLsiLogicController)
			return ControllerKind.LSI_LOGIC;
		if (d instanceof VirtualBusLogicController)
			return ControllerKind.BUS_LOGIC;
		return ControllerKind.OTHER;
	}

	private static VirtualDevice toVimDevice(VirtualDeviceInfo info) throws VimFaultException
	{
		if (info instanceof ScsiControllerInfo)
		{
			ScsiControllerInfo c = (ScsiControllerInfo) info;
			if (c.kind != ControllerKind.PARAVIRTUAL)
				throw new VimFaultException(VimFaultException.Kind.GENERIC, "Unsupported controller type " + c.kind);
			ParaVirtualSCSIController ctl = new ParaVirtualSCSIController();
			ctl.setKey(c.key);
			ctl.setBusNumber(c.busNumber);
			ctl.setSharedBus(VirtualSCSISharing.noSharing);
			return ctl;
		}
		VirtualDiskInfo d = (VirtualDiskInfo) info;
		VirtualDiskFlatVer2BackingInfo backing = new VirtualDiskFlatVer2BackingInfo();
		backing.setFileName(NO_DATASTORE + d.backingFileName);
		backing.setDiskMode(d.diskMode);
		Description desc = new Description();
		desc.setLabel(d.label);
		desc.setSummary(d.label);
		VirtualDisk disk = new VirtualDisk();
		disk.setBacking(backing);
		disk.setDeviceInfo(desc);
		disk.setUnitNumber(d.unitNumber);
		disk.setControllerKey(d.controllerKey);
		return disk;
	}

	static VimFaultException toFault(String context, Throwable e)
	{
		Throwable cause = e;
		while (cause instanceof RuntimeException && cause.getCause() != null)
			cause = cause.getCause();
		VimFaultException.Kind kind = VimFaultException.Kind.GENERIC;
		if (cause instanceof NotAuthenticated)
			kind = VimFaultException.Kind.AUTH_EXPIRED;
		else if (cause instanceof VmConfigFault)
			kind = VimFaultException.Kind.DEVICE_FAULT;
		String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
		return new VimFaultException(kind, context + ": " + detail, e);
	}
}
