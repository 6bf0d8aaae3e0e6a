package com.netbric.vmdkops.service.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.netbric.vmdkops.meta.InMemoryMetadataStore;
import com.netbric.vmdkops.meta.VolumeMetadata;
import com.netbric.vmdkops.meta.VolumeStatus;
import com.netbric.vmdkops.service.ExecResult;
import com.netbric.vmdkops.service.ExternalTools;
import com.netbric.vmdkops.service.FakeToolInvoker;
import com.netbric.vmdkops.service.exception.InvalidParamException;
import com.netbric.vmdkops.service.exception.MetadataException;
import com.netbric.vmdkops.service.exception.StateException;
import com.netbric.vmdkops.service.exception.ToolException;
import com.netbric.vmdkops.service.rpc.RetCode;
import com.netbric.vmdkops.service.rpc.VolumeInfo;

public class VmdkHandlerTest
{
	static final String DESCRIPTOR = "# Disk DescriptorFile\nversion=1\nCID=fffffffe\ncreateType=\"vmfs\"\n";

	@TempDir
	Path tmp;

	private FakeToolInvoker invoker;
	private InMemoryMetadataStore metadata;
	private VmdkHandler handler;
	private Path volDir;
	private Path vsanDir;

	@BeforeEach
	void setUp() throws IOException
	{
		invoker = new FakeToolInvoker();
		// vmkfstools -d thin -c <size> <path> leaves a descriptor and its flat file
		invoker.when("vmkfstools", "-d", cmd -> {
			String path = cmd.get(cmd.size() - 1);
			Files.write(Paths.get(path), DESCRIPTOR.getBytes(StandardCharsets.UTF_8));
			Files.write(Paths.get(path.replace(".vmdk", "-flat.vmdk")), new byte[16]);
			return new ExecResult(0, "");
		});
		metadata = new InMemoryMetadataStore();
		ExternalTools tools = new ExternalTools(invoker, "vmkfstools", "mkfs.ext4", "osfs-mkdir", "objtool");
		volDir = Files.createDirectories(tmp.resolve("dockvols"));
		vsanDir = Files.createDirectories(tmp.resolve("vsan"));
		handler = new VmdkHandler(tools, metadata, VmdkHandler.DEFAULT_DISK_SIZE, vsanDir.toString());
	}

	private String vmdk(String name)
	{
		return volDir.resolve(name + VmdkHandler.VMDK_EXT).toString();
	}

	@Test
	void createFormatsFlatBacking() throws Exception
	{
		String path = vmdk("vol1");
		handler.create(path, "vol1", Collections.emptyMap());

		assertEquals(Arrays.asList("vmkfstools", "-d", "thin", "-c", "100mb", path),
				invoker.last("vmkfstools", "-d"));
		assertEquals(Arrays.asList("mkfs.ext4", "-qF", "-L", "vol1", volDir.resolve("vol1-flat.vmdk").toString()),
				invoker.last("mkfs.ext4", null));
		VolumeMetadata meta = metadata.getAll(path);
		assertEquals(VolumeStatus.DETACHED, meta.status);
		assertNull(meta.attachedVMUuid);
	}

	@Test
	void createUsesRequestedSizeAndKeepsOptions() throws Exception
	{
		String path = vmdk("big");
		Map<String, String> opts = Collections.singletonMap("size", "10gb");
		handler.create(path, "big", opts);

		assertTrue(invoker.last("vmkfstools", "-d").contains("10gb"));
		assertEquals("10gb", metadata.getAll(path).volOpts.get("size"));
	}

	@Test
	void createFailsWhenVolumeExists() throws IOException
	{
		String path = vmdk("vol1");
		Files.write(Paths.get(path), DESCRIPTOR.getBytes(StandardCharsets.UTF_8));

		InvalidParamException e = assertThrows(InvalidParamException.class,
				() -> handler.create(path, "vol1", null));
		assertEquals(RetCode.ALREADY_EXISTS, e.state);
		assertTrue(invoker.calls.isEmpty());
	}

	@Test
	void createToolFailureCarriesOutput()
	{
		invoker.fail("vmkfstools", "-d", 1, "Failed to create virtual disk: No space left on device");

		ToolException e = assertThrows(ToolException.class, () -> handler.create(vmdk("vol1"), "vol1", null));
		assertTrue(e.getMessage().contains("No space left on device"), e.getMessage());
		assertEquals(1, e.getExitCode());
		assertEquals(0, invoker.count("mkfs.ext4", null));
	}

	@Test
	void createRollsBackWhenMetadataCannotBeWritten()
	{
		metadata.failWrites = true;
		String path = vmdk("vol1");

		assertThrows(MetadataException.class, () -> handler.create(path, "vol1", null));
		assertEquals(Arrays.asList("vmkfstools", "-U", path), invoker.last("vmkfstools", "-U"));
		assertEquals(0, invoker.count("mkfs.ext4", null));
	}

	@Test
	void failedRollbackKeepsMetadataError()
	{
		metadata.failWrites = true;
		invoker.fail("vmkfstools", "-U", 1, "Device or resource busy");

		MetadataException e = assertThrows(MetadataException.class,
				() -> handler.create(vmdk("vol1"), "vol1", null));
		assertTrue(e.getMessage().startsWith("Failed to create meta-data store"), e.getMessage());
	}

	@Test
	void formatFailureDeletesDisk()
	{
		invoker.fail("mkfs.ext4", null, 1, "mkfs.ext4: Device size reported to be zero.");
		String path = vmdk("vol1");

		ToolException e = assertThrows(ToolException.class, () -> handler.create(path, "vol1", null));

		assertTrue(e.getMessage().startsWith("Failed to format " + path), e.getMessage());
		assertTrue(e.getMessage().contains("Device size reported to be zero"), e.getMessage());
		assertEquals(1, invoker.count("vmkfstools", "-U"));
		assertTrue(metadata.deleted.contains(path));
		assertNull(metadata.getAll(path));
	}

	@Test
	void formatAndDeleteFailureWarnsAboutOrphan()
	{
		invoker.fail("mkfs.ext4", null, 1, "bad superblock");
		invoker.fail("vmkfstools", "-U", 1, "Device or resource busy");
		String path = vmdk("vol1");

		ToolException e = assertThrows(ToolException.class, () -> handler.create(path, "vol1", null));
		assertTrue(e.getMessage().contains("Please delete it manually"), e.getMessage());
	}

	@Test
	void vsanObjectIsOpenedAndFormatted() throws Exception
	{
		String objectId = "4c8c4659-2c5a-37e1-86b5-020012345678";
		invoker.when("vmkfstools", "-d", cmd -> {
			String descriptor = DESCRIPTOR + "# Extent description\nRW 204800 VMFS \"vsan://" + objectId + "\"\n";
			Files.write(Paths.get(cmd.get(cmd.size() - 1)), descriptor.getBytes(StandardCharsets.UTF_8));
			return new ExecResult(0, "");
		});
		invoker.when("objtool", "open", cmd -> {
			Files.createFile(vsanDir.resolve(objectId));
			return new ExecResult(0, "");
		});

		handler.create(vmdk("vsanvol"), "vsanvol", null);

		assertEquals(Arrays.asList("objtool", "open", "-u", objectId), invoker.last("objtool", "open"));
		assertEquals(vsanDir.resolve(objectId).toString(), invoker.last("mkfs.ext4", null).get(4));
	}

	@Test
	void missingBackingCountsAsFormatFailure()
	{
		invoker.when("vmkfstools", "-d", cmd -> {
			Files.write(Paths.get(cmd.get(cmd.size() - 1)), DESCRIPTOR.getBytes(StandardCharsets.UTF_8));
			return new ExecResult(0, "");
		});

		StateException e = assertThrows(StateException.class, () -> handler.create(vmdk("vol1"), "vol1", null));
		assertTrue(e.getMessage().startsWith("Failed to format"), e.getMessage());
		assertEquals(0, invoker.count("mkfs.ext4", null));
		assertEquals(1, invoker.count("vmkfstools", "-U"));
	}

	@Test
	void removeDeletesDiskAndMetadata() throws Exception
	{
		String path = vmdk("vol1");
		handler.create(path, "vol1", null);
		assertNotNull(metadata.getAll(path));

		handler.remove(path);

		assertEquals(Arrays.asList("vmkfstools", "-U", path), invoker.last("vmkfstools", "-U"));
		assertNull(metadata.getAll(path));
	}

	@Test
	void removeFailureCarriesOutput()
	{
		invoker.fail("vmkfstools", "-U", 255, "Failed to delete virtual disk: The system cannot find the file.");

		ToolException e = assertThrows(ToolException.class, () -> handler.remove(vmdk("nope")));
		assertTrue(e.getMessage().contains("cannot find the file"), e.getMessage());
		assertTrue(metadata.deleted.isEmpty());
	}

	@Test
	void listReturnsOnlyDescriptors() throws IOException
	{
		Files.write(volDir.resolve("vol1.vmdk"), DESCRIPTOR.getBytes(StandardCharsets.UTF_8));
		Files.write(volDir.resolve("vol1-flat.vmdk"), new byte[20000]);
		Files.write(volDir.resolve("vol1-meta.json"), "{}".getBytes(StandardCharsets.UTF_8));
		Files.write(volDir.resolve("notes.txt"), DESCRIPTOR.getBytes(StandardCharsets.UTF_8));
		Files.write(volDir.resolve("fake.vmdk"), "not a descriptor\n".getBytes(StandardCharsets.UTF_8));
		Files.write(volDir.resolve("abc.vmdk"), "# Disk DescriptorFile".getBytes(StandardCharsets.UTF_8));
		Files.createDirectories(volDir.resolve("sub.vmdk"));

		List<VolumeInfo> vols = handler.list(volDir.toString());

		assertEquals(new HashSet<>(Arrays.asList("abc", "vol1")), vols.stream().map(v -> v.name).collect(Collectors.toSet()));
		assertEquals(2, vols.size());
		assertTrue(vols.stream().allMatch(v -> v.attributes.isEmpty()));
	}

	@Test
	void listOfEmptyDirectory()
	{
		assertTrue(handler.list(volDir.toString()).isEmpty());
	}
}
