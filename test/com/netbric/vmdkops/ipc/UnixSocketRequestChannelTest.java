package com.netbric.vmdkops.ipc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.netbric.vmdkops.service.exception.TransientChannelException;

public class UnixSocketRequestChannelTest
{
	@TempDir
	Path tmp;

	private Path sock;
	private UnixSocketRequestChannel channel;
	private final ExecutorService clients = Executors.newSingleThreadExecutor();

	@BeforeEach
	void setUp() throws Exception
	{
		sock = tmp.resolve("run/vmdkops.sock");
		channel = new UnixSocketRequestChannel(sock);
		channel.open();
	}

	@AfterEach
	void tearDown()
	{
		channel.close();
		clients.shutdownNow();
	}

	@Test
	void requestAndReplyRoundTrip() throws Exception
	{
		String json = "{\"cmd\": \"list\", \"details\": {\"Name\": \"\"}}";
		Future<String> reply = clients.submit(() -> UnixSocketClient.call(sock, 68525, json));

		ChannelRequest req = channel.nextRequest();
		assertEquals(68525, req.cartelId);
		assertEquals(json, new String(req.payload, StandardCharsets.UTF_8));
		channel.reply(req, "[]");

		assertEquals("[]", reply.get(10, TimeUnit.SECONDS));
	}

	/**
	 * Sends a frame header announcing {@code len} bytes and returns the reply,
	 * or null if the service closed the connection without one.
	 */
	static String sendHeaderOnly(Path sock, int cartelId, int len) throws IOException
	{
		try (SocketChannel ch = SocketChannel.open(StandardProtocolFamily.UNIX))
		{
			ch.connect(UnixDomainSocketAddress.of(sock));
			DataOutputStream out = new DataOutputStream(Channels.newOutputStream(ch));
			out.writeInt(cartelId);
			out.writeInt(len);
			out.flush();
			DataInputStream in = new DataInputStream(Channels.newInputStream(ch));
			byte[] reply = new byte[in.readInt()];
			in.readFully(reply);
			return new String(reply, StandardCharsets.UTF_8);
		}
		catch (EOFException e)
		{
			return null;
		}
	}

	@Test
	void oversizedRequestGetsErrorReplyAndIsSkipped() throws Exception
	{
		Future<String> rejected = clients.submit(
				() -> sendHeaderOnly(sock, 1, UnixSocketRequestChannel.MAX_JSON_SIZE + 1));
		Future<String> reply = clients.submit(() -> UnixSocketClient.call(sock, 2, "{}"));

		ChannelRequest req = channel.nextRequest();
		assertEquals(2, req.cartelId);
		channel.reply(req, "null");

		assertEquals("{\"Error\":\"Invalid request length 4097, max is 4096\"}",
				rejected.get(10, TimeUnit.SECONDS));
		assertEquals("null", reply.get(10, TimeUnit.SECONDS));
	}

	@Test
	void truncatedRequestIsDroppedAndChannelStaysUsable() throws Exception
	{
		Future<?> broken = clients.submit(() -> {
			try (SocketChannel ch = SocketChannel.open(StandardProtocolFamily.UNIX))
			{
				ch.connect(UnixDomainSocketAddress.of(sock));
				DataOutputStream out = new DataOutputStream(Channels.newOutputStream(ch));
				out.writeInt(1);
				out.writeInt(100);
				out.write("{\"cmd\"".getBytes(StandardCharsets.UTF_8));
				out.flush();
			}
			return null;
		});
		Future<String> reply = clients.submit(() -> UnixSocketClient.call(sock, 2, "{}"));

		ChannelRequest req = channel.nextRequest();
		assertEquals(2, req.cartelId);
		assertEquals("{}", new String(req.payload, StandardCharsets.UTF_8));
		channel.reply(req, "null");

		broken.get(10, TimeUnit.SECONDS);
		assertEquals("null", reply.get(10, TimeUnit.SECONDS));
	}

	@Test
	void closeUnblocksPendingReceive() throws Exception
	{
		ExecutorService receiver = Executors.newSingleThreadExecutor();
		try
		{
			Future<ChannelRequest> pending = receiver.submit(() -> channel.nextRequest());
			Thread.sleep(200);
			channel.close();

			ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(10, TimeUnit.SECONDS));
			assertTrue(e.getCause() instanceof TransientChannelException);
		}
		finally
		{
			receiver.shutdownNow();
		}
	}

	@Test
	void closeRemovesSocketFile()
	{
		channel.close();
		assertFalse(Files.exists(sock));
	}

	@Test
	void reopenReplacesStaleSocket() throws Exception
	{
		channel.close();
		Files.createFile(sock);

		channel = new UnixSocketRequestChannel(sock);
		channel.open();

		Future<String> reply = clients.submit(() -> UnixSocketClient.call(sock, 3, "{}"));
		channel.reply(channel.nextRequest(), "{}");
		assertEquals("{}", reply.get(10, TimeUnit.SECONDS));
	}
}
