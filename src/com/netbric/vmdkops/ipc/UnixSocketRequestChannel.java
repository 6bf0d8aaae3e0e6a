package com.netbric.vmdkops.ipc;

import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.netbric.vmdkops.service.exception.TransientChannelException;
import com.netbric.vmdkops.service.rpc.ErrorReply;

/**
 * Request channel over a Unix domain stream socket. One connection carries one
 * request:
 *
 * <pre>
 * request:  int32 cartelId | int32 length | length bytes of UTF-8 JSON
 * reply:    int32 length | length bytes of UTF-8 JSON
 * </pre>
 *
 * Integers are big endian. The listening socket is reopened after a failed
 * accept. A frame longer than {@link #MAX_JSON_SIZE} gets an error reply.
 */
public class UnixSocketRequestChannel implements RequestChannel
{
	static final Logger logger = LoggerFactory.getLogger(UnixSocketRequestChannel.class);
	public static final int MAX_JSON_SIZE = 4096;

	private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

	private final Path socketPath;
	private ServerSocketChannel server;
	private volatile boolean closed = false;

	public UnixSocketRequestChannel(Path socketPath)
	{
		this.socketPath = socketPath;
	}

	public synchronized void open() throws IOException
	{
		Files.deleteIfExists(socketPath);
		if (socketPath.getParent() != null)
			Files.createDirectories(socketPath.getParent());
		ServerSocketChannel s = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
		try
		{
			s.bind(UnixDomainSocketAddress.of(socketPath));
		}
		catch (IOException e)
		{
			s.close();
			throw e;
		}
		server = s;
		logger.info("Listening on {}", socketPath);
	}

	/**
	 * Only accept failures are reported as {@link TransientChannelException}. A
	 * malformed frame is answered with an error reply where possible, its
	 * connection dropped, and the next connection accepted.
	 */
	@Override
	public ChannelRequest nextRequest() throws TransientChannelException
	{
		while (true)
		{
			SocketChannel conn;
			try
			{
				conn = accept();
			}
			catch (IOException e)
			{
				if (closed)
					throw new TransientChannelException("Channel closed", e);
				reopen();
				throw new TransientChannelException("Failed to accept on " + socketPath + ": " + e.getMessage(), e);
			}

			ChannelRequest req = readRequest(conn);
			if (req != null)
				return req;
		}
	}

	private ChannelRequest readRequest(SocketChannel conn)
	{
		try
		{
			DataInputStream in = new DataInputStream(Channels.newInputStream(conn));
			int cartelId = in.readInt();
			int len = in.readInt();
			if (len < 0 || len > MAX_JSON_SIZE)
			{
				String msg = "Invalid request length " + len + ", max is " + MAX_JSON_SIZE;
				logger.warn("Dropped request from cartel {}: {}", cartelId, msg);
				replyError(conn, msg);
				return null;
			}
			byte[] payload = new byte[len];
			in.readFully(payload);
			return new SocketRequest(cartelId, payload, conn);
		}
		catch (IOException e)
		{
			logger.warn("Dropped malformed request: {}", e.toString());
			closeQuietly(conn);
			return null;
		}
	}

	private void replyError(SocketChannel conn, String msg)
	{
		try
		{
			write(conn, gson.toJson(new ErrorReply(msg)));
		}
		catch (IOException e)
		{
			logger.debug("Failed to send error reply: {}", e.getMessage());
		}
		finally
		{
			closeQuietly(conn);
		}
	}

	@Override
	public void reply(ChannelRequest request, String json) throws IOException
	{
		if (!(request instanceof SocketRequest))
			throw new IllegalArgumentException("Request was not received on this channel");
		SocketChannel conn = ((SocketRequest) request).conn;
		try
		{
			write(conn, json);
		}
		finally
		{
			closeQuietly(conn);
		}
	}

	@Override
	public void close()
	{
		closed = true;
		ServerSocketChannel s;
		synchronized (this)
		{
			s = server;
			server = null;
		}
		if (s != null)
			closeQuietly(s);
		try
		{
			Files.deleteIfExists(socketPath);
		}
		catch (IOException e)
		{
			logger.warn("Failed to remove {}: {}", socketPath, e.getMessage());
		}
	}

	private static void write(SocketChannel conn, String json) throws IOException
	{
		byte[] data = json.getBytes(StandardCharsets.UTF_8);
		DataOutputStream out = new DataOutputStream(Channels.newOutputStream(conn));
		out.writeInt(data.length);
		out.write(data);
		out.flush();
	}

	private SocketChannel accept() throws IOException
	{
		ServerSocketChannel s;
		synchronized (this)
		{
			s = server;
		}
		if (s == null)
			throw new IOException("Channel not open");
		return s.accept();
	}

	private synchronized void reopen()
	{
		if (closed)
			return;
		if (server != null)
			closeQuietly(server);
		server = null;
		try
		{
			open();
		}
		catch (IOException e)
		{
			logger.error("Failed to reopen {}: {}", socketPath, e.getMessage());
		}
	}

	private static void closeQuietly(Closeable c)
	{
		try
		{
			c.close();
		}
		catch (IOException e)
		{
			logger.debug("close failed: {}", e.getMessage());
		}
	}

	static class SocketRequest extends ChannelRequest
	{
		final SocketChannel conn;

		SocketRequest(int cartelId, byte[] payload, SocketChannel conn)
		{
			super(cartelId, payload);
			this.conn = conn;
		}
	}
}
