package com.netbric.vmdkops.ipc;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Client side of {@link UnixSocketRequestChannel}: sends one framed request
 * and waits for the reply.
 */
public class UnixSocketClient
{
	public static String call(Path socketPath, int cartelId, String json) throws IOException
	{
		byte[] data = json.getBytes(StandardCharsets.UTF_8);
		try (SocketChannel ch = SocketChannel.open(StandardProtocolFamily.UNIX))
		{
			ch.connect(UnixDomainSocketAddress.of(socketPath));
			DataOutputStream out = new DataOutputStream(Channels.newOutputStream(ch));
			out.writeInt(cartelId);
			out.writeInt(data.length);
			out.write(data);
			out.flush();

			DataInputStream in = new DataInputStream(Channels.newInputStream(ch));
			int len = in.readInt();
			if (len < 0)
				throw new IOException("Invalid reply length " + len);
			byte[] reply = new byte[len];
			in.readFully(reply);
			return new String(reply, StandardCharsets.UTF_8);
		}
	}
}
