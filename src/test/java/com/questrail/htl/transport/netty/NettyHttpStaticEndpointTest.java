package com.questrail.htl.transport.netty;

import com.questrail.htl.transport.StaticResponse;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyHttpStaticEndpointTest
 * -----------------------------------------------------------------------------
 * Lifecycle of {@link NettyHttpStaticEndpoint} against real sockets.
 */
final class NettyHttpStaticEndpointTest
{
    @Test
    void failedBindReleasesEventLoops() throws IOException
    {
        InetAddress loopback = InetAddress.getLoopbackAddress();
        try (ServerSocket occupied = new ServerSocket(0, 50, loopback)) {
            NettyHttpStaticEndpoint endpoint =
                    new NettyHttpStaticEndpoint(new InetSocketAddress(loopback, occupied.getLocalPort()));
            endpoint.setListener((method, path) -> StaticResponse.empty(404));

            assertThrows(IllegalStateException.class, endpoint::start);
            assertTrue(endpoint.isShuttingDown());
        }
    }

    @Test
    void stopReleasesEventLoops()
    {
        NettyHttpStaticEndpoint endpoint =
                new NettyHttpStaticEndpoint(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        endpoint.setListener((method, path) -> StaticResponse.empty(404));

        endpoint.start();
        assertTrue(endpoint.localAddress().getPort() > 0);
        assertFalse(endpoint.isShuttingDown());

        endpoint.stop();
        assertTrue(endpoint.isShuttingDown());
    }
}
