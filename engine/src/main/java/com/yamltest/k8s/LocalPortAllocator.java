package com.yamltest.k8s;

import com.yamltest.infra.TransportException;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

/**
 * Picks a free loopback port for a port-forward tunnel.
 */
@Singleton
public class LocalPortAllocator {

    public int allocate() {
        try (ServerSocket socket = new ServerSocket(0, 0, InetAddress.getLoopbackAddress())) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new TransportException("Could not allocate a local port: " + e.getMessage(), e);
        }
    }
}
