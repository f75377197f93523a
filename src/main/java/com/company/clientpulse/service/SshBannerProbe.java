package com.company.clientpulse.service;

import com.company.clientpulse.config.ProbeProperties;
import com.company.clientpulse.domain.enums.ProbeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Connects to the SSH port and checks that the server greets with an SSH banner.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SshBannerProbe implements ReachabilityProbe {

    private final ProbeProperties properties;

    @Override
    public ProbeResult probe(String host) {
        try (Socket socket = new Socket()) {
            try {
                socket.connect(new InetSocketAddress(host, properties.getPort()),
                        (int) properties.getConnectTimeout().toMillis());
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Could not connect to {}: {}", host, e.getMessage());
                return ProbeResult.UNREACHABLE;
            }

            try {
                String banner = readBanner(socket);
                if (banner.startsWith(properties.getBannerPrefix())) {
                    return ProbeResult.REACHABLE;
                }
                log.debug("Unexpected banner from {}: {}", host, banner);
                return ProbeResult.WRONG_BANNER;
            } catch (SocketTimeoutException e) {
                log.debug("No banner from {} within {}", host, properties.getReadTimeout());
                return ProbeResult.READ_TIMEOUT;
            }
        } catch (IOException e) {
            log.debug("Probe of {} failed: {}", host, e.getMessage());
            return ProbeResult.UNREACHABLE;
        }
    }

    /**
     * Reads until the banner prefix is in, the buffer is full or the stream ends. The read timeout
     * bounds the whole banner, so each read only gets the time left before the deadline.
     */
    private String readBanner(Socket socket) throws IOException {
        InputStream in = socket.getInputStream();
        long deadline = System.nanoTime() + properties.getReadTimeout().toNanos();
        byte[] buffer = new byte[properties.getBannerLength()];
        int read = 0;
        while (read < buffer.length) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                throw new SocketTimeoutException("Banner not complete within " + properties.getReadTimeout());
            }
            socket.setSoTimeout((int) Math.min(remainingMillis, Integer.MAX_VALUE));

            int n = in.read(buffer, read, buffer.length - read);
            if (n < 0) {
                break;
            }
            read += n;
            if (read >= properties.getBannerPrefix().length()) {
                break;
            }
        }
        return new String(buffer, 0, read, StandardCharsets.US_ASCII);
    }
}
