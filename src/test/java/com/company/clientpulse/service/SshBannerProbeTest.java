package com.company.clientpulse.service;

import com.company.clientpulse.config.ProbeProperties;
import com.company.clientpulse.domain.enums.ProbeResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SshBannerProbeTest {

    private ServerSocket server;
    private ExecutorService acceptor;
    private final CountDownLatch done = new CountDownLatch(1);
    private ProbeProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        server = new ServerSocket(0, 10, InetAddress.getLoopbackAddress());
        acceptor = Executors.newSingleThreadExecutor();

        properties = new ProbeProperties();
        properties.setPort(server.getLocalPort());
        properties.setConnectTimeout(Duration.ofSeconds(1));
        properties.setReadTimeout(Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() throws IOException {
        done.countDown();
        acceptor.shutdownNow();
        server.close();
    }

    /**
     * Accepts one connection, writes the greeting and keeps the connection open until the test ends.
     */
    private void greetWith(String greeting) {
        acceptor.submit(() -> {
            try (Socket socket = server.accept()) {
                if (greeting != null) {
                    OutputStream out = socket.getOutputStream();
                    out.write(greeting.getBytes(StandardCharsets.US_ASCII));
                    out.flush();
                }
                done.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                // server closed by the test
            }
        });
    }

    /**
     * Accepts one connection and sends the greeting one byte at a time.
     */
    private void dribble(String greeting, long pauseMillis) {
        acceptor.submit(() -> {
            try (Socket socket = server.accept()) {
                OutputStream out = socket.getOutputStream();
                for (byte b : greeting.getBytes(StandardCharsets.US_ASCII)) {
                    Thread.sleep(pauseMillis);
                    out.write(b);
                    out.flush();
                }
                done.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                // probe gave up and closed the connection
            }
        });
    }

    private ProbeResult probe() {
        return new SshBannerProbe(properties).probe("127.0.0.1");
    }

    @Test
    @DisplayName("Should report reachable for an SSH greeting")
    void shouldAcceptSshBanner() {
        greetWith("SSH-2.0-OpenSSH_9.6\r\n");

        assertThat(probe()).isEqualTo(ProbeResult.REACHABLE);
    }

    @Test
    @DisplayName("Should report a wrong banner for other services")
    void shouldRejectOtherBanner() {
        greetWith("HTTP/1.1 400 Bad Request\r\n");

        assertThat(probe()).isEqualTo(ProbeResult.WRONG_BANNER);
    }

    @Test
    @DisplayName("Should time out when the server never greets")
    void shouldTimeOutWithoutBanner() {
        greetWith(null);

        assertThat(probe()).isEqualTo(ProbeResult.READ_TIMEOUT);
    }

    @Test
    @DisplayName("Should report unreachable when nothing listens")
    void shouldReportUnreachable() throws IOException {
        server.close();

        assertThat(probe()).isEqualTo(ProbeResult.UNREACHABLE);
    }

    @Test
    @DisplayName("Should bound the whole banner read by the read timeout")
    void shouldTimeOutOnSlowBanner() {
        // Given
        dribble("SSH-2.0", 200);

        // When
        long started = System.nanoTime();
        ProbeResult result = probe();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // Then
        assertThat(result).isEqualTo(ProbeResult.READ_TIMEOUT);
        assertThat(elapsedMillis).isLessThan(700);
    }
}
