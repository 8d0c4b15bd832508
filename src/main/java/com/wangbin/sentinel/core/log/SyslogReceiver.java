package com.wangbin.sentinel.core.log;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * UDP syslog 接收，解析后写入 {@link LogBuffer}。
 */
@Slf4j
public class SyslogReceiver {

    private static final int MAX_DATAGRAM = 8192;

    private final int port;
    private final LogBuffer buffer;
    private final SyslogMessageParser parser;
    private final Clock clock;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                    .setNameFormat("syslog-receiver-%d")
                    .setDaemon(true)
                    .build());

    private volatile DatagramSocket socket;

    public SyslogReceiver(int port, LogBuffer buffer, SyslogMessageParser parser, Clock clock) {
        this.port = port;
        this.buffer = buffer;
        this.parser = parser;
        this.clock = clock;
    }

    public synchronized void start() throws SocketException {
        if (socket != null) {
            return;
        }
        socket = new DatagramSocket(port);
        executor.submit(this::receiveLoop);
        log.info("Syslog 接收已启动, UDP 端口 {}", getLocalPort());
    }

    public synchronized void stop() {
        if (socket != null && !socket.isClosed()) {
            socket.close();
        }
        executor.shutdownNow();
        log.info("Syslog 接收已停止");
    }

    /**
     * 实际监听端口，配置为 0 时由系统分配
     */
    public int getLocalPort() {
        DatagramSocket current = socket;
        return current != null ? current.getLocalPort() : port;
    }

    private void receiveLoop() {
        byte[] buf = new byte[MAX_DATAGRAM];
        DatagramSocket current = socket;
        while (!Thread.currentThread().isInterrupted()) {
            try {
                DatagramPacket packet = new DatagramPacket(buf, buf.length);
                current.receive(packet);
                String body = new String(packet.getData(), 0, packet.getLength(), StandardCharsets.UTF_8);
                buffer.add(parser.parse(body, packet.getAddress().getHostAddress(), clock.instant()));
            } catch (IOException e) {
                if (!current.isClosed()) {
                    log.error("Syslog 接收异常，接收线程退出", e);
                }
                break;
            } catch (RuntimeException e) {
                log.warn("Syslog 报文处理失败: {}", e.getMessage());
            }
        }
    }
}
