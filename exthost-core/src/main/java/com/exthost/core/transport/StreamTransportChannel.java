package com.exthost.core.transport;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 基于字节流的通道：一行 UTF-8 文本即一帧
 * <p>
 * 线程模型：
 * - 读线程 (单个守护线程) 按顺序派发入站帧，相当于宿主的事件循环
 * - 写线程 (单线程执行器) 负责出站，send 只入队
 * - close 时已入队的帧先写完 (有超时)，之后的 send 静默丢弃
 */
@Slf4j
public class StreamTransportChannel implements TransportChannel {

    private static final long DRAIN_TIMEOUT_MILLIS = 2000;

    private final String name;
    private final InputStream input;
    private final BufferedWriter writer;

    private final List<Consumer<String>> frameListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    // 对端已断开，不再尝试写出
    private volatile boolean writeFailed;

    private final ExecutorService writeExecutor;
    private Thread readerThread;
    private volatile Thread writerThread;

    public StreamTransportChannel(String name, InputStream input, OutputStream output) {
        this.name = name;
        this.input = input;
        this.writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        this.writeExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-writer");
            t.setDaemon(true);
            writerThread = t;
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("[{}] Writer thread {} failed: {}", name, thread.getName(), e.getMessage(), e));
            return t;
        });
    }

    /**
     * 启动读线程；在注册完回调之后调用
     */
    public StreamTransportChannel start() {
        if (!started.compareAndSet(false, true)) {
            return this;
        }
        readerThread = new Thread(this::readLoop, name + "-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        log.debug("[{}] Channel started", name);
        return this;
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (!closed.get() && (line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                dispatch(line);
            }
            log.info("[{}] Peer closed the channel", name);
        } catch (IOException e) {
            if (!closed.get()) {
                log.warn("[{}] Channel read failed: {}", name, e.getMessage());
            }
        } finally {
            close();
        }
    }

    private void dispatch(String frame) {
        for (Consumer<String> listener : frameListeners) {
            try {
                listener.accept(frame);
            } catch (Exception e) {
                // 单帧处理失败不能终止读循环
                log.error("[{}] Frame listener failed: {}", name, e.getMessage(), e);
            }
        }
    }

    @Override
    public void send(String frame) {
        if (closed.get()) {
            log.debug("[{}] Channel closed, dropping outbound frame", name);
            return;
        }
        try {
            writeExecutor.execute(() -> write(frame));
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Channel closed, dropping outbound frame", name);
        }
    }

    private void write(String frame) {
        if (writeFailed) {
            return;
        }
        try {
            writer.write(frame);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            writeFailed = true;
            log.warn("[{}] Peer is gone, write failed: {}", name, e.getMessage());
            close();
        }
    }

    @Override
    public void onFrame(Consumer<String> listener) {
        frameListeners.add(listener);
    }

    @Override
    public void onClose(Runnable listener) {
        closeListeners.add(listener);
        if (closed.get() && closeListeners.remove(listener)) {
            runCloseListener(listener);
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.debug("[{}] Closing channel", name);
        writeExecutor.shutdown();
        if (Thread.currentThread() != writerThread) {
            drainWrites();
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("[{}] Error closing writer: {}", name, e.getMessage());
        }
        if (readerThread != null && readerThread != Thread.currentThread()) {
            try {
                input.close();
            } catch (IOException e) {
                log.debug("[{}] Error closing reader: {}", name, e.getMessage());
            }
        }
        for (Runnable listener : closeListeners) {
            if (closeListeners.remove(listener)) {
                runCloseListener(listener);
            }
        }
    }

    private void drainWrites() {
        try {
            if (!writeExecutor.awaitTermination(DRAIN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = writeExecutor.shutdownNow();
                log.warn("[{}] Outbound queue not drained in {} ms, dropped {} frame(s)",
                        name, DRAIN_TIMEOUT_MILLIS, dropped.size());
            }
        } catch (InterruptedException e) {
            writeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runCloseListener(Runnable listener) {
        try {
            listener.run();
        } catch (Exception e) {
            log.error("[{}] Close listener failed: {}", name, e.getMessage(), e);
        }
    }
}
