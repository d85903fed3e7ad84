package org.portal.instance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 门户名称的单实例锁：保证同一时刻只有一个进程处理文件选择请求。
 * <p>
 * 工作方式：
 * <ul>
 *   <li>在锁目录下对 {@code <serviceName>.lock} 加排他文件锁；拿不到且不要求替换时直接失败（不排队）。</li>
 *   <li>要求替换时写入 {@code <serviceName>.replace} 标记，然后在超时时间内轮询等待锁释放。</li>
 *   <li>持有者定期检查替换标记；发现后记录 “Lost name” 告警、释放锁并回调 {@code onLost}（通常是退出进程）。</li>
 * </ul>
 * 失去名称时进行中的请求直接被放弃，不做优雅收尾。
 */
public class PortalInstanceLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PortalInstanceLock.class);

    private final String serviceName;
    private final Path lockFile;
    private final Path replaceMarker;
    private final Duration pollInterval;
    private final Duration replaceTimeout;

    private FileChannel channel;
    private FileLock lock;
    private ScheduledExecutorService watcher;

    public PortalInstanceLock(Path directory, String serviceName, Duration pollInterval, Duration replaceTimeout) {
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName 不能为空");
        this.lockFile = directory.resolve(serviceName + ".lock");
        this.replaceMarker = directory.resolve(serviceName + ".replace");
        this.pollInterval = pollInterval;
        this.replaceTimeout = replaceTimeout;
    }

    /**
     * 获取名称。
     *
     * @param replace 名称被占用时是否要求现有持有者让出
     * @param onLost  之后被其它进程替换时的回调（在后台线程执行）
     */
    public synchronized void acquire(boolean replace, Runnable onLost) throws PortalInstanceLockException {
        if (lock != null) {
            throw new IllegalStateException("已经持有名称：" + serviceName);
        }
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            lock = tryLock(channel);
            if (lock == null && replace) {
                lock = awaitReplacement(channel);
            }
            if (lock == null) {
                closeChannel();
                throw new PortalInstanceLockException("名称 " + serviceName + " 已被其它进程占用（可使用 --replace 替换）");
            }
            // 自己刚刚发出的替换请求，或上一次残留的标记
            Files.deleteIfExists(replaceMarker);
            writeOwner(channel);
        } catch (IOException e) {
            releaseQuietly();
            throw new PortalInstanceLockException("无法获取名称 " + serviceName, e);
        }
        startWatching(onLost);
        log.info("已获取名称 {}（{}）", serviceName, lockFile);
    }

    public synchronized boolean isHeld() {
        return lock != null && lock.isValid();
    }

    public synchronized void release() {
        if (watcher != null) {
            watcher.shutdownNow();
            watcher = null;
        }
        releaseQuietly();
    }

    @Override
    public void close() {
        release();
    }

    private FileLock awaitReplacement(FileChannel fileChannel) throws IOException, PortalInstanceLockException {
        log.info("名称 {} 已被占用，请求现有进程让出", serviceName);
        Files.writeString(replaceMarker, String.valueOf(ProcessHandle.current().pid()), StandardCharsets.UTF_8);
        long deadline = System.nanoTime() + replaceTimeout.toNanos();
        while (System.nanoTime() < deadline) {
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                Files.deleteIfExists(replaceMarker);
                throw new PortalInstanceLockException("等待名称 " + serviceName + " 时被中断", e);
            }
            FileLock acquired = tryLock(fileChannel);
            if (acquired != null) {
                return acquired;
            }
        }
        Files.deleteIfExists(replaceMarker);
        return null;
    }

    private void startWatching(Runnable onLost) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "portal-instance-watch");
            thread.setDaemon(true);
            return thread;
        });
        watcher = executor;
        long period = Math.max(1, pollInterval.toMillis());
        executor.scheduleWithFixedDelay(() -> {
            if (Files.exists(replaceMarker)) {
                log.warn("Lost name {}", serviceName);
                release();
                onLost.run();
            }
        }, period, period, TimeUnit.MILLISECONDS);
    }

    private static FileLock tryLock(FileChannel fileChannel) throws IOException {
        try {
            return fileChannel.tryLock();
        } catch (OverlappingFileLockException e) {
            // 同一个 JVM 内已有其它通道持有该锁
            return null;
        }
    }

    private static void writeOwner(FileChannel fileChannel) throws IOException {
        fileChannel.truncate(0);
        fileChannel.write(ByteBuffer.wrap(String.valueOf(ProcessHandle.current().pid()).getBytes(StandardCharsets.UTF_8)), 0);
    }

    private void releaseQuietly() {
        if (lock != null) {
            try {
                lock.release();
            } catch (IOException e) {
                log.warn("释放名称 {} 的文件锁失败", serviceName, e);
            }
            lock = null;
        }
        closeChannel();
    }

    private void closeChannel() {
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("关闭锁文件失败：{}", lockFile, e);
            }
            channel = null;
        }
    }
}
