package dev.everydaythings.fontcat.freetype;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Watches font directories and reports changes after they settle.
 *
 * <p>Installing a font package touches many files; events are collected until
 * no new one arrives for the quiet period, then {@code onChange} runs once on
 * the watcher thread. New subdirectories are watched as they appear.
 */
public final class FontDirectoryWatcher implements AutoCloseable {

    private static final Logger log = Logger.getLogger(FontDirectoryWatcher.class.getName());

    static final long DEFAULT_QUIET_MILLIS = 500;

    private final WatchService watchService;
    private final Runnable onChange;
    private final long quietMillis;
    private final Thread thread;
    private volatile boolean running = true;

    public FontDirectoryWatcher(List<Path> directories, Runnable onChange) throws IOException {
        this(directories, onChange, DEFAULT_QUIET_MILLIS);
    }

    FontDirectoryWatcher(List<Path> directories, Runnable onChange, long quietMillis) throws IOException {
        this.watchService = FileSystems.getDefault().newWatchService();
        this.onChange = onChange;
        this.quietMillis = quietMillis;
        for (Path dir : directories) {
            registerTree(dir);
        }
        this.thread = new Thread(this::run, "fontcat-font-watcher");
        this.thread.setDaemon(true);
        this.thread.start();
        log.fine(() -> "Watching " + directories.size() + " font directories");
    }

    private void registerTree(Path root) {
        if (!Files.isDirectory(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root, FontDirectoryScanner.MAX_DEPTH)) {
            stream.filter(Files::isDirectory).forEach(this::register);
        } catch (IOException e) {
            log.log(Level.WARNING, "Cannot watch font directory " + root, e);
        }
    }

    private void register(Path dir) {
        try {
            dir.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_DELETE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            log.log(Level.FINE, "Cannot watch " + dir, e);
        }
    }

    private void run() {
        try {
            while (running) {
                WatchKey key = watchService.take();
                boolean relevant = drain(key);
                // Keep collecting until the directories go quiet.
                WatchKey next;
                while ((next = watchService.poll(quietMillis, TimeUnit.MILLISECONDS)) != null) {
                    relevant |= drain(next);
                }
                if (relevant && running) {
                    log.info("Font directories changed");
                    try {
                        onChange.run();
                    } catch (RuntimeException e) {
                        log.log(Level.WARNING, "Font change handler failed", e);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.finer("Font watcher closed");
        }
    }

    /** Handle the events of one key; returns whether any concerns a font file or directory. */
    private boolean drain(WatchKey key) {
        boolean relevant = false;
        Path dir = (Path) key.watchable();
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                relevant = true;
                continue;
            }
            Path child = dir.resolve((Path) event.context());
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
                registerTree(child);
                relevant = true;
            } else if (FontDirectoryScanner.isFontFile(child) || Files.isDirectory(child)) {
                relevant = true;
            }
        }
        key.reset();
        return relevant;
    }

    public boolean isRunning() {
        return running && thread.isAlive();
    }

    @Override
    public void close() {
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.log(Level.FINE, "Error closing font watcher", e);
        }
        thread.interrupt();
    }
}
