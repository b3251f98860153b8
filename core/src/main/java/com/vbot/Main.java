package com.vbot;

import com.vbot.core.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CountDownLatch;

/**
 * Starts the bot.
 * <p>
 * Usage: {@code java -jar vbot-core.jar [toolsDir]}. The tools folder holds {@code config.json}
 * and the command log database and defaults to {@code tools}. Console output is mirrored to
 * {@code logs/latest.log} and a per-session file; {@code -Dvbot.logDir} moves that folder.
 */
public class Main {
    private static final DateTimeFormatter SESSION_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    public static void main(String[] args) {
        Path logDir = Paths.get(System.getProperty("vbot.logDir", "logs"));
        Path sessionLog = mirrorConsole(logDir);

        // First logger only after System.err points at the log files
        Logger logger = LoggerFactory.getLogger(Main.class);
        logger.info("🚀 Starting VBot...");
        if (sessionLog != null)
            logger.info("📄 Session log: {}", sessionLog.toAbsolutePath());

        Kernel kernel = new Kernel(resolveToolsDir(args));
        logger.info("🗂️ Tools folder: {}", kernel.getToolsDir().getAbsolutePath());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            kernel.shutdown();
            stopped.countDown();
        }, "shutdown"));

        try {
            kernel.start();
            logger.info("✅ VBot is running. Stop with Ctrl+C.");
            stopped.await();
        } catch (InterruptedException e) {
            logger.warn("Main thread interrupted. Exiting...");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("CRITICAL FAILURE during startup", e);
            System.exit(1);
        }
    }

    static File resolveToolsDir(String[] args) {
        if (args.length > 0 && !args[0].isBlank())
            return new File(args[0]);
        return new File("tools");
    }

    /**
     * Tees System.out and System.err into {@code latest.log} and a timestamped session file.
     * slf4j-simple writes to System.err, so every log line lands there too.
     *
     * @return the session file, or null if the folder could not be prepared
     */
    static Path mirrorConsole(Path logDir) {
        try {
            Files.createDirectories(logDir);
            Path session = logDir.resolve("session-" + LocalDateTime.now().format(SESSION_STAMP) + ".log");
            OutputStream sessionStream = Files.newOutputStream(session);
            OutputStream latestStream = Files.newOutputStream(logDir.resolve("latest.log"));

            System.setOut(new PrintStream(new TeeOutputStream(System.out, sessionStream, latestStream), true,
                    StandardCharsets.UTF_8));
            System.setErr(new PrintStream(new TeeOutputStream(System.err, sessionStream, latestStream), true,
                    StandardCharsets.UTF_8));
            return session;
        } catch (IOException e) {
            System.err.println("Could not set up log files in " + logDir + ": " + e.getMessage());
            return null;
        }
    }

    static class TeeOutputStream extends OutputStream {
        private final OutputStream[] targets;

        TeeOutputStream(OutputStream... targets) {
            this.targets = targets;
        }

        @Override
        public synchronized void write(int b) throws IOException {
            for (OutputStream target : targets)
                target.write(b);
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) throws IOException {
            for (OutputStream target : targets)
                target.write(b, off, len);
        }

        @Override
        public synchronized void flush() throws IOException {
            for (OutputStream target : targets)
                target.flush();
        }

        @Override
        public void close() throws IOException {
            for (OutputStream target : targets)
                target.close();
        }
    }
}
