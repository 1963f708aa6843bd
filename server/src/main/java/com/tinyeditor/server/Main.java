package com.tinyeditor.server;

import com.tinyeditor.core.Kernel;
import com.tinyeditor.server.internal.EditorWebService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;

public class Main {
    static final String LOG_FILE = "editor-service.log";

    // Logger is created only after the streams are redirected
    private static Logger logger;

    public static void main(String[] args) {
        setupGlobalLogging();

        logger = LoggerFactory.getLogger(Main.class);
        logger.info("Starting Tiny Editor configuration service...");
        logger.info("Log file: logs/{}", LOG_FILE);

        try {
            File toolsDir = new File(args.length > 0 ? args[0] : "tools");
            Kernel kernel = new Kernel(toolsDir, EditorPlugins.createRegistry());
            kernel.start();

            int port = Integer.parseInt(kernel.getConfigManager().get("core", "webserviceport", "6875"));
            EditorWebService webService = new EditorWebService(kernel, port);
            webService.start();
            Runtime.getRuntime().addShutdownHook(new Thread(webService::stop));

            logger.info("Service running. Joining main thread.");
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.warn("Main thread interrupted. Exiting...");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE during startup", e);
            System.exit(1);
        }
    }

    /**
     * Copies console output into logs/editor-service.log before anything else logs.
     * slf4j-simple writes to System.err, so this covers every log line.
     */
    private static void setupGlobalLogging() {
        try {
            File logDir = new File("logs");
            if (!logDir.exists()) logDir.mkdirs();

            OutputStream logFile = new FileOutputStream(new File(logDir, LOG_FILE), true);
            System.setOut(new PrintStream(new TeeOutputStream(System.out, logFile), true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(new TeeOutputStream(System.err, logFile), true, StandardCharsets.UTF_8));
        } catch (IOException e) {
            System.err.println("Could not open log file, logging to console only: " + e.getMessage());
        }
    }

    static class TeeOutputStream extends OutputStream {
        private final OutputStream console;
        private final OutputStream file;

        TeeOutputStream(OutputStream console, OutputStream file) {
            this.console = console;
            this.file = file;
        }

        @Override
        public void write(int b) throws IOException {
            console.write(b);
            file.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            console.write(b, off, len);
            file.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            console.flush();
            file.flush();
        }
    }
}
