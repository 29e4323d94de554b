package io.netnotes.canvas.utils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

public class LoggingHelpers {
    public enum LogLevel{
        NONE(0),
        GENERAL(1),
        HIGH_PRIORITY(2),
        ERROR(3),
        ALL(4);

        private final int value;

        private LogLevel(int value) {
            this.value = value;
        }

        public int getValue() {
            return this.value;
        }

        public static LogLevel fromName(String name, LogLevel defaultLevel){
            if(name == null){
                return defaultLevel;
            }
            for(LogLevel level : values()){
                if(level.name().equalsIgnoreCase(name.trim())){
                    return level;
                }
            }
            return defaultLevel;
        }
    }

    private static final DateTimeFormatter FILE_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    public static class Log {
        public static String logDirName = "logs";
        public static File logDir = new File(logDirName);
        public static String logName = "canvas";
        public static String logExt = ".txt";

        private static volatile File logFile = null;

        // Serialized executor for all log writes
        private static final SerializedExecutor logExecutor = new SerializedExecutor("canvas-log-writer");

        // Timeout for individual log operations
        private static final long LOG_TIMEOUT_MS = 2000;

        private static volatile int logLevel = LogLevel.ALL.getValue();

        private static File createTimedLogFile(){
            String stamp = LocalDateTime.now().format(FILE_DATE_FORMAT);
            try{
                Files.createDirectories(logDir.toPath());
                return new File(logDir.getAbsolutePath(), logName + "-" + stamp + logExt);
            }catch(IOException e){
                return new File(logName + "-" + stamp + logExt);
            }
        }

        public static CompletableFuture<Void> setLogLevel(LogLevel logLevel){
            return setLogLevel(logLevel.getValue());
        }

        public static CompletableFuture<Void> setLogLevel(int level){
            return logExecutor.execute(() -> {
                Log.logLevel = level;
            });
        }

        public static int getLogLevel(){
            return logLevel;
        }

        public static CompletableFuture<Void> setLogDirectory(File dir){
            return logExecutor.execute(() -> {
                Log.logDir = dir;
                Log.logFile = null;
            });
        }

        public static CompletableFuture<Void> log(String scope, String msg, LogLevel level) {
            return enqueue(level.getValue(), () ->
                write(scope + ": " + msg + "\n")
            );
        }

        public static CompletableFuture<Void> logError(String scope, String msg, Throwable error) {
            return enqueue(LogLevel.ERROR.getValue(), () ->
                write(scope + ": '" + msg + "' - " + getThrowableMsg(error) + "\n")
            );
        }

        public static CompletableFuture<Void> logJson(String scope, JsonObject json, LogLevel level) {
            return enqueue(level.getValue(), () ->{
                Gson gson = new GsonBuilder().setPrettyPrinting().create();
                write("**" + scope + "**\n" + gson.toJson(json) + "\n");
            });
        }

        /**
         * Enqueues a log action with priority checking and timeout handling.
         * Returns a CompletableFuture that completes when the log is written,
         * times out, or fails.
         */
        private static CompletableFuture<Void> enqueue(int priority, Runnable action) {
            if (priority > logLevel) {
                return CompletableFuture.completedFuture(null);
            }

            CompletableFuture<Void> future = logExecutor.execute(action);

            return future
                .orTimeout(LOG_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .whenComplete((v, ex) -> {
                    if(ex != null){
                        if (ex instanceof java.util.concurrent.TimeoutException) {
                            System.err.println("[LOG TIMEOUT] Write hung after " + LOG_TIMEOUT_MS + "ms");
                        } else {
                            System.err.println("[LOG ERROR] " + ex.toString());
                        }
                    }
                });
        }

        private static void write(String text) {
            try {
                if(logFile == null){
                    logFile = createTimedLogFile();
                }
                Files.writeString(
                    logFile.toPath(),
                    text,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                );
            } catch (Exception e) {
                System.err.println("[LOG WRITE FAILED] " + e.getMessage());
            }
        }

        /**
         * Waits until every log queued before this call has been written.
         */
        public static boolean drain(long timeout, TimeUnit unit) {
            try {
                logExecutor.execute(() -> { }).get(timeout, unit);
                return true;
            } catch (Exception e) {
                return false;
            }
        }
    }

    public static String getThrowableMsg(Throwable throwable){
        if(throwable == null){
            return "null";
        }
        String msg = throwable.getMessage();
        Throwable cause = throwable.getCause();
        return throwable.getClass().getSimpleName()
            + (msg != null ? ": " + msg : "")
            + (cause != null && cause != throwable ? " (cause: " + getThrowableMsg(cause) + ")" : "");
    }
}
