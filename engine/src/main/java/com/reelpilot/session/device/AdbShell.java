package com.reelpilot.session.device;

import com.reelpilot.session.util.ErrorKind;
import com.reelpilot.session.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code adb shell} commands against one device.
 */
public class AdbShell {
    private static final Logger log = LoggerFactory.getLogger(AdbShell.class);

    private final String adbPath;
    private final String serial;
    private final Duration timeout;

    public AdbShell(String adbPath, String serial, Duration timeout) {
        this.adbPath = adbPath == null || adbPath.isBlank() ? "adb" : adbPath;
        this.serial = serial;
        this.timeout = timeout;
    }

    public Result<String> shell(String... args) {
        return run(command(args));
    }

    /**
     * Output goes to a temporary file so a chatty command never blocks on a full pipe.
     */
    Result<String> run(List<String> command) {
        Path output;
        try {
            output = Files.createTempFile("adb-", ".out");
        } catch (IOException e) {
            return Result.err(ErrorKind.FATAL, "no room for adb output: " + e.getMessage());
        }
        try {
            Process process;
            try {
                process = new ProcessBuilder(command).redirectErrorStream(true).redirectOutput(output.toFile()).start();
            } catch (IOException e) {
                log.warn("Unable to start {}", command, e);
                return Result.err(ErrorKind.FATAL, "adb unavailable: " + e.getMessage());
            }
            return await(process, output, command);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.debug("Unable to delete {}", output, e);
            }
        }
    }

    private Result<String> await(Process process, Path output, List<String> command) {
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return Result.transientFailure("adb timed out: " + String.join(" ", command));
            }
            String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                return Result.transientFailure("adb exited with " + process.exitValue() + ": " + text.trim());
            }
            return Result.ok(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return Result.transientFailure("adb interrupted");
        } catch (IOException e) {
            return Result.transientFailure("adb output unreadable: " + e.getMessage());
        }
    }

    List<String> command(String... args) {
        List<String> command = new ArrayList<>();
        command.add(adbPath);
        if (serial != null && !serial.isBlank()) {
            command.add("-s");
            command.add(serial);
        }
        command.add("shell");
        command.addAll(List.of(args));
        return command;
    }

    /**
     * {@code input text} treats spaces as argument separators; {@code %s} is its escape for a space.
     */
    static String escapeInputText(String text) {
        StringBuilder escaped = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == ' ') {
                escaped.append("%s");
            } else if ("\\\"'`$&|;<>()*?#~".indexOf(c) >= 0) {
                escaped.append('\\').append(c);
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
