package com.autopar.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The outside world of one interpreted run: a console buffer, an in-memory file system
 * and queued console input. Safe to use from several work units at once.
 */
public final class ExecutionContext {

    private final StringBuilder console = new StringBuilder();
    private final ConcurrentHashMap<String, String> files = new ConcurrentHashMap<>();
    private final Deque<String> input = new ArrayDeque<>();

    public ExecutionContext() {}

    public ExecutionContext(List<String> inputLines) {
        input.addAll(inputLines);
    }

    public synchronized void write(String text) {
        console.append(text);
    }

    public synchronized String console() {
        return console.toString();
    }

    public synchronized Optional<String> readLine() {
        return Optional.ofNullable(input.poll());
    }

    public void writeFile(String path, String content) {
        files.put(path, content);
    }

    public void appendFile(String path, String content) {
        files.merge(path, content, String::concat);
    }

    public Optional<String> readFile(String path) {
        return Optional.ofNullable(files.get(path));
    }

    /** Files written so far, sorted by path. */
    public Map<String, String> files() {
        return new TreeMap<>(files);
    }
}
