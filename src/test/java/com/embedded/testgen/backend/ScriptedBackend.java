package com.embedded.testgen.backend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Backend that replays queued answers and failures in order and records every prompt it receives.
 * Once the queue is empty the last queued answer is repeated.
 */
public class ScriptedBackend implements GenerationBackend {

    private final String name;
    private final Deque<Object> script = new ArrayDeque<>();
    private final List<String> prompts = new ArrayList<>();
    private Object last;

    public ScriptedBackend(String name) {
        this.name = name;
    }

    public ScriptedBackend answer(String text) {
        script.add(text);
        return this;
    }

    public ScriptedBackend fail(BackendCallException failure) {
        script.add(failure);
        return this;
    }

    public ScriptedBackend throttle() {
        return fail(new BackendCallException(name + " returned HTTP 429: RESOURCE_EXHAUSTED", 429, null));
    }

    public List<String> getPrompts() {
        return prompts;
    }

    public int getCalls() {
        return prompts.size();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String generate(String prompt) throws BackendCallException {
        prompts.add(prompt);
        Object next = script.isEmpty() ? last : script.poll();
        if (next == null) {
            throw new BackendCallException(name + " has nothing scripted");
        }
        last = next;
        if (next instanceof BackendCallException failure) {
            throw failure;
        }
        return (String) next;
    }
}
