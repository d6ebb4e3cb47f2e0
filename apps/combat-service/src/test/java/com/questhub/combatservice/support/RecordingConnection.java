package com.questhub.combatservice.support;

import com.questhub.combatservice.platform.transport.CombatConnection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 内存连接：记录收到的事件与断开调用，供会话 / 准入测试断言。
 */
public class RecordingConnection implements CombatConnection {

    public static final String DISCONNECTED = "<disconnected>";

    public record Emitted(String event, Object payload) {
    }

    private final String id;
    private final List<Emitted> emitted = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean open = true;
    private volatile int disconnectCalls;

    public RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void emit(String event, Object payload) {
        if (open) {
            emitted.add(new Emitted(event, payload));
        }
    }

    @Override
    public void disconnect() {
        disconnectCalls++;
        if (open) {
            emitted.add(new Emitted(DISCONNECTED, null));
        }
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public List<String> events() {
        synchronized (emitted) {
            return emitted.stream().map(Emitted::event).collect(Collectors.toList());
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T lastPayload(String event, Class<T> type) {
        synchronized (emitted) {
            for (int i = emitted.size() - 1; i >= 0; i--) {
                if (emitted.get(i).event().equals(event)) {
                    return (T) emitted.get(i).payload();
                }
            }
        }
        throw new AssertionError("no event " + event + " in " + events());
    }

    public boolean wasDisconnected() {
        return disconnectCalls > 0;
    }

    public void clear() {
        emitted.clear();
    }
}
