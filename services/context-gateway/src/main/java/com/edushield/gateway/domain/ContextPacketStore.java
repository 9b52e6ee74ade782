package com.edushield.gateway.domain;

import com.edushield.context.ContextPacket;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded trace id to context packet index. Evicts the eldest packet once full.
 */
public class ContextPacketStore {

    private final int capacity;
    private final Map<String, ContextPacket> packets;

    public ContextPacketStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.packets = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ContextPacket> eldest) {
                return size() > ContextPacketStore.this.capacity;
            }
        };
    }

    public synchronized void put(ContextPacket packet) {
        packets.put(packet.traceId(), packet);
    }

    public synchronized Optional<ContextPacket> find(String traceId) {
        return Optional.ofNullable(packets.get(traceId));
    }

    public synchronized int size() {
        return packets.size();
    }

    public int capacity() {
        return capacity;
    }
}
