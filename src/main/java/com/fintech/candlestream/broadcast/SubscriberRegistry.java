package com.fintech.candlestream.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Set of currently connected live subscribers, keyed by subscriber id.
 * Safe for concurrent connect, disconnect and iteration.
 */
public class SubscriberRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(SubscriberRegistry.class);
    
    private final Map<String, LiveSubscriber> subscribers = new ConcurrentHashMap<>();
    
    public void add(LiveSubscriber subscriber) {
        subscribers.put(subscriber.id(), subscriber);
        log.info("Live subscriber connected: id={}, subscribers={}", subscriber.id(), subscribers.size());
    }
    
    public void remove(String subscriberId) {
        if (subscribers.remove(subscriberId) != null) {
            log.info("Live subscriber disconnected: id={}, subscribers={}", subscriberId, subscribers.size());
        }
    }
    
    /** Weakly consistent view; subscribers added during iteration may or may not appear. */
    public Collection<LiveSubscriber> snapshot() {
        return Collections.unmodifiableCollection(subscribers.values());
    }
    
    public boolean contains(String subscriberId) {
        return subscribers.containsKey(subscriberId);
    }
    
    public int size() {
        return subscribers.size();
    }
    
    public boolean isEmpty() {
        return subscribers.isEmpty();
    }
}
