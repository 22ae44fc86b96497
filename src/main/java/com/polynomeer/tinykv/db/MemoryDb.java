package com.polynomeer.tinykv.db;

import com.polynomeer.tinykv.resp.RespValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory key space guarded by a single lock.
 * <p>
 * Every operation holds the lock for its whole body, so reads and writes from all
 * connections are serialized; there is no per-key locking and no lock-free read path.
 * Lives as long as the server process; nothing is persisted.
 */
public class MemoryDb implements Db {

    private final Map<Key, RespValue> map = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public RespValue get(Key key) {
        lock.lock();
        try {
            return map.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(Key key, RespValue value) {
        lock.lock();
        try {
            map.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(Key key) {
        lock.lock();
        try {
            // containsKey: a stored null bulk string still counts as present
            if (!map.containsKey(key)) return false;
            map.remove(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int flush() {
        lock.lock();
        try {
            int n = map.size();
            map.clear();
            return n;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<RespValue> mget(List<Key> keys) {
        lock.lock();
        try {
            List<RespValue> out = new ArrayList<>(keys.size());
            for (Key k : keys) {
                out.add(map.get(k));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int mset(List<Map.Entry<Key, RespValue>> pairs) {
        lock.lock();
        try {
            for (Map.Entry<Key, RespValue> p : pairs) {
                map.put(p.getKey(), p.getValue());
            }
            return pairs.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return map.size();
        } finally {
            lock.unlock();
        }
    }
}
